package sast;

import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * Callbacks for {@link Stmt#walk}, a depth-first walk that may replace nodes or stop early.
 *
 * <p>Each {@code walkTo*Pre} callback runs before a node's children and decides, through its
 * {@link Action}, whether to descend, skip the children, or stop the whole walk; the node carried
 * by the action replaces the visited one. Each {@code walkTo*Post} callback runs after the children
 * of a node that was descended into, and returns the node to store or empty to stop. Expressions,
 * patterns and declarations are opaque here: they get callbacks but have no children.
 *
 * <p>Walks are synchronous and not reentrant.
 */
public abstract class ASTWalker {

  public static final class Action<T> {
    private enum Kind {
      PROCEED,
      SKIP_CHILDREN,
      STOP;
    }

    private static final Action<?> STOP = new Action<>(Kind.STOP, Optional.empty());

    private final Kind kind;
    private final Optional<T> node;

    private Action(Kind kind, Optional<T> node) {
      this.kind = kind;
      this.node = node;
    }

    /** Visit the children of {@code node}. */
    public static <T> Action<T> proceed(T node) {
      return new Action<>(Kind.PROCEED, Optional.of(node));
    }

    /** Keep {@code node} but don't visit its children or call the post callback. */
    public static <T> Action<T> skipChildren(T node) {
      return new Action<>(Kind.SKIP_CHILDREN, Optional.of(node));
    }

    /** Abandon the walk. */
    @SuppressWarnings("unchecked")
    public static <T> Action<T> stop() {
      return (Action<T>) STOP;
    }

    public boolean isStop() {
      return kind == Kind.STOP;
    }

    public boolean shouldDescend() {
      return kind == Kind.PROCEED;
    }

    public T node() {
      Preconditions.checkState(!isStop(), "a stop action carries no node");
      return node.get();
    }
  }

  public Action<Stmt> walkToStmtPre(Stmt stmt) {
    return Action.proceed(stmt);
  }

  public Optional<Stmt> walkToStmtPost(Stmt stmt) {
    return Optional.of(stmt);
  }

  public Action<Expr> walkToExprPre(Expr expr) {
    return Action.proceed(expr);
  }

  public Optional<Expr> walkToExprPost(Expr expr) {
    return Optional.of(expr);
  }

  public Action<Pattern> walkToPatternPre(Pattern pattern) {
    return Action.proceed(pattern);
  }

  public Optional<Pattern> walkToPatternPost(Pattern pattern) {
    return Optional.of(pattern);
  }

  public Action<Decl> walkToDeclPre(Decl decl) {
    return Action.proceed(decl);
  }

  public Optional<Decl> walkToDeclPost(Decl decl) {
    return Optional.of(decl);
  }
}
