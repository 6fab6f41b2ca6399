package sast;

import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * Base class for all statements.
 *
 * <p>The set of subclasses is closed and identified by {@link #kind()}. Code that needs the
 * concrete type switches on the kind and calls {@link #cast()}; the labeled-statement family is a
 * contiguous range of kinds, tested with {@link #isLabeledStatement(Kind)}.
 *
 * <p>Every statement is created through a static {@code create} factory that registers it with an
 * {@link ASTContext}. Child statements must come from the same context.
 */
public abstract class Stmt implements ASTNodeInterface {
  public enum Kind {
    BRACE("Brace"),
    RETURN("Return"),
    IF("If"),
    IF_CONFIG("IfConfig"),
    WHILE("While"),
    DO_WHILE("DoWhile"),
    FOR("For"),
    FOR_EACH("ForEach"),
    SWITCH("Switch"),
    CASE("Case"),
    BREAK("Break"),
    CONTINUE("Continue"),
    FALLTHROUGH("Fallthrough");

    private final String debugName;

    private Kind(String debugName) {
      this.debugName = debugName;
    }
  }

  /** Bounds of the labeled-statement family; every kind in between is a {@link LabeledStmt}. */
  public static final Kind FIRST_LABELED_STMT = Kind.WHILE;

  public static final Kind LAST_LABELED_STMT = Kind.SWITCH;

  /**
   * Returns the name of the given statement kind.
   *
   * <p>Only for debugging dumps and other developer aids. Never part of a diagnostic.
   */
  public static String kindName(Kind kind) {
    return kind.debugName;
  }

  public static boolean isLabeledStatement(Kind kind) {
    return kind.compareTo(FIRST_LABELED_STMT) >= 0 && kind.compareTo(LAST_LABELED_STMT) <= 0;
  }

  /**
   * The explicit flag if one was given, otherwise whether the statement's keyword location is
   * invalid. Statements without a written keyword were synthesized by the compiler.
   */
  protected static boolean defaultImplicitFlag(Optional<Boolean> implicit, SourceLoc keywordLoc) {
    return implicit.orElse(keywordLoc.isInvalid());
  }

  private final Kind kind;
  private final boolean implicit;
  private SourceLoc trailingSemiLoc = SourceLoc.invalid();
  private ASTContext context = null;

  protected Stmt(Kind kind, boolean implicit) {
    this.kind = kind;
    this.implicit = implicit;
  }

  public final Kind kind() {
    return kind;
  }

  /** Whether this statement was generated by the compiler rather than written in the source. */
  public final boolean isImplicit() {
    return implicit;
  }

  public abstract SourceRange sourceRange();

  public final SourceLoc startLoc() {
    return sourceRange().start();
  }

  public final SourceLoc endLoc() {
    return sourceRange().end();
  }

  public final SourceLoc trailingSemiLoc() {
    return trailingSemiLoc;
  }

  public final void setTrailingSemiLoc(SourceLoc trailingSemiLoc) {
    this.trailingSemiLoc = Preconditions.checkNotNull(trailingSemiLoc);
  }

  /**
   * Walks the tree rooted at this statement.
   *
   * @return the root after any replacement made by {@code walker}, or empty if the walk was
   *     stopped
   */
  public final Optional<Stmt> walk(ASTWalker walker) {
    return new Traversal(walker).doIt(this);
  }

  /** Unchecked downcast; callers establish the type through {@link #kind()} first. */
  @SuppressWarnings("unchecked")
  public final <T extends Stmt> T cast() {
    return (T) this;
  }

  /** An indented s-expression rendering for developers. No stability guarantees. */
  public final String dump() {
    return new StmtPrinter(StmtPrinter.Options.defaults()).print(this);
  }

  final ASTContext context() {
    return context;
  }

  final void setContext(ASTContext context) {
    this.context = context;
  }

  /** Checks that a statement about to be stored in this one shares its context. */
  protected final <T extends Stmt> T checkOwned(T child) {
    Preconditions.checkState(context != null, "statement was not created through an ASTContext");
    return context.checkOwned(child);
  }

  @Override
  public String toString() {
    return kindName(kind) + "Stmt" + sourceRange();
  }
}
