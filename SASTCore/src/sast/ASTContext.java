package sast;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Owns every statement of one compilation unit. Nodes are registered once, never released
 * individually, and are dropped together with the context.
 *
 * <p>Not thread-safe: a single pass builds a subtree at a time.
 */
public final class ASTContext {
  private final List<Stmt> statements = new ArrayList<>();
  private int numTrailingSlots = 0;

  public ASTContext() {}

  /** Registers {@code stmt} as owned by this context. */
  <T extends Stmt> T allocate(T stmt) {
    Preconditions.checkNotNull(stmt);
    Preconditions.checkState(
        stmt.context() == null, "%s statement is already owned", Stmt.kindName(stmt.kind()));
    stmt.setContext(this);
    statements.add(stmt);
    return stmt;
  }

  /** Allocates the trailing payload of a variable-shape node, sized to {@code elements}. */
  <E> TrailingArray<E> allocateTrailing(List<? extends E> elements) {
    TrailingArray<E> trailing = TrailingArray.copyOf(elements);
    numTrailingSlots += trailing.size();
    return trailing;
  }

  /** Fails fast unless {@code stmt} was allocated by this context. */
  <T extends Stmt> T checkOwned(T stmt) {
    Preconditions.checkNotNull(stmt);
    Preconditions.checkArgument(
        owns(stmt), "%s statement belongs to a different ASTContext", Stmt.kindName(stmt.kind()));
    return stmt;
  }

  public boolean owns(Stmt stmt) {
    return stmt.context() == this;
  }

  public int numStatements() {
    return statements.size();
  }

  public int numTrailingSlots() {
    return numTrailingSlots;
  }

  /** All statements in allocation order. */
  public ImmutableList<Stmt> statements() {
    return ImmutableList.copyOf(statements);
  }
}
