package sast;

import java.util.Optional;

import com.google.common.base.Preconditions;

import sast.processor.ASTNode;

/**
 * {@code return} with an optional result. A bare {@code return} is equivalent to returning the
 * empty tuple.
 */
@ASTNode
public final class ReturnStmt extends Stmt implements ReturnStmt_ASTNode {
  private final SourceLoc returnLoc;
  private Optional<Expr> result;

  private ReturnStmt(SourceLoc returnLoc, Optional<Expr> result, Optional<Boolean> implicit) {
    super(Kind.RETURN, defaultImplicitFlag(implicit, returnLoc));
    this.returnLoc = returnLoc;
    this.result = result;
  }

  public static ReturnStmt create(ASTContext ctx, SourceLoc returnLoc, Optional<Expr> result) {
    return ctx.allocate(
        new ReturnStmt(Preconditions.checkNotNull(returnLoc), result, Optional.empty()));
  }

  public static ReturnStmt create(
      ASTContext ctx, SourceLoc returnLoc, Optional<Expr> result, boolean implicit) {
    return ctx.allocate(
        new ReturnStmt(Preconditions.checkNotNull(returnLoc), result, Optional.of(implicit)));
  }

  public SourceLoc returnLoc() {
    return returnLoc;
  }

  public boolean hasResult() {
    return result.isPresent();
  }

  public Expr result() {
    Preconditions.checkState(result.isPresent(), "ReturnStmt doesn't have a result");
    return result.get();
  }

  public void setResult(Expr result) {
    this.result = Optional.of(result);
  }

  // A synthesized return of a written expression starts at the expression.
  @Override
  public SourceRange sourceRange() {
    SourceLoc start =
        returnLoc.isInvalid() && result.isPresent() ? result.get().startLoc() : returnLoc;
    SourceLoc end = SourceRange.endOf(start, () -> result.map(Expr::endLoc).orElse(null));
    return SourceRange.create(start, end);
  }
}
