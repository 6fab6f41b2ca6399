package sast;

import java.util.Optional;

import com.google.common.base.Preconditions;

import sast.processor.ASTChild;
import sast.processor.ASTNode;

/** {@code do { ... } while cond}. The body runs before the condition is first tested. */
@ASTNode
public final class DoWhileStmt extends LabeledStmt implements DoWhileStmt_ASTNode {
  private final SourceLoc doLoc;
  private final SourceLoc whileLoc;
  private Stmt body;
  private Expr cond;

  private DoWhileStmt(
      LabeledStmtInfo labelInfo,
      SourceLoc doLoc,
      Expr cond,
      SourceLoc whileLoc,
      Stmt body,
      Optional<Boolean> implicit) {
    super(Kind.DO_WHILE, defaultImplicitFlag(implicit, doLoc), labelInfo);
    this.doLoc = doLoc;
    this.whileLoc = whileLoc;
    this.body = body;
    this.cond = cond;
  }

  public static DoWhileStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc doLoc,
      Expr cond,
      SourceLoc whileLoc,
      Stmt body) {
    return create(ctx, labelInfo, doLoc, cond, whileLoc, body, Optional.empty());
  }

  public static DoWhileStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc doLoc,
      Expr cond,
      SourceLoc whileLoc,
      Stmt body,
      boolean implicit) {
    return create(ctx, labelInfo, doLoc, cond, whileLoc, body, Optional.of(implicit));
  }

  private static DoWhileStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc doLoc,
      Expr cond,
      SourceLoc whileLoc,
      Stmt body,
      Optional<Boolean> implicit) {
    return ctx.allocate(
        new DoWhileStmt(
            labelInfo,
            Preconditions.checkNotNull(doLoc),
            Preconditions.checkNotNull(cond),
            Preconditions.checkNotNull(whileLoc),
            ctx.checkOwned(body),
            implicit));
  }

  public SourceLoc doLoc() {
    return doLoc;
  }

  public SourceLoc whileLoc() {
    return whileLoc;
  }

  @ASTChild
  @Override
  public Stmt body() {
    return body;
  }

  public void setBody(Stmt body) {
    this.body = checkOwned(body);
  }

  public Expr cond() {
    return cond;
  }

  public void setCond(Expr cond) {
    this.cond = Preconditions.checkNotNull(cond);
  }

  @Override
  public SourceRange sourceRange() {
    return SourceRange.create(
        labelLocOrKeywordLoc(doLoc),
        SourceRange.endOf(doLoc, cond::endLoc, () -> whileLoc, body::endLoc));
  }
}
