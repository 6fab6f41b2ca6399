package sast;

import java.util.Optional;

import com.google.common.base.Preconditions;

import sast.processor.ASTChild;
import sast.processor.ASTNode;

/** {@code while} loop. */
@ASTNode
public final class WhileStmt extends LabeledStmt implements WhileStmt_ASTNode {
  private final SourceLoc whileLoc;
  private StmtCondition cond;
  private Stmt body;

  private WhileStmt(
      LabeledStmtInfo labelInfo,
      SourceLoc whileLoc,
      StmtCondition cond,
      Stmt body,
      Optional<Boolean> implicit) {
    super(Kind.WHILE, defaultImplicitFlag(implicit, whileLoc), labelInfo);
    this.whileLoc = whileLoc;
    this.cond = cond;
    this.body = body;
  }

  public static WhileStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc whileLoc,
      StmtCondition cond,
      Stmt body) {
    return create(ctx, labelInfo, whileLoc, cond, body, Optional.empty());
  }

  public static WhileStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc whileLoc,
      StmtCondition cond,
      Stmt body,
      boolean implicit) {
    return create(ctx, labelInfo, whileLoc, cond, body, Optional.of(implicit));
  }

  private static WhileStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc whileLoc,
      StmtCondition cond,
      Stmt body,
      Optional<Boolean> implicit) {
    return ctx.allocate(
        new WhileStmt(
            labelInfo,
            Preconditions.checkNotNull(whileLoc),
            Preconditions.checkNotNull(cond),
            ctx.checkOwned(body),
            implicit));
  }

  public SourceLoc whileLoc() {
    return whileLoc;
  }

  public StmtCondition cond() {
    return cond;
  }

  public void setCond(StmtCondition cond) {
    this.cond = Preconditions.checkNotNull(cond);
  }

  @ASTChild
  @Override
  public Stmt body() {
    return body;
  }

  public void setBody(Stmt body) {
    this.body = checkOwned(body);
  }

  @Override
  public SourceRange sourceRange() {
    return SourceRange.create(
        labelLocOrKeywordLoc(whileLoc),
        SourceRange.endOf(whileLoc, body::endLoc, () -> cond.sourceRange().end()));
  }
}
