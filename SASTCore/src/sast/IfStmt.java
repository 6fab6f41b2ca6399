package sast;

import java.util.Optional;

import com.google.common.base.Preconditions;

import sast.processor.ASTChild;
import sast.processor.ASTNode;

/**
 * if/then/else. Without an {@code else}, the else location is invalid and there is no else branch.
 */
@ASTNode
public final class IfStmt extends Stmt implements IfStmt_ASTNode {
  private final SourceLoc ifLoc;
  private final SourceLoc elseLoc;
  private StmtCondition cond;
  private Stmt thenStmt;
  private Optional<Stmt> elseStmt;

  private IfStmt(
      SourceLoc ifLoc,
      StmtCondition cond,
      Stmt thenStmt,
      SourceLoc elseLoc,
      Optional<Stmt> elseStmt,
      Optional<Boolean> implicit) {
    super(Kind.IF, defaultImplicitFlag(implicit, ifLoc));
    this.ifLoc = ifLoc;
    this.elseLoc = elseLoc;
    this.cond = cond;
    this.thenStmt = thenStmt;
    this.elseStmt = elseStmt;
  }

  public static IfStmt create(
      ASTContext ctx,
      SourceLoc ifLoc,
      StmtCondition cond,
      Stmt thenStmt,
      SourceLoc elseLoc,
      Optional<Stmt> elseStmt) {
    return create(ctx, ifLoc, cond, thenStmt, elseLoc, elseStmt, Optional.empty());
  }

  public static IfStmt create(
      ASTContext ctx,
      SourceLoc ifLoc,
      StmtCondition cond,
      Stmt thenStmt,
      SourceLoc elseLoc,
      Optional<Stmt> elseStmt,
      boolean implicit) {
    return create(ctx, ifLoc, cond, thenStmt, elseLoc, elseStmt, Optional.of(implicit));
  }

  private static IfStmt create(
      ASTContext ctx,
      SourceLoc ifLoc,
      StmtCondition cond,
      Stmt thenStmt,
      SourceLoc elseLoc,
      Optional<Stmt> elseStmt,
      Optional<Boolean> implicit) {
    ctx.checkOwned(thenStmt);
    elseStmt.ifPresent(ctx::checkOwned);
    return ctx.allocate(
        new IfStmt(
            Preconditions.checkNotNull(ifLoc),
            Preconditions.checkNotNull(cond),
            thenStmt,
            Preconditions.checkNotNull(elseLoc),
            elseStmt,
            implicit));
  }

  public SourceLoc ifLoc() {
    return ifLoc;
  }

  public SourceLoc elseLoc() {
    return elseLoc;
  }

  public StmtCondition cond() {
    return cond;
  }

  public void setCond(StmtCondition cond) {
    this.cond = Preconditions.checkNotNull(cond);
  }

  @ASTChild
  @Override
  public Stmt thenStmt() {
    return thenStmt;
  }

  public void setThenStmt(Stmt thenStmt) {
    this.thenStmt = checkOwned(thenStmt);
  }

  @ASTChild
  @Override
  public Optional<Stmt> elseStmt() {
    return elseStmt;
  }

  public void setElseStmt(Stmt elseStmt) {
    this.elseStmt = Optional.of(checkOwned(elseStmt));
  }

  @Override
  public SourceRange sourceRange() {
    return SourceRange.create(
        ifLoc,
        SourceRange.endOf(
            ifLoc, () -> elseStmt.map(Stmt::endLoc).orElse(null), () -> thenStmt.endLoc()));
  }
}
