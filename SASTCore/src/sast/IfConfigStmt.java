package sast;

import java.util.Optional;

import com.google.common.base.Preconditions;

import sast.processor.ASTChild;
import sast.processor.ASTNode;

/** The statement form of an {@code #if}/{@code #else}/{@code #endif} block. Never implicit. */
@ASTNode
public final class IfConfigStmt extends Stmt implements IfConfigStmt_ASTNode {
  private final boolean ifBlockIsActive;
  private final SourceLoc ifLoc;
  private final SourceLoc elseLoc;
  private final SourceLoc endKeywordLoc;
  private Expr cond;
  private Stmt thenStmt;
  private Optional<Stmt> elseStmt;

  private IfConfigStmt(
      boolean ifBlockIsActive,
      SourceLoc ifLoc,
      Expr cond,
      Stmt thenStmt,
      SourceLoc elseLoc,
      Optional<Stmt> elseStmt,
      SourceLoc endKeywordLoc) {
    super(Kind.IF_CONFIG, false);
    this.ifBlockIsActive = ifBlockIsActive;
    this.ifLoc = ifLoc;
    this.elseLoc = elseLoc;
    this.endKeywordLoc = endKeywordLoc;
    this.cond = cond;
    this.thenStmt = thenStmt;
    this.elseStmt = elseStmt;
  }

  public static IfConfigStmt create(
      ASTContext ctx,
      boolean ifBlockIsActive,
      SourceLoc ifLoc,
      Expr cond,
      Stmt thenStmt,
      SourceLoc elseLoc,
      Optional<Stmt> elseStmt,
      SourceLoc endKeywordLoc) {
    ctx.checkOwned(thenStmt);
    elseStmt.ifPresent(ctx::checkOwned);
    return ctx.allocate(
        new IfConfigStmt(
            ifBlockIsActive,
            Preconditions.checkNotNull(ifLoc),
            Preconditions.checkNotNull(cond),
            thenStmt,
            Preconditions.checkNotNull(elseLoc),
            elseStmt,
            Preconditions.checkNotNull(endKeywordLoc)));
  }

  public SourceLoc ifLoc() {
    return ifLoc;
  }

  public SourceLoc elseLoc() {
    return elseLoc;
  }

  /** Location of {@code #endif}. */
  public SourceLoc endKeywordLoc() {
    return endKeywordLoc;
  }

  public boolean isIfBlockActive() {
    return ifBlockIsActive;
  }

  public boolean hasElse() {
    return elseLoc.isValid();
  }

  public Expr cond() {
    return cond;
  }

  public void setCond(Expr cond) {
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

  /** The branch selected by the condition; empty if it's false and there's no else. */
  public Optional<Stmt> activeStmt() {
    return ifBlockIsActive ? Optional.of(thenStmt) : elseStmt;
  }

  @Override
  public SourceRange sourceRange() {
    return SourceRange.create(ifLoc, endKeywordLoc);
  }
}
