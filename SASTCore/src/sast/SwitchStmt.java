package sast;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;

import sast.processor.ASTChild;
import sast.processor.ASTNode;

/** {@code switch subject { case ... }}. The cases are fixed at creation. */
@ASTNode
public final class SwitchStmt extends LabeledStmt implements SwitchStmt_ASTNode {
  private final SourceLoc switchLoc;
  private final SourceLoc lbLoc;
  private final SourceLoc rbLoc;
  private final TrailingArray<CaseStmt> cases;
  private Expr subjectExpr;

  private SwitchStmt(
      LabeledStmtInfo labelInfo,
      SourceLoc switchLoc,
      Expr subjectExpr,
      SourceLoc lbLoc,
      TrailingArray<CaseStmt> cases,
      SourceLoc rbLoc,
      Optional<Boolean> implicit) {
    super(Kind.SWITCH, defaultImplicitFlag(implicit, switchLoc), labelInfo);
    this.switchLoc = switchLoc;
    this.lbLoc = lbLoc;
    this.rbLoc = rbLoc;
    this.cases = cases;
    this.subjectExpr = subjectExpr;
  }

  public static SwitchStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc switchLoc,
      Expr subjectExpr,
      SourceLoc lbLoc,
      List<CaseStmt> cases,
      SourceLoc rbLoc) {
    return create(ctx, labelInfo, switchLoc, subjectExpr, lbLoc, cases, rbLoc, Optional.empty());
  }

  public static SwitchStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc switchLoc,
      Expr subjectExpr,
      SourceLoc lbLoc,
      List<CaseStmt> cases,
      SourceLoc rbLoc,
      boolean implicit) {
    return create(
        ctx, labelInfo, switchLoc, subjectExpr, lbLoc, cases, rbLoc, Optional.of(implicit));
  }

  private static SwitchStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc switchLoc,
      Expr subjectExpr,
      SourceLoc lbLoc,
      List<CaseStmt> cases,
      SourceLoc rbLoc,
      Optional<Boolean> implicit) {
    cases.forEach(ctx::checkOwned);
    return ctx.allocate(
        new SwitchStmt(
            labelInfo,
            Preconditions.checkNotNull(switchLoc),
            Preconditions.checkNotNull(subjectExpr),
            Preconditions.checkNotNull(lbLoc),
            ctx.allocateTrailing(cases),
            Preconditions.checkNotNull(rbLoc),
            implicit));
  }

  public SourceLoc switchLoc() {
    return switchLoc;
  }

  public SourceLoc lbraceLoc() {
    return lbLoc;
  }

  public SourceLoc rbraceLoc() {
    return rbLoc;
  }

  public Expr subjectExpr() {
    return subjectExpr;
  }

  public void setSubjectExpr(Expr subjectExpr) {
    this.subjectExpr = Preconditions.checkNotNull(subjectExpr);
  }

  /** The case clauses in source order. */
  @ASTChild
  @Override
  public List<CaseStmt> cases() {
    return cases.asList();
  }

  @Override
  public SourceRange sourceRange() {
    return SourceRange.create(
        switchLoc,
        SourceRange.endOf(
            switchLoc,
            () -> rbLoc,
            () -> cases.isEmpty() ? null : cases.get(cases.size() - 1).endLoc(),
            subjectExpr::endLoc));
  }
}
