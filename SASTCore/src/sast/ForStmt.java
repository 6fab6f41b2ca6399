package sast;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import sast.processor.ASTChild;
import sast.processor.ASTNode;

/**
 * C-style {@code for init; cond; increment { ... }}. The initializer, condition and increment are
 * all optional; a missing condition is always true.
 */
@ASTNode
public final class ForStmt extends LabeledStmt implements ForStmt_ASTNode {
  private final SourceLoc forLoc;
  private final SourceLoc semi1Loc;
  private final SourceLoc semi2Loc;
  private Optional<Expr> initializer;
  private ImmutableList<Decl> initializerVarDecls;
  private Optional<Expr> cond;
  private Optional<Expr> increment;
  private Stmt body;

  private ForStmt(
      LabeledStmtInfo labelInfo,
      SourceLoc forLoc,
      Optional<Expr> initializer,
      List<Decl> initializerVarDecls,
      SourceLoc semi1Loc,
      Optional<Expr> cond,
      SourceLoc semi2Loc,
      Optional<Expr> increment,
      Stmt body,
      Optional<Boolean> implicit) {
    super(Kind.FOR, defaultImplicitFlag(implicit, forLoc), labelInfo);
    this.forLoc = forLoc;
    this.semi1Loc = semi1Loc;
    this.semi2Loc = semi2Loc;
    this.initializer = initializer;
    this.initializerVarDecls = ImmutableList.copyOf(initializerVarDecls);
    this.cond = cond;
    this.increment = increment;
    this.body = body;
  }

  public static ForStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc forLoc,
      Optional<Expr> initializer,
      List<Decl> initializerVarDecls,
      SourceLoc semi1Loc,
      Optional<Expr> cond,
      SourceLoc semi2Loc,
      Optional<Expr> increment,
      Stmt body) {
    return create(
        ctx,
        labelInfo,
        forLoc,
        initializer,
        initializerVarDecls,
        semi1Loc,
        cond,
        semi2Loc,
        increment,
        body,
        Optional.empty());
  }

  public static ForStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc forLoc,
      Optional<Expr> initializer,
      List<Decl> initializerVarDecls,
      SourceLoc semi1Loc,
      Optional<Expr> cond,
      SourceLoc semi2Loc,
      Optional<Expr> increment,
      Stmt body,
      boolean implicit) {
    return create(
        ctx,
        labelInfo,
        forLoc,
        initializer,
        initializerVarDecls,
        semi1Loc,
        cond,
        semi2Loc,
        increment,
        body,
        Optional.of(implicit));
  }

  private static ForStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc forLoc,
      Optional<Expr> initializer,
      List<Decl> initializerVarDecls,
      SourceLoc semi1Loc,
      Optional<Expr> cond,
      SourceLoc semi2Loc,
      Optional<Expr> increment,
      Stmt body,
      Optional<Boolean> implicit) {
    return ctx.allocate(
        new ForStmt(
            labelInfo,
            Preconditions.checkNotNull(forLoc),
            initializer,
            initializerVarDecls,
            Preconditions.checkNotNull(semi1Loc),
            cond,
            Preconditions.checkNotNull(semi2Loc),
            increment,
            ctx.checkOwned(body),
            implicit));
  }

  public SourceLoc forLoc() {
    return forLoc;
  }

  public SourceLoc firstSemicolonLoc() {
    return semi1Loc;
  }

  public SourceLoc secondSemicolonLoc() {
    return semi2Loc;
  }

  public Optional<Expr> initializer() {
    return initializer;
  }

  public void setInitializer(Expr initializer) {
    this.initializer = Optional.of(initializer);
  }

  /** Variables declared by the initializer clause, e.g. {@code var i = 0}. */
  public ImmutableList<Decl> initializerVarDecls() {
    return initializerVarDecls;
  }

  public void setInitializerVarDecls(List<Decl> initializerVarDecls) {
    this.initializerVarDecls = ImmutableList.copyOf(initializerVarDecls);
  }

  public Optional<Expr> cond() {
    return cond;
  }

  public void setCond(Optional<Expr> cond) {
    this.cond = Preconditions.checkNotNull(cond);
  }

  public Optional<Expr> increment() {
    return increment;
  }

  public void setIncrement(Expr increment) {
    this.increment = Optional.of(increment);
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
        forLoc,
        SourceRange.endOf(
            forLoc,
            body::endLoc,
            () -> increment.map(Expr::endLoc).orElse(null),
            () -> cond.map(Expr::endLoc).orElse(null),
            () -> initializer.map(Expr::endLoc).orElse(null)));
  }
}
