package sast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static sast.FakeNodes.brace;
import static sast.FakeNodes.cond;
import static sast.FakeNodes.expr;
import static sast.FakeNodes.label;
import static sast.FakeNodes.loc;
import static sast.FakeNodes.pattern;

import java.util.EnumSet;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class StmtTest {

  private final ASTContext ctx = new ASTContext();

  @Test
  public void labeledFamily() {
    EnumSet<Stmt.Kind> labeled = EnumSet.noneOf(Stmt.Kind.class);
    for (Stmt.Kind kind : Stmt.Kind.values()) {
      if (Stmt.isLabeledStatement(kind)) labeled.add(kind);
    }

    assertThat(labeled)
        .containsExactly(
            Stmt.Kind.WHILE,
            Stmt.Kind.DO_WHILE,
            Stmt.Kind.FOR,
            Stmt.Kind.FOR_EACH,
            Stmt.Kind.SWITCH);
    assertThat(Stmt.FIRST_LABELED_STMT).isEqualTo(Stmt.Kind.WHILE);
    assertThat(Stmt.LAST_LABELED_STMT).isEqualTo(Stmt.Kind.SWITCH);
  }

  @Test
  public void kindNames() {
    assertThat(Stmt.kindName(Stmt.Kind.BRACE)).isEqualTo("Brace");
    assertThat(Stmt.kindName(Stmt.Kind.IF_CONFIG)).isEqualTo("IfConfig");
    assertThat(Stmt.kindName(Stmt.Kind.DO_WHILE)).isEqualTo("DoWhile");
    assertThat(Stmt.kindName(Stmt.Kind.FOR_EACH)).isEqualTo("ForEach");
    assertThat(Stmt.kindName(Stmt.Kind.FALLTHROUGH)).isEqualTo("Fallthrough");
  }

  @Test
  public void everyVariantReportsItsKind() {
    BraceStmt body = brace(ctx);
    WhileStmt whileStmt =
        WhileStmt.create(ctx, LabeledStmtInfo.none(), loc(0, 0), cond("c"), body);
    ForEachStmt forEach =
        ForEachStmt.create(
            ctx,
            LabeledStmtInfo.none(),
            loc(1, 0),
            pattern("x"),
            loc(1, 6),
            expr("xs"),
            brace(ctx));

    assertThat(body.kind()).isEqualTo(Stmt.Kind.BRACE);
    assertThat(whileStmt.kind()).isEqualTo(Stmt.Kind.WHILE);
    assertThat(forEach.kind()).isEqualTo(Stmt.Kind.FOR_EACH);
    assertThat(BreakStmt.create(ctx, loc(2, 0)).kind()).isEqualTo(Stmt.Kind.BREAK);
    assertThat(ContinueStmt.create(ctx, loc(2, 0)).kind()).isEqualTo(Stmt.Kind.CONTINUE);
    assertThat(FallthroughStmt.create(ctx, loc(2, 0)).kind()).isEqualTo(Stmt.Kind.FALLTHROUGH);
  }

  @Test
  public void labeledDowncast() {
    WhileStmt whileStmt =
        WhileStmt.create(ctx, label("outer", loc(0, 0)), loc(0, 7), cond("c"), brace(ctx));
    Stmt stmt = whileStmt;

    assertThat(LabeledStmt.from(stmt)).isSameInstanceAs(whileStmt);
    assertThat(LabeledStmt.from(stmt).labelInfo().name()).isEqualTo("outer");
    assertThrows(IllegalArgumentException.class, () -> LabeledStmt.from(brace(ctx)));
  }

  @Test
  public void loopsAndSwitches() {
    SwitchStmt switchStmt =
        SwitchStmt.create(
            ctx,
            LabeledStmtInfo.none(),
            loc(0, 0),
            expr("x"),
            loc(0, 9),
            ImmutableList.of(),
            loc(1, 0));
    WhileStmt whileStmt =
        WhileStmt.create(ctx, LabeledStmtInfo.none(), loc(0, 0), cond("c"), brace(ctx));

    assertThat(switchStmt.isLoop()).isFalse();
    assertThat(whileStmt.isLoop()).isTrue();
  }

  @Test
  public void implicitDefaultsToMissingKeyword() {
    assertThat(ReturnStmt.create(ctx, loc(0, 0), Optional.empty()).isImplicit()).isFalse();
    assertThat(ReturnStmt.create(ctx, SourceLoc.invalid(), Optional.empty()).isImplicit())
        .isTrue();
    assertThat(brace(ctx).isImplicit()).isTrue();
    assertThat(BreakStmt.create(ctx, SourceLoc.invalid()).isImplicit()).isTrue();
  }

  @Test
  public void explicitImplicitFlagWins() {
    assertThat(ReturnStmt.create(ctx, SourceLoc.invalid(), Optional.empty(), false).isImplicit())
        .isFalse();
    assertThat(ReturnStmt.create(ctx, loc(0, 0), Optional.empty(), true).isImplicit()).isTrue();
    assertThat(FallthroughStmt.create(ctx, loc(0, 0), true).isImplicit()).isTrue();
  }

  @Test
  public void ifConfigIsNeverImplicit() {
    IfConfigStmt ifConfig =
        IfConfigStmt.create(
            ctx,
            true,
            SourceLoc.invalid(),
            expr("DEBUG"),
            brace(ctx),
            SourceLoc.invalid(),
            Optional.empty(),
            SourceLoc.invalid());

    assertThat(ifConfig.isImplicit()).isFalse();
  }

  @Test
  public void ifConfigActiveBranch() {
    BraceStmt thenBlock = brace(ctx);
    BraceStmt elseBlock = brace(ctx);
    thenBlock.markAsConfigBlock();
    elseBlock.markAsConfigBlock();
    elseBlock.markAsInactiveConfigBlock();

    IfConfigStmt active =
        IfConfigStmt.create(
            ctx,
            true,
            loc(0, 0),
            expr("DEBUG"),
            thenBlock,
            loc(2, 0),
            Optional.of(elseBlock),
            loc(4, 0));
    IfConfigStmt inactiveNoElse =
        IfConfigStmt.create(
            ctx,
            false,
            loc(5, 0),
            expr("RELEASE"),
            brace(ctx),
            SourceLoc.invalid(),
            Optional.empty(),
            loc(7, 0));

    assertThat(active.hasElse()).isTrue();
    assertThat(active.activeStmt()).hasValue(thenBlock);
    assertThat(inactiveNoElse.activeStmt()).isEmpty();
    assertThat(elseBlock.isConfigBlock()).isTrue();
    assertThat(elseBlock.isInactiveConfigBlock()).isTrue();
    assertThat(thenBlock.isInactiveConfigBlock()).isFalse();
  }

  @Test
  public void returnResult() {
    ReturnStmt bare = ReturnStmt.create(ctx, loc(0, 0), Optional.empty());
    ReturnStmt withResult = ReturnStmt.create(ctx, loc(1, 0), Optional.of(expr("1", loc(1, 7))));

    assertThat(bare.hasResult()).isFalse();
    IllegalStateException ex = assertThrows(IllegalStateException.class, bare::result);
    assertThat(ex).hasMessageThat().contains("doesn't have a result");

    assertThat(withResult.hasResult()).isTrue();
    assertThat(withResult.result().toString()).isEqualTo("1");

    bare.setResult(expr("2"));
    assertThat(bare.hasResult()).isTrue();
  }

  @Test
  public void trailingSemicolon() {
    ReturnStmt ret = ReturnStmt.create(ctx, loc(0, 0), Optional.empty());
    assertThat(ret.trailingSemiLoc().isValid()).isFalse();

    ret.setTrailingSemiLoc(loc(0, 6));
    assertThat(ret.trailingSemiLoc()).isEqualTo(loc(0, 6));
    // Not part of the statement's range.
    assertThat(ret.endLoc()).isEqualTo(loc(0, 0));
  }

  @Test
  public void jumpTargetIsSetOnce() {
    WhileStmt loop =
        WhileStmt.create(ctx, LabeledStmtInfo.none(), loc(0, 0), cond("c"), brace(ctx));
    BreakStmt breakStmt = BreakStmt.create(ctx, loc(1, 2));

    assertThat(breakStmt.hasTarget()).isFalse();
    assertThrows(IllegalStateException.class, breakStmt::target);

    breakStmt.setTarget(loop);
    assertThat(breakStmt.target()).isSameInstanceAs(loop);
    assertThrows(IllegalStateException.class, () -> breakStmt.setTarget(loop));
  }

  @Test
  public void fallthroughDestIsSetOnce() {
    CaseStmt dest =
        CaseStmt.create(
            ctx,
            loc(3, 0),
            ImmutableList.of(CaseLabelItem.of(pattern("2"))),
            false,
            loc(3, 6),
            brace(ctx));
    FallthroughStmt fallthrough = FallthroughStmt.create(ctx, loc(2, 2));

    assertThat(fallthrough.hasFallthroughDest()).isFalse();
    IllegalStateException unset =
        assertThrows(IllegalStateException.class, fallthrough::fallthroughDest);
    assertThat(unset).hasMessageThat().contains("not set until resolution");

    fallthrough.setFallthroughDest(dest);
    assertThat(fallthrough.fallthroughDest()).isSameInstanceAs(dest);

    IllegalStateException twice =
        assertThrows(IllegalStateException.class, () -> fallthrough.setFallthroughDest(dest));
    assertThat(twice).hasMessageThat().contains("already set");
  }

  @Test
  public void forEachGeneratorIsSetOnce() {
    ForEachStmt forEach =
        ForEachStmt.create(
            ctx,
            LabeledStmtInfo.none(),
            loc(0, 0),
            pattern("x"),
            loc(0, 6),
            expr("xs"),
            brace(ctx));

    assertThat(forEach.generator()).isEmpty();
    assertThat(forEach.generatorNext()).isEmpty();

    PatternBindingDecl generator = FakeNodes.binding("$gen", loc(0, 9), loc(0, 11));
    forEach.setGenerator(generator);
    forEach.setGeneratorNext(expr("$gen.next()"));

    assertThat(forEach.generator()).hasValue(generator);
    assertThrows(IllegalStateException.class, () -> forEach.setGenerator(generator));
    assertThrows(IllegalStateException.class, () -> forEach.setGeneratorNext(expr("again")));
  }

  @Test
  public void stmtConditionKinds() {
    PatternBindingDecl binding = FakeNodes.binding("let x = y", loc(0, 3), loc(0, 12));
    StmtCondition bindingCond = StmtCondition.binding(binding);
    StmtCondition exprCond = cond("flag");

    assertThat(bindingCond.kind()).isEqualTo(StmtCondition.Kind.BINDING);
    assertThat(bindingCond.binding()).isSameInstanceAs(binding);
    assertThat(bindingCond.sourceRange()).isEqualTo(SourceRange.create(loc(0, 3), loc(0, 12)));
    assertThrows(IllegalStateException.class, bindingCond::expr);

    assertThat(exprCond.kind()).isEqualTo(StmtCondition.Kind.EXPRESSION);
    assertThrows(IllegalStateException.class, exprCond::binding);
  }
}
