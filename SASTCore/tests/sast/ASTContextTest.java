package sast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static sast.FakeNodes.brace;
import static sast.FakeNodes.cond;
import static sast.FakeNodes.expr;
import static sast.FakeNodes.loc;
import static sast.FakeNodes.pattern;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ASTContextTest {

  private final ASTContext ctx = new ASTContext();
  private final ASTContext other = new ASTContext();

  @Test
  public void recordsAllocations() {
    ReturnStmt ret = ReturnStmt.create(ctx, loc(0, 0), Optional.empty());
    BraceStmt brace = brace(ctx, ret);

    assertThat(ctx.owns(ret)).isTrue();
    assertThat(ctx.owns(brace)).isTrue();
    assertThat(other.owns(ret)).isFalse();
    assertThat(ctx.statements()).containsExactly(ret, brace).inOrder();
    assertThat(ctx.numStatements()).isEqualTo(2);
  }

  @Test
  public void countsTrailingSlots() {
    CaseStmt caseStmt =
        CaseStmt.create(
            ctx,
            loc(1, 0),
            ImmutableList.of(CaseLabelItem.of(pattern("1")), CaseLabelItem.of(pattern("2"))),
            false,
            loc(1, 9),
            brace(ctx, ReturnStmt.create(ctx, loc(1, 11), Optional.empty())));
    SwitchStmt.create(
        ctx,
        LabeledStmtInfo.none(),
        loc(0, 0),
        expr("x"),
        loc(0, 9),
        ImmutableList.of(caseStmt),
        loc(2, 0));

    // One brace element, two label items, one case.
    assertThat(ctx.numTrailingSlots()).isEqualTo(4);
  }

  @Test
  public void statementIsAllocatedOnce() {
    ReturnStmt ret = ReturnStmt.create(ctx, loc(0, 0), Optional.empty());

    assertThrows(IllegalStateException.class, () -> ctx.allocate(ret));
    assertThrows(IllegalStateException.class, () -> other.allocate(ret));
  }

  @Test
  public void rejectsChildrenFromAnotherContext() {
    ReturnStmt foreign = ReturnStmt.create(other, loc(0, 0), Optional.empty());

    assertThrows(IllegalArgumentException.class, () -> brace(ctx, foreign));
    assertThrows(
        IllegalArgumentException.class,
        () -> WhileStmt.create(ctx, LabeledStmtInfo.none(), loc(0, 0), cond("c"), foreign));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            IfStmt.create(
                ctx, loc(0, 0), cond("c"), brace(ctx), loc(1, 0), Optional.of(foreign)));
  }

  @Test
  public void rejectsForeignReplacement() {
    IfStmt ifStmt =
        IfStmt.create(ctx, loc(0, 0), cond("c"), brace(ctx), SourceLoc.invalid(), Optional.empty());
    BraceStmt foreign = brace(other);

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> ifStmt.setThenStmt(foreign));
    assertThat(ex).hasMessageThat().contains("different ASTContext");
  }

  @Test
  public void rejectsForeignJumpTarget() {
    WhileStmt foreignLoop =
        WhileStmt.create(other, LabeledStmtInfo.none(), loc(0, 0), cond("c"), brace(other));
    BreakStmt breakStmt = BreakStmt.create(ctx, loc(1, 0));

    assertThrows(IllegalArgumentException.class, () -> breakStmt.setTarget(foreignLoop));
    assertThat(breakStmt.hasTarget()).isFalse();
  }
}
