package sast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static sast.FakeNodes.brace;
import static sast.FakeNodes.decl;
import static sast.FakeNodes.expr;
import static sast.FakeNodes.loc;
import static sast.FakeNodes.pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class VariableShapeStmtTest {

  private final ASTContext ctx = new ASTContext();

  private CaseStmt caseOf(CaseLabelItem... items) {
    return CaseStmt.create(
        ctx, loc(1, 0), ImmutableList.copyOf(items), false, loc(1, 6), brace(ctx));
  }

  @Test
  public void braceKeepsElementOrder() {
    ReturnStmt ret = ReturnStmt.create(ctx, loc(2, 2), Optional.empty());
    ImmutableList<ASTElement> elements =
        ImmutableList.of(
            ASTElement.of(decl("var x = 10", loc(1, 2))),
            ASTElement.of(expr("print(x)", loc(1, 14))),
            ASTElement.of(ret));

    BraceStmt brace = BraceStmt.create(ctx, loc(0, 0), elements, loc(3, 0));

    assertThat(brace.numElements()).isEqualTo(3);
    assertThat(brace.elements()).containsExactlyElementsIn(elements).inOrder();
    assertThat(brace.element(0).kind()).isEqualTo(ASTElement.Kind.DECL);
    assertThat(brace.element(1).kind()).isEqualTo(ASTElement.Kind.EXPR);
    assertThat(brace.element(2).stmt()).isSameInstanceAs(ret);
    assertThrows(IllegalStateException.class, () -> brace.element(2).expr());
  }

  @Test
  public void braceIsFixedSize() {
    BraceStmt brace =
        BraceStmt.create(
            ctx, loc(0, 0), ImmutableList.of(ASTElement.of(expr("a"))), loc(0, 4));
    List<ASTElement> elements = brace.elements();

    ASTElement b = ASTElement.of(expr("b"));

    assertThrows(UnsupportedOperationException.class, () -> elements.add(b));
    assertThrows(UnsupportedOperationException.class, () -> elements.set(0, b));
    assertThrows(IndexOutOfBoundsException.class, () -> brace.setElement(1, b));

    brace.setElement(0, b);
    assertThat(brace.element(0).expr().toString()).isEqualTo("b");
    assertThat(brace.numElements()).isEqualTo(1);
  }

  @Test
  public void emptyBrace() {
    BraceStmt brace = BraceStmt.create(ctx, loc(0, 0), ImmutableList.of(), loc(0, 1));

    assertThat(brace.numElements()).isEqualTo(0);
    assertThat(brace.elements()).isEmpty();
  }

  @Test
  public void braceCopiesItsInput() {
    List<ASTElement> input = new ArrayList<>();
    input.add(ASTElement.of(expr("a")));
    BraceStmt brace = BraceStmt.create(ctx, loc(0, 0), input, loc(0, 4));

    input.add(ASTElement.of(expr("b")));
    assertThat(brace.numElements()).isEqualTo(1);
  }

  @Test
  public void caseRequiresALabel() {
    assertThrows(IllegalArgumentException.class, () -> caseOf());
  }

  @Test
  public void caseIsDefaultFollowsFirstItem() {
    assertThat(caseOf(CaseLabelItem.defaultLabel(pattern("_"))).isDefault()).isTrue();
    assertThat(caseOf(CaseLabelItem.of(pattern("1"))).isDefault()).isFalse();
    assertThat(
            caseOf(CaseLabelItem.of(pattern("1")), CaseLabelItem.defaultLabel(pattern("_")))
                .isDefault())
        .isFalse();
  }

  @Test
  public void caseLabelItemsAreFixedSize() {
    CaseLabelItem one = CaseLabelItem.of(pattern("1"));
    CaseLabelItem two = CaseLabelItem.guarded(pattern("x"), loc(1, 8), expr("x > 2"));
    CaseStmt caseStmt = caseOf(one, two);

    assertThat(caseStmt.caseLabelItems()).hasSize(2);
    assertThat(caseStmt.caseLabelItems().get(1).guardExpr()).isPresent();
    assertThrows(
        UnsupportedOperationException.class,
        () -> caseStmt.mutableCaseLabelItems().add(CaseLabelItem.of(pattern("3"))));

    caseStmt.mutableCaseLabelItems().get(0).setPattern(pattern("one"));
    assertThat(caseStmt.caseLabelItems().get(0).pattern().toString()).isEqualTo("one");
    // The case stores its own copies.
    assertThat(one.pattern().toString()).isEqualTo("1");
  }

  @Test
  public void replacedLabelItemsAreCheckedAndCopied() {
    CaseStmt caseStmt = caseOf(CaseLabelItem.of(pattern("1")));
    List<CaseLabelItem> items = caseStmt.mutableCaseLabelItems();

    assertThrows(NullPointerException.class, () -> items.set(0, null));
    assertThat(caseStmt.isDefault()).isFalse();

    CaseLabelItem replacement = CaseLabelItem.defaultLabel(pattern("_"));
    CaseLabelItem previous = items.set(0, replacement);

    assertThat(previous.pattern().toString()).isEqualTo("1");
    assertThat(caseStmt.isDefault()).isTrue();
    assertThat(caseStmt.caseLabelItems().get(0)).isNotSameInstanceAs(replacement);

    replacement.setPattern(pattern("changed"));
    assertThat(caseStmt.caseLabelItems().get(0).pattern().toString()).isEqualTo("_");
  }

  @Test
  public void caseBoundDecls() {
    CaseStmt caseStmt =
        CaseStmt.create(
            ctx,
            loc(1, 0),
            ImmutableList.of(CaseLabelItem.of(pattern("let x"))),
            true,
            loc(1, 10),
            brace(ctx));

    assertThat(caseStmt.hasBoundDecls()).isTrue();
  }

  @Test
  public void switchCasesKeepIdentity() {
    CaseStmt first = caseOf(CaseLabelItem.of(pattern("1")));
    CaseStmt second = caseOf(CaseLabelItem.of(pattern("2")));
    CaseStmt third = caseOf(CaseLabelItem.defaultLabel(pattern("_")));

    SwitchStmt switchStmt =
        SwitchStmt.create(
            ctx,
            LabeledStmtInfo.none(),
            loc(0, 0),
            expr("x"),
            loc(0, 9),
            ImmutableList.of(first, second, third),
            loc(3, 0));

    assertThat(switchStmt.cases()).hasSize(3);
    assertThat(switchStmt.cases().get(0)).isSameInstanceAs(first);
    assertThat(switchStmt.cases().get(1)).isSameInstanceAs(second);
    assertThat(switchStmt.cases().get(2)).isSameInstanceAs(third);
    assertThrows(UnsupportedOperationException.class, () -> switchStmt.cases().remove(0));
  }

  @Test
  public void switchWithNoCases() {
    SwitchStmt switchStmt =
        SwitchStmt.create(
            ctx,
            LabeledStmtInfo.none(),
            loc(0, 0),
            expr("x", loc(0, 7)),
            loc(0, 9),
            ImmutableList.of(),
            loc(0, 10));

    assertThat(switchStmt.cases()).isEmpty();
    assertThat(switchStmt.endLoc()).isEqualTo(loc(0, 10));
  }

  @Test
  public void nullElementsAreRejected() {
    List<ASTElement> withNull = new ArrayList<>();
    withNull.add(null);

    assertThrows(
        NullPointerException.class, () -> BraceStmt.create(ctx, loc(0, 0), withNull, loc(0, 1)));
  }
}
