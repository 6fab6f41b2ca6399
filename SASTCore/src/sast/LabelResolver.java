package sast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Binds {@code break}, {@code continue} and {@code fallthrough} statements to their targets.
 *
 * <ul>
 *   <li>An unlabeled {@code break} leaves the innermost loop or switch.
 *   <li>An unlabeled {@code continue} continues the innermost loop; switches are skipped.
 *   <li>A labeled jump targets the innermost enclosing statement with that label.
 *   <li>{@code fallthrough} enters the next case of the innermost switch.
 * </ul>
 *
 * Jumps that can't be bound are reported and left unresolved. Each jump is bound once, so a tree
 * must be resolved at most once.
 */
public class LabelResolver extends ErrorCollectingValidator {

  // Innermost first.
  private final Deque<LabeledStmt> activeStmts = new ArrayDeque<>();
  private final Deque<Optional<CaseStmt>> fallthroughDests = new ArrayDeque<>();

  /** Returns true if every jump under {@code root} was bound. */
  public boolean resolve(Stmt root) {
    root.accept(this, null);
    return !hasErrors();
  }

  private void enter(LabeledStmt stmt) {
    LabeledStmtInfo label = stmt.labelInfo();
    if (label.isPresent() && findLabeled(label.name()).isPresent()) {
      logError(
          label.loc(),
          String.format("label '%s' cannot be reused on an inner statement", label.name()));
    }
    activeStmts.push(stmt);
  }

  private void exit() {
    activeStmts.pop();
  }

  private Optional<LabeledStmt> findLabeled(String name) {
    return activeStmts.stream().filter(s -> s.labelInfo().name().equals(name)).findFirst();
  }

  private static SourceLoc targetErrorLoc(JumpStmt jump) {
    return jump.targetLoc().isValid() ? jump.targetLoc() : jump.loc();
  }

  @Override
  public void visitImpl(WhileStmt node) {
    enter(node);
    super.visitImpl(node);
    exit();
  }

  @Override
  public void visitImpl(DoWhileStmt node) {
    enter(node);
    super.visitImpl(node);
    exit();
  }

  @Override
  public void visitImpl(ForStmt node) {
    enter(node);
    super.visitImpl(node);
    exit();
  }

  @Override
  public void visitImpl(ForEachStmt node) {
    enter(node);
    super.visitImpl(node);
    exit();
  }

  @Override
  public void visitImpl(SwitchStmt node) {
    enter(node);
    List<CaseStmt> cases = node.cases();
    for (int i = 0; i < cases.size(); i++) {
      fallthroughDests.push(
          i + 1 < cases.size() ? Optional.of(cases.get(i + 1)) : Optional.empty());
      cases.get(i).accept(this, null);
      fallthroughDests.pop();
    }
    exit();
  }

  @Override
  public void visitImpl(BreakStmt node) {
    if (node.hasTargetName()) {
      Optional<LabeledStmt> target = findLabeled(node.targetName());
      if (!target.isPresent()) {
        logError(
            targetErrorLoc(node), String.format("use of unresolved label '%s'", node.targetName()));
        return;
      }
      node.setTarget(target.get());
      return;
    }

    if (activeStmts.isEmpty()) {
      logError(node.loc(), "'break' is only allowed inside a loop or switch");
      return;
    }
    node.setTarget(activeStmts.peek());
  }

  @Override
  public void visitImpl(ContinueStmt node) {
    if (node.hasTargetName()) {
      Optional<LabeledStmt> target = findLabeled(node.targetName());
      if (!target.isPresent()) {
        logError(
            targetErrorLoc(node), String.format("use of unresolved label '%s'", node.targetName()));
        return;
      }
      if (!target.get().isLoop()) {
        logError(
            targetErrorLoc(node),
            String.format("label '%s' of 'continue' does not name a loop", node.targetName()));
        return;
      }
      node.setTarget(target.get());
      return;
    }

    Optional<LabeledStmt> loop = activeStmts.stream().filter(LabeledStmt::isLoop).findFirst();
    if (!loop.isPresent()) {
      logError(node.loc(), "'continue' is only allowed inside a loop");
      return;
    }
    node.setTarget(loop.get());
  }

  @Override
  public void visitImpl(FallthroughStmt node) {
    if (fallthroughDests.isEmpty()) {
      logError(node.loc(), "'fallthrough' is only allowed inside a switch");
      return;
    }

    Optional<CaseStmt> dest = fallthroughDests.peek();
    if (!dest.isPresent()) {
      logError(node.loc(), "'fallthrough' without a following 'case' or 'default' block");
      return;
    }
    node.setFallthroughDest(dest.get());
  }
}
