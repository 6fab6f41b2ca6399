package sast;

import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * {@code break} or {@code continue}, with an optional target label.
 *
 * <p>The parser records the label name; the resolution pass binds the statement to the enclosing
 * {@link LabeledStmt} exactly once.
 */
public abstract class JumpStmt extends Stmt {
  private final SourceLoc loc;
  private String targetName;
  private SourceLoc targetLoc;
  private Optional<LabeledStmt> target = Optional.empty();

  protected JumpStmt(
      Kind kind, SourceLoc loc, String targetName, SourceLoc targetLoc, boolean implicit) {
    super(kind, implicit);
    Preconditions.checkArgument(kind == Kind.BREAK || kind == Kind.CONTINUE, kind);
    this.loc = Preconditions.checkNotNull(loc);
    this.targetName = Preconditions.checkNotNull(targetName);
    this.targetLoc = Preconditions.checkNotNull(targetLoc);
  }

  public final SourceLoc loc() {
    return loc;
  }

  /** The label written after the keyword; empty if there was none. */
  public final String targetName() {
    return targetName;
  }

  public final boolean hasTargetName() {
    return !targetName.isEmpty();
  }

  public final void setTargetName(String targetName) {
    this.targetName = Preconditions.checkNotNull(targetName);
  }

  public final SourceLoc targetLoc() {
    return targetLoc;
  }

  public final void setTargetLoc(SourceLoc targetLoc) {
    this.targetLoc = Preconditions.checkNotNull(targetLoc);
  }

  public final boolean hasTarget() {
    return target.isPresent();
  }

  /** The loop or switch this statement leaves or continues. Set by the resolution pass. */
  public final LabeledStmt target() {
    Preconditions.checkState(
        target.isPresent(), "%s target is not set until resolution", kindName(kind()));
    return target.get();
  }

  public final void setTarget(LabeledStmt target) {
    Preconditions.checkState(
        !this.target.isPresent(), "%s target already set", kindName(kind()));
    this.target = Optional.of(checkOwned(target));
  }

  @Override
  public final SourceRange sourceRange() {
    return SourceRange.create(loc, targetLoc.isValid() ? targetLoc : loc);
  }
}
