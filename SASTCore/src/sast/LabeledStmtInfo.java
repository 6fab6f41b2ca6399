package sast;

import com.google.auto.value.AutoValue;

/** The optional {@code name:} label in front of a loop or switch. */
@AutoValue
public abstract class LabeledStmtInfo {
  private static final LabeledStmtInfo NONE = create("", SourceLoc.invalid());

  /** The label name; empty when there's no label. */
  public abstract String name();

  public abstract SourceLoc loc();

  public static LabeledStmtInfo create(String name, SourceLoc loc) {
    return new AutoValue_LabeledStmtInfo(name, loc);
  }

  public static LabeledStmtInfo none() {
    return NONE;
  }

  public boolean isPresent() {
    return !name().isEmpty();
  }
}
