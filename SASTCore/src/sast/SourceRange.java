package sast;

import java.util.function.Supplier;

import com.google.auto.value.AutoValue;

/** A pair of source locations. Either end may be invalid for synthesized nodes. */
@AutoValue
public abstract class SourceRange {
  private static final SourceRange INVALID = create(SourceLoc.invalid(), SourceLoc.invalid());

  public abstract SourceLoc start();

  public abstract SourceLoc end();

  public static SourceRange create(SourceLoc start, SourceLoc end) {
    return new AutoValue_SourceRange(start, end);
  }

  public static SourceRange of(SourceLoc loc) {
    return create(loc, loc);
  }

  public static SourceRange invalid() {
    return INVALID;
  }

  /**
   * Whether the range has a valid start. The end may still be invalid for a node whose trailing
   * parts were synthesized.
   */
  public boolean isValid() {
    return start().isValid();
  }

  public boolean isInvalid() {
    return !isValid();
  }

  /**
   * Returns the first valid end among {@code candidates}, tried in order, or {@code fallback} if
   * none has one. Callers list the trailing sub-nodes last-to-first, so a missing or synthesized
   * tail falls back to the last present sub-node and finally to the keyword location.
   */
  @SafeVarargs
  public static SourceLoc endOf(SourceLoc fallback, Supplier<SourceLoc>... candidates) {
    for (Supplier<SourceLoc> candidate : candidates) {
      SourceLoc end = candidate.get();
      if (end != null && end.isValid()) return end;
    }
    return fallback;
  }

  @Override
  public final String toString() {
    return "[" + start() + " - " + end() + "]";
  }
}
