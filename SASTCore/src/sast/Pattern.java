package sast;

/** A pattern subtree, as bound by {@code case} labels and {@code for-in} loops. */
public interface Pattern {
  SourceRange sourceRange();

  default SourceLoc startLoc() {
    return sourceRange().start();
  }

  default SourceLoc endLoc() {
    return sourceRange().end();
  }
}
