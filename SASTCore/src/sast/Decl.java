package sast;

/** A declaration subtree. */
public interface Decl {
  SourceRange sourceRange();

  default SourceLoc startLoc() {
    return sourceRange().start();
  }

  default SourceLoc endLoc() {
    return sourceRange().end();
  }
}
