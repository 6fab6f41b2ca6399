package sast;

/** An expression subtree. Statements only store and forward these. */
public interface Expr {
  SourceRange sourceRange();

  default SourceLoc startLoc() {
    return sourceRange().start();
  }

  default SourceLoc endLoc() {
    return sourceRange().end();
  }
}
