package sast;

import java.io.PrintStream;

/** A user-facing problem found by a pass over the tree. */
public class DiagnosticException extends Exception {
  private static final long serialVersionUID = 1L;

  private final SourceLoc loc;
  private final String errorMsg;

  public DiagnosticException(SourceLoc loc, String errorMsg) {
    super(errorMsg);
    this.loc = loc;
    this.errorMsg = errorMsg;
  }

  public SourceLoc loc() {
    return loc;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public void print(PrintStream out) {
    if (loc.isInvalid()) {
      out.println(String.format("ERROR: <unknown> %s", errorMsg));
    } else {
      out.println(
          String.format(
              "ERROR: %s@%d:%d %s", loc.file(), loc.line() + 1, loc.column() + 1, errorMsg));
    }
  }
}
