package sast;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.google.common.collect.ImmutableList;

/** A visitor pass that records user-facing problems instead of throwing them. */
public abstract class ErrorCollectingValidator extends VoidDefaultASTVisitor {
  private final List<DiagnosticException> errors = new ArrayList<>();

  /** Errors in the order they were found. */
  public ImmutableList<DiagnosticException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(SourceLoc loc, String msg) {
    logError(new DiagnosticException(loc, msg));
  }

  protected void logError(DiagnosticException ex) {
    errors.add(ex);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public void printErrors(PrintStream out) {
    errors
        .stream()
        .sorted(Comparator.comparing(DiagnosticException::loc))
        .forEach(ex -> ex.print(out));
  }
}
