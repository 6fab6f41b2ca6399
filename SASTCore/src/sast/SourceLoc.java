package sast;

import java.util.Comparator;
import java.util.Objects;

import com.google.common.base.Preconditions;

/** A position in a source buffer. The invalid location marks synthesized nodes. */
public final class SourceLoc implements Comparable<SourceLoc> {
  private static final SourceLoc INVALID = new SourceLoc("<invalid>", -1, -1);

  private static final Comparator<SourceLoc> ORDER =
      Comparator.comparing(SourceLoc::file)
          .thenComparingInt(SourceLoc::line)
          .thenComparingInt(SourceLoc::column);

  public static SourceLoc invalid() {
    return INVALID;
  }

  /** A valid location; use {@link #invalid()} for synthesized nodes. */
  public static SourceLoc of(String file, int line, int column) {
    Preconditions.checkNotNull(file);
    Preconditions.checkArgument(line >= 0 && column >= 0, "negative position %s:%s", line, column);
    return new SourceLoc(file, line, column);
  }

  private final String file;
  private final int line;
  private final int column;

  private SourceLoc(String file, int line, int column) {
    this.file = file;
    this.line = line;
    this.column = column;
  }

  public String file() {
    return file;
  }

  /** Zero-based. */
  public int line() {
    return line;
  }

  /** Zero-based. */
  public int column() {
    return column;
  }

  public boolean isValid() {
    return this != INVALID;
  }

  public boolean isInvalid() {
    return this == INVALID;
  }

  public SourceLoc addColumns(int columns) {
    if (isInvalid()) return this;
    return of(file, line, column + columns);
  }

  @Override
  public int compareTo(SourceLoc loc) {
    return ORDER.compare(this, loc);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof SourceLoc)) return false;

    SourceLoc other = (SourceLoc) obj;
    return file.equals(other.file) && line == other.line && column == other.column;
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line, column);
  }

  @Override
  public String toString() {
    if (isInvalid()) return "<invalid loc>";
    return String.format("%s:%d:%d", file, line + 1, column + 1);
  }
}
