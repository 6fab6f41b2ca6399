package sast;

import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * A pattern with an optional {@code where} guard, one per comma-separated label of a {@code case}.
 *
 * <p>A {@code default} label is an item with {@link #isDefault()} set. A guarded default is not
 * rejected here; that's left to semantic analysis.
 */
public final class CaseLabelItem {
  private final boolean isDefault;
  private final SourceLoc whereLoc;
  private Pattern pattern;
  private Optional<Expr> guardExpr;

  private CaseLabelItem(
      boolean isDefault, Pattern pattern, SourceLoc whereLoc, Optional<Expr> guardExpr) {
    this.isDefault = isDefault;
    this.pattern = Preconditions.checkNotNull(pattern);
    this.whereLoc = Preconditions.checkNotNull(whereLoc);
    this.guardExpr = Preconditions.checkNotNull(guardExpr);
  }

  public static CaseLabelItem create(
      boolean isDefault, Pattern pattern, SourceLoc whereLoc, Optional<Expr> guardExpr) {
    return new CaseLabelItem(isDefault, pattern, whereLoc, guardExpr);
  }

  /** {@code case pattern:} */
  public static CaseLabelItem of(Pattern pattern) {
    return new CaseLabelItem(false, pattern, SourceLoc.invalid(), Optional.empty());
  }

  /** {@code case pattern where guard:} */
  public static CaseLabelItem guarded(Pattern pattern, SourceLoc whereLoc, Expr guardExpr) {
    return new CaseLabelItem(false, pattern, whereLoc, Optional.of(guardExpr));
  }

  /** {@code default:}, matching with the given (usually implicit) catch-all pattern. */
  public static CaseLabelItem defaultLabel(Pattern pattern) {
    return new CaseLabelItem(true, pattern, SourceLoc.invalid(), Optional.empty());
  }

  /** Copies of items are what a {@link CaseStmt} stores. */
  CaseLabelItem copy() {
    return new CaseLabelItem(isDefault, pattern, whereLoc, guardExpr);
  }

  public boolean isDefault() {
    return isDefault;
  }

  public SourceLoc whereLoc() {
    return whereLoc;
  }

  public Pattern pattern() {
    return pattern;
  }

  public void setPattern(Pattern pattern) {
    this.pattern = Preconditions.checkNotNull(pattern);
  }

  public Optional<Expr> guardExpr() {
    return guardExpr;
  }

  public void setGuardExpr(Expr guardExpr) {
    this.guardExpr = Optional.of(guardExpr);
  }

  public SourceRange sourceRange() {
    if (guardExpr.isPresent()) {
      return SourceRange.create(pattern.startLoc(), guardExpr.get().endLoc());
    }
    return pattern.sourceRange();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(isDefault ? "default" : "case");
    sb.append(' ').append(pattern);
    guardExpr.ifPresent(g -> sb.append(" where ").append(g));
    return sb.toString();
  }
}
