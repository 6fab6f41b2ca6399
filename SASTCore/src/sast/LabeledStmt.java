package sast;

import com.google.common.base.Preconditions;

/**
 * Common base of the statements that can carry a label and be the target of {@code break} or
 * {@code continue}: the loops and {@code switch}.
 */
public abstract class LabeledStmt extends Stmt {
  private LabeledStmtInfo labelInfo;

  protected LabeledStmt(Kind kind, boolean implicit, LabeledStmtInfo labelInfo) {
    super(kind, implicit);
    Preconditions.checkArgument(isLabeledStatement(kind), "%s is not a labeled kind", kind);
    this.labelInfo = Preconditions.checkNotNull(labelInfo);
  }

  /** Checked downcast through the kind range. */
  public static LabeledStmt from(Stmt stmt) {
    Preconditions.checkArgument(
        isLabeledStatement(stmt.kind()), "%s is not a labeled statement", kindName(stmt.kind()));
    return stmt.cast();
  }

  public final LabeledStmtInfo labelInfo() {
    return labelInfo;
  }

  public final void setLabelInfo(LabeledStmtInfo labelInfo) {
    this.labelInfo = Preconditions.checkNotNull(labelInfo);
  }

  /** Whether {@code continue} may target this statement. */
  public final boolean isLoop() {
    return kind() != Kind.SWITCH;
  }

  protected final SourceLoc labelLocOrKeywordLoc(SourceLoc keywordLoc) {
    return labelInfo.isPresent() ? labelInfo.loc() : keywordLoc;
  }
}
