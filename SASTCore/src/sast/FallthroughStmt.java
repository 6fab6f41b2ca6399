package sast;

import java.util.Optional;

import com.google.common.base.Preconditions;

import sast.processor.ASTNode;

/** {@code fallthrough}: transfers control into the next case of the enclosing switch. */
@ASTNode
public final class FallthroughStmt extends Stmt implements FallthroughStmt_ASTNode {
  private final SourceLoc loc;
  private Optional<CaseStmt> fallthroughDest = Optional.empty();

  private FallthroughStmt(SourceLoc loc, Optional<Boolean> implicit) {
    super(Kind.FALLTHROUGH, defaultImplicitFlag(implicit, loc));
    this.loc = loc;
  }

  public static FallthroughStmt create(ASTContext ctx, SourceLoc loc) {
    return ctx.allocate(new FallthroughStmt(Preconditions.checkNotNull(loc), Optional.empty()));
  }

  public static FallthroughStmt create(ASTContext ctx, SourceLoc loc, boolean implicit) {
    return ctx.allocate(
        new FallthroughStmt(Preconditions.checkNotNull(loc), Optional.of(implicit)));
  }

  public SourceLoc loc() {
    return loc;
  }

  public boolean hasFallthroughDest() {
    return fallthroughDest.isPresent();
  }

  /** The case that control transfers to. Set during resolution. */
  public CaseStmt fallthroughDest() {
    Preconditions.checkState(
        fallthroughDest.isPresent(), "fallthrough dest is not set until resolution");
    return fallthroughDest.get();
  }

  public void setFallthroughDest(CaseStmt dest) {
    Preconditions.checkState(!fallthroughDest.isPresent(), "fallthrough dest already set");
    fallthroughDest = Optional.of(checkOwned(dest));
  }

  @Override
  public SourceRange sourceRange() {
    return SourceRange.of(loc);
  }
}
