package sast;

import java.util.Optional;

import sast.processor.ASTNode;

/** {@code continue} and {@code continue label}. Only loops can be continued. */
@ASTNode
public final class ContinueStmt extends JumpStmt implements ContinueStmt_ASTNode {
  private ContinueStmt(
      SourceLoc loc, String targetName, SourceLoc targetLoc, Optional<Boolean> implicit) {
    super(Kind.CONTINUE, loc, targetName, targetLoc, defaultImplicitFlag(implicit, loc));
  }

  public static ContinueStmt create(
      ASTContext ctx, SourceLoc loc, String targetName, SourceLoc targetLoc) {
    return ctx.allocate(new ContinueStmt(loc, targetName, targetLoc, Optional.empty()));
  }

  public static ContinueStmt create(
      ASTContext ctx, SourceLoc loc, String targetName, SourceLoc targetLoc, boolean implicit) {
    return ctx.allocate(new ContinueStmt(loc, targetName, targetLoc, Optional.of(implicit)));
  }

  /** An unlabeled {@code continue}. */
  public static ContinueStmt create(ASTContext ctx, SourceLoc loc) {
    return create(ctx, loc, "", SourceLoc.invalid());
  }
}
