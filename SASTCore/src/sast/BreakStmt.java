package sast;

import java.util.Optional;

import sast.processor.ASTNode;

/** {@code break} and {@code break label}. */
@ASTNode
public final class BreakStmt extends JumpStmt implements BreakStmt_ASTNode {
  private BreakStmt(
      SourceLoc loc, String targetName, SourceLoc targetLoc, Optional<Boolean> implicit) {
    super(Kind.BREAK, loc, targetName, targetLoc, defaultImplicitFlag(implicit, loc));
  }

  public static BreakStmt create(
      ASTContext ctx, SourceLoc loc, String targetName, SourceLoc targetLoc) {
    return ctx.allocate(new BreakStmt(loc, targetName, targetLoc, Optional.empty()));
  }

  public static BreakStmt create(
      ASTContext ctx, SourceLoc loc, String targetName, SourceLoc targetLoc, boolean implicit) {
    return ctx.allocate(new BreakStmt(loc, targetName, targetLoc, Optional.of(implicit)));
  }

  /** An unlabeled {@code break}. */
  public static BreakStmt create(ASTContext ctx, SourceLoc loc) {
    return create(ctx, loc, "", SourceLoc.invalid());
  }
}
