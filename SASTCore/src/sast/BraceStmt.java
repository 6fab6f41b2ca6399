package sast;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;

import sast.processor.ASTChild;
import sast.processor.ASTNode;

/**
 * A brace-enclosed sequence of statements, expressions and declarations, like {@code { var x = 10;
 * print(x) }}. The element count is fixed at creation; elements may be replaced in place.
 */
@ASTNode
public final class BraceStmt extends Stmt implements BraceStmt_ASTNode {
  private final SourceLoc lbLoc;
  private final TrailingArray<ASTElement> elements;
  private final SourceLoc rbLoc;

  private boolean isConfigBlock = false;
  private boolean isInactiveConfigBlock = false;

  private BraceStmt(
      SourceLoc lbLoc,
      TrailingArray<ASTElement> elements,
      SourceLoc rbLoc,
      Optional<Boolean> implicit) {
    super(Kind.BRACE, defaultImplicitFlag(implicit, lbLoc));
    this.lbLoc = lbLoc;
    this.elements = elements;
    this.rbLoc = rbLoc;
  }

  public static BraceStmt create(
      ASTContext ctx, SourceLoc lbLoc, List<ASTElement> elements, SourceLoc rbLoc) {
    return create(ctx, lbLoc, elements, rbLoc, Optional.empty());
  }

  public static BraceStmt create(
      ASTContext ctx,
      SourceLoc lbLoc,
      List<ASTElement> elements,
      SourceLoc rbLoc,
      boolean implicit) {
    return create(ctx, lbLoc, elements, rbLoc, Optional.of(implicit));
  }

  private static BraceStmt create(
      ASTContext ctx,
      SourceLoc lbLoc,
      List<ASTElement> elements,
      SourceLoc rbLoc,
      Optional<Boolean> implicit) {
    for (ASTElement element : elements) {
      if (element.isStmt()) ctx.checkOwned(element.stmt());
    }
    return ctx.allocate(
        new BraceStmt(
            Preconditions.checkNotNull(lbLoc),
            ctx.allocateTrailing(elements),
            Preconditions.checkNotNull(rbLoc),
            implicit));
  }

  public SourceLoc lbraceLoc() {
    return lbLoc;
  }

  public SourceLoc rbraceLoc() {
    return rbLoc;
  }

  @Override
  public SourceRange sourceRange() {
    return SourceRange.create(lbLoc, rbLoc);
  }

  /** The elements in source order. Read-only; use {@link #setElement} to replace one. */
  @ASTChild
  @Override
  public List<ASTElement> elements() {
    return elements.asList();
  }

  public int numElements() {
    return elements.size();
  }

  public ASTElement element(int index) {
    return elements.get(index);
  }

  public void setElement(int index, ASTElement element) {
    if (element.isStmt()) checkOwned(element.stmt());
    elements.set(index, element);
  }

  public void markAsConfigBlock() {
    isConfigBlock = true;
  }

  /** Whether this brace is a branch of an {@code #if} block. */
  public boolean isConfigBlock() {
    return isConfigBlock;
  }

  public void markAsInactiveConfigBlock() {
    isInactiveConfigBlock = true;
  }

  /** Whether this brace is an {@code #if} branch whose condition is false. */
  public boolean isInactiveConfigBlock() {
    return isInactiveConfigBlock;
  }
}
