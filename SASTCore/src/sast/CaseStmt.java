package sast;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import sast.processor.ASTChild;
import sast.processor.ASTNode;

/**
 * A {@code case} or {@code default} block of a {@link SwitchStmt}. Only valid as a case of a
 * switch.
 *
 * <pre>
 *   case 1:
 *   case 2, 3:
 *   case Foo(var x, var y) where x &lt; y:
 *   default:
 * </pre>
 */
@ASTNode
public final class CaseStmt extends Stmt implements CaseStmt_ASTNode {
  private final SourceLoc caseLoc;
  private final SourceLoc colonLoc;
  private final boolean hasBoundDecls;
  private final TrailingArray<CaseLabelItem> labelItems;
  private Stmt body;

  private CaseStmt(
      SourceLoc caseLoc,
      TrailingArray<CaseLabelItem> labelItems,
      boolean hasBoundDecls,
      SourceLoc colonLoc,
      Stmt body,
      Optional<Boolean> implicit) {
    super(Kind.CASE, defaultImplicitFlag(implicit, caseLoc));
    this.caseLoc = caseLoc;
    this.labelItems = labelItems;
    this.hasBoundDecls = hasBoundDecls;
    this.colonLoc = colonLoc;
    this.body = body;
  }

  public static CaseStmt create(
      ASTContext ctx,
      SourceLoc caseLoc,
      List<CaseLabelItem> labelItems,
      boolean hasBoundDecls,
      SourceLoc colonLoc,
      Stmt body) {
    return create(ctx, caseLoc, labelItems, hasBoundDecls, colonLoc, body, Optional.empty());
  }

  public static CaseStmt create(
      ASTContext ctx,
      SourceLoc caseLoc,
      List<CaseLabelItem> labelItems,
      boolean hasBoundDecls,
      SourceLoc colonLoc,
      Stmt body,
      boolean implicit) {
    return create(
        ctx, caseLoc, labelItems, hasBoundDecls, colonLoc, body, Optional.of(implicit));
  }

  private static CaseStmt create(
      ASTContext ctx,
      SourceLoc caseLoc,
      List<CaseLabelItem> labelItems,
      boolean hasBoundDecls,
      SourceLoc colonLoc,
      Stmt body,
      Optional<Boolean> implicit) {
    Preconditions.checkArgument(!labelItems.isEmpty(), "case needs at least one label item");
    ImmutableList<CaseLabelItem> copies =
        labelItems.stream().map(CaseLabelItem::copy).collect(ImmutableList.toImmutableList());
    return ctx.allocate(
        new CaseStmt(
            Preconditions.checkNotNull(caseLoc),
            ctx.allocateTrailing(copies),
            hasBoundDecls,
            Preconditions.checkNotNull(colonLoc),
            ctx.checkOwned(body),
            implicit));
  }

  /** Location of the {@code case} or {@code default} keyword of the first label. */
  public SourceLoc caseLoc() {
    return caseLoc;
  }

  public SourceLoc colonLoc() {
    return colonLoc;
  }

  public List<CaseLabelItem> caseLabelItems() {
    return labelItems.asList();
  }

  /** Fixed-size; items may be replaced but not added or removed. Replacements are copied. */
  public List<CaseLabelItem> mutableCaseLabelItems() {
    return labelItems.asMutableList(CaseLabelItem::copy);
  }

  @ASTChild
  @Override
  public Stmt body() {
    return body;
  }

  public void setBody(Stmt body) {
    this.body = checkOwned(body);
  }

  /** Whether any label pattern binds local variables. */
  public boolean hasBoundDecls() {
    return hasBoundDecls;
  }

  public boolean isDefault() {
    return labelItems.get(0).isDefault();
  }

  @Override
  public SourceRange sourceRange() {
    return SourceRange.create(
        caseLoc,
        SourceRange.endOf(
            caseLoc,
            body::endLoc,
            () -> colonLoc,
            () -> labelItems.get(labelItems.size() - 1).sourceRange().end()));
  }
}
