package sast;

import java.util.Optional;

import com.google.common.base.Preconditions;

import sast.processor.ASTChild;
import sast.processor.ASTNode;

/**
 * {@code for pattern in sequence { ... }}.
 *
 * <p>The generator binding and the expression advancing it are not written by the parser; the
 * pass that lowers the loop sets each of them once.
 */
@ASTNode
public final class ForEachStmt extends LabeledStmt implements ForEachStmt_ASTNode {
  private final SourceLoc forLoc;
  private final SourceLoc inLoc;
  private Pattern pattern;
  private Expr sequence;
  private BraceStmt body;

  private Optional<PatternBindingDecl> generator = Optional.empty();
  private Optional<Expr> generatorNext = Optional.empty();

  private ForEachStmt(
      LabeledStmtInfo labelInfo,
      SourceLoc forLoc,
      Pattern pattern,
      SourceLoc inLoc,
      Expr sequence,
      BraceStmt body,
      Optional<Boolean> implicit) {
    super(Kind.FOR_EACH, defaultImplicitFlag(implicit, forLoc), labelInfo);
    this.forLoc = forLoc;
    this.inLoc = inLoc;
    this.pattern = pattern;
    this.sequence = sequence;
    this.body = body;
  }

  public static ForEachStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc forLoc,
      Pattern pattern,
      SourceLoc inLoc,
      Expr sequence,
      BraceStmt body) {
    return create(ctx, labelInfo, forLoc, pattern, inLoc, sequence, body, Optional.empty());
  }

  public static ForEachStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc forLoc,
      Pattern pattern,
      SourceLoc inLoc,
      Expr sequence,
      BraceStmt body,
      boolean implicit) {
    return create(ctx, labelInfo, forLoc, pattern, inLoc, sequence, body, Optional.of(implicit));
  }

  private static ForEachStmt create(
      ASTContext ctx,
      LabeledStmtInfo labelInfo,
      SourceLoc forLoc,
      Pattern pattern,
      SourceLoc inLoc,
      Expr sequence,
      BraceStmt body,
      Optional<Boolean> implicit) {
    return ctx.allocate(
        new ForEachStmt(
            labelInfo,
            Preconditions.checkNotNull(forLoc),
            Preconditions.checkNotNull(pattern),
            Preconditions.checkNotNull(inLoc),
            Preconditions.checkNotNull(sequence),
            ctx.checkOwned(body),
            implicit));
  }

  public SourceLoc forLoc() {
    return forLoc;
  }

  public SourceLoc inLoc() {
    return inLoc;
  }

  /** The iteration variables, visible only inside the body. */
  public Pattern pattern() {
    return pattern;
  }

  public void setPattern(Pattern pattern) {
    this.pattern = Preconditions.checkNotNull(pattern);
  }

  /** The sequence as written in the source. */
  public Expr sequence() {
    return sequence;
  }

  public void setSequence(Expr sequence) {
    this.sequence = Preconditions.checkNotNull(sequence);
  }

  @ASTChild
  @Override
  public BraceStmt body() {
    return body;
  }

  public void setBody(BraceStmt body) {
    this.body = checkOwned(body);
  }

  /** The implicit generator variable and its initialization from the sequence. */
  public Optional<PatternBindingDecl> generator() {
    return generator;
  }

  public void setGenerator(PatternBindingDecl generator) {
    Preconditions.checkState(!this.generator.isPresent(), "generator already set");
    this.generator = Optional.of(generator);
  }

  /** Advances the generator, producing the next element or nothing at the end of the sequence. */
  public Optional<Expr> generatorNext() {
    return generatorNext;
  }

  public void setGeneratorNext(Expr generatorNext) {
    Preconditions.checkState(!this.generatorNext.isPresent(), "generator advance already set");
    this.generatorNext = Optional.of(generatorNext);
  }

  @Override
  public SourceRange sourceRange() {
    return SourceRange.create(
        forLoc, SourceRange.endOf(forLoc, body::endLoc, sequence::endLoc, pattern::endLoc));
  }
}
