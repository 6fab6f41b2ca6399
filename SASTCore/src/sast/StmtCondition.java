package sast;

import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * The condition of an {@code if} or {@code while}: either a conditional pattern binding ({@code if
 * let x = ...}) or a boolean expression. Never empty.
 */
public final class StmtCondition {
  public enum Kind {
    BINDING,
    EXPRESSION;
  }

  private final Optional<PatternBindingDecl> binding;
  private final Optional<Expr> expr;

  private StmtCondition(Optional<PatternBindingDecl> binding, Optional<Expr> expr) {
    this.binding = binding;
    this.expr = expr;
  }

  public static StmtCondition binding(PatternBindingDecl binding) {
    return new StmtCondition(Optional.of(binding), Optional.empty());
  }

  public static StmtCondition expr(Expr expr) {
    return new StmtCondition(Optional.empty(), Optional.of(expr));
  }

  public Kind kind() {
    return binding.isPresent() ? Kind.BINDING : Kind.EXPRESSION;
  }

  public boolean isBinding() {
    return binding.isPresent();
  }

  public PatternBindingDecl binding() {
    Preconditions.checkState(isBinding(), "condition is an expression");
    return binding.get();
  }

  public Expr expr() {
    Preconditions.checkState(!isBinding(), "condition is a pattern binding");
    return expr.get();
  }

  public SourceRange sourceRange() {
    switch (kind()) {
      case BINDING:
        return binding.get().sourceRange();
      case EXPRESSION:
        return expr.get().sourceRange();
      default:
        throw new AssertionError(kind());
    }
  }

  @Override
  public String toString() {
    return isBinding() ? "[binding: " + binding.get() + "]" : "[expr: " + expr.get() + "]";
  }
}
