package sast;

import java.util.Optional;

import com.google.common.base.Preconditions;

/** An element of a {@link BraceStmt}: exactly one of a statement, expression or declaration. */
public final class ASTElement implements ASTNodeInterface {
  public enum Kind {
    STMT,
    EXPR,
    DECL;
  }

  private final Optional<Stmt> stmt;
  private final Optional<Expr> expr;
  private final Optional<Decl> decl;

  private ASTElement(Optional<Stmt> stmt, Optional<Expr> expr, Optional<Decl> decl) {
    this.stmt = stmt;
    this.expr = expr;
    this.decl = decl;
  }

  public static ASTElement of(Stmt stmt) {
    return new ASTElement(Optional.of(stmt), Optional.empty(), Optional.empty());
  }

  public static ASTElement of(Expr expr) {
    return new ASTElement(Optional.empty(), Optional.of(expr), Optional.empty());
  }

  public static ASTElement of(Decl decl) {
    return new ASTElement(Optional.empty(), Optional.empty(), Optional.of(decl));
  }

  public Kind kind() {
    if (stmt.isPresent()) return Kind.STMT;
    return expr.isPresent() ? Kind.EXPR : Kind.DECL;
  }

  public boolean isStmt() {
    return stmt.isPresent();
  }

  public boolean isExpr() {
    return expr.isPresent();
  }

  public boolean isDecl() {
    return decl.isPresent();
  }

  public Stmt stmt() {
    Preconditions.checkState(isStmt(), "element is a %s", kind());
    return stmt.get();
  }

  public Expr expr() {
    Preconditions.checkState(isExpr(), "element is a %s", kind());
    return expr.get();
  }

  public Decl decl() {
    Preconditions.checkState(isDecl(), "element is a %s", kind());
    return decl.get();
  }

  public SourceRange sourceRange() {
    switch (kind()) {
      case STMT:
        return stmt.get().sourceRange();
      case EXPR:
        return expr.get().sourceRange();
      case DECL:
        return decl.get().sourceRange();
      default:
        throw new AssertionError(kind());
    }
  }

  @Override
  public <V> V accept(ASTVisitor<V> visitor, V value) {
    return isStmt() ? stmt.get().accept(visitor, value) : value;
  }

  @Override
  public <V> V visitChildren(ASTVisitor<V> visitor, V value) {
    return isStmt() ? stmt.get().visitChildren(visitor, value) : value;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof ASTElement)) return false;

    ASTElement other = (ASTElement) obj;
    // Identity of the wrapped node, not structural equality.
    return payload() == other.payload();
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(payload());
  }

  private Object payload() {
    if (stmt.isPresent()) return stmt.get();
    return expr.isPresent() ? expr.get() : decl.get();
  }

  @Override
  public String toString() {
    return "[" + kind().name().toLowerCase() + ": " + payload() + "]";
  }
}
