package sast;

import java.util.Optional;

/** Overloads called from the generated {@code visitChildren} methods, one per child shape. */
public final class ASTNodeUtils {
  public static <V> V accept(ASTNodeInterface node, ASTVisitor<V> visitor, V value) {
    return node.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends ASTNodeInterface> nodes, ASTVisitor<V> visitor, V value) {
    for (ASTNodeInterface node : nodes) {
      value = node.accept(visitor, value);
    }
    return value;
  }

  public static <V> V accept(
      Optional<? extends ASTNodeInterface> node, ASTVisitor<V> visitor, V value) {
    return node.isPresent() ? node.get().accept(visitor, value) : value;
  }

  private ASTNodeUtils() {}
}
