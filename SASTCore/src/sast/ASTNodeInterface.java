package sast;

/** Implemented by every node reachable through the generated {@link ASTVisitor}. */
public interface ASTNodeInterface {
  <V> V accept(ASTVisitor<V> visitor, V value);

  <V> V visitChildren(ASTVisitor<V> visitor, V value);
}
