package sast.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a concrete AST class. The class must implement {@code <SimpleName>_ASTNode}, which is
 * generated along with a {@code visit} overload on {@code ASTVisitor}.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface ASTNode {}
