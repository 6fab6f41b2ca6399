package sast.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Marks an accessor whose result is visited by the generated {@code visitChildren}. */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
public @interface ASTChild {}
