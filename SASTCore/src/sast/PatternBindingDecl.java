package sast;

/**
 * A declaration binding a pattern to an initializer, e.g. {@code let x = foo()}. Appears as the
 * condition of {@code if}/{@code while} and as the generator of a {@code for-in} loop.
 */
public interface PatternBindingDecl extends Decl {}
