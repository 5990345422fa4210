package org.pragmatica.loft.ast;

/**
 * Piece of a template literal: literal text or an interpolated expression.
 */
public sealed interface TemplatePart {

    record Text(String text) implements TemplatePart {}

    record Interpolation(Expr expr) implements TemplatePart {}
}
