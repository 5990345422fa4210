package org.pragmatica.loft.ast;

/**
 * {@code pattern => body}. Expression matches carry {@link Expr} bodies, statement matches carry
 * {@link Stmt} bodies.
 */
public record MatchArm<B>(Expr pattern, B body) {}
