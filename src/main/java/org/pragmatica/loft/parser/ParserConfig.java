package org.pragmatica.loft.parser;

/**
 * Parser configuration options.
 *
 * @param lambdaLookaheadLimit Maximum number of tokens examined when deciding whether {@code (} opens a
 *                             lambda parameter list
 * @param maxInputSize         Maximum source length in characters
 */
public record ParserConfig(
    int lambdaLookaheadLimit,
    int maxInputSize
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        100,
        10_000_000
    );

    public ParserConfig {
        if (lambdaLookaheadLimit < 1) {
            throw new IllegalArgumentException("Lambda lookahead limit must be positive, got " + lambdaLookaheadLimit);
        }
        if (maxInputSize < 0) {
            throw new IllegalArgumentException("Maximum input size must not be negative, got " + maxInputSize);
        }
    }
}
