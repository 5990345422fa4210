package org.pragmatica.loft.lexer;

import org.pragmatica.loft.source.SourceSpan;

/**
 * A token paired with the span its producing stream reported for it.
 */
public record Lexeme(Token token, SourceSpan span) {

    public static Lexeme of(Token token, SourceSpan span) {
        return new Lexeme(token, span);
    }

    @Override
    public String toString() {
        return span.start() + " " + token.describe();
    }
}
