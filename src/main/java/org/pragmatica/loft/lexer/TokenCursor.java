package org.pragmatica.loft.lexer;

import org.pragmatica.loft.error.ParseError;
import org.pragmatica.loft.source.SourceSpan;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Token stream with unbounded push-back.
 *
 * <p>Pushed-back lexemes are returned before anything new is pulled from the tokenizer, most
 * recently pushed first. The {@code expect*} methods peek and consume only on a match, so after a
 * failure the offending lexeme is still at the front.
 */
public final class TokenCursor {
    private final Tokenizer tokenizer;
    private final Deque<Lexeme> buffer;
    private SourceSpan lastSpan;

    private TokenCursor(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
        this.buffer = new ArrayDeque<>();
        this.lastSpan = SourceSpan.at(tokenizer.position());
    }

    public static TokenCursor over(Tokenizer tokenizer) {
        return new TokenCursor(tokenizer);
    }

    public Optional<Lexeme> peek() throws ParseError {
        if (buffer.isEmpty()) {
            var next = tokenizer.next();
            if (next.isEmpty()) {
                return Optional.empty();
            }
            buffer.addFirst(next.get());
        }
        return Optional.of(buffer.peekFirst());
    }

    public Optional<Token> peekToken() throws ParseError {
        return peek().map(Lexeme::token);
    }

    public Optional<Lexeme> next() throws ParseError {
        var next = buffer.isEmpty()
            ? tokenizer.next()
            : Optional.of(buffer.removeFirst());
        next.ifPresent(lexeme -> lastSpan = lexeme.span());
        return next;
    }

    public void pushBack(Lexeme lexeme) {
        buffer.addFirst(lexeme);
    }

    /**
     * Undo a run of {@link #next()} calls: the lexemes go back to the front in their original order
     * and {@link #lastSpan()} is reset to what it was before the run.
     */
    public void pushBackAll(List<Lexeme> lexemes, SourceSpan previousSpan) {
        for (int i = lexemes.size() - 1; i >= 0; i--) {
            buffer.addFirst(lexemes.get(i));
        }
        lastSpan = previousSpan;
    }

    public boolean atEnd() throws ParseError {
        return peek().isEmpty();
    }

    public boolean isPunct(String symbol) throws ParseError {
        return peekToken().filter(token -> token instanceof Token.Punct punct && punct.symbol().equals(symbol))
                          .isPresent();
    }

    public boolean isKeyword(String name) throws ParseError {
        return peekToken().filter(token -> token instanceof Token.Keyword keyword && keyword.name().equals(name))
                          .isPresent();
    }

    public boolean isOp(String symbol) throws ParseError {
        return peekToken().filter(token -> token instanceof Token.Op op && op.symbol().equals(symbol))
                          .isPresent();
    }

    public Lexeme expectPunct(String symbol) throws ParseError {
        if (isPunct(symbol)) {
            return next().orElseThrow();
        }
        throw unexpected("'" + symbol + "'");
    }

    public Lexeme expectKeyword(String name) throws ParseError {
        if (isKeyword(name)) {
            return next().orElseThrow();
        }
        throw unexpected("keyword '" + name + "'");
    }

    public Lexeme expectOp(String symbol) throws ParseError {
        if (isOp(symbol)) {
            return next().orElseThrow();
        }
        throw unexpected("operator '" + symbol + "'");
    }

    /**
     * Span of the most recently consumed lexeme, or the start of input if nothing was consumed.
     */
    public SourceSpan lastSpan() {
        return lastSpan;
    }

    /**
     * Span to blame for an error at the current position: the next lexeme, or the end of the
     * last one when the input is exhausted.
     */
    public SourceSpan currentSpan() throws ParseError {
        return peek().map(Lexeme::span)
                     .orElseGet(() -> SourceSpan.at(lastSpan.end()));
    }

    public Optional<String> takeLastDocComment() {
        return tokenizer.takeLastDocComment();
    }

    public String path() {
        return tokenizer.path();
    }

    /**
     * Build an "Expected X but got Y" error pointing at the current position.
     */
    public ParseError unexpected(String expected) throws ParseError {
        var found = peek();
        var got = found.map(lexeme -> lexeme.token().describe())
                       .orElse("EOF");
        return ParseError.syntax(path(), currentSpan(), "Expected " + expected + " but got " + got);
    }

    public ParseError error(String reason) throws ParseError {
        return ParseError.syntax(path(), currentSpan(), reason);
    }
}
