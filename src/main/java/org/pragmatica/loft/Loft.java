package org.pragmatica.loft;

import org.pragmatica.loft.ast.Expr;
import org.pragmatica.loft.ast.Stmt;
import org.pragmatica.loft.error.ParseError;
import org.pragmatica.loft.lexer.Lexeme;
import org.pragmatica.loft.lexer.PositionedInputStream;
import org.pragmatica.loft.lexer.Tokenizer;
import org.pragmatica.loft.parser.LoftParser;
import org.pragmatica.loft.parser.ParseOutcome;
import org.pragmatica.loft.parser.ParserConfig;

import java.util.List;

/**
 * Entry point for parsing loft source.
 *
 * <p>Example usage:
 * <pre>{@code
 * var statements = Loft.parse("let x = 2 + 3 * 4;", "main.lf");
 *
 * var outcome = Loft.parseRecoverable(source, "main.lf");
 * if (outcome.hasErrors()) {
 *     System.err.print(outcome.formatDiagnostics());
 * }
 * }</pre>
 *
 * <p>Every call creates a fresh parser, so the static methods may be used from several threads.
 */
public final class Loft {
    private Loft() {}

    /**
     * Parse a whole source, failing on the first error.
     */
    public static List<Stmt> parse(String source, String path) throws ParseError {
        return LoftParser.create(source, path).parse();
    }

    /**
     * Parse a whole source, collecting errors and skipping the statements they occur in.
     */
    public static ParseOutcome parseRecoverable(String source, String path) {
        return LoftParser.create(source, path).parseRecoverable();
    }

    /**
     * Parse a source consisting of exactly one expression.
     */
    public static Expr parseExpression(String source, String path) throws ParseError {
        return builder().parseExpression(source, path);
    }

    /**
     * Tokenize a whole source.
     *
     * @param keepComments emit comments as tokens instead of skipping them
     */
    public static List<Lexeme> tokenize(String source, String path, boolean keepComments) throws ParseError {
        var input = PositionedInputStream.of(path, source);
        var tokenizer = keepComments
            ? Tokenizer.keepingComments(input)
            : Tokenizer.create(input);
        return tokenizer.tokenizeAll();
    }

    /**
     * Create a builder for parsers with non-default configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int lambdaLookaheadLimit = ParserConfig.DEFAULT.lambdaLookaheadLimit();
        private int maxInputSize = ParserConfig.DEFAULT.maxInputSize();

        private Builder() {}

        public Builder lambdaLookaheadLimit(int limit) {
            this.lambdaLookaheadLimit = limit;
            return this;
        }

        public Builder maxInputSize(int size) {
            this.maxInputSize = size;
            return this;
        }

        public ParserConfig config() {
            return new ParserConfig(lambdaLookaheadLimit, maxInputSize);
        }

        public LoftParser parser(String source, String path) {
            return LoftParser.create(source, path, config());
        }

        public List<Stmt> parse(String source, String path) throws ParseError {
            return parser(source, path).parse();
        }

        public ParseOutcome parseRecoverable(String source, String path) {
            return parser(source, path).parseRecoverable();
        }

        public Expr parseExpression(String source, String path) throws ParseError {
            var parser = parser(source, path);
            var expr = parser.parseExpression();
            parser.expectEnd();
            return expr;
        }
    }
}
