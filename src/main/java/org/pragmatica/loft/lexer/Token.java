package org.pragmatica.loft.lexer;

import java.math.BigDecimal;

/**
 * Token produced by the {@link Tokenizer}.
 *
 * <p>Tokens carry no position; the stream that produced a token reports its span alongside it
 * (see {@link Lexeme}).
 */
public sealed interface Token {

    /**
     * Rendering used in diagnostics, e.g. {@code 'fn'} or {@code "text"}.
     */
    String describe();

    // Literals and names
    record Number(BigDecimal value) implements Token {
        @Override
        public String describe() {
            return value.toPlainString();
        }
    }

    record Keyword(String name) implements Token {
        @Override
        public String describe() {
            return "'" + name + "'";
        }
    }

    record Ident(String name) implements Token {
        @Override
        public String describe() {
            return "'" + name + "'";
        }
    }

    record StringLiteral(String value) implements Token {
        @Override
        public String describe() {
            return "\"" + value + "\"";
        }
    }

    // , ; : ( ) { } [ ] #
    record Punct(String symbol) implements Token {
        @Override
        public String describe() {
            return "'" + symbol + "'";
        }
    }

    // single operator character or digraph
    record Op(String symbol) implements Token {
        @Override
        public String describe() {
            return "'" + symbol + "'";
        }
    }

    // Comments, only emitted in keep-comments mode
    record DocComment(String text) implements Token {
        @Override
        public String describe() {
            return "doc comment";
        }
    }

    record Comment(String text) implements Token {
        @Override
        public String describe() {
            return "comment";
        }
    }

    // Template literal markers
    record TemplateStart() implements Token {
        @Override
        public String describe() {
            return "'`'";
        }
    }

    record TemplateString(String text) implements Token {
        @Override
        public String describe() {
            return "template text \"" + text + "\"";
        }
    }

    record TemplateExprStart() implements Token {
        @Override
        public String describe() {
            return "'${'";
        }
    }

    record TemplateExprEnd() implements Token {
        @Override
        public String describe() {
            return "'}'";
        }
    }

    record TemplateEnd() implements Token {
        @Override
        public String describe() {
            return "'`'";
        }
    }
}
