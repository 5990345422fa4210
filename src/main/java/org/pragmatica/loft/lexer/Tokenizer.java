package org.pragmatica.loft.lexer;

import org.pragmatica.loft.error.ParseError;
import org.pragmatica.loft.source.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Character-to-token translation for loft source text.
 *
 * <p>Tokens are produced one at a time. Whitespace and comments are skipped; {@code ///} and
 * {@code /** *}{@code /} comments are kept in a single "last doc comment" slot instead of being
 * emitted, unless the tokenizer was created in keep-comments mode. A backtick template literal is
 * lexed in one go and its tokens are queued, each {@code ${...}} interpolation being tokenized by
 * a fresh, independent tokenizer.
 */
public final class Tokenizer {
    private static final Logger log = LoggerFactory.getLogger(Tokenizer.class);

    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    public static final Set<String> KEYWORDS = Set.of(
        "let", "const", "fn", "if", "else", "while", "for", "in", "return", "break", "continue",
        "match", "def", "enum", "impl", "trait", "async", "await", "lazy", "mut", "true", "false",
        "learn", "teach");

    private static final String OPERATOR_CHARS = "+-*/%=!<>&|^~.@?";
    private static final String PUNCT_CHARS = ",;:(){}[]#";
    private static final Set<String> DIGRAPHS = Set.of(
        "->", "=>", "==", "!=", "<=", ">=", "&&", "||", "+=", "-=", "*=", "/=", "::");

    private final PositionedInputStream input;
    private final boolean keepComments;
    private final Deque<Lexeme> pending;
    private String lastDocComment;

    private Tokenizer(PositionedInputStream input, boolean keepComments) {
        this.input = input;
        this.keepComments = keepComments;
        this.pending = new ArrayDeque<>();
    }

    public static Tokenizer create(PositionedInputStream input) {
        return new Tokenizer(input, false);
    }

    /**
     * Create a tokenizer that emits {@link Token.Comment} and {@link Token.DocComment} tokens
     * instead of skipping comments.
     */
    public static Tokenizer keepingComments(PositionedInputStream input) {
        return new Tokenizer(input, true);
    }

    /**
     * Produce the next token, or empty at the end of input.
     */
    public Optional<Lexeme> next() throws ParseError {
        if (!pending.isEmpty()) {
            return Optional.of(pending.removeFirst());
        }

        var comment = skipWhitespaceAndComments();
        if (comment.isPresent()) {
            return comment;
        }
        if (input.eof()) {
            return Optional.empty();
        }

        var start = input.savePosition();
        int c = input.peek();

        if (c == '"') {
            return Optional.of(readString(start));
        }
        if (c == '`') {
            return Optional.of(readTemplateLiteral(start));
        }
        if (isDigit(c)) {
            return Optional.of(readNumber(start));
        }
        if (isIdentifierStart(c)) {
            return Optional.of(readIdentifier(start));
        }
        if (OPERATOR_CHARS.indexOf(c) >= 0) {
            return Optional.of(readOperator(start));
        }
        if (PUNCT_CHARS.indexOf(c) >= 0) {
            input.next();
            // "::" is the one digraph that starts with a punctuation character
            if (c == ':' && input.peek() == ':') {
                input.next();
                return Optional.of(Lexeme.of(new Token.Op("::"), input.spanFrom(start)));
            }
            return Optional.of(Lexeme.of(new Token.Punct(Character.toString(c)), input.spanFrom(start)));
        }

        input.next();
        throw ParseError.lexical(input.path(), input.spanFrom(start),
                                 "Unexpected character '" + Character.toString(c) + "'");
    }

    /**
     * Drain the whole input into a list.
     */
    public List<Lexeme> tokenizeAll() throws ParseError {
        var lexemes = new ArrayList<Lexeme>();
        var next = next();
        while (next.isPresent()) {
            lexemes.add(next.get());
            next = next();
        }
        return lexemes;
    }

    /**
     * Return and clear the pending doc comment.
     */
    public Optional<String> takeLastDocComment() {
        var comment = Optional.ofNullable(lastDocComment);
        lastDocComment = null;
        return comment;
    }

    public SourceLocation position() {
        return input.savePosition();
    }

    public String path() {
        return input.path();
    }

    private Optional<Lexeme> skipWhitespaceAndComments() throws ParseError {
        while (true) {
            while (!input.eof() && Character.isWhitespace(input.peek())) {
                input.next();
            }
            if (input.eof() || input.peek() != '/') {
                return Optional.empty();
            }

            var start = input.savePosition();
            input.next();

            if (input.peek() == '/') {
                input.next();
                var comment = readLineComment(start);
                if (comment.isPresent()) {
                    return comment;
                }
            } else if (input.peek() == '*') {
                input.next();
                var comment = readBlockComment(start);
                if (comment.isPresent()) {
                    return comment;
                }
            } else {
                input.restorePosition(start);
                return Optional.empty();
            }
        }
    }

    // "//" already consumed
    private Optional<Lexeme> readLineComment(SourceLocation start) {
        boolean doc = input.peek() == '/';
        if (doc) {
            input.next();
        }
        var text = readWhile(c -> c != '\n');

        if (keepComments) {
            var token = doc
                ? new Token.DocComment(text.trim())
                : new Token.Comment("//" + text);
            return Optional.of(Lexeme.of(token, input.spanFrom(start)));
        }
        if (doc) {
            lastDocComment = text.trim();
        }
        return Optional.empty();
    }

    // "/*" already consumed
    private Optional<Lexeme> readBlockComment(SourceLocation start) throws ParseError {
        boolean doc = false;
        if (input.peek() == '*') {
            var star = input.savePosition();
            input.next();
            if (input.peek() == '/') {
                // "/**/" is an empty plain comment
                input.restorePosition(star);
            } else {
                doc = true;
            }
        }

        var text = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        boolean terminated = false;
        while (!input.eof()) {
            int c = input.next();
            if (c == '*' && input.peek() == '/') {
                input.next();
                terminated = true;
                break;
            }
            text.appendCodePoint(c);
        }

        if (!terminated) {
            throw ParseError.lexical(input.path(), input.spanFrom(start), "Unterminated block comment");
        }

        if (keepComments) {
            var token = doc
                ? new Token.DocComment(text.toString().trim())
                : new Token.Comment("/*" + text + "*/");
            return Optional.of(Lexeme.of(token, input.spanFrom(start)));
        }
        if (doc) {
            lastDocComment = text.toString().trim();
        }
        return Optional.empty();
    }

    private Lexeme readNumber(SourceLocation start) throws ParseError {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        sb.append(readWhile(Tokenizer::isDigit));

        if (input.peek() == '.') {
            var dot = input.savePosition();
            input.next();
            if (!input.eof() && isDigit(input.peek())) {
                sb.append('.').append(readWhile(Tokenizer::isDigit));
            } else {
                input.restorePosition(dot);
            }
        }

        var text = sb.toString();
        try {
            return Lexeme.of(new Token.Number(new BigDecimal(text)), input.spanFrom(start));
        } catch (NumberFormatException e) {
            throw ParseError.lexical(input.path(), input.spanFrom(start),
                                     "Invalid number literal '" + text + "'");
        }
    }

    private Lexeme readIdentifier(SourceLocation start) {
        var name = readWhile(Tokenizer::isIdentifierPart);
        var token = KEYWORDS.contains(name)
            ? (Token) new Token.Keyword(name)
            : new Token.Ident(name);
        return Lexeme.of(token, input.spanFrom(start));
    }

    // Unterminated strings end silently at end of input.
    private Lexeme readString(SourceLocation start) {
        input.next();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        boolean escaped = false;
        while (!input.eof()) {
            int c = input.next();
            if (escaped) {
                sb.appendCodePoint(c);
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                break;
            } else {
                sb.appendCodePoint(c);
            }
        }
        return Lexeme.of(new Token.StringLiteral(sb.toString()), input.spanFrom(start));
    }

    private Lexeme readOperator(SourceLocation start) {
        var symbol = Character.toString(input.next());
        if (!input.eof()) {
            var pair = symbol + Character.toString(input.peek());
            if (DIGRAPHS.contains(pair)) {
                input.next();
                symbol = pair;
            }
        }
        return Lexeme.of(new Token.Op(symbol), input.spanFrom(start));
    }

    /**
     * Lex a whole template literal. The returned lexeme is the {@code TemplateStart}; the rest are
     * queued and handed out by subsequent {@link #next()} calls.
     */
    private Lexeme readTemplateLiteral(SourceLocation start) throws ParseError {
        input.next();
        var opening = Lexeme.of(new Token.TemplateStart(), input.spanFrom(start));
        var parts = new ArrayList<Lexeme>();
        var text = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        var textStart = input.savePosition();

        while (!input.eof()) {
            int c = input.peek();

            if (c == '`') {
                flushText(parts, text, textStart);
                var closing = input.savePosition();
                input.next();
                parts.add(Lexeme.of(new Token.TemplateEnd(), input.spanFrom(closing)));
                pending.addAll(parts);
                return opening;
            }

            if (c == '$') {
                var dollar = input.savePosition();
                input.next();
                if (input.peek() == '{') {
                    flushText(parts, text, textStart);
                    input.next();
                    parts.add(Lexeme.of(new Token.TemplateExprStart(), input.spanFrom(dollar)));
                    readTemplateExpression(parts);
                    textStart = input.savePosition();
                } else {
                    input.restorePosition(dollar);
                    text.appendCodePoint(input.next());
                }
                continue;
            }

            if (c == '\\') {
                input.next();
                if (!input.eof()) {
                    text.append(translateTemplateEscape(input.next()));
                }
                continue;
            }

            text.appendCodePoint(input.next());
        }

        throw ParseError.lexical(input.path(), input.spanFrom(start), "Unterminated template literal");
    }

    // "${" already consumed; consumes the closing '}'
    private void readTemplateExpression(List<Lexeme> parts) throws ParseError {
        var exprStart = input.savePosition();
        var buffer = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        int braceDepth = 1;

        while (!input.eof()) {
            int c = input.peek();
            if (c == '\\') {
                buffer.appendCodePoint(input.next());
                if (!input.eof()) {
                    buffer.appendCodePoint(input.next());
                }
                continue;
            }
            if (c == '{') {
                braceDepth++;
            } else if (c == '}') {
                braceDepth--;
                if (braceDepth == 0) {
                    break;
                }
            }
            buffer.appendCodePoint(input.next());
        }

        if (braceDepth > 0) {
            throw ParseError.lexical(input.path(), input.spanFrom(exprStart), "Unterminated template expression");
        }

        var expression = buffer.toString();
        if (!expression.isEmpty()) {
            log.trace("Tokenizing template interpolation '{}' at {}", expression, exprStart);
            var nested = Tokenizer.create(PositionedInputStream.of(input.path(), expression, exprStart));
            try {
                parts.addAll(nested.tokenizeAll());
            } catch (ParseError e) {
                // Leave the outer input after the whole literal so lexing resumes in code
                skipRestOfTemplate();
                throw e;
            }
        }

        var closing = input.savePosition();
        input.next();
        parts.add(Lexeme.of(new Token.TemplateExprEnd(), input.spanFrom(closing)));
    }

    // Positioned on the '}' closing an interpolation; consumes up to and including the closing backtick
    private void skipRestOfTemplate() {
        input.next();
        int braceDepth = 0;
        while (!input.eof()) {
            int c = input.next();
            if (c == '\\') {
                input.next();
            } else if (braceDepth > 0) {
                if (c == '{') {
                    braceDepth++;
                } else if (c == '}') {
                    braceDepth--;
                }
            } else if (c == '`') {
                return;
            } else if (c == '$' && input.peek() == '{') {
                input.next();
                braceDepth = 1;
            }
        }
    }

    private static String translateTemplateEscape(int escaped) {
        return switch (escaped) {
            case 'n' -> "\n";
            case 't' -> "\t";
            case 'r' -> "\r";
            case '\\' -> "\\";
            case '`' -> "`";
            case '$' -> "$";
            default -> "\\" + Character.toString(escaped);
        };
    }

    private void flushText(List<Lexeme> parts, StringBuilder text, SourceLocation textStart) {
        if (text.length() > 0) {
            parts.add(Lexeme.of(new Token.TemplateString(text.toString()), input.spanFrom(textStart)));
            text.setLength(0);
        }
    }

    private String readWhile(IntPredicate predicate) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!input.eof() && predicate.test(input.peek())) {
            sb.appendCodePoint(input.next());
        }
        return sb.toString();
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(int c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(int c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
