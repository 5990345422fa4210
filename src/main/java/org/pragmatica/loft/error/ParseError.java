package org.pragmatica.loft.error;

import org.pragmatica.loft.source.SourceLocation;
import org.pragmatica.loft.source.SourceSpan;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Lexical or syntactic error with location and context information.
 *
 * <p>All failures of the front end share this one type; {@link #kind()} only tells whether the
 * tokenizer or the parser raised it. Finer classification is done on {@link #reason()}.
 */
public final class ParseError extends Exception {

    /**
     * Stage that raised the error.
     */
    public enum Kind {
        LEXICAL,
        SYNTAX
    }

    private final Kind kind;
    private final String path;
    private final SourceSpan span;
    private final String reason;
    private final String help;

    private ParseError(Kind kind, String path, SourceSpan span, String reason, String help) {
        super("Error in " + path + " @ " + span.start() + ":\n" + reason);
        this.kind = kind;
        this.path = path;
        this.span = span;
        this.reason = reason;
        this.help = help;
    }

    public static ParseError lexical(String path, SourceSpan span, String reason) {
        return new ParseError(Kind.LEXICAL, path, span, reason, null);
    }

    public static ParseError syntax(String path, SourceSpan span, String reason) {
        return new ParseError(Kind.SYNTAX, path, span, reason, null);
    }

    public ParseError withHelp(String help) {
        return new ParseError(kind, path, span, reason, help);
    }

    public Kind kind() {
        return kind;
    }

    public String path() {
        return path;
    }

    public SourceSpan span() {
        return span;
    }

    public SourceLocation location() {
        return span.start();
    }

    public int offset() {
        return span.start().offset();
    }

    public int line() {
        return span.start().line();
    }

    public int column() {
        return span.start().column();
    }

    /**
     * Message without the location prefix.
     */
    public String reason() {
        return reason;
    }

    /**
     * Length of the highlighted region, if the error points at more than a position.
     */
    public OptionalInt length() {
        return span.length() > 0 ? OptionalInt.of(span.length()) : OptionalInt.empty();
    }

    public Optional<String> help() {
        return Optional.ofNullable(help);
    }

    public Diagnostic toDiagnostic() {
        var diagnostic = Diagnostic.error(reason, span).withLabel(reason);
        return help().map(diagnostic::withHelp).orElse(diagnostic);
    }

    /**
     * Render this error with a labeled snippet of the given source.
     */
    public String render(String source) {
        return toDiagnostic().format(source, path);
    }
}
