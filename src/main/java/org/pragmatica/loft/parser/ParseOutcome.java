package org.pragmatica.loft.parser;

import org.pragmatica.loft.ast.Stmt;
import org.pragmatica.loft.error.Diagnostic;
import org.pragmatica.loft.error.ParseError;

import java.util.List;

/**
 * Result of parsing with error recovery: the statements that parsed plus every error met on the way.
 *
 * <p>Errors are in source order, one per skipped statement. A statement that failed is absent from
 * {@code statements}; there is no placeholder node for it.
 *
 * @param statements Successfully parsed top-level statements
 * @param errors     Collected errors (empty on full success)
 * @param source     The original source text (for formatting diagnostics)
 * @param path       Path or name of the source, used in diagnostics
 */
public record ParseOutcome(
    List<Stmt> statements,
    List<ParseError> errors,
    String source,
    String path
) {
    public ParseOutcome {
        statements = List.copyOf(statements);
        errors = List.copyOf(errors);
    }

    /**
     * Check if parsing succeeded without any errors.
     */
    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int errorCount() {
        return errors.size();
    }

    public List<Diagnostic> diagnostics() {
        return errors.stream()
                     .map(ParseError::toDiagnostic)
                     .toList();
    }

    /**
     * Format all errors in Rust style.
     */
    public String formatDiagnostics() {
        if (errors.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var diag : diagnostics()) {
            sb.append(diag.format(source, path));
            sb.append("\n");
        }
        return sb.toString();
    }

    /**
     * One {@code path:line:column: error: message} line per error.
     */
    public String formatSimple() {
        var sb = new StringBuilder();
        for (var diag : diagnostics()) {
            sb.append(diag.formatSimple(path)).append("\n");
        }
        return sb.toString();
    }
}
