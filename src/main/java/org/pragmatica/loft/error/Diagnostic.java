package org.pragmatica.loft.error;

import org.pragmatica.loft.source.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic message rendered in Rust style with a labeled source snippet.
 *
 * <p>Example output:
 * <pre>
 * error: Unexpected token in expression: ';'
 *   --> main.lf:1:9
 *    |
 *  1 | let x = ;
 *    |         ^ Unexpected token in expression: ';'
 *    |
 * </pre>
 *
 * @param message Primary error message
 * @param span    Source span where the error occurred
 * @param labels  Labeled spans underlined in the snippet
 * @param notes   Additional notes or suggestions
 */
public record Diagnostic(
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    /**
     * A labeled span shown under the source line.
     *
     * @param span    Source span for this label
     * @param message Label message
     */
    public record Label(SourceSpan span, String message) {}

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(message, span, List.of(), List.of());
    }

    public Diagnostic withLabel(String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(new Label(span, message));
        return new Diagnostic(this.message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, span, labels, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic in Rust style.
     *
     * @param source   The source text
     * @param filename Optional filename for display
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append("error: ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int minLine = span.start().line();
        int maxLine = span.end().line();
        for (var label : labels) {
            minLine = Math.min(minLine, label.span().start().line());
            maxLine = Math.max(maxLine, label.span().end().line());
        }

        int gutterWidth = String.valueOf(maxLine).length();
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) {
                continue;
            }
            String lineContent = stripCarriageReturn(lines[lineNum - 1]);
            String lineNumStr = String.format("%" + gutterWidth + "d", lineNum);
            sb.append(lineNumStr).append(" | ").append(lineContent).append("\n");

            var lineLabels = labelsOnLine(lineNum);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutterWidth)).append(" | ");
                sb.append(formatUnderlines(lineNum, lineContent, lineLabels));
                sb.append("\n");
            }
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    /**
     * Single-line format: {@code path:line:column: error: message}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: error: %s", filename, loc.line(), loc.column(), message);
    }

    private List<Label> labelsOnLine(int lineNum) {
        var result = new ArrayList<Label>();
        if (labels.isEmpty() && span.start().line() <= lineNum && span.end().line() >= lineNum) {
            result.add(new Label(span, ""));
        }
        for (var label : labels) {
            if (label.span().start().line() <= lineNum && label.span().end().line() >= lineNum) {
                result.add(label);
            }
        }
        return result;
    }

    private String formatUnderlines(int lineNum, String lineContent, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int currentCol = 1;

        var sorted = lineLabels.stream()
            .sorted((a, b) -> Integer.compare(a.span().start().column(), b.span().start().column()))
            .toList();

        for (var label : sorted) {
            int startCol = label.span().start().line() == lineNum ? label.span().start().column() : 1;
            int endCol = label.span().end().line() == lineNum
                ? label.span().end().column()
                : lineContent.codePointCount(0, lineContent.length()) + 1;

            while (currentCol < startCol) {
                sb.append(" ");
                currentCol++;
            }

            int underlineLen = Math.max(1, endCol - startCol);
            sb.append("^".repeat(underlineLen));
            currentCol += underlineLen;

            if (!label.message().isEmpty()) {
                sb.append(" ").append(label.message());
            }
        }

        return sb.toString();
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
