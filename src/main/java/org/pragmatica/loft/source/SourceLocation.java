package org.pragmatica.loft.source;

/**
 * A position in loft source text.
 *
 * @param line   1-based line
 * @param column 1-based column, counted in code points
 * @param offset 0-based UTF-8 byte offset, as reported in diagnostics
 * @param index  0-based UTF-16 index into the Java string holding the source
 */
public record SourceLocation(int line, int column, int offset, int index) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0, 0);

    public static SourceLocation at(int line, int column, int offset, int index) {
        return new SourceLocation(line, column, offset, index);
    }

    /**
     * Location in text whose prefix is ASCII, where the byte offset and the string index coincide.
     */
    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset, offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
