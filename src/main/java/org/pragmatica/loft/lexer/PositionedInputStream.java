package org.pragmatica.loft.lexer;

import org.pragmatica.loft.source.SourceLocation;
import org.pragmatica.loft.source.SourceSpan;

/**
 * Code point iterator over source text that tracks UTF-8 byte offset, line and column.
 *
 * <p>Positions are plain {@link SourceLocation} values, so checkpointing and rewinding are O(1).
 * A stream created with an origin reports positions relative to that origin, which lets a stream
 * over a substring of a larger document produce absolute positions.
 */
public final class PositionedInputStream {
    public static final int EOF = -1;

    private final String path;
    private final String input;
    private final int baseIndex;

    private int pos;
    private int offset;
    private int line;
    private int column;

    private PositionedInputStream(String path, String input, SourceLocation origin) {
        this.path = path;
        this.input = input;
        this.baseIndex = origin.index();
        this.pos = 0;
        this.offset = origin.offset();
        this.line = origin.line();
        this.column = origin.column();
    }

    public static PositionedInputStream of(String path, String input) {
        return new PositionedInputStream(path, input, SourceLocation.START);
    }

    public static PositionedInputStream of(String path, String input, SourceLocation origin) {
        return new PositionedInputStream(path, input, origin);
    }

    /**
     * Consume the next code point, or return {@link #EOF} at the end of input.
     */
    public int next() {
        if (eof()) {
            return EOF;
        }
        int c = input.codePointAt(pos);
        pos += Character.charCount(c);
        offset += utf8Length(c);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    public int peek() {
        return eof() ? EOF : input.codePointAt(pos);
    }

    public boolean eof() {
        return pos >= input.length();
    }

    public SourceLocation savePosition() {
        return SourceLocation.at(line, column, offset, baseIndex + pos);
    }

    public void restorePosition(SourceLocation location) {
        this.pos = location.index() - baseIndex;
        this.offset = location.offset();
        this.line = location.line();
        this.column = location.column();
    }

    public SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, savePosition());
    }

    public String path() {
        return path;
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }
}
