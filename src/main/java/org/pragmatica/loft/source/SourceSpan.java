package org.pragmatica.loft.source;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    /**
     * Length in UTF-8 bytes.
     */
    public int length() {
        return end.offset() - start.offset();
    }

    public String extract(String source) {
        return source.substring(start.index(), end.index());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
