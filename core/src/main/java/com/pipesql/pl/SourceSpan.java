package com.pipesql.pl;

/**
 * Location of a PL node in the source text.
 *
 * @param offset zero-based character offset of the first character
 * @param length number of characters covered
 * @param line one-based line number
 * @param column zero-based column within the line
 */
public record SourceSpan(int offset, int length, int line, int column) {

    /** Span used for nodes synthesized by the compiler rather than parsed. */
    public static final SourceSpan SYNTHETIC = new SourceSpan(0, 0, 0, 0);

    /**
     * Returns a span shifted by the given origin, used when re-parsing text
     * embedded in an interpolated string.
     */
    public SourceSpan relativeTo(SourceSpan origin) {
        int newLine = line <= 1 ? origin.line : origin.line + line - 1;
        int newColumn = line <= 1 ? origin.column + column : column;
        return new SourceSpan(origin.offset + offset, length, newLine, newColumn);
    }

    @Override
    public String toString() {
        return "%d:%d".formatted(line, column);
    }
}
