package com.codegraph.core.service.model;

/**
 * Half-open source range with 1-based lines and columns; the end position is exclusive.
 */
public record SourceSpan(int startLine, int startColumn, int endLine, int endColumn) {

    public SourceSpan {
        if (startLine < 1 || startColumn < 1 || endLine < 1 || endColumn < 1) {
            throw new IllegalArgumentException("Span positions are 1-based: " + describe(
                    startLine, startColumn, endLine, endColumn));
        }
        if (endLine < startLine || (endLine == startLine && endColumn < startColumn)) {
            throw new IllegalArgumentException("Span ends before it starts: " + describe(
                    startLine, startColumn, endLine, endColumn));
        }
    }

    /**
     * Builds a span from 0-based parser points.
     */
    public static SourceSpan fromZeroBased(int startRow, int startColumn, int endRow, int endColumn) {
        return new SourceSpan(startRow + 1, startColumn + 1, endRow + 1, endColumn + 1);
    }

    /**
     * Single-line placeholder span used when only a start line is known.
     */
    public static SourceSpan ofLine(int line) {
        int safeLine = Math.max(line, 1);
        return new SourceSpan(safeLine, 1, safeLine, 1);
    }

    public boolean contains(SourceSpan other) {
        return !isBefore(other.startLine, other.startColumn, startLine, startColumn)
                && !isBefore(endLine, endColumn, other.endLine, other.endColumn);
    }

    private static boolean isBefore(int line, int column, int otherLine, int otherColumn) {
        return line < otherLine || (line == otherLine && column < otherColumn);
    }

    private static String describe(int startLine, int startColumn, int endLine, int endColumn) {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
