package com.codeviz.core.parser;

import java.util.Comparator;

/**
 * Region of source text.
 *
 * <p>Rows are 0-based line indexes; columns are 0-based UTF-16 character offsets
 * within the line. The end position is exclusive.
 *
 * @param startRow first line of the range
 * @param startColumn column where the range starts on {@code startRow}
 * @param endRow last line of the range
 * @param endColumn column just past the range on {@code endRow}
 */
public record SourceRange(
    int startRow,
    int startColumn,
    int endRow,
    int endColumn
) {
    /** Orders ranges by start position. */
    public static final Comparator<SourceRange> BY_START =
        Comparator.comparingInt(SourceRange::startRow).thenComparingInt(SourceRange::startColumn);

    /**
     * Compact constructor with validation.
     */
    public SourceRange {
        if (startRow < 0 || startColumn < 0 || endRow < 0 || endColumn < 0) {
            throw new IllegalArgumentException("Negative position in range");
        }
        if (endRow < startRow || (endRow == startRow && endColumn < startColumn)) {
            throw new IllegalArgumentException(
                "Range end precedes start: " + startRow + ":" + startColumn + "-" + endRow + ":" + endColumn);
        }
    }

    /**
     * Checks whether the character at a position falls inside this range.
     *
     * @param row line index
     * @param column character index within the line
     * @return true if covered
     */
    public boolean covers(int row, int column) {
        if (row < startRow || row > endRow) {
            return false;
        }
        if (row == startRow && column < startColumn) {
            return false;
        }
        return row != endRow || column < endColumn;
    }
}
