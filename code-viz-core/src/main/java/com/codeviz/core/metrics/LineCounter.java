package com.codeviz.core.metrics;

import com.codeviz.core.parser.SourceRange;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Counts lines of code given the comment ranges of a file.
 *
 * <p>A physical line counts when at least one non-whitespace character on it lies
 * outside every comment range. Lines are separated by {@code \n}; a trailing
 * {@code \r} belongs to the line break, and the empty segment after a final newline
 * is not a line.
 *
 * @since 1.0.0
 */
public final class LineCounter {

    private LineCounter() {
        // Utility class
    }

    /**
     * Counts code lines.
     *
     * @param source file content
     * @param commentRanges comment ranges, in any order
     * @return number of lines holding code
     */
    public static int countCodeLines(String source, List<SourceRange> commentRanges) {
        List<SourceRange> pending = new ArrayList<>(commentRanges);
        pending.sort(SourceRange.BY_START);
        Iterator<SourceRange> upcoming = pending.iterator();
        SourceRange next = upcoming.hasNext() ? upcoming.next() : null;
        List<SourceRange> active = new ArrayList<>();

        int count = 0;
        int row = 0;
        int lineStart = 0;
        int length = source.length();
        while (lineStart < length) {
            int newline = source.indexOf('\n', lineStart);
            int lineEnd = newline >= 0 ? newline : length;
            int contentEnd = lineEnd;
            if (contentEnd > lineStart && source.charAt(contentEnd - 1) == '\r') {
                contentEnd--;
            }

            final int currentRow = row;
            active.removeIf(range -> range.endRow() < currentRow);
            while (next != null && next.startRow() <= row) {
                if (next.endRow() >= row) {
                    active.add(next);
                }
                next = upcoming.hasNext() ? upcoming.next() : null;
            }

            if (hasCode(source, lineStart, contentEnd, row, active)) {
                count++;
            }

            if (newline < 0) {
                break;
            }
            lineStart = newline + 1;
            row++;
        }
        return count;
    }

    private static boolean hasCode(String source, int lineStart, int lineEnd, int row, List<SourceRange> active) {
        for (int i = lineStart; i < lineEnd; i++) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                continue;
            }
            if (!isCommented(active, row, i - lineStart)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isCommented(List<SourceRange> active, int row, int column) {
        for (SourceRange range : active) {
            if (range.covers(row, column)) {
                return true;
            }
        }
        return false;
    }
}
