package com.codeviz.core.parser.base;

import com.codeviz.core.parser.SourceRange;
import com.codeviz.core.parser.SyntaxTree;
import org.treesitter.TSNode;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-sitter parse result together with the text it was parsed from.
 *
 * <p>Tree-sitter reports columns as UTF-8 byte offsets; {@link #toRange(TSNode)}
 * converts them to character columns on the affected lines.
 *
 * @since 1.0.0
 */
public final class TreeSitterSyntaxTree implements SyntaxTree {

    private final String language;
    private final String source;
    // held so the native tree outlives every node handed out from it
    private final TSTree tree;
    private final TSNode rootNode;
    private int[] lineStarts;

    TreeSitterSyntaxTree(String language, String source, TSTree tree, TSNode rootNode) {
        this.language = language;
        this.source = source;
        this.tree = tree;
        this.rootNode = rootNode;
    }

    @Override
    public String getLanguage() {
        return language;
    }

    @Override
    public String getSource() {
        return source;
    }

    @Override
    public boolean hasErrors() {
        return rootNode.hasError();
    }

    public TSNode getRootNode() {
        return rootNode;
    }

    /**
     * Converts a node's extent to a character-based range.
     *
     * @param node node of this tree
     * @return range with UTF-16 columns
     */
    public SourceRange toRange(TSNode node) {
        TSPoint start = node.getStartPoint();
        TSPoint end = node.getEndPoint();
        return new SourceRange(
            start.getRow(),
            toCharColumn(start.getRow(), start.getColumn()),
            end.getRow(),
            toCharColumn(end.getRow(), end.getColumn())
        );
    }

    /**
     * Maps a UTF-8 byte column on a line to the corresponding character column.
     */
    int toCharColumn(int row, int byteColumn) {
        int[] starts = lineStarts();
        if (row >= starts.length || byteColumn == 0) {
            return byteColumn;
        }
        int index = starts[row];
        int bytes = 0;
        while (bytes < byteColumn && index < source.length()) {
            char c = source.charAt(index);
            if (c == '\n') {
                break;
            }
            if (Character.isHighSurrogate(c) && index + 1 < source.length()
                    && Character.isLowSurrogate(source.charAt(index + 1))) {
                bytes += 4;
                index += 2;
                continue;
            }
            bytes += c < 0x80 ? 1 : c < 0x800 ? 2 : 3;
            index++;
        }
        return index - starts[row];
    }

    private int[] lineStarts() {
        if (lineStarts == null) {
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < source.length(); i++) {
                if (source.charAt(i) == '\n') {
                    starts.add(i + 1);
                }
            }
            lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        }
        return lineStarts;
    }
}
