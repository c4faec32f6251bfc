package org.pragmatica.pddl.tree;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * Position resolver over a text snapshot. Line starts are indexed once, lookups use binary search.
 */
public final class LinePositionResolver implements PositionResolver {
    private final String text;
    private final int[] lineStarts;

    private LinePositionResolver(String text) {
        this.text = text;
        this.lineStarts = indexLines(text);
    }

    public static LinePositionResolver of(String text) {
        return new LinePositionResolver(text);
    }

    private static int[] indexLines(String text) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream()
                     .mapToInt(Integer::intValue)
                     .toArray();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    @Override
    public SourceLocation resolveToLocation(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IllegalArgumentException("Offset " + offset + " is outside of text of length " + text.length());
        }
        int found = Arrays.binarySearch(lineStarts, offset);
        int line = found >= 0
                   ? found
                   : -found - 2;
        return SourceLocation.at(line, offset - lineStarts[line], offset);
    }

    @Override
    public int resolveToOffset(int line, int column) {
        if (line < 0 || line >= lineStarts.length) {
            throw new IllegalArgumentException("Line " + line + " does not exist, text has " + lineStarts.length
                                               + " lines");
        }
        int lineEnd = line + 1 < lineStarts.length
                      ? lineStarts[line + 1] - 1
                      : text.length();
        return Math.min(lineStarts[line] + Math.max(column, 0), lineEnd);
    }
}
