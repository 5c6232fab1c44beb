package com.connascence.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Converts between character offsets and 1-based line/column positions of a source text.
 */
public final class LineMap {
    private final String source;
    private final int[] lineStarts;

    public LineMap(String source) {
        this.source = source;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = new int[starts.size()];
        for (int i = 0; i < lineStarts.length; i++) {
            lineStarts[i] = starts.get(i);
        }
    }

    public String getSource() {
        return source;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public int lineOf(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        if (idx < 0) {
            idx = -idx - 2;
        }
        return idx + 1;
    }

    public int columnOf(int offset) {
        return offset - lineStarts[lineOf(offset) - 1] + 1;
    }

    /**
     * Offset of a 1-based line/column position, clamped to the text.
     */
    public int offsetOf(int line, int column) {
        if (line < 1) {
            return 0;
        }
        if (line > lineStarts.length) {
            return source.length();
        }
        return Math.min(lineStarts[line - 1] + Math.max(column, 1) - 1, source.length());
    }

    public int lineStart(int line) {
        return offsetOf(line, 1);
    }

    /**
     * Offset just past the end of a line, newline included.
     */
    public int lineEnd(int line) {
        if (line >= lineStarts.length) {
            return source.length();
        }
        return lineStarts[line];
    }

    public Span span(int startOffset, int endOffset) {
        return new Span(lineOf(startOffset), columnOf(startOffset),
                lineOf(endOffset), columnOf(endOffset), startOffset, endOffset);
    }

    /**
     * Leading whitespace of the line containing the offset.
     */
    public String indentationAt(int offset) {
        int start = lineStarts[lineOf(offset) - 1];
        int end = start;
        while (end < source.length() && (source.charAt(end) == ' ' || source.charAt(end) == '\t')) {
            end++;
        }
        return source.substring(start, end);
    }
}
