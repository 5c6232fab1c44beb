package com.connascence.refactor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Offset-based edits against one source text, applied together. Insertions at the same offset
 * keep the order they were added in and come before a replacement starting there.
 */
public class TextEdits {
    private final String source;
    private final List<Edit> edits = new ArrayList<>();

    public TextEdits(String source) {
        this.source = source;
    }

    public TextEdits insert(int offset, String text) {
        return replace(offset, offset, text);
    }

    public TextEdits replace(int start, int end, String text) {
        if (start < 0 || end > source.length() || start > end) {
            throw new TransformationException("Edit range " + start + ".." + end + " is outside the source");
        }
        edits.add(new Edit(start, end, text, edits.size()));
        return this;
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    public String apply() {
        List<Edit> ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparingInt((Edit e) -> e.start)
                .thenComparing(e -> e.start != e.end)
                .thenComparingInt(e -> e.order));

        StringBuilder result = new StringBuilder(source.length() + 64);
        int cursor = 0;
        for (Edit edit : ordered) {
            if (edit.start < cursor) {
                throw new TransformationException("Overlapping edits at offset " + edit.start);
            }
            result.append(source, cursor, edit.start).append(edit.text);
            cursor = edit.end;
        }
        result.append(source, cursor, source.length());
        return result.toString();
    }

    private static final class Edit {
        private final int start;
        private final int end;
        private final String text;
        private final int order;

        private Edit(int start, int end, String text, int order) {
            this.start = start;
            this.end = end;
            this.text = text;
            this.order = order;
        }
    }
}
