package com.connascence.ast;

/**
 * Source location of a node: 1-based lines and columns plus character offsets into the source text.
 */
public final class Span {
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;
    private final int startOffset;
    private final int endOffset;

    public Span(int startLine, int startColumn, int endLine, int endColumn, int startOffset, int endOffset) {
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    /**
     * A line-only span, used by candidates that cover a range of lines.
     */
    public static Span ofLines(int startLine, int endLine) {
        return new Span(startLine, 1, endLine, 1, -1, -1);
    }

    public int getStartLine() { return startLine; }
    public int getStartColumn() { return startColumn; }
    public int getEndLine() { return endLine; }
    public int getEndColumn() { return endColumn; }
    public int getStartOffset() { return startOffset; }
    public int getEndOffset() { return endOffset; }

    public int lineCount() {
        return endLine - startLine + 1;
    }

    public boolean hasOffsets() {
        return startOffset >= 0 && endOffset >= startOffset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span other = (Span) o;
        return startLine == other.startLine && startColumn == other.startColumn
                && endLine == other.endLine && endColumn == other.endColumn
                && startOffset == other.startOffset && endOffset == other.endOffset;
    }

    @Override
    public int hashCode() {
        int result = startLine;
        result = 31 * result + startColumn;
        result = 31 * result + endLine;
        result = 31 * result + endColumn;
        result = 31 * result + startOffset;
        return 31 * result + endOffset;
    }

    @Override
    public String toString() {
        return "(" + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn + ")";
    }
}
