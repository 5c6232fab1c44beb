package com.connascence.api.error;

import java.util.Objects;

/**
 * A failure found while parsing, validating or transforming a unit.
 */
public class AnalysisError {
    private final ErrorKind kind;
    private final String message;
    private final int line;
    private final int column;

    public AnalysisError(ErrorKind kind, String message, int line, int column) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = Objects.requireNonNull(message, "message");
        this.line = line;
        this.column = column;
    }

    public static AnalysisError syntax(String message, int line, int column) {
        return new AnalysisError(ErrorKind.SYNTAX_ERROR, message, line, column);
    }

    // Getters
    public ErrorKind getKind() { return kind; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    @Override
    public String toString() {
        return kind + " at " + line + ":" + column + ": " + message;
    }
}
