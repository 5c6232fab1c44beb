package com.connascence.overlay;

import com.connascence.api.error.Severity;

/**
 * A construct found in a tree that an overlay rule forbids.
 */
public class OverlayViolation {
    private final String ruleId;
    private final SafetyRule category;
    private final String message;
    private final int line;
    private final int column;
    private final Severity severity;

    public OverlayViolation(String ruleId, SafetyRule category, String message, int line, int column,
                            Severity severity) {
        this.ruleId = ruleId;
        this.category = category;
        this.message = message;
        this.line = line;
        this.column = column;
        this.severity = severity;
    }

    // Getters
    public String getRuleId() { return ruleId; }
    public SafetyRule getCategory() { return category; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public Severity getSeverity() { return severity; }

    @Override
    public String toString() {
        return severity.label() + " " + ruleId + " at " + line + ":" + column + " - " + message;
    }
}
