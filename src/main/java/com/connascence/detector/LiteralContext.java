package com.connascence.detector;

import java.util.Locale;

import com.connascence.api.error.Severity;

/**
 * Syntactic usage context of a literal.
 */
public enum LiteralContext {
    CONDITION,
    COMPARISON,
    ASSIGNMENT,
    ARGUMENT,
    RETURN,
    DEFAULT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Severity of a magic number in this context; strings sit one tier lower.
     */
    public Severity numericSeverity() {
        return switch (this) {
            case CONDITION, COMPARISON -> Severity.HIGH;
            case ASSIGNMENT, ARGUMENT -> Severity.MEDIUM;
            case RETURN, DEFAULT -> Severity.LOW;
        };
    }

    public Severity stringSeverity() {
        return numericSeverity().lower();
    }
}
