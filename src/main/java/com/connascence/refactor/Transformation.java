package com.connascence.refactor;

import java.util.List;

/**
 * The text a handler produced, with notes on what it changed and what it left alone.
 */
public class Transformation {
    private final String code;
    private final List<String> changes;
    private final List<String> warnings;

    public Transformation(String code, List<String> changes, List<String> warnings) {
        this.code = code;
        this.changes = List.copyOf(changes);
        this.warnings = List.copyOf(warnings);
    }

    public static Transformation unchanged(String code, String reason) {
        return new Transformation(code, List.of(), List.of(reason));
    }

    // Getters
    public String getCode() { return code; }
    public List<String> getChanges() { return changes; }
    public List<String> getWarnings() { return warnings; }
}
