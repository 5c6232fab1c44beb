package com.connascence.api.error;

import java.util.Locale;

/**
 * Severity of a violation or overlay finding, ordered from most to least severe.
 */
public enum Severity {
    CRITICAL(27), // Safety rules that must never be violated
    HIGH(9),      // Strong coupling in guards and comparisons
    MEDIUM(3),    // Coupling that deserves a refactoring
    LOW(1);       // Informational

    private final int weight;

    Severity(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * One tier less severe; LOW stays LOW.
     */
    public Severity lower() {
        return switch (this) {
            case CRITICAL -> HIGH;
            case HIGH -> MEDIUM;
            case MEDIUM, LOW -> LOW;
        };
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) <= 0;
    }

    public static Severity fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
