package com.connascence.overlay;

import java.util.Locale;

import com.connascence.api.ViolationKind;

/**
 * Safety rule categories of the Power-of-Ten style overlays.
 */
public enum SafetyRule implements ViolationKind {
    CONTROL_FLOW(10),
    DYNAMIC_EXECUTION(10),
    RECURSION(8),
    INDIRECTION(6),
    DYNAMIC_MEMORY(6),
    ASSERTION_DENSITY(4);

    private final int weight;

    SafetyRule(int weight) {
        this.weight = weight;
    }

    @Override
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public int getWeight() {
        return weight;
    }

    public static SafetyRule fromCode(String code) {
        return valueOf(code.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
