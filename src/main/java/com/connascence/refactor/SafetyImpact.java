package com.connascence.refactor;

import java.util.Locale;

/**
 * How much a candidate improves safety. Batches run higher impact candidates first.
 */
public enum SafetyImpact {
    NONE,
    LOW,
    MEDIUM,
    HIGH;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
