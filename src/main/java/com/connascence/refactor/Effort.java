package com.connascence.refactor;

import java.util.Locale;

/**
 * Estimated effort of applying a candidate. Batches run cheaper candidates first.
 */
public enum Effort {
    LOW,
    MEDIUM,
    HIGH;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
