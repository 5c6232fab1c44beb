package com.connascence.api;

/**
 * Classification of a violation: a connascence kind or a safety rule category.
 */
public interface ViolationKind {
    /**
     * Short stable code, for example {@code CoM} or {@code control_flow}.
     */
    String code();

    /**
     * Base weight multiplied by the severity weight of each violation of this kind.
     */
    int getWeight();
}
