package com.connascence.api;

/**
 * Terminal state of one refactoring attempt.
 */
public enum RefactoringOutcome {
    APPLIED,
    REJECTED,
    // the handler left the text unchanged
    SKIPPED
}
