package com.connascence.refactor;

/**
 * What a candidate points at. Each variant carries only what its handlers need to find the code
 * again, so a target survives edits made earlier in a batch.
 */
public sealed interface RefactoringTarget permits MagicNumberTarget, FunctionTarget, FunctionGroupTarget {

    /**
     * Short human-readable form used in logs and messages.
     */
    String describe();
}
