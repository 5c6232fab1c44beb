package com.connascence.refactor;

import java.util.List;

/**
 * Several functions considered together, such as structurally similar duplicates.
 */
public final class FunctionGroupTarget implements RefactoringTarget {
    private final List<String> names;

    public FunctionGroupTarget(List<String> names) {
        this.names = List.copyOf(names);
    }

    public List<String> getNames() {
        return names;
    }

    @Override
    public String describe() {
        return "functions " + names;
    }
}
