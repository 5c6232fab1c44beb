package com.connascence.refactor;

import java.util.Objects;

/**
 * A function located by name. The line is a hint that picks the closest definition when a name
 * is defined more than once.
 */
public final class FunctionTarget implements RefactoringTarget {
    private final String name;
    private final int line;

    public FunctionTarget(String name, int line) {
        this.name = Objects.requireNonNull(name, "name");
        this.line = line;
    }

    public String getName() { return name; }
    public int getLine() { return line; }

    @Override
    public String describe() {
        return "function " + name;
    }
}
