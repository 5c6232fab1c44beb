package com.connascence.config;

import java.util.Objects;

/**
 * A named policy: detection thresholds plus refactoring behavior.
 */
public class Policy {
    private final String name;
    private final PatternRegistry registry;
    private final RefactoringPolicy refactoringPolicy;

    public Policy(String name, PatternRegistry registry, RefactoringPolicy refactoringPolicy) {
        this.name = Objects.requireNonNull(name, "name");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.refactoringPolicy = Objects.requireNonNull(refactoringPolicy, "refactoringPolicy");
    }

    public static Policy defaults() {
        return new Policy("default", PatternRegistry.defaults(), RefactoringPolicy.defaults());
    }

    // Getters
    public String getName() { return name; }
    public PatternRegistry getRegistry() { return registry; }
    public RefactoringPolicy getRefactoringPolicy() { return refactoringPolicy; }
}
