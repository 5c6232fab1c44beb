package com.connascence.overlay;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import com.connascence.api.error.Severity;

/**
 * One rule of a safety overlay. A rule matches forbidden node types, calls to forbidden names,
 * self-recursive calls, or functions with too few assertions, and may forbid tokens outright.
 */
public final class OverlayRule {
    private final String id;
    private final String name;
    private final String description;
    private final Severity severity;
    private final SafetyRule category;
    private final Set<String> nodeTypes;
    private final Set<String> callNames;
    private final Set<String> tokens;
    private final boolean recursion;
    private final int minAssertions;

    private OverlayRule(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.name = builder.name == null ? builder.id : builder.name;
        this.description = builder.description == null ? this.name : builder.description;
        this.severity = Objects.requireNonNull(builder.severity, "severity");
        this.category = Objects.requireNonNull(builder.category, "category");
        this.nodeTypes = Set.copyOf(builder.nodeTypes);
        this.callNames = Set.copyOf(builder.callNames);
        this.tokens = Set.copyOf(builder.tokens);
        this.recursion = builder.recursion;
        this.minAssertions = builder.minAssertions;
    }

    // Getters
    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public Severity getSeverity() { return severity; }
    public SafetyRule getCategory() { return category; }
    public Set<String> getNodeTypes() { return nodeTypes; }
    public Set<String> getCallNames() { return callNames; }
    public Set<String> getTokens() { return tokens; }
    public boolean isRecursion() { return recursion; }
    public int getMinAssertions() { return minAssertions; }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private String name;
        private String description;
        private Severity severity = Severity.HIGH;
        private SafetyRule category;
        private Set<String> nodeTypes = new LinkedHashSet<>();
        private Set<String> callNames = new LinkedHashSet<>();
        private Set<String> tokens = new LinkedHashSet<>();
        private boolean recursion;
        private int minAssertions;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder category(SafetyRule category) {
            this.category = category;
            return this;
        }

        public Builder nodeTypes(Set<String> nodeTypes) {
            this.nodeTypes = new LinkedHashSet<>(nodeTypes);
            return this;
        }

        public Builder callNames(Set<String> callNames) {
            this.callNames = new LinkedHashSet<>(callNames);
            return this;
        }

        public Builder tokens(Set<String> tokens) {
            this.tokens = new LinkedHashSet<>(tokens);
            return this;
        }

        public Builder recursion(boolean recursion) {
            this.recursion = recursion;
            return this;
        }

        public Builder minAssertions(int minAssertions) {
            this.minAssertions = minAssertions;
            return this;
        }

        public OverlayRule build() {
            return new OverlayRule(this);
        }
    }
}
