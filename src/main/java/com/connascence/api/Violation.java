package com.connascence.api;

import java.util.Objects;

import com.connascence.api.error.Severity;

/**
 * A detected coupling or safety problem. The weight is derived from kind and severity.
 */
public class Violation {
    private final String id;
    private final String ruleId;
    private final ViolationKind kind;
    private final Severity severity;
    private final String filePath;
    private final int line;
    private final int column;
    private final String description;
    private final int weight;
    private final String context;
    private final String suggestedName;

    private Violation(Builder builder) {
        this.ruleId = Objects.requireNonNull(builder.ruleId, "ruleId");
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.severity = Objects.requireNonNull(builder.severity, "severity");
        if (builder.line < 1) {
            throw new IllegalArgumentException("Violation line must be >= 1, got " + builder.line);
        }
        this.filePath = builder.filePath;
        this.line = builder.line;
        this.column = Math.max(builder.column, 1);
        this.description = builder.description;
        this.context = builder.context;
        this.suggestedName = builder.suggestedName;
        this.weight = kind.getWeight() * severity.getWeight();
        this.id = ruleId + ":" + filePath + ":" + line + ":" + column;
    }

    // Getters
    public String getId() { return id; }
    public String getRuleId() { return ruleId; }
    public ViolationKind getKind() { return kind; }
    public Severity getSeverity() { return severity; }
    public String getFilePath() { return filePath; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getDescription() { return description; }
    public int getWeight() { return weight; }
    public String getContext() { return context; }

    /**
     * Constant name proposed for a magic literal, null for other rules.
     */
    public String getSuggestedName() { return suggestedName; }

    @Override
    public String toString() {
        return severity.label() + " " + ruleId + " at " + filePath + ":" + line + ":" + column + " - " + description;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleId;
        private ViolationKind kind;
        private Severity severity;
        private String filePath = "<unknown>";
        private int line = 1;
        private int column = 1;
        private String description = "";
        private String context = "default";
        private String suggestedName;

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder kind(ViolationKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder line(int line) {
            this.line = line;
            return this;
        }

        public Builder column(int column) {
            this.column = column;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder context(String context) {
            this.context = context;
            return this;
        }

        public Builder suggestedName(String suggestedName) {
            this.suggestedName = suggestedName;
            return this;
        }

        public Violation build() {
            return new Violation(this);
        }
    }
}
