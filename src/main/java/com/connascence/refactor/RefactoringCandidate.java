package com.connascence.refactor;

import java.util.Objects;

/**
 * A proposed, not yet applied refactoring with its estimated effort and safety impact.
 */
public class RefactoringCandidate {
    private final RefactoringTechnique technique;
    private final RefactoringTarget target;
    private final String filePath;
    private final int startLine;
    private final int endLine;
    private final String description;
    private final String rationale;
    private final Effort estimatedEffort;
    private final SafetyImpact safetyImpact;
    private final String connascenceImprovement;

    private RefactoringCandidate(Builder builder) {
        this.technique = Objects.requireNonNull(builder.technique, "technique");
        this.target = Objects.requireNonNull(builder.target, "target");
        this.filePath = builder.filePath;
        this.startLine = builder.startLine;
        this.endLine = Math.max(builder.endLine, builder.startLine);
        this.description = builder.description;
        this.rationale = builder.rationale;
        this.estimatedEffort = builder.estimatedEffort;
        this.safetyImpact = builder.safetyImpact;
        this.connascenceImprovement = builder.connascenceImprovement;
    }

    // Getters
    public RefactoringTechnique getTechnique() { return technique; }
    public RefactoringTarget getTarget() { return target; }
    public String getFilePath() { return filePath; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public String getDescription() { return description; }
    public String getRationale() { return rationale; }
    public Effort getEstimatedEffort() { return estimatedEffort; }
    public SafetyImpact getSafetyImpact() { return safetyImpact; }
    public String getConnascenceImprovement() { return connascenceImprovement; }

    /**
     * The target as the variant a handler expects.
     *
     * @throws TransformationException when the candidate carries another kind of target
     */
    public <T extends RefactoringTarget> T target(Class<T> type) {
        if (!type.isInstance(target)) {
            throw new TransformationException(technique.getId() + " cannot be applied to " + target.describe());
        }
        return type.cast(target);
    }

    @Override
    public String toString() {
        return technique.getId() + " [" + startLine + "-" + endLine + "] " + description;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RefactoringTechnique technique;
        private RefactoringTarget target;
        private String filePath = "<unknown>";
        private int startLine = 1;
        private int endLine = 1;
        private String description = "";
        private String rationale = "";
        private Effort estimatedEffort = Effort.MEDIUM;
        private SafetyImpact safetyImpact = SafetyImpact.NONE;
        private String connascenceImprovement = "";

        public Builder technique(RefactoringTechnique technique) {
            this.technique = technique;
            return this;
        }

        public Builder target(RefactoringTarget target) {
            this.target = target;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder lines(int startLine, int endLine) {
            this.startLine = startLine;
            this.endLine = endLine;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder rationale(String rationale) {
            this.rationale = rationale;
            return this;
        }

        public Builder estimatedEffort(Effort estimatedEffort) {
            this.estimatedEffort = estimatedEffort;
            return this;
        }

        public Builder safetyImpact(SafetyImpact safetyImpact) {
            this.safetyImpact = safetyImpact;
            return this;
        }

        public Builder connascenceImprovement(String connascenceImprovement) {
            this.connascenceImprovement = connascenceImprovement;
            return this;
        }

        public RefactoringCandidate build() {
            return new RefactoringCandidate(this);
        }
    }
}
