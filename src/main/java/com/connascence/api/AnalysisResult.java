package com.connascence.api;

import java.util.ArrayList;
import java.util.List;

import com.connascence.api.error.AnalysisError;
import com.connascence.plugins.Language;
import com.connascence.refactor.RefactoringCandidate;

/**
 * Violations and refactoring candidates found in one unit, or the errors that prevented analysis.
 */
public class AnalysisResult {
    private final boolean successful;
    private final Language language;
    private final List<Violation> violations;
    private final List<RefactoringCandidate> candidates;
    private final List<AnalysisError> errors;

    private AnalysisResult(Builder builder) {
        this.successful = builder.successful;
        this.language = builder.language;
        this.violations = List.copyOf(builder.violations);
        this.candidates = List.copyOf(builder.candidates);
        this.errors = List.copyOf(builder.errors);
    }

    // Getters
    public boolean isSuccessful() { return successful; }
    public Language getLanguage() { return language; }
    public List<Violation> getViolations() { return violations; }
    public List<RefactoringCandidate> getCandidates() { return candidates; }
    public List<AnalysisError> getErrors() { return errors; }

    /**
     * Sum of all violation weights.
     */
    public int totalWeight() {
        return violations.stream().mapToInt(Violation::getWeight).sum();
    }

    public List<Violation> violationsOf(String ruleId) {
        List<Violation> result = new ArrayList<>();
        for (Violation violation : violations) {
            if (violation.getRuleId().equals(ruleId)) {
                result.add(violation);
            }
        }
        return result;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private Language language = Language.UNKNOWN;
        private List<Violation> violations = new ArrayList<>();
        private List<RefactoringCandidate> candidates = new ArrayList<>();
        private List<AnalysisError> errors = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder language(Language language) {
            this.language = language;
            return this;
        }

        public Builder violations(List<Violation> violations) {
            this.violations = new ArrayList<>(violations);
            return this;
        }

        public Builder candidates(List<RefactoringCandidate> candidates) {
            this.candidates = new ArrayList<>(candidates);
            return this;
        }

        public Builder errors(List<AnalysisError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public AnalysisResult build() {
            return new AnalysisResult(this);
        }
    }
}
