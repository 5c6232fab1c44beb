package com.connascence.api;

import java.util.ArrayList;
import java.util.List;

import com.connascence.api.error.ErrorKind;
import com.connascence.refactor.RefactoringTechnique;

/**
 * Result of applying one refactoring, or a batch of them. On rejection {@code refactoredCode}
 * never carries an unvalidated edit.
 */
public class RefactoringResult {
    private final boolean success;
    private final RefactoringOutcome outcome;
    private final RefactoringTechnique technique;
    private final String originalCode;
    private final String refactoredCode;
    private final List<String> changesApplied;
    private final List<String> validationErrors;
    private final List<String> warnings;
    private final ErrorKind errorKind;

    private RefactoringResult(Builder builder) {
        this.outcome = builder.outcome;
        this.success = builder.outcome != RefactoringOutcome.REJECTED;
        this.technique = builder.technique;
        this.originalCode = builder.originalCode;
        this.refactoredCode = builder.refactoredCode;
        this.changesApplied = List.copyOf(builder.changesApplied);
        this.validationErrors = List.copyOf(builder.validationErrors);
        this.warnings = List.copyOf(builder.warnings);
        this.errorKind = builder.errorKind;
    }

    public boolean isSuccess() {
        return success;
    }

    public RefactoringOutcome getOutcome() {
        return outcome;
    }

    public RefactoringTechnique getTechnique() {
        return technique;
    }

    public String getOriginalCode() {
        return originalCode;
    }

    public String getRefactoredCode() {
        return refactoredCode;
    }

    public List<String> getChangesApplied() {
        return changesApplied;
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Structured reason of a rejection, null when the refactoring was not rejected.
     */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RefactoringOutcome outcome = RefactoringOutcome.APPLIED;
        private RefactoringTechnique technique;
        private String originalCode;
        private String refactoredCode;
        private List<String> changesApplied = new ArrayList<>();
        private List<String> validationErrors = new ArrayList<>();
        private List<String> warnings = new ArrayList<>();
        private ErrorKind errorKind;

        public Builder outcome(RefactoringOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder technique(RefactoringTechnique technique) {
            this.technique = technique;
            return this;
        }

        public Builder originalCode(String originalCode) {
            this.originalCode = originalCode;
            return this;
        }

        public Builder refactoredCode(String refactoredCode) {
            this.refactoredCode = refactoredCode;
            return this;
        }

        public Builder addChange(String change) {
            this.changesApplied.add(change);
            return this;
        }

        public Builder changesApplied(List<String> changes) {
            this.changesApplied = new ArrayList<>(changes);
            return this;
        }

        public Builder addValidationError(String error) {
            this.validationErrors.add(error);
            return this;
        }

        public Builder validationErrors(List<String> errors) {
            this.validationErrors = new ArrayList<>(errors);
            return this;
        }

        public Builder addWarning(String warning) {
            this.warnings.add(warning);
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings = new ArrayList<>(warnings);
            return this;
        }

        public Builder errorKind(ErrorKind errorKind) {
            this.errorKind = errorKind;
            return this;
        }

        /**
         * Marks the result rejected, keeping the original text as the refactored code.
         */
        public Builder rejected(ErrorKind kind, String error) {
            this.outcome = RefactoringOutcome.REJECTED;
            this.errorKind = kind;
            this.refactoredCode = originalCode;
            this.validationErrors.add(error);
            return this;
        }

        public RefactoringResult build() {
            return new RefactoringResult(this);
        }
    }
}
