package com.connascence.api;

import java.util.List;

import com.connascence.api.error.AnalysisError;
import com.connascence.overlay.OverlayViolation;

/**
 * Outcome of checking code for syntax and, optionally, against a safety overlay.
 */
public class ValidationResult {
    private final boolean valid;
    private final List<AnalysisError> errors;
    private final List<OverlayViolation> overlayViolations;

    public ValidationResult(List<AnalysisError> errors, List<OverlayViolation> overlayViolations) {
        this.errors = List.copyOf(errors);
        this.overlayViolations = List.copyOf(overlayViolations);
        this.valid = this.errors.isEmpty() && this.overlayViolations.isEmpty();
    }

    // Getters
    public boolean isValid() { return valid; }
    public List<AnalysisError> getErrors() { return errors; }
    public List<OverlayViolation> getOverlayViolations() { return overlayViolations; }
}
