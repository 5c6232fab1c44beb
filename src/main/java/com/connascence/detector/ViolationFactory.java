package com.connascence.detector;

import com.connascence.api.Violation;
import com.connascence.api.ViolationKind;
import com.connascence.api.error.Severity;
import com.connascence.ast.NormalizedNode;
import com.connascence.overlay.OverlayViolation;

/**
 * Creates violations for one file, located at tree nodes.
 */
public class ViolationFactory {
    private final String filePath;

    public ViolationFactory(String filePath) {
        this.filePath = filePath == null ? "<unknown>" : filePath;
    }

    public Violation.Builder at(NormalizedNode node, String ruleId, ViolationKind kind, Severity severity) {
        return Violation.builder()
                .filePath(filePath)
                .ruleId(ruleId)
                .kind(kind)
                .severity(severity)
                .line(Math.max(node.getStartLine(), 1))
                .column(node.getSpan().getStartColumn());
    }

    /**
     * An overlay finding reported as a violation of its safety category.
     */
    public Violation fromOverlay(OverlayViolation violation) {
        return Violation.builder()
                .filePath(filePath)
                .ruleId(violation.getRuleId())
                .kind(violation.getCategory())
                .severity(violation.getSeverity())
                .line(Math.max(violation.getLine(), 1))
                .column(violation.getColumn())
                .description(violation.getMessage())
                .context("safety")
                .build();
    }
}
