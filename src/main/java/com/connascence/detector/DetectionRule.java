package com.connascence.detector;

import java.util.List;

import com.connascence.api.Violation;

/**
 * An independent visitor producing violations for one pattern.
 */
public interface DetectionRule {
    /**
     * Rule id carried by the violations this rule reports.
     */
    String id();

    List<Violation> detect(RuleContext context);
}
