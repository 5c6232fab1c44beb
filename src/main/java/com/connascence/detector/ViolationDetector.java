package com.connascence.detector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

import com.connascence.api.Violation;
import com.connascence.ast.NormalizedNode;
import com.connascence.config.PatternRegistry;
import com.connascence.detector.rules.FunctionLengthRule;
import com.connascence.detector.rules.GodClassRule;
import com.connascence.detector.rules.MagicLiteralRule;
import com.connascence.detector.rules.NamingConventionRule;
import com.connascence.detector.rules.NestingDepthRule;
import com.connascence.detector.rules.ParameterCountRule;
import com.connascence.plugins.Language;
import com.connascence.util.LoggerUtil;

/**
 * Runs independent detection rules over a tree. Holds no per-call state.
 */
public class ViolationDetector {
    private static final Logger logger = LoggerUtil.getLogger(ViolationDetector.class);

    private final List<DetectionRule> rules;

    public ViolationDetector(List<DetectionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static ViolationDetector withDefaultRules() {
        return new ViolationDetector(List.of(
                new MagicLiteralRule(),
                new ParameterCountRule(),
                new FunctionLengthRule(),
                new NestingDepthRule(),
                new NamingConventionRule(),
                new GodClassRule()));
    }

    /**
     * All violations in the tree, ordered by line and column; rules keep their order on ties.
     */
    public List<Violation> detect(NormalizedNode root, Language language, PatternRegistry registry,
                                  String filePath) {
        RuleContext context = new RuleContext(root, language, registry, filePath);
        return detect(context);
    }

    public List<Violation> detect(RuleContext context) {
        List<Violation> violations = new ArrayList<>();
        for (DetectionRule rule : rules) {
            List<Violation> found = rule.detect(context);
            if (!found.isEmpty()) {
                logger.fine("Rule " + rule.id() + " reported " + found.size() + " violations");
            }
            violations.addAll(found);
        }
        violations.sort(Comparator.comparingInt(Violation::getLine).thenComparingInt(Violation::getColumn));
        return violations;
    }

    public List<DetectionRule> getRules() {
        return rules;
    }
}
