package com.connascence.detector.rules;

import java.util.ArrayList;
import java.util.List;

import com.connascence.api.ConnascenceKind;
import com.connascence.api.Violation;
import com.connascence.api.error.Severity;
import com.connascence.ast.ClassInfo;
import com.connascence.detector.DetectionRule;
import com.connascence.detector.RuleContext;

/**
 * Classes whose method count exceeds the threshold. Severity grows with the excess.
 */
public class GodClassRule implements DetectionRule {
    public static final String RULE_ID = "god_class";

    @Override
    public String id() {
        return RULE_ID;
    }

    @Override
    public List<Violation> detect(RuleContext context) {
        int max = context.getRegistry().getMaxMethodCount();
        List<Violation> violations = new ArrayList<>();
        for (ClassInfo type : context.getClasses()) {
            int count = type.getMethodCount();
            if (count > max) {
                violations.add(context.violations()
                        .at(type.getNode(), RULE_ID, ConnascenceKind.ALGORITHM, severityFor(count - max))
                        .description("Class '" + type.getName() + "' has " + count + " methods (max " + max + ")")
                        .build());
            }
        }
        return violations;
    }

    static Severity severityFor(int excess) {
        if (excess <= 5) {
            return Severity.MEDIUM;
        }
        if (excess <= 15) {
            return Severity.HIGH;
        }
        return Severity.CRITICAL;
    }
}
