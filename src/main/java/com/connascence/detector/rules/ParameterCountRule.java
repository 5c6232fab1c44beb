package com.connascence.detector.rules;

import java.util.ArrayList;
import java.util.List;

import com.connascence.api.ConnascenceKind;
import com.connascence.api.Violation;
import com.connascence.api.error.Severity;
import com.connascence.ast.FunctionInfo;
import com.connascence.detector.DetectionRule;
import com.connascence.detector.RuleContext;

/**
 * Long positional parameter lists (Connascence of Position).
 */
public class ParameterCountRule implements DetectionRule {
    public static final String RULE_ID = "parameter_count";

    @Override
    public String id() {
        return RULE_ID;
    }

    @Override
    public List<Violation> detect(RuleContext context) {
        int max = context.getRegistry().getMaxParameters();
        List<Violation> violations = new ArrayList<>();
        for (FunctionInfo function : context.getFunctions()) {
            int count = function.getParameterCount();
            if (count > max) {
                Severity severity = count - max > 2 ? Severity.HIGH : Severity.MEDIUM;
                violations.add(context.violations()
                        .at(function.getNode(), RULE_ID, ConnascenceKind.POSITION, severity)
                        .description("Function '" + function.getName() + "' has " + count
                                + " parameters (max " + max + ")")
                        .build());
            }
        }
        return violations;
    }
}
