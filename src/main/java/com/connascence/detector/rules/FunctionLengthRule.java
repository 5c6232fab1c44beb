package com.connascence.detector.rules;

import java.util.ArrayList;
import java.util.List;

import com.connascence.api.ConnascenceKind;
import com.connascence.api.Violation;
import com.connascence.api.error.Severity;
import com.connascence.ast.FunctionInfo;
import com.connascence.detector.DetectionRule;
import com.connascence.detector.RuleContext;

public class FunctionLengthRule implements DetectionRule {
    public static final String RULE_ID = "function_length";

    @Override
    public String id() {
        return RULE_ID;
    }

    @Override
    public List<Violation> detect(RuleContext context) {
        int max = context.getRegistry().getMaxFunctionLength();
        List<Violation> violations = new ArrayList<>();
        for (FunctionInfo function : context.getFunctions()) {
            int length = function.getEndLine() - function.getStartLine();
            if (length > max) {
                violations.add(context.violations()
                        .at(function.getNode(), RULE_ID, ConnascenceKind.ALGORITHM, Severity.MEDIUM)
                        .description("Function '" + function.getName() + "' spans " + length
                                + " lines (max " + max + ")")
                        .build());
            }
        }
        return violations;
    }
}
