package com.connascence.detector.rules;

import java.util.ArrayList;
import java.util.List;

import com.connascence.api.ConnascenceKind;
import com.connascence.api.Violation;
import com.connascence.api.error.Severity;
import com.connascence.ast.FunctionInfo;
import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import com.connascence.detector.DetectionRule;
import com.connascence.detector.RuleContext;

/**
 * Maximum nesting of branching constructs inside a function body. Nested definitions are
 * measured on their own, and an {@code else if} chain stays on one level.
 */
public class NestingDepthRule implements DetectionRule {
    public static final String RULE_ID = "nesting_depth";

    @Override
    public String id() {
        return RULE_ID;
    }

    @Override
    public List<Violation> detect(RuleContext context) {
        int max = context.getRegistry().getMaxNestingDepth();
        List<Violation> violations = new ArrayList<>();
        for (FunctionInfo function : context.getFunctions()) {
            NormalizedNode body = function.getBody();
            if (body == null) {
                continue;
            }
            int depth = maxDepth(body, 0);
            if (depth > max) {
                violations.add(context.violations()
                        .at(function.getNode(), RULE_ID, ConnascenceKind.ALGORITHM, Severity.MEDIUM)
                        .description("Function '" + function.getName() + "' nests " + depth
                                + " levels deep (max " + max + ")")
                        .build());
            }
        }
        return violations;
    }

    static int maxDepth(NormalizedNode node, int depth) {
        int max = depth;
        for (NormalizedNode child : node.getChildren()) {
            if (child.is(NodeTypes.FUNCTION_DEFINITION) || child.is(NodeTypes.CLASS_DEFINITION)) {
                continue;
            }
            int childDepth = depth;
            if (NodeTypes.BRANCHING.contains(child.getType()) && !_isElseIf(node, child)) {
                childDepth++;
            }
            max = Math.max(max, maxDepth(child, childDepth));
        }
        return max;
    }

    private static boolean _isElseIf(NormalizedNode parent, NormalizedNode child) {
        return parent.is(NodeTypes.ELSE_CLAUSE) && child.is(NodeTypes.IF_STATEMENT)
                && parent.getChildren().size() == 1;
    }
}
