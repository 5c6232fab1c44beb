package com.connascence.overlay;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

import com.connascence.ast.FunctionExtractor;
import com.connascence.ast.FunctionInfo;
import com.connascence.ast.NodeIndex;
import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import com.connascence.util.LoggerUtil;

/**
 * Checks a tree against the rules of one safety overlay. Stateless.
 */
public class SafetyOverlayValidator {
    private static final Logger logger = LoggerUtil.getLogger(SafetyOverlayValidator.class);

    /**
     * Every rule match in the tree, ordered by position.
     */
    public List<OverlayViolation> validate(NormalizedNode root, SafetyOverlay overlay) {
        NodeIndex index = NodeIndex.build(root);
        List<OverlayViolation> violations = new ArrayList<>();

        for (NormalizedNode node : index.nodes()) {
            for (OverlayRule rule : overlay.getRules()) {
                if (rule.getNodeTypes().contains(node.getType())) {
                    violations.add(_violation(rule, node, "Banned construct: " + node.getType()
                            + " (" + rule.getName() + ")"));
                } else if (node.is(NodeTypes.CALL) && !rule.getCallNames().isEmpty()) {
                    String callee = FunctionExtractor.calleeName(node);
                    if (callee != null && rule.getCallNames().contains(callee)) {
                        violations.add(_violation(rule, node, "Forbidden call: " + callee
                                + " (" + rule.getName() + ")"));
                    }
                }
            }
        }

        List<FunctionInfo> functions = FunctionExtractor.functions(root, index);
        for (OverlayRule rule : overlay.getRules()) {
            if (rule.isRecursion()) {
                for (FunctionInfo function : functions) {
                    if (FunctionExtractor.isSelfRecursive(function)) {
                        violations.add(_violation(rule, function.getNode(),
                                "Recursive function: " + function.getName() + " (" + rule.getName() + ")"));
                    }
                }
            }
            if (rule.getMinAssertions() > 0) {
                for (FunctionInfo function : functions) {
                    int assertions = FunctionExtractor.assertionCount(function);
                    if (assertions < rule.getMinAssertions()) {
                        violations.add(_violation(rule, function.getNode(), "Function " + function.getName()
                                + " has " + assertions + " assertions, requires " + rule.getMinAssertions()));
                    }
                }
            }
        }

        violations.sort(Comparator.comparingInt(OverlayViolation::getLine)
                .thenComparingInt(OverlayViolation::getColumn));
        logger.fine("Overlay " + overlay.getId() + " found " + violations.size() + " violations");
        return violations;
    }

    private static OverlayViolation _violation(OverlayRule rule, NormalizedNode node, String message) {
        return new OverlayViolation(rule.getId(), rule.getCategory(), message,
                node.getStartLine(), node.getSpan().getStartColumn(), rule.getSeverity());
    }
}
