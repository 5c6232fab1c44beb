package com.connascence.detector;

import java.util.regex.Pattern;

import com.connascence.ast.NodeIndex;
import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;

/**
 * Finds the usage context of a literal by walking the parent index upwards. The walk stops at
 * statement-block boundaries.
 */
public final class LiteralContextClassifier {
    private static final Pattern CONSTANT_NAME = Pattern.compile("^[A-Z][A-Z0-9_]*$");

    private LiteralContextClassifier() {
    }

    public static LiteralContext classify(NormalizedNode literal, NodeIndex index) {
        NormalizedNode current = index.parentOf(literal);
        while (current != null && !NodeTypes.SCOPE_BOUNDARIES.contains(current.getType())) {
            switch (current.getType()) {
                case NodeTypes.COMPARISON_OPERATOR:
                    return LiteralContext.COMPARISON;
                case NodeTypes.IF_STATEMENT:
                case NodeTypes.ELIF_CLAUSE:
                case NodeTypes.WHILE_STATEMENT:
                case NodeTypes.DO_STATEMENT:
                case NodeTypes.CONDITIONAL_EXPRESSION:
                    return LiteralContext.CONDITION;
                case NodeTypes.ASSIGNMENT:
                case NodeTypes.AUGMENTED_ASSIGNMENT:
                case NodeTypes.INIT_DECLARATOR:
                    return LiteralContext.ASSIGNMENT;
                case NodeTypes.ARGUMENT_LIST:
                    return LiteralContext.ARGUMENT;
                case NodeTypes.RETURN_STATEMENT:
                    return LiteralContext.RETURN;
                default:
                    current = index.parentOf(current);
            }
        }
        return LiteralContext.DEFAULT;
    }

    /**
     * True when the literal is part of the value bound to an UPPER_SNAKE_CASE name.
     */
    public static boolean isConstantDefinition(NormalizedNode literal, NodeIndex index) {
        NormalizedNode current = index.parentOf(literal);
        while (current != null && !NodeTypes.SCOPE_BOUNDARIES.contains(current.getType())) {
            if (current.is(NodeTypes.ASSIGNMENT) || current.is(NodeTypes.INIT_DECLARATOR)) {
                NormalizedNode target = current.getChildren().isEmpty() ? null : current.getChildren().get(0);
                if (target != null && target.is(NodeTypes.IDENTIFIER)
                        && CONSTANT_NAME.matcher(target.getText()).matches()) {
                    return true;
                }
            }
            current = index.parentOf(current);
        }
        return false;
    }

    /**
     * True for a string forming the first statement of a module, class or function body.
     */
    public static boolean isDocstring(NormalizedNode literal, NodeIndex index) {
        NormalizedNode statement = index.parentOf(literal);
        if (statement == null || !statement.is(NodeTypes.EXPRESSION_STATEMENT)
                || statement.getChildren().size() != 1) {
            return false;
        }
        NormalizedNode body = index.parentOf(statement);
        if (body == null || body.getChildren().isEmpty() || body.getChildren().get(0) != statement) {
            return false;
        }
        if (body.is(NodeTypes.MODULE)) {
            return true;
        }
        NormalizedNode owner = index.parentOf(body);
        return body.is(NodeTypes.BLOCK) && owner != null
                && (owner.is(NodeTypes.FUNCTION_DEFINITION) || owner.is(NodeTypes.CLASS_DEFINITION));
    }
}
