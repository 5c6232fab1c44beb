package com.connascence.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects function and class facts from a normalized tree.
 */
public final class FunctionExtractor {
    private static final Set<String> DEFINITIONS = Set.of(
            NodeTypes.FUNCTION_DEFINITION, NodeTypes.CLASS_DEFINITION);
    private static final Set<String> RECEIVER_NAMES = Set.of("self", "cls");
    private static final Set<String> ASSERTION_HELPERS = Set.of(
            "requireNonNull", "checkArgument", "checkState", "checkNotNull", "static_assert", "_Static_assert");

    private FunctionExtractor() {
    }

    /**
     * Every function definition in document order.
     */
    public static List<FunctionInfo> functions(NormalizedNode root, NodeIndex index) {
        List<FunctionInfo> result = new ArrayList<>();
        for (NormalizedNode node : index.nodes()) {
            if (node.is(NodeTypes.FUNCTION_DEFINITION)) {
                result.add(_describe(node, index));
            }
        }
        return result;
    }

    /**
     * Every class definition in document order, each with the methods it declares directly.
     */
    public static List<ClassInfo> classes(NormalizedNode root, NodeIndex index) {
        Map<NormalizedNode, List<FunctionInfo>> methodsByClass = new IdentityHashMap<>();
        for (FunctionInfo function : functions(root, index)) {
            NormalizedNode owner = index.nearestAncestor(function.getNode(), DEFINITIONS);
            if (owner != null && owner.is(NodeTypes.CLASS_DEFINITION)) {
                methodsByClass.computeIfAbsent(owner, k -> new ArrayList<>()).add(function);
            }
        }

        List<ClassInfo> result = new ArrayList<>();
        for (NormalizedNode node : index.nodes()) {
            if (node.is(NodeTypes.CLASS_DEFINITION)) {
                result.add(new ClassInfo(node, nameOf(node),
                        methodsByClass.getOrDefault(node, List.of())));
            }
        }
        return result;
    }

    /**
     * Name of a definition: its first direct identifier child.
     */
    public static String nameOf(NormalizedNode definition) {
        return definition.firstChild(NodeTypes.IDENTIFIER)
                .map(NormalizedNode::getText)
                .orElse("<anonymous>");
    }

    /**
     * Simple name of the function a call invokes ({@code foo} for {@code obj.foo(x)}), or null.
     */
    public static String calleeName(NormalizedNode call) {
        if (call.getChildren().isEmpty()) {
            return null;
        }
        NormalizedNode callee = call.getChildren().get(0);
        if (callee.is(NodeTypes.IDENTIFIER)) {
            return callee.getText();
        }
        if (callee.is(NodeTypes.ATTRIBUTE)) {
            List<NormalizedNode> names = callee.childrenOfType(NodeTypes.IDENTIFIER);
            return names.isEmpty() ? null : names.get(names.size() - 1).getText();
        }
        return null;
    }

    /**
     * Number of source lines spanned by the statements of a body; zero for an empty body.
     */
    public static int bodyLines(NormalizedNode body) {
        if (body == null || body.getChildren().isEmpty()) {
            return 0;
        }
        List<NormalizedNode> statements = body.getChildren();
        return statements.get(statements.size() - 1).getEndLine() - statements.get(0).getStartLine() + 1;
    }

    /**
     * Nodes of a definition in pre-order, excluding nested function and class definitions.
     */
    public static List<NormalizedNode> ownNodes(NormalizedNode definition) {
        List<NormalizedNode> result = new ArrayList<>();
        Deque<NormalizedNode> stack = new ArrayDeque<>();
        List<NormalizedNode> top = definition.getChildren();
        for (int i = top.size() - 1; i >= 0; i--) {
            stack.push(top.get(i));
        }
        while (!stack.isEmpty()) {
            NormalizedNode node = stack.pop();
            if (DEFINITIONS.contains(node.getType())) {
                continue;
            }
            result.add(node);
            List<NormalizedNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * True when the function body calls a function of the same name.
     */
    public static boolean isSelfRecursive(FunctionInfo function) {
        for (NormalizedNode node : ownNodes(function.getNode())) {
            if (node.is(NodeTypes.CALL) && function.getName().equals(calleeName(node))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Assertion-like statements of a function: assert statements, static assertions and calls to
     * assertion or precondition helpers.
     */
    public static int assertionCount(FunctionInfo function) {
        int count = 0;
        for (NormalizedNode node : ownNodes(function.getNode())) {
            if (node.is(NodeTypes.ASSERT_STATEMENT) || node.is("static_assert_declaration")) {
                count++;
            } else if (node.is(NodeTypes.CALL) && _isAssertionCall(calleeName(node))) {
                count++;
            }
        }
        return count;
    }

    private static boolean _isAssertionCall(String name) {
        if (name == null) {
            return false;
        }
        return name.startsWith("assert") || name.startsWith("ASSERT") || ASSERTION_HELPERS.contains(name);
    }

    private static FunctionInfo _describe(NormalizedNode node, NodeIndex index) {
        NormalizedNode owner = index.nearestAncestor(node, DEFINITIONS);
        boolean method = owner != null && owner.is(NodeTypes.CLASS_DEFINITION);

        List<String> parameters = new ArrayList<>();
        node.firstChild(NodeTypes.PARAMETERS).ifPresent(params -> {
            for (NormalizedNode param : params.getChildren()) {
                if (NodeTypes.NON_COUNTED_PARAMETERS.contains(param.getType())) {
                    continue;
                }
                String name = parameterName(param);
                if (method && parameters.isEmpty() && RECEIVER_NAMES.contains(name)
                        && params.getChildren().indexOf(param) == 0) {
                    continue;
                }
                parameters.add(name);
            }
        });

        return new FunctionInfo(node, nameOf(node), parameters,
                bodyLines(node.firstChild(NodeTypes.BLOCK).orElse(null)), method);
    }

    /**
     * Declared name of one entry of a parameter list.
     */
    public static String parameterName(NormalizedNode param) {
        if (param.is(NodeTypes.IDENTIFIER)) {
            return param.getText();
        }
        return param.firstChild(NodeTypes.IDENTIFIER)
                .map(NormalizedNode::getText)
                .orElseGet(() -> _declaredName(param));
    }

    // Identifiers inside a type (struct tags, qualified names) never name the parameter
    private static String _declaredName(NormalizedNode param) {
        Deque<NormalizedNode> stack = new ArrayDeque<>();
        stack.push(param);
        while (!stack.isEmpty()) {
            NormalizedNode node = stack.pop();
            if (node.is(NodeTypes.IDENTIFIER)) {
                return node.getText();
            }
            if (node.is(NodeTypes.TYPE)) {
                continue;
            }
            List<NormalizedNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return param.getText();
    }
}
