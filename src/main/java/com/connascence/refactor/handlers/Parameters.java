package com.connascence.refactor.handlers;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.connascence.ast.FunctionInfo;
import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;

/**
 * Reads parameter lists of the normalized languages.
 */
final class Parameters {
    private static final Set<String> RECEIVERS = Set.of("self", "cls");
    private static final Set<String> SPECIAL = Set.of(
            NodeTypes.LIST_SPLAT_PATTERN, NodeTypes.DICTIONARY_SPLAT_PATTERN,
            NodeTypes.KEYWORD_SEPARATOR, NodeTypes.POSITIONAL_SEPARATOR, NodeTypes.VARIADIC_PARAMETER);

    private Parameters() {
    }

    static NormalizedNode listOf(FunctionInfo function) {
        return function.getNode().firstChild(NodeTypes.PARAMETERS).orElse(null);
    }

    static List<NormalizedNode> all(FunctionInfo function) {
        NormalizedNode parameters = listOf(function);
        return parameters == null ? List.of() : parameters.getChildren();
    }

    /**
     * The {@code self} or {@code cls} parameter of a Python method, or null.
     */
    static NormalizedNode pythonReceiver(FunctionInfo function) {
        List<NormalizedNode> all = all(function);
        if (function.isMethod() && !all.isEmpty() && all.get(0).is(NodeTypes.IDENTIFIER)
                && RECEIVERS.contains(all.get(0).getText())) {
            return all.get(0);
        }
        return null;
    }

    /**
     * Python parameters without the receiver.
     */
    static List<NormalizedNode> python(FunctionInfo function) {
        List<NormalizedNode> result = new ArrayList<>(all(function));
        NormalizedNode receiver = pythonReceiver(function);
        if (receiver != null) {
            result.remove(0);
        }
        return result;
    }

    /**
     * Splats, separators and C varargs: entries that cannot become a plain field.
     */
    static boolean isSplat(NormalizedNode param) {
        return SPECIAL.contains(param.getType());
    }

    static boolean defaultsToNone(NormalizedNode param) {
        String value = pythonDefault(param);
        return value != null && value.equals("None");
    }

    static String pythonAnnotation(NormalizedNode param) {
        return param.firstChild(NodeTypes.TYPE).map(NormalizedNode::getText).orElse(null);
    }

    static String pythonDefault(NormalizedNode param) {
        if (!param.is(NodeTypes.DEFAULT_PARAMETER) && !param.is(NodeTypes.TYPED_DEFAULT_PARAMETER)) {
            return null;
        }
        List<NormalizedNode> children = param.getChildren();
        return children.get(children.size() - 1).getText();
    }

    /**
     * The declarator of a C parameter declaration, or null for an unnamed parameter.
     */
    static NormalizedNode cDeclarator(NormalizedNode param) {
        for (NormalizedNode child : param.getChildren()) {
            if (!child.is(NodeTypes.TYPE)) {
                return child;
            }
        }
        return null;
    }
}
