package com.connascence.refactor.handlers;

import java.util.ArrayList;
import java.util.List;

import com.connascence.ast.FunctionInfo;
import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import com.connascence.refactor.TransformationContext;

/**
 * Java facts the normalized tree does not carry directly.
 */
final class JavaMembers {
    static final String OBJECT_CREATION = "object_creation_expr";

    private JavaMembers() {
    }

    /**
     * True when the method or constructor declares its own type parameters.
     */
    static boolean hasTypeParameters(TransformationContext context, FunctionInfo function) {
        NormalizedNode node = function.getNode();
        NormalizedNode limit = node.firstChild(NodeTypes.TYPE)
                .orElseGet(() -> node.firstChild(NodeTypes.IDENTIFIER).orElse(node));
        String header = context.text(node.getSpan().getStartOffset(), limit.getSpan().getStartOffset());
        return header.replaceAll("@\\w+(\\([^)]*\\))?", "").contains("<");
    }

    /**
     * True when another member of the same type shares the function's name.
     */
    static boolean isOverloaded(TransformationContext context, FunctionInfo function) {
        NormalizedNode owner = SourceLayout.enclosingClass(context, function.getNode());
        for (FunctionInfo other : context.getFunctions()) {
            if (other != function && other.getName().equals(function.getName())
                    && SourceLayout.enclosingClass(context, other.getNode()) == owner) {
                return true;
            }
        }
        return false;
    }

    /**
     * Calls of a constructor: {@code new Owner(...)} anywhere in the unit and {@code this(...)}
     * inside the owner.
     */
    static List<NormalizedNode> instantiations(TransformationContext context, FunctionInfo constructor) {
        NormalizedNode owner = SourceLayout.enclosingClass(context, constructor.getNode());
        List<NormalizedNode> result = new ArrayList<>();
        for (NormalizedNode node : context.getIndex().nodes()) {
            if (node.is(OBJECT_CREATION)) {
                boolean matches = node.firstChild(NodeTypes.TYPE)
                        .map(type -> _simpleTypeName(type.getText()).equals(constructor.getName()))
                        .orElse(false);
                if (matches) {
                    result.add(node);
                }
            } else if (node.is(BodyInsertion.CONSTRUCTOR_CALL) && node.getText().startsWith("this")
                    && SourceLayout.enclosingClass(context, node) == owner) {
                result.add(node);
            }
        }
        return result;
    }

    private static String _simpleTypeName(String type) {
        String raw = type;
        int generic = raw.indexOf('<');
        if (generic >= 0) {
            raw = raw.substring(0, generic);
        }
        return raw.substring(raw.lastIndexOf('.') + 1).strip();
    }
}
