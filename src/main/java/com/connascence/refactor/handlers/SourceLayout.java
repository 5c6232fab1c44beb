package com.connascence.refactor.handlers;

import java.util.List;
import java.util.Set;

import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import com.connascence.refactor.TransformationContext;
import com.connascence.refactor.TransformationException;

/**
 * Where generated declarations go in a file of each language.
 */
final class SourceLayout {
    private SourceLayout() {
    }

    /**
     * Offset just past a Python module's docstring and leading imports; zero when it has neither.
     */
    static int pythonHeaderEnd(TransformationContext context) {
        List<NormalizedNode> statements = context.getRoot().getChildren();
        int end = 0;
        for (int i = 0; i < statements.size(); i++) {
            NormalizedNode statement = statements.get(i);
            boolean docstring = i == 0 && isDocstring(statement);
            if (!docstring && !statement.is(NodeTypes.IMPORT_STATEMENT)) {
                break;
            }
            end = context.lineEndOf(statement);
        }
        return end;
    }

    static boolean isDocstring(NormalizedNode statement) {
        if (!statement.is(NodeTypes.EXPRESSION_STATEMENT) || statement.getChildren().size() != 1) {
            return false;
        }
        NormalizedNode value = statement.getChildren().get(0);
        return value.is(NodeTypes.STRING) || value.is(NodeTypes.CONCATENATED_STRING);
    }

    /**
     * Offset just past the last top-level {@code #include} that starts before {@code limit}.
     */
    static int cIncludeEnd(TransformationContext context, int limit) {
        int end = 0;
        for (NormalizedNode item : context.getRoot().getChildren()) {
            if (item.getSpan().getStartOffset() >= limit) {
                break;
            }
            if (item.is(NodeTypes.PREPROC_INCLUDE)) {
                end = context.lineEndOf(item);
            }
        }
        return end;
    }

    static boolean hasInclude(TransformationContext context, String header) {
        for (NormalizedNode item : context.getRoot().getChildren()) {
            if (item.is(NodeTypes.PREPROC_INCLUDE) && item.getText().contains(header)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Text to insert at {@code offset} so that {@code lines} start on a line of their own.
     */
    static String atLineStart(TransformationContext context, int offset, String lines) {
        if (offset > 0 && context.getCode().charAt(offset - 1) != '\n') {
            return "\n" + lines;
        }
        return lines;
    }

    /**
     * The outermost type declaration containing a node in a Java unit.
     */
    static NormalizedNode outermostClass(TransformationContext context, NormalizedNode node) {
        NormalizedNode result = null;
        for (NormalizedNode ancestor : context.getIndex().ancestors(node)) {
            if (ancestor.is(NodeTypes.CLASS_DEFINITION)) {
                result = ancestor;
            }
        }
        if (result == null && node.is(NodeTypes.CLASS_DEFINITION)) {
            result = node;
        }
        return result;
    }

    /**
     * The innermost type declaration containing a node, or null.
     */
    static NormalizedNode enclosingClass(TransformationContext context, NormalizedNode node) {
        return context.getIndex().nearestAncestor(node, Set.of(NodeTypes.CLASS_DEFINITION));
    }

    /**
     * The keyword a Java type declaration is introduced with: class, interface, enum or record.
     */
    static String javaTypeKeyword(TransformationContext context, NormalizedNode type) {
        NormalizedNode name = type.firstChild(NodeTypes.IDENTIFIER)
                .orElseThrow(() -> new TransformationException("Type declaration without a name"));
        String header = context.text(type.getSpan().getStartOffset(), name.getSpan().getStartOffset()).strip();
        String[] words = header.split("[\\s@]+");
        return words.length == 0 ? "class" : words[words.length - 1];
    }

    /**
     * Offset just past the opening brace of a Java type body.
     */
    static int javaBodyStart(TransformationContext context, NormalizedNode type) {
        NormalizedNode name = type.firstChild(NodeTypes.IDENTIFIER)
                .orElseThrow(() -> new TransformationException("Type declaration without a name"));
        int brace = context.getCode().indexOf('{', name.getSpan().getEndOffset());
        if (brace < 0 || brace >= type.getSpan().getEndOffset()) {
            throw new TransformationException("Type " + name.getText() + " has no body");
        }
        return brace + 1;
    }

    /**
     * Indentation of members inside a Java type body.
     */
    static String javaMemberIndentation(TransformationContext context, NormalizedNode type) {
        for (NormalizedNode member : type.getChildren()) {
            if (!member.is(NodeTypes.IDENTIFIER) && context.startsLine(member)
                    && member.getStartLine() > type.getStartLine()) {
                return context.indentationOf(member);
            }
        }
        return context.indentationOf(type) + "    ";
    }
}
