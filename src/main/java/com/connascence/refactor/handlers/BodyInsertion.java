package com.connascence.refactor.handlers;

import java.util.List;

import com.connascence.ast.FunctionInfo;
import com.connascence.ast.NormalizedNode;
import com.connascence.plugins.Language;
import com.connascence.refactor.TextEdits;
import com.connascence.refactor.TransformationContext;
import com.connascence.refactor.TransformationException;

/**
 * Inserts statements at the top of a function body: after a Python docstring, after a Java
 * {@code this(...)} or {@code super(...)} call, otherwise before the first statement.
 */
final class BodyInsertion {
    static final String CONSTRUCTOR_CALL = "explicit_constructor_invocation_stmt";

    private BodyInsertion() {
    }

    static void atStart(TransformationContext context, FunctionInfo function, List<String> lines, TextEdits edits) {
        NormalizedNode body = function.getBody();
        if (body == null) {
            throw new TransformationException("Function '" + function.getName() + "' has no body");
        }
        if (context.getLanguage() == Language.PYTHON) {
            _python(context, function, body, lines, edits);
        } else {
            _braced(context, function, body, lines, edits);
        }
    }

    private static void _python(TransformationContext context, FunctionInfo function, NormalizedNode body,
                                List<String> lines, TextEdits edits) {
        List<NormalizedNode> statements = body.getChildren();
        NormalizedNode first = statements.isEmpty() ? null : statements.get(0);
        if (first == null || !context.startsLine(first) || first.getStartLine() == function.getStartLine()) {
            throw new TransformationException("Body of '" + function.getName() + "' shares a line with its header");
        }
        String indent = context.indentationOf(first);
        if (SourceLayout.isDocstring(first)) {
            if (!context.endsLine(first)) {
                throw new TransformationException("Docstring of '" + function.getName() + "' is followed by code");
            }
            int at = context.lineEndOf(first);
            edits.insert(at, SourceLayout.atLineStart(context, at, _block(indent, lines)));
        } else {
            edits.insert(context.lineStartOf(first), _block(indent, lines));
        }
    }

    private static void _braced(TransformationContext context, FunctionInfo function, NormalizedNode body,
                                List<String> lines, TextEdits edits) {
        List<NormalizedNode> statements = body.getChildren();
        NormalizedNode anchor = null;
        if (!statements.isEmpty() && statements.get(0).is(CONSTRUCTOR_CALL)) {
            anchor = statements.get(0);
        }
        int nextIndex = anchor == null ? 0 : 1;
        NormalizedNode next = nextIndex < statements.size() ? statements.get(nextIndex) : null;

        if (anchor == null && next != null && context.startsLine(next) && next.getStartLine() > body.getStartLine()) {
            edits.insert(context.lineStartOf(next), _block(context.indentationOf(next), lines));
            return;
        }

        String indent = context.bodyIndentation(function);
        int at = anchor == null ? body.getSpan().getStartOffset() + 1 : anchor.getSpan().getEndOffset();
        StringBuilder text = new StringBuilder();
        for (String line : lines) {
            text.append('\n').append(indent).append(line);
        }
        int lineEnd = context.getLineMap().lineEnd(context.getLineMap().lineOf(at));
        if (context.text(at, lineEnd).strip().startsWith("}")) {
            text.append('\n').append(context.indentationOf(function.getNode()));
        }
        edits.insert(at, text.toString());
    }

    private static String _block(String indent, List<String> lines) {
        StringBuilder text = new StringBuilder();
        for (String line : lines) {
            text.append(indent).append(line).append('\n');
        }
        return text.toString();
    }
}
