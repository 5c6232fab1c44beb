package com.connascence.refactor.handlers;

import java.util.List;

import com.connascence.ast.FunctionInfo;
import com.connascence.ast.NormalizedNode;
import com.connascence.refactor.FunctionTarget;
import com.connascence.refactor.RefactoringCandidate;
import com.connascence.refactor.TechniqueHandler;
import com.connascence.refactor.TextEdits;
import com.connascence.refactor.Transformation;
import com.connascence.refactor.TransformationContext;
import com.connascence.refactor.TransformationException;

/**
 * Marks a self-recursive function for conversion to iteration. The rewrite itself is left to
 * a developer; the marker makes the finding visible in the code.
 */
public class RecursionHandler implements TechniqueHandler {

    @Override
    public Transformation apply(TransformationContext context, RefactoringCandidate candidate) {
        FunctionInfo function = context.function(candidate.target(FunctionTarget.class));
        NormalizedNode definition = context.outerDefinition(function.getNode());
        if (!context.startsLine(definition)) {
            throw new TransformationException("Function '" + function.getName() + "' does not start its own line");
        }

        String marker = context.commentPrefix() + " TODO: convert recursion in " + function.getName()
                + " to iteration";
        int at = context.lineStartOf(definition);
        if (definition.getStartLine() > 1) {
            int previousStart = context.getLineMap().lineStart(definition.getStartLine() - 1);
            if (context.text(previousStart, at).strip().equals(marker)) {
                return Transformation.unchanged(context.getCode(),
                        "Function '" + function.getName() + "' is already marked");
            }
        }

        TextEdits edits = new TextEdits(context.getCode());
        edits.insert(at, context.indentationOf(definition) + marker + "\n");
        return new Transformation(edits.apply(),
                List.of("Marked recursive function " + function.getName() + " for conversion to iteration"),
                List.of("Recursion in " + function.getName() + " still has to be rewritten by hand"));
    }
}
