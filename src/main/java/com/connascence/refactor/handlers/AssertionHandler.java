package com.connascence.refactor.handlers;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.connascence.ast.FunctionExtractor;
import com.connascence.ast.FunctionInfo;
import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import com.connascence.plugins.Language;
import com.connascence.refactor.FunctionTarget;
import com.connascence.refactor.RefactoringCandidate;
import com.connascence.refactor.TechniqueHandler;
import com.connascence.refactor.TextEdits;
import com.connascence.refactor.Transformation;
import com.connascence.refactor.TransformationContext;
import com.connascence.refactor.TransformationException;

/**
 * Adds parameter preconditions at the top of a function body: {@code assert p is not None} in
 * Python, {@code assert(p != NULL);} for C pointers, {@code assert p != null;} for Java references.
 * <p>
 * Only parameter preconditions are generated, one per eligible parameter. A function with fewer
 * eligible parameters than {@code minAssertionsPerFunction} keeps its assertion-density finding
 * after the transformation, and applying the technique again leaves the code unchanged.
 */
public class AssertionHandler implements TechniqueHandler {
    private static final Set<String> JAVA_PRIMITIVES = Set.of(
            "boolean", "byte", "char", "short", "int", "long", "float", "double");

    @Override
    public Transformation apply(TransformationContext context, RefactoringCandidate candidate) {
        FunctionInfo function = context.function(candidate.target(FunctionTarget.class));
        NormalizedNode body = function.getBody();
        if (body == null) {
            throw new TransformationException("Function '" + function.getName() + "' has no body");
        }

        String bodyText = context.text(body);
        List<String> checks = new ArrayList<>();
        for (String check : _checks(context, function)) {
            if (!bodyText.contains(check)) {
                checks.add(check);
            }
        }
        if (checks.isEmpty()) {
            return Transformation.unchanged(context.getCode(),
                    "Function '" + function.getName() + "' has no parameter left to assert on");
        }

        TextEdits edits = new TextEdits(context.getCode());
        if (context.getLanguage() == Language.C && !SourceLayout.hasInclude(context, "assert.h")) {
            int at = SourceLayout.cIncludeEnd(context, function.getNode().getSpan().getStartOffset());
            edits.insert(at, SourceLayout.atLineStart(context, at, "#include <assert.h>\n"));
        }
        BodyInsertion.atStart(context, function, checks, edits);
        return new Transformation(edits.apply(),
                List.of("Added " + checks.size() + " assertion(s) to " + function.getName()), List.of());
    }

    private static List<String> _checks(TransformationContext context, FunctionInfo function) {
        List<String> checks = new ArrayList<>();
        NormalizedNode parameters = function.getNode().firstChild(NodeTypes.PARAMETERS).orElse(null);
        if (parameters == null) {
            return checks;
        }
        switch (context.getLanguage()) {
            case PYTHON -> {
                for (NormalizedNode param : Parameters.python(function)) {
                    if (Parameters.isSplat(param) || Parameters.defaultsToNone(param)) {
                        continue;
                    }
                    checks.add("assert " + FunctionExtractor.parameterName(param) + " is not None");
                }
            }
            case C -> {
                for (NormalizedNode param : parameters.getChildren()) {
                    NormalizedNode declarator = Parameters.cDeclarator(param);
                    if (declarator != null && declarator.is("pointer_declarator")) {
                        checks.add("assert(" + FunctionExtractor.parameterName(param) + " != NULL);");
                    }
                }
            }
            case JAVA -> {
                for (NormalizedNode param : parameters.getChildren()) {
                    String type = param.firstChild(NodeTypes.TYPE).map(NormalizedNode::getText).orElse("");
                    if (!JAVA_PRIMITIVES.contains(type)) {
                        checks.add("assert " + FunctionExtractor.parameterName(param) + " != null;");
                    }
                }
            }
            default -> throw new TransformationException("Assertions are not supported for "
                    + context.getLanguage().getId());
        }
        return checks;
    }
}
