package com.connascence.refactor.handlers;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import com.connascence.detector.LiteralOccurrence;
import com.connascence.refactor.MagicNumberTarget;
import com.connascence.refactor.RefactoringCandidate;
import com.connascence.refactor.TechniqueHandler;
import com.connascence.refactor.TextEdits;
import com.connascence.refactor.Transformation;
import com.connascence.refactor.TransformationContext;
import com.connascence.refactor.TransformationException;

/**
 * Replaces every occurrence of a numeric value with a named constant declared once: a module
 * assignment in Python, a {@code #define} in C, a {@code static final} field in Java.
 */
public class MagicNumberHandler implements TechniqueHandler {

    @Override
    public Transformation apply(TransformationContext context, RefactoringCandidate candidate) {
        MagicNumberTarget target = candidate.target(MagicNumberTarget.class);
        List<LiteralOccurrence> occurrences = _occurrences(context, target.getValue());
        if (occurrences.isEmpty()) {
            return Transformation.unchanged(context.getCode(), "No occurrence of " + target.getText() + " left to replace");
        }

        String name = context.uniqueName(constantName(target.getValue()), "_");
        return switch (context.getLanguage()) {
            case PYTHON -> _python(context, target, name, occurrences);
            case C -> _c(context, target, name, occurrences);
            case JAVA -> _java(context, target, name, occurrences);
            default -> throw new TransformationException("Magic number replacement is not supported for "
                    + context.getLanguage().getId());
        };
    }

    /**
     * {@code CONSTANT_7}, {@code CONSTANT_3_14}, {@code CONSTANT_NEG_5}.
     */
    static String constantName(BigDecimal value) {
        String digits = value.abs().toPlainString().replace('.', '_');
        return "CONSTANT_" + (value.signum() < 0 ? "NEG_" : "") + digits;
    }

    private Transformation _python(TransformationContext context, MagicNumberTarget target, String name,
                                   List<LiteralOccurrence> occurrences) {
        TextEdits edits = new TextEdits(context.getCode());
        int at = SourceLayout.pythonHeaderEnd(context);
        String declaration = name + " = " + target.getText() + "\n";
        edits.insert(at, SourceLayout.atLineStart(context, at, at == 0 ? declaration + "\n" : "\n" + declaration));
        _replaceAll(edits, occurrences, name);
        return _result(edits, target, name, occurrences.size(), List.of());
    }

    private Transformation _c(TransformationContext context, MagicNumberTarget target, String name,
                              List<LiteralOccurrence> occurrences) {
        TextEdits edits = new TextEdits(context.getCode());
        int firstUse = occurrences.get(0).getNode().getSpan().getStartOffset();
        int at = SourceLayout.cIncludeEnd(context, firstUse);
        String value = target.getValue().signum() < 0 ? "(" + target.getText() + ")" : target.getText();
        String define = "#define " + name + " " + value + "\n";
        edits.insert(at, SourceLayout.atLineStart(context, at, at == 0 ? define + "\n" : define));
        _replaceAll(edits, occurrences, name);
        return _result(edits, target, name, occurrences.size(), List.of());
    }

    private Transformation _java(TransformationContext context, MagicNumberTarget target, String name,
                                 List<LiteralOccurrence> occurrences) {
        NormalizedNode owner = SourceLayout.outermostClass(context, occurrences.get(0).getNode());
        if (owner == null) {
            throw new TransformationException("Literal " + target.getText() + " is not inside a type declaration");
        }
        String keyword = SourceLayout.javaTypeKeyword(context, owner);
        if (keyword.equals("enum")) {
            throw new TransformationException("Cannot declare a constant ahead of the constants of enum "
                    + owner.firstChild(NodeTypes.IDENTIFIER).map(NormalizedNode::getText).orElse("?"));
        }

        List<LiteralOccurrence> inOwner = new ArrayList<>();
        for (LiteralOccurrence occurrence : occurrences) {
            if (SourceLayout.outermostClass(context, occurrence.getNode()) == owner) {
                inOwner.add(occurrence);
            }
        }
        List<String> warnings = new ArrayList<>();
        if (inOwner.size() < occurrences.size()) {
            warnings.add((occurrences.size() - inOwner.size()) + " occurrence(s) of " + target.getText()
                    + " outside " + owner.firstChild(NodeTypes.IDENTIFIER).map(NormalizedNode::getText).orElse("?")
                    + " left unchanged");
        }

        String modifiers = keyword.equals("interface") ? "" : "private static final ";
        String field = SourceLayout.javaMemberIndentation(context, owner) + modifiers + javaType(target.getText())
                + " " + name + " = " + target.getText() + ";";

        TextEdits edits = new TextEdits(context.getCode());
        edits.insert(SourceLayout.javaBodyStart(context, owner), "\n" + field + "\n");
        _replaceAll(edits, inOwner, name);
        return _result(edits, target, name, inOwner.size(), warnings);
    }

    /**
     * Declared type of a constant initialized with the given Java literal.
     */
    static String javaType(String literal) {
        String text = literal.replace("_", "").toLowerCase(Locale.ROOT);
        boolean hex = text.startsWith("0x") || text.startsWith("-0x");
        if (text.endsWith("l")) {
            return "long";
        }
        if (!hex && text.endsWith("f")) {
            return "float";
        }
        if (!hex && (text.endsWith("d") || text.contains(".") || text.contains("e"))) {
            return "double";
        }
        if (hex && text.contains("p")) {
            return "double";
        }
        return "int";
    }

    private static List<LiteralOccurrence> _occurrences(TransformationContext context, BigDecimal value) {
        List<LiteralOccurrence> result = new ArrayList<>();
        for (LiteralOccurrence literal : context.literals()) {
            if (literal.isNumber() && !literal.isConstantDefinition() && !literal.isDocstring()
                    && literal.getNumber().compareTo(value) == 0) {
                result.add(literal);
            }
        }
        return result;
    }

    private static void _replaceAll(TextEdits edits, List<LiteralOccurrence> occurrences, String name) {
        for (LiteralOccurrence occurrence : occurrences) {
            edits.replace(occurrence.getNode().getSpan().getStartOffset(),
                    occurrence.getNode().getSpan().getEndOffset(), name);
        }
    }

    private static Transformation _result(TextEdits edits, MagicNumberTarget target, String name, int count,
                                          List<String> warnings) {
        return new Transformation(edits.apply(),
                List.of("Introduced constant " + name + " = " + target.getText(),
                        "Replaced " + count + " occurrence(s) of " + target.getText()),
                warnings);
    }
}
