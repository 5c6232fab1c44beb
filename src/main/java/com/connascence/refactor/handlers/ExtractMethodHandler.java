package com.connascence.refactor.handlers;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

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
 * Moves the middle third of a long function body into a helper and calls the helper in its place.
 * <p>
 * Python helpers receive the parameters and earlier locals the statements read, and return the
 * names they assign that are read afterwards. C and Java helpers are {@code void}: they receive all
 * parameters plus the earlier locals the statements only read, and the extraction is refused when a
 * value computed by the statements would be needed after them.
 */
public class ExtractMethodHandler implements TechniqueHandler {
    private static final Set<String> NESTED_SCOPES = Set.of(
            NodeTypes.FUNCTION_DEFINITION, NodeTypes.CLASS_DEFINITION, "lambda");
    private static final Set<String> LOOPS = Set.of(
            NodeTypes.FOR_STATEMENT, NodeTypes.WHILE_STATEMENT, NodeTypes.DO_STATEMENT);
    private static final Set<String> EXITS = Set.of(
            NodeTypes.RETURN_STATEMENT, NodeTypes.GOTO_STATEMENT, NodeTypes.LABELED_STATEMENT,
            "yield", "global_statement", "await");
    private static final Set<String> TARGET_GROUPS = Set.of(
            "pattern_list", "tuple", "list", "expression_list", NodeTypes.PARENTHESIZED_EXPRESSION, "list_splat");
    private static final Set<String> STORAGE_CLASSES = Set.of(
            "static", "register", "auto", "extern", "_Thread_local", "inline");
    private static final Pattern NAME = Pattern.compile("[A-Za-z_]\\w*");
    private static final Pattern ANNOTATION = Pattern.compile("@[\\w.]+(\\([^)]*\\))?");

    @Override
    public Transformation apply(TransformationContext context, RefactoringCandidate candidate) {
        FunctionInfo function = context.function(candidate.target(FunctionTarget.class));
        if (function.getBody() == null) {
            throw new TransformationException("Function '" + function.getName() + "' has no body");
        }
        Run run = _selectRun(context, function);
        _checkExits(context, run);
        return switch (context.getLanguage()) {
            case PYTHON -> _python(context, function, run);
            case C -> _c(context, function, run);
            case JAVA -> _java(context, function, run);
            default -> throw new TransformationException("Extract method is not supported for "
                    + context.getLanguage().getId());
        };
    }

    private Transformation _python(TransformationContext context, FunctionInfo function, Run run) {
        NormalizedNode outer = context.outerDefinition(function.getNode());
        NormalizedNode receiver = Parameters.pythonReceiver(function);

        Set<String> known = new LinkedHashSet<>();
        for (NormalizedNode param : Parameters.python(function)) {
            String name = FunctionExtractor.parameterName(param);
            if (NAME.matcher(name).matches()) {
                known.add(name);
            }
        }
        known.addAll(_pythonTargets(run.before));

        Set<String> read = _names(context, run.statements);
        List<String> inputs = new ArrayList<>();
        for (String name : known) {
            if (read.contains(name)) {
                inputs.add(name);
            }
        }
        Set<String> usedAfter = _names(context, run.after);
        List<String> outputs = new ArrayList<>();
        for (String name : _pythonTargets(run.statements)) {
            if (usedAfter.contains(name)) {
                outputs.add(name);
            }
        }

        String decorator = null;
        String callee;
        List<String> helperParams = new ArrayList<>();
        String helperName;
        if (function.isMethod()) {
            helperName = context.uniqueName("_" + function.getName().replaceFirst("^_+", "") + "_part", "_");
            if (receiver != null) {
                helperParams.add(receiver.getText());
                callee = receiver.getText() + "." + helperName;
                if (_hasDecorator(outer, "@classmethod")) {
                    decorator = "@classmethod";
                }
            } else if (_hasDecorator(outer, "@staticmethod")) {
                decorator = "@staticmethod";
                NormalizedNode owner = SourceLayout.enclosingClass(context, function.getNode());
                callee = FunctionExtractor.nameOf(owner) + "." + helperName;
            } else {
                throw new TransformationException("Method '" + function.getName() + "' has no receiver");
            }
        } else {
            helperName = context.uniqueName(function.getName() + "_part", "_");
            callee = helperName;
        }
        helperParams.addAll(inputs);

        String definitionIndent = context.indentationOf(outer);
        String bodyIndent = context.indentationOf(run.statements.get(0));
        StringBuilder helper = new StringBuilder();
        if (decorator != null) {
            helper.append(definitionIndent).append(decorator).append('\n');
        }
        helper.append(definitionIndent).append("def ").append(helperName)
                .append('(').append(String.join(", ", helperParams)).append("):\n")
                .append(_runText(context, run));
        if (!outputs.isEmpty()) {
            helper.append(bodyIndent).append("return ").append(String.join(", ", outputs)).append('\n');
        }
        helper.append(definitionIndent.isEmpty() ? "\n\n" : "\n");

        String call = bodyIndent + (outputs.isEmpty() ? "" : String.join(", ", outputs) + " = ")
                + callee + "(" + String.join(", ", inputs) + ")\n";

        TextEdits edits = new TextEdits(context.getCode());
        edits.insert(context.lineStartOf(outer), helper.toString());
        edits.replace(run.start, run.end, call);
        return _result(edits, function, run, helperName);
    }

    private Transformation _c(TransformationContext context, FunctionInfo function, Run run) {
        Signature signature = _bracedSignature(context, function, run);
        String helperName = context.uniqueName(function.getName() + "_part", "_");

        NormalizedNode parameters = Parameters.listOf(function);
        boolean sameLineBrace = parameters != null && parameters.getEndLine() == function.getBody().getStartLine();
        String helper = "static void " + helperName + "("
                + (signature.declarations.isEmpty() ? "void" : String.join(", ", signature.declarations)) + ")"
                + (sameLineBrace ? " {\n" : "\n{\n")
                + _runText(context, run) + "}\n\n";

        TextEdits edits = new TextEdits(context.getCode());
        edits.insert(context.lineStartOf(function.getNode()), helper);
        edits.replace(run.start, run.end, _bracedCall(context, run, helperName, signature));
        return _result(edits, function, run, helperName);
    }

    private Transformation _java(TransformationContext context, FunctionInfo function, Run run) {
        if (JavaMembers.hasTypeParameters(context, function)) {
            throw new TransformationException("Generic method '" + function.getName() + "' is not supported");
        }
        if (!context.endsLine(function.getNode())) {
            throw new TransformationException("Method '" + function.getName() + "' does not end its line");
        }
        Signature signature = _bracedSignature(context, function, run);
        String base = Character.toLowerCase(function.getName().charAt(0)) + function.getName().substring(1);
        String helperName = context.uniqueName(base + "Part", "");

        NormalizedNode node = function.getNode();
        NormalizedNode nameNode = node.firstChild(NodeTypes.TYPE)
                .orElseGet(() -> node.firstChild(NodeTypes.IDENTIFIER).orElse(node));
        String modifiers = ANNOTATION.matcher(
                context.text(node.getSpan().getStartOffset(), nameNode.getSpan().getStartOffset())).replaceAll("");
        boolean isStatic = Pattern.compile("\\bstatic\\b").matcher(modifiers).find();
        String throwsClause = context.text(Parameters.listOf(function).getSpan().getEndOffset(),
                function.getBody().getSpan().getStartOffset()).strip();

        String indent = context.indentationOf(node);
        String helper = "\n" + indent + "private " + (isStatic ? "static " : "") + "void " + helperName
                + "(" + String.join(", ", signature.declarations) + ")"
                + (throwsClause.isEmpty() ? "" : " " + throwsClause) + " {\n"
                + _runText(context, run) + indent + "}\n";

        TextEdits edits = new TextEdits(context.getCode());
        edits.replace(run.start, run.end, _bracedCall(context, run, helperName, signature));
        edits.insert(context.lineEndOf(node), helper);
        return _result(edits, function, run, helperName);
    }

    private Run _selectRun(TransformationContext context, FunctionInfo function) {
        List<NormalizedNode> all = function.getBody().getChildren();
        int first = 0;
        if (!all.isEmpty() && (all.get(0).is(BodyInsertion.CONSTRUCTOR_CALL)
                || context.getLanguage() == Language.PYTHON && SourceLayout.isDocstring(all.get(0)))) {
            first = 1;
        }
        int count = all.size() - first;
        int from = first + count / 3;
        int to = first + 2 * count / 3;
        if (to - from < 2) {
            throw new TransformationException("Body of '" + function.getName() + "' has too few statements to extract");
        }

        List<NormalizedNode> statements = all.subList(from, to);
        NormalizedNode head = statements.get(0);
        NormalizedNode tail = statements.get(statements.size() - 1);
        boolean alone = context.startsLine(head) && context.endsLine(tail)
                && (from == 0 || all.get(from - 1).getEndLine() < head.getStartLine())
                && all.get(to).getStartLine() > tail.getEndLine();
        if (!alone) {
            throw new TransformationException("Statements to extract from '" + function.getName()
                    + "' share lines with other code");
        }
        return new Run(all.subList(0, from), statements, all.subList(to, all.size()),
                context.lineStartOf(head), context.lineEndOf(tail));
    }

    private static void _checkExits(TransformationContext context, Run run) {
        for (NormalizedNode statement : run.statements) {
            for (NormalizedNode node : _walk(statement, true)) {
                if (EXITS.contains(node.getType())) {
                    throw new TransformationException("Statements to extract contain a " + node.getType()
                            + " at line " + node.getStartLine());
                }
                boolean escapes = node.is(NodeTypes.BREAK_STATEMENT)
                        && !_enclosedBy(context, node, statement, true)
                        || node.is(NodeTypes.CONTINUE_STATEMENT) && !_enclosedBy(context, node, statement, false);
                if (escapes) {
                    throw new TransformationException("Statements to extract jump out of their block at line "
                            + node.getStartLine());
                }
            }
        }
    }

    private static boolean _enclosedBy(TransformationContext context, NormalizedNode node, NormalizedNode statement,
                                       boolean switchCounts) {
        if (node == statement) {
            return false;
        }
        for (NormalizedNode ancestor : context.getIndex().ancestors(node)) {
            if (LOOPS.contains(ancestor.getType()) || switchCounts && ancestor.is(NodeTypes.SWITCH_STATEMENT)) {
                return true;
            }
            if (ancestor == statement) {
                break;
            }
        }
        return false;
    }

    // C and Java

    private Signature _bracedSignature(TransformationContext context, FunctionInfo function, Run run) {
        Signature signature = new Signature();
        Set<String> paramNames = new LinkedHashSet<>();
        for (NormalizedNode param : Parameters.all(function)) {
            if (Parameters.isSplat(param) || context.text(param).contains("...")) {
                throw new TransformationException("Variadic function '" + function.getName() + "' is not supported");
            }
            if (context.getLanguage() == Language.C) {
                NormalizedNode declarator = Parameters.cDeclarator(param);
                if (declarator == null || declarator.is("abstract_declarator")) {
                    continue;
                }
            }
            String name = FunctionExtractor.parameterName(param);
            paramNames.add(name);
            signature.declarations.add(context.text(param));
            signature.arguments.add(name);
        }

        Map<String, String> earlier = new LinkedHashMap<>();
        for (NormalizedNode statement : run.before) {
            earlier.putAll(_declarations(context, statement));
        }
        Set<String> assigned = _bracedTargets(run.statements);
        Set<String> usedAfter = _names(context, run.after);

        for (String name : _names(context, run.statements)) {
            boolean parameter = paramNames.contains(name);
            if (!parameter && !earlier.containsKey(name)) {
                continue;
            }
            if (assigned.contains(name) && usedAfter.contains(name)) {
                throw new TransformationException("Statements assign '" + name + "', which is read after them");
            }
            if (!parameter) {
                String declaration = earlier.get(name);
                if (declaration == null) {
                    throw new TransformationException("Local '" + name + "' cannot be passed to a helper");
                }
                signature.declarations.add(declaration);
                signature.arguments.add(name);
            }
        }

        for (NormalizedNode statement : run.statements) {
            for (String declared : _declarations(context, statement).keySet()) {
                if (usedAfter.contains(declared)) {
                    throw new TransformationException("Local '" + declared
                            + "' declared in the extracted statements is used after them");
                }
            }
        }
        return signature;
    }

    private static String _bracedCall(TransformationContext context, Run run, String helperName, Signature signature) {
        return context.indentationOf(run.statements.get(0)) + helperName
                + "(" + String.join(", ", signature.arguments) + ");\n";
    }

    /**
     * Locals a statement declares, each with the parameter declaration that would receive it, or
     * null when its declarator cannot be written as a parameter.
     */
    private static Map<String, String> _declarations(TransformationContext context, NormalizedNode statement) {
        Map<String, String> result = new LinkedHashMap<>();
        NormalizedNode declaration = statement;
        if (statement.is(NodeTypes.EXPRESSION_STATEMENT) && statement.getChildren().size() == 1) {
            declaration = statement.getChildren().get(0);
        }
        if (!declaration.is(NodeTypes.DECLARATION)) {
            return result;
        }

        if (context.getLanguage() == Language.JAVA) {
            List<NormalizedNode> declarators = new ArrayList<>();
            for (NormalizedNode child : declaration.getChildren()) {
                if (child.is(NodeTypes.INIT_DECLARATOR) || child.is("variable_declarator")) {
                    declarators.add(child);
                }
            }
            if (declarators.isEmpty()) {
                return result;
            }
            String type = ANNOTATION.matcher(context.text(declaration.getSpan().getStartOffset(),
                    declarators.get(0).getSpan().getStartOffset())).replaceAll("")
                    .replaceAll("\\bfinal\\b", "").strip();
            for (NormalizedNode declarator : declarators) {
                String name = declarator.getChildren().get(0).getText();
                result.put(name, type.equals("var") || type.isEmpty() ? null : type + " " + name);
            }
            return result;
        }

        String type = declaration.firstChild(NodeTypes.TYPE).map(t -> _withoutStorageClass(context.text(t))).orElse("");
        for (NormalizedNode child : declaration.getChildren()) {
            if (child.is(NodeTypes.TYPE)) {
                continue;
            }
            NormalizedNode declarator = child.is(NodeTypes.INIT_DECLARATOR) ? child.getChildren().get(0) : child;
            NormalizedNode name = declarator;
            while (name.is("pointer_declarator")) {
                name = name.getChildren().get(0);
            }
            if (!name.is(NodeTypes.IDENTIFIER)) {
                NormalizedNode innermost = _innermostName(declarator);
                if (innermost != null) {
                    result.put(innermost.getText(), null);
                }
                continue;
            }
            String pointers = context.text(declarator.getSpan().getStartOffset(), name.getSpan().getStartOffset())
                    .replaceAll("\\s+", " ").strip();
            result.put(name.getText(), type.isEmpty() ? null : type + " " + pointers + name.getText());
        }
        return result;
    }

    private static NormalizedNode _innermostName(NormalizedNode declarator) {
        NormalizedNode current = declarator;
        while (!current.is(NodeTypes.IDENTIFIER)) {
            if (current.getChildren().isEmpty()) {
                return null;
            }
            current = current.getChildren().get(0);
        }
        return current;
    }

    private static String _withoutStorageClass(String specifiers) {
        List<String> kept = new ArrayList<>();
        for (String word : specifiers.strip().split("\\s+")) {
            if (!STORAGE_CLASSES.contains(word)) {
                kept.add(word);
            }
        }
        return String.join(" ", kept);
    }

    private static Set<String> _bracedTargets(List<NormalizedNode> statements) {
        Set<String> result = new LinkedHashSet<>();
        for (NormalizedNode statement : statements) {
            for (NormalizedNode node : _walk(statement, false)) {
                boolean writes = node.is(NodeTypes.ASSIGNMENT) || node.is(NodeTypes.AUGMENTED_ASSIGNMENT)
                        || node.is("update_expression");
                if (writes && !node.getChildren().isEmpty() && node.getChildren().get(0).is(NodeTypes.IDENTIFIER)) {
                    result.add(node.getChildren().get(0).getText());
                }
            }
        }
        return result;
    }

    // Python

    private static Set<String> _pythonTargets(List<NormalizedNode> statements) {
        Set<String> result = new LinkedHashSet<>();
        for (NormalizedNode statement : statements) {
            for (NormalizedNode node : _walk(statement, true)) {
                if (node.is(NodeTypes.ASSIGNMENT) || node.is(NodeTypes.AUGMENTED_ASSIGNMENT)
                        || node.is(NodeTypes.FOR_STATEMENT) || node.is("named_expression")) {
                    _collectTargets(node.getChildren().get(0), result);
                } else if (node.is("with_item") && node.getChildren().size() == 2) {
                    _collectTargets(node.getChildren().get(1), result);
                }
            }
        }
        return result;
    }

    private static void _collectTargets(NormalizedNode target, Set<String> result) {
        if (target.is(NodeTypes.IDENTIFIER)) {
            result.add(target.getText());
        } else if (TARGET_GROUPS.contains(target.getType())) {
            for (NormalizedNode child : target.getChildren()) {
                _collectTargets(child, result);
            }
        }
    }

    private static boolean _hasDecorator(NormalizedNode outer, String decorator) {
        if (!outer.is(NodeTypes.DECORATED_DEFINITION)) {
            return false;
        }
        for (NormalizedNode child : outer.childrenOfType(NodeTypes.DECORATOR)) {
            if (child.getText().strip().equals(decorator)) {
                return true;
            }
        }
        return false;
    }

    // Shared

    /**
     * Names spelled in the statements, in order of appearance, leaving out member names after a dot
     * and keyword-argument names.
     */
    private static Set<String> _names(TransformationContext context, List<NormalizedNode> statements) {
        Set<String> result = new LinkedHashSet<>();
        for (NormalizedNode statement : statements) {
            for (NormalizedNode node : _walk(statement, false)) {
                if (!node.is(NodeTypes.IDENTIFIER)) {
                    continue;
                }
                NormalizedNode parent = context.getIndex().parentOf(node);
                boolean member = parent != null && parent.getChildren().indexOf(node) > 0
                        && parent.is(NodeTypes.ATTRIBUTE);
                boolean keyword = parent != null && parent.getChildren().indexOf(node) == 0
                        && parent.is(NodeTypes.KEYWORD_ARGUMENT);
                if (!member && !keyword) {
                    result.add(node.getText());
                }
            }
        }
        return result;
    }

    private static List<NormalizedNode> _walk(NormalizedNode root, boolean skipNestedScopes) {
        List<NormalizedNode> result = new ArrayList<>();
        Deque<NormalizedNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            NormalizedNode node = stack.pop();
            result.add(node);
            if (skipNestedScopes && node != root && NESTED_SCOPES.contains(node.getType())) {
                continue;
            }
            List<NormalizedNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    private static String _runText(TransformationContext context, Run run) {
        String text = context.text(run.start, run.end);
        return text.endsWith("\n") ? text : text + "\n";
    }

    private static Transformation _result(TextEdits edits, FunctionInfo function, Run run, String helperName) {
        return new Transformation(edits.apply(),
                List.of("Extracted " + run.statements.size() + " statement(s) of " + function.getName()
                        + " into " + helperName),
                List.of());
    }

    private static final class Run {
        private final List<NormalizedNode> before;
        private final List<NormalizedNode> statements;
        private final List<NormalizedNode> after;
        private final int start;
        private final int end;

        Run(List<NormalizedNode> before, List<NormalizedNode> statements, List<NormalizedNode> after,
            int start, int end) {
            this.before = before;
            this.statements = statements;
            this.after = after;
            this.start = start;
            this.end = end;
        }
    }

    private static final class Signature {
        private final List<String> declarations = new ArrayList<>();
        private final List<String> arguments = new ArrayList<>();
    }
}
