package com.connascence.refactor.handlers;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.connascence.ast.FunctionExtractor;
import com.connascence.ast.FunctionInfo;
import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import com.connascence.refactor.FunctionTarget;
import com.connascence.refactor.RefactoringCandidate;
import com.connascence.refactor.TechniqueHandler;
import com.connascence.refactor.TextEdits;
import com.connascence.refactor.Transformation;
import com.connascence.refactor.TransformationContext;
import com.connascence.refactor.TransformationException;

/**
 * Replaces a long parameter list with a single object: a dataclass in Python, a struct in C,
 * a nested record in Java. The body unpacks the object into the old names, and calls in the same
 * unit are rewritten to build it.
 */
public class ParameterObjectHandler implements TechniqueHandler {
    private static final Pattern DATACLASS_IMPORT = Pattern.compile("from\\s+dataclasses\\s+import\\b.*\\bdataclass\\b");

    @Override
    public Transformation apply(TransformationContext context, RefactoringCandidate candidate) {
        FunctionInfo function = context.function(candidate.target(FunctionTarget.class));
        if (function.getBody() == null) {
            throw new TransformationException("Function '" + function.getName() + "' has no body");
        }
        return switch (context.getLanguage()) {
            case PYTHON -> _python(context, function);
            case C -> _c(context, function);
            case JAVA -> _java(context, function);
            default -> throw new TransformationException("Parameter objects are not supported for "
                    + context.getLanguage().getId());
        };
    }

    private Transformation _python(TransformationContext context, FunctionInfo function) {
        List<NormalizedNode> params = Parameters.python(function);
        _requirePlain(function, params);

        String className = context.uniqueName(upperCamel(function.getName()) + "Params", "");
        StringBuilder dataclass = new StringBuilder("@dataclass\nclass ").append(className).append(":\n");
        List<String> unpack = new ArrayList<>();
        for (NormalizedNode param : params) {
            String name = FunctionExtractor.parameterName(param);
            String annotation = Parameters.pythonAnnotation(param);
            String defaultValue = Parameters.pythonDefault(param);
            dataclass.append("    ").append(name).append(": ").append(annotation == null ? "object" : annotation);
            if (defaultValue != null) {
                dataclass.append(" = ").append(defaultValue);
            }
            dataclass.append('\n');
            unpack.add(name + " = params." + name);
        }

        TextEdits edits = new TextEdits(context.getCode());
        if (!_importsDataclass(context)) {
            int at = SourceLayout.pythonHeaderEnd(context);
            String importLine = "from dataclasses import dataclass\n";
            edits.insert(at, SourceLayout.atLineStart(context, at, at == 0 ? importLine + "\n" : importLine));
        }
        NormalizedNode top = context.topLevel(context.outerDefinition(function.getNode()));
        edits.insert(context.lineStartOf(top), dataclass.append("\n\n").toString());

        NormalizedNode receiver = Parameters.pythonReceiver(function);
        String signature = "(" + (receiver == null ? "" : receiver.getText() + ", ") + "params: " + className + ")";
        edits.replace(_start(Parameters.listOf(function)), _end(Parameters.listOf(function)), signature);
        BodyInsertion.atStart(context, function, unpack, edits);

        List<String> warnings = new ArrayList<>();
        int rewritten = 0;
        for (NormalizedNode call : _calls(context, function)) {
            NormalizedNode callee = call.getChildren().get(0);
            boolean matches = receiver == null ? callee.is(NodeTypes.IDENTIFIER) : callee.is(NodeTypes.ATTRIBUTE);
            if (matches) {
                _wrapArguments(context, edits, call, className + "(", ")");
                rewritten++;
            }
        }
        return _result(edits, function, className, rewritten, warnings);
    }

    private Transformation _c(TransformationContext context, FunctionInfo function) {
        List<NormalizedNode> params = Parameters.all(function);
        _requirePlain(function, params);

        String structName = context.uniqueName(function.getName() + "_params", "_");
        StringBuilder struct = new StringBuilder("struct ").append(structName).append(" {\n");
        List<String> unpack = new ArrayList<>();
        for (NormalizedNode param : params) {
            NormalizedNode declarator = Parameters.cDeclarator(param);
            if (declarator == null || !_isPlainCDeclarator(declarator)) {
                throw new TransformationException("Parameter '" + context.text(param) + "' of '"
                        + function.getName() + "' cannot become a struct member");
            }
            String name = FunctionExtractor.parameterName(param);
            struct.append("    ").append(context.text(param)).append(";\n");
            unpack.add(context.text(param) + " = params." + name + ";");
        }
        struct.append("};\n\n");

        TextEdits edits = new TextEdits(context.getCode());
        edits.insert(context.lineStartOf(function.getNode()), struct.toString());
        edits.replace(_start(Parameters.listOf(function)), _end(Parameters.listOf(function)),
                "(struct " + structName + " params)");
        BodyInsertion.atStart(context, function, unpack, edits);

        List<String> warnings = new ArrayList<>();
        int rewritten = 0;
        for (NormalizedNode call : _calls(context, function)) {
            if (call.getChildren().get(0).is(NodeTypes.IDENTIFIER) && _argumentCount(call) == params.size()) {
                _wrapArguments(context, edits, call, "(struct " + structName + "){", "}");
                rewritten++;
            } else {
                warnings.add("Call to " + function.getName() + " at line " + call.getStartLine() + " left unchanged");
            }
        }
        for (NormalizedNode node : context.getIndex().nodes()) {
            if (node.is("function_declarator") && node.firstChild(NodeTypes.IDENTIFIER)
                    .map(id -> id.getText().equals(function.getName())).orElse(false)) {
                warnings.add("Declaration of " + function.getName() + " at line " + node.getStartLine()
                        + " keeps the old parameter list");
            }
        }
        return _result(edits, function, "struct " + structName, rewritten, warnings);
    }

    private Transformation _java(TransformationContext context, FunctionInfo function) {
        List<NormalizedNode> params = Parameters.all(function);
        _requirePlain(function, params);
        if (JavaMembers.hasTypeParameters(context, function)) {
            throw new TransformationException("Generic method '" + function.getName() + "' is not supported");
        }
        boolean constructor = function.getNode().firstChild(NodeTypes.TYPE).isEmpty();
        NormalizedNode body = function.getBody();
        if (constructor && !body.getChildren().isEmpty() && body.getChildren().get(0).is(BodyInsertion.CONSTRUCTOR_CALL)) {
            throw new TransformationException("Constructor delegating with this() or super() is not supported");
        }
        if (!context.endsLine(function.getNode())) {
            throw new TransformationException("Method '" + function.getName() + "' does not end its line");
        }

        String recordName = context.uniqueName(upperCamel(function.getName()) + "Params", "");
        List<String> components = new ArrayList<>();
        List<String> unpack = new ArrayList<>();
        for (NormalizedNode param : params) {
            String text = context.text(param);
            if (text.contains("...")) {
                throw new TransformationException("Varargs parameter of '" + function.getName() + "' is not supported");
            }
            String name = FunctionExtractor.parameterName(param);
            components.add(text.replaceAll("\\bfinal\\s+", ""));
            unpack.add(text + " = params." + name + "();");
        }

        NormalizedNode owner = SourceLayout.enclosingClass(context, function.getNode());
        boolean interfaceMember = owner != null && SourceLayout.javaTypeKeyword(context, owner).equals("interface");
        String indent = context.indentationOf(function.getNode());
        String record = "\n" + indent + (interfaceMember ? "" : "private ") + "record " + recordName
                + "(" + String.join(", ", components) + ") {\n" + indent + "}\n";

        TextEdits edits = new TextEdits(context.getCode());
        edits.replace(_start(Parameters.listOf(function)), _end(Parameters.listOf(function)),
                "(" + recordName + " params)");
        BodyInsertion.atStart(context, function, unpack, edits);
        edits.insert(context.lineEndOf(function.getNode()), record);

        List<String> warnings = new ArrayList<>();
        int rewritten = 0;
        if (JavaMembers.isOverloaded(context, function)) {
            warnings.add(function.getName() + " is overloaded; calls left unchanged");
        } else {
            List<NormalizedNode> calls = constructor
                    ? JavaMembers.instantiations(context, function)
                    : _calls(context, function);
            for (NormalizedNode call : calls) {
                if (_argumentCount(call) == params.size()) {
                    _wrapArguments(context, edits, call, "new " + recordName + "(", ")");
                    rewritten++;
                } else {
                    warnings.add("Call to " + function.getName() + " at line " + call.getStartLine() + " left unchanged");
                }
            }
        }
        return _result(edits, function, "record " + recordName, rewritten, warnings);
    }

    static String upperCamel(String name) {
        StringBuilder result = new StringBuilder();
        boolean upper = true;
        for (char c : name.toCharArray()) {
            if (c == '_') {
                upper = true;
            } else if (upper) {
                result.append(Character.toUpperCase(c));
                upper = false;
            } else {
                result.append(c);
            }
        }
        return result.length() == 0 ? "Function" : result.toString();
    }

    private static void _requirePlain(FunctionInfo function, List<NormalizedNode> params) {
        if (params.isEmpty()) {
            throw new TransformationException("Function '" + function.getName() + "' has no parameters");
        }
        for (NormalizedNode param : params) {
            if (Parameters.isSplat(param)) {
                throw new TransformationException("Function '" + function.getName()
                        + "' has variadic or keyword-only parameters");
            }
        }
    }

    private static boolean _isPlainCDeclarator(NormalizedNode declarator) {
        NormalizedNode current = declarator;
        while (current.is("pointer_declarator")) {
            current = current.getChildren().get(0);
        }
        return current.is(NodeTypes.IDENTIFIER);
    }

    private static boolean _importsDataclass(TransformationContext context) {
        for (NormalizedNode node : context.getIndex().nodes()) {
            if (node.is(NodeTypes.IMPORT_STATEMENT) && DATACLASS_IMPORT.matcher(node.getText()).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<NormalizedNode> _calls(TransformationContext context, FunctionInfo function) {
        List<NormalizedNode> calls = new ArrayList<>();
        for (NormalizedNode node : context.getIndex().nodes()) {
            if (node.is(NodeTypes.CALL) && function.getName().equals(FunctionExtractor.calleeName(node))) {
                calls.add(node);
            }
        }
        return calls;
    }

    private static NormalizedNode _arguments(NormalizedNode call) {
        return call.firstChild(NodeTypes.ARGUMENT_LIST)
                .orElseThrow(() -> new TransformationException("Call at line " + call.getStartLine()
                        + " has no argument list"));
    }

    private static int _argumentCount(NormalizedNode call) {
        return _arguments(call).getChildren().size();
    }

    // Argument lists either span their parentheses or, for Java constructor calls, only their members
    private static void _wrapArguments(TransformationContext context, TextEdits edits, NormalizedNode call,
                                       String open, String close) {
        NormalizedNode arguments = _arguments(call);
        int start = arguments.getSpan().getStartOffset();
        int end = arguments.getSpan().getEndOffset();
        if (context.text(arguments).startsWith("(")) {
            edits.insert(start + 1, open);
            edits.insert(end - 1, close);
        } else {
            edits.insert(start, open);
            edits.insert(end, close);
        }
    }

    private static int _start(NormalizedNode node) {
        return node.getSpan().getStartOffset();
    }

    private static int _end(NormalizedNode node) {
        return node.getSpan().getEndOffset();
    }

    private static Transformation _result(TextEdits edits, FunctionInfo function, String introduced, int rewritten,
                                          List<String> warnings) {
        return new Transformation(edits.apply(),
                List.of("Introduced " + introduced + " for " + function.getName(),
                        "Rewrote " + rewritten + " call(s) to " + function.getName()),
                warnings);
    }
}
