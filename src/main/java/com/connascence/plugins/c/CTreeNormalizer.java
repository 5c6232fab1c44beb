package com.connascence.plugins.c;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import com.connascence.plugins.TreeSitterNormalizer;
import org.treesitter.TSNode;

/**
 * Maps the tree-sitter C grammar onto the shared vocabulary. Declaration specifiers are grouped
 * into one {@code type} node, function definitions are flattened to name, parameters and body,
 * and a parenthesized pointer declarator with a parameter list becomes a {@code function_pointer}.
 */
class CTreeNormalizer extends TreeSitterNormalizer {
    private static final Map<String, String> RENAMED = Map.ofEntries(
            Map.entry("compound_statement", NodeTypes.BLOCK),
            Map.entry("parameter_list", NodeTypes.PARAMETERS),
            Map.entry("call_expression", NodeTypes.CALL),
            Map.entry("field_expression", NodeTypes.ATTRIBUTE),
            Map.entry("subscript_expression", NodeTypes.SUBSCRIPT),
            Map.entry("case_statement", NodeTypes.CASE_CLAUSE),
            Map.entry("type_definition", NodeTypes.DECLARATION),
            Map.entry("string_literal", NodeTypes.STRING),
            Map.entry("raw_string_literal", NodeTypes.STRING),
            Map.entry("field_identifier", NodeTypes.IDENTIFIER),
            Map.entry("statement_identifier", NodeTypes.IDENTIFIER),
            Map.entry("type_identifier", NodeTypes.IDENTIFIER),
            Map.entry("null", NodeTypes.IDENTIFIER),
            Map.entry("preproc_function_def", NodeTypes.PREPROC_DEF),
            Map.entry("preproc_call", NodeTypes.PREPROC_DIRECTIVE),
            Map.entry("abstract_pointer_declarator", "abstract_declarator"),
            Map.entry("abstract_array_declarator", "abstract_declarator"),
            Map.entry("abstract_function_declarator", "abstract_declarator"),
            Map.entry("abstract_parenthesized_declarator", "abstract_declarator"));

    private static final Set<String> TYPE_OWNERS = Set.of(
            "declaration", "type_definition", "function_definition", "parameter_declaration",
            "field_declaration", "type_descriptor");

    private static final Set<String> TYPE_SPECIFIERS = Set.of(
            "primitive_type", "sized_type_specifier", "type_identifier", "macro_type_specifier",
            "struct_specifier", "union_specifier", "enum_specifier");

    private static final Set<String> TAGGED_SPECIFIERS = Set.of(
            "struct_specifier", "union_specifier", "enum_specifier");

    private static final Set<String> QUALIFIERS = Set.of(
            "storage_class_specifier", "type_qualifier", "attribute_specifier", "attribute_declaration",
            "ms_declspec_modifier", "ms_call_modifier", "ms_pointer_modifier", "alignas_qualifier");

    private static final Set<String> COMPARISONS = Set.of("==", "!=", "<", ">", "<=", ">=");

    CTreeNormalizer(String source) {
        super(source);
    }

    @Override
    protected boolean isLeaf(String type) {
        return type.equals("string_literal") || type.equals("raw_string_literal") || type.equals("char_literal")
                || type.equals("system_lib_string") || type.equals("number_literal") || type.equals("preproc_arg");
    }

    @Override
    protected boolean isTransparent(String type) {
        return type.equals("field_designator") || type.equals("subscript_designator");
    }

    @Override
    protected boolean isSkipped(String type) {
        return QUALIFIERS.contains(type);
    }

    @Override
    protected NormalizedNode convertNode(TSNode node) {
        if (!node.isMissing() && TYPE_OWNERS.contains(node.getType())) {
            return convert(node, _withType(node));
        }
        return super.convertNode(node);
    }

    @Override
    protected NormalizedNode convert(TSNode node, List<NormalizedNode> children) {
        String type = node.getType();
        switch (type) {
            case "function_definition":
                return _functionDefinition(node, children);
            case "function_declarator":
            case "abstract_function_declarator":
                if (_isFunctionPointer(node)) {
                    List<NormalizedNode> parts = new ArrayList<>(children.get(0).getChildren());
                    parts.addAll(children.subList(1, children.size()));
                    return node(NodeTypes.FUNCTION_POINTER, node, parts);
                }
                break;
            case "parameter_list":
                return node(NodeTypes.PARAMETERS, node, _withoutVoid(children));
            case "number_literal":
                return leaf(_isFloat(textOf(node)) ? NodeTypes.FLOAT : NodeTypes.INTEGER, node);
            case "assignment_expression":
                return node(operatorOf(node).equals("=") ? NodeTypes.ASSIGNMENT : NodeTypes.AUGMENTED_ASSIGNMENT,
                        node, children);
            case "binary_expression":
                return node(_binaryType(operatorOf(node)), node, children);
            case "unary_expression":
                return node(operatorOf(node).equals("!") ? NodeTypes.NOT_OPERATOR : NodeTypes.UNARY_OPERATOR,
                        node, children);
            case "expression_statement":
                if (children.isEmpty()) {
                    return leaf("empty_statement", node);
                }
                break;
            default:
                if (type.startsWith("preproc_")) {
                    return trimmed(node(RENAMED.getOrDefault(type, type), node, children));
                }
                break;
        }
        return node(RENAMED.getOrDefault(type, type), node, children);
    }

    /**
     * Children of a declaration-like node with its leading specifiers grouped into one type node.
     * A type name after the first type specifier is a declarator, as in {@code typedef int count_t;}.
     */
    private List<NormalizedNode> _withType(TSNode node) {
        List<NormalizedNode> children = new ArrayList<>();
        List<NormalizedNode> tagged = new ArrayList<>();
        int typeStart = node.getType().equals("type_definition") ? startOf(node) : -1;
        int typeEnd = -1;
        boolean sawType = false;
        boolean inSpecifiers = true;

        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (child == null || child.isNull()) {
                continue;
            }
            if (child.isMissing() || NodeTypes.ERROR.equals(child.getType())) {
                children.add(leaf(NodeTypes.ERROR, child));
                continue;
            }
            String type = child.getType();
            if (!child.isNamed() || type.equals("comment")) {
                continue;
            }
            boolean specifier = inSpecifiers
                    && (QUALIFIERS.contains(type) || !sawType && TYPE_SPECIFIERS.contains(type));
            if (specifier) {
                sawType |= TYPE_SPECIFIERS.contains(type);
                typeStart = typeStart < 0 ? startOf(child) : typeStart;
                typeEnd = endOf(child);
                if (TAGGED_SPECIFIERS.contains(type)) {
                    tagged.add(convertNode(child));
                }
                continue;
            }
            inSpecifiers = false;
            if (QUALIFIERS.contains(type)) {
                continue;
            }
            NormalizedNode converted = convertNode(child);
            if (converted != null) {
                children.add(converted);
            }
        }

        if (typeEnd >= 0) {
            children.add(0, node(NodeTypes.TYPE, typeStart, typeEnd, tagged));
        }
        return children;
    }

    /**
     * {@code type name(parameters) body}, whatever pointers or parentheses wrap the name.
     */
    private NormalizedNode _functionDefinition(TSNode node, List<NormalizedNode> children) {
        List<NormalizedNode> flat = new ArrayList<>();
        boolean found = false;
        for (NormalizedNode child : children) {
            boolean candidate = !found && !child.is(NodeTypes.TYPE) && !child.is(NodeTypes.BLOCK);
            NormalizedNode declarator = candidate ? _functionDeclarator(child) : null;
            if (declarator == null) {
                flat.add(child);
                continue;
            }
            flat.addAll(declarator.getChildren());
            found = true;
        }
        return node(NodeTypes.FUNCTION_DEFINITION, node, flat);
    }

    private static NormalizedNode _functionDeclarator(NormalizedNode declarator) {
        for (NormalizedNode candidate : declarator.findAll("function_declarator")) {
            List<NormalizedNode> parts = candidate.getChildren();
            if (parts.size() >= 2 && parts.get(0).is(NodeTypes.IDENTIFIER) && parts.get(1).is(NodeTypes.PARAMETERS)) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean _isFunctionPointer(TSNode node) {
        List<TSNode> parts = namedChildren(node);
        if (parts.size() < 2 || !parts.get(0).getType().endsWith("parenthesized_declarator")) {
            return false;
        }
        List<TSNode> inner = namedChildren(parts.get(0));
        return !inner.isEmpty() && inner.get(0).getType().endsWith("pointer_declarator");
    }

    // "(void)" declares no parameters
    private static List<NormalizedNode> _withoutVoid(List<NormalizedNode> parameters) {
        if (parameters.size() == 1 && parameters.get(0).getChildren().size() == 1
                && parameters.get(0).getText().strip().equals("void")) {
            return List.of();
        }
        return parameters;
    }

    private static String _binaryType(String operator) {
        if (operator.equals("&&") || operator.equals("||")) {
            return NodeTypes.BOOLEAN_OPERATOR;
        }
        return COMPARISONS.contains(operator) ? NodeTypes.COMPARISON_OPERATOR : NodeTypes.BINARY_OPERATOR;
    }

    private static boolean _isFloat(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x")) {
            return lower.contains(".") || lower.contains("p");
        }
        return lower.contains(".") || lower.contains("e");
    }
}
