package com.connascence.plugins.python;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import com.connascence.plugins.TreeSitterNormalizer;
import org.treesitter.TSNode;

/**
 * Python grammar nodes already use the shared vocabulary; only imports, lambda parameters and
 * {@code as} targets are reshaped.
 */
class PythonTreeNormalizer extends TreeSitterNormalizer {
    private static final Set<String> IMPORTS = Set.of("import_from_statement", "future_import_statement");

    // compound statements end with their last block, not with trailing comments
    private static final Set<String> COMPOUND = Set.of(
            NodeTypes.FUNCTION_DEFINITION, NodeTypes.CLASS_DEFINITION, NodeTypes.DECORATED_DEFINITION,
            NodeTypes.IF_STATEMENT, NodeTypes.ELIF_CLAUSE, NodeTypes.ELSE_CLAUSE, NodeTypes.FOR_STATEMENT,
            NodeTypes.WHILE_STATEMENT, NodeTypes.TRY_STATEMENT, NodeTypes.EXCEPT_CLAUSE,
            NodeTypes.FINALLY_CLAUSE, NodeTypes.WITH_STATEMENT, "match_statement", NodeTypes.CASE_CLAUSE);

    PythonTreeNormalizer(String source) {
        super(source);
    }

    @Override
    protected boolean isLeaf(String type) {
        return type.equals(NodeTypes.STRING);
    }

    @Override
    protected boolean isTransparent(String type) {
        return type.equals("with_clause") || type.equals("as_pattern_target");
    }

    @Override
    protected NormalizedNode convert(TSNode node, List<NormalizedNode> children) {
        String type = node.getType();
        if (IMPORTS.contains(type)) {
            return node(NodeTypes.IMPORT_STATEMENT, node, children);
        }
        if (type.equals("lambda_parameters")) {
            return node(NodeTypes.PARAMETERS, node, children);
        }
        if (type.equals("with_item") || type.equals(NodeTypes.EXCEPT_CLAUSE)) {
            return _clippedIfCompound(node(type, node, _withoutAsPattern(children)));
        }
        if (type.equals(NodeTypes.BLOCK) && !children.isEmpty()) {
            return node(NodeTypes.BLOCK, children.get(0).getSpan().getStartOffset(),
                    children.get(children.size() - 1).getSpan().getEndOffset(), children);
        }
        return _clippedIfCompound(node(type, node, children));
    }

    private NormalizedNode _clippedIfCompound(NormalizedNode node) {
        return COMPOUND.contains(node.getType()) ? clippedToChildren(node) : node;
    }

    // "with open(p) as f" and "except E as e": the value and its target become direct children
    private static List<NormalizedNode> _withoutAsPattern(List<NormalizedNode> children) {
        List<NormalizedNode> result = new ArrayList<>();
        for (NormalizedNode child : children) {
            if (child.is("as_pattern")) {
                result.addAll(child.getChildren());
            } else {
                result.add(child);
            }
        }
        return result;
    }
}
