package com.connascence.plugins;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.connascence.ast.LineMap;
import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import org.treesitter.TSNode;

/**
 * Maps a tree-sitter syntax tree onto the shared node vocabulary. Anonymous nodes (keywords and
 * punctuation) and comments are dropped; error and missing nodes become {@code ERROR} leaves.
 * Subclasses rename and reshape the named nodes of their grammar.
 */
public abstract class TreeSitterNormalizer {
    private static final Set<String> EXTRAS = Set.of("comment", "line_continuation");

    protected final String source;
    protected final LineMap lineMap;

    // char offset of every UTF-8 byte, null when the source is plain ASCII
    private final int[] charOffsets;

    protected TreeSitterNormalizer(String source) {
        this.source = source;
        this.lineMap = new LineMap(source);
        this.charOffsets = _charOffsets(source);
    }

    /**
     * Normalizes a whole unit. The root always becomes a {@code module} spanning the full text.
     */
    public NormalizedNode normalize(TSNode root) {
        return new NormalizedNode(NodeTypes.MODULE, lineMap.span(0, source.length()), source, children(root));
    }

    /**
     * Converts one named node, or returns null to drop it.
     */
    protected abstract NormalizedNode convert(TSNode node, List<NormalizedNode> children);

    /**
     * Nodes whose subtree is irrelevant to analysis; they become leaves.
     */
    protected boolean isLeaf(String type) {
        return false;
    }

    /**
     * Wrapper nodes replaced by their own children.
     */
    protected boolean isTransparent(String type) {
        return false;
    }

    /**
     * Named nodes dropped with their subtree.
     */
    protected boolean isSkipped(String type) {
        return false;
    }

    protected NormalizedNode convertNode(TSNode node) {
        if (node.isMissing() || NodeTypes.ERROR.equals(node.getType())) {
            return leaf(NodeTypes.ERROR, node);
        }
        List<NormalizedNode> children = isLeaf(node.getType()) ? List.of() : children(node);
        return convert(node, children);
    }

    /**
     * Converted named children of a node in source order.
     */
    protected List<NormalizedNode> children(TSNode node) {
        List<NormalizedNode> result = new ArrayList<>();
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (_isNull(child)) {
                continue;
            }
            if (child.isMissing() || NodeTypes.ERROR.equals(child.getType())) {
                result.add(leaf(NodeTypes.ERROR, child));
                continue;
            }
            String type = child.getType();
            if (!child.isNamed() || EXTRAS.contains(type) || isSkipped(type)) {
                continue;
            }
            if (isTransparent(type)) {
                result.addAll(children(child));
                continue;
            }
            NormalizedNode converted = convertNode(child);
            if (converted != null) {
                result.add(converted);
            }
        }
        return result;
    }

    /**
     * Named children of a raw node, comments excluded.
     */
    protected static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> result = new ArrayList<>();
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (!_isNull(child) && child.isNamed() && !EXTRAS.contains(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Type of the operator token of an expression node, or an empty string.
     */
    protected static String operatorOf(TSNode node) {
        TSNode operator = node.getChildByFieldName("operator");
        return _isNull(operator) ? "" : operator.getType();
    }

    protected int startOf(TSNode node) {
        return _toChar(node.getStartByte());
    }

    protected int endOf(TSNode node) {
        return _toChar(node.getEndByte());
    }

    protected String textOf(TSNode node) {
        return source.substring(startOf(node), endOf(node));
    }

    protected NormalizedNode leaf(String type, TSNode node) {
        return node(type, startOf(node), endOf(node), List.of());
    }

    protected NormalizedNode node(String type, TSNode node, List<NormalizedNode> children) {
        return node(type, startOf(node), endOf(node), children);
    }

    protected NormalizedNode node(String type, int start, int end, List<NormalizedNode> children) {
        return new NormalizedNode(type, lineMap.span(start, Math.max(start, end)), source, children);
    }

    /**
     * Same node with its end moved back over trailing whitespace.
     */
    protected NormalizedNode trimmed(NormalizedNode node) {
        int start = node.getSpan().getStartOffset();
        int end = node.getSpan().getEndOffset();
        while (end > start && Character.isWhitespace(source.charAt(end - 1))) {
            end--;
        }
        return node(node.getType(), start, end, node.getChildren());
    }

    /**
     * Same node ending where its last child ends.
     */
    protected NormalizedNode clippedToChildren(NormalizedNode node) {
        List<NormalizedNode> children = node.getChildren();
        if (children.isEmpty()) {
            return node;
        }
        int end = children.get(children.size() - 1).getSpan().getEndOffset();
        return node(node.getType(), node.getSpan().getStartOffset(), end, children);
    }

    private int _toChar(int byteOffset) {
        if (charOffsets == null) {
            return Math.min(Math.max(byteOffset, 0), source.length());
        }
        return charOffsets[Math.min(Math.max(byteOffset, 0), charOffsets.length - 1)];
    }

    private static boolean _isNull(TSNode node) {
        return node == null || node.isNull();
    }

    private static int[] _charOffsets(String source) {
        int bytes = 0;
        for (int i = 0; i < source.length(); ) {
            int codePoint = source.codePointAt(i);
            bytes += _utf8Length(codePoint);
            i += Character.charCount(codePoint);
        }
        if (bytes == source.length()) {
            return null;
        }

        int[] offsets = new int[bytes + 1];
        int b = 0;
        for (int i = 0; i < source.length(); ) {
            int codePoint = source.codePointAt(i);
            int length = _utf8Length(codePoint);
            for (int k = 0; k < length; k++) {
                offsets[b + k] = i;
            }
            b += length;
            i += Character.charCount(codePoint);
        }
        offsets[bytes] = source.length();
        return offsets;
    }

    // Unpaired surrogates are written as a single replacement byte
    private static int _utf8Length(int codePoint) {
        if (codePoint < 0x80 || Character.isSurrogate((char) codePoint) && codePoint < 0x10000) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }
}
