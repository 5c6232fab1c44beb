package com.connascence.refactor;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.connascence.ast.FunctionExtractor;
import com.connascence.ast.FunctionInfo;
import com.connascence.ast.LineMap;
import com.connascence.ast.NodeIndex;
import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import com.connascence.detector.LiteralOccurrence;
import com.connascence.detector.LiteralScanner;
import com.connascence.plugins.Language;

/**
 * A parsed original handed to technique handlers, with the lookups they share.
 */
public class TransformationContext {
    private final String code;
    private final Language language;
    private final NormalizedNode root;
    private final NodeIndex index;
    private final LineMap lineMap;
    private final List<FunctionInfo> functions;

    public TransformationContext(String code, Language language, NormalizedNode root) {
        this.code = code;
        this.language = language;
        this.root = root;
        this.index = NodeIndex.build(root);
        this.lineMap = new LineMap(code);
        this.functions = FunctionExtractor.functions(root, index);
    }

    // Getters
    public String getCode() { return code; }
    public Language getLanguage() { return language; }
    public NormalizedNode getRoot() { return root; }
    public NodeIndex getIndex() { return index; }
    public LineMap getLineMap() { return lineMap; }
    public List<FunctionInfo> getFunctions() { return functions; }

    public List<LiteralOccurrence> literals() {
        return LiteralScanner.scan(root, index);
    }

    /**
     * The function a target names. When the name is defined more than once the definition
     * starting closest to the target's line wins.
     *
     * @throws TransformationException when no function has that name
     */
    public FunctionInfo function(FunctionTarget target) {
        FunctionInfo best = null;
        for (FunctionInfo function : functions) {
            if (!function.getName().equals(target.getName())) {
                continue;
            }
            if (best == null || Math.abs(function.getStartLine() - target.getLine())
                    < Math.abs(best.getStartLine() - target.getLine())) {
                best = function;
            }
        }
        if (best == null) {
            throw new TransformationException("Function '" + target.getName() + "' not found");
        }
        return best;
    }

    /**
     * The node a definition occupies in its parent, including decorators.
     */
    public NormalizedNode outerDefinition(NormalizedNode definition) {
        NormalizedNode parent = index.parentOf(definition);
        return parent != null && parent.is(NodeTypes.DECORATED_DEFINITION) ? parent : definition;
    }

    /**
     * The module-level statement containing a node.
     */
    public NormalizedNode topLevel(NormalizedNode node) {
        NormalizedNode current = node;
        NormalizedNode parent = index.parentOf(current);
        while (parent != null && parent != root) {
            current = parent;
            parent = index.parentOf(current);
        }
        return current;
    }

    public String text(int start, int end) {
        return code.substring(start, end);
    }

    public String text(NormalizedNode node) {
        return code.substring(node.getSpan().getStartOffset(), node.getSpan().getEndOffset());
    }

    public String indentationOf(NormalizedNode node) {
        return lineMap.indentationAt(node.getSpan().getStartOffset());
    }

    public int lineStartOf(NormalizedNode node) {
        return lineMap.lineStart(node.getStartLine());
    }

    public int lineEndOf(NormalizedNode node) {
        return lineMap.lineEnd(lineMap.lineOf(Math.max(node.getSpan().getEndOffset() - 1, 0)));
    }

    /**
     * True when only indentation precedes the node on its first line.
     */
    public boolean startsLine(NormalizedNode node) {
        int start = node.getSpan().getStartOffset();
        return code.substring(lineMap.lineStart(lineMap.lineOf(start)), start).isBlank();
    }

    /**
     * True when nothing but whitespace or a comment follows the node on its last line.
     */
    public boolean endsLine(NormalizedNode node) {
        int end = node.getSpan().getEndOffset();
        int lineEnd = lineMap.lineEnd(lineMap.lineOf(Math.max(end - 1, 0)));
        String rest = code.substring(Math.min(end, lineEnd), lineEnd).strip();
        return rest.isEmpty() || rest.startsWith(commentPrefix());
    }

    public String commentPrefix() {
        return language == Language.PYTHON ? "#" : "//";
    }

    /**
     * Indentation one level deeper than the definition, taken from its body when it has one.
     */
    public String bodyIndentation(FunctionInfo function) {
        NormalizedNode body = function.getBody();
        if (body != null && !body.getChildren().isEmpty()) {
            NormalizedNode first = body.getChildren().get(0);
            if (startsLine(first) && first.getStartLine() > function.getStartLine()) {
                return indentationOf(first);
            }
        }
        return indentationOf(function.getNode()) + "    ";
    }

    /**
     * Every identifier spelled anywhere in the unit.
     */
    public Set<String> identifiers() {
        Set<String> names = new HashSet<>();
        for (NormalizedNode node : index.nodes()) {
            if (node.is(NodeTypes.IDENTIFIER)) {
                names.add(node.getText());
            }
        }
        return names;
    }

    /**
     * A name not yet used in the unit: {@code base}, or {@code base_2}, {@code base_3} and so on.
     */
    public String uniqueName(String base, String separator) {
        Set<String> taken = identifiers();
        if (!taken.contains(base)) {
            return base;
        }
        int suffix = 2;
        while (taken.contains(base + separator + suffix)) {
            suffix++;
        }
        return base + separator + suffix;
    }
}
