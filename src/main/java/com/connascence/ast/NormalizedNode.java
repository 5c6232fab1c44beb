package com.connascence.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Language-neutral syntax tree node. Nodes are immutable; a transformation always works on source
 * text and produces a new tree by re-parsing.
 */
public final class NormalizedNode {
    private final String type;
    private final Span span;
    private final String source;
    private final List<NormalizedNode> children;

    public NormalizedNode(String type, Span span, String source, List<NormalizedNode> children) {
        this.type = Objects.requireNonNull(type, "type");
        this.span = Objects.requireNonNull(span, "span");
        this.source = Objects.requireNonNull(source, "source");
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public NormalizedNode(String type, Span span, String source) {
        this(type, span, source, List.of());
    }

    public String getType() {
        return type;
    }

    public Span getSpan() {
        return span;
    }

    /**
     * The exact source text covered by this node.
     */
    public String getText() {
        if (!span.hasOffsets()) {
            return "";
        }
        return source.substring(span.getStartOffset(), Math.min(span.getEndOffset(), source.length()));
    }

    public List<NormalizedNode> getChildren() {
        return children;
    }

    public int getStartLine() {
        return span.getStartLine();
    }

    public int getEndLine() {
        return span.getEndLine();
    }

    public boolean is(String nodeType) {
        return type.equals(nodeType);
    }

    public Optional<NormalizedNode> firstChild(String nodeType) {
        for (NormalizedNode child : children) {
            if (child.is(nodeType)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public List<NormalizedNode> childrenOfType(String nodeType) {
        List<NormalizedNode> result = new ArrayList<>();
        for (NormalizedNode child : children) {
            if (child.is(nodeType)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * All nodes of this subtree, this node included, matching the predicate in pre-order.
     */
    public List<NormalizedNode> findAll(Predicate<NormalizedNode> predicate) {
        List<NormalizedNode> result = new ArrayList<>();
        Deque<NormalizedNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            NormalizedNode node = stack.pop();
            if (predicate.test(node)) {
                result.add(node);
            }
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return result;
    }

    public List<NormalizedNode> findAll(String nodeType) {
        return findAll(node -> node.is(nodeType));
    }

    public boolean contains(String nodeType) {
        return !findAll(nodeType).isEmpty();
    }

    /**
     * Number of nodes in this subtree, this node included.
     */
    public int size() {
        int count = 1;
        for (NormalizedNode child : children) {
            count += child.size();
        }
        return count;
    }

    @Override
    public String toString() {
        return type + span;
    }
}
