package com.connascence.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flat arena over a tree: every node gets an integer slot holding its parent slot.
 * Built in one pre-order pass so ancestor lookups never re-walk the tree.
 */
public final class NodeIndex {
    private static final int NO_PARENT = -1;

    private final List<NormalizedNode> nodes;
    private final int[] parents;
    private final Map<NormalizedNode, Integer> slots;

    private NodeIndex(List<NormalizedNode> nodes, int[] parents, Map<NormalizedNode, Integer> slots) {
        this.nodes = nodes;
        this.parents = parents;
        this.slots = slots;
    }

    public static NodeIndex build(NormalizedNode root) {
        List<NormalizedNode> nodes = new ArrayList<>();
        List<Integer> parentSlots = new ArrayList<>();
        Map<NormalizedNode, Integer> slots = new IdentityHashMap<>();

        Deque<NormalizedNode> stack = new ArrayDeque<>();
        Deque<Integer> parentStack = new ArrayDeque<>();
        stack.push(root);
        parentStack.push(NO_PARENT);

        while (!stack.isEmpty()) {
            NormalizedNode node = stack.pop();
            int parent = parentStack.pop();
            int slot = nodes.size();
            nodes.add(node);
            parentSlots.add(parent);
            slots.put(node, slot);

            List<NormalizedNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
                parentStack.push(slot);
            }
        }

        int[] parents = new int[parentSlots.size()];
        for (int i = 0; i < parents.length; i++) {
            parents[i] = parentSlots.get(i);
        }
        return new NodeIndex(nodes, parents, slots);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Nodes in pre-order (document order).
     */
    public List<NormalizedNode> nodes() {
        return nodes;
    }

    public NormalizedNode parentOf(NormalizedNode node) {
        Integer slot = slots.get(node);
        if (slot == null || parents[slot] == NO_PARENT) {
            return null;
        }
        return nodes.get(parents[slot]);
    }

    /**
     * The closest proper ancestor whose type is in {@code types}, or null.
     */
    public NormalizedNode nearestAncestor(NormalizedNode node, Set<String> types) {
        NormalizedNode current = parentOf(node);
        while (current != null) {
            if (types.contains(current.getType())) {
                return current;
            }
            current = parentOf(current);
        }
        return null;
    }

    /**
     * Proper ancestors from the parent up to the root.
     */
    public List<NormalizedNode> ancestors(NormalizedNode node) {
        List<NormalizedNode> result = new ArrayList<>();
        NormalizedNode current = parentOf(node);
        while (current != null) {
            result.add(current);
            current = parentOf(current);
        }
        return result;
    }
}
