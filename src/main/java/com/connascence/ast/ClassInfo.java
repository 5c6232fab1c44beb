package com.connascence.ast;

import java.util.List;

/**
 * A class definition together with the methods declared directly in it.
 */
public class ClassInfo {
    private final NormalizedNode node;
    private final String name;
    private final List<FunctionInfo> methods;

    public ClassInfo(NormalizedNode node, String name, List<FunctionInfo> methods) {
        this.node = node;
        this.name = name;
        this.methods = List.copyOf(methods);
    }

    public NormalizedNode getNode() { return node; }
    public String getName() { return name; }
    public List<FunctionInfo> getMethods() { return methods; }

    public int getMethodCount() {
        return methods.size();
    }
}
