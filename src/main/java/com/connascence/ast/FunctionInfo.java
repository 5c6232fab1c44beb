package com.connascence.ast;

import java.util.List;

/**
 * Facts about one function or method definition.
 */
public class FunctionInfo {
    private final NormalizedNode node;
    private final String name;
    private final List<String> parameters;
    private final int startLine;
    private final int endLine;
    private final int bodyLines;
    private final boolean method;

    public FunctionInfo(NormalizedNode node, String name, List<String> parameters,
                        int bodyLines, boolean method) {
        this.node = node;
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.startLine = node.getStartLine();
        this.endLine = node.getEndLine();
        this.bodyLines = bodyLines;
        this.method = method;
    }

    // Getters
    public NormalizedNode getNode() { return node; }
    public String getName() { return name; }
    public List<String> getParameters() { return parameters; }
    public int getParameterCount() { return parameters.size(); }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public int getBodyLines() { return bodyLines; }
    public boolean isMethod() { return method; }

    public NormalizedNode getBody() {
        return node.firstChild(NodeTypes.BLOCK).orElse(null);
    }

    @Override
    public String toString() {
        return name + parameters + " lines " + startLine + "-" + endLine;
    }
}
