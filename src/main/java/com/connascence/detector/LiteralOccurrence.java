package com.connascence.detector;

import java.math.BigDecimal;

import com.connascence.ast.NormalizedNode;

/**
 * One numeric or string literal found in a tree. A negated numeric literal is a single occurrence
 * whose node is the unary minus.
 */
public final class LiteralOccurrence {

    public enum Kind { NUMBER, STRING }

    private final NormalizedNode node;
    private final Kind kind;
    private final BigDecimal number;
    private final String string;
    private final LiteralContext context;
    private final boolean constantDefinition;
    private final boolean docstring;

    LiteralOccurrence(NormalizedNode node, Kind kind, BigDecimal number, String string,
                      LiteralContext context, boolean constantDefinition, boolean docstring) {
        this.node = node;
        this.kind = kind;
        this.number = number;
        this.string = string;
        this.context = context;
        this.constantDefinition = constantDefinition;
        this.docstring = docstring;
    }

    // Getters
    public NormalizedNode getNode() { return node; }
    public Kind getKind() { return kind; }
    public BigDecimal getNumber() { return number; }
    public String getString() { return string; }
    public LiteralContext getContext() { return context; }
    public boolean isConstantDefinition() { return constantDefinition; }
    public boolean isDocstring() { return docstring; }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public int getLine() {
        return node.getStartLine();
    }

    public int getColumn() {
        return node.getSpan().getStartColumn();
    }

    /**
     * Literal text as written in the source.
     */
    public String getText() {
        return node.getText();
    }

    /**
     * Grouping key: equal values of the same kind share a key whatever their spelling.
     */
    public String valueKey() {
        return isNumber() ? "n:" + number.toPlainString() : "s:" + string;
    }

    /**
     * Value for messages: the number in plain notation or the quoted string.
     */
    public String displayValue() {
        return isNumber() ? number.toPlainString() : "'" + string + "'";
    }
}
