package com.connascence.ast;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class NodeIndexTest {

    @Test
    void build_indexesParentsInPreOrder() {
        String source = "x = 1";
        NormalizedNode one = new NormalizedNode(NodeTypes.INTEGER, Span.ofLines(1, 1), source);
        NormalizedNode x = new NormalizedNode(NodeTypes.IDENTIFIER, Span.ofLines(1, 1), source);
        NormalizedNode assignment = new NormalizedNode(NodeTypes.ASSIGNMENT, Span.ofLines(1, 1), source, List.of(x, one));
        NormalizedNode statement = new NormalizedNode(NodeTypes.EXPRESSION_STATEMENT, Span.ofLines(1, 1), source,
                List.of(assignment));
        NormalizedNode root = new NormalizedNode(NodeTypes.MODULE, Span.ofLines(1, 1), source, List.of(statement));

        NodeIndex index = NodeIndex.build(root);

        assertThat(index.size()).isEqualTo(5);
        assertThat(index.nodes()).containsExactly(root, statement, assignment, x, one);
        assertThat(index.parentOf(one)).isSameAs(assignment);
        assertThat(index.parentOf(root)).isNull();
        assertThat(index.ancestors(one)).containsExactly(assignment, statement, root);
        assertThat(index.nearestAncestor(one, Set.of(NodeTypes.EXPRESSION_STATEMENT, NodeTypes.MODULE)))
                .isSameAs(statement);
        assertThat(index.nearestAncestor(one, Set.of(NodeTypes.CLASS_DEFINITION))).isNull();
    }
}
