package com.connascence.ast;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LineMapTest {

    private final LineMap lineMap = new LineMap("first\n    second\nthird");

    @Test
    void lineOf_andColumnOf_areOneBased() {
        assertThat(lineMap.lineCount()).isEqualTo(3);
        assertThat(lineMap.lineOf(0)).isEqualTo(1);
        assertThat(lineMap.lineOf(6)).isEqualTo(2);
        assertThat(lineMap.columnOf(10)).isEqualTo(5);
    }

    @Test
    void lineEnd_includesNewline() {
        assertThat(lineMap.lineStart(2)).isEqualTo(6);
        assertThat(lineMap.lineEnd(1)).isEqualTo(6);
        assertThat(lineMap.lineEnd(3)).isEqualTo(lineMap.getSource().length());
    }

    @Test
    void indentationAt_returnsLeadingWhitespace() {
        assertThat(lineMap.indentationAt(12)).isEqualTo("    ");
        assertThat(lineMap.indentationAt(0)).isEmpty();
    }

    @Test
    void offsetOf_clampsOutOfRangePositions() {
        assertThat(lineMap.offsetOf(0, 5)).isZero();
        assertThat(lineMap.offsetOf(9, 1)).isEqualTo(lineMap.getSource().length());
    }
}
