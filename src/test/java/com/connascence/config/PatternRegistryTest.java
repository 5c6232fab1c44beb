package com.connascence.config;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class PatternRegistryTest {

    @Test
    void canonical_ignoresScale() {
        assertThat(PatternRegistry.canonical(new BigDecimal("7.00")))
                .isEqualTo(PatternRegistry.canonical(new BigDecimal("7")));
        assertThat(PatternRegistry.canonical(new BigDecimal("0.000"))).isEqualTo(BigDecimal.ZERO);
    }

    @Test
    void isAllowedString_singlePunctuationAlwaysAllowed() {
        PatternRegistry registry = PatternRegistry.defaults();

        assertThat(registry.isAllowedString("")).isTrue();
        assertThat(registry.isAllowedString(";")).isTrue();
        assertThat(registry.isAllowedString("a")).isFalse();
        assertThat(registry.isAllowedString("status")).isFalse();
    }

    @Test
    void toBuilder_copiesEverything() {
        PatternRegistry original = PatternRegistry.builder()
                .maxParameters(5)
                .allowNumber(new BigDecimal("42"))
                .build();

        PatternRegistry copy = original.toBuilder().maxNestingDepth(7).build();

        assertThat(copy.getMaxParameters()).isEqualTo(5);
        assertThat(copy.getMaxNestingDepth()).isEqualTo(7);
        assertThat(copy.isAllowedNumber(new BigDecimal("42.0"))).isTrue();
        assertThat(original.getMaxNestingDepth()).isEqualTo(4);
    }
}
