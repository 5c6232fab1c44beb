package com.connascence.refactor.handlers;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class HandlerNamingTest {

    @Test
    void constantName_encodesSignAndFraction() {
        assertThat(MagicNumberHandler.constantName(new BigDecimal("7"))).isEqualTo("CONSTANT_7");
        assertThat(MagicNumberHandler.constantName(new BigDecimal("3.14"))).isEqualTo("CONSTANT_3_14");
        assertThat(MagicNumberHandler.constantName(new BigDecimal("-5"))).isEqualTo("CONSTANT_NEG_5");
    }

    @Test
    void javaType_followsLiteralSpelling() {
        assertThat(MagicNumberHandler.javaType("42")).isEqualTo("int");
        assertThat(MagicNumberHandler.javaType("42L")).isEqualTo("long");
        assertThat(MagicNumberHandler.javaType("2.5f")).isEqualTo("float");
        assertThat(MagicNumberHandler.javaType("1e3")).isEqualTo("double");
        assertThat(MagicNumberHandler.javaType("0xFF")).isEqualTo("int");
        assertThat(MagicNumberHandler.javaType("1_000_000")).isEqualTo("int");
    }

    @Test
    void upperCamel_dropsUnderscores() {
        assertThat(ParameterObjectHandler.upperCamel("create_user")).isEqualTo("CreateUser");
        assertThat(ParameterObjectHandler.upperCamel("render")).isEqualTo("Render");
        assertThat(ParameterObjectHandler.upperCamel("__")).isEqualTo("Function");
    }
}
