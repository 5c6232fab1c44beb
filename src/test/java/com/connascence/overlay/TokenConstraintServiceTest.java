package com.connascence.overlay;

import com.connascence.plugins.Language;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TokenConstraintServiceTest {

    private TokenConstraintService service;
    private SafetyOverlay cSafety;
    private SafetyOverlay pythonSafety;

    @BeforeEach
    void setUp() {
        service = new TokenConstraintService();
        OverlayCatalog catalog = OverlayCatalog.loadDefault();
        cSafety = catalog.get("nasa_c_safety").orElseThrow();
        pythonSafety = catalog.get("nasa_python_safety").orElseThrow();
    }

    @Test
    void filterTokens_removesForbiddenTokensKeepingOrder() {
        List<String> filtered = service.filterTokens(List.of("if", "goto", "while", "setjmp", "return"), cSafety);

        assertThat(filtered).containsExactly("if", "while", "return");
    }

    @Test
    void filterTokens_isCaseInsensitive() {
        assertThat(service.filterTokens(List.of("EVAL", "len", "Exec"), pythonSafety)).containsExactly("len");
    }

    @Test
    void filterTokens_withoutOverlayReturnsCopy() {
        List<String> tokens = List.of("goto", "if");

        List<String> filtered = service.filterTokens(tokens, null);

        assertThat(filtered).containsExactly("goto", "if").isNotSameAs(tokens);
    }

    @Test
    void nextTokens_statementStartExcludesForbiddenKeywords() {
        List<String> suggestions = service.nextTokens("void f(void) {\n", Language.C, cSafety);

        assertThat(suggestions).contains("if", "return").doesNotContain("goto", "setjmp", "longjmp");
    }

    @Test
    void nextTokens_afterIdentifierSuggestsOperators() {
        assertThat(service.nextTokens("x", Language.PYTHON, null)).contains("=", "(", ".");
    }

    @Test
    void nextTokens_afterOperatorSuggestsExpressions() {
        List<String> suggestions = service.nextTokens("x = ", Language.PYTHON, pythonSafety);

        assertThat(suggestions).contains("None", "len").doesNotContain("eval");
    }

    @Test
    void nextTokens_unsupportedLanguageHasNoStatements() {
        assertThat(service.nextTokens("", Language.JAVASCRIPT, null)).isEmpty();
    }
}
