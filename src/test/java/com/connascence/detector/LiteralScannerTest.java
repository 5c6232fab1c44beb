package com.connascence.detector;

import com.connascence.ast.NodeIndex;
import com.connascence.ast.NormalizedNode;
import com.connascence.ast.ParseResult;
import com.connascence.plugins.Language;
import com.connascence.plugins.ParserRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LiteralScannerTest {

    private static ParserRegistry parsers;

    @BeforeAll
    static void setUp() {
        parsers = ParserRegistry.withDefaultBackends();
    }

    @Test
    void parseNumber_acceptsEverySpelling() {
        assertThat(LiteralScanner.parseNumber("42").get()).isEqualByComparingTo("42");
        assertThat(LiteralScanner.parseNumber("0x1F").get()).isEqualByComparingTo("31");
        assertThat(LiteralScanner.parseNumber("0o17").get()).isEqualByComparingTo("15");
        assertThat(LiteralScanner.parseNumber("0b101").get()).isEqualByComparingTo("5");
        assertThat(LiteralScanner.parseNumber("017").get()).isEqualByComparingTo("15");
        assertThat(LiteralScanner.parseNumber("1_000").get()).isEqualByComparingTo("1000");
        assertThat(LiteralScanner.parseNumber("10L").get()).isEqualByComparingTo("10");
        assertThat(LiteralScanner.parseNumber("100u").get()).isEqualByComparingTo("100");
        assertThat(LiteralScanner.parseNumber("2.5f").get()).isEqualByComparingTo("2.5");
        assertThat(LiteralScanner.parseNumber("1e3").get()).isEqualByComparingTo("1000");
        assertThat(LiteralScanner.parseNumber("0.5").get()).isEqualByComparingTo("0.5");
    }

    @Test
    void parseNumber_rejectsComplexLiterals() {
        assertThat(LiteralScanner.parseNumber("2j")).isEmpty();
        assertThat(LiteralScanner.parseNumber("")).isEmpty();
    }

    @Test
    void parseNumber_canonicalizesTrailingZeros() {
        assertThat(LiteralScanner.parseNumber("7.0").get()).isEqualTo(new BigDecimal("7"));
    }

    @Test
    void stringValue_stripsQuotesAndDecodesEscapes() {
        assertThat(LiteralScanner.stringValue("'abc'")).isEqualTo("abc");
        assertThat(LiteralScanner.stringValue("\"a\\tb\"")).isEqualTo("a\tb");
        assertThat(LiteralScanner.stringValue("r'\\n'")).isEqualTo("\\n");
        assertThat(LiteralScanner.stringValue("'''doc'''")).isEqualTo("doc");
        assertThat(LiteralScanner.stringValue("b'xy'")).isEqualTo("xy");
        assertThat(LiteralScanner.stringValue("''")).isEmpty();
    }

    @Test
    void scan_classifiesPythonLiterals() {
        String source = "\"\"\"Module doc.\"\"\"\n"
                + "LIMIT = 42\n"
                + "\n"
                + "def f(x):\n"
                + "    \"\"\"Doc.\"\"\"\n"
                + "    if x > 99:\n"
                + "        y = -5\n"
                + "        return 'done'\n"
                + "    print(3.5)\n"
                + "    while 8:\n"
                + "        pass\n"
                + "    return 7\n";

        List<LiteralOccurrence> literals = _scan(source, Language.PYTHON);

        assertThat(literals).extracting(LiteralOccurrence::getText).containsExactly(
                "\"\"\"Module doc.\"\"\"", "42", "\"\"\"Doc.\"\"\"", "99", "-5", "'done'", "3.5", "8", "7");

        assertThat(literals.get(0).isDocstring()).isTrue();
        assertThat(literals.get(1).isConstantDefinition()).isTrue();
        assertThat(literals.get(2).isDocstring()).isTrue();
        assertThat(literals.get(3).getContext()).isEqualTo(LiteralContext.COMPARISON);
        assertThat(literals.get(4).getNumber()).isEqualByComparingTo("-5");
        assertThat(literals.get(4).getContext()).isEqualTo(LiteralContext.ASSIGNMENT);
        assertThat(literals.get(5).isNumber()).isFalse();
        assertThat(literals.get(5).getString()).isEqualTo("done");
        assertThat(literals.get(5).getContext()).isEqualTo(LiteralContext.RETURN);
        assertThat(literals.get(6).getContext()).isEqualTo(LiteralContext.ARGUMENT);
        assertThat(literals.get(7).getContext()).isEqualTo(LiteralContext.CONDITION);
        assertThat(literals.get(8).getContext()).isEqualTo(LiteralContext.RETURN);
    }

    @Test
    void scan_stopsContextWalkAtBlockBoundary() {
        String source = "def f(x):\n"
                + "    if x:\n"
                + "        compute(x) + 12\n";

        List<LiteralOccurrence> literals = _scan(source, Language.PYTHON);

        assertThat(literals).hasSize(1);
        assertThat(literals.get(0).getContext()).isEqualTo(LiteralContext.DEFAULT);
    }

    @Test
    void scan_recognizesJavaConstantFields() {
        String source = "class Limits {\n"
                + "    private static final int MAX_RETRIES = 5;\n"
                + "    int retries = 6;\n"
                + "}\n";

        List<LiteralOccurrence> literals = _scan(source, Language.JAVA);

        assertThat(literals).hasSize(2);
        assertThat(literals.get(0).isConstantDefinition()).isTrue();
        assertThat(literals.get(1).isConstantDefinition()).isFalse();
        assertThat(literals.get(1).getContext()).isEqualTo(LiteralContext.ASSIGNMENT);
    }

    @Test
    void valueKey_groupsEqualValuesAcrossSpellings() {
        String source = "int f(void) {\n"
                + "    int a = 0x10;\n"
                + "    int b = 16;\n"
                + "    return a + b;\n"
                + "}\n";

        List<LiteralOccurrence> literals = _scan(source, Language.C);

        assertThat(literals).hasSize(2);
        assertThat(literals.get(0).valueKey()).isEqualTo(literals.get(1).valueKey());
        assertThat(literals.get(0).displayValue()).isEqualTo("16");
    }

    private static List<LiteralOccurrence> _scan(String source, Language language) {
        ParseResult result = parsers.parse(source, language);
        assertThat(result.isSuccess()).as(String.join("; ", result.errorMessages())).isTrue();
        NormalizedNode root = result.getRoot();
        return LiteralScanner.scan(root, NodeIndex.build(root));
    }
}
