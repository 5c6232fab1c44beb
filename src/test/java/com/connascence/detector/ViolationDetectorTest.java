package com.connascence.detector;

import com.connascence.api.ConnascenceKind;
import com.connascence.api.Violation;
import com.connascence.api.error.Severity;
import com.connascence.ast.ParseResult;
import com.connascence.config.PatternRegistry;
import com.connascence.detector.rules.FunctionLengthRule;
import com.connascence.detector.rules.GodClassRule;
import com.connascence.detector.rules.MagicLiteralRule;
import com.connascence.detector.rules.NamingConventionRule;
import com.connascence.detector.rules.NestingDepthRule;
import com.connascence.detector.rules.ParameterCountRule;
import com.connascence.plugins.Language;
import com.connascence.plugins.ParserRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ViolationDetectorTest {

    private static ParserRegistry parsers;

    private ViolationDetector detector;
    private PatternRegistry registry;

    @BeforeAll
    static void setUpParsers() {
        parsers = ParserRegistry.withDefaultBackends();
    }

    @BeforeEach
    void setUp() {
        detector = ViolationDetector.withDefaultRules();
        registry = PatternRegistry.defaults();
    }

    @Test
    void detect_comparisonAndReturnLiteralsGetTheirOwnSeverity() {
        String source = "def check(x):\n"
                + "    if x == 123:\n"
                + "        return 123\n";

        List<Violation> violations = _detect(source, Language.PYTHON);

        assertThat(violations).hasSize(2);
        assertThat(violations).allMatch(v -> v.getRuleId().equals(MagicLiteralRule.RULE_ID));
        assertThat(violations.get(0).getLine()).isEqualTo(2);
        assertThat(violations.get(0).getContext()).isEqualTo("comparison");
        assertThat(violations.get(0).getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(violations.get(1).getLine()).isEqualTo(3);
        assertThat(violations.get(1).getContext()).isEqualTo("return");
        assertThat(violations.get(1).getSeverity()).isEqualTo(Severity.LOW);
        assertThat(violations.get(0).getKind()).isEqualTo(ConnascenceKind.MEANING);
    }

    @Test
    void detect_repeatedLiteralReportedOnceAtFirstOccurrence() {
        String source = "def f():\n"
                + "    a = 7\n"
                + "    b = 7\n"
                + "    c = 7\n"
                + "    d = 7\n"
                + "    e = 7\n";

        List<Violation> violations = _detect(source, Language.PYTHON);

        assertThat(_ofRule(violations, MagicLiteralRule.RULE_ID)).hasSize(5)
                .allMatch(v -> v.getSeverity() == Severity.MEDIUM);
        List<Violation> repeated = _ofRule(violations, MagicLiteralRule.REPEATED_RULE_ID);
        assertThat(repeated).hasSize(1);
        assertThat(repeated.get(0).getLine()).isEqualTo(2);
        assertThat(repeated.get(0).getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(repeated.get(0).getDescription()).contains("repeated 5 times");
        assertThat(violations).hasSize(6);
    }

    @Test
    void detect_repeatedLiteralThresholdIsInclusive() {
        String twice = "def f():\n    a = 7\n    b = 7\n";
        String thrice = "def f():\n    a = 7\n    b = 7\n    c = 7\n";

        assertThat(_ofRule(_detect(twice, Language.PYTHON), MagicLiteralRule.REPEATED_RULE_ID)).isEmpty();
        assertThat(_ofRule(_detect(thrice, Language.PYTHON), MagicLiteralRule.REPEATED_RULE_ID)).hasSize(1);
    }

    @Test
    void detect_ignoresAllowListedNumbersAndConstants() {
        String source = "MAX_SIZE = 512\n"
                + "def f(x):\n"
                + "    y = x * 2 + 1 - 0\n"
                + "    z = -1\n"
                + "    return y * 100\n";

        assertThat(_ofRule(_detect(source, Language.PYTHON), MagicLiteralRule.RULE_ID)).isEmpty();
    }

    @Test
    void detect_customAllowListAndStringSeverity() {
        String source = "def f(x):\n"
                + "    if x == 42:\n"
                + "        return 'status'\n";
        registry = PatternRegistry.builder().allowNumber(new BigDecimal("42")).build();

        List<Violation> violations = _ofRule(_detect(source, Language.PYTHON), MagicLiteralRule.RULE_ID);

        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).getDescription()).isEqualTo("Magic string 'status' in return context");
        assertThat(violations.get(0).getSeverity()).isEqualTo(Severity.LOW);
        assertThat(violations.get(0).getSuggestedName()).isEqualTo("STATUS_VALUE");
    }

    @Test
    void detect_skipsLongStrings() {
        String longText = "x".repeat(51);
        String source = "def f():\n    return '" + longText + "'\n";

        assertThat(_ofRule(_detect(source, Language.PYTHON), MagicLiteralRule.RULE_ID)).isEmpty();
    }

    @Test
    void detect_parameterCountBoundary() {
        String three = "def f(a, b, c):\n    pass\n";
        String four = "def f(a, b, c, d):\n    pass\n";
        String six = "def f(a, b, c, d, e, g):\n    pass\n";

        assertThat(_ofRule(_detect(three, Language.PYTHON), ParameterCountRule.RULE_ID)).isEmpty();
        List<Violation> medium = _ofRule(_detect(four, Language.PYTHON), ParameterCountRule.RULE_ID);
        assertThat(medium).hasSize(1);
        assertThat(medium.get(0).getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(medium.get(0).getKind()).isEqualTo(ConnascenceKind.POSITION);
        assertThat(_ofRule(_detect(six, Language.PYTHON), ParameterCountRule.RULE_ID).get(0).getSeverity())
                .isEqualTo(Severity.HIGH);
    }

    @Test
    void detect_parameterCountIgnoresPythonReceiver() {
        String source = "class A:\n    def f(self, a, b, c):\n        pass\n";

        assertThat(_ofRule(_detect(source, Language.PYTHON), ParameterCountRule.RULE_ID)).isEmpty();
    }

    @Test
    void detect_functionLengthBoundary() {
        assertThat(_ofRule(_detect(_pythonFunction(50), Language.PYTHON), FunctionLengthRule.RULE_ID)).isEmpty();
        assertThat(_ofRule(_detect(_pythonFunction(51), Language.PYTHON), FunctionLengthRule.RULE_ID)).hasSize(1);
    }

    @Test
    void detect_nestingDepthBoundary() {
        assertThat(_ofRule(_detect(_nestedIfs(4), Language.PYTHON), NestingDepthRule.RULE_ID)).isEmpty();

        List<Violation> violations = _ofRule(_detect(_nestedIfs(5), Language.PYTHON), NestingDepthRule.RULE_ID);
        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(violations.get(0).getDescription()).contains("nests 5 levels");
    }

    @Test
    void detect_elseIfChainStaysOnOneLevel() {
        String source = "class A {\n"
                + "    int f(int x) {\n"
                + "        if (x == 0) {\n"
                + "            return 0;\n"
                + "        } else if (x == 1) {\n"
                + "            return 1;\n"
                + "        } else if (x == 2) {\n"
                + "            return 2;\n"
                + "        } else if (x == 3) {\n"
                + "            return 3;\n"
                + "        } else if (x == 4) {\n"
                + "            return 4;\n"
                + "        } else {\n"
                + "            return 5;\n"
                + "        }\n"
                + "    }\n"
                + "}\n";

        assertThat(_ofRule(_detect(source, Language.JAVA), NestingDepthRule.RULE_ID)).isEmpty();
    }

    @Test
    void detect_nestedDefinitionsMeasuredSeparately() {
        String source = "def outer(x):\n"
                + "    if x:\n"
                + "        if x:\n"
                + "            def inner(y):\n"
                + "                if y:\n"
                + "                    if y:\n"
                + "                        if y:\n"
                + "                            return y\n"
                + "            return inner\n";

        assertThat(_ofRule(_detect(source, Language.PYTHON), NestingDepthRule.RULE_ID)).isEmpty();
    }

    @Test
    void detect_godClassBoundary() {
        assertThat(_ofRule(_detect(_pythonClass(20), Language.PYTHON), GodClassRule.RULE_ID)).isEmpty();

        List<Violation> violations = _ofRule(_detect(_pythonClass(21), Language.PYTHON), GodClassRule.RULE_ID);
        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(violations.get(0).getLine()).isEqualTo(1);
    }

    @Test
    void detect_godClassSeverityGrowsWithExcess() {
        assertThat(_ofRule(_detect(_pythonClass(25), Language.PYTHON), GodClassRule.RULE_ID))
                .extracting(Violation::getSeverity)
                .containsExactly(Severity.MEDIUM);
        assertThat(_ofRule(_detect(_pythonClass(26), Language.PYTHON), GodClassRule.RULE_ID))
                .extracting(Violation::getSeverity)
                .containsExactly(Severity.HIGH);
        assertThat(_ofRule(_detect(_pythonClass(36), Language.PYTHON), GodClassRule.RULE_ID))
                .extracting(Violation::getSeverity)
                .containsExactly(Severity.CRITICAL);
    }

    @Test
    void detect_namingConventionsPerLanguage() {
        String python = "def doThing():\n    pass\n\nclass my_class:\n    pass\n\ndef _helper():\n    pass\n";
        String java = "class Service {\n    Service() {}\n    void DoThing() {}\n    void doThing() {}\n}\n";
        String c = "void DoThing(void) {\n}\nvoid do_thing(void) {\n}\n";

        assertThat(_ofRule(_detect(python, Language.PYTHON), NamingConventionRule.RULE_ID))
                .extracting(Violation::getDescription)
                .containsExactly("Function 'doThing' should be snake_case",
                        "Class 'my_class' should be UpperCamelCase without underscores");
        assertThat(_ofRule(_detect(java, Language.JAVA), NamingConventionRule.RULE_ID))
                .extracting(Violation::getDescription)
                .containsExactly("Function 'DoThing' should be camelCase");
        assertThat(_ofRule(_detect(c, Language.C), NamingConventionRule.RULE_ID)).hasSize(1);
    }

    @Test
    void detect_ordersByLineAndCarriesFilePath() {
        String source = "def f(a, b, c, d):\n    return 77\n";

        List<Violation> violations = _detect(source, Language.PYTHON);

        assertThat(violations).extracting(Violation::getLine).isSorted();
        assertThat(violations).allMatch(v -> v.getFilePath().equals("sample"));
        assertThat(violations.get(0).getId()).startsWith(ParameterCountRule.RULE_ID + ":sample:1:");
    }

    private List<Violation> _detect(String source, Language language) {
        ParseResult result = parsers.parse(source, language);
        assertThat(result.isSuccess()).as(String.join("; ", result.errorMessages())).isTrue();
        return detector.detect(result.getRoot(), language, registry, "sample");
    }

    private static List<Violation> _ofRule(List<Violation> violations, String ruleId) {
        return violations.stream().filter(v -> v.getRuleId().equals(ruleId)).collect(Collectors.toList());
    }

    private static String _pythonFunction(int bodyLines) {
        StringBuilder source = new StringBuilder("def long_one():\n");
        for (int i = 0; i < bodyLines; i++) {
            source.append("    x = 0\n");
        }
        return source.toString();
    }

    private static String _nestedIfs(int depth) {
        StringBuilder source = new StringBuilder("def deep(x):\n");
        String indent = "    ";
        for (int i = 0; i < depth; i++) {
            source.append(indent).append("if x:\n");
            indent += "    ";
        }
        source.append(indent).append("pass\n");
        return source.toString();
    }

    private static String _pythonClass(int methods) {
        StringBuilder source = new StringBuilder("class Big:\n");
        for (int i = 0; i < methods; i++) {
            source.append("    def m").append(i).append("(self):\n        pass\n");
        }
        return source.toString();
    }
}
