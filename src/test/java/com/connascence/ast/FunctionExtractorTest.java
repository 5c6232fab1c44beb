package com.connascence.ast;

import com.connascence.plugins.Language;
import com.connascence.plugins.ParserRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FunctionExtractorTest {

    private static ParserRegistry parsers;

    @BeforeAll
    static void setUp() {
        parsers = ParserRegistry.withDefaultBackends();
    }

    @Test
    void functions_skipPythonReceiverAndListInDocumentOrder() {
        String source = "class Cart:\n"
                + "    def add(self, item, qty):\n"
                + "        self.items.append(item)\n"
                + "\n"
                + "    @classmethod\n"
                + "    def empty(cls):\n"
                + "        return cls()\n"
                + "\n"
                + "def total(cart, tax):\n"
                + "    return 0\n";

        NormalizedNode root = _parse(source, Language.PYTHON);
        List<FunctionInfo> functions = FunctionExtractor.functions(root, NodeIndex.build(root));

        assertThat(functions).extracting(FunctionInfo::getName).containsExactly("add", "empty", "total");
        assertThat(functions.get(0).getParameters()).containsExactly("item", "qty");
        assertThat(functions.get(0).isMethod()).isTrue();
        assertThat(functions.get(1).getParameterCount()).isZero();
        assertThat(functions.get(2).isMethod()).isFalse();
        assertThat(functions.get(2).getParameters()).containsExactly("cart", "tax");
    }

    @Test
    void functions_countCParametersButNotVariadics() {
        String source = "int sum(int count, const char *label, ...) {\n"
                + "    return count;\n"
                + "}\n"
                + "void reset(void) {\n"
                + "}\n";

        NormalizedNode root = _parse(source, Language.C);
        List<FunctionInfo> functions = FunctionExtractor.functions(root, NodeIndex.build(root));

        assertThat(functions.get(0).getParameters()).containsExactly("count", "label");
        assertThat(functions.get(0).getBodyLines()).isEqualTo(1);
        assertThat(functions.get(1).getBodyLines()).isZero();
    }

    @Test
    void classes_countDirectMethodsOnly() {
        String source = "class Outer {\n"
                + "    void a() {}\n"
                + "    void b() {}\n"
                + "    static class Inner {\n"
                + "        void c() {}\n"
                + "    }\n"
                + "}\n";

        NormalizedNode root = _parse(source, Language.JAVA);
        List<ClassInfo> classes = FunctionExtractor.classes(root, NodeIndex.build(root));

        assertThat(classes).extracting(ClassInfo::getName).containsExactly("Outer", "Inner");
        assertThat(classes.get(0).getMethodCount()).isEqualTo(2);
        assertThat(classes.get(1).getMethodCount()).isEqualTo(1);
    }

    @Test
    void isSelfRecursive_detectsDirectCallsOnly() {
        String source = "def fact(n):\n"
                + "    if n <= 1:\n"
                + "        return 1\n"
                + "    return n * fact(n - 1)\n"
                + "\n"
                + "def outer(n):\n"
                + "    def outer_helper():\n"
                + "        return outer(n)\n"
                + "    return outer_helper\n";

        NormalizedNode root = _parse(source, Language.PYTHON);
        List<FunctionInfo> functions = FunctionExtractor.functions(root, NodeIndex.build(root));

        assertThat(FunctionExtractor.isSelfRecursive(functions.get(0))).isTrue();
        assertThat(FunctionExtractor.isSelfRecursive(functions.get(1))).isFalse();
    }

    @Test
    void assertionCount_includesAssertStatementsAndHelpers() {
        String source = "#include <assert.h>\n"
                + "int div(int a, int b) {\n"
                + "    assert(b != 0);\n"
                + "    ASSERT_POSITIVE(a);\n"
                + "    return a / b;\n"
                + "}\n";

        NormalizedNode root = _parse(source, Language.C);
        FunctionInfo function = FunctionExtractor.functions(root, NodeIndex.build(root)).get(0);

        assertThat(FunctionExtractor.assertionCount(function)).isEqualTo(2);
    }

    @Test
    void assertionCount_countsJavaAssertAndRequireNonNull() {
        String source = "class A {\n"
                + "    void f(Object o, int n) {\n"
                + "        assert n > 0;\n"
                + "        java.util.Objects.requireNonNull(o);\n"
                + "    }\n"
                + "}\n";

        NormalizedNode root = _parse(source, Language.JAVA);
        FunctionInfo function = FunctionExtractor.functions(root, NodeIndex.build(root)).get(0);

        assertThat(FunctionExtractor.assertionCount(function)).isEqualTo(2);
    }

    @Test
    void bodyLines_spanFirstToLastStatement() {
        String source = "def f():\n"
                + "    a = 1\n"
                + "\n"
                + "    b = 2\n"
                + "    return a + b\n";

        NormalizedNode root = _parse(source, Language.PYTHON);
        FunctionInfo function = FunctionExtractor.functions(root, NodeIndex.build(root)).get(0);

        assertThat(function.getBodyLines()).isEqualTo(4);
        assertThat(function.getStartLine()).isEqualTo(1);
        assertThat(function.getEndLine()).isEqualTo(5);
    }

    private static NormalizedNode _parse(String source, Language language) {
        ParseResult result = parsers.parse(source, language);
        assertThat(result.isSuccess()).as(String.join("; ", result.errorMessages())).isTrue();
        return result.getRoot();
    }
}
