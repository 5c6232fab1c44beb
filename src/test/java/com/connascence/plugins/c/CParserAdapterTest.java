package com.connascence.plugins.c;

import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import com.connascence.ast.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CParserAdapterTest {

    private CParserAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new CParserAdapter();
    }

    @Test
    void parse_functionDefinitionWithIncludes() {
        String source = "#include <stdio.h>\n"
                + "#define LIMIT 10\n"
                + "\n"
                + "static int clamp(int value, const char *name) {\n"
                + "    if (value > LIMIT) {\n"
                + "        return LIMIT;\n"
                + "    }\n"
                + "    return value;\n"
                + "}\n";

        ParseResult result = adapter.parse(source);

        assertThat(result.isSuccess()).isTrue();
        NormalizedNode root = result.getRoot();
        assertThat(root.getChildren().get(0).getType()).isEqualTo(NodeTypes.PREPROC_INCLUDE);
        assertThat(root.getChildren().get(1).getType()).isEqualTo(NodeTypes.PREPROC_DEF);

        NormalizedNode function = root.findAll(NodeTypes.FUNCTION_DEFINITION).get(0);
        assertThat(function.firstChild(NodeTypes.IDENTIFIER).get().getText()).isEqualTo("clamp");
        assertThat(function.getStartLine()).isEqualTo(4);
        assertThat(function.firstChild(NodeTypes.PARAMETERS).get().getChildren()).hasSize(2);
        assertThat(function.firstChild(NodeTypes.BLOCK)).isPresent();
    }

    @Test
    void parse_gotoAndLabel() {
        String source = "void f(int x) {\n"
                + "    if (x) goto done;\n"
                + "    x = 2;\n"
                + "done:\n"
                + "    return;\n"
                + "}\n";

        NormalizedNode root = adapter.parse(source).getRoot();

        assertThat(root.contains(NodeTypes.GOTO_STATEMENT)).isTrue();
        assertThat(root.contains(NodeTypes.LABELED_STATEMENT)).isTrue();
    }

    @Test
    void parse_functionPointerDeclarator() {
        ParseResult result = adapter.parse("int (*handler)(int code);\n");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRoot().contains(NodeTypes.FUNCTION_POINTER)).isTrue();
    }

    @Test
    void parse_typedefNamesActAsTypes() {
        String source = "typedef unsigned int count_t;\n"
                + "count_t total(count_t a, count_t b) {\n"
                + "    count_t sum = a + b;\n"
                + "    return sum;\n"
                + "}\n";

        ParseResult result = adapter.parse(source);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRoot().findAll(NodeTypes.FUNCTION_DEFINITION)).hasSize(1);
    }

    @Test
    void parse_callsAndFieldAccess() {
        String source = "void f(struct point *p) {\n"
                + "    printf(\"%d\", p->x);\n"
                + "    p->y++;\n"
                + "}\n";

        NormalizedNode root = adapter.parse(source).getRoot();

        NormalizedNode call = root.findAll(NodeTypes.CALL).get(0);
        assertThat(call.firstChild(NodeTypes.ARGUMENT_LIST).get().getText()).isEqualTo("(\"%d\", p->x)");
        assertThat(root.contains(NodeTypes.ATTRIBUTE)).isTrue();
        assertThat(root.contains("update_expression")).isTrue();
    }

    @Test
    void parse_variadicParameter() {
        NormalizedNode root = adapter.parse("int log_line(const char *fmt, ...);\n").getRoot();

        assertThat(root.contains(NodeTypes.VARIADIC_PARAMETER)).isTrue();
    }

    @Test
    void parse_oldStyleDefinition() {
        String source = "int twice(a)\n"
                + "int a;\n"
                + "{\n"
                + "    return a * 2;\n"
                + "}\n";

        ParseResult result = adapter.parse(source);

        assertThat(result.isSuccess()).as(String.join("; ", result.errorMessages())).isTrue();
        NormalizedNode function = result.getRoot().findAll(NodeTypes.FUNCTION_DEFINITION).get(0);
        assertThat(function.firstChild(NodeTypes.IDENTIFIER).get().getText()).isEqualTo("twice");
        assertThat(function.firstChild(NodeTypes.PARAMETERS).get().getChildren()).hasSize(1);
        assertThat(function.firstChild(NodeTypes.BLOCK)).isPresent();
    }

    @Test
    void parse_definitionShapeIsTypeNameParametersBody() {
        String source = "static const char *name_of(int id, char **names) {\n"
                + "    /* lookup */\n"
                + "    return names[id];\n"
                + "}\n"
                + "int ready(void) {\n"
                + "    return 1;\n"
                + "}\n";

        List<NormalizedNode> functions = adapter.parse(source).getRoot().findAll(NodeTypes.FUNCTION_DEFINITION);

        NormalizedNode lookup = functions.get(0);
        assertThat(lookup.getChildren()).extracting(NormalizedNode::getType).containsExactly(
                NodeTypes.TYPE, NodeTypes.IDENTIFIER, NodeTypes.PARAMETERS, NodeTypes.BLOCK);
        assertThat(lookup.getChildren().get(0).getText()).isEqualTo("static const char");
        assertThat(lookup.getChildren().get(1).getText()).isEqualTo("name_of");
        NormalizedNode names = lookup.firstChild(NodeTypes.PARAMETERS).get().getChildren().get(1);
        assertThat(names.getChildren()).extracting(NormalizedNode::getType)
                .containsExactly(NodeTypes.TYPE, "pointer_declarator");
        assertThat(lookup.firstChild(NodeTypes.BLOCK).get().getChildren()).hasSize(1);

        assertThat(functions.get(1).firstChild(NodeTypes.PARAMETERS).get().getChildren()).isEmpty();
    }

    @Test
    void parse_operatorsMapToSharedVocabulary() {
        String source = "int f(int a, int b) {\n"
                + "    a += 3;\n"
                + "    b = -4;\n"
                + "    if (a > b && !a) {\n"
                + "        return 1.5e3;\n"
                + "    }\n"
                + "    return 0x1F;\n"
                + "}\n";

        NormalizedNode root = adapter.parse(source).getRoot();

        assertThat(root.contains(NodeTypes.AUGMENTED_ASSIGNMENT)).isTrue();
        assertThat(root.contains(NodeTypes.ASSIGNMENT)).isTrue();
        assertThat(root.findAll(NodeTypes.UNARY_OPERATOR).get(0).getText()).isEqualTo("-4");
        assertThat(root.contains(NodeTypes.BOOLEAN_OPERATOR)).isTrue();
        assertThat(root.contains(NodeTypes.COMPARISON_OPERATOR)).isTrue();
        assertThat(root.contains(NodeTypes.NOT_OPERATOR)).isTrue();
        assertThat(root.findAll(NodeTypes.FLOAT)).extracting(NormalizedNode::getText).containsExactly("1.5e3");
        assertThat(root.findAll(NodeTypes.INTEGER)).extracting(NormalizedNode::getText)
                .containsExactly("3", "4", "0x1F");
    }

    @Test
    void parse_includeSpanStopsAtEndOfLine() {
        NormalizedNode include = adapter.parse("#include \"local.h\"\nint x;\n").getRoot().getChildren().get(0);

        assertThat(include.getText()).isEqualTo("#include \"local.h\"");
        assertThat(include.getEndLine()).isEqualTo(1);
        assertThat(include.firstChild(NodeTypes.STRING)).isPresent();
    }

    @Test
    void parse_recoversAfterSyntaxError() {
        String source = "int broken( {\n"
                + "}\n"
                + "int ok(void) {\n"
                + "    return 0;\n"
                + "}\n";

        ParseResult result = adapter.parse(source);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrors().get(0).getLine()).isEqualTo(1);
        assertThat(result.getRoot().contains(NodeTypes.ERROR)).isTrue();
    }
}
