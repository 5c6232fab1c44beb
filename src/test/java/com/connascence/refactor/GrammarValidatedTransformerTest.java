package com.connascence.refactor;

import com.connascence.api.RefactoringOutcome;
import com.connascence.api.RefactoringResult;
import com.connascence.api.error.ErrorKind;
import com.connascence.api.error.Severity;
import com.connascence.ast.NodeTypes;
import com.connascence.config.RefactoringPolicy;
import com.connascence.overlay.OverlayCatalog;
import com.connascence.overlay.OverlayRule;
import com.connascence.overlay.SafetyOverlay;
import com.connascence.overlay.SafetyRule;
import com.connascence.plugins.Language;
import com.connascence.plugins.ParserRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class GrammarValidatedTransformerTest {

    private static final String MAGIC_PY = "def area(r):\n"
            + "    return r * 7\n"
            + "\n"
            + "def perimeter(r):\n"
            + "    return r + 7\n";

    private static final String GREET_PY = "def greet(name, greeting=None):\n"
            + "    return greeting or name\n";

    private static final String FACT_PY = "def fact(n):\n"
            + "    if n <= 1:\n"
            + "        return 1\n"
            + "    return n * fact(n - 1)\n";

    private static final String MAKE_PY = "def make(a, b, c, d):\n"
            + "    return a + b + c + d\n"
            + "\n"
            + "x = make(1, 2, 3, 4)\n";

    private static ParserRegistry parsers;

    private GrammarValidatedTransformer transformer;

    @BeforeAll
    static void setUpParsers() {
        parsers = ParserRegistry.withDefaultBackends();
    }

    @BeforeEach
    void setUp() {
        transformer = new GrammarValidatedTransformer(parsers, OverlayCatalog.loadDefault(), RefactoringPolicy.defaults());
    }

    @Test
    void apply_magicNumberPython() {
        RefactoringResult result = transformer.apply(_magic("7"), MAGIC_PY, Language.PYTHON, false);

        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.APPLIED);
        assertThat(result.getRefactoredCode()).isEqualTo("CONSTANT_7 = 7\n"
                + "\n"
                + "def area(r):\n"
                + "    return r * CONSTANT_7\n"
                + "\n"
                + "def perimeter(r):\n"
                + "    return r + CONSTANT_7\n");
        assertThat(result.getChangesApplied()).containsExactly(
                "Applied replace_magic_number",
                "Introduced constant CONSTANT_7 = 7",
                "Replaced 2 occurrence(s) of 7");
        assertThat(result.getOriginalCode()).isEqualTo(MAGIC_PY);
    }

    @Test
    void apply_magicNumberCAfterIncludes() {
        String source = "#include <stdio.h>\n"
                + "int scale(int x) {\n"
                + "    return x * 7;\n"
                + "}\n";

        RefactoringResult result = transformer.apply(_magic("7"), source, Language.C, false);

        assertThat(result.getRefactoredCode()).isEqualTo("#include <stdio.h>\n"
                + "#define CONSTANT_7 7\n"
                + "int scale(int x) {\n"
                + "    return x * CONSTANT_7;\n"
                + "}\n");
    }

    @Test
    void apply_magicNumberJavaDeclaresField() {
        String source = "class Rates {\n"
                + "    int fee(int amount) {\n"
                + "        return amount * 7;\n"
                + "    }\n"
                + "}\n";

        RefactoringResult result = transformer.apply(_magic("7"), source, Language.JAVA, false);

        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.APPLIED);
        assertThat(result.getRefactoredCode())
                .contains("private static final int CONSTANT_7 = 7;")
                .contains("return amount * CONSTANT_7;");
    }

    @Test
    void apply_assertionPythonSkipsNoneDefaults() {
        RefactoringResult result = transformer.apply(_function(RefactoringTechnique.INTRODUCE_ASSERTION, "greet"),
                GREET_PY, Language.PYTHON, false);

        assertThat(result.getRefactoredCode()).isEqualTo("def greet(name, greeting=None):\n"
                + "    assert name is not None\n"
                + "    return greeting or name\n");
        assertThat(result.getChangesApplied()).contains("Added 1 assertion(s) to greet");
    }

    @Test
    void apply_assertionCAddsInclude() {
        String source = "int length(const char *s) {\n"
                + "    return 0;\n"
                + "}\n";

        RefactoringResult result = transformer.apply(_function(RefactoringTechnique.INTRODUCE_ASSERTION, "length"),
                source, Language.C, false);

        assertThat(result.getRefactoredCode()).isEqualTo("#include <assert.h>\n"
                + "int length(const char *s) {\n"
                + "    assert(s != NULL);\n"
                + "    return 0;\n"
                + "}\n");
    }

    @Test
    void apply_assertionAddsOnePreconditionPerParameter() {
        String source = "def square(n):\n"
                + "    return n * n\n";

        RefactoringResult first = transformer.apply(_function(RefactoringTechnique.INTRODUCE_ASSERTION, "square"),
                source, Language.PYTHON, false);
        RefactoringResult second = transformer.apply(_function(RefactoringTechnique.INTRODUCE_ASSERTION, "square"),
                first.getRefactoredCode(), Language.PYTHON, false);

        assertThat(first.getRefactoredCode()).isEqualTo("def square(n):\n"
                + "    assert n is not None\n"
                + "    return n * n\n");
        assertThat(first.getChangesApplied()).contains("Added 1 assertion(s) to square");
        assertThat(second.getOutcome()).isEqualTo(RefactoringOutcome.SKIPPED);
        assertThat(second.getRefactoredCode()).isEqualTo(first.getRefactoredCode());
    }

    @Test
    void apply_assertionAlreadyPresentIsSkipped() {
        String source = "def greet(name):\n"
                + "    assert name is not None\n"
                + "    return name\n";

        RefactoringResult result = transformer.apply(_function(RefactoringTechnique.INTRODUCE_ASSERTION, "greet"),
                source, Language.PYTHON, false);

        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.SKIPPED);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRefactoredCode()).isEqualTo(source);
        assertThat(result.getWarnings()).anyMatch(w -> w.contains("no parameter left to assert on"));
    }

    @Test
    void apply_recursionInsertsMarker() {
        RefactoringResult result = transformer.apply(
                _function(RefactoringTechnique.REPLACE_RECURSION_WITH_ITERATION, "fact"), FACT_PY, Language.PYTHON, false);

        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.APPLIED);
        assertThat(result.getRefactoredCode())
                .isEqualTo("# TODO: convert recursion in fact to iteration\n" + FACT_PY);
        assertThat(result.getWarnings()).contains("Recursion in fact still has to be rewritten by hand");

        RefactoringResult again = transformer.apply(
                _function(RefactoringTechnique.REPLACE_RECURSION_WITH_ITERATION, "fact"),
                result.getRefactoredCode(), Language.PYTHON, false);
        assertThat(again.getOutcome()).isEqualTo(RefactoringOutcome.SKIPPED);
    }

    @Test
    void apply_parameterObjectPythonRewritesCalls() {
        RefactoringResult result = transformer.apply(
                _function(RefactoringTechnique.INTRODUCE_PARAMETER_OBJECT, "make"), MAKE_PY, Language.PYTHON, false);

        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.APPLIED);
        assertThat(result.getRefactoredCode()).isEqualTo("from dataclasses import dataclass\n"
                + "\n"
                + "@dataclass\n"
                + "class MakeParams:\n"
                + "    a: object\n"
                + "    b: object\n"
                + "    c: object\n"
                + "    d: object\n"
                + "\n"
                + "\n"
                + "def make(params: MakeParams):\n"
                + "    a = params.a\n"
                + "    b = params.b\n"
                + "    c = params.c\n"
                + "    d = params.d\n"
                + "    return a + b + c + d\n"
                + "\n"
                + "x = make(MakeParams(1, 2, 3, 4))\n");
        assertThat(result.getChangesApplied()).contains(
                "Introduced MakeParams for make",
                "Rewrote 1 call(s) to make",
                "Class count changed from 0 to 1");
    }

    @Test
    void apply_parameterObjectJavaUsesRecord() {
        String source = "class Shop {\n"
                + "    int total(int a, int b, int c, int d) {\n"
                + "        return a + b + c + d;\n"
                + "    }\n"
                + "\n"
                + "    int run() {\n"
                + "        return total(1, 2, 3, 4);\n"
                + "    }\n"
                + "}\n";

        RefactoringResult result = transformer.apply(
                _function(RefactoringTechnique.INTRODUCE_PARAMETER_OBJECT, "total"), source, Language.JAVA, false);

        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.APPLIED);
        assertThat(result.getRefactoredCode())
                .contains("int total(TotalParams params) {")
                .contains("int a = params.a();")
                .contains("private record TotalParams(int a, int b, int c, int d) {")
                .contains("return total(new TotalParams(1, 2, 3, 4));");
    }

    @Test
    void apply_extractMethodPythonReturnsLaterUsedNames() {
        String source = "def compute(a):\n"
                + "    x = a + 1\n"
                + "    y = x * 2\n"
                + "    z = y - 3\n"
                + "    w = z + x\n"
                + "    v = w * 2\n"
                + "    return v\n";

        RefactoringResult result = transformer.apply(_function(RefactoringTechnique.EXTRACT_METHOD, "compute"),
                source, Language.PYTHON, false);

        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.APPLIED);
        assertThat(result.getRefactoredCode())
                .contains("def compute_part(x, y):\n")
                .contains("    return w\n")
                .contains("    w = compute_part(x, y)\n");
        assertThat(result.getChangesApplied()).contains("Function count changed from 1 to 2");
    }

    @Test
    void apply_unimplementedTechniqueIsRejected() {
        RefactoringResult result = transformer.apply(_function(RefactoringTechnique.INLINE_METHOD, "greet"),
                GREET_PY, Language.PYTHON, false);

        assertThat(transformer.isImplemented(RefactoringTechnique.INLINE_METHOD)).isFalse();
        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.REJECTED);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.TECHNIQUE_NOT_IMPLEMENTED);
        assertThat(result.getValidationErrors()).containsExactly("Technique inline_method not implemented");
        assertThat(result.getRefactoredCode()).isEqualTo(GREET_PY);
    }

    @Test
    void apply_unparseableOriginalIsRejected() {
        String broken = "def broken(:\n    pass\n";

        RefactoringResult result = transformer.apply(_magic("7"), broken, Language.PYTHON, false);

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.SYNTAX_ERROR);
        assertThat(result.getValidationErrors().get(0)).startsWith("Original code does not parse");
        assertThat(result.getRefactoredCode()).isEqualTo(broken);
    }

    @Test
    void apply_unsupportedLanguageIsRejected() {
        RefactoringResult result = transformer.apply(_magic("7"), "const x = 7;", Language.JAVASCRIPT, false);

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.UNSUPPORTED_LANGUAGE);
    }

    @Test
    void apply_handlerFailureIsValidationFailure() {
        RefactoringResult result = transformer.apply(_function(RefactoringTechnique.INTRODUCE_ASSERTION, "missing"),
                GREET_PY, Language.PYTHON, false);

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.VALIDATION_FAILURE);
        assertThat(result.getValidationErrors()).containsExactly("Refactoring failed: Function 'missing' not found");
    }

    @Test
    void apply_advisoryOverlayOnlyWarns() {
        GrammarValidatedTransformer advisory = new GrammarValidatedTransformer(parsers, _noDecorators(),
                RefactoringPolicy.defaults());

        RefactoringResult result = advisory.apply(
                _function(RefactoringTechnique.INTRODUCE_PARAMETER_OBJECT, "make"), MAKE_PY, Language.PYTHON, true);

        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.APPLIED);
        assertThat(result.getWarnings()).contains("Safety warning: Banned construct: decorator (No decorators)");
    }

    @Test
    void apply_blockingOverlayRejectsNewFindings() {
        GrammarValidatedTransformer blocking = new GrammarValidatedTransformer(parsers, _noDecorators(),
                RefactoringPolicy.defaults().withOverlayPolicy(RefactoringPolicy.OverlayPolicy.BLOCKING));

        RefactoringResult result = blocking.apply(
                _function(RefactoringTechnique.INTRODUCE_PARAMETER_OBJECT, "make"), MAKE_PY, Language.PYTHON, true);

        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.REJECTED);
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.VALIDATION_FAILURE);
        assertThat(result.getValidationErrors()).contains(
                "Safety violation: Banned construct: decorator (No decorators) at line 3",
                "Refactoring introduces safety violations");
        assertThat(result.getRefactoredCode()).isEqualTo(MAKE_PY);
    }

    @Test
    void apply_blockingOverlayToleratesExistingFindings() {
        GrammarValidatedTransformer blocking = new GrammarValidatedTransformer(parsers, OverlayCatalog.loadDefault(),
                RefactoringPolicy.defaults().withOverlayPolicy(RefactoringPolicy.OverlayPolicy.BLOCKING));

        RefactoringResult result = blocking.apply(
                _function(RefactoringTechnique.REPLACE_RECURSION_WITH_ITERATION, "fact"), FACT_PY, Language.PYTHON, true);

        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.APPLIED);
    }

    @Test
    void applyBatch_bestEffortKeepsEarlierEdits() {
        String source = "def greet(name):\n"
                + "    return name\n";
        List<RefactoringCandidate> batch = List.of(
                _function(RefactoringTechnique.EXTRACT_METHOD, "greet", SafetyImpact.MEDIUM),
                _function(RefactoringTechnique.INTRODUCE_ASSERTION, "greet", SafetyImpact.HIGH));

        RefactoringResult result = transformer.applyBatch(batch, source, Language.PYTHON, false);

        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.REJECTED);
        assertThat(result.getTechnique()).isEqualTo(RefactoringTechnique.EXTRACT_METHOD);
        assertThat(result.getRefactoredCode()).contains("assert name is not None");
        assertThat(result.getChangesApplied()).contains("Applied introduce_assertion");
    }

    @Test
    void applyBatch_transactionalRollsBack() {
        GrammarValidatedTransformer transactional = new GrammarValidatedTransformer(parsers,
                OverlayCatalog.loadDefault(),
                RefactoringPolicy.defaults().withBatchMode(RefactoringPolicy.BatchMode.TRANSACTIONAL));
        String source = "def greet(name):\n"
                + "    return name\n";
        List<RefactoringCandidate> batch = List.of(
                _function(RefactoringTechnique.INTRODUCE_ASSERTION, "greet", SafetyImpact.HIGH),
                _function(RefactoringTechnique.EXTRACT_METHOD, "greet", SafetyImpact.MEDIUM));

        RefactoringResult result = transactional.applyBatch(batch, source, Language.PYTHON, false);

        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.REJECTED);
        assertThat(result.getRefactoredCode()).isEqualTo(source);
        assertThat(result.getChangesApplied()).isEmpty();
    }

    @Test
    void applyBatch_appliesAllInOrder() {
        String source = "def scale(value):\n"
                + "    if value > 7:\n"
                + "        return value * 7\n"
                + "    return value\n";
        List<RefactoringCandidate> batch = List.of(
                _magic("7"),
                _function(RefactoringTechnique.INTRODUCE_ASSERTION, "scale", SafetyImpact.HIGH));

        RefactoringResult result = transformer.applyBatch(batch, source, Language.PYTHON, false);

        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.APPLIED);
        assertThat(result.getRefactoredCode())
                .startsWith("CONSTANT_7 = 7\n")
                .contains("    assert value is not None\n")
                .contains("if value > CONSTANT_7:");
        assertThat(result.getChangesApplied())
                .containsSubsequence("Applied introduce_assertion", "Applied replace_magic_number");
    }

    @Test
    void applyBatch_nothingToDoIsSkipped() {
        RefactoringResult result = transformer.applyBatch(List.of(_magic("42")), MAGIC_PY, Language.PYTHON, false);

        assertThat(result.getOutcome()).isEqualTo(RefactoringOutcome.SKIPPED);
        assertThat(result.getRefactoredCode()).isEqualTo(MAGIC_PY);
    }

    @Test
    void preview_returnsTextWithoutValidation() {
        assertThat(transformer.preview(_magic("7"), MAGIC_PY, Language.PYTHON)).contains("r * CONSTANT_7");
        assertThat(transformer.preview(_function(RefactoringTechnique.INLINE_METHOD, "area"), MAGIC_PY,
                Language.PYTHON)).isEqualTo(MAGIC_PY);
        assertThat(transformer.preview(_function(RefactoringTechnique.EXTRACT_METHOD, "area"), MAGIC_PY,
                Language.PYTHON)).isEqualTo(MAGIC_PY);
    }

    private static OverlayCatalog _noDecorators() {
        OverlayRule rule = OverlayRule.builder("no_decorators")
                .name("No decorators")
                .category(SafetyRule.INDIRECTION)
                .severity(Severity.MEDIUM)
                .nodeTypes(Set.of(NodeTypes.DECORATOR))
                .build();
        return new OverlayCatalog(List.of(new SafetyOverlay("no_decorators", "No decorators", Language.PYTHON,
                List.of(rule))));
    }

    private static RefactoringCandidate _magic(String text) {
        return RefactoringCandidate.builder()
                .technique(RefactoringTechnique.REPLACE_MAGIC_NUMBER)
                .target(new MagicNumberTarget(new BigDecimal(text), text))
                .estimatedEffort(Effort.LOW)
                .safetyImpact(SafetyImpact.LOW)
                .build();
    }

    private static RefactoringCandidate _function(RefactoringTechnique technique, String name) {
        return _function(technique, name, SafetyImpact.LOW);
    }

    private static RefactoringCandidate _function(RefactoringTechnique technique, String name, SafetyImpact impact) {
        return RefactoringCandidate.builder()
                .technique(technique)
                .target(new FunctionTarget(name, 1))
                .safetyImpact(impact)
                .build();
    }
}
