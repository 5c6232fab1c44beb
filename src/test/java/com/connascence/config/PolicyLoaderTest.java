package com.connascence.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadDefaultPolicy_matchesBuiltInDefaults() {
        Policy policy = PolicyLoader.loadDefaultPolicy();
        PatternRegistry registry = policy.getRegistry();

        assertThat(policy.getName()).isEqualTo("default");
        assertThat(registry.getMaxParameters()).isEqualTo(3);
        assertThat(registry.getMaxNestingDepth()).isEqualTo(4);
        assertThat(registry.getMaxMethodCount()).isEqualTo(20);
        assertThat(registry.getMaxFunctionLength()).isEqualTo(50);
        assertThat(registry.getExtractMethodBodyLines()).isEqualTo(60);
        assertThat(registry.isAllowedNumber(new BigDecimal("100"))).isTrue();
        assertThat(registry.isAllowedNumber(new BigDecimal("-1.0"))).isTrue();
        assertThat(registry.isAllowedNumber(new BigDecimal("42"))).isFalse();
        assertThat(policy.getRefactoringPolicy().getOverlayPolicy())
                .isEqualTo(RefactoringPolicy.OverlayPolicy.ADVISORY);
        assertThat(policy.getRefactoringPolicy().getBatchMode())
                .isEqualTo(RefactoringPolicy.BatchMode.BEST_EFFORT);
    }

    @Test
    void loadPreset_strictCoreOverridesThresholdsAndRefactoring() {
        Policy policy = PolicyLoader.loadPreset("strict-core");
        PatternRegistry registry = policy.getRegistry();

        assertThat(policy.getName()).isEqualTo("strict-core");
        assertThat(registry.getMaxNestingDepth()).isEqualTo(3);
        assertThat(registry.getMaxMethodCount()).isEqualTo(15);
        assertThat(registry.getMaxFunctionLength()).isEqualTo(40);
        assertThat(registry.getExtractMethodBodyLines()).isEqualTo(40);
        assertThat(registry.getRepeatedLiteralThreshold()).isEqualTo(3);
        assertThat(policy.getRefactoringPolicy().isBlocking()).isTrue();
        assertThat(policy.getRefactoringPolicy().isTransactional()).isTrue();
    }

    @Test
    void loadPreset_relaxedPresetsKeepDefaultRefactoringPolicy() {
        Policy service = PolicyLoader.loadPreset("service-defaults");
        Policy experimental = PolicyLoader.loadPreset("experimental");

        assertThat(service.getRegistry().getMaxParameters()).isEqualTo(4);
        assertThat(service.getRegistry().getMaxFunctionLength()).isEqualTo(60);
        assertThat(experimental.getRegistry().getMaxParameters()).isEqualTo(6);
        assertThat(experimental.getRegistry().getExtractMethodBodyLines()).isEqualTo(100);
        assertThat(experimental.getRefactoringPolicy().isBlocking()).isFalse();
    }

    @Test
    void loadPreset_unknownNameFallsBackToDefault() {
        assertThat(PolicyLoader.loadPreset("no-such-preset").getName()).isEqualTo("default");
    }

    @Test
    void availablePresets_sorted() {
        assertThat(PolicyLoader.availablePresets())
                .containsExactly("experimental", "service-defaults", "strict-core");
    }

    @Test
    void fromMap_outOfRangeAndNonNumericValuesUseDefaults() {
        Map<String, Object> document = Map.of("thresholds", Map.of(
                "maxParameters", 0,
                "maxNestingDepth", "deep",
                "maxFunctionLength", 80));

        PatternRegistry registry = PolicyLoader.fromMap("custom", document).getRegistry();

        assertThat(registry.getMaxParameters()).isEqualTo(3);
        assertThat(registry.getMaxNestingDepth()).isEqualTo(4);
        assertThat(registry.getMaxFunctionLength()).isEqualTo(80);
    }

    @Test
    void fromMap_invalidEnumKeepsDefault() {
        Map<String, Object> document = Map.of("refactoring", Map.of(
                "overlayPolicy", "sometimes",
                "batchMode", "transactional"));

        RefactoringPolicy policy = PolicyLoader.fromMap("custom", document).getRefactoringPolicy();

        assertThat(policy.getOverlayPolicy()).isEqualTo(RefactoringPolicy.OverlayPolicy.ADVISORY);
        assertThat(policy.getBatchMode()).isEqualTo(RefactoringPolicy.BatchMode.TRANSACTIONAL);
    }

    @Test
    void fromMap_allowListReplacesDefaultsAndSkipsNonNumbers() {
        Map<String, Object> document = Map.of("allowList", Map.of(
                "numbers", List.of(0, "42", "abc"),
                "strings", List.of("ok")));

        PatternRegistry registry = PolicyLoader.fromMap("custom", document).getRegistry();

        assertThat(registry.isAllowedNumber(new BigDecimal("42.00"))).isTrue();
        assertThat(registry.isAllowedNumber(BigDecimal.ONE)).isFalse();
        assertThat(registry.getAllowedNumbers()).hasSize(2);
        assertThat(registry.isAllowedString("ok")).isTrue();
        assertThat(registry.isAllowedString("-")).isTrue();
        assertThat(registry.isAllowedString("no")).isFalse();
    }

    @Test
    void loadPolicy_missingOrNullPathUsesDefault() {
        assertThat(PolicyLoader.loadPolicy(null).getName()).isEqualTo("default");
        assertThat(PolicyLoader.loadPolicy(tempDir.resolve("absent.yml")).getName()).isEqualTo("default");
    }

    @Test
    void loadPolicy_readsYamlFile() throws IOException {
        Path file = tempDir.resolve("team.yml");
        Files.writeString(file, "thresholds:\n"
                + "  maxParameters: 5\n"
                + "  repeatedLiteralThreshold: 4\n"
                + "refactoring:\n"
                + "  overlayPolicy: blocking\n");

        Policy policy = PolicyLoader.loadPolicy(file);

        assertThat(policy.getName()).isEqualTo("team.yml");
        assertThat(policy.getRegistry().getMaxParameters()).isEqualTo(5);
        assertThat(policy.getRegistry().getRepeatedLiteralThreshold()).isEqualTo(4);
        assertThat(policy.getRefactoringPolicy().isBlocking()).isTrue();
    }

    @Test
    void loadPolicy_malformedYamlUsesDefault() throws IOException {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "thresholds: [unclosed\n");

        assertThat(PolicyLoader.loadPolicy(file).getName()).isEqualTo("default");
    }
}
