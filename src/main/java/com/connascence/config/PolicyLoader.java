package com.connascence.config;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.connascence.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Loads policies from YAML with fallback to the bundled defaults. Invalid values are logged and
 * replaced by their defaults.
 */
public class PolicyLoader {
    private static final Logger logger = LoggerUtil.getLogger(PolicyLoader.class);
    private static final String DEFAULT_POLICY_RESOURCE = "/config/default-policy.yml";

    private static volatile Map<String, Object> _cachedDefaultDocument = null;

    private PolicyLoader() {
    }

    /**
     * Loads a policy file. A missing or unreadable file yields the default policy.
     */
    public static Policy loadPolicy(Path policyPath) {
        if (policyPath == null) {
            logger.warning("No policy path provided, using default policy");
            return loadDefaultPolicy();
        }

        if (!Files.exists(policyPath)) {
            logger.warning("Policy file not found: " + policyPath + ", using default policy");
            return loadDefaultPolicy();
        }

        try {
            logger.info("Loading policy from: " + policyPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> document = mapper.readValue(policyPath.toFile(), Map.class);

            String name = policyPath.getFileName().toString();
            return fromMap(name, document == null ? Map.of() : document);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing policy file: " + e.getMessage(), e);
            logger.info("Falling back to default policy");
            return loadDefaultPolicy();
        }
    }

    /**
     * The bundled default policy.
     */
    public static Policy loadDefaultPolicy() {
        return fromMap("default", _defaultDocument());
    }

    /**
     * One of the bundled presets ({@code strict-core}, {@code service-defaults}, {@code experimental})
     * layered over the default policy. Unknown names yield the default policy.
     */
    @SuppressWarnings("unchecked")
    public static Policy loadPreset(String presetName) {
        Map<String, Object> document = _defaultDocument();
        Map<String, Object> presets = _section(document, "presets");
        Object preset = presets.get(presetName);
        if (!(preset instanceof Map)) {
            logger.warning("Unknown policy preset '" + presetName + "', using default policy");
            return loadDefaultPolicy();
        }

        Map<String, Object> merged = new HashMap<>();
        for (String section : List.of("thresholds", "allowList", "refactoring")) {
            Map<String, Object> values = new HashMap<>(_section(document, section));
            values.putAll(_section((Map<String, Object>) preset, section));
            merged.put(section, values);
        }
        logger.info("Loaded policy preset: " + presetName);
        return fromMap(presetName, merged);
    }

    public static Set<String> availablePresets() {
        return Collections.unmodifiableSet(new TreeSet<>(_section(_defaultDocument(), "presets").keySet()));
    }

    /**
     * Builds a policy from a parsed document with {@code thresholds}, {@code allowList} and
     * {@code refactoring} sections.
     */
    public static Policy fromMap(String name, Map<String, Object> document) {
        Map<String, Object> thresholds = new HashMap<>(_section(document, "thresholds"));
        _validateThresholds(thresholds);

        PatternRegistry.Builder registry = PatternRegistry.builder();
        _intValue(thresholds, "maxParameters").ifPresent(registry::maxParameters);
        _intValue(thresholds, "maxNestingDepth").ifPresent(registry::maxNestingDepth);
        _intValue(thresholds, "maxMethodCount").ifPresent(registry::maxMethodCount);
        _intValue(thresholds, "maxFunctionLength").ifPresent(registry::maxFunctionLength);
        _intValue(thresholds, "maxStringLiteralLength").ifPresent(registry::maxStringLiteralLength);
        _intValue(thresholds, "repeatedLiteralThreshold").ifPresent(registry::repeatedLiteralThreshold);
        _intValue(thresholds, "magicNumberCandidateOccurrences").ifPresent(registry::magicNumberCandidateOccurrences);
        _intValue(thresholds, "parameterObjectThreshold").ifPresent(registry::parameterObjectThreshold);
        _intValue(thresholds, "extractMethodBodyLines").ifPresent(registry::extractMethodBodyLines);
        _intValue(thresholds, "minAssertionsPerFunction").ifPresent(registry::minAssertionsPerFunction);

        Map<String, Object> allowList = _section(document, "allowList");
        if (allowList.get("numbers") instanceof List) {
            registry.allowedNumbers(_numbers((List<?>) allowList.get("numbers")));
        }
        if (allowList.get("strings") instanceof List) {
            Set<String> strings = new LinkedHashSet<>();
            for (Object value : (List<?>) allowList.get("strings")) {
                strings.add(String.valueOf(value));
            }
            registry.allowedStrings(strings);
        }

        return new Policy(name, registry.build(), _refactoringPolicy(_section(document, "refactoring")));
    }

    private static RefactoringPolicy _refactoringPolicy(Map<String, Object> section) {
        RefactoringPolicy policy = RefactoringPolicy.defaults();
        Object overlay = section.get("overlayPolicy");
        if (overlay != null) {
            try {
                policy = policy.withOverlayPolicy(
                        RefactoringPolicy.parseEnum(RefactoringPolicy.OverlayPolicy.class, overlay.toString()));
            } catch (IllegalArgumentException e) {
                logger.warning("Invalid overlayPolicy '" + overlay + "', using " + policy.getOverlayPolicy());
            }
        }
        Object batch = section.get("batchMode");
        if (batch != null) {
            try {
                policy = policy.withBatchMode(
                        RefactoringPolicy.parseEnum(RefactoringPolicy.BatchMode.class, batch.toString()));
            } catch (IllegalArgumentException e) {
                logger.warning("Invalid batchMode '" + batch + "', using " + policy.getBatchMode());
            }
        }
        return policy;
    }

    private static Set<BigDecimal> _numbers(List<?> values) {
        Set<BigDecimal> numbers = new LinkedHashSet<>();
        for (Object value : values) {
            try {
                numbers.add(new BigDecimal(String.valueOf(value).trim()));
            } catch (NumberFormatException e) {
                logger.warning("Ignoring non-numeric allow-list entry: " + value);
            }
        }
        return numbers;
    }

    /**
     * Validates threshold values to ensure they are within acceptable ranges.
     */
    private static void _validateThresholds(Map<String, Object> thresholds) {
        _validateIntRange(thresholds, "maxParameters", 1, 20);
        _validateIntRange(thresholds, "maxNestingDepth", 1, 20);
        _validateIntRange(thresholds, "maxMethodCount", 1, 500);
        _validateIntRange(thresholds, "maxFunctionLength", 5, 2000);
        _validateIntRange(thresholds, "maxStringLiteralLength", 1, 1000);
        _validateIntRange(thresholds, "repeatedLiteralThreshold", 2, 100);
        _validateIntRange(thresholds, "magicNumberCandidateOccurrences", 2, 100);
        _validateIntRange(thresholds, "parameterObjectThreshold", 2, 20);
        _validateIntRange(thresholds, "extractMethodBodyLines", 5, 2000);
        _validateIntRange(thresholds, "minAssertionsPerFunction", 0, 20);
    }

    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.containsKey(key) && !(config.get(key) instanceof Number)) {
            logger.warning("Policy value '" + key + "' is not a number. Using default value.");
            config.remove(key);
        } else if (config.containsKey(key)) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Policy value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
            }
        }
    }

    private static OptionalInt _intValue(Map<String, Object> config, String key) {
        Object value = config.get(key);
        return value instanceof Number
                ? OptionalInt.of(((Number) value).intValue())
                : OptionalInt.empty();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> _section(Map<String, Object> document, String key) {
        Object section = document.get(key);
        if (section instanceof Map) {
            return (Map<String, Object>) section;
        }
        if (section != null) {
            logger.warning("Invalid '" + key + "' section in policy, using defaults");
        }
        return Map.of();
    }

    private static Map<String, Object> _defaultDocument() {
        if (_cachedDefaultDocument != null) {
            return _cachedDefaultDocument;
        }

        try (InputStream stream = PolicyLoader.class.getResourceAsStream(DEFAULT_POLICY_RESOURCE)) {
            if (stream == null) {
                logger.severe("Default policy resource not found: " + DEFAULT_POLICY_RESOURCE);
                return Map.of();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> document = mapper.readValue(stream, Map.class);

            _cachedDefaultDocument = Collections.unmodifiableMap(document);
            logger.info("Default policy loaded successfully");
            return _cachedDefaultDocument;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default policy", e);
            return Map.of();
        }
    }
}
