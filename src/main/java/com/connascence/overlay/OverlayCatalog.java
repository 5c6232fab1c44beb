package com.connascence.overlay;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.connascence.api.error.Severity;
import com.connascence.plugins.Language;
import com.connascence.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * The safety overlays known to one engine, keyed by id. Loaded once and read-only afterwards.
 */
public final class OverlayCatalog {
    private static final Logger logger = LoggerUtil.getLogger(OverlayCatalog.class);
    private static final String DEFAULT_OVERLAY_RESOURCE = "/config/safety-overlays.yml";

    private final Map<String, SafetyOverlay> overlays;

    public OverlayCatalog(List<SafetyOverlay> overlays) {
        Map<String, SafetyOverlay> byId = new LinkedHashMap<>();
        for (SafetyOverlay overlay : overlays) {
            byId.put(overlay.getId(), overlay);
        }
        this.overlays = Collections.unmodifiableMap(byId);
    }

    public static OverlayCatalog empty() {
        return new OverlayCatalog(List.of());
    }

    /**
     * Loads the bundled overlays. A missing resource yields an empty catalog.
     */
    public static OverlayCatalog loadDefault() {
        try (InputStream stream = OverlayCatalog.class.getResourceAsStream(DEFAULT_OVERLAY_RESOURCE)) {
            if (stream == null) {
                logger.severe("Safety overlay resource not found: " + DEFAULT_OVERLAY_RESOURCE);
                return empty();
            }
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> document = mapper.readValue(stream, Map.class);
            OverlayCatalog catalog = fromMap(document);
            logger.info("Loaded " + catalog.size() + " safety overlays: " + catalog.ids());
            return catalog;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load safety overlays", e);
            return empty();
        }
    }

    /**
     * Loads overlays from a YAML file, or an empty catalog when it cannot be read.
     */
    public static OverlayCatalog load(Path path) {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> document = mapper.readValue(path.toFile(), Map.class);
            return fromMap(document);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error reading safety overlays from " + path + ": " + e.getMessage(), e);
            return empty();
        }
    }

    /**
     * Builds a catalog from a document with an {@code overlays} list. Overlays may name parents
     * under {@code inherits}; inherited rules come first.
     */
    @SuppressWarnings("unchecked")
    public static OverlayCatalog fromMap(Map<String, Object> document) {
        Object entries = document == null ? null : document.get("overlays");
        if (!(entries instanceof List)) {
            logger.warning("Missing or invalid 'overlays' section in overlay catalog");
            return empty();
        }

        Map<String, Map<String, Object>> raw = new LinkedHashMap<>();
        for (Object entry : (List<Object>) entries) {
            if (entry instanceof Map && ((Map<String, Object>) entry).get("id") != null) {
                Map<String, Object> overlay = (Map<String, Object>) entry;
                raw.put(overlay.get("id").toString(), overlay);
            } else {
                logger.warning("Skipping overlay entry without id: " + entry);
            }
        }

        List<SafetyOverlay> overlays = new ArrayList<>();
        for (Map.Entry<String, Map<String, Object>> entry : raw.entrySet()) {
            Map<String, Object> data = entry.getValue();
            Language language = Language.fromId(String.valueOf(data.get("language")));
            if (language == Language.UNKNOWN) {
                logger.warning("Overlay '" + entry.getKey() + "' names an unknown language: " + data.get("language"));
                continue;
            }
            List<OverlayRule> rules = _collectRules(entry.getKey(), raw, new LinkedHashSet<>());
            overlays.add(new SafetyOverlay(entry.getKey(), (String) data.get("name"), language, rules));
        }
        return new OverlayCatalog(overlays);
    }

    public Optional<SafetyOverlay> get(String overlayId) {
        return overlayId == null ? Optional.empty() : Optional.ofNullable(overlays.get(overlayId));
    }

    public List<SafetyOverlay> forLanguage(Language language) {
        List<SafetyOverlay> result = new ArrayList<>();
        for (SafetyOverlay overlay : overlays.values()) {
            if (overlay.appliesTo(language)) {
                result.add(overlay);
            }
        }
        return result;
    }

    public Set<String> ids() {
        return overlays.keySet();
    }

    public int size() {
        return overlays.size();
    }

    /**
     * A new catalog with the overlay added or replaced.
     */
    public OverlayCatalog with(SafetyOverlay overlay) {
        List<SafetyOverlay> all = new ArrayList<>(overlays.values());
        all.removeIf(existing -> existing.getId().equals(overlay.getId()));
        all.add(overlay);
        return new OverlayCatalog(all);
    }

    @SuppressWarnings("unchecked")
    private static List<OverlayRule> _collectRules(String overlayId, Map<String, Map<String, Object>> raw,
                                                   Set<String> visiting) {
        if (!visiting.add(overlayId) || !raw.containsKey(overlayId)) {
            logger.warning("Ignoring unknown or cyclic overlay parent: " + overlayId);
            return List.of();
        }
        Map<String, Object> data = raw.get(overlayId);
        List<OverlayRule> rules = new ArrayList<>();
        if (data.get("inherits") instanceof List) {
            for (Object parent : (List<Object>) data.get("inherits")) {
                rules.addAll(_collectRules(parent.toString(), raw, visiting));
            }
        }
        if (data.get("rules") instanceof List) {
            for (Object rule : (List<Object>) data.get("rules")) {
                if (rule instanceof Map) {
                    _parseRule(overlayId, (Map<String, Object>) rule).ifPresent(rules::add);
                }
            }
        }
        visiting.remove(overlayId);
        return rules;
    }

    private static Optional<OverlayRule> _parseRule(String overlayId, Map<String, Object> data) {
        try {
            OverlayRule.Builder builder = OverlayRule.builder(String.valueOf(data.get("id")))
                    .name((String) data.get("name"))
                    .description((String) data.get("description"))
                    .severity(Severity.fromLabel(String.valueOf(data.getOrDefault("severity", "high"))))
                    .category(SafetyRule.fromCode(String.valueOf(data.get("category"))))
                    .nodeTypes(_strings(data.get("nodeTypes")))
                    .callNames(_strings(data.get("calls")))
                    .tokens(_strings(data.get("tokens")))
                    .recursion(Boolean.TRUE.equals(data.get("recursion")));
            if (data.get("minAssertions") instanceof Number) {
                builder.minAssertions(((Number) data.get("minAssertions")).intValue());
            }
            return Optional.of(builder.build());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Skipping invalid rule in overlay '" + overlayId + "': " + data, e);
            return Optional.empty();
        }
    }

    private static Set<String> _strings(Object value) {
        Set<String> result = new LinkedHashSet<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                result.add(String.valueOf(item));
            }
        }
        return result;
    }
}
