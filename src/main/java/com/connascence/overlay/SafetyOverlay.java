package com.connascence.overlay;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.connascence.plugins.Language;

/**
 * A named, per-language set of safety rules. Read-only once built.
 */
public final class SafetyOverlay {
    private final String id;
    private final String name;
    private final Language language;
    private final List<OverlayRule> rules;

    public SafetyOverlay(String id, String name, Language language, List<OverlayRule> rules) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? id : name;
        this.language = Objects.requireNonNull(language, "language");
        this.rules = List.copyOf(rules);
    }

    // Getters
    public String getId() { return id; }
    public String getName() { return name; }
    public Language getLanguage() { return language; }
    public List<OverlayRule> getRules() { return rules; }

    public Set<String> forbiddenNodeTypes() {
        Set<String> result = new LinkedHashSet<>();
        rules.forEach(rule -> result.addAll(rule.getNodeTypes()));
        return result;
    }

    public Set<String> forbiddenCallPatterns() {
        Set<String> result = new LinkedHashSet<>();
        rules.forEach(rule -> result.addAll(rule.getCallNames()));
        return result;
    }

    public Set<String> forbiddenTokens() {
        Set<String> result = new LinkedHashSet<>();
        rules.forEach(rule -> result.addAll(rule.getTokens()));
        return result;
    }

    public Optional<OverlayRule> rule(String ruleId) {
        return rules.stream().filter(rule -> rule.getId().equals(ruleId)).findFirst();
    }

    public boolean appliesTo(Language other) {
        return language == other;
    }

    @Override
    public String toString() {
        return id + " (" + language.getId() + ", " + rules.size() + " rules)";
    }
}
