package com.connascence.detector.rules;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.connascence.api.ConnascenceKind;
import com.connascence.api.Violation;
import com.connascence.api.error.Severity;
import com.connascence.config.PatternRegistry;
import com.connascence.detector.ConstantNameSuggester;
import com.connascence.detector.DetectionRule;
import com.connascence.detector.LiteralOccurrence;
import com.connascence.detector.RuleContext;

/**
 * Context-sensitive magic literal detection (Connascence of Meaning). Also reports each value
 * repeated at least {@code repeatedLiteralThreshold} times once, at its first occurrence.
 */
public class MagicLiteralRule implements DetectionRule {
    public static final String RULE_ID = "magic_literal";
    public static final String REPEATED_RULE_ID = "repeated_literal";

    @Override
    public String id() {
        return RULE_ID;
    }

    @Override
    public List<Violation> detect(RuleContext context) {
        PatternRegistry registry = context.getRegistry();
        List<Violation> violations = new ArrayList<>();
        Map<String, List<LiteralOccurrence>> byValue = new LinkedHashMap<>();

        for (LiteralOccurrence literal : context.getLiterals()) {
            if (!isMagic(literal, registry)) {
                continue;
            }
            byValue.computeIfAbsent(literal.valueKey(), k -> new ArrayList<>()).add(literal);

            Severity severity = literal.isNumber()
                    ? literal.getContext().numericSeverity()
                    : literal.getContext().stringSeverity();
            String noun = literal.isNumber() ? "Magic number " : "Magic string ";
            violations.add(context.violations().at(literal.getNode(), RULE_ID, ConnascenceKind.MEANING, severity)
                    .description(noun + literal.displayValue() + " in " + literal.getContext().label() + " context")
                    .context(literal.getContext().label())
                    .suggestedName(ConstantNameSuggester.suggest(literal))
                    .build());
        }

        for (List<LiteralOccurrence> occurrences : byValue.values()) {
            if (occurrences.size() >= registry.getRepeatedLiteralThreshold()) {
                LiteralOccurrence first = occurrences.get(0);
                violations.add(context.violations()
                        .at(first.getNode(), REPEATED_RULE_ID, ConnascenceKind.MEANING, Severity.HIGH)
                        .description("Literal " + first.displayValue() + " repeated " + occurrences.size()
                                + " times; extract a named constant")
                        .context(first.getContext().label())
                        .suggestedName(ConstantNameSuggester.suggest(first))
                        .build());
            }
        }
        return violations;
    }

    /**
     * Whether a literal counts as magic under the registry's allow-lists.
     */
    public static boolean isMagic(LiteralOccurrence literal, PatternRegistry registry) {
        if (literal.isConstantDefinition() || literal.isDocstring()) {
            return false;
        }
        if (literal.isNumber()) {
            return !registry.isAllowedNumber(literal.getNumber());
        }
        String value = literal.getString();
        return !registry.isAllowedString(value) && value.length() <= registry.getMaxStringLiteralLength();
    }
}
