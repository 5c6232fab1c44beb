package com.connascence.detector;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Proposes a constant name for a magic literal.
 */
public final class ConstantNameSuggester {
    private static final BigDecimal LARGE = BigDecimal.valueOf(1000);
    private static final int MAX_STEM_LENGTH = 20;

    private ConstantNameSuggester() {
    }

    public static String suggest(LiteralOccurrence occurrence) {
        if (occurrence.isNumber()) {
            return forNumber(occurrence.getNumber(), occurrence.getContext());
        }
        return forString(occurrence.getString());
    }

    public static String forNumber(BigDecimal value, LiteralContext context) {
        if (value.compareTo(LARGE) > 0) {
            return "MAX_VALUE";
        }
        if (value.signum() < 0) {
            return "MIN_VALUE";
        }
        if (context == LiteralContext.CONDITION) {
            return "THRESHOLD";
        }
        return "CONSTANT_VALUE";
    }

    /**
     * Upper-cased value with non-alphanumerics as underscores, at most 20 characters, plus {@code _VALUE}.
     */
    public static String forString(String value) {
        String stem = value.toUpperCase(Locale.ROOT)
                .replaceAll("[^A-Z0-9]+", "_")
                .replaceAll("^_+", "");
        if (stem.length() > MAX_STEM_LENGTH) {
            stem = stem.substring(0, MAX_STEM_LENGTH);
        }
        stem = stem.replaceAll("_+$", "");
        if (stem.isEmpty()) {
            return "STRING_CONSTANT";
        }
        if (Character.isDigit(stem.charAt(0))) {
            stem = "STR_" + stem;
        }
        return stem + "_VALUE";
    }
}
