package com.connascence.refactor;

import java.math.BigDecimal;
import java.util.Objects;

import com.connascence.config.PatternRegistry;

/**
 * Every occurrence of one numeric value. {@code text} is the spelling of the first occurrence and
 * becomes the constant's initializer.
 */
public final class MagicNumberTarget implements RefactoringTarget {
    private final BigDecimal value;
    private final String text;

    public MagicNumberTarget(BigDecimal value, String text) {
        this.value = PatternRegistry.canonical(Objects.requireNonNull(value, "value"));
        this.text = Objects.requireNonNull(text, "text");
    }

    public BigDecimal getValue() { return value; }
    public String getText() { return text; }

    @Override
    public String describe() {
        return "magic number " + text;
    }
}
