package com.connascence.config;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Thresholds and allow-lists for one analysis run. Immutable; build variations with {@link #toBuilder()}.
 */
public final class PatternRegistry {
    public static final Set<String> DEFAULT_ALLOWED_NUMBERS = Set.of("0", "1", "-1", "2", "10", "100");
    public static final Set<String> DEFAULT_ALLOWED_STRINGS = Set.of("", " ", "\n", "\t", ",", ".", ":");

    private final Set<BigDecimal> allowedNumbers;
    private final Set<String> allowedStrings;
    private final int maxParameters;
    private final int maxNestingDepth;
    private final int maxMethodCount;
    private final int maxFunctionLength;
    private final int maxStringLiteralLength;
    private final int repeatedLiteralThreshold;
    private final int magicNumberCandidateOccurrences;
    private final int parameterObjectThreshold;
    private final int extractMethodBodyLines;
    private final int minAssertionsPerFunction;

    private PatternRegistry(Builder builder) {
        Set<BigDecimal> numbers = new LinkedHashSet<>();
        for (BigDecimal number : builder.allowedNumbers) {
            numbers.add(canonical(number));
        }
        this.allowedNumbers = Set.copyOf(numbers);
        this.allowedStrings = Set.copyOf(builder.allowedStrings);
        this.maxParameters = builder.maxParameters;
        this.maxNestingDepth = builder.maxNestingDepth;
        this.maxMethodCount = builder.maxMethodCount;
        this.maxFunctionLength = builder.maxFunctionLength;
        this.maxStringLiteralLength = builder.maxStringLiteralLength;
        this.repeatedLiteralThreshold = builder.repeatedLiteralThreshold;
        this.magicNumberCandidateOccurrences = builder.magicNumberCandidateOccurrences;
        this.parameterObjectThreshold = builder.parameterObjectThreshold;
        this.extractMethodBodyLines = builder.extractMethodBodyLines;
        this.minAssertionsPerFunction = builder.minAssertionsPerFunction;
    }

    public static PatternRegistry defaults() {
        return builder().build();
    }

    /**
     * Numeric value normalized so that {@code 7}, {@code 7.0} and {@code 0x7} compare equal.
     */
    public static BigDecimal canonical(BigDecimal value) {
        return value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }

    public boolean isAllowedNumber(BigDecimal value) {
        return allowedNumbers.contains(canonical(value));
    }

    /**
     * Empty strings and single whitespace or punctuation characters are always allowed.
     */
    public boolean isAllowedString(String value) {
        if (allowedStrings.contains(value) || value.isEmpty()) {
            return true;
        }
        if (value.length() == 1) {
            char c = value.charAt(0);
            return Character.isWhitespace(c) || !Character.isLetterOrDigit(c);
        }
        return false;
    }

    // Getters
    public Set<BigDecimal> getAllowedNumbers() { return allowedNumbers; }
    public Set<String> getAllowedStrings() { return allowedStrings; }
    public int getMaxParameters() { return maxParameters; }
    public int getMaxNestingDepth() { return maxNestingDepth; }
    public int getMaxMethodCount() { return maxMethodCount; }
    public int getMaxFunctionLength() { return maxFunctionLength; }
    public int getMaxStringLiteralLength() { return maxStringLiteralLength; }
    public int getRepeatedLiteralThreshold() { return repeatedLiteralThreshold; }
    public int getMagicNumberCandidateOccurrences() { return magicNumberCandidateOccurrences; }
    public int getParameterObjectThreshold() { return parameterObjectThreshold; }
    public int getExtractMethodBodyLines() { return extractMethodBodyLines; }
    public int getMinAssertionsPerFunction() { return minAssertionsPerFunction; }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.allowedNumbers = new LinkedHashSet<>(allowedNumbers);
        builder.allowedStrings = new LinkedHashSet<>(allowedStrings);
        builder.maxParameters = maxParameters;
        builder.maxNestingDepth = maxNestingDepth;
        builder.maxMethodCount = maxMethodCount;
        builder.maxFunctionLength = maxFunctionLength;
        builder.maxStringLiteralLength = maxStringLiteralLength;
        builder.repeatedLiteralThreshold = repeatedLiteralThreshold;
        builder.magicNumberCandidateOccurrences = magicNumberCandidateOccurrences;
        builder.parameterObjectThreshold = parameterObjectThreshold;
        builder.extractMethodBodyLines = extractMethodBodyLines;
        builder.minAssertionsPerFunction = minAssertionsPerFunction;
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Set<BigDecimal> allowedNumbers = new LinkedHashSet<>();
        private Set<String> allowedStrings = new LinkedHashSet<>(DEFAULT_ALLOWED_STRINGS);
        private int maxParameters = 3;
        private int maxNestingDepth = 4;
        private int maxMethodCount = 20;
        private int maxFunctionLength = 50;
        private int maxStringLiteralLength = 50;
        private int repeatedLiteralThreshold = 3;
        private int magicNumberCandidateOccurrences = 2;
        private int parameterObjectThreshold = 4;
        private int extractMethodBodyLines = 60;
        private int minAssertionsPerFunction = 2;

        private Builder() {
            for (String number : DEFAULT_ALLOWED_NUMBERS) {
                allowedNumbers.add(new BigDecimal(number));
            }
        }

        public Builder allowedNumbers(Set<BigDecimal> numbers) {
            this.allowedNumbers = new LinkedHashSet<>(numbers);
            return this;
        }

        public Builder allowNumber(BigDecimal number) {
            this.allowedNumbers.add(number);
            return this;
        }

        public Builder allowedStrings(Set<String> strings) {
            this.allowedStrings = new LinkedHashSet<>(strings);
            return this;
        }

        public Builder maxParameters(int maxParameters) {
            this.maxParameters = maxParameters;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder maxMethodCount(int maxMethodCount) {
            this.maxMethodCount = maxMethodCount;
            return this;
        }

        public Builder maxFunctionLength(int maxFunctionLength) {
            this.maxFunctionLength = maxFunctionLength;
            return this;
        }

        public Builder maxStringLiteralLength(int maxStringLiteralLength) {
            this.maxStringLiteralLength = maxStringLiteralLength;
            return this;
        }

        public Builder repeatedLiteralThreshold(int repeatedLiteralThreshold) {
            this.repeatedLiteralThreshold = repeatedLiteralThreshold;
            return this;
        }

        public Builder magicNumberCandidateOccurrences(int occurrences) {
            this.magicNumberCandidateOccurrences = occurrences;
            return this;
        }

        public Builder parameterObjectThreshold(int parameterObjectThreshold) {
            this.parameterObjectThreshold = parameterObjectThreshold;
            return this;
        }

        public Builder extractMethodBodyLines(int extractMethodBodyLines) {
            this.extractMethodBodyLines = extractMethodBodyLines;
            return this;
        }

        public Builder minAssertionsPerFunction(int minAssertionsPerFunction) {
            this.minAssertionsPerFunction = minAssertionsPerFunction;
            return this;
        }

        public PatternRegistry build() {
            return new PatternRegistry(this);
        }
    }
}
