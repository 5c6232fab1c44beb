package com.connascence.detector;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.connascence.ast.NodeIndex;
import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import com.connascence.config.PatternRegistry;

/**
 * Collects literal occurrences in document order, each with its value and usage context.
 */
public final class LiteralScanner {

    private LiteralScanner() {
    }

    public static List<LiteralOccurrence> scan(NormalizedNode root, NodeIndex index) {
        List<LiteralOccurrence> occurrences = new ArrayList<>();
        for (NormalizedNode node : index.nodes()) {
            if (_isNegatedNumber(node)) {
                parseNumber(node.getChildren().get(0).getText())
                        .ifPresent(value -> occurrences.add(_number(node, value.negate(), index)));
            } else if (NodeTypes.NUMERIC_LITERALS.contains(node.getType())) {
                NormalizedNode parent = index.parentOf(node);
                if (parent == null || !_isNegatedNumber(parent)) {
                    parseNumber(node.getText()).ifPresent(value -> occurrences.add(_number(node, value, index)));
                }
            } else if (node.is(NodeTypes.CONCATENATED_STRING)) {
                StringBuilder value = new StringBuilder();
                for (NormalizedNode part : node.getChildren()) {
                    value.append(stringValue(part.getText()));
                }
                occurrences.add(_string(node, value.toString(), index));
            } else if (node.is(NodeTypes.STRING) || node.is(NodeTypes.CHAR_LITERAL)) {
                NormalizedNode parent = index.parentOf(node);
                if (parent == null || !parent.is(NodeTypes.CONCATENATED_STRING)) {
                    occurrences.add(_string(node, stringValue(node.getText()), index));
                }
            }
        }
        return occurrences;
    }

    /**
     * Numeric value of a literal in any supported spelling, or empty for complex and hexadecimal
     * floating literals.
     */
    public static Optional<BigDecimal> parseNumber(String text) {
        String literal = text.replace("_", "").replace("'", "").trim().toLowerCase(Locale.ROOT);
        if (literal.isEmpty() || literal.endsWith("j")) {
            return Optional.empty();
        }
        try {
            if (literal.startsWith("0x")) {
                String digits = _stripIntegerSuffix(literal.substring(2));
                if (digits.contains(".") || digits.contains("p")) {
                    return Optional.empty();
                }
                return Optional.of(PatternRegistry.canonical(new BigDecimal(new BigInteger(digits, 16))));
            }
            if (literal.startsWith("0o") || literal.startsWith("0b")) {
                int radix = literal.charAt(1) == 'o' ? 8 : 2;
                String digits = _stripIntegerSuffix(literal.substring(2));
                return Optional.of(PatternRegistry.canonical(new BigDecimal(new BigInteger(digits, radix))));
            }
            String digits = _stripIntegerSuffix(literal);
            if (digits.endsWith("f") || digits.endsWith("d")) {
                digits = digits.substring(0, digits.length() - 1);
            }
            if (digits.length() > 1 && digits.startsWith("0") && digits.chars().allMatch(c -> c >= '0' && c <= '7')) {
                return Optional.of(PatternRegistry.canonical(new BigDecimal(new BigInteger(digits, 8))));
            }
            return Optional.of(PatternRegistry.canonical(new BigDecimal(digits)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Content of a string or character literal without prefix and quotes. Escapes are decoded
     * unless the literal is raw.
     */
    public static String stringValue(String text) {
        int quote = 0;
        while (quote < text.length() && text.charAt(quote) != '"' && text.charAt(quote) != '\'') {
            quote++;
        }
        if (quote >= text.length()) {
            return text;
        }
        String prefix = text.substring(0, quote).toLowerCase(Locale.ROOT);
        String body = text.substring(quote);
        int delimiter = body.startsWith("\"\"\"") || body.startsWith("'''") ? 3 : 1;
        if (body.length() < delimiter * 2) {
            return "";
        }
        String content = body.substring(delimiter, body.length() - delimiter);
        return prefix.contains("r") ? content : _unescape(content);
    }

    private static String _unescape(String content) {
        if (content.indexOf('\\') < 0) {
            return content;
        }
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c != '\\' || i + 1 >= content.length()) {
                result.append(c);
                continue;
            }
            char next = content.charAt(++i);
            switch (next) {
                case 'n' -> result.append('\n');
                case 't' -> result.append('\t');
                case 'r' -> result.append('\r');
                case '0' -> result.append('\0');
                default -> result.append(next);
            }
        }
        return result.toString();
    }

    private static String _stripIntegerSuffix(String literal) {
        int end = literal.length();
        while (end > 0 && (literal.charAt(end - 1) == 'u' || literal.charAt(end - 1) == 'l')) {
            end--;
        }
        return literal.substring(0, end);
    }

    private static boolean _isNegatedNumber(NormalizedNode node) {
        return node.is(NodeTypes.UNARY_OPERATOR)
                && node.getChildren().size() == 1
                && NodeTypes.NUMERIC_LITERALS.contains(node.getChildren().get(0).getType())
                && node.getText().startsWith("-");
    }

    private static LiteralOccurrence _number(NormalizedNode node, BigDecimal value, NodeIndex index) {
        return new LiteralOccurrence(node, LiteralOccurrence.Kind.NUMBER, PatternRegistry.canonical(value), null,
                LiteralContextClassifier.classify(node, index),
                LiteralContextClassifier.isConstantDefinition(node, index), false);
    }

    private static LiteralOccurrence _string(NormalizedNode node, String value, NodeIndex index) {
        return new LiteralOccurrence(node, LiteralOccurrence.Kind.STRING, null, value,
                LiteralContextClassifier.classify(node, index),
                LiteralContextClassifier.isConstantDefinition(node, index),
                LiteralContextClassifier.isDocstring(node, index));
    }
}
