package com.connascence.overlay;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import com.connascence.plugins.Language;

/**
 * Token filtering for constrained generation: removes tokens an overlay forbids outright.
 */
public class TokenConstraintService {
    private static final List<String> PYTHON_STATEMENTS = List.of(
            "if", "for", "while", "def", "class", "return", "import", "from", "with", "try", "pass",
            "raise", "assert", "exec");
    private static final List<String> PYTHON_EXPRESSIONS = List.of(
            "None", "True", "False", "not", "lambda", "len", "range", "eval", "(", "[", "{", "-");
    private static final List<String> C_STATEMENTS = List.of(
            "if", "for", "while", "do", "switch", "return", "break", "continue", "goto", "int", "char",
            "unsigned", "const", "struct", "static", "void", "setjmp", "longjmp", "{");
    private static final List<String> C_EXPRESSIONS = List.of(
            "NULL", "sizeof", "(", "!", "-", "~", "*", "&");
    private static final List<String> JAVA_STATEMENTS = List.of(
            "if", "for", "while", "do", "switch", "return", "break", "continue", "throw", "try",
            "final", "var", "int", "String", "assert", "{");
    private static final List<String> JAVA_EXPRESSIONS = List.of(
            "null", "true", "false", "new", "this", "(", "!", "-");
    private static final List<String> OPERATORS = List.of(
            "(", "=", ".", "[", "+", "-", "*", "/", "==", "!=", "<", ">", ",", ")");

    /**
     * The candidate tokens minus those the overlay forbids; order is preserved.
     */
    public List<String> filterTokens(List<String> candidateTokens, SafetyOverlay overlay) {
        if (overlay == null) {
            return new ArrayList<>(candidateTokens);
        }
        Set<String> forbidden = overlay.forbiddenTokens().stream()
                .map(token -> token.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<String> result = new ArrayList<>();
        for (String token : candidateTokens) {
            if (!forbidden.contains(token.toLowerCase(Locale.ROOT))) {
                result.add(token);
            }
        }
        return result;
    }

    /**
     * Heuristic next-token suggestions for a code prefix, filtered through the overlay.
     */
    public List<String> nextTokens(String prefix, Language language, SafetyOverlay overlay) {
        String trimmed = prefix == null ? "" : prefix.stripTrailing();
        char last = trimmed.isEmpty() ? '\n' : trimmed.charAt(trimmed.length() - 1);
        boolean atStatementStart = trimmed.isEmpty() || prefix.endsWith("\n")
                || last == ':' || last == ';' || last == '{' || last == '}';

        List<String> candidates;
        if (atStatementStart) {
            candidates = _statements(language);
        } else if (Character.isLetterOrDigit(last) || last == '_' || last == ')' || last == ']') {
            candidates = OPERATORS;
        } else {
            candidates = _expressions(language);
        }
        return filterTokens(candidates, overlay);
    }

    private static List<String> _statements(Language language) {
        return switch (language) {
            case PYTHON -> PYTHON_STATEMENTS;
            case C -> C_STATEMENTS;
            case JAVA -> JAVA_STATEMENTS;
            default -> List.of();
        };
    }

    private static List<String> _expressions(Language language) {
        return switch (language) {
            case PYTHON -> PYTHON_EXPRESSIONS;
            case C -> C_EXPRESSIONS;
            case JAVA -> JAVA_EXPRESSIONS;
            default -> List.of();
        };
    }
}
