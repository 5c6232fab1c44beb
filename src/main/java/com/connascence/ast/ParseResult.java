package com.connascence.ast;

import java.util.ArrayList;
import java.util.List;

import com.connascence.api.error.AnalysisError;
import com.connascence.api.error.ErrorKind;
import com.connascence.plugins.Language;

/**
 * Outcome of parsing one unit. Successful only when no error was reported and no ERROR node exists.
 */
public class ParseResult {
    private final boolean success;
    private final NormalizedNode root;
    private final List<AnalysisError> errors;
    private final Language language;

    private ParseResult(Language language, NormalizedNode root, List<AnalysisError> errors) {
        this.language = language;
        this.root = root;
        this.errors = List.copyOf(errors);
        this.success = root != null && errors.isEmpty() && !root.contains(NodeTypes.ERROR);
    }

    /**
     * Builds a result from a tree and the errors collected while producing it.
     */
    public static ParseResult of(Language language, NormalizedNode root, List<AnalysisError> errors) {
        List<AnalysisError> all = new ArrayList<>(errors);
        if (root != null && all.isEmpty()) {
            for (NormalizedNode error : root.findAll(NodeTypes.ERROR)) {
                all.add(AnalysisError.syntax("Syntax error at line " + error.getStartLine(),
                        error.getStartLine(), error.getSpan().getStartColumn()));
            }
        }
        return new ParseResult(language, root, all);
    }

    public static ParseResult failure(Language language, AnalysisError error) {
        return new ParseResult(language, null, List.of(error));
    }

    public static ParseResult unsupported(Language language) {
        return failure(language, new AnalysisError(ErrorKind.UNSUPPORTED_LANGUAGE,
                "No parser backend available for language: " + language, 1, 1));
    }

    // Getters
    public boolean isSuccess() { return success; }
    public NormalizedNode getRoot() { return root; }
    public List<AnalysisError> getErrors() { return errors; }
    public Language getLanguage() { return language; }

    public boolean isUnsupported() {
        return errors.stream().anyMatch(e -> e.getKind() == ErrorKind.UNSUPPORTED_LANGUAGE);
    }

    /**
     * Error messages as plain strings, first one first.
     */
    public List<String> errorMessages() {
        List<String> messages = new ArrayList<>();
        for (AnalysisError error : errors) {
            messages.add(error.getMessage());
        }
        return messages;
    }
}
