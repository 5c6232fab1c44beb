package com.connascence.api;

import java.util.List;

import com.connascence.ast.ParseResult;
import com.connascence.config.PatternRegistry;
import com.connascence.overlay.SafetyOverlay;
import com.connascence.plugins.Language;
import com.connascence.refactor.RefactoringCandidate;

/**
 * The operations collaborators (CLI, editor integrations, generation tools) call.
 * Implementations never throw for problems in a unit; they report them in the returned value.
 */
public interface AnalysisEngine {
    ParseResult parse(String source, Language language);

    /**
     * Violations and refactoring candidates of one unit.
     *
     * @param overlay safety overlay to enforce, or null
     */
    AnalysisResult analyzeUnit(SourceUnit unit, PatternRegistry registry, SafetyOverlay overlay);

    RefactoringResult applyRefactoring(RefactoringCandidate candidate, String source, Language language,
                                       boolean validateOverlay);

    /**
     * Removes the tokens the overlay forbids from a set of generation candidates.
     *
     * @param overlayId overlay to apply, or null for no filtering
     */
    List<String> filterTokens(List<String> candidateTokens, Language language, String overlayId);
}
