package com.connascence.refactor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.connascence.api.RefactoringOutcome;
import com.connascence.api.RefactoringResult;
import com.connascence.api.error.ErrorKind;
import com.connascence.ast.FunctionExtractor;
import com.connascence.ast.NodeIndex;
import com.connascence.ast.NormalizedNode;
import com.connascence.ast.ParseResult;
import com.connascence.config.RefactoringPolicy;
import com.connascence.overlay.OverlayCatalog;
import com.connascence.overlay.OverlayViolation;
import com.connascence.overlay.SafetyOverlay;
import com.connascence.overlay.SafetyOverlayValidator;
import com.connascence.plugins.Language;
import com.connascence.plugins.ParserRegistry;
import com.connascence.refactor.handlers.AssertionHandler;
import com.connascence.refactor.handlers.ExtractMethodHandler;
import com.connascence.refactor.handlers.MagicNumberHandler;
import com.connascence.refactor.handlers.ParameterObjectHandler;
import com.connascence.refactor.handlers.RecursionHandler;
import com.connascence.util.LoggerUtil;

/**
 * Applies refactorings as text edits and keeps only results that still parse.
 * <p>
 * Each attempt ends {@link RefactoringOutcome#APPLIED}, {@link RefactoringOutcome#REJECTED} or
 * {@link RefactoringOutcome#SKIPPED}. A rejected result always carries the code it started from.
 * Overlay findings in the new code are warnings under an advisory policy; a blocking policy
 * rejects the edit when it introduces findings the original did not have.
 */
public class GrammarValidatedTransformer {
    private static final Logger logger = LoggerUtil.getLogger(GrammarValidatedTransformer.class);

    private static final Comparator<RefactoringCandidate> BATCH_ORDER =
            Comparator.comparing(RefactoringCandidate::getSafetyImpact, Comparator.reverseOrder())
                    .thenComparing(RefactoringCandidate::getEstimatedEffort);

    private final ParserRegistry parsers;
    private final OverlayCatalog overlays;
    private final RefactoringPolicy policy;
    private final SafetyOverlayValidator validator = new SafetyOverlayValidator();

    private final TechniqueHandler magicNumbers = new MagicNumberHandler();
    private final TechniqueHandler extractMethod = new ExtractMethodHandler();
    private final TechniqueHandler parameterObject = new ParameterObjectHandler();
    private final TechniqueHandler assertions = new AssertionHandler();
    private final TechniqueHandler recursion = new RecursionHandler();

    public GrammarValidatedTransformer(ParserRegistry parsers, OverlayCatalog overlays, RefactoringPolicy policy) {
        this.parsers = Objects.requireNonNull(parsers, "parsers");
        this.overlays = Objects.requireNonNull(overlays, "overlays");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * True when the technique has a handler.
     */
    public boolean isImplemented(RefactoringTechnique technique) {
        return _handlerFor(technique) != null;
    }

    /**
     * Applies one candidate to {@code code}.
     *
     * @param validateOverlay check the result against the overlays of the language
     */
    public RefactoringResult apply(RefactoringCandidate candidate, String code, Language language,
                                   boolean validateOverlay) {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(language, "language");
        RefactoringTechnique technique = candidate.getTechnique();
        RefactoringResult.Builder result = RefactoringResult.builder()
                .technique(technique)
                .originalCode(code);

        TechniqueHandler handler = _handlerFor(technique);
        if (handler == null) {
            return _reject(result, ErrorKind.TECHNIQUE_NOT_IMPLEMENTED,
                    "Technique " + technique.getId() + " not implemented");
        }

        ParseResult original = parsers.parse(code, language);
        if (!original.isSuccess()) {
            ErrorKind kind = original.isUnsupported() ? ErrorKind.UNSUPPORTED_LANGUAGE : ErrorKind.SYNTAX_ERROR;
            return _reject(result, kind, "Original code does not parse: " + _firstError(original));
        }

        Transformation transformation;
        try {
            transformation = handler.apply(new TransformationContext(code, language, original.getRoot()), candidate);
        } catch (TransformationException e) {
            return _reject(result, ErrorKind.VALIDATION_FAILURE, "Refactoring failed: " + e.getMessage());
        }
        result.warnings(transformation.getWarnings());

        String refactored = transformation.getCode();
        if (refactored.equals(code)) {
            logger.fine("Skipped " + technique.getId() + ": no textual change");
            return result.outcome(RefactoringOutcome.SKIPPED).refactoredCode(code).build();
        }

        ParseResult reparsed = parsers.parse(refactored, language);
        if (!reparsed.isSuccess()) {
            for (String message : reparsed.errorMessages()) {
                result.addValidationError("Syntax error: " + message);
            }
            return _reject(result, ErrorKind.VALIDATION_FAILURE,
                    "Refactored code does not parse; original code kept");
        }

        if (validateOverlay) {
            List<String> blocking = _checkOverlays(original.getRoot(), reparsed.getRoot(), language, result);
            if (!blocking.isEmpty()) {
                blocking.forEach(result::addValidationError);
                return _reject(result, ErrorKind.VALIDATION_FAILURE,
                        "Refactoring introduces safety violations");
            }
        }

        result.addChange("Applied " + technique.getId());
        transformation.getChanges().forEach(result::addChange);
        _structuralChanges(original.getRoot(), reparsed.getRoot()).forEach(result::addChange);
        logger.fine("Applied " + technique.getId() + " to " + candidate.getTarget().describe());
        return result.refactoredCode(refactored).build();
    }

    /**
     * The text a candidate would produce, without parsing it again. Returns {@code code} unchanged
     * when the technique has no handler or the handler cannot apply.
     */
    public String preview(RefactoringCandidate candidate, String code, Language language) {
        TechniqueHandler handler = _handlerFor(candidate.getTechnique());
        if (handler == null) {
            return code;
        }
        ParseResult original = parsers.parse(code, language);
        if (!original.isSuccess()) {
            return code;
        }
        try {
            return handler.apply(new TransformationContext(code, language, original.getRoot()), candidate).getCode();
        } catch (TransformationException e) {
            logger.log(Level.FINE, "Preview of " + candidate.getTechnique().getId() + " failed", e);
            return code;
        }
    }

    /**
     * Applies candidates one after another over the evolving code, highest safety impact first and
     * cheapest first among equals. Stops at the first rejection; what happens to earlier edits
     * depends on the batch mode of the policy.
     */
    public RefactoringResult applyBatch(List<RefactoringCandidate> candidates, String code, Language language,
                                        boolean validateOverlay) {
        List<RefactoringCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(BATCH_ORDER);

        RefactoringResult.Builder batch = RefactoringResult.builder().originalCode(code);
        String current = code;
        int applied = 0;
        for (RefactoringCandidate candidate : ordered) {
            RefactoringResult step = apply(candidate, current, language, validateOverlay);
            step.getWarnings().forEach(batch::addWarning);
            if (step.getOutcome() == RefactoringOutcome.REJECTED) {
                step.getValidationErrors().forEach(batch::addValidationError);
                batch.technique(step.getTechnique());
                if (policy.isTransactional()) {
                    logger.warning("Batch rolled back at " + step.getTechnique().getId() + ": "
                            + String.join("; ", step.getValidationErrors()));
                    return batch.changesApplied(List.of())
                            .outcome(RefactoringOutcome.REJECTED)
                            .errorKind(step.getErrorKind())
                            .refactoredCode(code)
                            .build();
                }
                logger.warning("Batch stopped at " + step.getTechnique().getId() + " after " + applied
                        + " applied refactoring(s)");
                return batch.outcome(RefactoringOutcome.REJECTED)
                        .errorKind(step.getErrorKind())
                        .refactoredCode(current)
                        .build();
            }
            if (step.getOutcome() == RefactoringOutcome.APPLIED) {
                step.getChangesApplied().forEach(batch::addChange);
                current = step.getRefactoredCode();
                applied++;
            }
        }
        logger.fine("Batch applied " + applied + " of " + ordered.size() + " refactoring(s)");
        return batch.outcome(applied == 0 ? RefactoringOutcome.SKIPPED : RefactoringOutcome.APPLIED)
                .refactoredCode(current)
                .build();
    }

    private TechniqueHandler _handlerFor(RefactoringTechnique technique) {
        return switch (technique) {
            case REPLACE_MAGIC_NUMBER -> magicNumbers;
            case EXTRACT_METHOD -> extractMethod;
            case INTRODUCE_PARAMETER_OBJECT -> parameterObject;
            case INTRODUCE_ASSERTION -> assertions;
            case REPLACE_RECURSION_WITH_ITERATION -> recursion;
            case INLINE_METHOD, EXTRACT_VARIABLE, INLINE_VARIABLE, REPLACE_TEMP_WITH_QUERY,
                    MOVE_METHOD, MOVE_FIELD, EXTRACT_CLASS, INLINE_CLASS,
                    ENCAPSULATE_FIELD, REPLACE_TYPE_CODE_WITH_CLASS,
                    DECOMPOSE_CONDITIONAL, CONSOLIDATE_CONDITIONAL_EXPRESSION,
                    REPLACE_CONDITIONAL_WITH_POLYMORPHISM, RENAME_METHOD, SEPARATE_QUERY_FROM_MODIFIER,
                    PARAMETERIZE_METHOD, PRESERVE_WHOLE_OBJECT, PULL_UP_METHOD, PUSH_DOWN_METHOD,
                    EXTRACT_SUPERCLASS, SUBSTITUTE_ALGORITHM, REPLACE_CONSTRUCTOR_WITH_FACTORY -> null;
        };
    }

    /**
     * Adds advisory warnings to the result and returns the findings that block the edit.
     */
    private List<String> _checkOverlays(NormalizedNode before, NormalizedNode after, Language language,
                                        RefactoringResult.Builder result) {
        List<String> blocking = new ArrayList<>();
        for (SafetyOverlay overlay : overlays.forLanguage(language)) {
            List<OverlayViolation> found = validator.validate(after, overlay);
            if (!policy.isBlocking()) {
                for (OverlayViolation violation : found) {
                    result.addWarning("Safety warning: " + violation.getMessage());
                }
                continue;
            }
            Map<String, Integer> previous = _countByRule(validator.validate(before, overlay));
            Map<String, Integer> seen = new HashMap<>();
            for (OverlayViolation violation : found) {
                int count = seen.merge(violation.getRuleId(), 1, Integer::sum);
                if (count > previous.getOrDefault(violation.getRuleId(), 0)) {
                    blocking.add("Safety violation: " + violation.getMessage() + " at line " + violation.getLine());
                }
            }
        }
        return blocking;
    }

    private static Map<String, Integer> _countByRule(List<OverlayViolation> violations) {
        Map<String, Integer> counts = new HashMap<>();
        for (OverlayViolation violation : violations) {
            counts.merge(violation.getRuleId(), 1, Integer::sum);
        }
        return counts;
    }

    private static List<String> _structuralChanges(NormalizedNode before, NormalizedNode after) {
        NodeIndex beforeIndex = NodeIndex.build(before);
        NodeIndex afterIndex = NodeIndex.build(after);
        int functionsBefore = FunctionExtractor.functions(before, beforeIndex).size();
        int functionsAfter = FunctionExtractor.functions(after, afterIndex).size();
        int classesBefore = FunctionExtractor.classes(before, beforeIndex).size();
        int classesAfter = FunctionExtractor.classes(after, afterIndex).size();

        List<String> changes = new ArrayList<>();
        if (functionsBefore != functionsAfter) {
            changes.add("Function count changed from " + functionsBefore + " to " + functionsAfter);
        }
        if (classesBefore != classesAfter) {
            changes.add("Class count changed from " + classesBefore + " to " + classesAfter);
        }
        return changes;
    }

    private static RefactoringResult _reject(RefactoringResult.Builder result, ErrorKind kind, String error) {
        RefactoringResult rejected = result.rejected(kind, error).build();
        logger.warning("Rejected " + (rejected.getTechnique() == null ? "refactoring" : rejected.getTechnique().getId())
                + ": " + error);
        return rejected;
    }

    private static String _firstError(ParseResult result) {
        List<String> messages = result.errorMessages();
        return messages.isEmpty() ? "unknown error" : messages.get(0);
    }
}
