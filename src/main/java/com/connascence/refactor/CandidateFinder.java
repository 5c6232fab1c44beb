package com.connascence.refactor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.connascence.ast.FunctionExtractor;
import com.connascence.ast.FunctionInfo;
import com.connascence.config.PatternRegistry;
import com.connascence.detector.LiteralOccurrence;
import com.connascence.detector.RuleContext;
import com.connascence.detector.rules.MagicLiteralRule;
import com.connascence.util.LoggerUtil;

/**
 * Proposes refactorings for a parsed unit. Proposals are never applied here.
 */
public class CandidateFinder {
    private static final Logger logger = LoggerUtil.getLogger(CandidateFinder.class);

    /**
     * Candidates for the unit in a fixed order: magic numbers, parameter objects, long functions,
     * duplicated algorithms, then the safety candidates when an overlay is active.
     */
    public List<RefactoringCandidate> find(RuleContext context, boolean overlayActive) {
        List<RefactoringCandidate> candidates = new ArrayList<>();
        _magicNumbers(context, candidates);
        _parameterObjects(context, candidates);
        _longFunctions(context, candidates);
        _duplicatedAlgorithms(context, candidates);
        if (overlayActive) {
            _safety(context, candidates);
        }
        logger.fine("Found " + candidates.size() + " refactoring candidates");
        return candidates;
    }

    /**
     * Candidates whose connascence improvement mentions one of the given kinds ({@code CoM},
     * {@code CoP} and so on). A null or empty list keeps everything.
     */
    public static List<RefactoringCandidate> filter(List<RefactoringCandidate> candidates,
                                                    Collection<String> targetKinds) {
        if (targetKinds == null || targetKinds.isEmpty()) {
            return candidates;
        }
        List<RefactoringCandidate> kept = new ArrayList<>();
        for (RefactoringCandidate candidate : candidates) {
            String improvement = candidate.getConnascenceImprovement();
            if (improvement != null && targetKinds.stream().anyMatch(improvement::contains)) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    private void _magicNumbers(RuleContext context, List<RefactoringCandidate> candidates) {
        PatternRegistry registry = context.getRegistry();
        Map<String, List<LiteralOccurrence>> byValue = new LinkedHashMap<>();
        for (LiteralOccurrence literal : context.getLiterals()) {
            if (literal.isNumber() && MagicLiteralRule.isMagic(literal, registry)) {
                byValue.computeIfAbsent(literal.valueKey(), k -> new ArrayList<>()).add(literal);
            }
        }

        for (List<LiteralOccurrence> occurrences : byValue.values()) {
            if (occurrences.size() < registry.getMagicNumberCandidateOccurrences()) {
                continue;
            }
            LiteralOccurrence first = occurrences.get(0);
            LiteralOccurrence last = occurrences.get(occurrences.size() - 1);
            String value = first.displayValue();
            candidates.add(_builder(context)
                    .technique(RefactoringTechnique.REPLACE_MAGIC_NUMBER)
                    .target(new MagicNumberTarget(first.getNumber(), first.getText()))
                    .lines(first.getLine(), last.getLine())
                    .description("Replace magic number " + value + " with named constant")
                    .rationale("Number " + value + " appears " + occurrences.size()
                            + " times, should be a named constant")
                    .estimatedEffort(Effort.LOW)
                    .safetyImpact(SafetyImpact.LOW)
                    .connascenceImprovement("CoM -> CoN")
                    .build());
        }
    }

    private void _parameterObjects(RuleContext context, List<RefactoringCandidate> candidates) {
        int threshold = context.getRegistry().getParameterObjectThreshold();
        for (FunctionInfo function : context.getFunctions()) {
            if (function.getParameterCount() < threshold) {
                continue;
            }
            candidates.add(_functionCandidate(context, function)
                    .technique(RefactoringTechnique.INTRODUCE_PARAMETER_OBJECT)
                    .description("Introduce parameter object for " + function.getName())
                    .rationale("Function has " + function.getParameterCount()
                            + " parameters; callers depend on their order")
                    .estimatedEffort(Effort.MEDIUM)
                    .safetyImpact(SafetyImpact.LOW)
                    .connascenceImprovement("CoP -> CoN")
                    .build());
        }
    }

    private void _longFunctions(RuleContext context, List<RefactoringCandidate> candidates) {
        int limit = context.getRegistry().getExtractMethodBodyLines();
        for (FunctionInfo function : context.getFunctions()) {
            if (function.getBodyLines() <= limit) {
                continue;
            }
            candidates.add(_functionCandidate(context, function)
                    .technique(RefactoringTechnique.EXTRACT_METHOD)
                    .description("Extract part of " + function.getName() + " into a helper")
                    .rationale("Function body spans " + function.getBodyLines() + " lines (limit " + limit + ")")
                    .estimatedEffort(Effort.HIGH)
                    .safetyImpact(SafetyImpact.MEDIUM)
                    .connascenceImprovement("CoA -> CoN")
                    .build());
        }
    }

    private void _duplicatedAlgorithms(RuleContext context, List<RefactoringCandidate> candidates) {
        Map<String, List<FunctionInfo>> byFingerprint = new LinkedHashMap<>();
        for (FunctionInfo function : context.getFunctions()) {
            if (function.getBodyLines() == 0) {
                continue;
            }
            byFingerprint.computeIfAbsent(fingerprint(function), k -> new ArrayList<>()).add(function);
        }

        for (Map.Entry<String, List<FunctionInfo>> entry : byFingerprint.entrySet()) {
            List<FunctionInfo> group = entry.getValue();
            if (group.size() < 2) {
                continue;
            }
            List<String> names = new ArrayList<>();
            int start = Integer.MAX_VALUE;
            int end = 0;
            for (FunctionInfo function : group) {
                names.add(function.getName());
                start = Math.min(start, function.getStartLine());
                end = Math.max(end, function.getEndLine());
            }
            candidates.add(_builder(context)
                    .technique(RefactoringTechnique.SUBSTITUTE_ALGORITHM)
                    .target(new FunctionGroupTarget(names))
                    .lines(start, end)
                    .description("Consolidate similar functions: " + String.join(", ", names))
                    .rationale("Functions share the structure " + entry.getKey())
                    .estimatedEffort(Effort.MEDIUM)
                    .safetyImpact(SafetyImpact.MEDIUM)
                    .connascenceImprovement("CoA -> CoN")
                    .build());
        }
    }

    private void _safety(RuleContext context, List<RefactoringCandidate> candidates) {
        int minAssertions = context.getRegistry().getMinAssertionsPerFunction();
        for (FunctionInfo function : context.getFunctions()) {
            if (FunctionExtractor.isSelfRecursive(function)) {
                candidates.add(_functionCandidate(context, function)
                        .technique(RefactoringTechnique.REPLACE_RECURSION_WITH_ITERATION)
                        .description("Replace recursion in " + function.getName() + " with iteration")
                        .rationale("Recursion has no statically bounded depth")
                        .estimatedEffort(Effort.HIGH)
                        .safetyImpact(SafetyImpact.HIGH)
                        .connascenceImprovement("CoE -> CoN")
                        .build());
            }
        }
        for (FunctionInfo function : context.getFunctions()) {
            if (function.getBody() == null) {
                continue;
            }
            int assertions = FunctionExtractor.assertionCount(function);
            if (assertions < minAssertions) {
                candidates.add(_functionCandidate(context, function)
                        .technique(RefactoringTechnique.INTRODUCE_ASSERTION)
                        .description("Add assertions to " + function.getName())
                        .rationale("Function has " + assertions + " assertions, requires " + minAssertions)
                        .estimatedEffort(Effort.LOW)
                        .safetyImpact(SafetyImpact.HIGH)
                        .connascenceImprovement("CoE -> Explicit Contracts")
                        .build());
            }
        }
    }

    /**
     * Coarse structural fingerprint: body length rounded down to tens and parameter count.
     */
    static String fingerprint(FunctionInfo function) {
        return "lines:" + (function.getBodyLines() / 10 * 10) + "_params:" + function.getParameterCount();
    }

    private static RefactoringCandidate.Builder _functionCandidate(RuleContext context, FunctionInfo function) {
        return _builder(context)
                .target(new FunctionTarget(function.getName(), function.getStartLine()))
                .lines(function.getStartLine(), function.getEndLine());
    }

    private static RefactoringCandidate.Builder _builder(RuleContext context) {
        return RefactoringCandidate.builder().filePath(context.getFilePath());
    }
}
