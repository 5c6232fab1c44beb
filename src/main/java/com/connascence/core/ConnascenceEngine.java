package com.connascence.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import com.connascence.api.AnalysisEngine;
import com.connascence.api.AnalysisResult;
import com.connascence.api.RefactoringResult;
import com.connascence.api.SourceUnit;
import com.connascence.api.ValidationResult;
import com.connascence.api.Violation;
import com.connascence.ast.ParseResult;
import com.connascence.config.PatternRegistry;
import com.connascence.config.Policy;
import com.connascence.config.PolicyLoader;
import com.connascence.detector.RuleContext;
import com.connascence.detector.ViolationDetector;
import com.connascence.overlay.OverlayCatalog;
import com.connascence.overlay.OverlayViolation;
import com.connascence.overlay.SafetyOverlay;
import com.connascence.overlay.SafetyOverlayValidator;
import com.connascence.overlay.TokenConstraintService;
import com.connascence.plugins.Language;
import com.connascence.plugins.ParserRegistry;
import com.connascence.refactor.CandidateFinder;
import com.connascence.refactor.GrammarValidatedTransformer;
import com.connascence.refactor.RefactoringCandidate;
import com.connascence.util.LoggerUtil;

/**
 * Thread-safe entry point of the engine. Owns the parser cache and the overlay catalog, and
 * delegates detection, candidate search and refactoring to stateless collaborators, so one
 * instance can serve many units concurrently.
 */
public class ConnascenceEngine implements AnalysisEngine {
    private static final Logger logger = LoggerUtil.getLogger(ConnascenceEngine.class);
    private static final String UNKNOWN_PATH = "<unknown>";

    private final ParserRegistry parsers;
    private final OverlayCatalog overlays;
    private final Policy policy;
    private final ViolationDetector detector = ViolationDetector.withDefaultRules();
    private final CandidateFinder candidateFinder = new CandidateFinder();
    private final SafetyOverlayValidator overlayValidator = new SafetyOverlayValidator();
    private final TokenConstraintService tokenConstraints = new TokenConstraintService();
    private final GrammarValidatedTransformer transformer;

    /**
     * Creates an engine over the given backends.
     *
     * @throws IllegalStateException when the registry has no parser backend at all
     */
    public ConnascenceEngine(ParserRegistry parsers, OverlayCatalog overlays, Policy policy) {
        this.parsers = Objects.requireNonNull(parsers, "parsers");
        this.overlays = Objects.requireNonNull(overlays, "overlays");
        this.policy = Objects.requireNonNull(policy, "policy");
        if (!parsers.hasAnyBackend()) {
            throw new IllegalStateException("No parser backend is available for any language");
        }
        this.transformer = new GrammarValidatedTransformer(parsers, overlays, policy.getRefactoringPolicy());
        logger.info("Connascence engine initialized with policy " + policy.getName() + ", languages "
                + parsers.supportedLanguages() + ", " + overlays.size() + " safety overlays");
    }

    /**
     * An engine with every bundled backend, the bundled overlays and the bundled default policy.
     */
    public static ConnascenceEngine withDefaults() {
        return new ConnascenceEngine(ParserRegistry.withDefaultBackends(), OverlayCatalog.loadDefault(),
                PolicyLoader.loadDefaultPolicy());
    }

    @Override
    public ParseResult parse(String source, Language language) {
        return parsers.parse(source, language);
    }

    /**
     * Analyzes source text under the engine's policy, without an overlay.
     */
    public AnalysisResult analyzeUnit(String source, Language language) {
        return analyzeUnit(new SourceUnit(UNKNOWN_PATH, language, source), policy.getRegistry(), null);
    }

    /**
     * Analyzes source text with an explicit registry and optional overlay.
     */
    public AnalysisResult analyzeUnit(String source, Language language, PatternRegistry registry,
                                      SafetyOverlay overlay) {
        return analyzeUnit(new SourceUnit(UNKNOWN_PATH, language, source), registry, overlay);
    }

    /**
     * Analyzes a unit under the engine's policy with the catalog overlay of the given id.
     */
    public AnalysisResult analyzeUnit(SourceUnit unit, String overlayId) {
        return analyzeUnit(unit, policy.getRegistry(), _overlay(overlayId, unit.getLanguage()).orElse(null));
    }

    @Override
    public AnalysisResult analyzeUnit(SourceUnit unit, PatternRegistry registry, SafetyOverlay overlay) {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(registry, "registry");
        long start = System.nanoTime();

        ParseResult parsed = parsers.parse(unit.getText(), unit.getLanguage());
        if (!parsed.isSuccess()) {
            logger.fine("Analysis of " + unit.getPath() + " stopped: " + String.join("; ", parsed.errorMessages()));
            return AnalysisResult.builder()
                    .successful(false)
                    .language(unit.getLanguage())
                    .errors(parsed.getErrors())
                    .build();
        }

        SafetyOverlay active = overlay;
        if (overlay != null && !overlay.appliesTo(unit.getLanguage())) {
            logger.warning("Overlay " + overlay.getId() + " targets " + overlay.getLanguage().getId()
                    + ", ignored for " + unit.getPath());
            active = null;
        }

        RuleContext context = new RuleContext(parsed.getRoot(), unit.getLanguage(), registry, unit.getPath());
        List<Violation> violations = new ArrayList<>(detector.detect(context));
        if (active != null) {
            for (OverlayViolation violation : overlayValidator.validate(parsed.getRoot(), active)) {
                violations.add(context.violations().fromOverlay(violation));
            }
            violations.sort(Comparator.comparingInt(Violation::getLine).thenComparingInt(Violation::getColumn));
        }
        List<RefactoringCandidate> candidates = candidateFinder.find(context, active != null);

        logger.fine("Analyzed " + unit + " in " + (System.nanoTime() - start) / 1_000_000 + " ms: "
                + violations.size() + " violations, " + candidates.size() + " candidates");
        return AnalysisResult.builder()
                .successful(true)
                .language(unit.getLanguage())
                .violations(violations)
                .candidates(candidates)
                .build();
    }

    /**
     * Candidates of a unit whose connascence improvement mentions one of the given kinds.
     */
    public List<RefactoringCandidate> findCandidates(SourceUnit unit, Collection<String> targetKinds) {
        AnalysisResult result = analyzeUnit(unit, policy.getRegistry(), null);
        return CandidateFinder.filter(result.getCandidates(), targetKinds);
    }

    @Override
    public RefactoringResult applyRefactoring(RefactoringCandidate candidate, String source, Language language,
                                              boolean validateOverlay) {
        return transformer.apply(candidate, source, language, validateOverlay);
    }

    /**
     * Applies several candidates in batch order; see {@link GrammarValidatedTransformer#applyBatch}.
     */
    public RefactoringResult applyRefactorings(List<RefactoringCandidate> candidates, String source,
                                               Language language, boolean validateOverlay) {
        return transformer.applyBatch(candidates, source, language, validateOverlay);
    }

    /**
     * The text a candidate would produce, without validation.
     */
    public String previewRefactoring(RefactoringCandidate candidate, String source, Language language) {
        return transformer.preview(candidate, source, language);
    }

    /**
     * Parses the code and, when an overlay id is given, checks it against that overlay.
     */
    public ValidationResult validate(String source, Language language, String overlayId) {
        ParseResult parsed = parsers.parse(source, language);
        if (!parsed.isSuccess()) {
            return new ValidationResult(parsed.getErrors(), List.of());
        }
        List<OverlayViolation> violations = _overlay(overlayId, language)
                .map(overlay -> overlayValidator.validate(parsed.getRoot(), overlay))
                .orElse(List.of());
        return new ValidationResult(List.of(), violations);
    }

    @Override
    public List<String> filterTokens(List<String> candidateTokens, Language language, String overlayId) {
        return tokenConstraints.filterTokens(candidateTokens, _overlay(overlayId, language).orElse(null));
    }

    /**
     * Heuristic suggestions for the token after {@code prefix}, filtered through the overlay.
     */
    public List<String> nextTokens(String prefix, Language language, String overlayId) {
        return tokenConstraints.nextTokens(prefix, language, _overlay(overlayId, language).orElse(null));
    }

    // Getters
    public Policy getPolicy() { return policy; }
    public OverlayCatalog getOverlays() { return overlays; }
    public ParserRegistry getParsers() { return parsers; }

    private Optional<SafetyOverlay> _overlay(String overlayId, Language language) {
        if (overlayId == null) {
            return Optional.empty();
        }
        Optional<SafetyOverlay> overlay = overlays.get(overlayId);
        if (overlay.isEmpty()) {
            logger.warning("Unknown safety overlay: " + overlayId);
            return Optional.empty();
        }
        if (!overlay.get().appliesTo(language)) {
            logger.warning("Overlay " + overlayId + " targets " + overlay.get().getLanguage().getId()
                    + ", not " + language.getId());
            return Optional.empty();
        }
        return overlay;
    }
}
