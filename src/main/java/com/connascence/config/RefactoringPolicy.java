package com.connascence.config;

import java.util.Locale;
import java.util.Objects;

/**
 * How the transformer treats overlay findings and failures inside a batch.
 */
public final class RefactoringPolicy {

    public enum OverlayPolicy {
        // overlay findings become warnings
        ADVISORY,
        // new overlay findings reject the refactoring
        BLOCKING
    }

    public enum BatchMode {
        // stop at the first rejection and keep earlier edits
        BEST_EFFORT,
        // any rejection discards the whole batch
        TRANSACTIONAL
    }

    private static final RefactoringPolicy DEFAULT =
            new RefactoringPolicy(OverlayPolicy.ADVISORY, BatchMode.BEST_EFFORT);

    private final OverlayPolicy overlayPolicy;
    private final BatchMode batchMode;

    public RefactoringPolicy(OverlayPolicy overlayPolicy, BatchMode batchMode) {
        this.overlayPolicy = Objects.requireNonNull(overlayPolicy, "overlayPolicy");
        this.batchMode = Objects.requireNonNull(batchMode, "batchMode");
    }

    public static RefactoringPolicy defaults() {
        return DEFAULT;
    }

    public OverlayPolicy getOverlayPolicy() {
        return overlayPolicy;
    }

    public BatchMode getBatchMode() {
        return batchMode;
    }

    public boolean isBlocking() {
        return overlayPolicy == OverlayPolicy.BLOCKING;
    }

    public boolean isTransactional() {
        return batchMode == BatchMode.TRANSACTIONAL;
    }

    public RefactoringPolicy withOverlayPolicy(OverlayPolicy policy) {
        return new RefactoringPolicy(policy, batchMode);
    }

    public RefactoringPolicy withBatchMode(BatchMode mode) {
        return new RefactoringPolicy(overlayPolicy, mode);
    }

    static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        return Enum.valueOf(type, value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return "RefactoringPolicy{overlay=" + overlayPolicy + ", batch=" + batchMode + "}";
    }
}
