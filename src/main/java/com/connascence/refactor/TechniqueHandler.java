package com.connascence.refactor;

/**
 * Text-level implementation of one refactoring technique. Handlers never see a tree they could
 * mutate: they read the parsed original and return new source text.
 */
public interface TechniqueHandler {
    /**
     * @throws TransformationException when the technique cannot be applied to this code
     */
    Transformation apply(TransformationContext context, RefactoringCandidate candidate);
}
