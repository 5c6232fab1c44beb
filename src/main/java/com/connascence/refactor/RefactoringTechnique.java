package com.connascence.refactor;

import java.util.Locale;

/**
 * The catalog of refactoring techniques. Every technique is known to the engine; only some have
 * a handler in {@link GrammarValidatedTransformer}.
 */
public enum RefactoringTechnique {
    // Composing methods
    EXTRACT_METHOD("extract_method"),
    INLINE_METHOD("inline_method"),
    EXTRACT_VARIABLE("extract_variable"),
    INLINE_VARIABLE("inline_variable"),
    REPLACE_TEMP_WITH_QUERY("replace_temp_with_query"),

    // Moving features between objects
    MOVE_METHOD("move_method"),
    MOVE_FIELD("move_field"),
    EXTRACT_CLASS("extract_class"),
    INLINE_CLASS("inline_class"),

    // Organizing data
    REPLACE_MAGIC_NUMBER("replace_magic_number"),
    ENCAPSULATE_FIELD("encapsulate_field"),
    REPLACE_TYPE_CODE_WITH_CLASS("replace_type_code_with_class"),

    // Simplifying conditional expressions
    DECOMPOSE_CONDITIONAL("decompose_conditional"),
    CONSOLIDATE_CONDITIONAL_EXPRESSION("consolidate_conditional"),
    REPLACE_CONDITIONAL_WITH_POLYMORPHISM("replace_conditional_with_polymorphism"),

    // Simplifying method calls
    RENAME_METHOD("rename_method"),
    SEPARATE_QUERY_FROM_MODIFIER("separate_query_from_modifier"),
    PARAMETERIZE_METHOD("parameterize_method"),
    INTRODUCE_PARAMETER_OBJECT("introduce_parameter_object"),
    PRESERVE_WHOLE_OBJECT("preserve_whole_object"),

    // Dealing with generalization
    PULL_UP_METHOD("pull_up_method"),
    PUSH_DOWN_METHOD("push_down_method"),
    EXTRACT_SUPERCLASS("extract_superclass"),
    SUBSTITUTE_ALGORITHM("substitute_algorithm"),

    // Safety
    INTRODUCE_ASSERTION("introduce_assertion"),
    REPLACE_RECURSION_WITH_ITERATION("replace_recursion_with_iteration"),
    REPLACE_CONSTRUCTOR_WITH_FACTORY("replace_constructor_with_factory");

    private final String id;

    RefactoringTechnique(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Resolves a technique id such as {@code "extract_method"}.
     *
     * @throws IllegalArgumentException when no technique has that id
     */
    public static RefactoringTechnique fromId(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (RefactoringTechnique technique : values()) {
            if (technique.id.equals(normalized)) {
                return technique;
            }
        }
        throw new IllegalArgumentException("Unknown refactoring technique: " + id);
    }
}
