package com.connascence.ast;

import java.util.Set;

/**
 * Type tags shared by every language backend. Adapters map their own syntax onto this vocabulary
 * so rules can be written once.
 */
public final class NodeTypes {
    public static final String MODULE = "module";
    public static final String ERROR = "ERROR";

    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String DECORATED_DEFINITION = "decorated_definition";
    public static final String DECORATOR = "decorator";
    public static final String PARAMETERS = "parameters";
    public static final String BLOCK = "block";

    // parameter shapes
    public static final String PARAMETER = "parameter";
    public static final String TYPED_PARAMETER = "typed_parameter";
    public static final String DEFAULT_PARAMETER = "default_parameter";
    public static final String TYPED_DEFAULT_PARAMETER = "typed_default_parameter";
    public static final String LIST_SPLAT_PATTERN = "list_splat_pattern";
    public static final String DICTIONARY_SPLAT_PATTERN = "dictionary_splat_pattern";
    public static final String KEYWORD_SEPARATOR = "keyword_separator";
    public static final String POSITIONAL_SEPARATOR = "positional_separator";
    public static final String VARIADIC_PARAMETER = "variadic_parameter";

    // statements
    public static final String IF_STATEMENT = "if_statement";
    public static final String ELIF_CLAUSE = "elif_clause";
    public static final String ELSE_CLAUSE = "else_clause";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String DO_STATEMENT = "do_statement";
    public static final String SWITCH_STATEMENT = "switch_statement";
    public static final String CASE_CLAUSE = "case_clause";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String EXCEPT_CLAUSE = "except_clause";
    public static final String FINALLY_CLAUSE = "finally_clause";
    public static final String WITH_STATEMENT = "with_statement";
    public static final String RETURN_STATEMENT = "return_statement";
    public static final String ASSERT_STATEMENT = "assert_statement";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String GOTO_STATEMENT = "goto_statement";
    public static final String LABELED_STATEMENT = "labeled_statement";
    public static final String BREAK_STATEMENT = "break_statement";
    public static final String CONTINUE_STATEMENT = "continue_statement";
    public static final String PASS_STATEMENT = "pass_statement";
    public static final String RAISE_STATEMENT = "raise_statement";
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String DECLARATION = "declaration";
    public static final String PREPROC_INCLUDE = "preproc_include";
    public static final String PREPROC_DEF = "preproc_def";
    public static final String PREPROC_DIRECTIVE = "preproc_directive";

    // expressions
    public static final String ASSIGNMENT = "assignment";
    public static final String AUGMENTED_ASSIGNMENT = "augmented_assignment";
    public static final String INIT_DECLARATOR = "init_declarator";
    public static final String CALL = "call";
    public static final String ARGUMENT_LIST = "argument_list";
    public static final String KEYWORD_ARGUMENT = "keyword_argument";
    public static final String COMPARISON_OPERATOR = "comparison_operator";
    public static final String BOOLEAN_OPERATOR = "boolean_operator";
    public static final String BINARY_OPERATOR = "binary_operator";
    public static final String UNARY_OPERATOR = "unary_operator";
    public static final String NOT_OPERATOR = "not_operator";
    public static final String CONDITIONAL_EXPRESSION = "conditional_expression";
    public static final String ATTRIBUTE = "attribute";
    public static final String SUBSCRIPT = "subscript";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String FUNCTION_POINTER = "function_pointer";
    public static final String IDENTIFIER = "identifier";
    public static final String TYPE = "type";

    // literals
    public static final String INTEGER = "integer";
    public static final String FLOAT = "float";
    public static final String STRING = "string";
    public static final String CONCATENATED_STRING = "concatenated_string";
    public static final String CHAR_LITERAL = "char_literal";
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String NONE = "none";

    public static final Set<String> NUMERIC_LITERALS = Set.of(INTEGER, FLOAT);

    /** Constructs that open a new nesting level. */
    public static final Set<String> BRANCHING = Set.of(
            IF_STATEMENT, FOR_STATEMENT, WHILE_STATEMENT, DO_STATEMENT,
            SWITCH_STATEMENT, TRY_STATEMENT, WITH_STATEMENT);

    /** Boundaries a literal's context lookup never crosses. */
    public static final Set<String> SCOPE_BOUNDARIES = Set.of(
            BLOCK, MODULE, FUNCTION_DEFINITION, CLASS_DEFINITION);

    public static final Set<String> NON_COUNTED_PARAMETERS = Set.of(
            KEYWORD_SEPARATOR, POSITIONAL_SEPARATOR, VARIADIC_PARAMETER);

    private NodeTypes() {
    }
}
