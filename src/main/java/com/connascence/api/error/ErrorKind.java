package com.connascence.api.error;

/**
 * Taxonomy of failures the engine reports as data.
 */
public enum ErrorKind {
    SYNTAX_ERROR,
    UNSUPPORTED_LANGUAGE,
    TECHNIQUE_NOT_IMPLEMENTED,
    VALIDATION_FAILURE
}
