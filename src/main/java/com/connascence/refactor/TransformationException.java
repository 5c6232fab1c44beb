package com.connascence.refactor;

/**
 * Thrown by a technique handler that cannot apply its technique to the given code.
 * The transformer reports it as a rejected refactoring.
 */
public class TransformationException extends RuntimeException {
    public TransformationException(String message) {
        super(message);
    }
}
