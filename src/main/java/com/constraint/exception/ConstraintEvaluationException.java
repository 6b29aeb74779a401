package com.constraint.exception;

/**
 * Exception thrown when a registered function fails while a constraint or message
 * is being evaluated.
 */
public class ConstraintEvaluationException extends ConstraintException {

    public ConstraintEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
