package com.constraint.exception;

/**
 * Exception thrown when an assertion, expression or message template is malformed.
 * Carries the index of the offending character where one is known.
 */
public class DslSyntaxException extends ConstraintException {

    private final int position;

    public DslSyntaxException(String message) {
        this(message, -1);
    }

    public DslSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Index of the offending character in the scanned input, or -1 if unknown.
     * <p>
     * Expression errors index into the expression as tokenized: the activation body or
     * the condition, trimmed and with whitespace outside string literals removed. For
     * {@code ALWAYS: 1 == 'abc} the unterminated string is at position 3 of {@code 1=='abc}.
     * Errors found while splitting an assertion, or in a message template, index into that
     * raw text.
     */
    public int getPosition() {
        return position;
    }
}
