package com.constraint.config;

/**
 * Raw source of one constraint.
 *
 * @param name      Constraint name (e.g., "positive-total")
 * @param assertion Assertion text of the form {@code activation:condition}
 * @param message   Message template rendered when the constraint is violated (may be null)
 */
public record ConstraintDefinition(
        String name,
        String assertion,
        String message
) {
    /**
     * Check if a message template is configured.
     */
    public boolean hasMessage() {
        return message != null && !message.isBlank();
    }
}
