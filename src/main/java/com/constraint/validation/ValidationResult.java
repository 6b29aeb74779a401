package com.constraint.validation;

import java.util.List;

/**
 * Result of validating one model/state pair against a constraint set.
 */
public interface ValidationResult {

    /**
     * Check if every constraint held.
     */
    boolean isValid();

    /**
     * Violations in definition order. Empty when valid.
     */
    List<Violation> getViolations();

    /**
     * Get a human-readable summary of the outcome.
     */
    String getExplanation();
}
