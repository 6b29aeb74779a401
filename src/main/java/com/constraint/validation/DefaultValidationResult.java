package com.constraint.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Default implementation of ValidationResult.
 */
public class DefaultValidationResult implements ValidationResult {

    private static final ValidationResult VALID = new DefaultValidationResult(List.of(), "All constraints hold");

    private final List<Violation> violations;
    private final String explanation;

    private DefaultValidationResult(List<Violation> violations, String explanation) {
        this.violations = violations;
        this.explanation = explanation;
    }

    @Override
    public boolean isValid() {
        return violations.isEmpty();
    }

    @Override
    public List<Violation> getViolations() {
        return violations;
    }

    @Override
    public String getExplanation() {
        return explanation;
    }

    @Override
    public String toString() {
        return "ValidationResult{" +
                "valid=" + isValid() +
                ", violations=" + violations.size() +
                '}';
    }

    /**
     * Create a result for a pair that satisfied every constraint.
     */
    public static ValidationResult valid() {
        return VALID;
    }

    /**
     * Create a result listing the violated constraints.
     */
    public static ValidationResult invalid(List<Violation> violations) {
        if (violations.isEmpty()) {
            return VALID;
        }
        String explanation = violations.size() + " constraint(s) violated: " + violations.stream()
                .map(Violation::name)
                .collect(Collectors.joining(", "));
        return new DefaultValidationResult(List.copyOf(violations), explanation);
    }
}
