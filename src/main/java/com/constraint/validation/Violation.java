package com.constraint.validation;

/**
 * A constraint that did not hold.
 *
 * @param name      Constraint name
 * @param assertion Raw assertion text
 * @param message   Rendered message
 */
public record Violation(String name, String assertion, String message) {
}
