package com.constraint.activation;

/**
 * Forms of the activation part of an assertion.
 */
public enum ActivationType {
    /**
     * ALWAYS
     */
    ALWAYS,

    /**
     * WHEN(condition)
     */
    CONDITIONAL,

    /**
     * Bare registered statement name
     */
    STATEMENT
}
