package com.constraint.variable;

import com.constraint.config.expression.DslSymbols;

/**
 * Sentinel for a data path that does not resolve.
 * Never equal to anything, never truthy, and NaN in arithmetic.
 */
public enum MissingValue {
    INSTANCE;

    public static boolean isMissing(Object value) {
        return value == INSTANCE;
    }

    @Override
    public String toString() {
        return DslSymbols.UNDEFINED_VALUE;
    }
}
