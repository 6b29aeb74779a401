package com.constraint.variable;

import static com.constraint.config.expression.DslSymbols.MODEL_PREFIX;
import static com.constraint.config.expression.DslSymbols.STATE_PREFIX;

/**
 * The two data contexts an expression can read from.
 */
public enum DataScope {
    /**
     * Model data ($a.b.c)
     */
    MODEL(MODEL_PREFIX),

    /**
     * State data (#a.b.c)
     */
    STATE(STATE_PREFIX);

    private final char prefix;

    DataScope(char prefix) {
        this.prefix = prefix;
    }

    public char getPrefix() {
        return prefix;
    }

    /**
     * Pick this scope's root object.
     */
    public Object select(Object model, Object state) {
        return this == MODEL ? model : state;
    }

    /**
     * Determine the scope from a reference's leading character.
     *
     * @param reference Reference text (e.g., "$order.total")
     * @return The data scope
     * @throws IllegalArgumentException if the reference has no data prefix
     */
    public static DataScope fromReference(String reference) {
        if (reference == null || reference.isEmpty()) {
            throw new IllegalArgumentException("Data reference cannot be null or empty");
        }
        char first = reference.charAt(0);
        if (first == MODEL_PREFIX) {
            return MODEL;
        }
        if (first == STATE_PREFIX) {
            return STATE;
        }
        throw new IllegalArgumentException("Invalid data reference: " + reference
                + ". Must start with " + MODEL_PREFIX + " or " + STATE_PREFIX);
    }
}
