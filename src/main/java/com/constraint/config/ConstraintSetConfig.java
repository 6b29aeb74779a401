package com.constraint.config;

import java.util.List;

/**
 * A named set of constraint definitions, in evaluation order.
 *
 * @param name        Set name
 * @param definitions Constraint definitions
 */
public record ConstraintSetConfig(
        String name,
        List<ConstraintDefinition> definitions
) {
    public ConstraintSetConfig {
        definitions = definitions == null ? List.of() : List.copyOf(definitions);
    }
}
