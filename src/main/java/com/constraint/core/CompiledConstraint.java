package com.constraint.core;

import com.constraint.config.ConstraintDefinition;

/**
 * A constraint definition together with its compiled form.
 *
 * @param definition Source definition
 * @param constraint Compiled constraint
 */
public record CompiledConstraint(ConstraintDefinition definition, Constraint constraint) {

    public String name() {
        return definition.name();
    }
}
