package com.constraint.activation.impl;

import com.constraint.activation.Activation;
import com.constraint.activation.ActivationType;
import com.constraint.expression.EvaluationContext;

/**
 * Activation that is always active.
 */
public final class AlwaysActivation implements Activation {

    public static final AlwaysActivation INSTANCE = new AlwaysActivation();

    private AlwaysActivation() {
    }

    @Override
    public boolean isActive(EvaluationContext context) {
        return true;
    }

    @Override
    public ActivationType getType() {
        return ActivationType.ALWAYS;
    }

    @Override
    public String toString() {
        return "ALWAYS";
    }
}
