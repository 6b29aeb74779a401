package com.constraint.activation;

import com.constraint.expression.EvaluationContext;

/**
 * Decides whether a constraint's condition must hold for the given data.
 */
public interface Activation {

    /**
     * Evaluate this activation.
     *
     * @param context Model, state and callable functions
     * @return true if the condition must hold
     */
    boolean isActive(EvaluationContext context);

    /**
     * Get the activation type.
     */
    ActivationType getType();
}
