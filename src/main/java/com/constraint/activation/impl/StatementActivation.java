package com.constraint.activation.impl;

import com.constraint.activation.Activation;
import com.constraint.activation.ActivationType;
import com.constraint.expression.EvaluationContext;
import com.constraint.expression.Values;

/**
 * Activation gated by a registered statement, invoked with (model, state).
 */
public class StatementActivation implements Activation {

    private final String name;

    public StatementActivation(String name) {
        this.name = name;
    }

    @Override
    public boolean isActive(EvaluationContext context) {
        return Values.isTruthy(context.invokeStatement(name));
    }

    @Override
    public ActivationType getType() {
        return ActivationType.STATEMENT;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
