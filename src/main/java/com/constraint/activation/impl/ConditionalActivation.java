package com.constraint.activation.impl;

import com.constraint.activation.Activation;
import com.constraint.activation.ActivationType;
import com.constraint.expression.EvaluationContext;
import com.constraint.expression.Expression;

/**
 * Activation guarded by an expression, written {@code WHEN(expression)}.
 */
public class ConditionalActivation implements Activation {

    private final Expression condition;

    public ConditionalActivation(Expression condition) {
        this.condition = condition;
    }

    @Override
    public boolean isActive(EvaluationContext context) {
        return condition.test(context);
    }

    @Override
    public ActivationType getType() {
        return ActivationType.CONDITIONAL;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public String toString() {
        return "WHEN(" + condition + ")";
    }
}
