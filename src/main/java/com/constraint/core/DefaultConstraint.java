package com.constraint.core;

import com.constraint.activation.Activation;
import com.constraint.expression.Expression;
import com.constraint.function.FunctionRegistry;

/**
 * Default implementation of Constraint, bound to the registry it was compiled against.
 */
public class DefaultConstraint implements Constraint {

    private final String assertion;
    private final Activation activation;
    private final Expression condition;
    private final FunctionRegistry functions;

    public DefaultConstraint(String assertion, Activation activation, Expression condition,
                             FunctionRegistry functions) {
        this.assertion = assertion;
        this.activation = activation;
        this.condition = condition;
        this.functions = functions;
    }

    @Override
    public boolean evaluate(Object model, Object state) {
        return evaluate(model, state, functions.asMap());
    }

    @Override
    public String getAssertion() {
        return assertion;
    }

    @Override
    public Activation getActivation() {
        return activation;
    }

    @Override
    public Expression getCondition() {
        return condition;
    }

    @Override
    public String toString() {
        return "Constraint{" + activation + " : " + condition + "}";
    }
}
