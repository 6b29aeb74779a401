package com.constraint.expression.impl;

import com.constraint.expression.EvaluationContext;
import com.constraint.expression.Expression;
import com.constraint.expression.ExpressionType;

/**
 * Bare reference to a registered zero-argument function, invoked with (model, state).
 */
public class StatementReferenceExpression implements Expression {

    private final String name;

    public StatementReferenceExpression(String name) {
        this.name = name;
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        return context.invokeStatement(name);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.STATEMENT_REF;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
