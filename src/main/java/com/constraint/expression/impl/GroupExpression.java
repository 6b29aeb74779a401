package com.constraint.expression.impl;

import com.constraint.expression.EvaluationContext;
import com.constraint.expression.Expression;
import com.constraint.expression.ExpressionType;

/**
 * An explicitly bracketed sub-expression.
 */
public class GroupExpression implements Expression {

    private final Expression inner;

    public GroupExpression(Expression inner) {
        this.inner = inner;
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        return inner.evaluate(context);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.GROUP;
    }

    public Expression getInner() {
        return inner;
    }

    @Override
    public String toString() {
        return "(" + inner + ")";
    }
}
