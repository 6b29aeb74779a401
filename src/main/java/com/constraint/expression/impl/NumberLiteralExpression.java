package com.constraint.expression.impl;

import com.constraint.expression.EvaluationContext;
import com.constraint.expression.Expression;
import com.constraint.expression.ExpressionType;
import com.constraint.expression.Values;

/**
 * A numeric literal, held as double.
 */
public class NumberLiteralExpression implements Expression {

    private final double value;

    public NumberLiteralExpression(double value) {
        this.value = value;
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        return value;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.NUMBER_LITERAL;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return Values.toText(value);
    }
}
