package com.constraint.expression.impl;

import com.constraint.expression.EvaluationContext;
import com.constraint.expression.Expression;
import com.constraint.expression.ExpressionType;

/**
 * A quoted string literal.
 */
public class StringLiteralExpression implements Expression {

    private final String value;

    public StringLiteralExpression(String value) {
        this.value = value;
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        return value;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.STRING_LITERAL;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "'" + value + "'";
    }
}
