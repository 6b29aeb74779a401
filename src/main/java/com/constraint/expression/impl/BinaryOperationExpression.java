package com.constraint.expression.impl;

import com.constraint.expression.BinaryOperator;
import com.constraint.expression.EvaluationContext;
import com.constraint.expression.Expression;
import com.constraint.expression.ExpressionType;

/**
 * Binary operation with exactly two operands. {@code &&} and {@code ||} short-circuit.
 */
public class BinaryOperationExpression implements Expression {

    private final BinaryOperator operator;
    private final Expression left;
    private final Expression right;

    public BinaryOperationExpression(BinaryOperator operator, Expression left, Expression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        return switch (operator) {
            case AND -> left.test(context) && right.test(context);
            case OR -> left.test(context) || right.test(context);
            default -> operator.apply(left.evaluate(context), right.evaluate(context));
        };
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.BINARY_OP;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public String toString() {
        return "[" + left + " " + operator.getSymbol() + " " + right + "]";
    }
}
