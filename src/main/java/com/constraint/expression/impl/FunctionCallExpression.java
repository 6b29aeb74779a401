package com.constraint.expression.impl;

import com.constraint.expression.EvaluationContext;
import com.constraint.expression.Expression;
import com.constraint.expression.ExpressionType;
import com.constraint.variable.MissingValue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Call of a registered function with evaluated arguments, e.g. {@code add(mul(2, 3), $x)}.
 * Arguments are evaluated left to right before the call; missing values are passed as null.
 */
public class FunctionCallExpression implements Expression {

    private final String name;
    private final List<Expression> arguments;

    public FunctionCallExpression(String name, List<Expression> arguments) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        Object[] args = new Object[arguments.size()];
        for (int i = 0; i < args.length; i++) {
            Object value = arguments.get(i).evaluate(context);
            args[i] = MissingValue.isMissing(value) ? null : value;
        }
        return context.invoke(name, args);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.FUNCTION_CALL;
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public String toString() {
        return name + arguments.stream()
                .map(Expression::toString)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
