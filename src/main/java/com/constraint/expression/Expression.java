package com.constraint.expression;

/**
 * A compiled expression node that can be evaluated against model and state.
 * Nodes are immutable and may be shared across threads.
 */
public interface Expression {

    /**
     * Evaluate this node.
     *
     * @param context Model, state and callable functions
     * @return Resolved value; a missing data path yields {@link com.constraint.variable.MissingValue#INSTANCE}
     */
    Object evaluate(EvaluationContext context);

    /**
     * Get the node type.
     */
    ExpressionType getType();

    /**
     * Evaluate and coerce the result to a boolean.
     */
    default boolean test(EvaluationContext context) {
        return Values.isTruthy(evaluate(context));
    }
}
