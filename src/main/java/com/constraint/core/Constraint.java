package com.constraint.core;

import com.constraint.activation.Activation;
import com.constraint.expression.EvaluationContext;
import com.constraint.expression.Expression;
import com.constraint.function.DslFunction;

import java.util.Map;

/**
 * A compiled assertion: if the activation holds the condition must hold, otherwise the
 * constraint is vacuously satisfied. Immutable once compiled.
 */
public interface Constraint {

    /**
     * Evaluate against model and state using the functions registered with the compiler.
     *
     * @param model Model data
     * @param state State data
     * @return true if satisfied
     */
    boolean evaluate(Object model, Object state);

    /**
     * Evaluate with a caller-supplied function table.
     *
     * @param model     Model data
     * @param state     State data
     * @param functions Callables by name
     * @return true if satisfied
     */
    default boolean evaluate(Object model, Object state, Map<String, DslFunction> functions) {
        return evaluate(new EvaluationContext(model, state, functions));
    }

    /**
     * Evaluate within a prepared context.
     */
    default boolean evaluate(EvaluationContext context) {
        if (!getActivation().isActive(context)) {
            return true;
        }
        return getCondition().test(context);
    }

    /**
     * The raw assertion text this constraint was compiled from.
     */
    String getAssertion();

    Activation getActivation();

    Expression getCondition();
}
