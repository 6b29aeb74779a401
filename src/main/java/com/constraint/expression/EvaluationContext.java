package com.constraint.expression;

import com.constraint.exception.ConstraintEvaluationException;
import com.constraint.exception.ConstraintException;
import com.constraint.exception.UnknownFunctionException;
import com.constraint.function.DslFunction;

import java.util.Map;

/**
 * Inputs of one evaluation: the caller's model and state plus the callable functions.
 * Not retained after the evaluation returns.
 */
public final class EvaluationContext {

    private final Object model;
    private final Object state;
    private final Map<String, DslFunction> functions;

    public EvaluationContext(Object model, Object state, Map<String, DslFunction> functions) {
        this.model = model;
        this.state = state;
        this.functions = functions;
    }

    public Object getModel() {
        return model;
    }

    public Object getState() {
        return state;
    }

    /**
     * Invoke a function by name.
     *
     * @throws UnknownFunctionException      if no function has that name
     * @throws ConstraintEvaluationException if the function itself fails
     */
    public Object invoke(String name, Object... args) {
        DslFunction function = functions.get(name);
        if (function == null) {
            throw new UnknownFunctionException(name);
        }
        try {
            return function.invoke(args);
        } catch (ConstraintException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConstraintEvaluationException("Function '" + name + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * Invoke a zero-argument statement, which receives model and state.
     */
    public Object invokeStatement(String name) {
        return invoke(name, model, state);
    }
}
