package com.constraint.trace;

import com.constraint.config.expression.Token;
import com.constraint.core.Constraint;

import java.util.List;

/**
 * Observer for the trace points of constraint compilation.
 * <p>
 * All methods default to no-ops. Implementations must not throw; compilation does not
 * guard against listener failures.
 */
public interface CompilationListener {

    /**
     * Listener that ignores every event.
     */
    CompilationListener NOOP = new CompilationListener() {
    };

    /**
     * Called after an assertion has been split into activation and condition.
     */
    default void onSplit(String assertion, String activation, String condition) {
    }

    /**
     * Called after an expression has been tokenized.
     *
     * @param expression Whitespace-stripped expression text
     * @param tokens     Tokens including the trailing EOF
     */
    default void onTokenized(String expression, List<Token> tokens) {
    }

    /**
     * Called after an assertion has been compiled into a constraint.
     */
    default void onCompiled(String assertion, Constraint constraint) {
    }
}
