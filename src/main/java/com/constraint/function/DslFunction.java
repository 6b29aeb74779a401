package com.constraint.function;

/**
 * A callable registered under a name in the DSL.
 * <p>
 * Invoked as {@code name(arg1, arg2, ...)} with the evaluated arguments, or, when
 * referenced as a bare statement, with {@code (model, state)}.
 */
@FunctionalInterface
public interface DslFunction {

    /**
     * Invoke the function.
     *
     * @param args Evaluated arguments; a data path that does not resolve is passed as null
     * @return Function result
     */
    Object invoke(Object... args);
}
