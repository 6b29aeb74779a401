package com.constraint.adapter.spring;

import com.constraint.function.FunctionRegistry;

/**
 * Registers DSL functions with the application's registry.
 * Every bean of this type is applied once, in bean order, before any constraint is compiled.
 */
@FunctionalInterface
public interface FunctionContributor {

    void contribute(FunctionRegistry registry);
}
