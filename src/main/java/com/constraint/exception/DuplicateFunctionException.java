package com.constraint.exception;

/**
 * Exception thrown when a function name is registered twice.
 */
public class DuplicateFunctionException extends ConstraintException {

    private final String functionName;

    public DuplicateFunctionException(String functionName) {
        super("Function with name " + functionName + " is already registered");
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
