package com.constraint.exception;

/**
 * Exception thrown when a function call or statement reference names a function
 * that is not registered.
 */
public class UnknownFunctionException extends ConstraintException {

    private final String functionName;

    public UnknownFunctionException(String functionName) {
        super("Unknown function '" + functionName + "'");
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
