package com.constraint.expression;

/**
 * Node types of a compiled expression tree.
 */
public enum ExpressionType {
    // References
    MODEL_REF,
    STATE_REF,
    STATEMENT_REF,

    // Literals
    STRING_LITERAL,
    NUMBER_LITERAL,

    // Composite
    FUNCTION_CALL,
    BINARY_OP,
    GROUP
}
