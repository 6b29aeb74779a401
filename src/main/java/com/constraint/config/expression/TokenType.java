package com.constraint.config.expression;

/**
 * Token types for assertion expressions.
 */
public enum TokenType {
    // References and literals
    MODEL_REF,
    STATE_REF,
    STRING,
    NUMBER,
    FUNCTION_CALL,
    STATEMENT,

    // Grouping
    LPAREN,
    RPAREN,

    // Comparison operators
    LT,
    LTE,
    EQ,
    NE,
    GTE,
    GT,

    // Arithmetic operators
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,

    // Logical operators
    AND,
    OR,

    // Special
    EOF
}
