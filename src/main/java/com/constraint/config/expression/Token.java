package com.constraint.config.expression;

/**
 * Represents a token in an expression.
 *
 * @param type     Token type
 * @param text     Original text
 * @param literal  Parsed value: path for references, content for strings, Double for numbers,
 *                 function name for calls and statements
 * @param position Position in the scanned input string
 */
public record Token(TokenType type, String text, Object literal, int position) {

    /**
     * For a function call token, the raw text between its outermost brackets.
     */
    public String rawArguments() {
        if (type != TokenType.FUNCTION_CALL) {
            throw new IllegalStateException("Token " + this + " is not a function call");
        }
        return text.substring(text.indexOf(DslSymbols.BRACKET_OPEN) + 1, text.length() - 1);
    }

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
