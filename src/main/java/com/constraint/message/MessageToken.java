package com.constraint.message;

import com.constraint.config.expression.TokenType;

/**
 * A reference found in a message template.
 *
 * @param type  MODEL_REF, STATE_REF, STATEMENT or FUNCTION_CALL
 * @param text  Reference text as written (e.g., "$order.total", "fmt($a, 'x')")
 * @param start Index of the first character in the template
 */
public record MessageToken(TokenType type, String text, int start) {

    /**
     * Index just past the last character in the template.
     */
    public int end() {
        return start + text.length();
    }
}
