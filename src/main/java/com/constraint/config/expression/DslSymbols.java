package com.constraint.config.expression;

import java.util.Map;
import java.util.Set;

/**
 * Symbols, keywords and operators of the assertion DSL.
 */
public final class DslSymbols {

    private DslSymbols() {
    }

    // General
    public static final char COND_SEPARATOR = ':';
    public static final char KEY_SEPARATOR = '.';
    public static final char ARG_SEPARATOR = ',';

    // Activation
    public static final String ALWAYS = "ALWAYS";
    public static final String WHEN = "WHEN";

    // Data access
    public static final char MODEL_PREFIX = '$';
    public static final char STATE_PREFIX = '#';
    public static final char STRING_SYMBOL = '\'';
    public static final char FORBIDDEN_STRING_CHAR = '`';

    public static final char BRACKET_OPEN = '(';
    public static final char BRACKET_CLOSE = ')';

    /**
     * Text substituted into messages for a data path that does not resolve.
     */
    public static final String UNDEFINED_VALUE = "UNDEFINED_VALUE";

    /**
     * Upper bound on tokens scanned from one expression.
     */
    public static final int MAX_PARSING_ITERATIONS = 1000;

    /**
     * Operator spellings mapped to token types.
     */
    public static final Map<String, TokenType> OPERATORS = Map.ofEntries(
            // Comparison
            Map.entry("<", TokenType.LT),
            Map.entry("<=", TokenType.LTE),
            Map.entry("==", TokenType.EQ),
            Map.entry("!=", TokenType.NE),
            Map.entry(">=", TokenType.GTE),
            Map.entry(">", TokenType.GT),

            // Arithmetic
            Map.entry("+", TokenType.PLUS),
            Map.entry("-", TokenType.MINUS),
            Map.entry("*", TokenType.STAR),
            Map.entry("/", TokenType.SLASH),
            Map.entry("%", TokenType.PERCENT),

            // Grouping
            Map.entry("(", TokenType.LPAREN),
            Map.entry(")", TokenType.RPAREN),

            // Logic
            Map.entry("&&", TokenType.AND),
            Map.entry("||", TokenType.OR)
    );

    /**
     * First character of every operator, used to recognise the start of an operator token.
     */
    public static final Set<Character> OPERATOR_START =
            Set.of('<', '=', '!', '>', '+', '-', '*', '/', '%', '(', ')', '&', '|');

    public static boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == '_';
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
