package com.constraint.expression;

import com.constraint.config.expression.TokenType;

/**
 * Binary operators of the DSL.
 * <p>
 * Precedence, tightest first: {@code * / %}, {@code + -}, {@code < <= > >=}, {@code == !=},
 * {@code &&}, {@code ||}. Operators of equal precedence associate left to right.
 */
public enum BinaryOperator {
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%"),
    ADD("+"),
    SUBTRACT("-"),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    EQUAL("=="),
    NOT_EQUAL("!="),
    AND("&&"),
    OR("||");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Apply to two already evaluated operands. {@link #AND} and {@link #OR} short-circuit
     * in the tree and never reach this method.
     */
    public Object apply(Object left, Object right) {
        return switch (this) {
            case MULTIPLY -> Values.toNumber(left) * Values.toNumber(right);
            case DIVIDE -> Values.toNumber(left) / Values.toNumber(right);
            case MODULO -> Values.toNumber(left) % Values.toNumber(right);
            case ADD -> Values.add(left, right);
            case SUBTRACT -> Values.toNumber(left) - Values.toNumber(right);
            case LESS -> Values.compare(left, right, c -> c < 0);
            case LESS_EQUAL -> Values.compare(left, right, c -> c <= 0);
            case GREATER -> Values.compare(left, right, c -> c > 0);
            case GREATER_EQUAL -> Values.compare(left, right, c -> c >= 0);
            case EQUAL -> Values.looseEquals(left, right);
            case NOT_EQUAL -> !Values.looseEquals(left, right);
            case AND, OR -> throw new IllegalStateException("Logical operator " + symbol
                    + " must be evaluated lazily");
        };
    }

    public static BinaryOperator fromTokenType(TokenType type) {
        return switch (type) {
            case STAR -> MULTIPLY;
            case SLASH -> DIVIDE;
            case PERCENT -> MODULO;
            case PLUS -> ADD;
            case MINUS -> SUBTRACT;
            case LT -> LESS;
            case LTE -> LESS_EQUAL;
            case GT -> GREATER;
            case GTE -> GREATER_EQUAL;
            case EQ -> EQUAL;
            case NE -> NOT_EQUAL;
            case AND -> AND;
            case OR -> OR;
            default -> throw new IllegalArgumentException("Not a binary operator: " + type);
        };
    }
}
