package com.constraint.config.expression;

import com.constraint.exception.DslSyntaxException;
import com.constraint.exception.UnknownFunctionException;
import com.constraint.expression.BinaryOperator;
import com.constraint.expression.Expression;
import com.constraint.expression.impl.BinaryOperationExpression;
import com.constraint.expression.impl.DataReferenceExpression;
import com.constraint.expression.impl.FunctionCallExpression;
import com.constraint.expression.impl.GroupExpression;
import com.constraint.expression.impl.NumberLiteralExpression;
import com.constraint.expression.impl.StatementReferenceExpression;
import com.constraint.expression.impl.StringLiteralExpression;
import com.constraint.function.FunctionRegistry;
import com.constraint.variable.DataScope;
import com.constraint.variable.ValueResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Parser for assertion expressions.
 * Converts tokens into an Expression tree using recursive descent parsing.
 * <p>
 * Grammar (loosest binding first, all binary levels left-associative):
 * <pre>
 * expression     := or
 * or             := and ('||' and)*
 * and            := equality ('&amp;&amp;' equality)*
 * equality       := comparison (('==' | '!=') comparison)*
 * comparison     := additive (('&lt;' | '&lt;=' | '&gt;' | '&gt;=') additive)*
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := primary (('*' | '/' | '%') primary)*
 * primary        := '(' expression ')' | reference | string | number | call | statement
 * </pre>
 * Function call arguments are split on top-level commas and each compiled as an expression.
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private final FunctionRegistry functions;
    private final ValueResolver resolver;
    private int index;

    public ExpressionParser(String input, List<Token> tokens, FunctionRegistry functions, ValueResolver resolver) {
        this.input = input;
        this.tokens = tokens;
        this.functions = functions;
        this.resolver = resolver;
        this.index = 0;
    }

    /**
     * Parse the token stream into an Expression tree.
     *
     * @return Root expression node
     * @throws DslSyntaxException       if the tokens do not form one expression
     * @throws UnknownFunctionException if a call or statement names an unregistered function
     */
    public Expression parse() {
        Expression result = parseExpression();
        expect(TokenType.EOF);
        return result;
    }

    private Expression parseExpression() {
        return parseOr();
    }

    private Expression parseOr() {
        return parseBinary(this::parseAnd, TokenType.OR);
    }

    private Expression parseAnd() {
        return parseBinary(this::parseEquality, TokenType.AND);
    }

    private Expression parseEquality() {
        return parseBinary(this::parseComparison, TokenType.EQ, TokenType.NE);
    }

    private Expression parseComparison() {
        return parseBinary(this::parseAdditive, TokenType.LT, TokenType.LTE, TokenType.GT, TokenType.GTE);
    }

    private Expression parseAdditive() {
        return parseBinary(this::parseMultiplicative, TokenType.PLUS, TokenType.MINUS);
    }

    private Expression parseMultiplicative() {
        return parseBinary(this::parsePrimary, TokenType.STAR, TokenType.SLASH, TokenType.PERCENT);
    }

    private Expression parseBinary(Supplier<Expression> operand, TokenType... operators) {
        Expression left = operand.get();
        while (match(operators)) {
            BinaryOperator operator = BinaryOperator.fromTokenType(previous().type());
            Expression right = operand.get();
            left = new BinaryOperationExpression(operator, left, right);
        }
        return left;
    }

    private Expression parsePrimary() {
        // Parenthesized expression
        if (match(TokenType.LPAREN)) {
            Expression inner = parseExpression();
            expect(TokenType.RPAREN);
            return new GroupExpression(inner);
        }

        if (match(TokenType.MODEL_REF)) {
            return new DataReferenceExpression(DataScope.MODEL, (String) previous().literal(), resolver);
        }
        if (match(TokenType.STATE_REF)) {
            return new DataReferenceExpression(DataScope.STATE, (String) previous().literal(), resolver);
        }
        if (match(TokenType.STRING)) {
            return new StringLiteralExpression((String) previous().literal());
        }
        if (match(TokenType.NUMBER)) {
            return new NumberLiteralExpression((Double) previous().literal());
        }
        if (match(TokenType.STATEMENT)) {
            return new StatementReferenceExpression(requireRegistered(previous()));
        }
        if (match(TokenType.FUNCTION_CALL)) {
            Token call = previous();
            String name = requireRegistered(call);
            List<Expression> arguments = new ArrayList<>();
            for (String argument : DslStrings.splitArguments(call.rawArguments())) {
                arguments.add(compileArgument(argument));
            }
            return new FunctionCallExpression(name, arguments);
        }

        if (check(TokenType.EOF)) {
            throw error("Unexpected end of expression");
        }
        throw error("Unexpected token '" + peek().text() + "'");
    }

    private Expression compileArgument(String argument) {
        List<Token> argumentTokens = new ExpressionTokenizer(argument, functions).tokenize();
        return new ExpressionParser(argument, argumentTokens, functions, resolver).parse();
    }

    private String requireRegistered(Token token) {
        String name = (String) token.literal();
        if (!functions.contains(name)) {
            throw new UnknownFunctionException(name);
        }
        return name;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private DslSyntaxException error(String message) {
        int position = peek().position();
        return new DslSyntaxException("Invalid expression at position "
                + position + ": " + message + " in '" + input + "'", position);
    }
}
