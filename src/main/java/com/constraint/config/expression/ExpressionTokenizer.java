package com.constraint.config.expression;

import com.constraint.exception.DslSyntaxException;
import com.constraint.function.FunctionRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static com.constraint.config.expression.DslSymbols.*;

/**
 * Tokenizer for assertion expressions.
 * Scans a whitespace-free expression left to right. The leading character of each token
 * decides its kind, tried in this order: data access ({@code $}, {@code #}), string literal,
 * number, registered function or statement, operator or bracket.
 */
public final class ExpressionTokenizer {

    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?");

    private final String input;
    private final int length;
    private final FunctionRegistry functions;
    private int pos;

    public ExpressionTokenizer(String input, FunctionRegistry functions) {
        this.input = input;
        this.length = input.length();
        this.functions = functions;
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, terminated by an EOF token
     * @throws DslSyntaxException on an unexpected character, an unterminated string or call,
     *                            or when the iteration cap is exceeded
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        int iterations = 0;

        while (!isAtEnd()) {
            if (iterations++ >= MAX_PARSING_ITERATIONS) {
                throw error("Maximum parsing iterations reached", pos);
            }
            Token token = scanToken(pos);
            tokens.add(token);
            pos = token.position() + token.text().length();
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    /**
     * Classify and bound the token starting at {@code start}.
     * The token ends at {@code start + token.text().length()}.
     *
     * @param start Offset of the token's leading character
     * @return Token beginning at the offset
     */
    public Token scanToken(int start) {
        char c = input.charAt(start);

        if (c == MODEL_PREFIX || c == STATE_PREFIX) {
            return readDataAccess(start);
        }
        if (c == STRING_SYMBOL) {
            return readString(start);
        }
        if (isDigit(c)) {
            return readNumber(start);
        }
        if (functions.matchesPrefix(input.substring(start))) {
            return readFunctionOrStatement(start);
        }
        if (OPERATOR_START.contains(c)) {
            return readOperator(start);
        }
        throw error("Unexpected character '" + c + "'", start);
    }

    private Token readDataAccess(int start) {
        int end = start + 1;
        while (end < length && (isWordChar(input.charAt(end)) || input.charAt(end) == KEY_SEPARATOR)) {
            end++;
        }

        String text = input.substring(start, end);
        TokenType type = input.charAt(start) == MODEL_PREFIX ? TokenType.MODEL_REF : TokenType.STATE_REF;
        return new Token(type, text, text.substring(1), start);
    }

    private Token readString(int start) {
        int close = input.indexOf(STRING_SYMBOL, start + 1);
        if (close == -1) {
            throw error("Unterminated string", start);
        }

        String text = input.substring(start, close + 1);
        String content = text.substring(1, text.length() - 1);
        if (content.indexOf(FORBIDDEN_STRING_CHAR) != -1) {
            throw error("String must not contain '" + FORBIDDEN_STRING_CHAR + "'", start);
        }
        return new Token(TokenType.STRING, text, content, start);
    }

    private Token readNumber(int start) {
        int end = start;
        while (end < length && (isDigit(input.charAt(end)) || input.charAt(end) == KEY_SEPARATOR)) {
            end++;
        }

        String text = input.substring(start, end);
        if (!NUMBER.matcher(text).matches()) {
            throw error("Invalid number '" + text + "'", start);
        }
        return new Token(TokenType.NUMBER, text, Double.parseDouble(text), start);
    }

    private Token readFunctionOrStatement(int start) {
        int nameEnd = start + DslStrings.wordLength(input, start);
        String name = input.substring(start, nameEnd);

        // No bracket directly after the name, so this is a statement
        if (nameEnd >= length || input.charAt(nameEnd) != BRACKET_OPEN) {
            return new Token(TokenType.STATEMENT, name, name, start);
        }

        int close = DslStrings.closingBracketIndex(input, nameEnd);
        if (close == -1) {
            throw error("Unterminated function call '" + name + "'", nameEnd);
        }
        return new Token(TokenType.FUNCTION_CALL, input.substring(start, close + 1), name, start);
    }

    private Token readOperator(int start) {
        char c = input.charAt(start);
        char next = start + 1 < length ? input.charAt(start + 1) : '\0';

        String text = switch (c) {
            case '<', '>' -> next == '=' ? c + "=" : String.valueOf(c);
            case '=', '!' -> {
                if (next != '=') {
                    throw error("Unexpected '" + c + "', expected '" + c + "='", start);
                }
                yield c + "=";
            }
            case '&', '|' -> {
                if (next != c) {
                    throw error("Unexpected '" + c + "', expected '" + c + c + "'", start);
                }
                yield "" + c + c;
            }
            default -> String.valueOf(c);
        };

        return new Token(OPERATORS.get(text), text, null, start);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private DslSyntaxException error(String message, int position) {
        return new DslSyntaxException("Invalid expression at position "
                + position + ": " + message + " in '" + input + "'", position);
    }
}
