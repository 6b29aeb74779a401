package com.constraint.message;

import com.constraint.config.expression.DslStrings;
import com.constraint.config.expression.TokenType;
import com.constraint.exception.DslSyntaxException;
import com.constraint.function.FunctionRegistry;

import java.util.ArrayList;
import java.util.List;

import static com.constraint.config.expression.DslSymbols.*;

/**
 * Extracts references from free-text message templates.
 * <p>
 * Words are delimited by whitespace, except whitespace inside a function call's argument
 * list, so {@code fmt($a, 'b c')} stays one word. Each word is then trimmed to the reference
 * it holds:
 * <ul>
 *   <li>statement: its leading word characters ({@code isVip,} becomes {@code isVip})</li>
 *   <li>function call: up to and including the matching closing bracket</li>
 *   <li>data access: the contiguous path from the {@code $} or {@code #} prefix
 *       ({@code ($order.total).} becomes {@code $order.total})</li>
 * </ul>
 * Words holding no reference are skipped.
 */
public class MessageTokenizer {

    private final FunctionRegistry functions;

    public MessageTokenizer(FunctionRegistry functions) {
        this.functions = functions;
    }

    /**
     * Tokenize a message template.
     *
     * @param template Message template
     * @return References in template order
     * @throws DslSyntaxException if a function call in the template is never closed
     */
    public List<MessageToken> tokenize(String template) {
        List<MessageToken> tokens = new ArrayList<>();
        int length = template.length();
        int i = 0;

        while (i < length) {
            if (isBoundary(template, i)) {
                i++;
                continue;
            }
            int start = i;
            while (i < length && !isBoundary(template, i)) {
                i++;
            }
            MessageToken token = trim(template.substring(start, i), start);
            if (token != null) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private boolean isBoundary(String template, int index) {
        return Character.isWhitespace(template.charAt(index))
                && !DslStrings.isCharWithinFunction(template, index);
    }

    private MessageToken trim(String word, int start) {
        if (functions.matchesPrefix(word)) {
            int nameLength = DslStrings.wordLength(word, 0);
            if (nameLength == word.length() || word.charAt(nameLength) != BRACKET_OPEN) {
                return new MessageToken(TokenType.STATEMENT, word.substring(0, nameLength), start);
            }
            int close = DslStrings.closingBracketIndex(word, nameLength);
            if (close == -1) {
                throw new DslSyntaxException("Unterminated function call at position " + (start + nameLength)
                        + " in message '" + word + "'", start + nameLength);
            }
            return new MessageToken(TokenType.FUNCTION_CALL, word.substring(0, close + 1), start);
        }

        int model = word.indexOf(MODEL_PREFIX);
        if (model != -1) {
            return dataReference(TokenType.MODEL_REF, word, model, start);
        }
        int state = word.indexOf(STATE_PREFIX);
        if (state != -1) {
            return dataReference(TokenType.STATE_REF, word, state, start);
        }
        return null;
    }

    private MessageToken dataReference(TokenType type, String word, int prefix, int start) {
        int end = prefix + 1;
        while (end < word.length() && (isWordChar(word.charAt(end)) || word.charAt(end) == KEY_SEPARATOR)) {
            end++;
        }
        // A sentence may end right after the reference
        while (end > prefix + 1 && word.charAt(end - 1) == KEY_SEPARATOR) {
            end--;
        }
        return new MessageToken(type, word.substring(prefix, end), start + prefix);
    }
}
