package com.constraint.config.expression;

import com.constraint.exception.DslSyntaxException;

import java.util.ArrayList;
import java.util.List;

import static com.constraint.config.expression.DslSymbols.*;

/**
 * Positional helpers over raw DSL text shared by the tokenizers and the constraint compiler.
 * <p>
 * Bracket matching skips over quoted string literals, so brackets and commas inside
 * {@code 'text'} never count as structure.
 */
public final class DslStrings {

    private DslStrings() {
    }

    /**
     * Check whether the character at {@code index} lies inside a string literal.
     * "some 'cust<o>m' message" is inside, "some 'custom' m<e>ssage" is not.
     * The first and last characters and the delimiters themselves are never inside.
     * Delimiters are counted from the start, so an unterminated literal only captures
     * what follows it.
     *
     * @param src   Source text
     * @param index Character index
     * @return true if an odd number of delimiters precede the index
     */
    public static boolean isCharWithinString(String src, int index) {
        if (index <= 0 || index >= src.length() - 1 || src.charAt(index) == STRING_SYMBOL) {
            return false;
        }
        int delimiters = 0;
        for (int i = 0; i < index; i++) {
            if (src.charAt(i) == STRING_SYMBOL) {
                delimiters++;
            }
        }
        return delimiters % 2 == 1;
    }

    /**
     * Check whether the character at {@code index} lies inside the argument list of a
     * function call, i.e. between a bracket pair whose opening bracket directly follows
     * a word character. "SOME_FUNCTION(a, t<e>st)" is inside, "SOME_FUNCTI<O>N(a, test)" is not.
     * Brackets are matched by depth alone, so an apostrophe in free text such as
     * "Limit(customer's cap)" does not hide the closing bracket.
     *
     * @param src   Source text
     * @param index Character index
     * @return true if the index is enclosed by a function call's brackets
     * @throws DslSyntaxException if a function call's bracket is never closed
     */
    public static boolean isCharWithinFunction(String src, int index) {
        if (index <= 0 || index >= src.length() - 1) {
            return false;
        }
        char c = src.charAt(index);
        if (c == BRACKET_OPEN || c == BRACKET_CLOSE) {
            return false;
        }

        for (int open = 1; open < index; open++) {
            if (src.charAt(open) != BRACKET_OPEN || !isWordChar(src.charAt(open - 1))) {
                continue;
            }
            int close = closingBracketIndex(src, open, false);
            if (close == -1) {
                throw new DslSyntaxException("Unterminated function call at position " + open
                        + " in '" + src + "'", open);
            }
            if (index > open && index < close) {
                return true;
            }
        }
        return false;
    }

    /**
     * Find the bracket closing the one at {@code openIndex}, counting nested pairs.
     *
     * @param src       Source text
     * @param openIndex Index of an opening bracket
     * @return Index of the matching closing bracket, or -1 if depth never returns to zero
     */
    public static int closingBracketIndex(String src, int openIndex) {
        return closingBracketIndex(src, openIndex, true);
    }

    /**
     * Find the bracket closing the one at {@code openIndex}.
     *
     * @param src         Source text
     * @param openIndex   Index of an opening bracket
     * @param skipStrings Whether brackets inside string literals are ignored
     * @return Index of the matching closing bracket, or -1 if depth never returns to zero
     */
    public static int closingBracketIndex(String src, int openIndex, boolean skipStrings) {
        int depth = 0;
        boolean inString = false;
        for (int i = openIndex; i < src.length(); i++) {
            char c = src.charAt(i);
            if (skipStrings && c == STRING_SYMBOL) {
                inString = !inString;
            } else if (inString) {
                continue;
            } else if (c == BRACKET_OPEN) {
                depth++;
            } else if (c == BRACKET_CLOSE) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * For text of the form {@code abcdef(this, is (a) test)} return the part inside the
     * outermost brackets, here {@code this, is (a) test}.
     *
     * @param src Source text
     * @return Content between the first opening bracket and its match
     * @throws DslSyntaxException if there is no opening bracket or it is never closed
     */
    public static String substringWithinParentheses(String src) {
        int open = src.indexOf(BRACKET_OPEN);
        if (open == -1) {
            throw new DslSyntaxException("Expected '" + BRACKET_OPEN + "' in '" + src + "'");
        }
        int close = closingBracketIndex(src, open);
        if (close == -1) {
            throw new DslSyntaxException("Unmatched '" + BRACKET_OPEN + "' at position " + open
                    + " in '" + src + "'", open);
        }
        return src.substring(open + 1, close);
    }

    /**
     * Split a function's argument text on top-level commas. Commas inside nested brackets
     * or string literals do not split. Each argument is trimmed.
     *
     * @param args Raw argument text (without the enclosing brackets)
     * @return Arguments in order; empty if the text is blank
     * @throws DslSyntaxException if an argument is empty
     */
    public static List<String> splitArguments(String args) {
        List<String> result = new ArrayList<>();
        if (args.isBlank()) {
            return result;
        }

        int depth = 0;
        int start = 0;
        boolean inString = false;
        for (int i = 0; i < args.length(); i++) {
            char c = args.charAt(i);
            if (c == STRING_SYMBOL) {
                inString = !inString;
            } else if (inString) {
                continue;
            } else if (c == BRACKET_OPEN) {
                depth++;
            } else if (c == BRACKET_CLOSE) {
                depth--;
            } else if (c == ARG_SEPARATOR && depth == 0) {
                result.add(argument(args, start, i));
                start = i + 1;
            }
        }
        result.add(argument(args, start, args.length()));
        return result;
    }

    /**
     * Remove all whitespace outside string literals.
     */
    public static String stripWhitespace(String src) {
        StringBuilder sb = new StringBuilder(src.length());
        boolean inString = false;
        for (int i = 0; i < src.length(); i++) {
            char c = src.charAt(i);
            if (c == STRING_SYMBOL) {
                inString = !inString;
            }
            if (inString || !Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Length of the run of word characters starting at {@code start}.
     */
    public static int wordLength(String src, int start) {
        int i = start;
        while (i < src.length() && isWordChar(src.charAt(i))) {
            i++;
        }
        return i - start;
    }

    private static String argument(String args, int start, int end) {
        String arg = args.substring(start, end).trim();
        if (arg.isEmpty()) {
            throw new DslSyntaxException("Empty function argument at position " + start
                    + " in '" + args + "'", start);
        }
        return arg;
    }
}
