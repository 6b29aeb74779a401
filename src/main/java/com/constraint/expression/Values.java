package com.constraint.expression;

import com.constraint.variable.MissingValue;

import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Coercion and comparison rules for values flowing through an expression.
 * Numbers are handled as double; strings holding a number take part in numeric operations.
 */
public final class Values {

    private Values() {
    }

    /**
     * Booleans as is, numbers when non-zero and not NaN, strings when non-empty.
     * Null and missing values are false, any other object is true.
     */
    public static boolean isTruthy(Object value) {
        if (value == null || MissingValue.isMissing(value)) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    /**
     * Numeric value of a number or numeric string, NaN for anything else.
     */
    public static double toNumber(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    /**
     * Concatenate when either side is a string, otherwise add numerically.
     */
    public static Object add(Object left, Object right) {
        if (left instanceof String || right instanceof String) {
            return toText(left) + toText(right);
        }
        return toNumber(left) + toNumber(right);
    }

    /**
     * Equality as used by {@code ==}. The missing sentinel equals nothing.
     */
    public static boolean looseEquals(Object left, Object right) {
        if (MissingValue.isMissing(left) || MissingValue.isMissing(right)) {
            return false;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return a.doubleValue() == b.doubleValue();
        }
        // Handle number against numeric string
        if ((left instanceof Number && right instanceof String)
                || (left instanceof String && right instanceof Number)) {
            return toNumber(left) == toNumber(right);
        }
        return Objects.equals(left, right);
    }

    /**
     * Relational comparison. Two strings compare lexicographically, anything else numerically;
     * a side without a numeric value makes the comparison false.
     */
    public static boolean compare(Object left, Object right, IntPredicate outcome) {
        if (left instanceof String a && right instanceof String b) {
            return outcome.test(a.compareTo(b));
        }
        double a = toNumber(left);
        double b = toNumber(right);
        if (Double.isNaN(a) || Double.isNaN(b)) {
            return false;
        }
        return outcome.test(Double.compare(a, b));
    }

    /**
     * Textual form for messages and concatenation. Integral doubles drop the fraction.
     */
    public static String toText(Object value) {
        if (value instanceof Double d && !d.isInfinite() && d == Math.rint(d)
                && Math.abs(d) < 1e15) {
            return String.valueOf(d.longValue());
        }
        if (value instanceof Float f && !f.isInfinite() && f == Math.rint(f)
                && Math.abs(f) < 1e7) {
            return String.valueOf(f.longValue());
        }
        return String.valueOf(value);
    }
}
