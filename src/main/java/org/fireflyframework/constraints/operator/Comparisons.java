/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.constraints.operator;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Ordering of heterogeneous literal values.
 *
 * <p>Numbers compare by value whatever their boxed type, booleans compare with
 * booleans, text compares with text, and any other {@link Comparable} only with
 * an instance of the same class. Everything else, including {@code null} and
 * {@code NaN}, is incomparable.</p>
 */
public final class Comparisons {

    private Comparisons() {
    }

    /**
     * Compares two values.
     *
     * @param left  the left-hand value
     * @param right the right-hand value
     * @return the sign of {@code left - right}, or empty when the values cannot be ordered
     */
    @SuppressWarnings("unchecked")
    public static OptionalInt compare(Object left, Object right) {
        if (left == null || right == null) {
            return OptionalInt.empty();
        }
        ValueKind leftKind = ValueKind.of(left);
        ValueKind rightKind = ValueKind.of(right);
        if (leftKind != rightKind) {
            return OptionalInt.empty();
        }
        switch (leftKind) {
            case NUMBER:
                return compareNumbers((Number) left, (Number) right);
            case BOOLEAN:
                return OptionalInt.of(Boolean.compare((Boolean) left, (Boolean) right));
            case STRING:
                return OptionalInt.of(Integer.signum(left.toString().compareTo(right.toString())));
            default:
                if (left instanceof Comparable && left.getClass() == right.getClass()) {
                    return OptionalInt.of(Integer.signum(((Comparable<Object>) left).compareTo(right)));
                }
                return OptionalInt.empty();
        }
    }

    /**
     * Returns whether two literals denote the same value, treating numbers of
     * different boxed types as equal when their values are.
     */
    public static boolean sameLiteral(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return compare(left, right).orElse(1) == 0;
        }
        return Objects.equals(left, right);
    }

    /**
     * Applies an ordering operator to a comparison outcome.
     *
     * <p>An incomparable pair satisfies only {@link Operator#NE}.</p>
     */
    static boolean holds(Operator operator, OptionalInt comparison) {
        if (comparison.isEmpty()) {
            return operator == Operator.NE;
        }
        int cmp = comparison.getAsInt();
        return switch (operator) {
            case LT -> cmp < 0;
            case LE -> cmp <= 0;
            case EQ -> cmp == 0;
            case NE -> cmp != 0;
            case GE -> cmp >= 0;
            case GT -> cmp > 0;
            case MATCH, NOMATCH, BETWEEN, IN_SET, CONTAIN_SET, EQ_SET ->
                    throw new IllegalArgumentException(operator + " is not an ordering operator");
        };
    }

    private static OptionalInt compareNumbers(Number left, Number right) {
        if (isNaN(left) || isNaN(right)) {
            return OptionalInt.empty();
        }
        if (isIntegral(left) && isIntegral(right)) {
            return OptionalInt.of(Long.compare(left.longValue(), right.longValue()));
        }
        return OptionalInt.of(toBigDecimal(left).compareTo(toBigDecimal(right)));
    }

    private static boolean isNaN(Number value) {
        return (value instanceof Double || value instanceof Float) && Double.isNaN(value.doubleValue());
    }

    private static boolean isIntegral(Number value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    private static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (isIntegral(value)) {
            return BigDecimal.valueOf(value.longValue());
        }
        double d = value.doubleValue();
        if (Double.isInfinite(d)) {
            // stand-ins that order correctly against any finite value
            return d > 0 ? BigDecimal.valueOf(Double.MAX_VALUE).multiply(BigDecimal.TEN)
                    : BigDecimal.valueOf(-Double.MAX_VALUE).multiply(BigDecimal.TEN);
        }
        return new BigDecimal(d);
    }
}
