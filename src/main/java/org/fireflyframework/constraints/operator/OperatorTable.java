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

import org.fireflyframework.constraints.exception.ConstraintConfigurationException;
import org.fireflyframework.constraints.sketch.DistinctValueSketch;
import org.fireflyframework.constraints.summary.NumberSummary;

import java.util.function.BiPredicate;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Binds an {@link Operator} and its operands into an executable check.
 *
 * <p>There is one flavour per kind of constraint: a streamed value against a
 * literal or pattern, a summary field against a literal or literal range, a
 * summary field against other summary fields, and a reference sketch against
 * an observed sketch. Checks are bound once when a constraint is built and
 * reused for every evaluation.</p>
 */
public final class OperatorTable {

    private OperatorTable() {
    }

    /**
     * Streamed value compared to a literal: {@code value <op> literal}.
     */
    public static Predicate<Object> valueLiteral(Operator operator, Object literal) {
        return switch (operator) {
            case LT, LE, EQ, NE, GE, GT -> value -> Comparisons.holds(operator, Comparisons.compare(value, literal));
            case MATCH, NOMATCH, BETWEEN, IN_SET, CONTAIN_SET, EQ_SET -> throw notApplicable(operator, "a literal value");
        };
    }

    /**
     * Streamed text matched against a pattern. The match is anchored at the
     * start of the text only. Callers must only pass text.
     */
    public static Predicate<Object> valuePattern(Operator operator, Pattern pattern) {
        return switch (operator) {
            case MATCH -> value -> pattern.matcher((CharSequence) value).lookingAt();
            case NOMATCH -> value -> !pattern.matcher((CharSequence) value).lookingAt();
            case LT, LE, EQ, NE, GE, GT, BETWEEN, IN_SET, CONTAIN_SET, EQ_SET ->
                    throw notApplicable(operator, "a regex pattern");
        };
    }

    /**
     * Summary field compared to a literal: {@code summary[field] <op> literal}.
     */
    public static Predicate<NumberSummary> summaryLiteral(Operator operator, String field, Object literal) {
        return switch (operator) {
            case LT, LE, EQ, NE, GE, GT -> summary -> {
                Number actual = summary.getField(field);
                return actual != null && Comparisons.holds(operator, Comparisons.compare(actual, literal));
            };
            case MATCH, NOMATCH, BETWEEN, IN_SET, CONTAIN_SET, EQ_SET -> throw notApplicable(operator, "a literal value");
        };
    }

    /**
     * Summary field within an inclusive literal range: {@code lower <= summary[field] <= upper}.
     */
    public static Predicate<NumberSummary> summaryLiteralRange(String field, double lower, double upper) {
        return summary -> {
            Number actual = summary.getField(field);
            return actual != null && within(actual, lower, upper);
        };
    }

    /**
     * Summary field compared to another summary field: {@code summary[field] <op> summary[other]}.
     */
    public static Predicate<NumberSummary> summaryField(Operator operator, String field, String otherField) {
        return switch (operator) {
            case LT, LE, EQ, NE, GE, GT -> summary -> {
                Number actual = summary.getField(field);
                Number other = summary.getField(otherField);
                return actual != null && other != null
                        && Comparisons.holds(operator, Comparisons.compare(actual, other));
            };
            case MATCH, NOMATCH, BETWEEN, IN_SET, CONTAIN_SET, EQ_SET -> throw notApplicable(operator, "a second field");
        };
    }

    /**
     * Summary field within an inclusive range bounded by two other fields:
     * {@code summary[lowerField] <= summary[field] <= summary[upperField]}.
     */
    public static Predicate<NumberSummary> summaryFieldRange(String field, String lowerField, String upperField) {
        return summary -> {
            Number actual = summary.getField(field);
            Number lower = summary.getField(lowerField);
            Number upper = summary.getField(upperField);
            return actual != null && lower != null && upper != null && within(actual, lower, upper);
        };
    }

    /**
     * Set relation between a reference sketch (first argument) and an observed
     * sketch (second argument). A difference counts as empty when its estimate
     * rounds to zero at one decimal place.
     *
     * <ul>
     *   <li>{@link Operator#IN_SET}: observed minus reference is empty</li>
     *   <li>{@link Operator#CONTAIN_SET}: reference minus observed is empty</li>
     *   <li>{@link Operator#EQ_SET}: both differences are empty</li>
     * </ul>
     */
    public static BiPredicate<DistinctValueSketch, DistinctValueSketch> setRelation(Operator operator) {
        return switch (operator) {
            case IN_SET -> (reference, observed) -> isEmptyDifference(observed, reference);
            case CONTAIN_SET -> (reference, observed) -> isEmptyDifference(reference, observed);
            case EQ_SET -> (reference, observed) -> isEmptyDifference(observed, reference)
                    && isEmptyDifference(reference, observed);
            case LT, LE, EQ, NE, GE, GT, MATCH, NOMATCH, BETWEEN -> throw notApplicable(operator, "a reference set");
        };
    }

    static boolean isEmptyDifference(DistinctValueSketch a, DistinctValueSketch b) {
        double estimate = DistinctValueSketch.estimateDifference(a, b);
        return Math.round(estimate * 10.0) / 10.0 == 0.0;
    }

    private static boolean within(Number actual, Object lower, Object upper) {
        return Comparisons.holds(Operator.GE, Comparisons.compare(actual, lower))
                && Comparisons.holds(Operator.LE, Comparisons.compare(actual, upper));
    }

    private static ConstraintConfigurationException notApplicable(Operator operator, String operand) {
        return new ConstraintConfigurationException("Operator " + operator + " cannot be applied to " + operand);
    }
}
