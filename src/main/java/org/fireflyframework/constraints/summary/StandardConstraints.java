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

package org.fireflyframework.constraints.summary;

import org.fireflyframework.constraints.operator.Operator;

/**
 * Factories for the summary constraints pipelines declare most often.
 *
 * <p>Range factories come in a literal flavour ({@code stddevBetween(0.5, 2.0)})
 * and a field flavour ({@code meanBetweenFields("min", "max")}).</p>
 */
public final class StandardConstraints {

    public static final String DISTINCT_VALUES_FIELD = "distinct_column_values";

    private StandardConstraints() {
    }

    public static SummaryConstraint stddevBetween(double lowerValue, double upperValue) {
        return between("stddev", new SummaryOperand.BetweenLiterals(lowerValue, upperValue));
    }

    public static SummaryConstraint stddevBetweenFields(String lowerField, String upperField) {
        return between("stddev", new SummaryOperand.BetweenFields(lowerField, upperField));
    }

    public static SummaryConstraint meanBetween(double lowerValue, double upperValue) {
        return between("mean", new SummaryOperand.BetweenLiterals(lowerValue, upperValue));
    }

    public static SummaryConstraint meanBetweenFields(String lowerField, String upperField) {
        return between("mean", new SummaryOperand.BetweenFields(lowerField, upperField));
    }

    public static SummaryConstraint minBetween(double lowerValue, double upperValue) {
        return between("min", new SummaryOperand.BetweenLiterals(lowerValue, upperValue));
    }

    public static SummaryConstraint minBetweenFields(String lowerField, String upperField) {
        return between("min", new SummaryOperand.BetweenFields(lowerField, upperField));
    }

    public static SummaryConstraint maxBetween(double lowerValue, double upperValue) {
        return between("max", new SummaryOperand.BetweenLiterals(lowerValue, upperValue));
    }

    public static SummaryConstraint maxBetweenFields(String lowerField, String upperField) {
        return between("max", new SummaryOperand.BetweenFields(lowerField, upperField));
    }

    public static SummaryConstraint minGreaterThanEqual(Number value) {
        return new SummaryConstraint("min", Operator.GE, new SummaryOperand.LiteralCompare(value));
    }

    public static SummaryConstraint minGreaterThanEqualField(String field) {
        return new SummaryConstraint("min", Operator.GE, new SummaryOperand.FieldCompare(field));
    }

    public static SummaryConstraint maxLessThanEqual(Number value) {
        return new SummaryConstraint("max", Operator.LE, new SummaryOperand.LiteralCompare(value));
    }

    public static SummaryConstraint maxLessThanEqualField(String field) {
        return new SummaryConstraint("max", Operator.LE, new SummaryOperand.FieldCompare(field));
    }

    /**
     * Every observed distinct value must belong to {@code referenceSet}.
     */
    public static SummaryConstraint distinctValuesInSet(Object referenceSet) {
        return distinctValuesInSet(referenceSet, null, false);
    }

    public static SummaryConstraint distinctValuesInSet(Object referenceSet, String name, boolean verbose) {
        return setRelation(Operator.IN_SET, referenceSet, name, verbose);
    }

    /**
     * The observed distinct values must be exactly {@code referenceSet}.
     */
    public static SummaryConstraint distinctValuesEqualSet(Object referenceSet) {
        return distinctValuesEqualSet(referenceSet, null, false);
    }

    public static SummaryConstraint distinctValuesEqualSet(Object referenceSet, String name, boolean verbose) {
        return setRelation(Operator.EQ_SET, referenceSet, name, verbose);
    }

    /**
     * Every value of {@code referenceSet} must have been observed.
     */
    public static SummaryConstraint distinctValuesContainSet(Object referenceSet) {
        return distinctValuesContainSet(referenceSet, null, false);
    }

    public static SummaryConstraint distinctValuesContainSet(Object referenceSet, String name, boolean verbose) {
        return setRelation(Operator.CONTAIN_SET, referenceSet, name, verbose);
    }

    private static SummaryConstraint between(String field, SummaryOperand range) {
        return new SummaryConstraint(field, Operator.BETWEEN, range);
    }

    private static SummaryConstraint setRelation(Operator operator, Object referenceSet, String name, boolean verbose) {
        return new SummaryConstraint(DISTINCT_VALUES_FIELD, operator,
                new SummaryOperand.SetRelation(ReferenceSet.coerce(referenceSet)), name, verbose);
    }
}
