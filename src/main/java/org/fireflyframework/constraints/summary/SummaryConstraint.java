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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.constraints.ConstraintReport;
import org.fireflyframework.constraints.codec.ProtoValues;
import org.fireflyframework.constraints.exception.ConstraintConfigurationException;
import org.fireflyframework.constraints.exception.ConstraintFormatException;
import org.fireflyframework.constraints.exception.IncompatibleMergeException;
import org.fireflyframework.constraints.operator.Comparisons;
import org.fireflyframework.constraints.operator.Operator;
import org.fireflyframework.constraints.operator.OperatorTable;
import org.fireflyframework.constraints.operator.ValueKind;
import org.fireflyframework.constraints.proto.SummaryBetweenConstraintMsg;
import org.fireflyframework.constraints.proto.SummaryConstraintMsg;
import org.fireflyframework.constraints.sketch.DistinctValueSketch;

import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * Constraint on the aggregate statistics of a column, or on the set of its
 * observed distinct values.
 *
 * <p>The constraint always names the summary field under test
 * ({@code firstField}) and takes exactly one {@link SummaryOperand}:</p>
 * <pre>
 *   'min' GE 0                       LiteralCompare
 *   'min' LT 'mean'                  FieldCompare
 *   'stddev' BETWEEN 0.5 and 2.0     BetweenLiterals
 *   'mean' BETWEEN 'min' and 'max'   BetweenFields
 *   distinct values IN_SET {a, b}    SetRelation
 * </pre>
 *
 * <p>Constraints are usually assembled with {@link #builder()}, which accepts
 * the operands as loose optional values and rejects every combination that
 * does not resolve to exactly one shape:</p>
 * <pre>{@code
 * SummaryConstraint minNotNegative = SummaryConstraint.builder()
 *         .firstField("min")
 *         .operator(Operator.GE)
 *         .value(0)
 *         .build();
 * }</pre>
 *
 * <p>Instances are single-writer: one pipeline worker calls {@link #update}
 * and results from several workers are combined with {@link #merge}.</p>
 */
@Slf4j
public class SummaryConstraint {

    private final String explicitName;
    @Getter
    private final String firstField;
    @Getter
    private final Operator operator;
    @Getter
    private final SummaryOperand operand;
    @Getter
    private final boolean verbose;

    private final Predicate<SummaryBundle> check;

    @Getter
    private long total;
    @Getter
    private long failures;

    /**
     * Creates a summary constraint from an already resolved operand shape.
     *
     * @param firstField the summary field under test
     * @param operator   the comparison to apply
     * @param operand    the right-hand side
     * @param name       the report name, or {@code null} to generate one
     * @param verbose    whether to log every failed evaluation
     * @throws ConstraintConfigurationException if the operator does not apply to the operand shape
     */
    public SummaryConstraint(String firstField, Operator operator, SummaryOperand operand, String name, boolean verbose) {
        if (firstField == null || firstField.isEmpty()) {
            throw new ConstraintConfigurationException("Summary constraint must specify the summary field to test");
        }
        if (operator == null) {
            throw new ConstraintConfigurationException("Summary constraint must specify an operator");
        }
        if (operand == null) {
            throw new ConstraintConfigurationException("Summary constraint must specify a second value or field name");
        }
        this.firstField = firstField;
        this.operator = operator;
        this.operand = operand;
        this.explicitName = name;
        this.verbose = verbose;
        this.check = bind(firstField, operator, operand);
    }

    public SummaryConstraint(String firstField, Operator operator, SummaryOperand operand) {
        this(firstField, operator, operand, null, false);
    }

    /**
     * Resolves loose operands into a constraint.
     *
     * <ul>
     *   <li>set operators take only {@code referenceSet}</li>
     *   <li>{@link Operator#BETWEEN} takes numeric {@code value} and {@code upperValue},
     *       or {@code secondField} and {@code thirdField}</li>
     *   <li>every other operator takes {@code value} or {@code secondField}</li>
     * </ul>
     */
    @lombok.Builder(builderClassName = "Builder")
    private static SummaryConstraint define(String firstField, Operator operator, Object value, Object upperValue,
                                            String secondField, String thirdField, Object referenceSet,
                                            String name, boolean verbose) {
        if (operator == null) {
            throw new ConstraintConfigurationException("Summary constraint must specify an operator");
        }
        return new SummaryConstraint(firstField, operator,
                resolveOperand(operator, value, upperValue, secondField, thirdField, referenceSet), name, verbose);
    }

    private static SummaryOperand resolveOperand(Operator operator, Object value, Object upperValue,
                                                 String secondField, String thirdField, Object referenceSet) {
        if (operator.isSetRelation()) {
            if (value != null || upperValue != null || secondField != null || thirdField != null) {
                throw new ConstraintConfigurationException(
                        "When using set operations only set should be provided and not values or field names!");
            }
            return new SummaryOperand.SetRelation(ReferenceSet.coerce(referenceSet));
        }
        if (referenceSet != null) {
            throw new ConstraintConfigurationException(
                    "Reference set can only be provided with IN_SET, CONTAIN_SET or EQ_SET, not " + operator);
        }
        if (operator == Operator.BETWEEN) {
            if (value != null && upperValue != null && secondField == null && thirdField == null) {
                if (ValueKind.of(value) != ValueKind.NUMBER || ValueKind.of(upperValue) != ValueKind.NUMBER) {
                    throw new ConstraintConfigurationException(
                            "When creating Summary constraint with BETWEEN operation, upper and lower value must be numeric");
                }
                return new SummaryOperand.BetweenLiterals(
                        ((Number) value).doubleValue(), ((Number) upperValue).doubleValue());
            }
            if (secondField != null && thirdField != null && value == null && upperValue == null) {
                return new SummaryOperand.BetweenFields(secondField, thirdField);
            }
            throw new ConstraintConfigurationException("Summary constraint with BETWEEN operation must specify "
                    + "lower and upper value OR lower and upper field name, but not both");
        }
        if (upperValue != null || thirdField != null) {
            throw new ConstraintConfigurationException(
                    "Summary constraint with other than BETWEEN operation must NOT specify upper value NOR third field name");
        }
        if (value != null && secondField == null) {
            return new SummaryOperand.LiteralCompare(value);
        }
        if (secondField != null && value == null) {
            return new SummaryOperand.FieldCompare(secondField);
        }
        throw new ConstraintConfigurationException(
                "Summary constraint must specify a second value or field name, but not both");
    }

    private static Predicate<SummaryBundle> bind(String firstField, Operator operator, SummaryOperand operand) {
        if (operator.isPattern()) {
            throw new ConstraintConfigurationException("Operator " + operator + " cannot be applied to a summary field");
        }
        boolean between = operator == Operator.BETWEEN;
        boolean setRelation = operator.isSetRelation();
        switch (operand.kind()) {
            case LITERAL_COMPARE: {
                requireOperator(!between && !setRelation, operator, operand);
                Object literal = ((SummaryOperand.LiteralCompare) operand).value();
                if (ValueKind.of(literal) == ValueKind.OTHER) {
                    throw new ConstraintConfigurationException("Summary constraint literal must be text, a number or a boolean, "
                            + "instead type: '" + literal.getClass().getSimpleName() + "' was provided!");
                }
                Predicate<NumberSummary> predicate = OperatorTable.summaryLiteral(operator, firstField, literal);
                return onSummary(predicate);
            }
            case FIELD_COMPARE: {
                requireOperator(!between && !setRelation, operator, operand);
                Predicate<NumberSummary> predicate = OperatorTable.summaryField(
                        operator, firstField, ((SummaryOperand.FieldCompare) operand).secondField());
                return onSummary(predicate);
            }
            case BETWEEN_LITERALS: {
                requireOperator(between, operator, operand);
                SummaryOperand.BetweenLiterals range = (SummaryOperand.BetweenLiterals) operand;
                return onSummary(OperatorTable.summaryLiteralRange(firstField, range.lower(), range.upper()));
            }
            case BETWEEN_FIELDS: {
                requireOperator(between, operator, operand);
                SummaryOperand.BetweenFields range = (SummaryOperand.BetweenFields) operand;
                return onSummary(OperatorTable.summaryFieldRange(firstField, range.lowerField(), range.upperField()));
            }
            case SET_RELATION: {
                requireOperator(setRelation, operator, operand);
                ReferenceSet reference = ((SummaryOperand.SetRelation) operand).referenceSet();
                BiPredicate<DistinctValueSketch, DistinctValueSketch> relation = OperatorTable.setRelation(operator);
                return bundle -> bundle != null
                        && relation.test(reference.getStringSketch(), bundle.stringSketchOrEmpty())
                        && relation.test(reference.getNumberSketch(), bundle.numberSketchOrEmpty());
            }
            default:
                throw new IllegalStateException("Unhandled operand kind " + operand.kind());
        }
    }

    private static Predicate<SummaryBundle> onSummary(Predicate<NumberSummary> predicate) {
        return bundle -> bundle != null && bundle.getNumberSummary() != null
                && predicate.test(bundle.getNumberSummary());
    }

    private static void requireOperator(boolean applicable, Operator operator, SummaryOperand operand) {
        if (!applicable) {
            throw new ConstraintConfigurationException(
                    "Operator " + operator + " cannot be applied to a " + operand.kind() + " operand");
        }
    }

    /**
     * Returns the report name: the explicit name when one was given, otherwise
     * a rendering of the field, operator and operand.
     */
    public String getName() {
        if (explicitName != null) {
            return explicitName;
        }
        return "summary " + firstField + " " + operator + " " + operand.render();
    }

    /**
     * Evaluates the constraint against one window of column statistics.
     * A failed check, including a missing summary field, is counted and never thrown.
     *
     * @param bundle the column summary and observed-value sketches
     */
    public void update(SummaryBundle bundle) {
        total++;
        if (!check.test(bundle)) {
            failures++;
            if (verbose) {
                log.info("summary constraint {} failed", getName());
            }
        }
    }

    /**
     * Combines the counters of two constraints describing the same check.
     *
     * @param other the constraint to merge in, may be {@code null}
     * @return a new constraint with summed counters, or this constraint when {@code other} is {@code null}
     * @throws IncompatibleMergeException if name, operator, fields or operands differ
     */
    public SummaryConstraint merge(SummaryConstraint other) {
        if (other == null) {
            return this;
        }
        requireSame("names", getName(), other.getName());
        requireSame("ops", operator, other.operator);
        requireSame("first_field", firstField, other.firstField);
        requireSame("operand shapes", operand.kind(), other.operand.kind());
        switch (operand.kind()) {
            case LITERAL_COMPARE -> {
                Object left = ((SummaryOperand.LiteralCompare) operand).value();
                Object right = ((SummaryOperand.LiteralCompare) other.operand).value();
                if (!Comparisons.sameLiteral(left, right)) {
                    throw IncompatibleMergeException.mismatch("values", left, right);
                }
            }
            case FIELD_COMPARE -> requireSame("second_field",
                    ((SummaryOperand.FieldCompare) operand).secondField(),
                    ((SummaryOperand.FieldCompare) other.operand).secondField());
            case BETWEEN_LITERALS -> {
                SummaryOperand.BetweenLiterals left = (SummaryOperand.BetweenLiterals) operand;
                SummaryOperand.BetweenLiterals right = (SummaryOperand.BetweenLiterals) other.operand;
                requireSame("values", left.lower(), right.lower());
                requireSame("upper values", left.upper(), right.upper());
            }
            case BETWEEN_FIELDS -> {
                SummaryOperand.BetweenFields left = (SummaryOperand.BetweenFields) operand;
                SummaryOperand.BetweenFields right = (SummaryOperand.BetweenFields) other.operand;
                requireSame("second_field", left.lowerField(), right.lowerField());
                requireSame("third_field", left.upperField(), right.upperField());
            }
            case SET_RELATION -> requireSame("reference sets",
                    ((SummaryOperand.SetRelation) operand).referenceSet(),
                    ((SummaryOperand.SetRelation) other.operand).referenceSet());
        }

        SummaryConstraint merged = new SummaryConstraint(firstField, operator, operand, getName(), verbose);
        merged.total = total + other.total;
        merged.failures = failures + other.failures;
        return merged;
    }

    private static void requireSame(String field, Object left, Object right) {
        if (!Objects.equals(left, right)) {
            throw IncompatibleMergeException.mismatch(field, left, right);
        }
    }

    public ConstraintReport report() {
        return ConstraintReport.of(getName(), total, failures);
    }

    public SummaryConstraintMsg toProtobuf() {
        SummaryConstraintMsg.Builder msg = SummaryConstraintMsg.newBuilder()
                .setName(getName())
                .setFirstField(firstField)
                .setOp(operator.toProto())
                .setVerbose(verbose)
                .setTotal(total)
                .setFailures(failures);
        switch (operand.kind()) {
            case LITERAL_COMPARE -> msg.setValue(ProtoValues.toValue(((SummaryOperand.LiteralCompare) operand).value()));
            case FIELD_COMPARE -> msg.setSecondField(((SummaryOperand.FieldCompare) operand).secondField());
            case BETWEEN_LITERALS -> {
                SummaryOperand.BetweenLiterals range = (SummaryOperand.BetweenLiterals) operand;
                msg.setBetween(SummaryBetweenConstraintMsg.newBuilder()
                        .setLowerValue(range.lower())
                        .setUpperValue(range.upper()));
            }
            case BETWEEN_FIELDS -> {
                SummaryOperand.BetweenFields range = (SummaryOperand.BetweenFields) operand;
                msg.setBetween(SummaryBetweenConstraintMsg.newBuilder()
                        .setSecondField(range.lowerField())
                        .setThirdField(range.upperField()));
            }
            case SET_RELATION -> msg.setReferenceSet(
                    ProtoValues.toListValue(((SummaryOperand.SetRelation) operand).referenceSet().getItems()));
        }
        return msg.build();
    }

    /**
     * Rebuilds a constraint, counters included, from its wire form.
     *
     * @param msg the message
     * @return the constraint
     * @throws ConstraintFormatException if zero or several operand variants are set, or the operator is unknown
     */
    public static SummaryConstraint fromProtobuf(SummaryConstraintMsg msg) {
        int variants = (msg.hasValue() ? 1 : 0) + (msg.hasSecondField() ? 1 : 0)
                + (msg.hasBetween() ? 1 : 0) + (msg.hasReferenceSet() ? 1 : 0);
        if (variants != 1) {
            throw new ConstraintFormatException("SummaryConstraintMsg must specify a value OR second field name "
                    + "OR SummaryBetweenConstraintMsg OR reference set, but only one of them");
        }

        SummaryOperand operand;
        if (msg.hasValue()) {
            operand = new SummaryOperand.LiteralCompare(ProtoValues.fromValue(msg.getValue()));
        } else if (msg.hasSecondField()) {
            operand = new SummaryOperand.FieldCompare(msg.getSecondField());
        } else if (msg.hasReferenceSet()) {
            operand = new SummaryOperand.SetRelation(
                    ReferenceSet.coerce(ProtoValues.fromListValue(msg.getReferenceSet())));
        } else {
            operand = fromBetween(msg.getBetween());
        }

        String name = msg.getName().isEmpty() ? null : msg.getName();
        SummaryConstraint constraint = new SummaryConstraint(
                msg.getFirstField(), Operator.fromProto(msg.getOp()), operand, name, msg.getVerbose());
        constraint.total = msg.getTotal();
        constraint.failures = msg.getFailures();
        return constraint;
    }

    private static SummaryOperand fromBetween(SummaryBetweenConstraintMsg between) {
        if (between.hasLowerValue() && between.hasUpperValue()
                && !between.hasSecondField() && !between.hasThirdField()) {
            return new SummaryOperand.BetweenLiterals(between.getLowerValue(), between.getUpperValue());
        }
        if (between.hasSecondField() && between.hasThirdField()
                && !between.hasLowerValue() && !between.hasUpperValue()) {
            return new SummaryOperand.BetweenFields(between.getSecondField(), between.getThirdField());
        }
        throw new ConstraintFormatException("SummaryBetweenConstraintMsg must specify lower and upper value "
                + "OR second and third field name, but only one pair");
    }

    @Override
    public String toString() {
        return getName();
    }
}
