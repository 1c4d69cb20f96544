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

package org.fireflyframework.constraints.value;

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
import org.fireflyframework.constraints.proto.ValueConstraintMsg;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Constraint evaluated against every streamed value of a column.
 *
 * <p>The constraint compares each value either to a literal with an ordering
 * operator ({@code value GT 0}) or to a regular expression with
 * {@link Operator#MATCH}/{@link Operator#NOMATCH}. Exactly one of the two is
 * given. A value that fails, including a non-text value under a pattern
 * operator, is counted in {@code failures} and never raised.</p>
 *
 * <pre>{@code
 * ValueConstraint positive = new ValueConstraint(Operator.GT, 0);
 * ValueConstraint email = ValueConstraint.builder()
 *         .operator(Operator.MATCH)
 *         .regexPattern(".+@.+")
 *         .verbose(true)
 *         .build();
 * }</pre>
 */
@Slf4j
public class ValueConstraint {

    private final String explicitName;
    @Getter
    private final Operator operator;
    @Getter
    private final Object value;
    @Getter
    private final String regexPattern;
    @Getter
    private final boolean verbose;

    private final Predicate<Object> check;

    @Getter
    private long total;
    @Getter
    private long failures;

    /**
     * Creates a value constraint.
     *
     * @param operator     the comparison to apply
     * @param value        the literal to compare against, or {@code null} when a pattern is given
     * @param regexPattern the pattern to match, or {@code null} when a literal is given
     * @param name         the report name, or {@code null} to generate one
     * @param verbose      whether to log every failed evaluation
     * @throws ConstraintConfigurationException if both or neither of literal and pattern are given, the literal
     *                                          has no wire form, or the operator does not apply to the one given
     */
    @lombok.Builder(builderClassName = "Builder")
    public ValueConstraint(Operator operator, Object value, String regexPattern, String name, boolean verbose) {
        if (operator == null) {
            throw new ConstraintConfigurationException("Value constraint must specify an operator");
        }
        if ((value == null) == (regexPattern == null)) {
            throw new ConstraintConfigurationException(
                    "Value constraint must specify a numeric value or regex pattern, but not both");
        }
        if (value != null && ValueKind.of(value) == ValueKind.OTHER) {
            throw new ConstraintConfigurationException("Value constraint literal must be text, a number or a boolean, "
                    + "instead type: '" + value.getClass().getSimpleName() + "' was provided!");
        }
        this.operator = operator;
        this.value = value;
        this.regexPattern = regexPattern;
        this.explicitName = name;
        this.verbose = verbose;
        this.check = value != null
                ? OperatorTable.valueLiteral(operator, value)
                : OperatorTable.valuePattern(operator, compile(regexPattern));
    }

    public ValueConstraint(Operator operator, Object value) {
        this(operator, value, null, null, false);
    }

    private static Pattern compile(String regexPattern) {
        try {
            return Pattern.compile(regexPattern);
        } catch (PatternSyntaxException e) {
            throw new ConstraintConfigurationException("Invalid regex pattern: " + regexPattern, e);
        }
    }

    /**
     * Returns the report name: the explicit name when one was given, otherwise
     * {@code value <OP> <literal-or-pattern>}.
     */
    public String getName() {
        if (explicitName != null) {
            return explicitName;
        }
        return "value " + operator + " " + (value != null ? value : regexPattern);
    }

    public void update(Object v) {
        total++;
        if (operator.isPattern() && !(v instanceof CharSequence)) {
            failures++;
            if (verbose) {
                log.info("value constraint {} failed: value {} not a string", getName(), v);
            }
        } else if (!check.test(v)) {
            failures++;
            if (verbose) {
                log.info("value constraint {} failed on value {}", getName(), v);
            }
        }
    }

    /**
     * Combines the counters of two constraints describing the same check.
     *
     * @param other the constraint to merge in, may be {@code null}
     * @return a new constraint with summed counters, or this constraint when {@code other} is {@code null}
     * @throws IncompatibleMergeException if name, operator, literal or pattern differ
     */
    public ValueConstraint merge(ValueConstraint other) {
        if (other == null) {
            return this;
        }
        if (!Objects.equals(getName(), other.getName())) {
            throw IncompatibleMergeException.mismatch("names", getName(), other.getName());
        }
        if (operator != other.operator) {
            throw IncompatibleMergeException.mismatch("ops", operator, other.operator);
        }
        if (!Comparisons.sameLiteral(value, other.value)) {
            throw IncompatibleMergeException.mismatch("values", value, other.value);
        }
        if (!Objects.equals(regexPattern, other.regexPattern)) {
            throw IncompatibleMergeException.mismatch("regex patterns", regexPattern, other.regexPattern);
        }

        ValueConstraint merged = new ValueConstraint(operator, value, regexPattern, getName(), verbose);
        merged.total = total + other.total;
        merged.failures = failures + other.failures;
        return merged;
    }

    public ConstraintReport report() {
        return ConstraintReport.of(getName(), total, failures);
    }

    public ValueConstraintMsg toProtobuf() {
        ValueConstraintMsg.Builder msg = ValueConstraintMsg.newBuilder()
                .setName(getName())
                .setOp(operator.toProto())
                .setVerbose(verbose)
                .setTotal(total)
                .setFailures(failures);
        if (value != null) {
            msg.setValue(ProtoValues.toValue(value));
        } else {
            msg.setRegexPattern(regexPattern);
        }
        return msg.build();
    }

    /**
     * Rebuilds a constraint, counters included, from its wire form.
     *
     * @param msg the message
     * @return the constraint
     * @throws ConstraintFormatException if both or neither of value and pattern are set, or the operator is unknown
     */
    public static ValueConstraint fromProtobuf(ValueConstraintMsg msg) {
        if (msg.hasValue() == msg.hasRegexPattern()) {
            throw new ConstraintFormatException(
                    "ValueConstraintMsg must specify a value or a regex pattern, but only one of them");
        }
        Object literal = msg.hasValue() ? ProtoValues.fromValue(msg.getValue()) : null;
        String pattern = msg.hasRegexPattern() ? msg.getRegexPattern() : null;
        String name = msg.getName().isEmpty() ? null : msg.getName();

        ValueConstraint constraint = new ValueConstraint(
                Operator.fromProto(msg.getOp()), literal, pattern, name, msg.getVerbose());
        constraint.total = msg.getTotal();
        constraint.failures = msg.getFailures();
        return constraint;
    }

    @Override
    public String toString() {
        return getName();
    }
}
