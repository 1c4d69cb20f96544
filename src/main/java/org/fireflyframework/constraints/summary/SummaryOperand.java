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

import org.fireflyframework.constraints.exception.ConstraintConfigurationException;

import java.util.Objects;

/**
 * Right-hand side of a {@link SummaryConstraint}. Exactly one shape applies to
 * each constraint, and the shape decides which operators are allowed.
 */
public interface SummaryOperand {

    enum Kind {
        LITERAL_COMPARE,
        FIELD_COMPARE,
        BETWEEN_LITERALS,
        BETWEEN_FIELDS,
        SET_RELATION
    }

    Kind kind();

    /**
     * Text used when a constraint name is generated.
     */
    String render();

    /**
     * Summary field against a literal.
     */
    record LiteralCompare(Object value) implements SummaryOperand {

        public LiteralCompare {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.LITERAL_COMPARE;
        }

        @Override
        public String render() {
            return String.valueOf(value);
        }
    }

    /**
     * Summary field against a second summary field.
     */
    record FieldCompare(String secondField) implements SummaryOperand {

        public FieldCompare {
            Objects.requireNonNull(secondField, "secondField");
        }

        @Override
        public Kind kind() {
            return Kind.FIELD_COMPARE;
        }

        @Override
        public String render() {
            return secondField;
        }
    }

    /**
     * Summary field within {@code [lower, upper]}; {@code lower} must be strictly below {@code upper}.
     */
    record BetweenLiterals(double lower, double upper) implements SummaryOperand {

        public BetweenLiterals {
            if (!(lower < upper)) {
                throw new ConstraintConfigurationException(
                        "Summary constraint with BETWEEN operation must specify lower value to be less than upper value");
            }
        }

        @Override
        public Kind kind() {
            return Kind.BETWEEN_LITERALS;
        }

        @Override
        public String render() {
            return lower + " and " + upper;
        }
    }

    /**
     * Summary field within the range given by two other summary fields.
     */
    record BetweenFields(String lowerField, String upperField) implements SummaryOperand {

        public BetweenFields {
            Objects.requireNonNull(lowerField, "lowerField");
            Objects.requireNonNull(upperField, "upperField");
        }

        @Override
        public Kind kind() {
            return Kind.BETWEEN_FIELDS;
        }

        @Override
        public String render() {
            return lowerField + " and " + upperField;
        }
    }

    /**
     * Observed distinct values against a reference set.
     */
    record SetRelation(ReferenceSet referenceSet) implements SummaryOperand {

        public SetRelation {
            Objects.requireNonNull(referenceSet, "referenceSet");
        }

        @Override
        public Kind kind() {
            return Kind.SET_RELATION;
        }

        @Override
        public String render() {
            return referenceSet.render();
        }
    }
}
