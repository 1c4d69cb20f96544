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

import org.fireflyframework.constraints.ConstraintReport;
import org.fireflyframework.constraints.exception.IncompatibleMergeException;
import org.fireflyframework.constraints.operator.Operator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ValueConstraints}.
 */
class ValueConstraintsTest {

    @Test
    void update_shouldEvaluateEveryConstraint() {
        // Given
        ValueConstraints constraints = new ValueConstraints(List.of(
                new ValueConstraint(Operator.GT, 0),
                new ValueConstraint(Operator.LT, 100)));

        // When
        constraints.update(50);
        constraints.update(-5);
        constraints.update(500);

        // Then
        assertThat(constraints.report()).hasValueSatisfying(reports -> assertThat(reports).containsExactly(
                ConstraintReport.of("value GT 0", 3, 1),
                ConstraintReport.of("value LT 100", 3, 1)));
    }

    @Test
    void constructor_withDuplicateNames_shouldKeepLastConstraint() {
        // Given
        ValueConstraint first = ValueConstraint.builder().operator(Operator.GT).value(0).name("positive").build();
        ValueConstraint second = ValueConstraint.builder().operator(Operator.GE).value(1).name("positive").build();

        // When
        ValueConstraints constraints = new ValueConstraints(List.of(first, second));

        // Then
        assertThat(constraints.size()).isEqualTo(1);
        assertThat(constraints.get("positive")).containsSame(second);
    }

    @Test
    void report_emptyCollection_shouldBeEmpty() {
        assertThat(new ValueConstraints().report()).isEmpty();
        assertThat(new ValueConstraints().isEmpty()).isTrue();
    }

    @Test
    void merge_shouldCombineSameNamedConstraints() {
        // Given
        ValueConstraints left = new ValueConstraints(List.of(new ValueConstraint(Operator.GT, 0)));
        ValueConstraints right = new ValueConstraints(List.of(new ValueConstraint(Operator.GT, 0)));
        left.update(1);
        right.update(-1);

        // When
        ValueConstraints merged = left.merge(right);

        // Then
        assertThat(merged.get("value GT 0"))
                .hasValueSatisfying(c -> {
                    assertThat(c.getTotal()).isEqualTo(2);
                    assertThat(c.getFailures()).isEqualTo(1);
                });
    }

    @Test
    void merge_withDifferentNames_shouldFail() {
        ValueConstraints left = new ValueConstraints(List.of(new ValueConstraint(Operator.GT, 0)));
        ValueConstraints right = new ValueConstraints(List.of(new ValueConstraint(Operator.LT, 10)));

        assertThatThrownBy(() -> left.merge(right))
                .isInstanceOf(IncompatibleMergeException.class)
                .hasMessageContaining("value LT 10");
    }

    @Test
    void protobuf_shouldRestoreEveryConstraint() {
        // Given
        ValueConstraints constraints = new ValueConstraints(List.of(
                new ValueConstraint(Operator.GT, 0),
                ValueConstraint.builder().operator(Operator.NOMATCH).regexPattern("\\s").build()));
        constraints.update(3);

        // When
        ValueConstraints restored = ValueConstraints.fromProtobuf(constraints.toProtobuf());

        // Then
        assertThat(restored.getConstraints().keySet()).containsExactly("value GT 0", "value NOMATCH \\s");
        assertThat(restored.report()).isEqualTo(constraints.report());
    }
}
