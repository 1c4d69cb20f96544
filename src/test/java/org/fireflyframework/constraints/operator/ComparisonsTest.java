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

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Comparisons}.
 */
class ComparisonsTest {

    @Test
    void compare_numbersOfDifferentBoxedTypes_shouldCompareByValue() {
        assertThat(Comparisons.compare(1, 1.0)).hasValue(0);
        assertThat(Comparisons.compare(2L, 1.5f)).hasValue(1);
        assertThat(Comparisons.compare(new BigDecimal("0.1"), 1)).hasValue(-1);
    }

    @Test
    void compare_textWithText_shouldUseLexicalOrder() {
        assertThat(Comparisons.compare("apple", "banana")).hasValue(-1);
        assertThat(Comparisons.compare("b", "b")).hasValue(0);
    }

    @Test
    void compare_mixedKinds_shouldBeIncomparable() {
        assertThat(Comparisons.compare("5", 5)).isEmpty();
        assertThat(Comparisons.compare(true, 1)).isEmpty();
        assertThat(Comparisons.compare(null, 1)).isEmpty();
    }

    @Test
    void compare_nanAndInfinity_shouldFollowNumericRules() {
        assertThat(Comparisons.compare(Double.NaN, 1.0)).isEmpty();
        assertThat(Comparisons.compare(Double.POSITIVE_INFINITY, Double.MAX_VALUE)).hasValue(1);
        assertThat(Comparisons.compare(Double.NEGATIVE_INFINITY, Long.MIN_VALUE)).hasValue(-1);
    }

    @Test
    void compare_sameComparableClass_shouldUseNaturalOrder() {
        assertThat(Comparisons.compare(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 6, 1))).hasValue(-1);
    }

    @Test
    void holds_incomparablePair_shouldOnlySatisfyNotEqual() {
        assertThat(Comparisons.holds(Operator.NE, Comparisons.compare("a", 1))).isTrue();
        assertThat(Comparisons.holds(Operator.EQ, Comparisons.compare("a", 1))).isFalse();
        assertThat(Comparisons.holds(Operator.LT, Comparisons.compare("a", 1))).isFalse();
        assertThat(Comparisons.holds(Operator.GE, Comparisons.compare("a", 1))).isFalse();
    }

    @Test
    void sameLiteral_shouldTreatEqualNumbersAsSame() {
        assertThat(Comparisons.sameLiteral(0, 0.0)).isTrue();
        assertThat(Comparisons.sameLiteral("a", "a")).isTrue();
        assertThat(Comparisons.sameLiteral(1, 2)).isFalse();
        assertThat(Comparisons.sameLiteral(null, null)).isTrue();
        assertThat(Comparisons.sameLiteral(1, "1")).isFalse();
    }
}
