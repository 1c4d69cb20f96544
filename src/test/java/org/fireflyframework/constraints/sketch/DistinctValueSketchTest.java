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

package org.fireflyframework.constraints.sketch;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DistinctValueSketch}.
 */
class DistinctValueSketchTest {

    @Test
    void estimate_shouldCountDistinctItems() {
        // Given
        DistinctValueSketch sketch = DistinctValueSketch.create();

        // When
        sketch.add("a").add("b").add("a").add(1).add(1.0).add(true).add(null);

        // Then - 1 and 1.0 hash the same, null is ignored
        assertThat(sketch.estimate()).isCloseTo(4.0, within(0.001));
        assertThat(sketch.isEmpty()).isFalse();
    }

    @Test
    void estimateDifference_shouldCountItemsOnlyInFirstSketch() {
        DistinctValueSketch a = DistinctValueSketch.of(List.of("a", "b", "z"));
        DistinctValueSketch b = DistinctValueSketch.of(List.of("a", "b", "c"));

        assertThat(DistinctValueSketch.estimateDifference(a, b)).isCloseTo(1.0, within(0.001));
        assertThat(DistinctValueSketch.estimateDifference(b, b)).isCloseTo(0.0, within(0.001));
        assertThat(DistinctValueSketch.estimateDifference(DistinctValueSketch.create(), b)).isCloseTo(0.0, within(0.001));
    }

    @Test
    void byteArray_shouldKeepEstimateAndRejectUpdates() {
        // Given
        DistinctValueSketch sketch = DistinctValueSketch.of(List.of("x", "y", "z"));

        // When
        DistinctValueSketch restored = DistinctValueSketch.fromByteArray(sketch.toByteArray());

        // Then
        assertThat(restored.estimate()).isCloseTo(3.0, within(0.001));
        assertThat(DistinctValueSketch.estimateDifference(restored, sketch)).isCloseTo(0.0, within(0.001));
        assertThatThrownBy(() -> restored.add("w")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void create_withTooFewEntries_shouldFail() {
        assertThatThrownBy(() -> DistinctValueSketch.create(8)).isInstanceOf(IllegalArgumentException.class);
    }
}
