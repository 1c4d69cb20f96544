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

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.constraints.operator.ValueKind;
import org.fireflyframework.constraints.sketch.DistinctValueSketch;

/**
 * Everything a {@link SummaryConstraint} looks at for one window of a column:
 * the aggregate statistics and two sketches of the observed distinct values,
 * one over the text values and one over the numeric values.
 *
 * <p>A missing sketch is read as an empty one.</p>
 */
@Data
@Builder
public class SummaryBundle {

    private final NumberSummary numberSummary;
    private final DistinctValueSketch stringSketch;
    private final DistinctValueSketch numberSketch;

    /**
     * Builds a bundle whose sketches hold the given observed distinct values,
     * bucketed the same way reference sets are.
     *
     * @param numberSummary  the column statistics, may be {@code null}
     * @param distinctValues the observed values
     * @return the bundle
     */
    public static SummaryBundle of(NumberSummary numberSummary, Iterable<?> distinctValues) {
        DistinctValueSketch strings = DistinctValueSketch.create();
        DistinctValueSketch numbers = DistinctValueSketch.create();
        for (Object value : distinctValues) {
            ValueKind kind = ValueKind.of(value);
            if (kind == ValueKind.STRING) {
                strings.add(value);
            } else if (kind == ValueKind.NUMBER) {
                numbers.add(value);
            }
        }
        return SummaryBundle.builder()
                .numberSummary(numberSummary)
                .stringSketch(strings)
                .numberSketch(numbers)
                .build();
    }

    public static SummaryBundle of(NumberSummary numberSummary) {
        return SummaryBundle.builder().numberSummary(numberSummary).build();
    }

    DistinctValueSketch stringSketchOrEmpty() {
        return stringSketch != null ? stringSketch : DistinctValueSketch.create();
    }

    DistinctValueSketch numberSketchOrEmpty() {
        return numberSketch != null ? numberSketch : DistinctValueSketch.create();
    }
}
