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
import lombok.Singular;

import java.util.Map;

/**
 * Aggregate statistics of one column, produced by the statistics-collection
 * layer and consumed by {@link SummaryConstraint}s.
 *
 * <p>Fields are addressed by name: {@code count}, {@code min}, {@code max},
 * {@code mean}, {@code stddev}, {@code unique_count}, plus any additional
 * named statistics the producer chooses to expose.</p>
 */
@Data
@Builder
public class NumberSummary {

    private final Long count;
    private final Double min;
    private final Double max;
    private final Double mean;
    private final Double stddev;
    private final Double uniqueCount;

    @Singular
    private final Map<String, Double> additionalFields;

    /**
     * Looks up a statistic by name.
     *
     * @param fieldName the statistic name
     * @return the value, or {@code null} when the summary does not carry it
     */
    public Number getField(String fieldName) {
        if (fieldName == null) {
            return null;
        }
        return switch (fieldName) {
            case "count" -> count;
            case "min" -> min;
            case "max" -> max;
            case "mean" -> mean;
            case "stddev" -> stddev;
            case "unique_count" -> uniqueCount;
            default -> additionalFields.get(fieldName);
        };
    }
}
