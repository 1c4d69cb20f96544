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

package org.fireflyframework.constraints.dataset;

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.constraints.ConstraintReport;

import java.time.Instant;
import java.util.List;

/**
 * Verdict tree of a {@link DatasetConstraints}: value-constraint columns first,
 * then summary-constraint columns, each in declaration order.
 */
@Data
@Builder
public class DatasetConstraintsReport {

    private final List<ColumnReport> columns;
    private final Instant timestamp;

    /**
     * Returns every constraint report, flattened in column order.
     *
     * @return the constraint reports
     */
    public List<ConstraintReport> getEntries() {
        return columns.stream()
                .flatMap(column -> column.getConstraints().stream())
                .toList();
    }

    public long getTotalFailures() {
        return getEntries().stream()
                .mapToLong(ConstraintReport::getFailures)
                .sum();
    }

    /**
     * Returns whether no constraint of the dataset has failed.
     *
     * @return {@code true} when every constraint reports zero failures
     */
    public boolean isPassed() {
        return getTotalFailures() == 0;
    }
}
