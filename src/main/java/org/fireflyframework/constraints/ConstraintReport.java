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

package org.fireflyframework.constraints;

import lombok.Builder;
import lombok.Data;

/**
 * Verdict of a single constraint: how many times it was evaluated and how
 * many of those evaluations failed.
 */
@Data
@Builder
public class ConstraintReport {

    private final String name;
    private final long total;
    private final long failures;

    public static ConstraintReport of(String name, long total, long failures) {
        return ConstraintReport.builder()
                .name(name)
                .total(total)
                .failures(failures)
                .build();
    }

    /**
     * Returns whether no evaluation of the constraint has failed.
     *
     * @return {@code true} when {@code failures} is zero
     */
    public boolean isPassed() {
        return failures == 0;
    }
}
