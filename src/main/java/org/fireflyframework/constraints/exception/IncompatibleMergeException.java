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

package org.fireflyframework.constraints.exception;

/**
 * Raised when two constraints, or two collections of constraints, that are
 * being merged do not describe the same check.
 */
public class IncompatibleMergeException extends ConstraintException {

    public IncompatibleMergeException(String message) {
        super(message);
    }

    /**
     * Creates an exception naming the field that differs and both of its values.
     *
     * @param field the identity field that differs
     * @param left  the value on the receiving side
     * @param right the value on the merged-in side
     * @return the exception
     */
    public static IncompatibleMergeException mismatch(String field, Object left, Object right) {
        return new IncompatibleMergeException(
                "Cannot merge constraints with different " + field + ": (" + left + ") and (" + right + ")");
    }
}
