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

/**
 * Type tag used to bucket values into the string and numeric subsets that
 * set-relation constraints compare separately.
 *
 * <p>Booleans get their own tag and belong to neither subset, even though
 * some sources treat them as numbers.</p>
 */
public enum ValueKind {

    STRING,
    NUMBER,
    BOOLEAN,
    OTHER;

    public static ValueKind of(Object value) {
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof CharSequence) {
            return STRING;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        return OTHER;
    }
}
