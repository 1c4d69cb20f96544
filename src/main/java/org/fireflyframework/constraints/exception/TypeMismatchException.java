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

import lombok.Getter;

/**
 * Raised when a reference set for a set-relation constraint is supplied as a
 * value that cannot be turned into a set.
 */
@Getter
public class TypeMismatchException extends ConstraintConfigurationException {

    private final String providedType;

    public TypeMismatchException(String providedType) {
        super("When using set operations, provided value must be set or set castable, instead type: '"
                + providedType + "' was provided!");
        this.providedType = providedType;
    }
}
