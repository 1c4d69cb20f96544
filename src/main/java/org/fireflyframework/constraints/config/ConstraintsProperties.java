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

package org.fireflyframework.constraints.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration of the data constraints module.
 *
 * <pre>{@code
 * firefly:
 *   data:
 *     constraints:
 *       enabled: true
 *       location: classpath:constraints/orders.json
 *       publish-events: true
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.data.constraints")
public class ConstraintsProperties {

    /**
     * Whether the module is enabled.
     */
    private boolean enabled = true;

    /**
     * Resource location of a JSON dataset constraints definition.
     */
    private String location;

    /**
     * Whether reports are published as application events.
     */
    private boolean publishEvents = true;
}
