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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.constraints.dataset.ConstraintsDefinition;
import org.fireflyframework.constraints.service.DatasetConstraintsService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ResourceLoader;

/**
 * Auto-configuration for the data constraints module.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>{@link DatasetConstraintsService} for merging shard results and reporting them</li>
 *   <li>{@link ConstraintsDefinition} loaded from {@code firefly.data.constraints.location}, when set</li>
 * </ul>
 *
 * <p>The configuration is activated when:</p>
 * <ul>
 *   <li>The property {@code firefly.data.constraints.enabled} is true (default)</li>
 *   <li>Or the property is not set (enabled by default)</li>
 * </ul>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(ConstraintsProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.data.constraints",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class ConstraintsAutoConfiguration {

    /**
     * Creates the constraints service bean.
     *
     * <p>An {@link ApplicationEventPublisher} is injected when available and
     * {@code publish-events} is on, to publish a report event per report.</p>
     *
     * @param properties     the module properties
     * @param eventPublisher the event publisher, or {@code null} if unavailable
     * @return the configured service
     */
    @Bean
    @ConditionalOnMissingBean
    public DatasetConstraintsService datasetConstraintsService(
            ConstraintsProperties properties,
            @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        ApplicationEventPublisher publisher = properties.isPublishEvents() ? eventPublisher : null;
        log.info("Configuring Dataset Constraints Service (events {})", publisher != null ? "enabled" : "disabled");
        return new DatasetConstraintsService(publisher);
    }

    /**
     * Loads the dataset constraints definition declared in configuration.
     *
     * @param properties     the module properties
     * @param resourceLoader the loader resolving the definition location
     * @return the definition
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.data.constraints", name = "location")
    public ConstraintsDefinition constraintsDefinition(ConstraintsProperties properties, ResourceLoader resourceLoader) {
        log.info("Loading dataset constraints from {}", properties.getLocation());
        return ConstraintsDefinition.load(resourceLoader.getResource(properties.getLocation()));
    }
}
