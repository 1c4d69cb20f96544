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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.constraints.exception.ConstraintConfigurationException;
import org.fireflyframework.constraints.proto.DatasetConstraintMsg;
import org.springframework.core.io.Resource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Dataset constraints declared once, at configuration time, and instantiated
 * afresh for every pipeline worker.
 *
 * <p>Each call to {@link #newInstance()} returns an independent
 * {@link DatasetConstraints}, so workers never share counters.</p>
 */
@Slf4j
public class ConstraintsDefinition {

    private final DatasetConstraintMsg definition;

    public ConstraintsDefinition(DatasetConstraintMsg definition) {
        // decode once so a broken definition fails at startup
        DatasetConstraints.fromProtobuf(definition);
        this.definition = definition;
    }

    /**
     * Reads a JSON definition from a Spring resource.
     *
     * @param resource the JSON resource
     * @return the definition
     * @throws ConstraintConfigurationException if the resource cannot be read
     */
    public static ConstraintsDefinition load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            String json = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            DatasetConstraintMsg msg = DatasetConstraints.fromJson(json).toProtobuf();
            log.info("Loaded constraints for {} value and {} summary columns from {}",
                    msg.getValueConstraintsCount(), msg.getSummaryConstraintsCount(), resource.getDescription());
            return new ConstraintsDefinition(msg);
        } catch (IOException e) {
            throw new ConstraintConfigurationException("Unable to read constraints from " + resource.getDescription(), e);
        }
    }

    public DatasetConstraints newInstance() {
        return DatasetConstraints.fromProtobuf(definition);
    }

    public DatasetConstraintMsg getDefinition() {
        return definition;
    }
}
