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

package org.fireflyframework.constraints.service;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.constraints.dataset.DatasetConstraints;
import org.fireflyframework.constraints.dataset.DatasetConstraintsReport;
import org.fireflyframework.constraints.event.ConstraintsReportEvent;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Combines the constraint results of pipeline shards and reports them.
 *
 * <p>Workers stream into their own {@link DatasetConstraints}. Once they are
 * done, {@link #mergeShards(Flux)} folds the shard results into one instance
 * through a pairwise merge tree, and {@link #report(DatasetConstraints)}
 * produces the final verdict.</p>
 *
 * <p>When an {@link ApplicationEventPublisher} is provided, a
 * {@link ConstraintsReportEvent} is published after each report.</p>
 */
@Slf4j
public class DatasetConstraintsService {

    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates a service that does not publish events.
     */
    public DatasetConstraintsService() {
        this(null);
    }

    /**
     * Creates a service with an optional event publisher.
     *
     * @param eventPublisher the event publisher, or {@code null} to disable event publishing
     */
    public DatasetConstraintsService(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    /**
     * Reports the constraints of a dataset.
     *
     * @param constraints the dataset constraints
     * @return a {@link Mono} emitting the report
     */
    public Mono<DatasetConstraintsReport> report(DatasetConstraints constraints) {
        Objects.requireNonNull(constraints, "constraints");
        return Mono.fromCallable(constraints::report)
                .doOnNext(report -> {
                    log.debug("Reported {} constraints with {} failures",
                            report.getEntries().size(), report.getTotalFailures());
                    publishEvent(constraints, report);
                });
    }

    /**
     * Merges shard results pairwise until one remains.
     *
     * @param shards the shard results
     * @return a {@link Mono} emitting the merged constraints, or empty when there are no shards
     */
    public Mono<DatasetConstraints> mergeShards(Flux<DatasetConstraints> shards) {
        return shards.collectList()
                .filter(list -> !list.isEmpty())
                .map(DatasetConstraintsService::mergeTree);
    }

    /**
     * Merges shard results and reports the merged constraints.
     *
     * @param shards the shard results
     * @return a {@link Mono} emitting the report of the merged constraints
     */
    public Mono<DatasetConstraintsReport> mergeAndReport(Flux<DatasetConstraints> shards) {
        return mergeShards(shards).flatMap(this::report);
    }

    private static DatasetConstraints mergeTree(List<DatasetConstraints> shards) {
        List<DatasetConstraints> level = shards;
        while (level.size() > 1) {
            List<DatasetConstraints> next = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                next.add(i + 1 < level.size() ? level.get(i).merge(level.get(i + 1)) : level.get(i));
            }
            log.debug("Merged {} shard results into {}", level.size(), next.size());
            level = next;
        }
        return level.get(0);
    }

    private void publishEvent(DatasetConstraints constraints, DatasetConstraintsReport report) {
        if (eventPublisher != null) {
            eventPublisher.publishEvent(new ConstraintsReportEvent(constraints.getProperties(), report));
        }
    }
}
