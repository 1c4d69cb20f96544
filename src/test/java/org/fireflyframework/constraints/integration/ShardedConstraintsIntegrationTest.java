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

package org.fireflyframework.constraints.integration;

import org.fireflyframework.constraints.ConstraintReport;
import org.fireflyframework.constraints.dataset.ColumnReport;
import org.fireflyframework.constraints.dataset.ConstraintKind;
import org.fireflyframework.constraints.dataset.ConstraintsDefinition;
import org.fireflyframework.constraints.dataset.DatasetConstraints;
import org.fireflyframework.constraints.service.DatasetConstraintsService;
import org.fireflyframework.constraints.summary.NumberSummary;
import org.fireflyframework.constraints.summary.SummaryBundle;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests that stream order records through several workers,
 * ship each worker's constraints as bytes and merge them into one report.
 */
class ShardedConstraintsIntegrationTest {

    record OrderRecord(double amount, String email, String status) {}

    private final ConstraintsDefinition definition =
            ConstraintsDefinition.load(new ClassPathResource("constraints/orders.json"));

    private byte[] runWorker(List<OrderRecord> orders) {
        DatasetConstraints constraints = definition.newInstance();
        Set<Object> statuses = new LinkedHashSet<>();
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        double sum = 0;
        for (OrderRecord order : orders) {
            constraints.updateValue("amount", order.amount());
            constraints.updateValue("email", order.email());
            statuses.add(order.status());
            min = Math.min(min, order.amount());
            max = Math.max(max, order.amount());
            sum += order.amount();
        }
        double mean = sum / orders.size();
        double squares = 0;
        for (OrderRecord order : orders) {
            squares += (order.amount() - mean) * (order.amount() - mean);
        }
        NumberSummary amountSummary = NumberSummary.builder()
                .count((long) orders.size())
                .min(min)
                .max(max)
                .mean(mean)
                .stddev(Math.sqrt(squares / orders.size()))
                .build();
        constraints.updateSummary("amount", SummaryBundle.of(amountSummary));
        constraints.updateSummary("status", SummaryBundle.of(null, statuses));
        return constraints.toByteArray();
    }

    @Test
    void shardedPipeline_cleanData_reportsPassed() {
        // Given - three workers, all data within constraints
        List<List<OrderRecord>> partitions = List.of(
                List.of(new OrderRecord(10, "a@example.com", "NEW"), new OrderRecord(20, "b@example.com", "PAID")),
                List.of(new OrderRecord(15, "c@example.com", "SHIPPED"), new OrderRecord(25, "d@example.com", "PAID")),
                List.of(new OrderRecord(12, "e@example.com", "NEW"), new OrderRecord(30, "f@example.com", "NEW")));
        DatasetConstraintsService service = new DatasetConstraintsService();

        // When
        Flux<DatasetConstraints> shards = Flux.fromIterable(partitions)
                .publishOn(Schedulers.parallel())
                .map(this::runWorker)
                .map(DatasetConstraints::parseFrom);

        // Then
        StepVerifier.create(service.mergeAndReport(shards))
                .assertNext(report -> {
                    assertThat(report.isPassed()).isTrue();
                    assertThat(report.getColumns()).hasSize(4);
                    assertThat(report.getEntries()).filteredOn(e -> e.getName().equals("amount positive"))
                            .singleElement()
                            .extracting(ConstraintReport::getTotal)
                            .isEqualTo(6L);
                    assertThat(report.getColumns())
                            .filteredOn(c -> c.getKind() == ConstraintKind.SUMMARY)
                            .flatExtracting(ColumnReport::getConstraints)
                            .extracting(ConstraintReport::getTotal)
                            .containsOnly(3L);
                })
                .verifyComplete();
    }

    @Test
    void shardedPipeline_dirtyShard_reportsEveryFailure() {
        // Given - the second worker sees a refund, a bad address and an unknown status
        List<List<OrderRecord>> partitions = List.of(
                List.of(new OrderRecord(10, "a@example.com", "NEW"), new OrderRecord(11, "b@example.com", "PAID")),
                List.of(new OrderRecord(-5, "not an address", "REFUNDED"), new OrderRecord(40, "c@example.com", "PAID")));
        DatasetConstraintsService service = new DatasetConstraintsService();

        // When
        Flux<DatasetConstraints> shards = Flux.fromIterable(partitions)
                .map(this::runWorker)
                .map(DatasetConstraints::parseFrom);

        // Then
        StepVerifier.create(service.mergeAndReport(shards))
                .assertNext(report -> {
                    assertThat(report.isPassed()).isFalse();
                    assertThat(report.getEntries())
                            .filteredOn(entry -> entry.getFailures() > 0)
                            .extracting(ConstraintReport::getName)
                            .containsExactlyInAnyOrder(
                                    "amount positive",
                                    "value MATCH [^@\\s]+@[^@\\s]+",
                                    "summary min GE 0.0",
                                    "summary stddev BETWEEN 0.5 and 20.0",
                                    "summary distinct_column_values IN_SET {NEW, PAID, SHIPPED}");
                    assertThat(report.getTotalFailures()).isEqualTo(5);
                })
                .verifyComplete();
    }
}
