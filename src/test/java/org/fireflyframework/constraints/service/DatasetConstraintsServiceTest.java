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

import org.fireflyframework.constraints.dataset.DatasetConstraints;
import org.fireflyframework.constraints.event.ConstraintsReportEvent;
import org.fireflyframework.constraints.exception.IncompatibleMergeException;
import org.fireflyframework.constraints.operator.Operator;
import org.fireflyframework.constraints.proto.DatasetProperties;
import org.fireflyframework.constraints.value.ValueConstraint;
import org.fireflyframework.constraints.value.ValueConstraints;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for {@link DatasetConstraintsService}.
 */
@ExtendWith(MockitoExtension.class)
class DatasetConstraintsServiceTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private static DatasetConstraints shard(int... amounts) {
        DatasetConstraints shard = DatasetConstraints.builder()
                .properties(DatasetProperties.newBuilder().setSessionId("orders").build())
                .valueConstraint("amount", new ValueConstraints(List.of(new ValueConstraint(Operator.GT, 0))))
                .build();
        for (int amount : amounts) {
            shard.updateValue("amount", amount);
        }
        return shard;
    }

    @Test
    void report_shouldPublishEvent() {
        // Given
        DatasetConstraintsService service = new DatasetConstraintsService(eventPublisher);

        // When & Then
        StepVerifier.create(service.report(shard(1, -1)))
                .assertNext(report -> {
                    assertThat(report.isPassed()).isFalse();
                    assertThat(report.getTotalFailures()).isEqualTo(1);
                })
                .verifyComplete();

        ArgumentCaptor<ConstraintsReportEvent> captor = ArgumentCaptor.forClass(ConstraintsReportEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getProperties().getSessionId()).isEqualTo("orders");
        assertThat(captor.getValue().getReport().getTotalFailures()).isEqualTo(1);
        assertThat(captor.getValue().getTimestamp()).isNotNull();
    }

    @Test
    void report_withoutPublisher_shouldStillReport() {
        DatasetConstraintsService service = new DatasetConstraintsService();

        StepVerifier.create(service.report(shard(3)))
                .assertNext(report -> assertThat(report.isPassed()).isTrue())
                .verifyComplete();
    }

    @Test
    void mergeShards_shouldSumEveryShard() {
        // Given - an odd number of shards exercises the carried-over leaf
        DatasetConstraintsService service = new DatasetConstraintsService(eventPublisher);
        Flux<DatasetConstraints> shards = Flux.fromStream(IntStream.range(0, 5).mapToObj(i -> shard(i, -i)));

        // When & Then
        StepVerifier.create(service.mergeShards(shards))
                .assertNext(merged -> assertThat(merged.report().getEntries()).singleElement()
                        .satisfies(entry -> {
                            assertThat(entry.getTotal()).isEqualTo(10);
                            // 0 fails twice, every negative fails once
                            assertThat(entry.getFailures()).isEqualTo(6);
                        }))
                .verifyComplete();
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void mergeShards_noShards_shouldCompleteEmpty() {
        DatasetConstraintsService service = new DatasetConstraintsService();

        StepVerifier.create(service.mergeShards(Flux.empty()))
                .verifyComplete();
    }

    @Test
    void mergeShards_incompatibleShards_shouldError() {
        // Given
        DatasetConstraintsService service = new DatasetConstraintsService();
        DatasetConstraints other = DatasetConstraints.builder()
                .valueConstraint("price", new ValueConstraints(List.of(new ValueConstraint(Operator.GT, 0))))
                .build();

        // When & Then
        StepVerifier.create(service.mergeShards(Flux.just(shard(1), other)))
                .expectError(IncompatibleMergeException.class)
                .verify();
    }

    @Test
    void mergeAndReport_shouldReportMergedShards() {
        DatasetConstraintsService service = new DatasetConstraintsService(eventPublisher);

        StepVerifier.create(service.mergeAndReport(Flux.just(shard(1, 2), shard(-4))))
                .assertNext(report -> {
                    assertThat(report.getEntries()).singleElement()
                            .satisfies(entry -> assertThat(entry.getTotal()).isEqualTo(3));
                    assertThat(report.getTotalFailures()).isEqualTo(1);
                })
                .verifyComplete();
        verify(eventPublisher).publishEvent(any(ConstraintsReportEvent.class));
    }
}
