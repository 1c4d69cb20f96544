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

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import lombok.Getter;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.constraints.ConstraintReport;
import org.fireflyframework.constraints.exception.ConstraintFormatException;
import org.fireflyframework.constraints.exception.IncompatibleMergeException;
import org.fireflyframework.constraints.proto.DatasetConstraintMsg;
import org.fireflyframework.constraints.proto.DatasetProperties;
import org.fireflyframework.constraints.proto.SummaryConstraintMsgs;
import org.fireflyframework.constraints.proto.ValueConstraintMsgs;
import org.fireflyframework.constraints.summary.SummaryBundle;
import org.fireflyframework.constraints.summary.SummaryConstraints;
import org.fireflyframework.constraints.value.ValueConstraints;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BinaryOperator;

/**
 * All constraints of a dataset, keyed by column, plus the dataset properties
 * they were declared with.
 *
 * <p>Each pipeline worker owns one instance and feeds it through
 * {@link #updateValue} and {@link #updateSummary}. Once streaming is over, the
 * shards are combined with {@link #merge} and the outcome is read with
 * {@link #report()}. The dataset properties are carried along untouched.</p>
 *
 * <pre>{@code
 * DatasetConstraints constraints = DatasetConstraints.builder()
 *         .valueConstraint("amount", new ValueConstraints(List.of(new ValueConstraint(Operator.GT, 0))))
 *         .summaryConstraint("amount", new SummaryConstraints(List.of(StandardConstraints.minGreaterThanEqual(0))))
 *         .build();
 * }</pre>
 */
@Slf4j
public class DatasetConstraints {

    @Getter
    private final DatasetProperties properties;
    private final Map<String, ValueConstraints> valueConstraints;
    private final Map<String, SummaryConstraints> summaryConstraints;

    @lombok.Builder(builderClassName = "Builder")
    public DatasetConstraints(DatasetProperties properties,
                              @Singular Map<String, ValueConstraints> valueConstraints,
                              @Singular Map<String, SummaryConstraints> summaryConstraints) {
        this.properties = properties != null ? properties : DatasetProperties.getDefaultInstance();
        this.valueConstraints = valueConstraints != null ? new LinkedHashMap<>(valueConstraints) : new LinkedHashMap<>();
        this.summaryConstraints = summaryConstraints != null ? new LinkedHashMap<>(summaryConstraints) : new LinkedHashMap<>();
    }

    public Optional<ValueConstraints> getValueConstraints(String column) {
        return Optional.ofNullable(valueConstraints.get(column));
    }

    public Optional<SummaryConstraints> getSummaryConstraints(String column) {
        return Optional.ofNullable(summaryConstraints.get(column));
    }

    public Map<String, ValueConstraints> getValueConstraintMap() {
        return Collections.unmodifiableMap(valueConstraints);
    }

    public Map<String, SummaryConstraints> getSummaryConstraintMap() {
        return Collections.unmodifiableMap(summaryConstraints);
    }

    /**
     * Feeds one streamed value of a column; columns without value constraints ignore it.
     */
    public void updateValue(String column, Object value) {
        ValueConstraints constraints = valueConstraints.get(column);
        if (constraints != null) {
            constraints.update(value);
        }
    }

    /**
     * Feeds one summary window of a column; columns without summary constraints ignore it.
     */
    public void updateSummary(String column, SummaryBundle bundle) {
        SummaryConstraints constraints = summaryConstraints.get(column);
        if (constraints != null) {
            constraints.update(bundle);
        }
    }

    /**
     * Merges the per-column collections of two shards. The result keeps this
     * instance's dataset properties.
     *
     * @param other the shard to merge in, may be {@code null}
     * @return a new instance, or this one when {@code other} is {@code null}
     * @throws IncompatibleMergeException if the shards constrain different columns or constraints
     */
    public DatasetConstraints merge(DatasetConstraints other) {
        if (other == null) {
            return this;
        }
        return new DatasetConstraints(properties,
                mergeColumns("value", valueConstraints, other.valueConstraints, ValueConstraints::merge),
                mergeColumns("summary", summaryConstraints, other.summaryConstraints, SummaryConstraints::merge));
    }

    private static <C> Map<String, C> mergeColumns(String kind, Map<String, C> left, Map<String, C> right,
                                                   BinaryOperator<C> merger) {
        if (!left.keySet().equals(right.keySet())) {
            throw new IncompatibleMergeException("Cannot merge datasets with different " + kind
                    + " constraint columns: " + left.keySet() + " and " + right.keySet());
        }
        Map<String, C> merged = new LinkedHashMap<>();
        for (Map.Entry<String, C> entry : left.entrySet()) {
            merged.put(entry.getKey(), merger.apply(entry.getValue(), right.get(entry.getKey())));
        }
        return merged;
    }

    /**
     * Reports every column that holds at least one constraint.
     *
     * @return the dataset report
     */
    public DatasetConstraintsReport report() {
        List<ColumnReport> columns = new ArrayList<>();
        valueConstraints.forEach((column, constraints) ->
                constraints.report().ifPresent(reports -> columns.add(columnReport(column, ConstraintKind.VALUE, reports))));
        summaryConstraints.forEach((column, constraints) ->
                constraints.report().ifPresent(reports -> columns.add(columnReport(column, ConstraintKind.SUMMARY, reports))));
        return DatasetConstraintsReport.builder()
                .columns(columns)
                .timestamp(Instant.now())
                .build();
    }

    private static ColumnReport columnReport(String column, ConstraintKind kind, List<ConstraintReport> reports) {
        return ColumnReport.builder()
                .column(column)
                .kind(kind)
                .constraints(reports)
                .build();
    }

    public DatasetConstraintMsg toProtobuf() {
        DatasetConstraintMsg.Builder msg = DatasetConstraintMsg.newBuilder().setProperties(properties);
        valueConstraints.forEach((column, constraints) -> msg.putValueConstraints(column, constraints.toProtobuf()));
        summaryConstraints.forEach((column, constraints) -> msg.putSummaryConstraints(column, constraints.toProtobuf()));
        return msg.build();
    }

    public static DatasetConstraints fromProtobuf(DatasetConstraintMsg msg) {
        Map<String, ValueConstraints> values = new LinkedHashMap<>();
        for (Map.Entry<String, ValueConstraintMsgs> entry : msg.getValueConstraintsMap().entrySet()) {
            values.put(entry.getKey(), ValueConstraints.fromProtobuf(entry.getValue()));
        }
        Map<String, SummaryConstraints> summaries = new LinkedHashMap<>();
        for (Map.Entry<String, SummaryConstraintMsgs> entry : msg.getSummaryConstraintsMap().entrySet()) {
            summaries.put(entry.getKey(), SummaryConstraints.fromProtobuf(entry.getValue()));
        }
        return new DatasetConstraints(msg.getProperties(), values, summaries);
    }

    public byte[] toByteArray() {
        return toProtobuf().toByteArray();
    }

    public static DatasetConstraints parseFrom(byte[] bytes) {
        try {
            return fromProtobuf(DatasetConstraintMsg.parseFrom(bytes));
        } catch (InvalidProtocolBufferException e) {
            throw new ConstraintFormatException("Unable to decode dataset constraints", e);
        }
    }

    public String toJson() {
        try {
            return JsonFormat.printer().print(toProtobuf());
        } catch (InvalidProtocolBufferException e) {
            throw new ConstraintFormatException("Unable to encode dataset constraints as JSON", e);
        }
    }

    public static DatasetConstraints fromJson(String json) {
        DatasetConstraintMsg.Builder msg = DatasetConstraintMsg.newBuilder();
        try {
            JsonFormat.parser().merge(json, msg);
        } catch (InvalidProtocolBufferException e) {
            throw new ConstraintFormatException("Unable to parse dataset constraints JSON", e);
        }
        log.debug("Parsed dataset constraints for {} value and {} summary columns",
                msg.getValueConstraintsCount(), msg.getSummaryConstraintsCount());
        return fromProtobuf(msg.build());
    }
}
