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

package org.fireflyframework.constraints.value;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.constraints.ConstraintReport;
import org.fireflyframework.constraints.exception.IncompatibleMergeException;
import org.fireflyframework.constraints.proto.ValueConstraintMsg;
import org.fireflyframework.constraints.proto.ValueConstraintMsgs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named value constraints of one column.
 *
 * <p>Names are unique. When built from a list, a constraint whose name is
 * already taken replaces the earlier one, so the last constraint wins.</p>
 */
@Slf4j
public class ValueConstraints {

    private final Map<String, ValueConstraint> constraints;

    public ValueConstraints() {
        this.constraints = new LinkedHashMap<>();
    }

    public ValueConstraints(List<ValueConstraint> constraints) {
        this.constraints = new LinkedHashMap<>();
        for (ValueConstraint constraint : constraints) {
            ValueConstraint replaced = this.constraints.put(constraint.getName(), constraint);
            if (replaced != null) {
                log.debug("Value constraint '{}' replaces an earlier constraint with the same name", constraint.getName());
            }
        }
    }

    public ValueConstraints(Map<String, ValueConstraint> constraints) {
        this.constraints = new LinkedHashMap<>(constraints);
    }

    public Optional<ValueConstraint> get(String name) {
        return Optional.ofNullable(constraints.get(name));
    }

    public Map<String, ValueConstraint> getConstraints() {
        return Collections.unmodifiableMap(constraints);
    }

    public int size() {
        return constraints.size();
    }

    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    /**
     * Evaluates every constraint against the value; none is skipped when another fails.
     */
    public void update(Object value) {
        for (ValueConstraint constraint : constraints.values()) {
            constraint.update(value);
        }
    }

    /**
     * Merges every constraint with its same-named counterpart.
     *
     * @param other the collection to merge in, may be {@code null}
     * @return a new collection, or this one when {@code other} is {@code null}
     * @throws IncompatibleMergeException if the two collections do not hold the same names,
     *                                    or same-named constraints differ
     */
    public ValueConstraints merge(ValueConstraints other) {
        if (other == null) {
            return this;
        }
        if (!constraints.keySet().equals(other.constraints.keySet())) {
            throw new IncompatibleMergeException("Cannot merge value constraints with different names: missing "
                    + missing(constraints.keySet(), other.constraints.keySet()) + " on one side and "
                    + missing(other.constraints.keySet(), constraints.keySet()) + " on the other");
        }
        Map<String, ValueConstraint> merged = new LinkedHashMap<>();
        for (Map.Entry<String, ValueConstraint> entry : constraints.entrySet()) {
            merged.put(entry.getKey(), entry.getValue().merge(other.constraints.get(entry.getKey())));
        }
        return new ValueConstraints(merged);
    }

    static Set<String> missing(Set<String> expected, Set<String> actual) {
        Set<String> result = new LinkedHashSet<>(actual);
        result.removeAll(expected);
        return result;
    }

    /**
     * Reports every constraint in insertion order.
     *
     * @return the reports, or empty when the collection holds no constraint
     */
    public Optional<List<ConstraintReport>> report() {
        if (constraints.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(constraints.values().stream()
                .map(ValueConstraint::report)
                .toList());
    }

    public ValueConstraintMsgs toProtobuf() {
        ValueConstraintMsgs.Builder msgs = ValueConstraintMsgs.newBuilder();
        for (ValueConstraint constraint : constraints.values()) {
            msgs.addConstraints(constraint.toProtobuf());
        }
        return msgs.build();
    }

    public static ValueConstraints fromProtobuf(ValueConstraintMsgs msgs) {
        Map<String, ValueConstraint> constraints = new LinkedHashMap<>();
        for (ValueConstraintMsg msg : msgs.getConstraintsList()) {
            ValueConstraint constraint = ValueConstraint.fromProtobuf(msg);
            constraints.put(constraint.getName(), constraint);
        }
        return new ValueConstraints(constraints);
    }
}
