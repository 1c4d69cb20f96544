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

package org.fireflyframework.constraints.summary;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.constraints.exception.ConstraintConfigurationException;
import org.fireflyframework.constraints.exception.TypeMismatchException;
import org.fireflyframework.constraints.operator.ValueKind;
import org.fireflyframework.constraints.sketch.DistinctValueSketch;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Reference values a set-relation constraint compares the observed distinct
 * values of a column against.
 *
 * <p>Items are normalized on the way in (text to {@link String}, numbers to
 * {@link Double}) and split by {@link ValueKind} into a string subset and a
 * numeric subset. Booleans go to neither subset. A theta sketch is kept for
 * the full set and for each subset.</p>
 *
 * <p>Iteration order is canonical: text sorted, then numbers ascending, then
 * booleans. Equal sets render the same name whatever order they were given in.</p>
 */
@Slf4j
@Getter
public final class ReferenceSet {

    static final int NAME_PREVIEW_SIZE = 20;

    private final Set<Object> items;
    private final Set<String> strings;
    private final Set<Double> numbers;

    private final DistinctValueSketch sketch;
    private final DistinctValueSketch stringSketch;
    private final DistinctValueSketch numberSketch;

    private ReferenceSet(Set<Object> items) {
        Set<String> stringItems = new TreeSet<>();
        Set<Double> numberItems = new TreeSet<>();
        Set<Boolean> booleanItems = new TreeSet<>();
        for (Object item : items) {
            switch (ValueKind.of(item)) {
                case STRING -> stringItems.add((String) item);
                case NUMBER -> numberItems.add((Double) item);
                case BOOLEAN -> booleanItems.add((Boolean) item);
                case OTHER -> throw unsupportedItem(item);
            }
        }
        Set<Object> canonical = new LinkedHashSet<>(stringItems);
        canonical.addAll(numberItems);
        canonical.addAll(booleanItems);
        this.items = Collections.unmodifiableSet(canonical);
        this.strings = Collections.unmodifiableSet(new LinkedHashSet<>(stringItems));
        this.numbers = Collections.unmodifiableSet(new LinkedHashSet<>(numberItems));
        this.sketch = DistinctValueSketch.of(this.items);
        this.stringSketch = DistinctValueSketch.of(this.strings);
        this.numberSketch = DistinctValueSketch.of(this.numbers);
    }

    /**
     * Builds a reference set from a set, a collection, an iterable or an array.
     *
     * @param input the reference values
     * @return the reference set
     * @throws TypeMismatchException            if the input cannot be read as a set
     * @throws ConstraintConfigurationException if the input is missing or empty, or holds {@code null}
     *                                          or an item that is not text, a number or a boolean
     */
    public static ReferenceSet coerce(Object input) {
        if (input == null) {
            throw new ConstraintConfigurationException("When using set operations a non-empty reference set must be provided");
        }
        Iterable<?> source;
        if (input instanceof Set<?>) {
            source = (Set<?>) input;
        } else if (input instanceof Iterable<?>) {
            log.warn("Trying to cast provided value of {} to type set!", input.getClass().getSimpleName());
            source = (Iterable<?>) input;
        } else if (input instanceof Object[]) {
            log.warn("Trying to cast provided value of {} to type set!", input.getClass().getSimpleName());
            source = Arrays.asList((Object[]) input);
        } else {
            throw new TypeMismatchException(input.getClass().getSimpleName());
        }

        Set<Object> normalized = new LinkedHashSet<>();
        for (Object item : source) {
            if (item == null) {
                throw new ConstraintConfigurationException("Reference set must not contain null items");
            }
            normalized.add(normalize(item));
        }
        if (normalized.isEmpty()) {
            throw new ConstraintConfigurationException("When using set operations a non-empty reference set must be provided");
        }
        return new ReferenceSet(normalized);
    }

    public int size() {
        return items.size();
    }

    /**
     * Renders the set for constraint names, listing at most
     * {@value #NAME_PREVIEW_SIZE} items followed by an ellipsis.
     */
    public String render() {
        String preview = items.stream()
                .limit(NAME_PREVIEW_SIZE)
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
        if (items.size() > NAME_PREVIEW_SIZE) {
            return "{" + preview + ", ...}";
        }
        return "{" + preview + "}";
    }

    private static ConstraintConfigurationException unsupportedItem(Object item) {
        return new ConstraintConfigurationException("Reference set items must be text, numbers or booleans, instead type: '"
                + item.getClass().getSimpleName() + "' was provided!");
    }

    private static Object normalize(Object item) {
        return switch (ValueKind.of(item)) {
            case STRING -> item.toString();
            case NUMBER -> ((Number) item).doubleValue();
            case BOOLEAN -> item;
            case OTHER -> throw unsupportedItem(item);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ReferenceSet && items.equals(((ReferenceSet) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return render();
    }
}
