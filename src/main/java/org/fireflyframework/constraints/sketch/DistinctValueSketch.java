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

package org.fireflyframework.constraints.sketch;

import org.apache.datasketches.memory.Memory;
import org.apache.datasketches.theta.AnotB;
import org.apache.datasketches.theta.CompactSketch;
import org.apache.datasketches.theta.SetOperation;
import org.apache.datasketches.theta.Sketch;
import org.apache.datasketches.theta.Sketches;
import org.apache.datasketches.theta.UpdateSketch;
import org.fireflyframework.constraints.operator.ValueKind;

/**
 * Approximate distinct-count sketch backed by an Apache DataSketches theta sketch.
 *
 * <p>Items are hashed by kind so that equal values always land on the same hash:
 * text as UTF-8 strings, numbers as doubles, booleans as {@code 1}/{@code 0}
 * longs, anything else through {@code toString()}. Producers of observed-value
 * sketches must go through {@link #add(Object)} for set relations to line up.</p>
 *
 * <p>A sketch read back from bytes is compact and can no longer be updated.</p>
 */
public final class DistinctValueSketch {

    public static final int DEFAULT_NOMINAL_ENTRIES = 4096;

    private final UpdateSketch updatable;
    private final Sketch sketch;

    private DistinctValueSketch(UpdateSketch updatable) {
        this.updatable = updatable;
        this.sketch = updatable;
    }

    private DistinctValueSketch(CompactSketch compact) {
        this.updatable = null;
        this.sketch = compact;
    }

    public static DistinctValueSketch create() {
        return create(DEFAULT_NOMINAL_ENTRIES);
    }

    public static DistinctValueSketch create(int nominalEntries) {
        if (nominalEntries < 16) {
            throw new IllegalArgumentException("nominalEntries too small");
        }
        return new DistinctValueSketch(UpdateSketch.builder().setNominalEntries(nominalEntries).build());
    }

    /**
     * Creates a sketch holding every item of the given values.
     */
    public static DistinctValueSketch of(Iterable<?> items) {
        DistinctValueSketch result = create();
        for (Object item : items) {
            result.add(item);
        }
        return result;
    }

    public static DistinctValueSketch fromByteArray(byte[] bytes) {
        return new DistinctValueSketch(Sketches.heapifySketch(Memory.wrap(bytes)).compact());
    }

    public DistinctValueSketch add(Object item) {
        if (updatable == null) {
            throw new IllegalStateException("Sketch was read from bytes and cannot be updated");
        }
        if (item == null) {
            return this;
        }
        switch (ValueKind.of(item)) {
            case STRING -> updatable.update(item.toString());
            case NUMBER -> updatable.update(((Number) item).doubleValue());
            case BOOLEAN -> updatable.update((Boolean) item ? 1L : 0L);
            case OTHER -> updatable.update(item.toString());
        }
        return this;
    }

    public double estimate() {
        return sketch.getEstimate();
    }

    public boolean isEmpty() {
        return sketch.isEmpty();
    }

    public byte[] toByteArray() {
        return sketch.compact().toByteArray();
    }

    /**
     * Estimates how many distinct items of {@code a} are not in {@code b}.
     *
     * @param a the sketch to subtract from
     * @param b the sketch to subtract
     * @return the estimated cardinality of {@code a \ b}
     */
    public static double estimateDifference(DistinctValueSketch a, DistinctValueSketch b) {
        AnotB aNotB = SetOperation.builder().buildANotB();
        CompactSketch result = aNotB.aNotB(a.sketch, b.sketch);
        return result.getEstimate();
    }
}
