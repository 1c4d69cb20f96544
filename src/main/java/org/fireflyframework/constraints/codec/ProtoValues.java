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

package org.fireflyframework.constraints.codec;

import com.google.protobuf.ListValue;
import com.google.protobuf.Value;
import org.fireflyframework.constraints.exception.ConstraintFormatException;
import org.fireflyframework.constraints.operator.ValueKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversion of constraint literals to and from {@code google.protobuf.Value}.
 *
 * <p>Text, numbers and booleans have a wire form. Numbers always come back as
 * {@link Double}.</p>
 */
public final class ProtoValues {

    private ProtoValues() {
    }

    public static Value toValue(Object literal) {
        return switch (ValueKind.of(literal)) {
            case STRING -> Value.newBuilder().setStringValue(literal.toString()).build();
            case NUMBER -> Value.newBuilder().setNumberValue(((Number) literal).doubleValue()).build();
            case BOOLEAN -> Value.newBuilder().setBoolValue((Boolean) literal).build();
            case OTHER -> throw new ConstraintFormatException("Literal of type '"
                    + (literal == null ? "null" : literal.getClass().getSimpleName())
                    + "' has no wire representation");
        };
    }

    public static Object fromValue(Value value) {
        return switch (value.getKindCase()) {
            case NUMBER_VALUE -> value.getNumberValue();
            case STRING_VALUE -> value.getStringValue();
            case BOOL_VALUE -> value.getBoolValue();
            case NULL_VALUE, STRUCT_VALUE, LIST_VALUE, KIND_NOT_SET ->
                    throw new ConstraintFormatException("Unsupported literal kind: " + value.getKindCase());
        };
    }

    public static ListValue toListValue(Iterable<?> items) {
        ListValue.Builder builder = ListValue.newBuilder();
        for (Object item : items) {
            builder.addValues(toValue(item));
        }
        return builder.build();
    }

    public static List<Object> fromListValue(ListValue listValue) {
        List<Object> items = new ArrayList<>(listValue.getValuesCount());
        for (Value value : listValue.getValuesList()) {
            items.add(fromValue(value));
        }
        return items;
    }
}
