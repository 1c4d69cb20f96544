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
import com.google.protobuf.NullValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import org.fireflyframework.constraints.exception.ConstraintFormatException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ProtoValues}.
 */
class ProtoValuesTest {

    @Test
    void toValue_shouldEncodeSupportedKinds() {
        assertThat(ProtoValues.toValue("abc").getStringValue()).isEqualTo("abc");
        assertThat(ProtoValues.toValue(7).getNumberValue()).isEqualTo(7.0);
        assertThat(ProtoValues.toValue(false).hasBoolValue()).isTrue();
    }

    @Test
    void toValue_unsupportedLiteral_shouldFail() {
        assertThatThrownBy(() -> ProtoValues.toValue(LocalDate.of(2024, 1, 1)))
                .isInstanceOf(ConstraintFormatException.class)
                .hasMessageContaining("LocalDate");
    }

    @Test
    void fromValue_shouldReturnNumbersAsDouble() {
        assertThat(ProtoValues.fromValue(Value.newBuilder().setNumberValue(3).build())).isEqualTo(3.0);
        assertThat(ProtoValues.fromValue(Value.newBuilder().setBoolValue(true).build())).isEqualTo(true);
    }

    @Test
    void fromValue_unsupportedKind_shouldFail() {
        assertThatThrownBy(() -> ProtoValues.fromValue(Value.newBuilder().setNullValue(NullValue.NULL_VALUE).build()))
                .isInstanceOf(ConstraintFormatException.class);
        assertThatThrownBy(() -> ProtoValues.fromValue(Value.newBuilder().setStructValue(Struct.getDefaultInstance()).build()))
                .isInstanceOf(ConstraintFormatException.class);
        assertThatThrownBy(() -> ProtoValues.fromValue(Value.getDefaultInstance()))
                .isInstanceOf(ConstraintFormatException.class);
    }

    @Test
    void listValue_shouldKeepItemOrder() {
        ListValue list = ProtoValues.toListValue(List.of("b", 1, "a"));

        assertThat(ProtoValues.fromListValue(list)).containsExactly("b", 1.0, "a");
    }
}
