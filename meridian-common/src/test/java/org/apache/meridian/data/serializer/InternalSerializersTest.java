/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.meridian.data.serializer;

import org.apache.meridian.data.BinaryString;
import org.apache.meridian.data.Decimal;
import org.apache.meridian.data.Timestamp;
import org.apache.meridian.types.DataTypes;
import org.apache.meridian.types.UnsupportedTypeException;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link InternalSerializers}. */
public class InternalSerializersTest {

    @Test
    public void testPrimitiveTypes() throws Exception {
        Serializer<Integer> ints = InternalSerializers.create(DataTypes.INT());
        assertThat(ints.deserializeFromBytes(ints.serializeToBytes(-42))).isEqualTo(-42);
        assertThat(ints.serializeToBytes(1)).hasSize(4);

        Serializer<Long> longs = InternalSerializers.create(DataTypes.BIGINT());
        assertThat(longs.deserializeFromBytes(longs.serializeToBytes(Long.MIN_VALUE)))
                .isEqualTo(Long.MIN_VALUE);

        Serializer<Double> doubles = InternalSerializers.create(DataTypes.DOUBLE());
        assertThat(doubles.deserializeFromBytes(doubles.serializeToBytes(Double.NaN))).isNaN();

        // DATE and TIME are carried as int
        assertThat(InternalSerializers.<Integer>create(DataTypes.DATE()))
                .isSameAs(IntSerializer.INSTANCE);
        assertThat(InternalSerializers.<Integer>create(DataTypes.TIME()))
                .isSameAs(IntSerializer.INSTANCE);
    }

    @Test
    public void testStringAndBinary() throws Exception {
        Serializer<BinaryString> strings = InternalSerializers.create(DataTypes.STRING());
        BinaryString value = BinaryString.fromString("héllo");
        assertThat(strings.deserializeFromBytes(strings.serializeToBytes(value))).isEqualTo(value);
        assertThat(InternalSerializers.<BinaryString>create(DataTypes.CHAR(3)))
                .isSameAs(strings);

        Serializer<byte[]> bytes = InternalSerializers.create(DataTypes.BYTES());
        assertThat(bytes.deserializeFromBytes(bytes.serializeToBytes(new byte[] {1, -1, 0})))
                .containsExactly(1, -1, 0);
    }

    @Test
    public void testTimestamp() throws Exception {
        Serializer<Timestamp> serializer = InternalSerializers.create(DataTypes.TIMESTAMP());
        Timestamp ts = Timestamp.fromLocalDateTime(LocalDateTime.of(2024, 2, 29, 13, 1, 2, 345));
        assertThat(serializer.deserializeFromBytes(serializer.serializeToBytes(ts))).isEqualTo(ts);
    }

    @Test
    public void testDecimalRescale() throws Exception {
        Serializer<Decimal> compact = InternalSerializers.create(DataTypes.DECIMAL(10, 2));
        Decimal value = Decimal.fromBigDecimal(new BigDecimal("3.1"), 5, 1);
        Decimal read = compact.deserializeFromBytes(compact.serializeToBytes(value));
        assertThat(read.toBigDecimal()).isEqualTo(new BigDecimal("3.10"));
        assertThat(read.precision()).isEqualTo(10);
        assertThat(read.scale()).isEqualTo(2);

        Serializer<Decimal> wide = InternalSerializers.create(DataTypes.DECIMAL(30, 4));
        Decimal big = Decimal.fromBigDecimal(new BigDecimal("12345678901234567890.1234"), 30, 4);
        assertThat(wide.deserializeFromBytes(wide.serializeToBytes(big))).isEqualTo(big);
    }

    @Test
    public void testDecimalOverflow() {
        Serializer<Decimal> serializer = InternalSerializers.create(DataTypes.DECIMAL(3, 1));
        Decimal tooLarge = Decimal.fromBigDecimal(new BigDecimal("12345.6"), 10, 1);
        assertThatThrownBy(() -> serializer.serializeToBytes(tooLarge))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("DECIMAL(3, 1)");
    }

    @Test
    public void testUnsupportedTypes() {
        assertThatThrownBy(() -> InternalSerializers.create(DataTypes.ARRAY(DataTypes.INT())))
                .isInstanceOf(UnsupportedTypeException.class);
        assertThatThrownBy(
                        () ->
                                InternalSerializers.create(
                                        DataTypes.MAP(DataTypes.INT(), DataTypes.INT())))
                .isInstanceOf(UnsupportedTypeException.class);
    }
}
