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

import org.apache.meridian.data.Decimal;
import org.apache.meridian.io.DataInputView;
import org.apache.meridian.io.DataOutputView;

import java.io.IOException;

/**
 * {@link Decimal} 的序列化器。
 *
 * <p>精度不超过 18 时只写未缩放的 long,否则写未缩放值的补码字节。小数位数与声明类型不同的值会先被调整到声明的小数位数,
 * 调整后超出精度则拒绝。
 */
public final class DecimalSerializer implements Serializer<Decimal> {

    private static final long serialVersionUID = 1L;

    private final int precision;

    private final int scale;

    public DecimalSerializer(int precision, int scale) {
        this.precision = precision;
        this.scale = scale;
    }

    @Override
    public void serialize(Decimal record, DataOutputView target) throws IOException {
        Decimal value = record;
        if (record.precision() != precision || record.scale() != scale) {
            value = Decimal.fromBigDecimal(record.toBigDecimal(), precision, scale);
            if (value == null) {
                throw new IllegalArgumentException(
                        String.format(
                                "Value %s does not fit into DECIMAL(%d, %d).",
                                record, precision, scale));
            }
        }

        if (Decimal.isCompact(precision)) {
            target.writeLong(value.toUnscaledLong());
        } else {
            BinarySerializer.INSTANCE.serialize(value.toUnscaledBytes(), target);
        }
    }

    @Override
    public Decimal deserialize(DataInputView source) throws IOException {
        if (Decimal.isCompact(precision)) {
            return Decimal.fromUnscaledLong(source.readLong(), precision, scale);
        } else {
            byte[] bytes = BinarySerializer.INSTANCE.deserialize(source);
            return Decimal.fromUnscaledBytes(bytes, precision, scale);
        }
    }

    @Override
    public DecimalSerializer duplicate() {
        return new DecimalSerializer(precision, scale);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DecimalSerializer that = (DecimalSerializer) o;
        return precision == that.precision && scale == that.scale;
    }

    @Override
    public int hashCode() {
        return 31 * precision + scale;
    }
}
