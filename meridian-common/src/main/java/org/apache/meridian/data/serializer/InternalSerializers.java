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

import org.apache.meridian.types.DataType;
import org.apache.meridian.types.DecimalType;
import org.apache.meridian.types.UnsupportedTypeException;

/**
 * 根据 {@link DataType} 创建内部数据结构的序列化器。
 *
 * <p>类型与内部表示的对应关系:
 *
 * <ul>
 *   <li>CHAR / VARCHAR: {@link org.apache.meridian.data.BinaryString}
 *   <li>BINARY / VARBINARY: byte[]
 *   <li>DECIMAL: {@link org.apache.meridian.data.Decimal}
 *   <li>DATE / TIME: Integer
 *   <li>TIMESTAMP: {@link org.apache.meridian.data.Timestamp}
 *   <li>其余数值与布尔类型: 对应的 Java 包装类
 * </ul>
 */
public final class InternalSerializers {

    /**
     * 为给定类型创建序列化器。
     *
     * @throws UnsupportedTypeException 类型没有内部序列化格式(如 ARRAY / MAP)
     */
    @SuppressWarnings("unchecked")
    public static <T> Serializer<T> create(DataType type) {
        return (Serializer<T>) createInternal(type);
    }

    private static Serializer<?> createInternal(DataType type) {
        switch (type.getTypeRoot()) {
            case CHAR:
            case VARCHAR:
                return BinaryStringSerializer.INSTANCE;
            case BOOLEAN:
                return BooleanSerializer.INSTANCE;
            case BINARY:
            case VARBINARY:
                return BinarySerializer.INSTANCE;
            case DECIMAL:
                DecimalType decimalType = (DecimalType) type;
                return new DecimalSerializer(decimalType.getPrecision(), decimalType.getScale());
            case TINYINT:
                return ByteSerializer.INSTANCE;
            case SMALLINT:
                return ShortSerializer.INSTANCE;
            case INTEGER:
            case DATE:
            case TIME_WITHOUT_TIME_ZONE:
                return IntSerializer.INSTANCE;
            case BIGINT:
                return LongSerializer.INSTANCE;
            case FLOAT:
                return FloatSerializer.INSTANCE;
            case DOUBLE:
                return DoubleSerializer.INSTANCE;
            case TIMESTAMP_WITHOUT_TIME_ZONE:
                return TimestampSerializer.INSTANCE;
            default:
                throw new UnsupportedTypeException(
                        type, "Unsupported type '" + type + "' to get internal serializer");
        }
    }

    private InternalSerializers() {}
}
