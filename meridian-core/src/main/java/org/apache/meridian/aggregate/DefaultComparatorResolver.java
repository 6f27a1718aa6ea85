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

package org.apache.meridian.aggregate;

import org.apache.meridian.data.BinaryString;
import org.apache.meridian.data.Decimal;
import org.apache.meridian.data.Timestamp;
import org.apache.meridian.types.DataType;
import org.apache.meridian.types.DataTypeRoot;
import org.apache.meridian.types.UnsupportedTypeException;

import java.util.Comparator;

/**
 * 默认的比较器绑定。
 *
 * <p>数值按大小比较,FLOAT / DOUBLE 使用 {@link Float#compare} / {@link Double#compare} 的全序(NaN 最大,-0.0 小于 0.0)。
 * 文本固定使用 {@link Collation#BINARY},二进制串按无符号字节的字典序。ARRAY、MULTISET、MAP 没有全序。
 */
public class DefaultComparatorResolver implements ComparatorResolver {

    public static final DefaultComparatorResolver INSTANCE = new DefaultComparatorResolver();

    @Override
    @SuppressWarnings("unchecked")
    public <T> ValueComparator<T> resolve(DataType type) {
        Comparator<?> comparator = createComparator(type);
        Collation collation =
                type.isAnyOf(DataTypeRoot.CHAR, DataTypeRoot.VARCHAR)
                        ? Collation.BINARY
                        : Collation.NONE;
        return new ValueComparator<>(type, collation, (Comparator<T>) comparator);
    }

    private static Comparator<?> createComparator(DataType type) {
        switch (type.getTypeRoot()) {
            case BOOLEAN:
                return (Comparator<Boolean>) Boolean::compare;
            case TINYINT:
                return (Comparator<Byte>) Byte::compare;
            case SMALLINT:
                return (Comparator<Short>) Short::compare;
            case INTEGER:
            case DATE:
            case TIME_WITHOUT_TIME_ZONE:
                return (Comparator<Integer>) Integer::compare;
            case BIGINT:
                return (Comparator<Long>) Long::compare;
            case FLOAT:
                return (Comparator<Float>) Float::compare;
            case DOUBLE:
                return (Comparator<Double>) Double::compare;
            case DECIMAL:
                return (Comparator<Decimal>) Decimal::compareTo;
            case TIMESTAMP_WITHOUT_TIME_ZONE:
                return (Comparator<Timestamp>) Timestamp::compareTo;
            case CHAR:
            case VARCHAR:
                return (Comparator<BinaryString>) BinaryString::compareTo;
            case BINARY:
            case VARBINARY:
                return (Comparator<byte[]>) BinaryString::compareBytes;
            default:
                throw new UnsupportedTypeException(
                        type, "Type '" + type + "' has no total order and cannot be sorted.");
        }
    }
}
