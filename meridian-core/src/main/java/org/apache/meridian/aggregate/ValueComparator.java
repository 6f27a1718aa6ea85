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

import org.apache.meridian.types.DataType;

import java.util.Comparator;

import static org.apache.meridian.utils.Preconditions.checkNotNull;

/**
 * 绑定到某个 {@link DataType} 的全序比较器。
 *
 * @param <T> 该类型的内部值类型
 */
public final class ValueComparator<T> implements Comparator<T> {

    private final DataType type;
    private final Collation collation;
    private final Comparator<T> comparator;

    public ValueComparator(DataType type, Collation collation, Comparator<T> comparator) {
        this.type = checkNotNull(type);
        this.collation = checkNotNull(collation);
        this.comparator = checkNotNull(comparator);
    }

    @Override
    public int compare(T o1, T o2) {
        return comparator.compare(o1, o2);
    }

    public DataType getType() {
        return type;
    }

    public Collation getCollation() {
        return collation;
    }

    @Override
    public String toString() {
        return "ValueComparator{type=" + type + ", collation=" + collation + '}';
    }
}
