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

package org.apache.meridian.types;

import org.apache.meridian.annotation.Public;

import java.util.Objects;

import static org.apache.meridian.utils.Preconditions.checkNotNull;

/** 多重集合类型。元素之间没有定义全序,不能用于排序。 */
@Public
public class MultisetType extends DataType {

    private static final long serialVersionUID = 1L;

    private static final String FORMAT = "MULTISET<%s>";

    private final DataType elementType;

    public MultisetType(boolean isNullable, DataType elementType) {
        super(isNullable, DataTypeRoot.MULTISET);
        this.elementType = checkNotNull(elementType, "Element type must not be null.");
    }

    public MultisetType(DataType elementType) {
        this(true, elementType);
    }

    @Override
    public String asSQLString() {
        return withNullability(FORMAT, elementType.asSQLString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        if (!super.equals(o)) {
            return false;
        }
        MultisetType that = (MultisetType) o;
        return elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), elementType);
    }
}
