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

import org.apache.meridian.annotation.Public;
import org.apache.meridian.types.DataType;
import org.apache.meridian.types.UnsupportedTypeException;

/** 为值类型查找全序比较器。实现必须没有副作用,同一类型总是得到相同的顺序。 */
@Public
public interface ComparatorResolver {

    /**
     * @throws UnsupportedTypeException 类型没有全序
     */
    <T> ValueComparator<T> resolve(DataType type);
}
