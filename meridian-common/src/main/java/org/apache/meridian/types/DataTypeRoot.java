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

/**
 * 数据类型的根,不带参数(长度、精度、可空性)的类型标识。
 *
 * <p>比较器解析与序列化器工厂都以根为分派依据。{@link #ARRAY}、{@link #MULTISET} 和 {@link #MAP}
 * 这类构造类型没有全序,不能作为中位数的输入。
 */
@Public
public enum DataTypeRoot {
    CHAR,

    VARCHAR,

    BOOLEAN,

    BINARY,

    VARBINARY,

    DECIMAL,

    TINYINT,

    SMALLINT,

    INTEGER,

    BIGINT,

    FLOAT,

    DOUBLE,

    DATE,

    TIME_WITHOUT_TIME_ZONE,

    TIMESTAMP_WITHOUT_TIME_ZONE,

    ARRAY,

    MULTISET,

    MAP
}
