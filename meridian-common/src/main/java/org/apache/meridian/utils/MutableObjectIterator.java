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

package org.apache.meridian.utils;

import javax.annotation.Nullable;

import java.io.IOException;

/**
 * 以 null 结尾的简化迭代器。
 *
 * <p>与 {@link java.util.Iterator} 不同,没有单独的 {@code hasNext()}:{@link #next()} 返回 null
 * 表示迭代结束,并允许抛出 {@link IOException}。溢写文件的顺序读取和多路归并都以此接口串联。
 *
 * @param <E> 元素类型
 */
public interface MutableObjectIterator<E> {

    /**
     * 获取下一个元素。
     *
     * @return 下一个元素,迭代结束时返回 null
     * @throws IOException 底层读取失败
     */
    @Nullable
    E next() throws IOException;
}
