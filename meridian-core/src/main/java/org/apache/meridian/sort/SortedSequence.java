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

package org.apache.meridian.sort;

import java.io.IOException;
import java.util.NoSuchElementException;

/**
 * 只能向前读取的有序序列。
 *
 * @param <T> 元素类型
 */
public interface SortedSequence<T> {

    /**
     * 丢弃接下来的 {@code n} 个元素。
     *
     * @throws IllegalArgumentException {@code n} 为负
     * @throws SequenceOutOfRangeException 剩余元素不足 {@code n} 个
     */
    void skip(long n) throws IOException;

    /**
     * 返回下一个元素。
     *
     * @throws NoSuchElementException 没有剩余元素
     */
    T next() throws IOException;

    boolean hasNext();

    /** 剩余的元素数量。 */
    long remaining();
}
