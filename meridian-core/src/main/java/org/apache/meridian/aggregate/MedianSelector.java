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

import org.apache.meridian.sort.SortedSequence;

import java.io.IOException;

import static org.apache.meridian.utils.Preconditions.checkArgument;

/**
 * 从有序序列中取中位数。
 *
 * <p>取下标 {@code count / 2}(从 0 开始)的元素:奇数个时是正中间的元素,偶数个时是两个中间元素中较大的一个,不做平均。
 */
public final class MedianSelector {

    /**
     * @param sequence 升序序列,尚未读取过
     * @param count 序列中的元素数量,至少为 1
     * @throws IllegalStateException 目标位置上没有值
     */
    public static <T> T select(SortedSequence<T> sequence, long count) throws IOException {
        checkArgument(count >= 1, "Median of %s values is undefined.", count);
        long pos = medianPosition(count);
        sequence.skip(pos);
        T value = sequence.next();
        if (value == null) {
            throw new IllegalStateException(
                    "Missing value at median position " + pos + " of " + count + " values.");
        }
        return value;
    }

    public static long medianPosition(long count) {
        return count / 2;
    }

    private MedianSelector() {}
}
