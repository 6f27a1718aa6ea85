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

package org.apache.meridian.data;

import org.apache.meridian.memory.MemorySegment;
import org.apache.meridian.utils.MathUtils;

import java.io.EOFException;
import java.util.List;

/**
 * 随机访问输入视图,用于在内存段列表上按绝对位置读取。
 *
 * <h2>位置计算</h2>
 *
 * <p>段大小必须是 2 的幂,因此绝对位置可以用位运算拆分:
 *
 * <ul>
 *   <li>段索引 = position >>> segmentSizeBits
 *   <li>段内偏移 = position & segmentSizeMask
 * </ul>
 *
 * <p>段列表可以在视图创建之后继续增长(排序缓冲区边写边比较),视图每次定位时都会重新读取列表。
 * 首次读取前必须先调用 {@link #setReadPosition(long)}。
 */
public class RandomAccessInputView extends AbstractPagedInputView {

    private final List<MemorySegment> segments;

    private final int segmentSizeBits;

    private final int segmentSizeMask;

    private final int segmentSize;

    private final int limitInLastSegment;

    private int currentSegmentIndex;

    public RandomAccessInputView(List<MemorySegment> segments, int segmentSize) {
        this(segments, segmentSize, segmentSize);
    }

    /**
     * @param segments 内存段列表
     * @param segmentSize 段大小(必须是 2 的幂)
     * @param limitInLastSegment 最后一个段的有效长度
     */
    public RandomAccessInputView(
            List<MemorySegment> segments, int segmentSize, int limitInLastSegment) {
        super();
        this.segments = segments;
        this.segmentSize = segmentSize;
        this.segmentSizeBits = MathUtils.log2strict(segmentSize);
        this.segmentSizeMask = segmentSize - 1;
        this.limitInLastSegment = limitInLastSegment;
        this.currentSegmentIndex = -1;
    }

    /** 定位到绝对字节位置。 */
    public void setReadPosition(long position) {
        final int bufferNum = (int) (position >>> this.segmentSizeBits);
        final int offset = (int) (position & this.segmentSizeMask);

        this.currentSegmentIndex = bufferNum;
        seekInput(this.segments.get(bufferNum), offset, limitOf(bufferNum));
    }

    @Override
    protected MemorySegment nextSegment(MemorySegment current) throws EOFException {
        if (++this.currentSegmentIndex < this.segments.size()) {
            return this.segments.get(this.currentSegmentIndex);
        } else {
            throw new EOFException();
        }
    }

    @Override
    protected int getLimitForSegment(MemorySegment segment) {
        return limitOf(currentSegmentIndex);
    }

    private int limitOf(int segmentIndex) {
        return segmentIndex < this.segments.size() - 1 ? this.segmentSize : this.limitInLastSegment;
    }
}
