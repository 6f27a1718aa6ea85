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

import org.apache.meridian.data.AbstractPagedOutputView;
import org.apache.meridian.data.RandomAccessInputView;
import org.apache.meridian.data.SimpleCollectingOutputView;
import org.apache.meridian.data.serializer.Serializer;
import org.apache.meridian.memory.MemorySegment;
import org.apache.meridian.memory.MemorySegmentPool;
import org.apache.meridian.utils.MutableObjectIterator;

import javax.annotation.Nullable;

import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;

import static org.apache.meridian.utils.Preconditions.checkArgument;

/**
 * 基于分页内存的排序缓冲区。
 *
 * <p>值按序列化形式连续写入记录页;另有一组索引页,每个值一个定长索引项(8 字节记录偏移 + 4 字节记录长度)。排序只交换索引项,
 * 比较时按偏移反序列化两条记录再交给比较器。记录页和索引页都从同一个 {@link MemorySegmentPool} 申请,任何一种申请失败都意味着缓冲区已满。
 *
 * @param <T> 值类型
 */
public class InMemorySortBuffer<T> implements IndexedSortable {

    private static final int MIN_REQUIRED_BUFFERS = 3;

    private static final int OFFSET_LEN = 8;

    private static final int LENGTH_LEN = 4;

    private static final int INDEX_ENTRY_SIZE = OFFSET_LEN + LENGTH_LEN;

    private final Serializer<T> serializer;
    private final Serializer<T> serializer1;
    private final Serializer<T> serializer2;
    private final Comparator<T> comparator;

    private final MemorySegmentPool memorySegmentPool;
    private final ArrayList<MemorySegment> recordBufferSegments;
    private final ArrayList<MemorySegment> sortIndex;

    private final RandomAccessInputView recordBuffer;
    private final RandomAccessInputView recordBufferForComparison;

    private final int indexEntriesPerSegment;
    private final int lastIndexEntryOffset;

    @Nullable private SimpleCollectingOutputView recordCollector;
    private MemorySegment currentSortIndexSegment;
    private int currentSortIndexOffset;
    private long currentDataBufferOffset;
    private long sortIndexBytes;
    private int numRecords;
    private boolean isInitialized;

    public InMemorySortBuffer(
            Serializer<T> serializer, Comparator<T> comparator, MemorySegmentPool memoryPool) {
        checkArgument(
                memoryPool.freePages() >= MIN_REQUIRED_BUFFERS,
                "Sort buffer needs at least %s pages, but only %s are available.",
                MIN_REQUIRED_BUFFERS,
                memoryPool.freePages());
        int segmentSize = memoryPool.pageSize();
        checkArgument(
                segmentSize >= INDEX_ENTRY_SIZE, "Page size %s is too small.", segmentSize);

        this.serializer = serializer;
        this.serializer1 = serializer.duplicate();
        this.serializer2 = serializer.duplicate();
        this.comparator = comparator;
        this.memorySegmentPool = memoryPool;
        this.recordBufferSegments = new ArrayList<>(16);
        this.sortIndex = new ArrayList<>(16);
        this.recordBuffer = new RandomAccessInputView(recordBufferSegments, segmentSize);
        this.recordBufferForComparison =
                new RandomAccessInputView(recordBufferSegments, segmentSize);

        this.indexEntriesPerSegment = segmentSize / INDEX_ENTRY_SIZE;
        this.lastIndexEntryOffset = (indexEntriesPerSegment - 1) * INDEX_ENTRY_SIZE;
        this.isInitialized = false;
    }

    // -------------------------------------------------------------------------
    // Memory Segment
    // -------------------------------------------------------------------------

    private void tryInitialize() {
        if (!isInitialized) {
            // first index page, then first record page
            this.currentSortIndexSegment = memorySegmentPool.nextSegment();
            this.sortIndex.add(this.currentSortIndexSegment);
            this.recordCollector =
                    new SimpleCollectingOutputView(
                            recordBufferSegments, memorySegmentPool, memorySegmentPool.pageSize());
            this.isInitialized = true;
        }
    }

    private boolean checkNextIndexOffset() {
        if (this.currentSortIndexOffset > this.lastIndexEntryOffset) {
            MemorySegment returnSegment = memorySegmentPool.nextSegment();
            if (returnSegment != null) {
                this.currentSortIndexSegment = returnSegment;
                this.sortIndex.add(this.currentSortIndexSegment);
                this.currentSortIndexOffset = 0;
            } else {
                return false;
            }
        }
        return true;
    }

    /** 清空缓冲区并把所有页还给内存池。 */
    public void clear() {
        if (this.isInitialized) {
            this.numRecords = 0;
            this.currentSortIndexOffset = 0;
            this.currentDataBufferOffset = 0;
            this.sortIndexBytes = 0;

            this.memorySegmentPool.returnAll(this.sortIndex);
            this.memorySegmentPool.returnAll(this.recordBufferSegments);
            this.sortIndex.clear();
            this.recordBufferSegments.clear();
            this.currentSortIndexSegment = null;
            this.recordCollector = null;
            this.isInitialized = false;
        }
    }

    /** 已占用的字节数,包括记录和索引。 */
    public long getOccupancy() {
        return this.currentDataBufferOffset + this.sortIndexBytes;
    }

    public boolean isEmpty() {
        return this.numRecords == 0;
    }

    /**
     * 写入一个值。
     *
     * @return 缓冲区已满时返回 false,此时缓冲区内容不变
     */
    public boolean write(T value) throws IOException {
        tryInitialize();

        if (!checkNextIndexOffset()) {
            return false;
        }

        try {
            this.serializer.serialize(value, this.recordCollector);
        } catch (EOFException e) {
            // bytes written past the last indexed record are unreachable and dropped on clear
            return false;
        }

        final long newOffset = this.recordCollector.getCurrentOffset();
        final long currOffset = this.currentDataBufferOffset;
        final long length = newOffset - currOffset;
        if (length > Integer.MAX_VALUE) {
            throw new IOException("Serialized value of " + length + " bytes is too large.");
        }

        this.currentSortIndexSegment.putLong(this.currentSortIndexOffset, currOffset);
        this.currentSortIndexSegment.putInt(
                this.currentSortIndexOffset + OFFSET_LEN, (int) length);
        this.currentSortIndexOffset += INDEX_ENTRY_SIZE;
        this.numRecords++;

        this.sortIndexBytes += INDEX_ENTRY_SIZE;
        this.currentDataBufferOffset = newOffset;
        return true;
    }

    // -------------------------------------------------------------------------
    // Sorting
    // -------------------------------------------------------------------------

    @Override
    public int compare(int i, int j) {
        final MemorySegment segI = this.sortIndex.get(i / this.indexEntriesPerSegment);
        final int offsetI = (i % this.indexEntriesPerSegment) * INDEX_ENTRY_SIZE;
        final MemorySegment segJ = this.sortIndex.get(j / this.indexEntriesPerSegment);
        final int offsetJ = (j % this.indexEntriesPerSegment) * INDEX_ENTRY_SIZE;

        this.recordBuffer.setReadPosition(segI.getLong(offsetI));
        this.recordBufferForComparison.setReadPosition(segJ.getLong(offsetJ));
        try {
            return this.comparator.compare(
                    serializer1.deserialize(recordBuffer),
                    serializer2.deserialize(recordBufferForComparison));
        } catch (IOException ioex) {
            throw new RuntimeException("Error comparing two records.", ioex);
        }
    }

    @Override
    public void swap(int i, int j) {
        final MemorySegment segI = this.sortIndex.get(i / this.indexEntriesPerSegment);
        final int offsetI = (i % this.indexEntriesPerSegment) * INDEX_ENTRY_SIZE;
        final MemorySegment segJ = this.sortIndex.get(j / this.indexEntriesPerSegment);
        final int offsetJ = (j % this.indexEntriesPerSegment) * INDEX_ENTRY_SIZE;

        long pointer = segI.getLong(offsetI);
        int length = segI.getInt(offsetI + OFFSET_LEN);
        segI.putLong(offsetI, segJ.getLong(offsetJ));
        segI.putInt(offsetI + OFFSET_LEN, segJ.getInt(offsetJ + OFFSET_LEN));
        segJ.putLong(offsetJ, pointer);
        segJ.putInt(offsetJ + OFFSET_LEN, length);
    }

    @Override
    public int size() {
        return this.numRecords;
    }

    /** 按索引顺序把记录的原始字节复制到输出,不做反序列化。 */
    public void writeToOutput(AbstractPagedOutputView output) throws IOException {
        final int numRecords = this.numRecords;
        int currentMemSeg = 0;
        int currentRecord = 0;

        while (currentRecord < numRecords) {
            final MemorySegment currentIndexSegment = this.sortIndex.get(currentMemSeg++);

            for (int offset = 0;
                    currentRecord < numRecords && offset <= this.lastIndexEntryOffset;
                    currentRecord++, offset += INDEX_ENTRY_SIZE) {
                this.recordBuffer.setReadPosition(currentIndexSegment.getLong(offset));
                output.write(this.recordBuffer, currentIndexSegment.getInt(offset + OFFSET_LEN));
            }
        }
    }

    /** 先原地排序,再返回按顺序读取的迭代器。 */
    public IndexIterator sortedIterator() {
        if (numRecords > 1) {
            new QuickSort().sort(this);
        }
        return new IndexIterator();
    }

    /** 按当前索引顺序读取值的迭代器,支持不反序列化地跳过。 */
    public final class IndexIterator implements MutableObjectIterator<T> {

        private final int size = numRecords;
        private int current = 0;

        private IndexIterator() {}

        @Override
        public T next() throws IOException {
            if (current < size) {
                final MemorySegment segment = sortIndex.get(current / indexEntriesPerSegment);
                final int offset = (current % indexEntriesPerSegment) * INDEX_ENTRY_SIZE;
                current++;
                recordBuffer.setReadPosition(segment.getLong(offset));
                return serializer.deserialize(recordBuffer);
            } else {
                return null;
            }
        }

        /** 跳过 n 个值,超出剩余数量时停在末尾。 */
        public void skip(int n) {
            current = (int) Math.min((long) current + n, size);
        }

        public int remaining() {
            return size - current;
        }
    }
}
