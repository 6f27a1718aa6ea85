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

import org.apache.meridian.annotation.VisibleForTesting;
import org.apache.meridian.compression.BlockCompressionFactory;
import org.apache.meridian.compression.CompressOptions;
import org.apache.meridian.data.serializer.Serializer;
import org.apache.meridian.disk.ChannelWithMeta;
import org.apache.meridian.disk.ChannelWriterOutputView;
import org.apache.meridian.disk.FileChannelUtil;
import org.apache.meridian.disk.FileIOChannel;
import org.apache.meridian.disk.IOManager;
import org.apache.meridian.memory.HeapMemorySegmentPool;
import org.apache.meridian.memory.MemorySegmentPool;
import org.apache.meridian.options.MemorySize;
import org.apache.meridian.utils.MutableObjectIterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.apache.meridian.utils.Preconditions.checkArgument;
import static org.apache.meridian.utils.Preconditions.checkNotNull;
import static org.apache.meridian.utils.Preconditions.checkState;

/**
 * 可溢写的外部排序器。
 *
 * <p>写入阶段值进入 {@link InMemorySortBuffer};内存页用完时把缓冲区排序后写成一个溢写段并清空缓冲区。溢写段数量达到
 * {@code maxNumFileHandles} 时先做一次中间归并。{@link #sort()} 之后:没有发生过溢写则直接读内存中的有序索引,否则把剩余的缓冲区也溢写,
 * 再用 {@link MergeIterator} 对全部段做多路归并,按需逐个产出。
 *
 * <p>状态转换:{@link SortState#ACCEPTING} → {@link SortState#SORTED} → {@link SortState#CLOSED},任何状态都可以直接关闭。
 * 一个排序器只由一个线程使用。
 *
 * @param <T> 值类型
 */
public class ExternalSorter<T> implements SortedSequence<T>, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ExternalSorter.class);

    /** 内存排序缓冲区 */
    private final InMemorySortBuffer<T> inMemorySortBuffer;
    /** IO管理器 */
    private final IOManager ioManager;
    /** 溢写通道管理器 */
    private final SpillChannelManager channelManager;
    /** 最大文件句柄数,也是归并的扇入上限 */
    private final int maxNumFileHandles;
    /** 压缩编解码工厂 */
    private final BlockCompressionFactory compressionCodecFactory;
    /** 压缩块大小 */
    private final int compressionBlockSize;
    /** 外部归并器 */
    private final ExternalMerger<T> merger;

    /** 文件通道枚举器 */
    private final FileIOChannel.Enumerator enumerator;
    /** 已溢写的有序段 */
    private final List<ChannelWithMeta> spillChannelIDs;
    /** 溢写段占用磁盘的上限 */
    private final MemorySize maxDiskSize;

    /** 当前状态 */
    private SortState state;
    /** 写入的值的总数 */
    private long numRecords;
    /** 排序后已跳过或读取的值的数量 */
    private long numConsumed;

    /** 有溢写时的归并迭代器 */
    @Nullable private MutableObjectIterator<T> sortedIterator;

    /** 没有溢写时指向内存中的有序索引,可以不反序列化地跳过。 */
    @Nullable private InMemorySortBuffer<T>.IndexIterator memoryIterator;

    /**
     * 构造外部排序器。
     *
     * @param serializer 值序列化器
     * @param comparator 值比较器,必须是全序
     * @param pool 内存排序缓冲区使用的内存池
     * @param ioManager IO管理器
     * @param maxNumFileHandles 最大文件句柄数,至少为 2
     * @param compression 溢写压缩选项
     * @param compressionBlockSize 压缩块大小
     * @param maxDiskSize 最大磁盘大小
     */
    public ExternalSorter(
            Serializer<T> serializer,
            Comparator<T> comparator,
            MemorySegmentPool pool,
            IOManager ioManager,
            int maxNumFileHandles,
            CompressOptions compression,
            int compressionBlockSize,
            MemorySize maxDiskSize) {
        checkArgument(
                maxNumFileHandles >= 2,
                "Max number of file handles must be at least 2, but is %s.",
                maxNumFileHandles);
        checkArgument(
                compressionBlockSize > 0,
                "Compression block size must be positive, but is %s.",
                compressionBlockSize);
        this.inMemorySortBuffer =
                new InMemorySortBuffer<>(serializer.duplicate(), comparator, pool);
        this.ioManager = ioManager;
        this.channelManager = new SpillChannelManager();
        this.maxNumFileHandles = maxNumFileHandles;
        this.compressionCodecFactory = BlockCompressionFactory.create(compression);
        this.compressionBlockSize = compressionBlockSize;
        this.maxDiskSize = checkNotNull(maxDiskSize);
        this.merger =
                new ExternalMerger<>(
                        ioManager,
                        maxNumFileHandles,
                        channelManager,
                        serializer.duplicate(),
                        comparator,
                        compressionCodecFactory,
                        compressionBlockSize);
        this.enumerator = ioManager.createChannelEnumerator();
        this.spillChannelIDs = new ArrayList<>();
        this.state = SortState.ACCEPTING;
    }

    /**
     * 创建使用 {@link HeapMemorySegmentPool} 的外部排序器。
     *
     * @param bufferSize 内存缓冲区大小,包括排序索引
     * @param pageSize 页大小
     */
    public static <T> ExternalSorter<T> create(
            Serializer<T> serializer,
            Comparator<T> comparator,
            IOManager ioManager,
            long bufferSize,
            int pageSize,
            int maxNumFileHandles,
            CompressOptions compression,
            int compressionBlockSize,
            MemorySize maxDiskSize) {
        return new ExternalSorter<>(
                serializer,
                comparator,
                new HeapMemorySegmentPool(bufferSize, pageSize),
                ioManager,
                maxNumFileHandles,
                compression,
                compressionBlockSize,
                maxDiskSize);
    }

    // ------------------------------------------------------------------------
    //  Writing
    // ------------------------------------------------------------------------

    /**
     * 写入一个值,缓冲区满时先溢写。
     *
     * @throws IOException 溢写失败、超过磁盘配额,或者单个值比整个空缓冲区还大
     */
    public void insert(T value) throws IOException {
        checkNotNull(value, "Sorter does not accept null values.");
        checkState(state == SortState.ACCEPTING, "Cannot insert into a sorter in state %s.", state);

        while (true) {
            if (inMemorySortBuffer.write(value)) {
                this.numRecords++;
                return;
            }

            if (inMemorySortBuffer.isEmpty()) {
                // did not fit in a fresh buffer, must be large...
                throw new IOException("The value exceeds the maximum size of a sort buffer.");
            }

            spill();

            if (spillChannelIDs.size() >= maxNumFileHandles) {
                List<ChannelWithMeta> merged = merger.mergeChannelList(spillChannelIDs);
                spillChannelIDs.clear();
                spillChannelIDs.addAll(merged);
            }
        }
    }

    private void spill() throws IOException {
        if (inMemorySortBuffer.isEmpty()) {
            return;
        }

        long diskUsage = getDiskUsage();
        if (diskUsage >= maxDiskSize.getBytes()) {
            throw new IOException(
                    String.format(
                            "Spilled runs occupy %s bytes, which exceeds maximum disk size %s.",
                            diskUsage, maxDiskSize));
        }

        // open next channel
        FileIOChannel.ID channel = enumerator.next();
        channelManager.addChannel(channel);

        ChannelWriterOutputView output = null;
        int numValues = inMemorySortBuffer.size();
        try {
            output =
                    FileChannelUtil.createOutputView(
                            ioManager, channel, compressionCodecFactory, compressionBlockSize);
            new QuickSort().sort(inMemorySortBuffer);
            inMemorySortBuffer.writeToOutput(output);
            output.close();
        } catch (IOException e) {
            if (output != null) {
                output.closeAndDelete();
                channelManager.removeChannel(channel);
            }
            throw e;
        }

        spillChannelIDs.add(
                new ChannelWithMeta(channel, output.getBlockCount(), output.getWriteBytes()));
        inMemorySortBuffer.clear();

        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Spilled run {} with {} values, {} blocks, {} bytes ({} bytes uncompressed).",
                    spillChannelIDs.size(),
                    numValues,
                    output.getBlockCount(),
                    output.getWriteBytes(),
                    output.getNumBytes());
        }
    }

    private long getDiskUsage() {
        long bytes = 0;
        for (ChannelWithMeta spillChannelID : spillChannelIDs) {
            bytes += spillChannelID.getNumBytes();
        }
        return bytes;
    }

    // ------------------------------------------------------------------------
    //  Reading
    // ------------------------------------------------------------------------

    /** 结束写入,之后只能按顺序读取。 */
    public void sort() throws IOException {
        checkState(state == SortState.ACCEPTING, "Cannot sort a sorter in state %s.", state);

        if (spillChannelIDs.isEmpty()) {
            memoryIterator = inMemorySortBuffer.sortedIterator();
            sortedIterator = memoryIterator;
        } else {
            spill();
            List<FileIOChannel> openChannels = new ArrayList<>();
            try {
                sortedIterator = merger.getMergingIterator(spillChannelIDs, openChannels);
            } finally {
                channelManager.addOpenChannels(openChannels);
            }
        }
        state = SortState.SORTED;

        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Sorted {} values, {} spilled runs, {} spilled bytes.",
                    numRecords,
                    spillChannelIDs.size(),
                    getDiskUsage());
        }
    }

    @Override
    public void skip(long n) throws IOException {
        checkArgument(n >= 0, "Cannot skip a negative number of elements: %s.", n);
        checkState(state == SortState.SORTED, "Cannot read a sorter in state %s.", state);

        long remaining = remaining();
        if (n > remaining) {
            throw new SequenceOutOfRangeException(n, remaining);
        }

        if (memoryIterator != null) {
            memoryIterator.skip((int) n);
        } else {
            for (long i = 0; i < n; i++) {
                nextFromIterator();
            }
        }
        numConsumed += n;
    }

    @Override
    public T next() throws IOException {
        checkState(state == SortState.SORTED, "Cannot read a sorter in state %s.", state);
        if (remaining() == 0) {
            throw new NoSuchElementException("Sorted sequence is exhausted.");
        }

        T value = nextFromIterator();
        numConsumed++;
        return value;
    }

    private T nextFromIterator() throws IOException {
        T value = sortedIterator.next();
        if (value == null) {
            throw new IllegalStateException(
                    String.format(
                            "Sorted sequence ended after %s of %s values.",
                            numConsumed, numRecords));
        }
        return value;
    }

    @Override
    public boolean hasNext() {
        return state == SortState.SORTED && remaining() > 0;
    }

    @Override
    public long remaining() {
        return state == SortState.CLOSED ? 0 : numRecords - numConsumed;
    }

    /** 写入的值总数。 */
    public long size() {
        return numRecords;
    }

    public int spilledRuns() {
        return spillChannelIDs.size();
    }

    public long spilledBytes() {
        return getDiskUsage();
    }

    public SortState getState() {
        return state;
    }

    @VisibleForTesting
    long getOccupancy() {
        return inMemorySortBuffer.getOccupancy();
    }

    /** 释放内存并删除全部溢写文件,可以重复调用。 */
    @Override
    public void close() {
        if (state == SortState.CLOSED) {
            return;
        }
        state = SortState.CLOSED;
        sortedIterator = null;
        memoryIterator = null;
        merger.close();
        inMemorySortBuffer.clear();
        spillChannelIDs.clear();
        channelManager.reset();
    }
}
