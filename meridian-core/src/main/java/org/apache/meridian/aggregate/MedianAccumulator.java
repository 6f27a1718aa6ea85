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
import org.apache.meridian.annotation.VisibleForTesting;
import org.apache.meridian.data.serializer.InternalSerializers;
import org.apache.meridian.data.serializer.Serializer;
import org.apache.meridian.disk.IOManager;
import org.apache.meridian.options.Options;
import org.apache.meridian.sort.ExternalSorter;
import org.apache.meridian.types.DataType;

import javax.annotation.Nullable;

import java.io.IOException;

import static org.apache.meridian.utils.Preconditions.checkNotNull;
import static org.apache.meridian.utils.Preconditions.checkState;

/**
 * 一个聚合分组的中位数累加器。
 *
 * <p>值逐个写入,null 被忽略。排序器在第一个非 null 值到来时才创建,只有 null 的分组不占用任何内存页。{@link #finalizeValue()}
 * 对全部值排序后取中位数,随后释放内存和溢写文件,累加器不再接受写入。
 *
 * <p>非线程安全,一个累加器只由一个线程驱动。
 *
 * @param <T> 值的内部类型
 */
@Public
public class MedianAccumulator<T> implements AutoCloseable {

    /** 输入值的类型 */
    private final DataType valueType;
    /** 解析得到的全序比较器 */
    private final ValueComparator<T> comparator;
    /** 值序列化器 */
    private final Serializer<T> serializer;
    /** IO管理器,由聚合函数共享 */
    private final IOManager ioManager;
    /** 排序器的内存与溢写配置 */
    private final MedianOptions options;

    /** 第一个非 null 值到来时才创建 */
    @Nullable private ExternalSorter<T> sorter;
    /** 非 null 值的数量 */
    private long count;
    private boolean finished;
    private boolean closed;

    private MedianAccumulator(
            DataType valueType,
            ValueComparator<T> comparator,
            Serializer<T> serializer,
            IOManager ioManager,
            MedianOptions options) {
        this.valueType = valueType;
        this.comparator = comparator;
        this.serializer = serializer;
        this.ioManager = ioManager;
        this.options = options;
        this.count = 0;
    }

    /**
     * 为给定类型创建累加器。
     *
     * @throws org.apache.meridian.types.UnsupportedTypeException 类型没有全序或没有序列化格式
     * @throws IllegalArgumentException 配置无效
     */
    public static <T> MedianAccumulator<T> create(
            DataType valueType, ComparatorResolver resolver, IOManager ioManager, Options options) {
        return create(valueType, resolver, ioManager, new MedianOptions(options));
    }

    public static <T> MedianAccumulator<T> create(
            DataType valueType,
            ComparatorResolver resolver,
            IOManager ioManager,
            MedianOptions options) {
        checkNotNull(valueType);
        ValueComparator<T> comparator = resolver.resolve(valueType);
        Serializer<T> serializer = InternalSerializers.create(valueType);
        return new MedianAccumulator<>(
                valueType, comparator, serializer, ioManager, checkNotNull(options));
    }

    /** 写入一个值,null 不计数。 */
    public void insert(@Nullable T value) throws IOException {
        checkState(!finished, "Cannot insert into a finalized median accumulator.");
        checkState(!closed, "Cannot insert into a closed median accumulator.");
        if (value == null) {
            return;
        }

        if (sorter == null) {
            sorter = createSorter();
        }
        sorter.insert(value);
        count++;
    }

    private ExternalSorter<T> createSorter() {
        return ExternalSorter.create(
                serializer,
                comparator,
                ioManager,
                options.spillBufferSize(),
                options.pageSize(),
                options.maxNumFileHandles(),
                options.spillCompressOptions(),
                options.spillCompressionBlockSize(),
                options.maxDiskSize());
    }

    /**
     * 计算中位数并结束累加,只能调用一次。
     *
     * @return 中位数,没有非 null 值时返回 null
     */
    @Nullable
    public T finalizeValue() throws IOException {
        checkState(!finished, "Median accumulator has already been finalized.");
        checkState(!closed, "Cannot finalize a closed median accumulator.");
        finished = true;

        try {
            if (count == 0) {
                return null;
            }
            sorter.sort();
            return MedianSelector.select(sorter, count);
        } finally {
            close();
        }
    }

    /** 释放内存和溢写文件,可以重复调用。 */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (sorter != null) {
            sorter.close();
        }
    }

    public long getCount() {
        return count;
    }

    public DataType getValueType() {
        return valueType;
    }

    public ValueComparator<T> getComparator() {
        return comparator;
    }

    public boolean isFinished() {
        return finished;
    }

    @VisibleForTesting
    @Nullable
    ExternalSorter<T> sorter() {
        return sorter;
    }
}
