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
import org.apache.meridian.data.BinaryString;
import org.apache.meridian.data.Decimal;
import org.apache.meridian.data.Timestamp;
import org.apache.meridian.disk.IOManager;
import org.apache.meridian.disk.IOManagerImpl;
import org.apache.meridian.options.Options;
import org.apache.meridian.types.DataType;
import org.apache.meridian.types.UnsupportedTypeException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import java.io.IOException;

import static org.apache.meridian.utils.Preconditions.checkArgument;
import static org.apache.meridian.utils.Preconditions.checkNotNull;

/**
 * 中位数聚合函数,面向宿主聚合引擎的入口。
 *
 * <p>宿主为每个分组调用一次 {@link #init},对分组中的每个值调用 {@link #insert},分组结束时调用 {@link #finalizeValue(MedianAccumulator)}。
 * 传入的值必须已经是声明类型的内部表示,例如 VARCHAR 对应 {@link BinaryString},DECIMAL 对应 {@link Decimal}。
 *
 * <p>函数对象本身可以被多个线程共享,每个累加器只能由一个线程使用。
 */
@Public
@ThreadSafe
public class MedianAggregateFunction implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MedianAggregateFunction.class);

    public static final String NAME = "median";

    private final IOManager ioManager;
    private final ComparatorResolver resolver;
    private final MedianOptions options;
    private final boolean ownsIOManager;

    public MedianAggregateFunction(
            IOManager ioManager, ComparatorResolver resolver, Options options) {
        this(ioManager, resolver, new MedianOptions(options), false);
    }

    private MedianAggregateFunction(
            IOManager ioManager,
            ComparatorResolver resolver,
            MedianOptions options,
            boolean ownsIOManager) {
        this.ioManager = checkNotNull(ioManager);
        this.resolver = checkNotNull(resolver);
        this.options = options;
        this.ownsIOManager = ownsIOManager;
    }

    /** 使用默认比较器绑定,并在 {@code io.tmp-dirs} 下创建自己的 {@link IOManager},关闭时一并关闭。 */
    public static MedianAggregateFunction create(Options options) {
        MedianOptions medianOptions = new MedianOptions(options);
        IOManager ioManager = IOManager.create(IOManagerImpl.splitPaths(medianOptions.tmpDirs()));
        return new MedianAggregateFunction(
                ioManager, DefaultComparatorResolver.INSTANCE, medianOptions, true);
    }

    public String identifier() {
        return NAME;
    }

    /**
     * 为一个分组创建累加器。
     *
     * @throws UnsupportedTypeException 类型不能排序
     */
    public MedianAccumulator<?> init(DataType valueType) {
        return MedianAccumulator.create(valueType, resolver, ioManager, options);
    }

    /**
     * 写入一个值,null 被忽略。
     *
     * @throws IllegalArgumentException 值的 Java 类型与累加器的声明类型不符
     */
    public void insert(MedianAccumulator<?> handle, @Nullable Object valueOrNull)
            throws IOException {
        insertInternal(handle, valueOrNull);
    }

    @SuppressWarnings("unchecked")
    private static <T> void insertInternal(MedianAccumulator<T> handle, @Nullable Object value)
            throws IOException {
        if (value != null) {
            Class<?> expected = internalClass(handle.getValueType());
            checkArgument(
                    expected.isInstance(value),
                    "Value of %s does not match type %s, expected %s.",
                    value.getClass().getName(),
                    handle.getValueType(),
                    expected.getName());
        }
        handle.insert((T) value);
    }

    /** 返回分组的中位数,没有非 null 值时返回 null。 */
    @Nullable
    public Object finalizeValue(MedianAccumulator<?> handle) throws IOException {
        return handle.finalizeValue();
    }

    /** 每种可排序类型的内部值类。 */
    static Class<?> internalClass(DataType type) {
        switch (type.getTypeRoot()) {
            case BOOLEAN:
                return Boolean.class;
            case TINYINT:
                return Byte.class;
            case SMALLINT:
                return Short.class;
            case INTEGER:
            case DATE:
            case TIME_WITHOUT_TIME_ZONE:
                return Integer.class;
            case BIGINT:
                return Long.class;
            case FLOAT:
                return Float.class;
            case DOUBLE:
                return Double.class;
            case DECIMAL:
                return Decimal.class;
            case TIMESTAMP_WITHOUT_TIME_ZONE:
                return Timestamp.class;
            case CHAR:
            case VARCHAR:
                return BinaryString.class;
            case BINARY:
            case VARBINARY:
                return byte[].class;
            default:
                throw new UnsupportedTypeException(type, "Unsupported median type " + type);
        }
    }

    @Override
    public void close() throws Exception {
        if (ownsIOManager) {
            LOG.info("Closing median function, removing spill directories.");
            ioManager.close();
        }
    }
}
