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
import org.apache.meridian.compression.BlockCompressionType;
import org.apache.meridian.compression.CompressOptions;
import org.apache.meridian.disk.IOManagerImpl;
import org.apache.meridian.options.ConfigOption;
import org.apache.meridian.options.MemorySize;
import org.apache.meridian.options.Options;
import org.apache.meridian.utils.MathUtils;

import java.io.Serializable;

import static org.apache.meridian.options.ConfigOptions.key;
import static org.apache.meridian.utils.Preconditions.checkArgument;

/** 中位数聚合的配置项,以及对 {@link Options} 的类型化访问。构造时校验所有取值。 */
@Public
public class MedianOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 排序索引的一条记录占 12 字节,页至少要放下一条。 */
    public static final int MIN_PAGE_SIZE = 16;

    public static final ConfigOption<MemorySize> SORT_SPILL_BUFFER_SIZE =
            key("sort.spill-buffer-size")
                    .memoryType()
                    .defaultValue(MemorySize.parse("5000 kb"))
                    .withDescription(
                            "Amount of memory a single median accumulator buffers before it "
                                    + "spills a sorted run to disk. Includes the sort index.");

    public static final ConfigOption<MemorySize> PAGE_SIZE =
            key("sort.page-size")
                    .memoryType()
                    .defaultValue(MemorySize.parse("32 kb"))
                    .withDescription(
                            "Memory page size of the sort buffer. Must be a power of two.");

    public static final ConfigOption<Integer> SORT_MAX_NUM_FILE_HANDLES =
            key("sort.max-num-file-handles")
                    .intType()
                    .defaultValue(128)
                    .withDescription(
                            "The maximal fan-in for external merge sort. It limits the number of file handles. "
                                    + "If it is too small, may cause intermediate merging. But if it is too large, "
                                    + "it will cause too many files opened at the same time.");

    public static final ConfigOption<String> SPILL_COMPRESSION =
            key("sort.spill-compression")
                    .stringType()
                    .defaultValue("lz4")
                    .withDescription(
                            "Compression for spilled runs, currently none, lz4, zstd and lzo are supported.");

    public static final ConfigOption<Integer> SPILL_COMPRESSION_ZSTD_LEVEL =
            key("sort.spill-compression.zstd-level")
                    .intType()
                    .defaultValue(1)
                    .withDescription("Zstd level used when spill compression is zstd.");

    public static final ConfigOption<MemorySize> SPILL_COMPRESSION_BLOCK_SIZE =
            key("sort.spill-compression.block-size")
                    .memoryType()
                    .defaultValue(MemorySize.parse("64 kb"))
                    .withDescription("Uncompressed size of one block in a spill file.");

    public static final ConfigOption<MemorySize> SORT_MAX_DISK_SIZE =
            key("sort.max-disk-size")
                    .memoryType()
                    .defaultValue(MemorySize.MAX_VALUE)
                    .withDescription(
                            "Maximum bytes of spilled runs per accumulator, unlimited by default. "
                                    + "A spill beyond this size fails.");

    public static final ConfigOption<String> IO_TMP_DIRS =
            key("io.tmp-dirs")
                    .stringType()
                    .defaultValue(System.getProperty("java.io.tmpdir"))
                    .withDescription(
                            "Directories for spill files, separated by ',' or the system path separator.");

    private final Options options;

    public MedianOptions(Options options) {
        this.options = options;
        validate();
    }

    private void validate() {
        long bufferSize = spillBufferSize();
        int pageSize = pageSize();
        checkArgument(
                MathUtils.isPowerOf2(pageSize),
                "%s must be a power of two, but is %s.",
                PAGE_SIZE.key(),
                pageSize);
        checkArgument(
                pageSize >= MIN_PAGE_SIZE,
                "%s must be at least %s bytes, but is %s.",
                PAGE_SIZE.key(),
                MIN_PAGE_SIZE,
                pageSize);
        checkArgument(
                bufferSize >= 3L * pageSize,
                "%s (%s bytes) must hold at least 3 pages of %s bytes.",
                SORT_SPILL_BUFFER_SIZE.key(),
                bufferSize,
                pageSize);
        checkArgument(
                maxNumFileHandles() >= 2,
                "%s must be at least 2, but is %s.",
                SORT_MAX_NUM_FILE_HANDLES.key(),
                maxNumFileHandles());
        String compression = options.get(SPILL_COMPRESSION);
        checkArgument(
                isKnownCompression(compression),
                "Unknown %s '%s'.",
                SPILL_COMPRESSION.key(),
                compression);
        checkArgument(
                spillCompressionBlockSize() > 0,
                "%s must be positive.",
                SPILL_COMPRESSION_BLOCK_SIZE.key());
        checkArgument(
                IOManagerImpl.splitPaths(tmpDirs()).length > 0,
                "%s must name at least one directory.",
                IO_TMP_DIRS.key());
    }

    private static boolean isKnownCompression(String compression) {
        for (BlockCompressionType type : BlockCompressionType.values()) {
            if (type.name().equalsIgnoreCase(compression)) {
                return true;
            }
        }
        return false;
    }

    public Options toConfiguration() {
        return options;
    }

    public long spillBufferSize() {
        return options.get(SORT_SPILL_BUFFER_SIZE).getBytes();
    }

    public int pageSize() {
        return (int) options.get(PAGE_SIZE).getBytes();
    }

    public int maxNumFileHandles() {
        return options.get(SORT_MAX_NUM_FILE_HANDLES);
    }

    public CompressOptions spillCompressOptions() {
        return new CompressOptions(
                options.get(SPILL_COMPRESSION), options.get(SPILL_COMPRESSION_ZSTD_LEVEL));
    }

    public int spillCompressionBlockSize() {
        return (int) options.get(SPILL_COMPRESSION_BLOCK_SIZE).getBytes();
    }

    public MemorySize maxDiskSize() {
        return options.get(SORT_MAX_DISK_SIZE);
    }

    public String tmpDirs() {
        return options.get(IO_TMP_DIRS);
    }
}
