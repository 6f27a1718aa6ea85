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

package org.apache.meridian.compression;

import io.airlift.compress.lzo.LzoCompressor;
import io.airlift.compress.lzo.LzoDecompressor;

import java.util.Locale;
import java.util.function.Supplier;

import static org.apache.meridian.utils.Preconditions.checkNotNull;

/**
 * 块压缩器与解压器的工厂。
 *
 * <p>每次调用 {@link #getCompressor()} / {@link #getDecompressor()} 都会创建新的实例,压缩器实例不在线程间共享。
 */
public final class BlockCompressionFactory {

    private final BlockCompressionType type;

    private final Supplier<BlockCompressor> compressorSupplier;

    private final Supplier<BlockDecompressor> decompressorSupplier;

    private BlockCompressionFactory(
            BlockCompressionType type,
            Supplier<BlockCompressor> compressorSupplier,
            Supplier<BlockDecompressor> decompressorSupplier) {
        this.type = type;
        this.compressorSupplier = compressorSupplier;
        this.decompressorSupplier = decompressorSupplier;
    }

    public BlockCompressionType getCompressionType() {
        return type;
    }

    public BlockCompressor getCompressor() {
        return compressorSupplier.get();
    }

    public BlockDecompressor getDecompressor() {
        return decompressorSupplier.get();
    }

    /**
     * 根据压缩选项创建工厂,算法名称不区分大小写。
     *
     * @throws IllegalArgumentException 未知的压缩算法
     */
    public static BlockCompressionFactory create(CompressOptions compression) {
        checkNotNull(compression);
        BlockCompressionType type;
        try {
            type = BlockCompressionType.valueOf(compression.compress().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown compression method '" + compression.compress() + "'", e);
        }
        return create(type, compression.zstdLevel());
    }

    public static BlockCompressionFactory create(BlockCompressionType type, int zstdLevel) {
        switch (type) {
            case NONE:
                return new BlockCompressionFactory(
                        type, NoneBlockCompressor::new, NoneBlockDecompressor::new);
            case ZSTD:
                return new BlockCompressionFactory(
                        type, () -> new ZstdBlockCompressor(zstdLevel), ZstdBlockDecompressor::new);
            case LZ4:
                return new BlockCompressionFactory(
                        type, Lz4BlockCompressor::new, Lz4BlockDecompressor::new);
            case LZO:
                return new BlockCompressionFactory(
                        type,
                        () -> new AirBlockCompressor(new LzoCompressor()),
                        () -> new AirBlockDecompressor(new LzoDecompressor()));
            default:
                throw new IllegalArgumentException("Unknown compression method " + type);
        }
    }
}
