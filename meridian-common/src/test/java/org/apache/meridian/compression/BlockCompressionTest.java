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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for the block compressors created by {@link BlockCompressionFactory}. */
public class BlockCompressionTest {

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    public void testCompressAndDecompress(BlockCompressionType type) {
        BlockCompressionFactory factory = BlockCompressionFactory.create(type, 1);
        assertThat(factory.getCompressionType()).isEqualTo(type);

        byte[] original = new byte[64 * 1024];
        Random random = new Random(42);
        // half random, half repetitive
        for (int i = 0; i < original.length; i++) {
            original[i] = i < original.length / 2 ? (byte) random.nextInt() : (byte) (i % 7);
        }

        verify(factory, original, 0, original.length);
        verify(factory, original, 100, 3000);
    }

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    public void testEmptyBlock(BlockCompressionType type) {
        BlockCompressionFactory factory = BlockCompressionFactory.create(type, 1);
        BlockCompressor compressor = factory.getCompressor();
        byte[] compressed = new byte[compressor.getMaxCompressedSize(0)];

        int len = compressor.compress(new byte[0], 0, 0, compressed, 0);
        assertThat(len).isEqualTo(CompressorUtils.HEADER_LENGTH);
        assertThat(factory.getDecompressor().decompress(compressed, 0, len, new byte[0], 0))
                .isEqualTo(0);
    }

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    public void testDestinationTooSmall(BlockCompressionType type) {
        BlockCompressionFactory factory = BlockCompressionFactory.create(type, 1);
        byte[] src = "0123456789".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(
                        () ->
                                factory.getCompressor()
                                        .compress(src, 0, src.length, new byte[4], 0))
                .isInstanceOf(BufferCompressionException.class);

        byte[] compressed = new byte[factory.getCompressor().getMaxCompressedSize(src.length)];
        int len = factory.getCompressor().compress(src, 0, src.length, compressed, 0);
        assertThatThrownBy(
                        () ->
                                factory.getDecompressor()
                                        .decompress(compressed, 0, len, new byte[5], 0))
                .isInstanceOf(BufferDecompressionException.class);
    }

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    public void testTruncatedInput(BlockCompressionType type) {
        BlockCompressionFactory factory = BlockCompressionFactory.create(type, 1);
        BlockDecompressor decompressor = factory.getDecompressor();
        assertThatThrownBy(() -> decompressor.decompress(new byte[3], 0, 3, new byte[8], 0))
                .isInstanceOf(BufferDecompressionException.class)
                .hasMessageContaining("header");
    }

    @Test
    public void testCreateFromOptions() {
        BlockCompressionFactory lz4 = BlockCompressionFactory.create(CompressOptions.defaultOptions());
        assertThat(lz4.getCompressionType()).isEqualTo(BlockCompressionType.LZ4);
        BlockCompressionFactory zstd = BlockCompressionFactory.create(new CompressOptions("ZSTD", 3));
        assertThat(zstd.getCompressionType()).isEqualTo(BlockCompressionType.ZSTD);
        assertThatThrownBy(() -> BlockCompressionFactory.create(new CompressOptions("snappy", 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("snappy");
    }

    private static void verify(BlockCompressionFactory factory, byte[] src, int off, int len) {
        BlockCompressor compressor = factory.getCompressor();
        BlockDecompressor decompressor = factory.getDecompressor();

        byte[] compressed = new byte[compressor.getMaxCompressedSize(len) + 10];
        int compressedLen = compressor.compress(src, off, len, compressed, 10);

        byte[] restored = new byte[len + 5];
        int restoredLen = decompressor.decompress(compressed, 10, compressedLen, restored, 5);

        assertThat(restoredLen).isEqualTo(len);
        assertThat(Arrays.copyOfRange(restored, 5, 5 + len))
                .isEqualTo(Arrays.copyOfRange(src, off, off + len));
    }
}
