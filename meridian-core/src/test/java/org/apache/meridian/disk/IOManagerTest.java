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

package org.apache.meridian.disk;

import org.apache.meridian.compression.BlockCompressionFactory;
import org.apache.meridian.compression.BlockCompressionType;
import org.apache.meridian.data.BinaryString;
import org.apache.meridian.data.serializer.BinaryStringSerializer;
import org.apache.meridian.utils.MutableObjectIterator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link IOManager} and the compressed channel views. */
public class IOManagerTest {

    private static final int BLOCK_SIZE = 1024;

    @TempDir Path tempDir;

    @ParameterizedTest
    @EnumSource(BlockCompressionType.class)
    public void testWriteAndReadChannel(BlockCompressionType type) throws Exception {
        BlockCompressionFactory factory = BlockCompressionFactory.create(type, 1);
        try (IOManager ioManager = IOManager.create(tempDir.toString())) {
            FileIOChannel.ID id = ioManager.createChannel();

            ChannelWriterOutputView out =
                    FileChannelUtil.createOutputView(ioManager, id, factory, BLOCK_SIZE);
            for (int i = 0; i < 2000; i++) {
                BinaryStringSerializer.INSTANCE.serialize(
                        BinaryString.fromString("value-" + i), out);
            }
            out.close();
            assertThat(out.getBlockCount()).isGreaterThan(1);
            assertThat(out.getWriteBytes()).isEqualTo(id.getPathFile().length());

            List<FileIOChannel> openChannels = new ArrayList<>();
            ChannelReaderInputView in =
                    FileChannelUtil.createInputView(
                            ioManager,
                            new ChannelWithMeta(id, out.getBlockCount(), out.getWriteBytes()),
                            openChannels,
                            factory,
                            BLOCK_SIZE);
            assertThat(openChannels).hasSize(1);

            MutableObjectIterator<BinaryString> iterator =
                    in.createIterator(BinaryStringSerializer.INSTANCE);
            for (int i = 0; i < 2000; i++) {
                assertThat(iterator.next()).isEqualTo(BinaryString.fromString("value-" + i));
            }
            assertThat(iterator.next()).isNull();
            assertThat(in.getChannel().isClosed()).isTrue();

            in.getChannel().closeAndDelete();
            assertThat(id.getPathFile()).doesNotExist();
        }
    }

    @Test
    public void testEmptyChannel() throws Exception {
        BlockCompressionFactory factory = BlockCompressionFactory.create(BlockCompressionType.LZ4, 1);
        try (IOManager ioManager = IOManager.create(tempDir.toString())) {
            FileIOChannel.ID id = ioManager.createChannel();
            ChannelWriterOutputView out =
                    FileChannelUtil.createOutputView(ioManager, id, factory, BLOCK_SIZE);
            out.close();
            assertThat(out.getBlockCount()).isZero();
            assertThat(out.getWriteBytes()).isZero();

            ChannelReaderInputView in =
                    new ChannelReaderInputView(id, ioManager, factory, BLOCK_SIZE, 0);
            assertThat(in.createIterator(BinaryStringSerializer.INSTANCE).next()).isNull();
        }
    }

    @Test
    public void testCloseRemovesSpillingDirectories() throws Exception {
        File[] dirs;
        FileIOChannel.ID id;
        try (IOManager ioManager =
                IOManager.create(
                        tempDir.resolve("a").toString(), tempDir.resolve("b").toString())) {
            dirs = ioManager.spillingDirectories();
            assertThat(dirs).hasSize(2);
            for (File dir : dirs) {
                assertThat(dir).isDirectory();
                assertThat(dir.getName()).startsWith("meridian-io-");
            }

            FileIOChannel.ID first = ioManager.createChannel();
            FileIOChannel.ID second = ioManager.createChannel();
            assertThat(first.getBucketNum()).isNotEqualTo(second.getBucketNum());

            FileIOChannel.Enumerator enumerator = ioManager.createChannelEnumerator();
            id = enumerator.next();
            assertThat(enumerator.next()).isNotEqualTo(id);

            BufferFileWriter writer = ioManager.createBufferFileWriter(id);
            writer.close();
            assertThat(id.getPathFile()).exists();
        }

        for (File dir : dirs) {
            assertThat(dir).doesNotExist();
        }
        assertThat(id.getPathFile()).doesNotExist();
    }

    @Test
    public void testSplitPaths() {
        assertThat(IOManagerImpl.splitPaths("/a,/b")).containsExactly("/a", "/b");
        assertThat(IOManagerImpl.splitPaths("/a" + File.pathSeparator + "/b"))
                .containsExactly("/a", "/b");
        assertThat(IOManagerImpl.splitPaths("")).isEmpty();
    }

    @Test
    public void testNoTempDirs() {
        assertThatThrownBy(() -> IOManager.create())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No temporary directory");
    }
}
