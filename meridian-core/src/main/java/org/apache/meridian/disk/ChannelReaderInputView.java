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
import org.apache.meridian.compression.BlockDecompressor;
import org.apache.meridian.data.AbstractPagedInputView;
import org.apache.meridian.data.serializer.Serializer;
import org.apache.meridian.memory.Buffer;
import org.apache.meridian.memory.MemorySegment;
import org.apache.meridian.utils.MutableObjectIterator;

import java.io.EOFException;
import java.io.IOException;

/**
 * 读取 {@link ChannelWriterOutputView} 写出的溢写文件的输入视图。
 *
 * <p>每次需要新页时读取一个压缩块并解压到同一个页中。读完 {@code numBlocks} 个块之后抛出 {@link EOFException} 并关闭文件。
 */
public class ChannelReaderInputView extends AbstractPagedInputView {

    private final BlockDecompressor decompressor;
    private final BufferFileReader reader;
    private final MemorySegment uncompressedBuffer;
    private final MemorySegment compressedBuffer;

    private int numBlocksRemaining;
    private int currentSegmentLimit;

    public ChannelReaderInputView(
            FileIOChannel.ID id,
            IOManager ioManager,
            BlockCompressionFactory compressionCodecFactory,
            int compressionBlockSize,
            int numBlocks)
            throws IOException {
        this.numBlocksRemaining = numBlocks;
        this.reader = ioManager.createBufferFileReader(id);
        this.uncompressedBuffer = MemorySegment.allocateHeapMemory(compressionBlockSize);
        this.decompressor = compressionCodecFactory.getDecompressor();
        this.compressedBuffer =
                MemorySegment.allocateHeapMemory(
                        compressionCodecFactory
                                .getCompressor()
                                .getMaxCompressedSize(compressionBlockSize));
    }

    @Override
    protected MemorySegment nextSegment(MemorySegment current) throws IOException {
        if (this.numBlocksRemaining <= 0) {
            this.reader.close();
            throw new EOFException();
        }

        Buffer buffer = Buffer.create(compressedBuffer);
        reader.readInto(buffer);
        this.currentSegmentLimit =
                decompressor.decompress(
                        buffer.getMemorySegment().getArray(),
                        0,
                        buffer.getSize(),
                        uncompressedBuffer.getArray(),
                        0);
        this.numBlocksRemaining--;
        return uncompressedBuffer;
    }

    @Override
    protected int getLimitForSegment(MemorySegment segment) {
        return currentSegmentLimit;
    }

    public void close() throws IOException {
        reader.close();
    }

    public FileIOChannel getChannel() {
        return reader;
    }

    /** 按顺序反序列化文件中的值,读到文件末尾时关闭文件并返回 null。 */
    public <T> MutableObjectIterator<T> createIterator(Serializer<T> serializer) {
        return () -> {
            try {
                return serializer.deserialize(ChannelReaderInputView.this);
            } catch (EOFException e) {
                close();
                return null;
            }
        };
    }
}
