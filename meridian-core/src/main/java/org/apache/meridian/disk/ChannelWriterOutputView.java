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
import org.apache.meridian.compression.BlockCompressor;
import org.apache.meridian.data.AbstractPagedOutputView;
import org.apache.meridian.memory.Buffer;
import org.apache.meridian.memory.MemorySegment;

import java.io.Closeable;
import java.io.IOException;

/**
 * 把有序段写入溢写文件的输出视图。
 *
 * <p>数据先写入一个大小为 {@code compressionBlockSize} 的未压缩页,页写满时整体压缩并作为一个块写出,然后复用这一页。
 * 关闭时写出最后一个不满的页。读取方需要知道块数({@link #getBlockCount()})才能判断文件结尾。
 */
public final class ChannelWriterOutputView extends AbstractPagedOutputView implements Closeable {

    private final MemorySegment compressedBuffer;
    private final BlockCompressor compressor;
    private final BufferFileWriter writer;

    private int blockCount;

    private long numBytes;
    private long writeBytes;

    public ChannelWriterOutputView(
            BufferFileWriter writer,
            BlockCompressionFactory compressionCodecFactory,
            int compressionBlockSize) {
        super(MemorySegment.allocateHeapMemory(compressionBlockSize), compressionBlockSize);

        this.compressor = compressionCodecFactory.getCompressor();
        this.compressedBuffer =
                MemorySegment.allocateHeapMemory(
                        compressor.getMaxCompressedSize(compressionBlockSize));
        this.writer = writer;
    }

    public FileIOChannel getChannel() {
        return writer;
    }

    @Override
    public void close() throws IOException {
        if (!writer.isClosed()) {
            int currentPositionInSegment = getCurrentPositionInSegment();
            if (currentPositionInSegment > 0) {
                writeCompressed(getCurrentSegment(), currentPositionInSegment);
            }
            clear();
            this.writeBytes = writer.getSize();
            this.writer.close();
        }
    }

    public void closeAndDelete() throws IOException {
        try {
            close();
        } finally {
            writer.deleteChannel();
        }
    }

    @Override
    protected MemorySegment nextSegment(MemorySegment current, int positionInCurrent)
            throws IOException {
        writeCompressed(current, positionInCurrent);
        return current;
    }

    private void writeCompressed(MemorySegment current, int size) throws IOException {
        int compressedLen =
                compressor.compress(current.getArray(), 0, size, compressedBuffer.getArray(), 0);
        writer.writeBlock(Buffer.create(compressedBuffer, compressedLen));
        blockCount++;
        numBytes += size;
    }

    /** 未压缩的字节数。 */
    public long getNumBytes() {
        return numBytes;
    }

    /** 关闭后文件的实际大小,包括块头。 */
    public long getWriteBytes() {
        return writeBytes;
    }

    public int getBlockCount() {
        return blockCount;
    }
}
