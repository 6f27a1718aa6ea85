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

import com.github.luben.zstd.RecyclingBufferPool;
import com.github.luben.zstd.ZstdOutputStream;

import java.io.IOException;
import java.io.OutputStream;

/** 基于 zstd-jni 流式接口的块压缩器。 */
public class ZstdBlockCompressor extends AbstractBlockCompressor {

    private static final int MAX_BLOCK_SIZE = 128 * 1024;

    private final int level;

    public ZstdBlockCompressor(int level) {
        this.level = level;
    }

    @Override
    protected int maxBodyLength(int srcSize) {
        // ZSTD_COMPRESSBOUND
        int result = srcSize + (srcSize >>> 8);
        if (srcSize < MAX_BLOCK_SIZE) {
            result += (MAX_BLOCK_SIZE - srcSize) >>> 11;
        }
        return result;
    }

    @Override
    protected int compressBody(
            byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff, int maxDstLen)
            throws IOException {
        FixedArrayOutputStream stream = new FixedArrayOutputStream(dst, dstOff, maxDstLen);
        try (ZstdOutputStream zstdStream =
                new ZstdOutputStream(stream, RecyclingBufferPool.INSTANCE)) {
            zstdStream.setLevel(level);
            zstdStream.setWorkers(0);
            zstdStream.write(src, srcOff, srcLen);
        }
        return stream.written();
    }

    /** 写入固定数组区域的输出流,超出区域时抛出 {@link IOException}。 */
    private static class FixedArrayOutputStream extends OutputStream {

        private final byte[] buf;
        private final int start;
        private final int end;
        private int position;

        private FixedArrayOutputStream(byte[] buf, int start, int length) {
            this.buf = buf;
            this.start = start;
            this.end = start + length;
            this.position = start;
        }

        @Override
        public void write(int b) throws IOException {
            if (position >= end) {
                throw new IOException("Destination buffer overflow");
            }
            buf[position++] = (byte) b;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            if (len > end - position) {
                throw new IOException("Destination buffer overflow");
            }
            System.arraycopy(b, off, buf, position, len);
            position += len;
        }

        int written() {
            return position - start;
        }
    }
}
