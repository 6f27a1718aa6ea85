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

import static org.apache.meridian.compression.CompressorUtils.HEADER_LENGTH;
import static org.apache.meridian.compression.CompressorUtils.writeIntLE;

/**
 * 负责块头的压缩器基类,子类只压缩块体。
 *
 * <p>空块写出长度均为 0 的块头,不调用子类。
 */
public abstract class AbstractBlockCompressor implements BlockCompressor {

    /** 压缩 {@code srcSize} 字节时块体的最大长度。 */
    protected abstract int maxBodyLength(int srcSize);

    /**
     * 压缩块体。
     *
     * @param maxDstLen dst 中可用于块体的最大字节数
     * @return 块体长度,必须大于 0
     */
    protected abstract int compressBody(
            byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff, int maxDstLen)
            throws Exception;

    @Override
    public int getMaxCompressedSize(int srcSize) {
        return HEADER_LENGTH + maxBodyLength(srcSize);
    }

    @Override
    public int compress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferCompressionException {
        if (dst.length - dstOff < getMaxCompressedSize(srcLen)) {
            throw new BufferCompressionException("Destination buffer too small");
        }

        int compressedLength = 0;
        if (srcLen > 0) {
            try {
                compressedLength =
                        compressBody(
                                src,
                                srcOff,
                                srcLen,
                                dst,
                                dstOff + HEADER_LENGTH,
                                dst.length - dstOff - HEADER_LENGTH);
            } catch (BufferCompressionException e) {
                throw e;
            } catch (Exception e) {
                throw new BufferCompressionException(e);
            }
        }

        writeIntLE(compressedLength, dst, dstOff);
        writeIntLE(srcLen, dst, dstOff + 4);
        return HEADER_LENGTH + compressedLength;
    }
}
