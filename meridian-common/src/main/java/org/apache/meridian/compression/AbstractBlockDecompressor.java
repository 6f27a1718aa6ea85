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
import static org.apache.meridian.compression.CompressorUtils.readIntLE;
import static org.apache.meridian.compression.CompressorUtils.validateLength;

/** 与 {@link AbstractBlockCompressor} 对应的解压器基类。 */
public abstract class AbstractBlockDecompressor implements BlockDecompressor {

    /**
     * 解压块体。
     *
     * @return 实际解压出的字节数
     */
    protected abstract int decompressBody(
            byte[] src, int srcOff, int compressedLen, byte[] dst, int dstOff, int originalLen)
            throws Exception;

    @Override
    public int decompress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferDecompressionException {
        if (srcLen < HEADER_LENGTH) {
            throw new BufferDecompressionException("Input is corrupted, missing block header.");
        }

        final int compressedLen = readIntLE(src, srcOff);
        final int originalLen = readIntLE(src, srcOff + 4);
        validateLength(compressedLen, originalLen);

        if (dst.length - dstOff < originalLen) {
            throw new BufferDecompressionException("Buffer length too small");
        }

        if (srcLen - HEADER_LENGTH < compressedLen) {
            throw new BufferDecompressionException(
                    "Source data is not integral for decompression.");
        }

        if (originalLen == 0) {
            return 0;
        }

        final int decompressedLen;
        try {
            decompressedLen =
                    decompressBody(
                            src, srcOff + HEADER_LENGTH, compressedLen, dst, dstOff, originalLen);
        } catch (BufferDecompressionException e) {
            throw e;
        } catch (Exception e) {
            throw new BufferDecompressionException("Input is corrupted", e);
        }

        if (decompressedLen != originalLen) {
            throw new BufferDecompressionException("Input is corrupted");
        }
        return originalLen;
    }
}
