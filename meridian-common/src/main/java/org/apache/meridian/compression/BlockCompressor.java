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

/** 块压缩器,一次压缩一个完整的数据块。 */
public interface BlockCompressor {

    /** 压缩 {@code srcSize} 字节时输出的最大字节数,包括块头。 */
    int getMaxCompressedSize(int srcSize);

    /**
     * 压缩 {@code src[srcOff, srcOff + srcLen)} 并写入 {@code dst[dstOff..]}。
     *
     * @return 写入 dst 的字节数
     * @throws BufferCompressionException 压缩失败或 dst 空间不足
     */
    int compress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferCompressionException;
}
