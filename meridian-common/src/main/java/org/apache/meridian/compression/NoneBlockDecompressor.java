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

/** {@link NoneBlockCompressor} 的解压器。 */
public class NoneBlockDecompressor extends AbstractBlockDecompressor {

    @Override
    protected int decompressBody(
            byte[] src, int srcOff, int compressedLen, byte[] dst, int dstOff, int originalLen) {
        if (compressedLen != originalLen) {
            throw new BufferDecompressionException("Input is corrupted");
        }
        System.arraycopy(src, srcOff, dst, dstOff, compressedLen);
        return compressedLen;
    }
}
