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

package org.apache.meridian.utils;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * 变长整数编码工具类。
 *
 * <p>每个字节的低 7 位存放数据,最高位表示后面是否还有字节。非负 int 最多占用 {@link
 * #MAX_VAR_INT_SIZE} 个字节,长度较小的值(如短字符串的长度前缀)只占一个字节。
 */
public final class VarLengthIntUtils {

    public static final int MAX_VAR_INT_SIZE = 5;

    /**
     * 写入一个非负 int。
     *
     * @return 写入的字节数
     */
    public static int encodeInt(DataOutput os, int value) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("negative value: v=" + value);
        }

        int i = 1;
        while ((value & ~0x7F) != 0) {
            os.write((value & 0x7F) | 0x80);
            value >>>= 7;
            i++;
        }
        os.write((byte) value);
        return i;
    }

    /** 读取由 {@link #encodeInt(DataOutput, int)} 写入的 int。 */
    public static int decodeInt(DataInput is) throws IOException {
        int result = 0;
        for (int shift = 0; shift < 32; shift += 7) {
            int b = is.readUnsignedByte();
            result |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new IOException("Malformed var-length integer.");
    }

    private VarLengthIntUtils() {}
}
