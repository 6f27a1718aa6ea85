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

package org.apache.meridian.data;

import org.apache.meridian.annotation.Public;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.apache.meridian.utils.Preconditions.checkNotNull;

/**
 * 以 UTF-8 字节存储的字符串,CHAR / VARCHAR 类型的内部表示。
 *
 * <h2>排序规则</h2>
 *
 * <p>{@link #compareTo} 按 UTF-8 字节的无符号字典序比较,等价于 C / binary 排序规则:与区域设置无关、在任何环境下结果一致。
 * 由于 UTF-8 保持码点顺序,该顺序也等于 Unicode 码点顺序;例如大写字母排在小写字母之前,{@code "Z" < "a" < "é"}。
 *
 * <p>对象不可变,可以安全地在排序缓冲区与归并流之间共享。
 */
@Public
public final class BinaryString implements Comparable<BinaryString> {

    public static final BinaryString EMPTY_UTF8 = new BinaryString(new byte[0]);

    private final byte[] bytes;

    private transient String javaObject;

    private BinaryString(byte[] bytes) {
        this.bytes = bytes;
    }

    /** 从 Java 字符串创建,null 输入返回 null。 */
    public static BinaryString fromString(String str) {
        if (str == null) {
            return null;
        }
        BinaryString s = new BinaryString(str.getBytes(StandardCharsets.UTF_8));
        s.javaObject = str;
        return s;
    }

    /** 直接使用给定的 UTF-8 字节,不做拷贝。 */
    public static BinaryString fromBytes(byte[] bytes) {
        return new BinaryString(checkNotNull(bytes));
    }

    /** UTF-8 字节数。 */
    public int getSizeInBytes() {
        return bytes.length;
    }

    /** 返回底层字节数组的副本。 */
    public byte[] toBytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public static int compareBytes(byte[] left, byte[] right) {
        int len = Math.min(left.length, right.length);
        for (int i = 0; i < len; i++) {
            int res = (left[i] & 0xFF) - (right[i] & 0xFF);
            if (res != 0) {
                return res;
            }
        }
        return left.length - right.length;
    }

    @Override
    public int compareTo(BinaryString other) {
        return compareBytes(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BinaryString)) {
            return false;
        }
        return Arrays.equals(bytes, ((BinaryString) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        if (javaObject == null) {
            javaObject = new String(bytes, StandardCharsets.UTF_8);
        }
        return javaObject;
    }
}
