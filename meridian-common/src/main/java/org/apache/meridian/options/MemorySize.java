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

package org.apache.meridian.options;

import org.apache.meridian.annotation.Public;

import java.util.Locale;

import static org.apache.meridian.utils.Preconditions.checkArgument;
import static org.apache.meridian.utils.Preconditions.checkNotNull;

/**
 * 以字节为单位的内存大小。
 *
 * <p>可以从 {@code "64 kb"}、{@code "5000 kb"}、{@code "1mb"} 之类的字符串解析,单位不区分大小写,缺省单位为字节。
 * 单位均按 1024 进位:
 *
 * <ul>
 *   <li>字节: b, bytes
 *   <li>KiB: k, kb, kibibytes
 *   <li>MiB: m, mb, mebibytes
 *   <li>GiB: g, gb, gibibytes
 *   <li>TiB: t, tb, tebibytes
 * </ul>
 */
@Public
public class MemorySize implements java.io.Serializable {

    private static final long serialVersionUID = 1L;

    public static final MemorySize MAX_VALUE = new MemorySize(Long.MAX_VALUE);

    private final long bytes;

    public MemorySize(long bytes) {
        checkArgument(bytes >= 0, "bytes must be >= 0");
        this.bytes = bytes;
    }

    public static MemorySize ofBytes(long bytes) {
        return new MemorySize(bytes);
    }

    public static MemorySize ofKibiBytes(long kibiBytes) {
        return new MemorySize(kibiBytes << 10);
    }

    public static MemorySize ofMebiBytes(long mebiBytes) {
        return new MemorySize(mebiBytes << 20);
    }

    public long getBytes() {
        return bytes;
    }

    /**
     * 解析内存大小字符串。
     *
     * @throws IllegalArgumentException 格式错误、单位未知或数值溢出
     */
    public static MemorySize parse(String text) throws IllegalArgumentException {
        return new MemorySize(parseBytes(text));
    }

    public static long parseBytes(String text) throws IllegalArgumentException {
        checkNotNull(text, "text");

        final String trimmed = text.trim();
        checkArgument(!trimmed.isEmpty(), "argument is an empty- or whitespace-only string");

        final int len = trimmed.length();
        int pos = 0;

        char current;
        while (pos < len && (current = trimmed.charAt(pos)) >= '0' && current <= '9') {
            pos++;
        }

        final String number = trimmed.substring(0, pos);
        final String unit = trimmed.substring(pos).trim().toLowerCase(Locale.US);

        if (number.isEmpty()) {
            throw new IllegalArgumentException("text does not start with a number: " + text);
        }

        final long value;
        try {
            value = Long.parseLong(number);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "The value '"
                            + number
                            + "' cannot be represented as 64bit number (numeric overflow).");
        }

        final long multiplier = parseUnit(unit, text);
        final long result = value * multiplier;

        if (result / multiplier != value) {
            throw new IllegalArgumentException(
                    "The value '"
                            + text
                            + "' cannot be represented as 64bit number of bytes (numeric overflow).");
        }

        return result;
    }

    private static long parseUnit(String unit, String text) {
        switch (unit) {
            case "":
            case "b":
            case "bytes":
                return 1L;
            case "k":
            case "kb":
            case "kibibytes":
                return 1L << 10;
            case "m":
            case "mb":
            case "mebibytes":
                return 1L << 20;
            case "g":
            case "gb":
            case "gibibytes":
                return 1L << 30;
            case "t":
            case "tb":
            case "tebibytes":
                return 1L << 40;
            default:
                throw new IllegalArgumentException(
                        "Memory size unit '"
                                + unit
                                + "' does not match any of the recognized units in '"
                                + text
                                + "'");
        }
    }

    @Override
    public int hashCode() {
        return (int) (bytes ^ (bytes >>> 32));
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this
                || (obj != null
                        && obj.getClass() == this.getClass()
                        && ((MemorySize) obj).bytes == this.bytes);
    }

    @Override
    public String toString() {
        if (bytes == 0) {
            return "0 bytes";
        }
        String[] units = {"bytes", "kb", "mb", "gb", "tb"};
        int idx = 0;
        long value = bytes;
        while (idx < units.length - 1 && value % 1024 == 0) {
            value /= 1024;
            idx++;
        }
        return value + " " + units[idx];
    }
}
