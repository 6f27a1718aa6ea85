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

package org.apache.meridian.memory;

import org.apache.meridian.annotation.Public;

import java.nio.ByteBuffer;

/**
 * 基于堆内 byte[] 的固定大小内存段。
 *
 * <p>内存段是排序缓冲区、溢写视图等组件的最小内存单元。与 {@link ByteBuffer} 不同,它没有 position /
 * limit 状态,所有读写都通过显式的偏移量完成,可以被多个视图交替访问。
 *
 * <h2>字节序</h2>
 *
 * <p>所有多字节数值统一按大端序(big-endian)读写,与 {@link java.io.DataOutput} 的约定一致,因此同一份数据
 * 既可以按段访问,也可以按 {@link java.io.DataInput} 流式读取。
 *
 * <h2>边界检查</h2>
 *
 * <p>越界访问由底层数组检查抛出 {@link IndexOutOfBoundsException}。
 */
@Public
public final class MemorySegment {

    private final byte[] heapMemory;

    private final int size;

    private MemorySegment(byte[] heapMemory) {
        this.heapMemory = heapMemory;
        this.size = heapMemory.length;
    }

    /** 包装一个已有的字节数组,内存段与数组共享数据。 */
    public static MemorySegment wrap(byte[] buffer) {
        return new MemorySegment(buffer);
    }

    /** 分配一个新的堆内存段。 */
    public static MemorySegment allocateHeapMemory(int size) {
        return wrap(new byte[size]);
    }

    public int size() {
        return size;
    }

    public byte[] getArray() {
        return heapMemory;
    }

    /** 将 [offset, offset + length) 包装为 {@link ByteBuffer},二者共享数据。 */
    public ByteBuffer wrap(int offset, int length) {
        return ByteBuffer.wrap(heapMemory, offset, length);
    }

    // ------------------------------------------------------------------------
    //  单字节与字节数组
    // ------------------------------------------------------------------------

    public byte get(int index) {
        return heapMemory[index];
    }

    public void put(int index, byte b) {
        heapMemory[index] = b;
    }

    public void get(int index, byte[] dst, int offset, int length) {
        System.arraycopy(heapMemory, index, dst, offset, length);
    }

    public void put(int index, byte[] src, int offset, int length) {
        System.arraycopy(src, offset, heapMemory, index, length);
    }

    // ------------------------------------------------------------------------
    //  多字节数值(大端序)
    // ------------------------------------------------------------------------

    public short getShort(int index) {
        return (short) (((heapMemory[index] & 0xFF) << 8) | (heapMemory[index + 1] & 0xFF));
    }

    public void putShort(int index, short value) {
        heapMemory[index] = (byte) (value >> 8);
        heapMemory[index + 1] = (byte) value;
    }

    public int getInt(int index) {
        return ((heapMemory[index] & 0xFF) << 24)
                | ((heapMemory[index + 1] & 0xFF) << 16)
                | ((heapMemory[index + 2] & 0xFF) << 8)
                | (heapMemory[index + 3] & 0xFF);
    }

    public void putInt(int index, int value) {
        heapMemory[index] = (byte) (value >>> 24);
        heapMemory[index + 1] = (byte) (value >>> 16);
        heapMemory[index + 2] = (byte) (value >>> 8);
        heapMemory[index + 3] = (byte) value;
    }

    public long getLong(int index) {
        return ((long) getInt(index) << 32) | (getInt(index + 4) & 0xFFFFFFFFL);
    }

    public void putLong(int index, long value) {
        putInt(index, (int) (value >>> 32));
        putInt(index + 4, (int) value);
    }
}
