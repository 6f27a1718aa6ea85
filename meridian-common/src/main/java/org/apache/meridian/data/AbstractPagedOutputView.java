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

import org.apache.meridian.io.DataInputView;
import org.apache.meridian.io.DataOutputView;
import org.apache.meridian.memory.MemorySegment;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UTFDataFormatException;

/**
 * 基于一串内存段(页)的输出视图。
 *
 * <p>当前段写满后调用 {@link #nextSegment(MemorySegment, int)} 交给子类处理,并获得下一个可写的段:
 *
 * <ul>
 *   <li>{@link SimpleCollectingOutputView}: 从内存池申请新页,预算耗尽时抛出 {@link java.io.EOFException}
 *   <li>溢写文件写出视图: 压缩当前页写入文件,然后复用同一页
 * </ul>
 *
 * <p>跨页的多字节数值按字节拆开写入,与 {@link AbstractPagedInputView} 的读取方式对应。
 */
public abstract class AbstractPagedOutputView implements DataOutputView {

    private MemorySegment currentSegment;

    protected final int segmentSize;

    private int positionInSegment;

    protected AbstractPagedOutputView(MemorySegment initialSegment, int segmentSize) {
        if (initialSegment == null) {
            throw new NullPointerException("Initial Segment may not be null");
        }
        this.segmentSize = segmentSize;
        this.currentSegment = initialSegment;
        this.positionInSegment = 0;
    }

    /**
     * 处理写满的段并返回下一个段。
     *
     * @param current 当前写满(或将要关闭)的段
     * @param positionInCurrent 当前段中已写入的字节数
     * @return 下一个可写的段
     * @throws java.io.EOFException 没有更多可用的段
     */
    protected abstract MemorySegment nextSegment(MemorySegment current, int positionInCurrent)
            throws IOException;

    public MemorySegment getCurrentSegment() {
        return this.currentSegment;
    }

    public int getCurrentPositionInSegment() {
        return this.positionInSegment;
    }

    /** 切换到下一个段。 */
    public void advance() throws IOException {
        this.currentSegment = nextSegment(this.currentSegment, this.positionInSegment);
        this.positionInSegment = 0;
    }

    /** 丢弃当前段,之后不能再写入,直到重新定位。 */
    protected void clear() {
        this.currentSegment = null;
        this.positionInSegment = 0;
    }

    // --------------------------------------------------------------------------------------------
    //                               Data Output Specific methods
    // --------------------------------------------------------------------------------------------

    @Override
    public void write(int b) throws IOException {
        writeByte(b);
    }

    @Override
    public void write(byte[] b) throws IOException {
        write(b, 0, b.length);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        int remaining = this.segmentSize - this.positionInSegment;
        if (remaining >= len) {
            this.currentSegment.put(this.positionInSegment, b, off, len);
            this.positionInSegment += len;
        } else {
            if (remaining == 0) {
                advance();
                remaining = this.segmentSize - this.positionInSegment;
            }
            while (true) {
                int toPut = Math.min(remaining, len);
                this.currentSegment.put(this.positionInSegment, b, off, toPut);
                off += toPut;
                len -= toPut;

                if (len > 0) {
                    this.positionInSegment = this.segmentSize;
                    advance();
                    remaining = this.segmentSize - this.positionInSegment;
                } else {
                    this.positionInSegment += toPut;
                    break;
                }
            }
        }
    }

    @Override
    public void writeBoolean(boolean v) throws IOException {
        writeByte(v ? 1 : 0);
    }

    @Override
    public void writeByte(int v) throws IOException {
        if (this.positionInSegment < this.segmentSize) {
            this.currentSegment.put(this.positionInSegment++, (byte) v);
        } else {
            advance();
            writeByte(v);
        }
    }

    @Override
    public void writeShort(int v) throws IOException {
        if (this.positionInSegment < this.segmentSize - 1) {
            this.currentSegment.putShort(this.positionInSegment, (short) v);
            this.positionInSegment += 2;
        } else if (this.positionInSegment == this.segmentSize) {
            advance();
            writeShort(v);
        } else {
            writeByte(v >> 8);
            writeByte(v);
        }
    }

    @Override
    public void writeChar(int v) throws IOException {
        writeShort(v);
    }

    @Override
    public void writeInt(int v) throws IOException {
        if (this.positionInSegment < this.segmentSize - 3) {
            this.currentSegment.putInt(this.positionInSegment, v);
            this.positionInSegment += 4;
        } else if (this.positionInSegment == this.segmentSize) {
            advance();
            writeInt(v);
        } else {
            writeByte(v >> 24);
            writeByte(v >> 16);
            writeByte(v >> 8);
            writeByte(v);
        }
    }

    @Override
    public void writeLong(long v) throws IOException {
        if (this.positionInSegment < this.segmentSize - 7) {
            this.currentSegment.putLong(this.positionInSegment, v);
            this.positionInSegment += 8;
        } else if (this.positionInSegment == this.segmentSize) {
            advance();
            writeLong(v);
        } else {
            writeInt((int) (v >>> 32));
            writeInt((int) v);
        }
    }

    @Override
    public void writeFloat(float v) throws IOException {
        writeInt(Float.floatToRawIntBits(v));
    }

    @Override
    public void writeDouble(double v) throws IOException {
        writeLong(Double.doubleToRawLongBits(v));
    }

    @Override
    public void writeBytes(String s) throws IOException {
        for (int i = 0; i < s.length(); i++) {
            writeByte(s.charAt(i));
        }
    }

    @Override
    public void writeChars(String s) throws IOException {
        for (int i = 0; i < s.length(); i++) {
            writeChar(s.charAt(i));
        }
    }

    @Override
    public void writeUTF(String str) throws IOException {
        // modified UTF-8,与 DataInputStream#readUTF 对应
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(str.length() + 2);
        try {
            new DataOutputStream(bytes).writeUTF(str);
        } catch (UTFDataFormatException e) {
            throw new UTFDataFormatException("Encoded string is too long: " + str.length());
        }
        write(bytes.toByteArray());
    }

    @Override
    public void skipBytesToWrite(int numBytes) throws IOException {
        while (numBytes > 0) {
            final int remaining = this.segmentSize - this.positionInSegment;
            if (numBytes <= remaining) {
                this.positionInSegment += numBytes;
                return;
            }
            this.positionInSegment = this.segmentSize;
            advance();
            numBytes -= remaining;
        }
    }

    @Override
    public void write(DataInputView source, int numBytes) throws IOException {
        while (numBytes > 0) {
            final int remaining = this.segmentSize - this.positionInSegment;
            if (numBytes <= remaining) {
                source.readFully(this.currentSegment.getArray(), this.positionInSegment, numBytes);
                this.positionInSegment += numBytes;
                return;
            }

            if (remaining > 0) {
                source.readFully(this.currentSegment.getArray(), this.positionInSegment, remaining);
                this.positionInSegment = this.segmentSize;
                numBytes -= remaining;
            }
            advance();
        }
    }
}
