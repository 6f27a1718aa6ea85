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
import org.apache.meridian.memory.MemorySegment;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;

/**
 * 基于一串内存段(页)的输入视图。
 *
 * <p>视图每次只持有一个当前段,读到段的有效末尾时通过 {@link #nextSegment(MemorySegment)} 向子类请求下一个段。
 * 子类决定段从哪里来:
 *
 * <ul>
 *   <li>{@link RandomAccessInputView}: 内存中的段列表,支持按绝对位置定位
 *   <li>溢写文件读取视图: 每个段是从文件中读出并解压的一个块
 * </ul>
 *
 * <p>跨段的多字节数值会被逐字节拼接,调用方无需关心页边界。没有更多段时子类抛出 {@link EOFException}。
 */
public abstract class AbstractPagedInputView implements DataInputView {

    private MemorySegment currentSegment;

    private int positionInSegment;

    private int limitInSegment;

    /**
     * 创建一个从给定段开始读取的视图。
     *
     * @param initialSegment 第一个段
     * @param initialLimit 第一个段中有效数据的末尾位置
     */
    protected AbstractPagedInputView(MemorySegment initialSegment, int initialLimit) {
        seekInput(initialSegment, 0, initialLimit);
    }

    /** 创建一个尚无当前段的视图,第一次读取时才会请求段。 */
    protected AbstractPagedInputView() {
        this.currentSegment = null;
        this.positionInSegment = 0;
        this.limitInSegment = 0;
    }

    public MemorySegment getCurrentSegment() {
        return currentSegment;
    }

    public int getCurrentPositionInSegment() {
        return positionInSegment;
    }

    /**
     * 获取当前段之后的下一个段。
     *
     * @param current 当前段,首次调用时为 null
     * @throws EOFException 没有更多数据
     */
    protected abstract MemorySegment nextSegment(MemorySegment current) throws IOException;

    /** 段中有效数据的末尾位置。 */
    protected abstract int getLimitForSegment(MemorySegment segment);

    /** 切换到下一个段。 */
    public void advance() throws IOException {
        this.currentSegment = nextSegment(this.currentSegment);
        this.limitInSegment = getLimitForSegment(this.currentSegment);
        this.positionInSegment = 0;
    }

    /** 定位到指定段的指定位置。 */
    protected void seekInput(MemorySegment segment, int positionInSegment, int limitInSegment) {
        this.currentSegment = segment;
        this.positionInSegment = positionInSegment;
        this.limitInSegment = limitInSegment;
    }

    /** 丢弃当前段。 */
    protected void clear() {
        this.currentSegment = null;
        this.positionInSegment = 0;
        this.limitInSegment = 0;
    }

    // --------------------------------------------------------------------------------------------
    //                               Data Input Specific methods
    // --------------------------------------------------------------------------------------------

    @Override
    public int read(byte[] b) throws IOException {
        return read(b, 0, b.length);
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (off < 0 || len < 0 || off + len > b.length) {
            throw new IndexOutOfBoundsException();
        }

        int remaining = this.limitInSegment - this.positionInSegment;
        if (remaining >= len) {
            this.currentSegment.get(this.positionInSegment, b, off, len);
            this.positionInSegment += len;
            return len;
        }

        if (remaining == 0) {
            try {
                advance();
            } catch (EOFException eof) {
                return -1;
            }
            remaining = this.limitInSegment - this.positionInSegment;
        }

        int bytesRead = 0;
        while (true) {
            int toRead = Math.min(remaining, len - bytesRead);
            this.currentSegment.get(this.positionInSegment, b, off, toRead);
            off += toRead;
            bytesRead += toRead;

            if (len > bytesRead) {
                try {
                    advance();
                } catch (EOFException eof) {
                    this.positionInSegment += toRead;
                    return bytesRead;
                }
                remaining = this.limitInSegment - this.positionInSegment;
            } else {
                this.positionInSegment += toRead;
                break;
            }
        }
        return len;
    }

    @Override
    public void readFully(byte[] b) throws IOException {
        readFully(b, 0, b.length);
    }

    @Override
    public void readFully(byte[] b, int off, int len) throws IOException {
        int bytesRead = read(b, off, len);

        if (bytesRead < len) {
            throw new EOFException("There is no enough data left in the DataInputView.");
        }
    }

    @Override
    public boolean readBoolean() throws IOException {
        return readByte() == 1;
    }

    @Override
    public byte readByte() throws IOException {
        if (this.positionInSegment < this.limitInSegment) {
            return this.currentSegment.get(this.positionInSegment++);
        } else {
            advance();
            return readByte();
        }
    }

    @Override
    public int readUnsignedByte() throws IOException {
        return readByte() & 0xff;
    }

    @Override
    public short readShort() throws IOException {
        if (this.positionInSegment < this.limitInSegment - 1) {
            final short v = this.currentSegment.getShort(this.positionInSegment);
            this.positionInSegment += 2;
            return v;
        } else if (this.positionInSegment == this.limitInSegment) {
            advance();
            return readShort();
        } else {
            return (short) ((readUnsignedByte() << 8) | readUnsignedByte());
        }
    }

    @Override
    public int readUnsignedShort() throws IOException {
        return readShort() & 0xffff;
    }

    @Override
    public char readChar() throws IOException {
        return (char) readShort();
    }

    @Override
    public int readInt() throws IOException {
        if (this.positionInSegment < this.limitInSegment - 3) {
            final int v = this.currentSegment.getInt(this.positionInSegment);
            this.positionInSegment += 4;
            return v;
        } else if (this.positionInSegment == this.limitInSegment) {
            advance();
            return readInt();
        } else {
            return (readUnsignedByte() << 24)
                    | (readUnsignedByte() << 16)
                    | (readUnsignedByte() << 8)
                    | readUnsignedByte();
        }
    }

    @Override
    public long readLong() throws IOException {
        if (this.positionInSegment < this.limitInSegment - 7) {
            final long v = this.currentSegment.getLong(this.positionInSegment);
            this.positionInSegment += 8;
            return v;
        } else if (this.positionInSegment == this.limitInSegment) {
            advance();
            return readLong();
        } else {
            long l = 0L;
            for (int i = 0; i < 8; i++) {
                l = (l << 8) | readUnsignedByte();
            }
            return l;
        }
    }

    @Override
    public float readFloat() throws IOException {
        return Float.intBitsToFloat(readInt());
    }

    @Override
    public double readDouble() throws IOException {
        return Double.longBitsToDouble(readLong());
    }

    @Override
    public String readLine() throws IOException {
        final StringBuilder bld = new StringBuilder(32);

        try {
            int b;
            while ((b = readUnsignedByte()) != '\n') {
                if (b != '\r') {
                    bld.append((char) b);
                }
            }
        } catch (EOFException eofex) {
            if (bld.length() == 0) {
                return null;
            }
        }

        return bld.toString();
    }

    @Override
    public String readUTF() throws IOException {
        return DataInputStream.readUTF(this);
    }

    @Override
    public int skipBytes(int n) throws IOException {
        if (n < 0) {
            throw new IllegalArgumentException();
        }

        int remaining = this.limitInSegment - this.positionInSegment;
        if (remaining >= n) {
            this.positionInSegment += n;
            return n;
        }

        if (remaining == 0) {
            try {
                advance();
            } catch (EOFException eofex) {
                return 0;
            }
            remaining = this.limitInSegment - this.positionInSegment;
        }

        int skipped = 0;
        while (true) {
            int toSkip = Math.min(remaining, n);
            n -= toSkip;
            skipped += toSkip;

            if (n > 0) {
                try {
                    advance();
                } catch (EOFException eofex) {
                    return skipped;
                }
                remaining = this.limitInSegment - this.positionInSegment;
            } else {
                this.positionInSegment += toSkip;
                break;
            }
        }
        return skipped;
    }

    @Override
    public void skipBytesToRead(int numBytes) throws IOException {
        if (numBytes < 0) {
            throw new IllegalArgumentException();
        }

        int remaining = this.limitInSegment - this.positionInSegment;
        while (numBytes > remaining) {
            numBytes -= remaining;
            advance();
            remaining = this.limitInSegment - this.positionInSegment;
        }
        this.positionInSegment += numBytes;
    }
}
