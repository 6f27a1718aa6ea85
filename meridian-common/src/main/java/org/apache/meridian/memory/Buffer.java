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

import java.nio.ByteBuffer;

import static org.apache.meridian.utils.Preconditions.checkArgument;

/**
 * 内存段加上有效长度。
 *
 * <p>溢写文件以块为单位读写,每个块对应一个 Buffer:写入时 size 是压缩后的有效字节数,读取时由读取方根据块头设置。
 */
public class Buffer {

    private final MemorySegment segment;

    private int size;

    private Buffer(MemorySegment segment, int size) {
        checkArgument(size >= 0 && size <= segment.size(), "Illegal buffer size %s", size);
        this.segment = segment;
        this.size = size;
    }

    /** 创建一个空 Buffer,容量为整个内存段。 */
    public static Buffer create(MemorySegment segment) {
        return new Buffer(segment, 0);
    }

    public static Buffer create(MemorySegment segment, int size) {
        return new Buffer(segment, size);
    }

    public MemorySegment getMemorySegment() {
        return segment;
    }

    public int getSize() {
        return size;
    }

    public void setSize(int size) {
        checkArgument(size >= 0 && size <= segment.size(), "Illegal buffer size %s", size);
        this.size = size;
    }

    public int getMaxCapacity() {
        return segment.size();
    }

    /** 以 {@link ByteBuffer} 形式访问 [index, index + length),二者共享数据。 */
    public ByteBuffer getNioBuffer(int index, int length) {
        return segment.wrap(index, length).slice();
    }
}
