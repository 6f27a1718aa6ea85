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

import org.apache.meridian.memory.HeapMemorySegmentPool;
import org.apache.meridian.memory.MemorySegment;

import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link SimpleCollectingOutputView} and {@link RandomAccessInputView}. */
public class PagedViewTest {

    private static final int PAGE_SIZE = 64;

    @Test
    public void testWriteAndReadAcrossPages() throws Exception {
        HeapMemorySegmentPool pool = new HeapMemorySegmentPool(PAGE_SIZE * 16, PAGE_SIZE);
        List<MemorySegment> segments = new ArrayList<>();
        SimpleCollectingOutputView out = new SimpleCollectingOutputView(segments, pool, PAGE_SIZE);

        List<Long> offsets = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            offsets.add(out.getCurrentOffset());
            // 1 + 4 + 8 + 2 bytes, so values straddle page boundaries
            out.writeBoolean(i % 2 == 0);
            out.writeInt(i);
            out.writeLong(i * 1_000_000_007L);
            out.writeShort(-i);
        }
        assertThat(segments.size()).isGreaterThan(1);
        assertThat(out.getCurrentOffset()).isEqualTo(40L * 15);

        RandomAccessInputView in = new RandomAccessInputView(segments, PAGE_SIZE);
        in.setReadPosition(0);
        for (int i = 0; i < 40; i++) {
            assertThat(in.readBoolean()).isEqualTo(i % 2 == 0);
            assertThat(in.readInt()).isEqualTo(i);
            assertThat(in.readLong()).isEqualTo(i * 1_000_000_007L);
            assertThat(in.readShort()).isEqualTo((short) -i);
        }

        // random access into the middle
        in.setReadPosition(offsets.get(17));
        in.skipBytesToRead(1);
        assertThat(in.readInt()).isEqualTo(17);
    }

    @Test
    public void testBytesAcrossPages() throws Exception {
        HeapMemorySegmentPool pool = new HeapMemorySegmentPool(PAGE_SIZE * 4, PAGE_SIZE);
        List<MemorySegment> segments = new ArrayList<>();
        SimpleCollectingOutputView out = new SimpleCollectingOutputView(segments, pool, PAGE_SIZE);

        byte[] bytes = new byte[150];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) i;
        }
        out.write(bytes);

        RandomAccessInputView in =
                new RandomAccessInputView(
                        segments, PAGE_SIZE, out.getCurrentPositionInSegment());
        in.setReadPosition(10);
        byte[] read = new byte[140];
        in.readFully(read);
        for (int i = 0; i < read.length; i++) {
            assertThat(read[i]).isEqualTo((byte) (i + 10));
        }
        assertThatThrownBy(() -> in.readLong()).isInstanceOf(EOFException.class);
    }

    @Test
    public void testCollectorStopsWhenPoolIsDepleted() throws Exception {
        HeapMemorySegmentPool pool = new HeapMemorySegmentPool(PAGE_SIZE * 2, PAGE_SIZE);
        List<MemorySegment> segments = new ArrayList<>();
        SimpleCollectingOutputView out = new SimpleCollectingOutputView(segments, pool, PAGE_SIZE);

        out.write(new byte[PAGE_SIZE * 2]);
        assertThat(segments).hasSize(2);
        assertThatThrownBy(() -> out.writeByte(1))
                .isInstanceOf(EOFException.class)
                .hasMessageContaining("depleted");
        assertThat(pool.freePages()).isEqualTo(0);

        pool.returnAll(segments);
        assertThat(pool.freePages()).isEqualTo(2);
    }
}
