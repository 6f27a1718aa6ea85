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

package org.apache.meridian.sort;

import org.apache.meridian.data.BinaryString;
import org.apache.meridian.data.serializer.BinaryStringSerializer;
import org.apache.meridian.data.serializer.LongSerializer;
import org.apache.meridian.memory.HeapMemorySegmentPool;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link InMemorySortBuffer}. */
public class InMemorySortBufferTest {

    private static final int PAGE_SIZE = 64;

    @Test
    public void testWriteUntilFullAndSort() throws Exception {
        HeapMemorySegmentPool pool = new HeapMemorySegmentPool(PAGE_SIZE * 8, PAGE_SIZE);
        InMemorySortBuffer<Long> buffer =
                new InMemorySortBuffer<>(LongSerializer.INSTANCE, Comparator.naturalOrder(), pool);
        assertThat(buffer.isEmpty()).isTrue();

        Random random = new Random(3);
        List<Long> written = new ArrayList<>();
        while (true) {
            long value = random.nextInt(100) - 50;
            if (!buffer.write(value)) {
                break;
            }
            written.add(value);
        }
        assertThat(written).isNotEmpty();
        assertThat(buffer.size()).isEqualTo(written.size());
        assertThat(buffer.getOccupancy()).isEqualTo(written.size() * (8L + 12L));
        assertThat(pool.freePages()).isZero();

        written.sort(Comparator.naturalOrder());
        InMemorySortBuffer<Long>.IndexIterator iterator = buffer.sortedIterator();
        assertThat(iterator.remaining()).isEqualTo(written.size());
        for (Long expected : written) {
            assertThat(iterator.next()).isEqualTo(expected);
        }
        assertThat(iterator.next()).isNull();

        buffer.clear();
        assertThat(buffer.isEmpty()).isTrue();
        assertThat(buffer.getOccupancy()).isZero();
        assertThat(pool.freePages()).isEqualTo(8);

        // reusable after clear
        assertThat(buffer.write(1L)).isTrue();
        assertThat(buffer.sortedIterator().next()).isEqualTo(1L);
    }

    @Test
    public void testSkip() throws Exception {
        HeapMemorySegmentPool pool = new HeapMemorySegmentPool(PAGE_SIZE * 16, PAGE_SIZE);
        InMemorySortBuffer<Long> buffer =
                new InMemorySortBuffer<>(LongSerializer.INSTANCE, Comparator.naturalOrder(), pool);
        for (long v = 20; v > 0; v--) {
            assertThat(buffer.write(v)).isTrue();
        }

        InMemorySortBuffer<Long>.IndexIterator iterator = buffer.sortedIterator();
        iterator.skip(9);
        assertThat(iterator.remaining()).isEqualTo(11);
        assertThat(iterator.next()).isEqualTo(10L);
        iterator.skip(100);
        assertThat(iterator.remaining()).isZero();
        assertThat(iterator.next()).isNull();
    }

    @Test
    public void testValueLargerThanBuffer() throws Exception {
        HeapMemorySegmentPool pool = new HeapMemorySegmentPool(PAGE_SIZE * 4, PAGE_SIZE);
        InMemorySortBuffer<BinaryString> buffer =
                new InMemorySortBuffer<>(
                        BinaryStringSerializer.INSTANCE, Comparator.naturalOrder(), pool);
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < PAGE_SIZE * 4; i++) {
            builder.append('x');
        }

        assertThat(buffer.write(BinaryString.fromString(builder.toString()))).isFalse();
        assertThat(buffer.isEmpty()).isTrue();
        assertThat(buffer.write(BinaryString.fromString("small"))).isFalse();

        buffer.clear();
        assertThat(buffer.write(BinaryString.fromString("small"))).isTrue();
    }

    @Test
    public void testTooFewPages() {
        HeapMemorySegmentPool pool = new HeapMemorySegmentPool(PAGE_SIZE * 2, PAGE_SIZE);
        assertThatThrownBy(
                        () ->
                                new InMemorySortBuffer<>(
                                        LongSerializer.INSTANCE, Comparator.naturalOrder(), pool))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 3 pages");
    }
}
