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

package org.apache.meridian.aggregate;

import org.apache.meridian.sort.SequenceOutOfRangeException;
import org.apache.meridian.sort.SortedSequence;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link MedianSelector}. */
public class MedianSelectorTest {

    @Test
    public void testMedianPosition() {
        assertThat(MedianSelector.medianPosition(1)).isZero();
        assertThat(MedianSelector.medianPosition(2)).isEqualTo(1);
        assertThat(MedianSelector.medianPosition(5)).isEqualTo(2);
        assertThat(MedianSelector.medianPosition(6)).isEqualTo(3);
        assertThat(MedianSelector.medianPosition(Long.MAX_VALUE)).isEqualTo(Long.MAX_VALUE / 2);
    }

    @Test
    public void testSelectUpperMedian() throws Exception {
        assertThat(MedianSelector.select(new ListSequence<>(1, 3, 5, 8), 4)).isEqualTo(5);
        assertThat(MedianSelector.select(new ListSequence<>(2, 2, 4, 4, 9), 5)).isEqualTo(4);
        assertThat(MedianSelector.select(new ListSequence<>(1, 1, 1, 2), 4)).isEqualTo(1);
        assertThat(MedianSelector.select(new ListSequence<>(7), 1)).isEqualTo(7);
    }

    @Test
    public void testSelectLeavesRemainder() throws Exception {
        ListSequence<Integer> sequence = new ListSequence<>(1, 2, 3, 4, 5);
        MedianSelector.select(sequence, 5);
        assertThat(sequence.remaining()).isEqualTo(2);
        assertThat(sequence.next()).isEqualTo(4);
    }

    @Test
    public void testInvalidCount() {
        assertThatThrownBy(() -> MedianSelector.select(new ListSequence<Integer>(), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Median of 0 values is undefined.");
    }

    @Test
    public void testCountLargerThanSequence() {
        assertThatThrownBy(() -> MedianSelector.select(new ListSequence<>(1, 2), 10))
                .isInstanceOf(SequenceOutOfRangeException.class);
    }

    @Test
    public void testMissingValueAtMedianPosition() {
        ListSequence<Integer> sequence = new ListSequence<>(1, null, 3);
        assertThatThrownBy(() -> MedianSelector.select(sequence, 3))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Missing value at median position 1 of 3 values.");
    }

    private static class ListSequence<T> implements SortedSequence<T> {

        private final List<T> values;
        private int position;

        @SafeVarargs
        private ListSequence(T... values) {
            this.values = Arrays.asList(values);
        }

        @Override
        public void skip(long n) {
            if (n > remaining()) {
                throw new SequenceOutOfRangeException(n, remaining());
            }
            position += (int) n;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return values.get(position++);
        }

        @Override
        public boolean hasNext() {
            return position < values.size();
        }

        @Override
        public long remaining() {
            return values.size() - position;
        }
    }
}
