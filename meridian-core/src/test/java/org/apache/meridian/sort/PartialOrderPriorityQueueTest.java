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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link PartialOrderPriorityQueue}. */
public class PartialOrderPriorityQueueTest {

    @Test
    public void testPollInOrder() {
        PartialOrderPriorityQueue<Integer> queue =
                new PartialOrderPriorityQueue<>(Comparator.<Integer>naturalOrder(), 8);
        for (int v : new int[] {5, 3, 8, 1, 3, 9, 0, 4}) {
            queue.put(v);
        }
        assertThat(queue.size()).isEqualTo(8);

        List<Integer> polled = new ArrayList<>();
        while (queue.size() > 0) {
            polled.add(queue.poll());
        }
        assertThat(polled).containsExactly(0, 1, 3, 3, 4, 5, 8, 9);
        assertThat(queue.poll()).isNull();
        assertThat(queue.peek()).isNull();
    }

    @Test
    public void testPutWhenFull() {
        PartialOrderPriorityQueue<Integer> queue =
                new PartialOrderPriorityQueue<>(Comparator.<Integer>naturalOrder(), 1);
        queue.put(1);
        assertThatThrownBy(() -> queue.put(2))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("full");
    }

    @Test
    public void testAdjustTop() {
        int[][] heads = {{4}, {2}, {6}};
        PartialOrderPriorityQueue<int[]> queue =
                new PartialOrderPriorityQueue<int[]>(Comparator.comparingInt(h -> h[0]), 3);
        for (int[] head : heads) {
            queue.put(head);
        }
        assertThat(queue.peek()[0]).isEqualTo(2);

        queue.peek()[0] = 5;
        queue.adjustTop();
        assertThat(queue.peek()[0]).isEqualTo(4);

        assertThat(queue.poll()[0]).isEqualTo(4);
        assertThat(queue.poll()[0]).isEqualTo(5);
        assertThat(queue.poll()[0]).isEqualTo(6);
        assertThat(queue.size()).isZero();
    }
}
