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

import org.apache.meridian.utils.MutableObjectIterator;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;

/**
 * 多路归并迭代器:把若干各自有序的输入合并成一个有序输出。
 *
 * <p>每个输入在 {@link PartialOrderPriorityQueue} 中占一个位置,按各自的头元素排序。输出的元素总数等于所有输入之和,重复值全部保留。
 *
 * @param <T> 元素类型
 */
public class MergeIterator<T> implements MutableObjectIterator<T> {

    private final PartialOrderPriorityQueue<HeadStream<T>> heap;

    private HeadStream<T> currHead;

    public MergeIterator(List<MutableObjectIterator<T>> iterators, Comparator<T> comparator)
            throws IOException {
        this.heap =
                new PartialOrderPriorityQueue<>(
                        (o1, o2) -> comparator.compare(o1.getHead(), o2.getHead()),
                        Math.max(1, iterators.size()));
        for (MutableObjectIterator<T> iterator : iterators) {
            HeadStream<T> stream = new HeadStream<>(iterator);
            // empty inputs never enter the heap
            if (stream.advance()) {
                this.heap.put(stream);
            }
        }
    }

    @Override
    public T next() throws IOException {
        if (currHead != null) {
            if (!currHead.advance()) {
                this.heap.poll();
            } else {
                this.heap.adjustTop();
            }
        }

        if (this.heap.size() > 0) {
            currHead = this.heap.peek();
            return currHead.getHead();
        } else {
            currHead = null;
            return null;
        }
    }

    private static final class HeadStream<T> {

        private final MutableObjectIterator<T> iterator;
        private T head;

        private HeadStream(MutableObjectIterator<T> iterator) {
            this.iterator = iterator;
        }

        private T getHead() {
            return this.head;
        }

        /** 读取下一个头元素,输入耗尽时返回 false。 */
        private boolean advance() throws IOException {
            return (this.head = this.iterator.next()) != null;
        }
    }
}
