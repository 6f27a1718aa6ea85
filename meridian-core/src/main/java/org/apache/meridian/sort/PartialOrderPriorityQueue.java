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

import java.util.Comparator;

/**
 * 固定容量的最小堆,堆顶总是比较器意义下最小的元素。
 *
 * <p>归并时每个有序段在堆中放一个头元素;堆顶元素前进后调用 {@link #adjustTop()} 重新下沉,比先出堆再入堆少一半比较。
 *
 * @param <T> 元素类型
 */
public class PartialOrderPriorityQueue<T> {

    /** 下标从 1 开始的堆数组。 */
    private final T[] heap;

    private final Comparator<T> comparator;

    private final int capacity;

    private int size;

    @SuppressWarnings("unchecked")
    public PartialOrderPriorityQueue(Comparator<T> comparator, int capacity) {
        this.comparator = comparator;
        this.capacity = capacity;
        this.size = 0;
        this.heap = (T[]) new Object[capacity + 1];
    }

    private boolean lessThan(T a, T b) {
        return comparator.compare(a, b) < 0;
    }

    /**
     * 在 log(size) 时间内加入一个元素。
     *
     * @throws IllegalStateException 队列已满
     */
    public final void put(T element) {
        if (size >= capacity) {
            throw new IllegalStateException("Priority queue is full, capacity " + capacity);
        }
        size++;
        heap[size] = element;
        upHeap();
    }

    public final T peek() {
        if (size > 0) {
            return heap[1];
        } else {
            return null;
        }
    }

    public final T poll() {
        if (size > 0) {
            T result = heap[1];
            heap[1] = heap[size];
            heap[size] = null;
            size--;
            if (size > 0) {
                downHeap();
            }
            return result;
        } else {
            return null;
        }
    }

    /** 堆顶元素的值变化之后调用。 */
    public final void adjustTop() {
        downHeap();
    }

    public final int size() {
        return size;
    }

    private void upHeap() {
        int i = size;
        T node = heap[i];
        int j = i >>> 1;
        while (j > 0 && lessThan(node, heap[j])) {
            heap[i] = heap[j];
            i = j;
            j = j >>> 1;
        }
        heap[i] = node;
    }

    private void downHeap() {
        int i = 1;
        T node = heap[i];
        int j = i << 1;
        int k = j + 1;
        if (k <= size && lessThan(heap[k], heap[j])) {
            j = k;
        }
        while (j <= size && lessThan(heap[j], node)) {
            heap[i] = heap[j];
            i = j;
            j = i << 1;
            k = j + 1;
            if (k <= size && lessThan(heap[k], heap[j])) {
                j = k;
            }
        }
        heap[i] = node;
    }
}
