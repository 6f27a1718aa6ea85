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

import java.util.ArrayDeque;
import java.util.List;

/**
 * 内存段池的基础实现。
 *
 * <p>优先复用已归还的内存段;空闲队列为空且尚未达到 {@code maxMemory / pageSize} 页上限时才分配新段。
 *
 * <p>非线程安全,一个池只归属于一个排序器。
 */
public abstract class AbstractMemorySegmentPool implements MemorySegmentPool {

    private final ArrayDeque<MemorySegment> segments;

    private final int maxPages;

    protected final int pageSize;

    private int numPage;

    public AbstractMemorySegmentPool(long maxMemory, int pageSize) {
        this.segments = new ArrayDeque<>();
        this.maxPages = (int) Math.min(Integer.MAX_VALUE, maxMemory / pageSize);
        this.pageSize = pageSize;
        this.numPage = 0;
    }

    @Override
    public MemorySegment nextSegment() {
        if (!segments.isEmpty()) {
            return segments.poll();
        } else if (numPage < maxPages) {
            numPage++;
            return allocateMemory();
        }

        return null;
    }

    /** 分配一个新的内存段。 */
    protected abstract MemorySegment allocateMemory();

    @Override
    public int pageSize() {
        return pageSize;
    }

    @Override
    public void returnAll(List<MemorySegment> memory) {
        segments.addAll(memory);
    }

    @Override
    public int freePages() {
        return segments.size() + maxPages - numPage;
    }

    /** 池的最大页数。 */
    public int maxPages() {
        return maxPages;
    }
}
