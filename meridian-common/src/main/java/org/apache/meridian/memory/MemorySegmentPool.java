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

import java.util.List;

/**
 * 有界的内存段池。
 *
 * <p>池的总容量就是使用方的内存预算:{@link #nextSegment()} 返回 null 即表示预算已满,排序缓冲区据此触发溢写。
 * 归还的内存段会被复用,不会重新分配。
 */
public interface MemorySegmentPool extends MemorySegmentSource {

    int DEFAULT_PAGE_SIZE = 32 * 1024;

    /** 每个内存段的大小(字节)。 */
    int pageSize();

    /** 归还一批内存段。 */
    void returnAll(List<MemorySegment> memory);

    /** 仍可获取的页数,包括已归还和尚未分配的。 */
    int freePages();
}
