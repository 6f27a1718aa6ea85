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

/** 可以按下标比较和交换元素的集合,供 {@link IndexedSorter} 原地排序。 */
public interface IndexedSortable {

    /**
     * 比较给定下标的两个元素,语义同 {@link java.util.Comparator#compare(Object, Object)}。
     *
     * @param i 第一个元素的下标
     * @param j 第二个元素的下标
     */
    int compare(int i, int j);

    /** 交换给定下标的两个元素。 */
    void swap(int i, int j);

    /** 元素数量。 */
    int size();
}
