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

/**
 * 三路划分的快速排序。
 *
 * <p>枢轴取首、中、尾三者的中值,与枢轴相等的元素先收集到区间两端,划分结束后再换回中间,因此大量重复值不会退化。
 * 区间小于 13 个元素时改用插入排序,递归深度超过 {@link #getMaxDepth} 时改用 {@link HeapSort}。
 */
public final class QuickSort implements IndexedSorter {

    private static final IndexedSorter alt = new HeapSort();

    private static void fix(IndexedSortable s, int p, int r) {
        if (s.compare(p, r) > 0) {
            s.swap(p, r);
        }
    }

    /** 返回 4 * ceil(log2(x))。 */
    private static int getMaxDepth(int x) {
        if (x <= 0) {
            throw new IllegalArgumentException("Undefined for " + x);
        }
        return (32 - Integer.numberOfLeadingZeros(x - 1)) << 2;
    }

    @Override
    public void sort(final IndexedSortable s, int p, int r) {
        if (r - p < 2) {
            return;
        }
        sortInternal(s, p, r, getMaxDepth(r - p));
    }

    @Override
    public void sort(IndexedSortable s) {
        sort(s, 0, s.size());
    }

    private static void sortInternal(final IndexedSortable s, int p, int r, int depth) {
        while (true) {
            if (r - p < 13) {
                for (int i = p + 1; i < r; i++) {
                    for (int j = i; j > p && s.compare(j - 1, j) > 0; j--) {
                        s.swap(j, j - 1);
                    }
                }
                return;
            }
            if (--depth < 0) {
                alt.sort(s, p, r);
                return;
            }

            // select, move pivot into first position
            final int m = (p + r) >>> 1;
            fix(s, m, p);
            fix(s, m, r - 1);
            fix(s, p, r - 1);

            // divide
            int i = p;
            int j = r;
            int ll = p;
            int rr = r;
            int cr;
            while (true) {
                while (++i < j) {
                    if ((cr = s.compare(i, p)) > 0) {
                        break;
                    }
                    if (0 == cr && ++ll != i) {
                        s.swap(ll, i);
                    }
                }
                while (--j > i) {
                    if ((cr = s.compare(p, j)) > 0) {
                        break;
                    }
                    if (0 == cr && --rr != j) {
                        s.swap(rr, j);
                    }
                }
                if (i < j) {
                    s.swap(i, j);
                } else {
                    break;
                }
            }
            j = i;
            // swap pivot and all equal values into position
            while (ll >= p) {
                s.swap(ll--, --i);
            }
            while (rr < r) {
                s.swap(rr++, j++);
            }

            // recurse on the smaller interval first to keep the stack shallow
            assert i != j;
            if (i - p < r - j) {
                sortInternal(s, p, i, depth);
                p = j;
            } else {
                sortInternal(s, j, r, depth);
                r = i;
            }
        }
    }
}
