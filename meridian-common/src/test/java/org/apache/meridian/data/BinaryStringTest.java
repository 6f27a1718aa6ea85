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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link BinaryString}. */
public class BinaryStringTest {

    @Test
    public void testCompareIsUnsignedBytewise() {
        assertThat(BinaryString.fromString("B")).isLessThan(BinaryString.fromString("a"));
        // 'é' is 0xC3 0xA9 in UTF-8
        assertThat(BinaryString.fromString("Z")).isLessThan(BinaryString.fromString("é"));
        assertThat(BinaryString.fromString("ab")).isLessThan(BinaryString.fromString("abc"));
        assertThat(BinaryString.EMPTY_UTF8).isLessThan(BinaryString.fromString("a"));
        assertThat(BinaryString.fromString("x")).isEqualByComparingTo(BinaryString.fromString("x"));
    }

    @Test
    public void testCompareBytes() {
        assertThat(BinaryString.compareBytes(new byte[] {(byte) 0xFF}, new byte[] {0x01}))
                .isPositive();
        assertThat(BinaryString.compareBytes(new byte[] {1, 2}, new byte[] {1, 2})).isZero();
        assertThat(BinaryString.compareBytes(new byte[0], new byte[] {0})).isNegative();
    }

    @Test
    public void testSortOrder() {
        List<BinaryString> values = new ArrayList<>();
        for (String s : Arrays.asList("pear", "Apple", "apple", "éclair", "zebra", "")) {
            values.add(BinaryString.fromString(s));
        }
        Collections.sort(values);
        assertThat(values)
                .extracting(BinaryString::toString)
                .containsExactly("", "Apple", "apple", "pear", "zebra", "éclair");
    }

    @Test
    public void testBytesAreCopiedOut() {
        BinaryString str = BinaryString.fromString("abc");
        byte[] bytes = str.toBytes();
        bytes[0] = 'z';
        assertThat(str.toString()).isEqualTo("abc");
        assertThat(str.getSizeInBytes()).isEqualTo(3);
        assertThat(str).isEqualTo(BinaryString.fromBytes(new byte[] {'a', 'b', 'c'}));
    }
}
