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

package org.apache.meridian.options;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link MemorySize}. */
public class MemorySizeTest {

    @Test
    public void testParseUnits() {
        assertThat(MemorySize.parseBytes("1234")).isEqualTo(1234L);
        assertThat(MemorySize.parseBytes("1234 bytes")).isEqualTo(1234L);
        assertThat(MemorySize.parseBytes("64 kb")).isEqualTo(64L * 1024);
        assertThat(MemorySize.parseBytes("64kb")).isEqualTo(64L * 1024);
        assertThat(MemorySize.parseBytes("  5000 KB ")).isEqualTo(5000L * 1024);
        assertThat(MemorySize.parseBytes("3 mb")).isEqualTo(3L << 20);
        assertThat(MemorySize.parseBytes("2 g")).isEqualTo(2L << 30);
        assertThat(MemorySize.parseBytes("1 tebibytes")).isEqualTo(1L << 40);
    }

    @Test
    public void testParseInvalid() {
        assertThatThrownBy(() -> MemorySize.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MemorySize.parse("kb"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not start with a number");
        assertThatThrownBy(() -> MemorySize.parse("12 parsecs"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parsecs");
        assertThatThrownBy(() -> MemorySize.parse("99999999999999999999"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("numeric overflow");
        assertThatThrownBy(() -> MemorySize.parse("9000000 tb"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("numeric overflow");
    }

    @Test
    public void testToStringUsesLargestExactUnit() {
        assertThat(MemorySize.ofBytes(0).toString()).isEqualTo("0 bytes");
        assertThat(MemorySize.ofBytes(1000).toString()).isEqualTo("1000 bytes");
        assertThat(MemorySize.ofKibiBytes(64).toString()).isEqualTo("64 kb");
        assertThat(MemorySize.ofMebiBytes(1024).toString()).isEqualTo("1 gb");
        assertThat(MemorySize.parse(MemorySize.ofKibiBytes(5000).toString()))
                .isEqualTo(MemorySize.ofKibiBytes(5000));
    }

    @Test
    public void testMaxValue() {
        assertThat(MemorySize.MAX_VALUE.getBytes()).isEqualTo(Long.MAX_VALUE);
        assertThatThrownBy(() -> MemorySize.ofBytes(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
