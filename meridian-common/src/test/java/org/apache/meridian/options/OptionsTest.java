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

import static org.apache.meridian.options.ConfigOptions.key;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Options} and {@link ConfigOption}. */
public class OptionsTest {

    private static final ConfigOption<Integer> INT_OPTION =
            key("test.int").intType().defaultValue(7).withDescription("An int.");

    private static final ConfigOption<MemorySize> MEMORY_OPTION =
            key("test.memory").memoryType().defaultValue(MemorySize.parse("64 kb"));

    private static final ConfigOption<String> STRING_OPTION =
            key("test.string").stringType().defaultValue("lz4");

    @Test
    public void testDefaults() {
        Options options = new Options();
        assertThat(options.get(INT_OPTION)).isEqualTo(7);
        assertThat(options.get(MEMORY_OPTION)).isEqualTo(MemorySize.ofKibiBytes(64));
        assertThat(options.get(STRING_OPTION)).isEqualTo("lz4");
        assertThat(INT_OPTION.key()).isEqualTo("test.int");
        assertThat(INT_OPTION.description()).isEqualTo("An int.");
    }

    @Test
    public void testStringValuesAreConverted() {
        Options options = new Options();
        options.setString("test.int", " 42 ");
        options.setString("test.memory", "1 mb");
        options.setString("test.string", "zstd");

        assertThat(options.get(INT_OPTION)).isEqualTo(42);
        assertThat(options.get(MEMORY_OPTION).getBytes()).isEqualTo(1L << 20);
        assertThat(options.get(STRING_OPTION)).isEqualTo("zstd");
    }

    @Test
    public void testTypedSet() {
        Options options = new Options();
        options.set(INT_OPTION, 3).set(MEMORY_OPTION, MemorySize.ofMebiBytes(2));

        assertThat(options.get(INT_OPTION)).isEqualTo(3);
        assertThat(options.get(MEMORY_OPTION)).isEqualTo(MemorySize.parse("2 mb"));
    }

    @Test
    public void testInvalidValue() {
        Options options = new Options();
        options.setString("test.int", "seven");
        assertThatThrownBy(() -> options.get(INT_OPTION))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("test.int");

        options.setString("test.memory", "64 parsecs");
        assertThatThrownBy(() -> options.get(MEMORY_OPTION))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("test.memory");
    }
}
