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

package org.apache.meridian.aggregate;

import org.apache.meridian.data.BinaryString;
import org.apache.meridian.data.Timestamp;
import org.apache.meridian.options.Options;
import org.apache.meridian.types.DataType;
import org.apache.meridian.types.DataTypes;
import org.apache.meridian.types.UnsupportedTypeException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link MedianAggregateFunction}. */
public class MedianAggregateFunctionTest {

    @TempDir Path tempDir;

    private MedianAggregateFunction function;

    @BeforeEach
    public void before() {
        Options options = new Options();
        options.set(MedianOptions.IO_TMP_DIRS, tempDir.toString());
        options.setString(MedianOptions.SORT_SPILL_BUFFER_SIZE.key(), "1 kb");
        options.setString(MedianOptions.PAGE_SIZE.key(), "128 b");
        function = MedianAggregateFunction.create(options);
    }

    @AfterEach
    public void after() throws Exception {
        function.close();
    }

    private Object median(DataType type, Object... values) throws IOException {
        MedianAccumulator<?> handle = function.init(type);
        for (Object value : values) {
            function.insert(handle, value);
        }
        return function.finalizeValue(handle);
    }

    @Test
    public void testIdentifier() {
        assertThat(function.identifier()).isEqualTo("median");
    }

    @Test
    public void testGroups() throws Exception {
        assertThat(median(DataTypes.INT(), 5, 3, 8, 1)).isEqualTo(5);
        assertThat(median(DataTypes.INT(), 7)).isEqualTo(7);
        assertThat(median(DataTypes.INT(), null, 3, null)).isEqualTo(3);
        assertThat(median(DataTypes.INT())).isNull();
        assertThat(median(DataTypes.INT(), 9, 2, 2, 4, 4)).isEqualTo(4);
        assertThat(median(DataTypes.INT(), 1, 1, 1, 2)).isEqualTo(1);
    }

    @Test
    public void testOtherTypes() throws Exception {
        assertThat(median(DataTypes.SMALLINT(), (short) 3, (short) -1, (short) 2))
                .isEqualTo((short) 2);
        assertThat(median(DataTypes.BOOLEAN(), true, false, false)).isEqualTo(false);
        assertThat(
                        median(
                                DataTypes.VARCHAR(10),
                                BinaryString.fromString("pear"),
                                BinaryString.fromString("apple"),
                                BinaryString.fromString("fig")))
                .isEqualTo(BinaryString.fromString("fig"));
        assertThat(
                        median(
                                DataTypes.TIMESTAMP(),
                                Timestamp.fromEpochMillis(30),
                                Timestamp.fromEpochMillis(10),
                                Timestamp.fromEpochMillis(20),
                                Timestamp.fromEpochMillis(40)))
                .isEqualTo(Timestamp.fromEpochMillis(30));
        assertThat((byte[]) median(DataTypes.BYTES(), new byte[] {3}, new byte[] {1}))
                .containsExactly(3);
    }

    @Test
    public void testManyGroupsShareTheFunction() throws Exception {
        MedianAccumulator<?> even = function.init(DataTypes.BIGINT());
        MedianAccumulator<?> odd = function.init(DataTypes.BIGINT());
        for (long v = 0; v < 2000; v++) {
            function.insert(v % 2 == 0 ? even : odd, v);
        }
        assertThat(function.finalizeValue(even)).isEqualTo(1000L);
        assertThat(function.finalizeValue(odd)).isEqualTo(1001L);
    }

    @Test
    public void testWrongValueClass() {
        MedianAccumulator<?> handle = function.init(DataTypes.INT());
        assertThatThrownBy(() -> function.insert(handle, 1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("java.lang.Long");
        assertThatThrownBy(() -> function.insert(handle, "text"))
                .isInstanceOf(IllegalArgumentException.class);
        handle.close();
    }

    @Test
    public void testUnsupportedType() {
        assertThatThrownBy(() -> function.init(DataTypes.MAP(DataTypes.INT(), DataTypes.INT())))
                .isInstanceOf(UnsupportedTypeException.class);
        assertThatThrownBy(
                        () -> MedianAggregateFunction.internalClass(
                                DataTypes.ARRAY(DataTypes.INT())))
                .isInstanceOf(UnsupportedTypeException.class);
    }

    @Test
    public void testCloseRemovesSpillDirectories() throws Exception {
        MedianAccumulator<?> handle = function.init(DataTypes.BIGINT());
        for (long v = 0; v < 1000; v++) {
            function.insert(handle, v);
        }
        File[] children = tempDir.toFile().listFiles();
        assertThat(children).isNotEmpty();

        handle.close();
        function.close();
        assertThat(tempDir.toFile().listFiles()).isEmpty();
    }
}
