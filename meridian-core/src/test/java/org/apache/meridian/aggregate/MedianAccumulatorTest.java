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
import org.apache.meridian.data.Decimal;
import org.apache.meridian.disk.IOManager;
import org.apache.meridian.options.Options;
import org.apache.meridian.types.DataType;
import org.apache.meridian.types.DataTypes;
import org.apache.meridian.types.UnsupportedTypeException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link MedianAccumulator}. */
public class MedianAccumulatorTest {

    @TempDir Path tempDir;

    private IOManager ioManager;

    @BeforeEach
    public void before() {
        ioManager = IOManager.create(tempDir.toString());
    }

    @AfterEach
    public void after() throws Exception {
        ioManager.close();
    }

    /** Options with a sort buffer of a few tiny pages, so that every group spills. */
    private static Options smallMemory() {
        Options options = new Options();
        options.setString(MedianOptions.SORT_SPILL_BUFFER_SIZE.key(), "512 b");
        options.setString(MedianOptions.PAGE_SIZE.key(), "64 b");
        options.setString(MedianOptions.SPILL_COMPRESSION_BLOCK_SIZE.key(), "256 b");
        return options;
    }

    private <T> MedianAccumulator<T> create(DataType type, Options options) {
        return MedianAccumulator.create(
                type, DefaultComparatorResolver.INSTANCE, ioManager, options);
    }

    private Integer intMedian(Integer... values) throws IOException {
        MedianAccumulator<Integer> accumulator = create(DataTypes.INT(), new Options());
        for (Integer value : values) {
            accumulator.insert(value);
        }
        return accumulator.finalizeValue();
    }

    @Test
    public void testMedianOfSmallGroups() throws Exception {
        assertThat(intMedian(5, 3, 8, 1)).isEqualTo(5);
        assertThat(intMedian(7)).isEqualTo(7);
        assertThat(intMedian(null, 3, null)).isEqualTo(3);
        assertThat(intMedian()).isNull();
        assertThat(intMedian(null, null)).isNull();
        assertThat(intMedian(9, 2, 2, 4, 4)).isEqualTo(4);
        assertThat(intMedian(1, 1, 1, 2)).isEqualTo(1);
        assertThat(intMedian(2, 1)).isEqualTo(2);
    }

    @Test
    public void testNullsAreNotCounted() throws Exception {
        MedianAccumulator<Integer> accumulator = create(DataTypes.INT(), new Options());
        accumulator.insert(null);
        assertThat(accumulator.getCount()).isZero();
        assertThat(accumulator.sorter()).isNull();

        accumulator.insert(4);
        accumulator.insert(null);
        assertThat(accumulator.getCount()).isEqualTo(1);
        assertThat(accumulator.sorter()).isNotNull();
        assertThat(accumulator.finalizeValue()).isEqualTo(4);
        assertThat(accumulator.isFinished()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 1000, 4999, 10_000})
    public void testSpillingMatchesInMemory(int size) throws Exception {
        Random random = new Random(size);
        List<Long> values = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            values.add((long) random.nextInt(size) - size / 2);
        }

        MedianAccumulator<Long> spilling = create(DataTypes.BIGINT(), smallMemory());
        MedianAccumulator<Long> inMemory = create(DataTypes.BIGINT(), new Options());
        for (Long value : values) {
            spilling.insert(value);
            inMemory.insert(value);
        }
        if (size >= 1000) {
            assertThat(spilling.sorter().spilledRuns()).isPositive();
        }
        assertThat(inMemory.sorter().spilledRuns()).isZero();

        List<Long> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        Long expected = sorted.get(size / 2);
        assertThat(spilling.finalizeValue()).isEqualTo(expected);
        assertThat(inMemory.finalizeValue()).isEqualTo(expected);
    }

    @Test
    public void testInsertionOrderDoesNotMatter() throws Exception {
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < 2000; i++) {
            values.add(i % 97);
        }
        Random random = new Random(11);
        Integer first = null;
        for (int round = 0; round < 5; round++) {
            Collections.shuffle(values, random);
            MedianAccumulator<Integer> accumulator = create(DataTypes.INT(), smallMemory());
            for (Integer value : values) {
                accumulator.insert(value);
            }
            Integer median = accumulator.finalizeValue();
            if (first == null) {
                first = median;
            }
            assertThat(median).isEqualTo(first);
        }
        List<Integer> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        assertThat(first).isEqualTo(sorted.get(1000));
    }

    @Test
    public void testTextByteOrder() throws Exception {
        MedianAccumulator<BinaryString> accumulator = create(DataTypes.STRING(), new Options());
        for (String s : Arrays.asList("é", "a", "Z", "B")) {
            accumulator.insert(BinaryString.fromString(s));
        }
        assertThat(accumulator.getComparator().getCollation()).isEqualTo(Collation.BINARY);
        // B < Z < a < é
        assertThat(accumulator.finalizeValue()).isEqualTo(BinaryString.fromString("a"));
    }

    @Test
    public void testFloatingPointOrder() throws Exception {
        MedianAccumulator<Double> accumulator = create(DataTypes.DOUBLE(), new Options());
        accumulator.insert(Double.NaN);
        accumulator.insert(0.0);
        accumulator.insert(-0.0);
        // -0.0 < 0.0 < NaN
        assertThat(accumulator.finalizeValue()).isEqualTo(0.0);
    }

    @Test
    public void testDecimal() throws Exception {
        MedianAccumulator<Decimal> accumulator = create(DataTypes.DECIMAL(20, 3), smallMemory());
        for (int i = 0; i < 501; i++) {
            accumulator.insert(
                    Decimal.fromBigDecimal(BigDecimal.valueOf(1000 - i, 3), 20, 3));
        }
        assertThat(accumulator.finalizeValue().toBigDecimal())
                .isEqualByComparingTo(new BigDecimal("0.750"));
    }

    @Test
    public void testFinalizeTwice() throws Exception {
        MedianAccumulator<Integer> accumulator = create(DataTypes.INT(), new Options());
        accumulator.insert(1);
        accumulator.finalizeValue();
        assertThatThrownBy(accumulator::finalizeValue)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already been finalized");
        assertThatThrownBy(() -> accumulator.insert(2))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("finalized");
    }

    @Test
    public void testInsertAfterClose() throws Exception {
        MedianAccumulator<Integer> accumulator = create(DataTypes.INT(), new Options());
        accumulator.insert(1);
        accumulator.close();
        accumulator.close();
        assertThatThrownBy(() -> accumulator.insert(2)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(accumulator::finalizeValue).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testSpillFilesRemovedAfterFinalize() throws Exception {
        MedianAccumulator<Long> accumulator = create(DataTypes.BIGINT(), smallMemory());
        for (long v = 0; v < 3000; v++) {
            accumulator.insert(v);
        }
        assertThat(spillFiles()).isNotEmpty();
        assertThat(accumulator.finalizeValue()).isEqualTo(1500L);
        assertThat(spillFiles()).isEmpty();
    }

    @Test
    public void testDiskQuota() throws Exception {
        Options options = smallMemory();
        options.setString(MedianOptions.SORT_MAX_DISK_SIZE.key(), "1 b");
        MedianAccumulator<Long> accumulator = create(DataTypes.BIGINT(), options);
        assertThatThrownBy(
                        () -> {
                            for (long v = 0; v < 3000; v++) {
                                accumulator.insert(v);
                            }
                        })
                .isInstanceOf(IOException.class)
                .hasMessageContaining("maximum disk size");
        accumulator.close();
        assertThat(spillFiles()).isEmpty();
    }

    @Test
    public void testUnsupportedType() {
        assertThatThrownBy(() -> create(DataTypes.ARRAY(DataTypes.INT()), new Options()))
                .isInstanceOf(UnsupportedTypeException.class);
    }

    private List<File> spillFiles() {
        List<File> files = new ArrayList<>();
        for (File dir : ioManager.spillingDirectories()) {
            File[] children = dir.listFiles();
            if (children != null) {
                files.addAll(Arrays.asList(children));
            }
        }
        return files;
    }
}
