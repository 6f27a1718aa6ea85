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

import org.apache.meridian.compression.CompressOptions;
import org.apache.meridian.data.BinaryString;
import org.apache.meridian.data.serializer.BinaryStringSerializer;
import org.apache.meridian.data.serializer.LongSerializer;
import org.apache.meridian.disk.IOManager;
import org.apache.meridian.options.MemorySize;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ExternalSorter}. */
public class ExternalSorterTest {

    private static final int PAGE_SIZE = 64;

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

    private ExternalSorter<Long> createSorter(int numPages, int maxNumFileHandles) {
        return createSorter(numPages, maxNumFileHandles, MemorySize.MAX_VALUE);
    }

    private ExternalSorter<Long> createSorter(
            int numPages, int maxNumFileHandles, MemorySize maxDiskSize) {
        return ExternalSorter.create(
                LongSerializer.INSTANCE,
                Comparator.naturalOrder(),
                ioManager,
                (long) numPages * PAGE_SIZE,
                PAGE_SIZE,
                maxNumFileHandles,
                new CompressOptions("lz4", 1),
                256,
                maxDiskSize);
    }

    @Test
    public void testInMemory() throws Exception {
        try (ExternalSorter<Long> sorter = createSorter(64, 128)) {
            for (long v : new long[] {5, 3, 8, 1, 3}) {
                sorter.insert(v);
            }
            assertThat(sorter.getState()).isEqualTo(SortState.ACCEPTING);
            sorter.sort();
            assertThat(sorter.getState()).isEqualTo(SortState.SORTED);
            assertThat(sorter.spilledRuns()).isZero();
            assertThat(sorter.size()).isEqualTo(5);

            List<Long> result = new ArrayList<>();
            while (sorter.hasNext()) {
                result.add(sorter.next());
            }
            assertThat(result).containsExactly(1L, 3L, 3L, 5L, 8L);
            assertThat(sorter.remaining()).isZero();
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 128})
    public void testSpillAndMerge(int maxNumFileHandles) throws Exception {
        Random random = new Random(maxNumFileHandles);
        List<Long> expected = new ArrayList<>();
        try (ExternalSorter<Long> sorter = createSorter(8, maxNumFileHandles)) {
            for (int i = 0; i < 5000; i++) {
                long value = random.nextInt(1000);
                expected.add(value);
                sorter.insert(value);
            }
            sorter.sort();
            assertThat(sorter.spilledRuns()).isBetween(1, maxNumFileHandles);
            assertThat(sorter.spilledBytes()).isPositive();
            assertThat(sorter.size()).isEqualTo(5000);

            expected.sort(Comparator.naturalOrder());
            List<Long> result = new ArrayList<>();
            while (sorter.hasNext()) {
                result.add(sorter.next());
            }
            assertThat(result).isEqualTo(expected);
        }
        assertThat(spillFiles()).isEmpty();
    }

    @Test
    public void testSkip() throws Exception {
        for (int numPages : new int[] {8, 1024}) {
            try (ExternalSorter<Long> sorter = createSorter(numPages, 4)) {
                for (long v = 999; v >= 0; v--) {
                    sorter.insert(v);
                }
                sorter.sort();
                assertThat(sorter.spilledRuns() > 0).isEqualTo(numPages == 8);

                sorter.skip(0);
                sorter.skip(500);
                assertThat(sorter.remaining()).isEqualTo(500);
                assertThat(sorter.next()).isEqualTo(500L);
                sorter.skip(498);
                assertThat(sorter.next()).isEqualTo(999L);
                assertThat(sorter.hasNext()).isFalse();
            }
        }
    }

    @Test
    public void testSkipOutOfRange() throws Exception {
        try (ExternalSorter<Long> sorter = createSorter(64, 128)) {
            sorter.insert(1L);
            sorter.insert(2L);
            sorter.sort();

            assertThatThrownBy(() -> sorter.skip(-1))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> sorter.skip(3))
                    .isInstanceOfSatisfying(
                            SequenceOutOfRangeException.class,
                            e -> {
                                assertThat(e.getRequested()).isEqualTo(3);
                                assertThat(e.getRemaining()).isEqualTo(2);
                            })
                    .hasMessage("Cannot skip 3 elements, only 2 remaining.");
            // failed skips consume nothing
            assertThat(sorter.remaining()).isEqualTo(2);

            sorter.skip(2);
            assertThatThrownBy(sorter::next).isInstanceOf(NoSuchElementException.class);
        }
    }

    @Test
    public void testEmpty() throws Exception {
        try (ExternalSorter<Long> sorter = createSorter(64, 128)) {
            sorter.sort();
            assertThat(sorter.hasNext()).isFalse();
            assertThat(sorter.size()).isZero();
            sorter.skip(0);
            assertThatThrownBy(sorter::next).isInstanceOf(NoSuchElementException.class);
        }
    }

    @Test
    public void testStateChecks() throws Exception {
        ExternalSorter<Long> sorter = createSorter(64, 128);
        assertThatThrownBy(() -> sorter.insert(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(sorter::next).isInstanceOf(IllegalStateException.class);

        sorter.insert(1L);
        sorter.sort();
        assertThatThrownBy(() -> sorter.insert(2L)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(sorter::sort).isInstanceOf(IllegalStateException.class);

        sorter.close();
        sorter.close();
        assertThat(sorter.getState()).isEqualTo(SortState.CLOSED);
        assertThat(sorter.remaining()).isZero();
        assertThat(sorter.hasNext()).isFalse();
        assertThatThrownBy(sorter::next).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testCloseRemovesSpillFiles() throws Exception {
        ExternalSorter<Long> sorter = createSorter(8, 128);
        for (long v = 0; v < 2000; v++) {
            sorter.insert(v);
        }
        assertThat(spillFiles()).isNotEmpty();

        // close while the merge is still open for reading
        sorter.sort();
        sorter.next();
        sorter.close();
        assertThat(spillFiles()).isEmpty();
    }

    @Test
    public void testMaxDiskSize() throws Exception {
        try (ExternalSorter<Long> sorter = createSorter(8, 128, MemorySize.ofBytes(1))) {
            assertThatThrownBy(
                            () -> {
                                for (long v = 0; v < 10_000; v++) {
                                    sorter.insert(v);
                                }
                            })
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("exceeds maximum disk size");
            assertThat(sorter.spilledRuns()).isEqualTo(1);
        }
        assertThat(spillFiles()).isEmpty();
    }

    @Test
    public void testValueLargerThanBuffer() throws Exception {
        try (ExternalSorter<BinaryString> sorter =
                ExternalSorter.create(
                        BinaryStringSerializer.INSTANCE,
                        Comparator.naturalOrder(),
                        ioManager,
                        PAGE_SIZE * 4,
                        PAGE_SIZE,
                        128,
                        CompressOptions.defaultOptions(),
                        256,
                        MemorySize.MAX_VALUE)) {
            sorter.insert(BinaryString.fromString("small"));
            char[] chars = new char[PAGE_SIZE * 8];
            Arrays.fill(chars, 'x');
            assertThatThrownBy(() -> sorter.insert(BinaryString.fromString(new String(chars))))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("maximum size of a sort buffer");
        }
    }

    @Test
    public void testInvalidArguments() {
        assertThatThrownBy(() -> createSorter(64, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("file handles");
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
