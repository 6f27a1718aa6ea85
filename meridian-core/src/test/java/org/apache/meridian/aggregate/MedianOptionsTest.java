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

import org.apache.meridian.compression.CompressOptions;
import org.apache.meridian.options.MemorySize;
import org.apache.meridian.options.Options;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link MedianOptions}. */
public class MedianOptionsTest {

    @Test
    public void testDefaults() {
        MedianOptions options = new MedianOptions(new Options());
        assertThat(options.spillBufferSize()).isEqualTo(5000L * 1024);
        assertThat(options.pageSize()).isEqualTo(32 * 1024);
        assertThat(options.maxNumFileHandles()).isEqualTo(128);
        assertThat(options.spillCompressOptions()).isEqualTo(new CompressOptions("lz4", 1));
        assertThat(options.spillCompressionBlockSize()).isEqualTo(64 * 1024);
        assertThat(options.maxDiskSize()).isEqualTo(MemorySize.MAX_VALUE);
        assertThat(options.tmpDirs()).isEqualTo(System.getProperty("java.io.tmpdir"));
    }

    @Test
    public void testFromStrings() {
        Options conf = new Options();
        conf.setString("sort.spill-buffer-size", "1 mb");
        conf.setString("sort.page-size", "4 kb");
        conf.setString("sort.max-num-file-handles", "16");
        conf.setString("sort.spill-compression", "ZSTD");
        conf.setString("sort.spill-compression.zstd-level", "3");
        conf.setString("sort.max-disk-size", "10 gb");
        MedianOptions options = new MedianOptions(conf);

        assertThat(options.spillBufferSize()).isEqualTo(1024L * 1024);
        assertThat(options.pageSize()).isEqualTo(4096);
        assertThat(options.maxNumFileHandles()).isEqualTo(16);
        assertThat(options.spillCompressOptions()).isEqualTo(new CompressOptions("ZSTD", 3));
        assertThat(options.maxDiskSize()).isEqualTo(MemorySize.ofMebiBytes(10 * 1024));
        assertThat(options.toConfiguration()).isSameAs(conf);
    }

    @Test
    public void testInvalidPageSize() {
        Options conf = new Options();
        conf.setString("sort.page-size", "100 b");
        assertThatThrownBy(() -> new MedianOptions(conf))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("power of two");
    }

    @Test
    public void testPageSmallerThanIndexEntry() {
        Options conf = new Options();
        conf.setString("sort.spill-buffer-size", "1 kb");
        conf.setString("sort.page-size", "8 b");
        assertThatThrownBy(() -> new MedianOptions(conf))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sort.page-size must be at least 16 bytes");

        conf.setString("sort.page-size", "16 b");
        assertThat(new MedianOptions(conf).pageSize()).isEqualTo(16);
    }

    @Test
    public void testBufferTooSmall() {
        Options conf = new Options();
        conf.setString("sort.spill-buffer-size", "64 kb");
        conf.setString("sort.page-size", "32 kb");
        assertThatThrownBy(() -> new MedianOptions(conf))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 3 pages");
    }

    @Test
    public void testTooFewFileHandles() {
        Options conf = new Options();
        conf.set(MedianOptions.SORT_MAX_NUM_FILE_HANDLES, 1);
        assertThatThrownBy(() -> new MedianOptions(conf))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sort.max-num-file-handles");
    }

    @Test
    public void testUnknownCompression() {
        Options conf = new Options();
        conf.setString("sort.spill-compression", "snappy");
        assertThatThrownBy(() -> new MedianOptions(conf))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("snappy");
    }

    @Test
    public void testNoTmpDirs() {
        Options conf = new Options();
        conf.setString("io.tmp-dirs", "");
        assertThatThrownBy(() -> new MedianOptions(conf))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("io.tmp-dirs");
    }

    @Test
    public void testUnparsableValue() {
        Options conf = new Options();
        conf.setString("sort.spill-buffer-size", "lots");
        assertThatThrownBy(() -> new MedianOptions(conf))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
