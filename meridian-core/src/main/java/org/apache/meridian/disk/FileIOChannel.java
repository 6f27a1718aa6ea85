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

package org.apache.meridian.disk;

import org.apache.meridian.utils.StringUtils;

import java.io.File;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 一个临时溢写文件的通道。
 *
 * <p>通道由 {@link ID} 标识,ID 只描述路径,不持有文件句柄。同一个 ID 可以先用写通道写出一个有序段(run),关闭后再用读通道读回。
 */
public interface FileIOChannel {

    ID getChannelID();

    /** 文件当前大小(字节)。 */
    long getSize() throws IOException;

    boolean isClosed();

    void close() throws IOException;

    /**
     * 删除底层文件。
     *
     * @throws IllegalStateException 通道仍处于打开状态
     */
    void deleteChannel();

    FileChannel getNioFileChannel();

    /** 关闭并删除,即使关闭失败也会尝试删除。 */
    void closeAndDelete() throws IOException;

    // --------------------------------------------------------------------------------------------

    /** 通道 ID:临时目录中一个随机命名的文件路径,以及该目录的编号。 */
    final class ID {

        private static final int RANDOM_BYTES_LENGTH = 16;

        private final File path;

        private final int bucketNum;

        private ID(File path, int bucketNum) {
            this.path = path;
            this.bucketNum = bucketNum;
        }

        public ID(File basePath, int bucketNum, Random random) {
            this(new File(basePath, randomString(random) + ".channel"), bucketNum);
        }

        public String getPath() {
            return path.getAbsolutePath();
        }

        public File getPathFile() {
            return path;
        }

        /** 所在临时目录的编号。 */
        public int getBucketNum() {
            return bucketNum;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof ID) {
                ID other = (ID) obj;
                return this.path.equals(other.path) && this.bucketNum == other.bucketNum;
            } else {
                return false;
            }
        }

        @Override
        public int hashCode() {
            return path.hashCode();
        }

        @Override
        public String toString() {
            return path.getAbsolutePath();
        }

        private static String randomString(Random random) {
            byte[] bytes = new byte[RANDOM_BYTES_LENGTH];
            random.nextBytes(bytes);
            return StringUtils.byteToHexString(bytes);
        }
    }

    /**
     * 为一个排序器连续生成通道 ID。
     *
     * <p>同一个枚举器生成的文件名共享随机前缀并带有递增序号,各文件在临时目录之间轮转分布。
     */
    final class Enumerator {

        private static final AtomicInteger GLOBAL_NUMBER = new AtomicInteger();

        private final File[] paths;

        private final String namePrefix;

        private int localCounter;

        public Enumerator(File[] basePaths, Random random) {
            this.paths = basePaths;
            this.namePrefix = ID.randomString(random);
            this.localCounter = 0;
        }

        public ID next() {
            int bucketNum = Math.floorMod(GLOBAL_NUMBER.getAndIncrement(), paths.length);
            String filename = String.format("%s.%06d.channel", namePrefix, (localCounter++));
            return new ID(new File(paths[bucketNum], filename), bucketNum);
        }
    }
}
