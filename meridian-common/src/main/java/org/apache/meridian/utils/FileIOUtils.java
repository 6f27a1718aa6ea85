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

package org.apache.meridian.utils;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import java.nio.file.Files;

import static org.apache.meridian.utils.Preconditions.checkNotNull;

/** 本地文件操作工具类。 */
public final class FileIOUtils {

    /**
     * 将缓冲区的剩余内容完整写入通道。
     *
     * <p>{@link WritableByteChannel#write} 可能只写入部分数据,因此需要循环直到缓冲区耗尽。
     */
    public static void writeCompletely(WritableByteChannel channel, ByteBuffer src)
            throws IOException {
        while (src.hasRemaining()) {
            channel.write(src);
        }
    }

    /**
     * 递归删除目录及其全部内容。
     *
     * <p>目录不存在时直接返回;如果给定路径是文件而不是目录,抛出 {@link IOException}。
     */
    public static void deleteDirectory(File directory) throws IOException {
        checkNotNull(directory, "directory");

        if (!directory.exists()) {
            return;
        }
        if (!directory.isDirectory()) {
            throw new IOException(directory + " is not a directory");
        }

        File[] files = directory.listFiles();
        if (files == null) {
            // 目录在列出前被并发删除
            return;
        }
        for (File file : files) {
            deleteFileOrDirectory(file);
        }

        Files.deleteIfExists(directory.toPath());
    }

    /** 删除文件,若是目录则递归删除。 */
    public static void deleteFileOrDirectory(File file) throws IOException {
        checkNotNull(file, "file");

        if (file.isDirectory()) {
            deleteDirectory(file);
        } else if (file.exists() && !file.delete() && file.exists()) {
            throw new FileNotFoundException("Could not delete file " + file);
        }
    }

    private FileIOUtils() {}
}
