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

import org.apache.meridian.utils.FileIOUtils;
import org.apache.meridian.utils.IOUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static org.apache.meridian.utils.Preconditions.checkArgument;
import static org.apache.meridian.utils.Preconditions.checkNotNull;

/**
 * {@link FileChannelManager} 的实现。
 *
 * <p>在每个临时目录下创建一个 {@code meridian-<prefix>-<uuid>} 子目录,所有通道文件都放在这些子目录中,关闭时整体删除。
 * 无法创建的目录会被跳过,一个都不可用时构造失败。
 */
public class FileChannelManagerImpl implements FileChannelManager {

    private static final Logger LOG = LoggerFactory.getLogger(FileChannelManagerImpl.class);

    private final File[] paths;

    private final Random random;

    private final AtomicLong nextPath = new AtomicLong(0);

    public FileChannelManagerImpl(String[] tempDirs, String prefix) {
        checkNotNull(tempDirs, "The temporary directories must not be null.");
        checkArgument(tempDirs.length > 0, "The temporary directories must not be empty.");

        this.random = new Random();
        this.paths = createFiles(tempDirs, prefix);

        LOG.info(
                "Created a new {} for spilling of sort runs to disk. Used directories:\n\t{}",
                FileChannelManager.class.getSimpleName(),
                Arrays.stream(paths).map(File::getAbsolutePath).collect(Collectors.joining("\n\t")));
    }

    private static File[] createFiles(String[] tempDirs, String prefix) {
        List<File> filesList = new ArrayList<>();
        for (String tempDir : tempDirs) {
            File storageDir =
                    new File(tempDir, String.format("meridian-%s-%s", prefix, UUID.randomUUID()));

            if (!storageDir.exists() && !storageDir.mkdirs()) {
                LOG.warn(
                        "Failed to create directory {}, temp directory {} will not be used",
                        storageDir.getAbsolutePath(),
                        tempDir);
                continue;
            }

            filesList.add(storageDir);
        }

        if (filesList.isEmpty()) {
            throw new UncheckedIOException(
                    new IOException(
                            "No available temporary directories in " + Arrays.toString(tempDirs)));
        }

        return filesList.toArray(new File[0]);
    }

    @Override
    public FileIOChannel.ID createChannel() {
        int num = (int) (nextPath.getAndIncrement() % paths.length);
        return new FileIOChannel.ID(paths[num], num, random);
    }

    @Override
    public FileIOChannel.Enumerator createChannelEnumerator() {
        return new FileIOChannel.Enumerator(paths, random);
    }

    @Override
    public File[] getPaths() {
        return Arrays.copyOf(paths, paths.length);
    }

    @Override
    public void close() throws Exception {
        IOUtils.closeAll(
                Arrays.stream(paths)
                        .filter(File::exists)
                        .map(this::getFileCloser)
                        .collect(Collectors.toList()));
    }

    private AutoCloseable getFileCloser(File path) {
        return () -> {
            try {
                FileIOUtils.deleteDirectory(path);
                LOG.info(
                        "FileChannelManager removed spill file directory {}",
                        path.getAbsolutePath());
            } catch (IOException e) {
                String errorMessage =
                        String.format(
                                "FileChannelManager failed to properly clean up temp file directory: %s",
                                path);
                throw new UncheckedIOException(errorMessage, e);
            }
        };
    }
}
