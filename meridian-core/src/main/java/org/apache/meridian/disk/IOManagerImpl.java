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

import org.apache.meridian.utils.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

import java.io.File;
import java.io.IOException;

/**
 * {@link IOManager} 的实现。
 *
 * <p>底层的 {@link FileChannelManager} 在第一次需要通道时才创建,因此从未溢写的累加器不会在磁盘上留下任何目录。
 */
public class IOManagerImpl implements IOManager {

    protected static final Logger LOG = LoggerFactory.getLogger(IOManagerImpl.class);

    private static final String DIR_NAME_PREFIX = "io";

    private final String[] tempDirs;

    private volatile FileChannelManager lazyChannelManager;

    public IOManagerImpl(String... tempDirs) {
        Preconditions.checkNotNull(tempDirs);
        Preconditions.checkArgument(tempDirs.length > 0, "No temporary directory configured.");
        this.tempDirs = tempDirs;
    }

    private FileChannelManager fileChannelManager() {
        if (lazyChannelManager == null) {
            synchronized (this) {
                if (lazyChannelManager == null) {
                    lazyChannelManager = new FileChannelManagerImpl(tempDirs, DIR_NAME_PREFIX);
                }
            }
        }

        return lazyChannelManager;
    }

    @Override
    public void close() throws Exception {
        FileChannelManager manager = lazyChannelManager;
        if (manager != null) {
            manager.close();
        }
    }

    @Override
    public FileIOChannel.ID createChannel() {
        return fileChannelManager().createChannel();
    }

    @Override
    public FileIOChannel.Enumerator createChannelEnumerator() {
        return fileChannelManager().createChannelEnumerator();
    }

    @Override
    public BufferFileWriter createBufferFileWriter(FileIOChannel.ID channelID) throws IOException {
        return new BufferFileWriterImpl(channelID);
    }

    @Override
    public BufferFileReader createBufferFileReader(FileIOChannel.ID channelID) throws IOException {
        return new BufferFileReaderImpl(channelID);
    }

    @Override
    public String[] tempDirs() {
        return tempDirs;
    }

    @Override
    public File[] spillingDirectories() {
        return fileChannelManager().getPaths();
    }

    /** 删除通道对应的文件,失败时只记录警告。 */
    public static void deleteChannel(FileIOChannel.ID channel) {
        if (channel != null) {
            if (channel.getPathFile().exists() && !channel.getPathFile().delete()) {
                LOG.warn("IOManager failed to delete temporary file {}", channel.getPath());
            }
        }
    }

    /** 按逗号或系统路径分隔符拆分目录列表。 */
    public static String[] splitPaths(@Nonnull String separatedPaths) {
        return separatedPaths.length() > 0
                ? separatedPaths.split(",|" + File.pathSeparator)
                : new String[0];
    }
}
