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

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;

/** 基于 {@link FileChannel} 的通道基类。 */
public abstract class AbstractFileIOChannel implements FileIOChannel {

    protected static final Logger LOG = LoggerFactory.getLogger(FileIOChannel.class);

    protected final FileIOChannel.ID id;

    protected final FileChannel fileChannel;

    /**
     * @param channelID 通道 ID
     * @param writeEnabled 是否以读写模式打开,写模式下文件不存在时会被创建
     * @throws IOException 文件无法打开
     */
    protected AbstractFileIOChannel(FileIOChannel.ID channelID, boolean writeEnabled)
            throws IOException {
        this.id = Preconditions.checkNotNull(channelID);

        try {
            @SuppressWarnings("resource")
            RandomAccessFile file = new RandomAccessFile(id.getPath(), writeEnabled ? "rw" : "r");
            this.fileChannel = file.getChannel();
        } catch (IOException e) {
            throw new IOException(
                    "Channel to path '" + channelID.getPath() + "' could not be opened.", e);
        }
    }

    @Override
    public final FileIOChannel.ID getChannelID() {
        return this.id;
    }

    @Override
    public long getSize() throws IOException {
        return fileChannel.size();
    }

    @Override
    public boolean isClosed() {
        return !this.fileChannel.isOpen();
    }

    @Override
    public void close() throws IOException {
        if (this.fileChannel.isOpen()) {
            this.fileChannel.close();
        }
    }

    @Override
    public void deleteChannel() {
        if (!isClosed()) {
            throw new IllegalStateException("Cannot delete a channel that is open.");
        }

        File f = new File(this.id.getPath());
        if (f.exists() && !f.delete()) {
            LOG.warn("Failed to delete channel file {}.", f.getAbsolutePath());
        }
    }

    @Override
    public void closeAndDelete() throws IOException {
        try {
            close();
        } finally {
            deleteChannel();
        }
    }

    @Override
    public FileChannel getNioFileChannel() {
        return fileChannel;
    }
}
