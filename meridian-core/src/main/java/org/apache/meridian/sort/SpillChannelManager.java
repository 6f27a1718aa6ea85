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

import org.apache.meridian.disk.FileIOChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;

/** 记录一个排序器创建的全部溢写通道,{@link #reset()} 时统一关闭并删除。 */
public class SpillChannelManager {

    private static final Logger LOG = LoggerFactory.getLogger(SpillChannelManager.class);

    /** 尚未打开读取的通道 */
    private final HashSet<FileIOChannel.ID> channels;
    /** 已打开读取的通道 */
    private final HashSet<FileIOChannel> openChannels;

    public SpillChannelManager() {
        this.channels = new HashSet<>(64);
        this.openChannels = new HashSet<>(64);
    }

    public synchronized void addChannel(FileIOChannel.ID id) {
        channels.add(id);
    }

    /** 通道被打开读取后转为按打开的通道管理。 */
    public synchronized void addOpenChannels(List<FileIOChannel> toOpen) {
        for (FileIOChannel channel : toOpen) {
            openChannels.add(channel);
            channels.remove(channel.getChannelID());
        }
    }

    public synchronized void removeChannel(FileIOChannel.ID id) {
        channels.remove(id);
    }

    public synchronized void reset() {
        for (Iterator<FileIOChannel> channels = this.openChannels.iterator();
                channels.hasNext(); ) {
            final FileIOChannel channel = channels.next();
            channels.remove();
            try {
                channel.closeAndDelete();
            } catch (Throwable t) {
                LOG.warn("Failed to close and delete spill channel {}", channel.getChannelID(), t);
            }
        }

        for (Iterator<FileIOChannel.ID> channels = this.channels.iterator(); channels.hasNext(); ) {
            final FileIOChannel.ID channel = channels.next();
            channels.remove();
            final File f = channel.getPathFile();
            if (f.exists() && !f.delete()) {
                LOG.warn("Failed to delete spill file {}", f);
            }
        }
    }
}
