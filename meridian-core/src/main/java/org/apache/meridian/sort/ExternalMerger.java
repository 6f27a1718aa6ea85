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

import org.apache.meridian.compression.BlockCompressionFactory;
import org.apache.meridian.data.serializer.Serializer;
import org.apache.meridian.disk.ChannelReaderInputView;
import org.apache.meridian.disk.ChannelWithMeta;
import org.apache.meridian.disk.ChannelWriterOutputView;
import org.apache.meridian.disk.FileChannelUtil;
import org.apache.meridian.disk.FileIOChannel;
import org.apache.meridian.disk.IOManager;
import org.apache.meridian.utils.MutableObjectIterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 溢写段的归并器。
 *
 * <p>负责两件事:为最终读取打开一个跨所有段的 {@link MergeIterator};段数达到扇入上限时把若干段合并成更少的段(中间归并)。
 *
 * @param <T> 元素类型
 */
public class ExternalMerger<T> implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ExternalMerger.class);

    /** 关闭后中间归并提前结束 */
    private volatile boolean closed;

    /** 最大扇入 */
    private final int maxFanIn;
    /** 溢写通道管理器 */
    private final SpillChannelManager channelManager;
    /** 压缩编解码工厂 */
    private final BlockCompressionFactory compressionCodecFactory;
    /** 压缩块大小 */
    private final int compressionBlockSize;
    /** 值序列化器 */
    private final Serializer<T> serializer;
    /** 值比较器 */
    private final Comparator<T> comparator;

    /** IO管理器 */
    protected final IOManager ioManager;

    /**
     * 构造外部归并器。
     *
     * @param ioManager IO管理器
     * @param maxFanIn 最大扇入
     * @param channelManager 溢写通道管理器,中间归并产生和删除的通道都登记在这里
     * @param serializer 值序列化器
     * @param comparator 值比较器
     * @param compressionCodecFactory 压缩编解码工厂
     * @param compressionBlockSize 压缩块大小
     */
    public ExternalMerger(
            IOManager ioManager,
            int maxFanIn,
            SpillChannelManager channelManager,
            Serializer<T> serializer,
            Comparator<T> comparator,
            BlockCompressionFactory compressionCodecFactory,
            int compressionBlockSize) {
        this.ioManager = ioManager;
        this.maxFanIn = maxFanIn;
        this.channelManager = channelManager;
        this.serializer = serializer;
        this.comparator = comparator;
        this.compressionCodecFactory = compressionCodecFactory;
        this.compressionBlockSize = compressionBlockSize;
    }

    @Override
    public void close() {
        this.closed = true;
    }

    /**
     * 为给定的段打开归并迭代器,打开的通道追加到 {@code openChannels},由调用方负责关闭。
     */
    public MergeIterator<T> getMergingIterator(
            List<ChannelWithMeta> channelIDs, List<FileIOChannel> openChannels) throws IOException {
        if (LOG.isDebugEnabled()) {
            LOG.debug("Performing merge of {} sorted streams.", channelIDs.size());
        }

        final List<MutableObjectIterator<T>> iterators = new ArrayList<>(channelIDs.size() + 1);
        for (ChannelWithMeta channel : channelIDs) {
            ChannelReaderInputView view =
                    FileChannelUtil.createInputView(
                            ioManager,
                            channel,
                            openChannels,
                            compressionCodecFactory,
                            compressionBlockSize);
            iterators.add(view.createIterator(serializer.duplicate()));
        }

        return new MergeIterator<>(iterators, comparator);
    }

    /**
     * 把段列表合并到不超过扇入上限的数量。
     *
     * <p>长度为 maxFanIn<sup>i</sup> 的列表可以经过 i-1 轮满扇入合并得到 maxFanIn 个段。不满的一轮放在最前面做最省。
     */
    public List<ChannelWithMeta> mergeChannelList(List<ChannelWithMeta> channelIDs)
            throws IOException {
        final double scale = Math.ceil(Math.log(channelIDs.size()) / Math.log(maxFanIn)) - 1;

        final int numStart = channelIDs.size();
        final int numEnd = (int) Math.pow(maxFanIn, scale);

        final int numMerges = (int) Math.ceil((numStart - numEnd) / (double) (maxFanIn - 1));

        final int numNotMerged = numEnd - numMerges;
        final int numToMerge = numStart - numNotMerged;

        // unmerged channel IDs are copied directly to the result list
        final List<ChannelWithMeta> mergedChannelIDs = new ArrayList<>(numEnd);
        mergedChannelIDs.addAll(channelIDs.subList(0, numNotMerged));

        final int channelsToMergePerStep = (int) Math.ceil(numToMerge / (double) numMerges);

        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Intermediate merge of {} runs into {} runs, {} runs per step.",
                    numStart,
                    numEnd,
                    channelsToMergePerStep);
        }

        final List<ChannelWithMeta> channelsToMergeThisStep =
                new ArrayList<>(channelsToMergePerStep);
        int channelNum = numNotMerged;
        while (!closed && channelNum < channelIDs.size()) {
            channelsToMergeThisStep.clear();

            for (int i = 0;
                    i < channelsToMergePerStep && channelNum < channelIDs.size();
                    i++, channelNum++) {
                channelsToMergeThisStep.add(channelIDs.get(channelNum));
            }

            mergedChannelIDs.add(mergeChannels(channelsToMergeThisStep));
        }

        return mergedChannelIDs;
    }

    /** 把若干段合并写到一个新通道,输入通道在返回前删除。 */
    private ChannelWithMeta mergeChannels(List<ChannelWithMeta> channelIDs) throws IOException {
        List<FileIOChannel> openChannels = new ArrayList<>(channelIDs.size());
        final FileIOChannel.ID mergedChannelID = ioManager.createChannel();
        channelManager.addChannel(mergedChannelID);
        ChannelWriterOutputView output = null;

        try {
            final MergeIterator<T> mergeIterator = getMergingIterator(channelIDs, openChannels);
            output =
                    FileChannelUtil.createOutputView(
                            ioManager,
                            mergedChannelID,
                            compressionCodecFactory,
                            compressionBlockSize);
            T value;
            while ((value = mergeIterator.next()) != null) {
                serializer.serialize(value, output);
            }
            output.close();
        } catch (IOException e) {
            if (output != null) {
                output.closeAndDelete();
                channelManager.removeChannel(mergedChannelID);
            }
            throw e;
        } finally {
            for (FileIOChannel channel : openChannels) {
                channelManager.removeChannel(channel.getChannelID());
                try {
                    channel.closeAndDelete();
                } catch (Throwable t) {
                    LOG.warn("Failed to delete merged spill channel {}", channel.getChannelID(), t);
                }
            }
        }

        return new ChannelWithMeta(mergedChannelID, output.getBlockCount(), output.getWriteBytes());
    }
}
