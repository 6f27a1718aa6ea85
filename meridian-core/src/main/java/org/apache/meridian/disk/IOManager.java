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

import org.apache.meridian.annotation.Public;

import java.io.File;
import java.io.IOException;

/**
 * 溢写存储服务。
 *
 * <p>为排序器创建、写出、读取和删除临时文件。一个 IOManager 可以被多个累加器共享,通道的创建是线程安全的;
 * 每个通道本身只由一个线程使用。关闭 IOManager 会删除它创建的全部临时文件。
 */
@Public
public interface IOManager extends AutoCloseable {

    FileIOChannel.ID createChannel();

    FileIOChannel.Enumerator createChannelEnumerator();

    BufferFileWriter createBufferFileWriter(FileIOChannel.ID channelID) throws IOException;

    BufferFileReader createBufferFileReader(FileIOChannel.ID channelID) throws IOException;

    /** 配置的临时目录。 */
    String[] tempDirs();

    /** 实际存放溢写文件的目录,首次调用时创建。 */
    File[] spillingDirectories();

    static IOManager create(String... tempDirs) {
        return new IOManagerImpl(tempDirs);
    }
}
