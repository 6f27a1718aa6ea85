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

import org.apache.meridian.memory.Buffer;
import org.apache.meridian.utils.FileIOUtils;

import java.io.IOException;
import java.nio.ByteBuffer;

/** 同步写出块的 {@link BufferFileWriter}。 */
public class BufferFileWriterImpl extends AbstractFileIOChannel implements BufferFileWriter {

    private final ByteBuffer header = ByteBuffer.allocate(4);

    protected BufferFileWriterImpl(ID channelID) throws IOException {
        super(channelID, true);
    }

    @Override
    public void writeBlock(Buffer buffer) throws IOException {
        ByteBuffer data = buffer.getNioBuffer(0, buffer.getSize());

        header.clear();
        header.putInt(data.remaining());
        header.flip();

        FileIOUtils.writeCompletely(fileChannel, header);
        FileIOUtils.writeCompletely(fileChannel, data);
    }
}
