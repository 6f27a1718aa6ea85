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

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;

import static org.apache.meridian.utils.Preconditions.checkArgument;

/** 同步读取块的 {@link BufferFileReader}。 */
public class BufferFileReaderImpl extends AbstractFileIOChannel implements BufferFileReader {

    private final ByteBuffer header = ByteBuffer.allocate(4);

    private boolean hasReachedEndOfFile;

    public BufferFileReaderImpl(ID channelID) throws IOException {
        super(channelID, false);
    }

    @Override
    public void readInto(Buffer buffer) throws IOException {
        checkArgument(buffer.getSize() == 0, "Buffer not empty");
        if (fileChannel.size() - fileChannel.position() <= 0) {
            throw new EOFException("No more blocks in channel " + id);
        }

        header.clear();
        readFully(header);
        header.flip();

        int size = header.getInt();
        if (size < 0 || size > buffer.getMaxCapacity()) {
            throw new IOException(
                    "Buffer is too small for data: "
                            + buffer.getMaxCapacity()
                            + " bytes available, but "
                            + size
                            + " needed. The channel "
                            + id
                            + " is probably corrupted.");
        }

        readFully(buffer.getNioBuffer(0, size));
        buffer.setSize(size);
        hasReachedEndOfFile = fileChannel.size() - fileChannel.position() == 0;
    }

    private void readFully(ByteBuffer target) throws IOException {
        while (target.hasRemaining()) {
            if (fileChannel.read(target) < 0) {
                throw new EOFException("Unexpected end of channel " + id);
            }
        }
    }

    @Override
    public boolean hasReachedEndOfFile() {
        return hasReachedEndOfFile;
    }
}
