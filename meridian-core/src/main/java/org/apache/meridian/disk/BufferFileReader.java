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

import java.io.IOException;

/** 以块为单位读取由 {@link BufferFileWriter} 写出的文件。 */
public interface BufferFileReader extends FileIOChannel {

    /** 读取下一个块到空的 {@code buffer} 中,并设置其有效长度。 */
    void readInto(Buffer buffer) throws IOException;

    boolean hasReachedEndOfFile();
}
