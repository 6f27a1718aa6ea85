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

package org.apache.meridian.io;

import java.io.DataOutput;
import java.io.IOException;

/**
 * 数据输出视图。
 *
 * <p>在 {@link DataOutput} 的基础上增加了跳过字节与从输入视图直接拷贝字节的方法。排序缓冲区溢写时用后者逐条搬运已经序列化好的记录。
 */
public interface DataOutputView extends DataOutput {

    void skipBytesToWrite(int numBytes) throws IOException;

    /**
     * 从 {@code source} 读取 {@code numBytes} 个字节并写入当前视图。
     *
     * @throws java.io.EOFException 源视图剩余字节不足
     */
    void write(DataInputView source, int numBytes) throws IOException;
}
