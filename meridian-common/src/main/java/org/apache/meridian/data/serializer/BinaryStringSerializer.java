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

package org.apache.meridian.data.serializer;

import org.apache.meridian.data.BinaryString;
import org.apache.meridian.io.DataInputView;
import org.apache.meridian.io.DataOutputView;

import java.io.IOException;

import static org.apache.meridian.utils.VarLengthIntUtils.decodeInt;
import static org.apache.meridian.utils.VarLengthIntUtils.encodeInt;

/** {@link BinaryString} 的序列化器,格式为变长长度前缀加 UTF-8 字节。 */
public final class BinaryStringSerializer extends SerializerSingleton<BinaryString> {

    private static final long serialVersionUID = 1L;

    public static final BinaryStringSerializer INSTANCE = new BinaryStringSerializer();

    private BinaryStringSerializer() {}

    @Override
    public void serialize(BinaryString string, DataOutputView target) throws IOException {
        byte[] bytes = string.toBytes();
        encodeInt(target, bytes.length);
        target.write(bytes);
    }

    @Override
    public BinaryString deserialize(DataInputView source) throws IOException {
        int length = decodeInt(source);
        byte[] bytes = new byte[length];
        source.readFully(bytes);
        return BinaryString.fromBytes(bytes);
    }
}
