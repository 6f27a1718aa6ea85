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

import org.apache.meridian.io.DataInputView;
import org.apache.meridian.io.DataInputViewStreamWrapper;
import org.apache.meridian.io.DataOutputView;
import org.apache.meridian.io.DataOutputViewStreamWrapper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.Serializable;

/**
 * 值的序列化器。
 *
 * <p>排序缓冲区把每个值序列化到内存页中,溢写时按字节原样搬运到文件,归并时再反序列化出来比较。因此同一个值经过
 * serialize / deserialize 之后必须与原值在比较器下相等。
 *
 * <p>有状态的序列化器需要通过 {@link #duplicate()} 为每个使用者提供独立实例。
 *
 * @param <T> 值类型
 */
public interface Serializer<T> extends Serializable {

    /** 创建一个可在其他线程使用的副本;无状态的序列化器可以返回自身。 */
    Serializer<T> duplicate();

    void serialize(T record, DataOutputView target) throws IOException;

    T deserialize(DataInputView source) throws IOException;

    default byte[] serializeToBytes(T record) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        DataOutputViewStreamWrapper view = new DataOutputViewStreamWrapper(out);
        serialize(record, view);
        return out.toByteArray();
    }

    default T deserializeFromBytes(byte[] bytes) throws IOException {
        ByteArrayInputStream in = new ByteArrayInputStream(bytes);
        DataInputViewStreamWrapper view = new DataInputViewStreamWrapper(in);
        return deserialize(view);
    }
}
