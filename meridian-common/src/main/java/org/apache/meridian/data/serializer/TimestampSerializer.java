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

import org.apache.meridian.data.Timestamp;
import org.apache.meridian.io.DataInputView;
import org.apache.meridian.io.DataOutputView;

import java.io.IOException;

/** {@link Timestamp} 的序列化器,依次写入毫秒(long)与毫秒内纳秒(int)。 */
public final class TimestampSerializer extends SerializerSingleton<Timestamp> {

    private static final long serialVersionUID = 1L;

    public static final TimestampSerializer INSTANCE = new TimestampSerializer();

    private TimestampSerializer() {}

    @Override
    public void serialize(Timestamp record, DataOutputView target) throws IOException {
        target.writeLong(record.getMillisecond());
        target.writeInt(record.getNanoOfMillisecond());
    }

    @Override
    public Timestamp deserialize(DataInputView source) throws IOException {
        long millisecond = source.readLong();
        int nanoOfMillisecond = source.readInt();
        return Timestamp.fromEpochMillis(millisecond, nanoOfMillisecond);
    }
}
