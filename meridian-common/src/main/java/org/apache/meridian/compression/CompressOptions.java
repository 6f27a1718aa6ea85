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

package org.apache.meridian.compression;

import java.io.Serializable;
import java.util.Objects;

/** 压缩算法名称及其参数。 */
public class CompressOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String compress;

    private final int zstdLevel;

    public CompressOptions(String compress, int zstdLevel) {
        this.compress = compress;
        this.zstdLevel = zstdLevel;
    }

    public String compress() {
        return compress;
    }

    public int zstdLevel() {
        return zstdLevel;
    }

    public static CompressOptions defaultOptions() {
        return new CompressOptions("lz4", 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CompressOptions that = (CompressOptions) o;
        return zstdLevel == that.zstdLevel && Objects.equals(compress, that.compress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(compress, zstdLevel);
    }

    @Override
    public String toString() {
        return "CompressOptions{" + "compress='" + compress + '\'' + ", zstdLevel=" + zstdLevel + '}';
    }
}
