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

package org.apache.meridian.utils;

import java.util.Arrays;

/** 资源关闭相关的工具方法。 */
public final class IOUtils {

    /**
     * 关闭所有资源。
     *
     * <p>即使某个资源关闭失败,也会继续关闭其余资源;第一个异常会被重新抛出,其余异常作为 suppressed
     * 附加在其上。
     */
    public static void closeAll(Iterable<? extends AutoCloseable> closeables) throws Exception {
        if (closeables == null) {
            return;
        }

        Exception collected = null;
        for (AutoCloseable closeable : closeables) {
            try {
                if (closeable != null) {
                    closeable.close();
                }
            } catch (Exception e) {
                if (collected == null) {
                    collected = e;
                } else {
                    collected.addSuppressed(e);
                }
            }
        }

        if (collected != null) {
            throw collected;
        }
    }

    public static void closeAll(AutoCloseable... closeables) throws Exception {
        closeAll(Arrays.asList(closeables));
    }

    private IOUtils() {}
}
