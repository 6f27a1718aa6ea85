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

package org.apache.meridian.options;

import org.apache.meridian.annotation.Public;

import javax.annotation.concurrent.ThreadSafe;

import java.io.Serializable;
import java.util.HashMap;

/**
 * 字符串键值形式的配置集合。
 *
 * <p>值以字符串或原始对象存放,读取时按 {@link ConfigOption} 的类型转换;键不存在时返回默认值。
 */
@Public
@ThreadSafe
public class Options implements Serializable {

    private static final long serialVersionUID = 1L;

    private final HashMap<String, Object> data;

    public Options() {
        this.data = new HashMap<>();
    }

    public synchronized void setString(String key, String value) {
        data.put(key, value);
    }

    public synchronized <T> Options set(ConfigOption<T> option, T value) {
        data.put(option.key(), value);
        return this;
    }

    /**
     * 读取配置值,键不存在时返回默认值。
     *
     * @throws IllegalArgumentException 值无法转换为配置项的类型
     */
    public synchronized <T> T get(ConfigOption<T> option) {
        Object rawValue = data.get(option.key());
        if (rawValue == null) {
            return option.defaultValue();
        }

        try {
            return OptionsUtils.convertValue(rawValue, option.getClazz());
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Could not parse value '%s' for key '%s'.", rawValue, option.key()),
                    e);
        }
    }

    @Override
    public synchronized String toString() {
        return data.toString();
    }
}
