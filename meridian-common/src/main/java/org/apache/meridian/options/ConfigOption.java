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

import java.util.Objects;

import static org.apache.meridian.utils.Preconditions.checkNotNull;

/**
 * 配置项的描述:键、值类型、默认值和说明。
 *
 * <p>配置项本身不保存值,值存放在 {@link Options} 中。通过 {@link ConfigOptions#key(String)} 构建。
 *
 * @param <T> 配置值的类型
 */
@Public
public class ConfigOption<T> {

    private final String key;

    private final T defaultValue;

    private final String description;

    private final Class<?> clazz;

    ConfigOption(String key, Class<?> clazz, String description, T defaultValue) {
        this.key = checkNotNull(key);
        this.description = description;
        this.defaultValue = defaultValue;
        this.clazz = checkNotNull(clazz);
    }

    Class<?> getClazz() {
        return clazz;
    }

    public ConfigOption<T> withDescription(String description) {
        return new ConfigOption<>(key, clazz, description, defaultValue);
    }

    public String key() {
        return key;
    }

    public T defaultValue() {
        return defaultValue;
    }

    public String description() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o != null && o.getClass() == ConfigOption.class) {
            ConfigOption<?> that = (ConfigOption<?>) o;
            return this.key.equals(that.key) && Objects.equals(this.defaultValue, that.defaultValue);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + (defaultValue != null ? defaultValue.hashCode() : 17);
    }

    @Override
    public String toString() {
        return String.format("Key: '%s' , default: %s", key, defaultValue);
    }
}
