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

package org.intervalframe.options;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** Options which stores key/value pairs as strings and reads them through {@link ConfigOption}s. */
public class Options implements Serializable {

    private static final long serialVersionUID = 1L;

    private final HashMap<String, String> data;

    public Options() {
        this.data = new HashMap<>();
    }

    public Options(Map<String, String> map) {
        this();
        map.forEach(this::setString);
    }

    public static Options fromMap(Map<String, String> map) {
        return new Options(map);
    }

    public synchronized <T> T get(ConfigOption<T> option) {
        String value = data.get(option.key());
        if (value == null) {
            return option.defaultValue();
        }
        return convertValue(option, value);
    }

    public synchronized <T> Options set(ConfigOption<T> option, T value) {
        data.put(option.key(), value.toString());
        return this;
    }

    public synchronized void setString(String key, String value) {
        data.put(key, value);
    }

    public synchronized Map<String, String> toMap() {
        return new HashMap<>(data);
    }

    @SuppressWarnings("unchecked")
    private static <T> T convertValue(ConfigOption<T> option, String value) {
        Class<?> clazz = option.getClazz();
        String trimmed = value.trim();
        try {
            if (clazz == String.class) {
                return (T) value;
            } else if (clazz == Integer.class) {
                return (T) Integer.valueOf(trimmed);
            } else if (clazz == Boolean.class) {
                return (T) convertToBoolean(trimmed);
            } else if (clazz.isEnum()) {
                return (T) convertToEnum(trimmed, clazz);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Could not parse value '%s' for key '%s'.", value, option.key()),
                    e);
        }
        throw new IllegalArgumentException("Unsupported type: " + clazz);
    }

    private static Boolean convertToBoolean(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new IllegalArgumentException(
                        String.format(
                                "Unrecognized option for boolean: %s. "
                                        + "Expected either true or false(case insensitive)",
                                value));
        }
    }

    private static Object convertToEnum(String value, Class<?> enumClass) {
        for (Object constant : enumClass.getEnumConstants()) {
            if (constant.toString().equalsIgnoreCase(value)
                    || ((Enum<?>) constant).name().equalsIgnoreCase(value)) {
                return constant;
            }
        }
        throw new IllegalArgumentException(
                String.format(
                        "Could not parse value '%s' for enum %s.",
                        value, enumClass.getSimpleName()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Objects.equals(data, ((Options) o).data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(data);
    }

    @Override
    public String toString() {
        return data.toString();
    }
}
