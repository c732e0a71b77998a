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

package org.intervalframe.types;

import java.time.LocalDate;
import java.time.LocalDateTime;

/** The root of a {@link DataType}, together with the Java class holding its values. */
public enum DataTypeRoot {
    BOOLEAN(Boolean.class, false),
    INTEGER(Integer.class, true),
    BIGINT(Long.class, true),
    DOUBLE(Double.class, true),
    STRING(String.class, false),
    DATE(LocalDate.class, true),
    TIMESTAMP(LocalDateTime.class, true);

    private final Class<?> javaClass;
    private final boolean rangeBoundary;

    DataTypeRoot(Class<?> javaClass, boolean rangeBoundary) {
        this.javaClass = javaClass;
        this.rangeBoundary = rangeBoundary;
    }

    public Class<?> javaClass() {
        return javaClass;
    }

    /** Whether values of this root may serve as the start or end of a range. */
    public boolean isRangeBoundary() {
        return rangeBoundary;
    }
}
