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

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.Objects;

import static org.intervalframe.utils.Preconditions.checkNotNull;

/**
 * Describes the logical type of a value: a {@link DataTypeRoot} plus nullability.
 *
 * <p>Instances are created through {@link DataTypes}.
 */
public final class DataType implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DataTypeRoot typeRoot;
    private final boolean isNullable;

    DataType(DataTypeRoot typeRoot, boolean isNullable) {
        this.typeRoot = checkNotNull(typeRoot, "Type root must not be null.");
        this.isNullable = isNullable;
    }

    public DataTypeRoot getTypeRoot() {
        return typeRoot;
    }

    public boolean isNullable() {
        return isNullable;
    }

    public DataType copy(boolean isNullable) {
        return isNullable == this.isNullable ? this : new DataType(typeRoot, isNullable);
    }

    public DataType nullable() {
        return copy(true);
    }

    public DataType notNull() {
        return copy(false);
    }

    /** Whether the given value can be stored in a field of this type. */
    public boolean accepts(@Nullable Object value) {
        if (value == null) {
            return isNullable;
        }
        return typeRoot.javaClass().isInstance(value);
    }

    public String asSQLString() {
        return isNullable ? typeRoot.name() : typeRoot.name() + " NOT NULL";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataType that = (DataType) o;
        return isNullable == that.isNullable && typeRoot == that.typeRoot;
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeRoot, isNullable);
    }

    @Override
    public String toString() {
        return asSQLString();
    }
}
