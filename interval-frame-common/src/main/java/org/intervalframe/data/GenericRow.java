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

package org.intervalframe.data;

import javax.annotation.Nullable;

import java.util.Arrays;

/**
 * An internal data structure representing data of {@link InternalRow}, backed by an array of Java
 * objects. The array is copied on creation and never exposed, so a row cannot change once built
 * and may be shared between result positions.
 */
public final class GenericRow implements InternalRow {

    private final Object[] fields;

    private GenericRow(Object[] fields) {
        this.fields = fields;
    }

    @Override
    public int getFieldCount() {
        return fields.length;
    }

    @Override
    public boolean isNullAt(int pos) {
        return fields[pos] == null;
    }

    @Nullable
    @Override
    public Object getField(int pos) {
        return fields[pos];
    }

    public static GenericRow of(Object... values) {
        return new GenericRow(values.clone());
    }

    /** Returns the row itself if it is a {@link GenericRow}, otherwise a copy of its fields. */
    public static GenericRow copyOf(InternalRow row) {
        if (row instanceof GenericRow) {
            return (GenericRow) row;
        }
        Object[] values = new Object[row.getFieldCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = row.getField(i);
        }
        return new GenericRow(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GenericRow)) {
            return false;
        }
        return Arrays.deepEquals(fields, ((GenericRow) o).fields);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(fields);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < fields.length; i++) {
            if (i != 0) {
                sb.append(",");
            }
            sb.append(fields[i]);
        }
        sb.append(")");
        return sb.toString();
    }
}
