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

import com.google.common.collect.ImmutableList;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.intervalframe.utils.Preconditions.checkArgument;

/** Data type of a sequence of fields. A field consists of a field name and field type. */
public final class RowType implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<DataField> fields;

    public RowType(List<DataField> fields) {
        this.fields = ImmutableList.copyOf(fields);
        validateFields(this.fields);
    }

    public List<DataField> getFields() {
        return fields;
    }

    public List<String> getFieldNames() {
        return fields.stream().map(DataField::name).collect(Collectors.toList());
    }

    public int getFieldCount() {
        return fields.size();
    }

    public DataType getTypeAt(int i) {
        return fields.get(i).type();
    }

    /** Returns the position of the field, or {@code -1} if the row type has no such field. */
    public int getFieldIndex(String fieldName) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(fieldName)) {
                return i;
            }
        }
        return -1;
    }

    public boolean containsField(String fieldName) {
        return getFieldIndex(fieldName) >= 0;
    }

    public DataField getField(String fieldName) {
        int index = getFieldIndex(fieldName);
        checkArgument(index >= 0, "Cannot find field %s in %s", fieldName, this);
        return fields.get(index);
    }

    private static void validateFields(List<DataField> fields) {
        Set<String> names = new HashSet<>();
        for (DataField field : fields) {
            checkArgument(
                    names.add(field.name()),
                    "Field names must be unique. Found duplicates: %s",
                    field.name());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return fields.equals(((RowType) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.stream()
                .map(DataField::toString)
                .collect(Collectors.joining(", ", "ROW<", ">"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder of {@link RowType}, assigning field ids in insertion order. */
    public static class Builder {

        private final List<DataField> fields = new ArrayList<>();

        public Builder field(String name, DataType type) {
            fields.add(new DataField(fields.size(), name, type));
            return this;
        }

        public RowType build() {
            return new RowType(fields);
        }
    }
}
