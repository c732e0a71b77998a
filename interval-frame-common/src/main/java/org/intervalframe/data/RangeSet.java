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

import org.intervalframe.types.DataField;
import org.intervalframe.types.RowType;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.intervalframe.utils.Preconditions.checkArgument;
import static org.intervalframe.utils.Preconditions.checkNotNull;

/**
 * An immutable, ordered collection of rows sharing one {@link RowType}. Both operands and the
 * result of an interval join are range sets.
 *
 * <p>Every value is checked against the type of its field when the set is built.
 */
public final class RangeSet implements Iterable<InternalRow> {

    private final RowType rowType;
    private final List<InternalRow> rows;

    private RangeSet(RowType rowType, List<InternalRow> rows) {
        this.rowType = rowType;
        this.rows = rows;
    }

    public static RangeSet empty(RowType rowType) {
        return new RangeSet(checkNotNull(rowType), ImmutableList.of());
    }

    public static RangeSet of(RowType rowType, List<? extends InternalRow> rows) {
        Builder builder = builder(rowType);
        for (InternalRow row : rows) {
            builder.add(row);
        }
        return builder.build();
    }

    public static Builder builder(RowType rowType) {
        return new Builder(rowType);
    }

    public RowType rowType() {
        return rowType;
    }

    public List<InternalRow> rows() {
        return rows;
    }

    public InternalRow row(int index) {
        return rows.get(index);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** Returns all values of the named column in row order. */
    public List<Object> column(String fieldName) {
        int index = rowType.getFieldIndex(fieldName);
        checkArgument(index >= 0, "Cannot find field %s in %s", fieldName, rowType);
        List<Object> values = new ArrayList<>(rows.size());
        for (InternalRow row : rows) {
            values.add(row.getField(index));
        }
        return values;
    }

    @Override
    public Iterator<InternalRow> iterator() {
        return rows.iterator();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(rowType.toString());
        for (InternalRow row : rows) {
            sb.append('\n').append(row);
        }
        return sb.toString();
    }

    /** Builder of {@link RangeSet}. */
    public static class Builder {

        private final RowType rowType;
        private final ImmutableList.Builder<InternalRow> rows = ImmutableList.builder();

        private Builder(RowType rowType) {
            this.rowType = checkNotNull(rowType, "Row type cannot be null");
        }

        public Builder add(Object... values) {
            return add(GenericRow.of(values));
        }

        /** Adds the row. Rows of other {@link InternalRow} types are copied first. */
        public Builder add(InternalRow row) {
            return addRow(GenericRow.copyOf(row));
        }

        private Builder addRow(GenericRow row) {
            checkArgument(
                    row.getFieldCount() == rowType.getFieldCount(),
                    "Row %s has %s fields, but %s expects %s",
                    row,
                    row.getFieldCount(),
                    rowType,
                    rowType.getFieldCount());
            List<DataField> fields = rowType.getFields();
            for (int i = 0; i < fields.size(); i++) {
                Object value = row.getField(i);
                checkArgument(
                        fields.get(i).type().accepts(value),
                        "Value %s of field %s does not match type %s",
                        value,
                        fields.get(i).name(),
                        fields.get(i).type());
            }
            rows.add(row);
            return this;
        }

        public RangeSet build() {
            return new RangeSet(rowType, rows.build());
        }
    }
}
