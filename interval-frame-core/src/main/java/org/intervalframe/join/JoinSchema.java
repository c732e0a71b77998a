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

package org.intervalframe.join;

import org.intervalframe.data.InternalRow;
import org.intervalframe.types.DataField;
import org.intervalframe.types.DataType;
import org.intervalframe.types.DataTypeRoot;
import org.intervalframe.types.RowType;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolved layout of an interval join: where each {@link FieldRole} lives in its operand, which
 * columns form the group key, and how the result is named and typed.
 *
 * <p>The result holds every primary column in order, followed by the secondary columns that are not
 * group keys. A secondary column whose name also exists on the primary side is renamed by
 * appending the suffix. The renaming is computed here once and reused by every later stage.
 */
public final class JoinSchema {

    private final RowType primaryType;
    private final RowType secondaryType;
    private final Map<FieldRole, Integer> boundaries;
    private final int[] primaryKeyIndices;
    private final int[] secondaryKeyIndices;
    private final int[] secondaryPayloadIndices;
    private final List<String> secondaryOutputNames;

    private JoinSchema(
            RowType primaryType,
            RowType secondaryType,
            Map<FieldRole, Integer> boundaries,
            int[] primaryKeyIndices,
            int[] secondaryKeyIndices,
            int[] secondaryPayloadIndices,
            List<String> secondaryOutputNames) {
        this.primaryType = primaryType;
        this.secondaryType = secondaryType;
        this.boundaries = boundaries;
        this.primaryKeyIndices = primaryKeyIndices;
        this.secondaryKeyIndices = secondaryKeyIndices;
        this.secondaryPayloadIndices = secondaryPayloadIndices;
        this.secondaryOutputNames = secondaryOutputNames;
    }

    /**
     * Resolves and validates the layout.
     *
     * @throws IntervalSchemaException if a referenced column is absent or unsuitable, or the
     *     renamed secondary columns collide with primary columns
     */
    public static JoinSchema create(
            RowType primaryType,
            RowType secondaryType,
            String primaryStart,
            String primaryEnd,
            String secondaryStart,
            String secondaryEnd,
            List<String> groupBy,
            String suffix) {
        Map<FieldRole, Integer> boundaries = new EnumMap<>(FieldRole.class);
        boundaries.put(
                FieldRole.PRIMARY_START, boundaryIndex(primaryType, primaryStart, "primary"));
        boundaries.put(FieldRole.PRIMARY_END, boundaryIndex(primaryType, primaryEnd, "primary"));
        boundaries.put(
                FieldRole.SECONDARY_START,
                boundaryIndex(secondaryType, secondaryStart, "secondary"));
        boundaries.put(
                FieldRole.SECONDARY_END, boundaryIndex(secondaryType, secondaryEnd, "secondary"));

        DataTypeRoot boundaryRoot =
                primaryType.getTypeAt(boundaries.get(FieldRole.PRIMARY_START)).getTypeRoot();
        for (Map.Entry<FieldRole, Integer> entry : boundaries.entrySet()) {
            RowType type = entry.getKey().side() == JoinSide.PRIMARY ? primaryType : secondaryType;
            DataField field = type.getFields().get(entry.getValue());
            if (field.type().getTypeRoot() != boundaryRoot) {
                throw new IntervalSchemaException(
                        String.format(
                                "All boundary columns must share one type, but %s column "
                                        + "'%s' is %s while the primary start is %s.",
                                entry.getKey().side().name().toLowerCase(Locale.ROOT),
                                field.name(),
                                field.type().getTypeRoot(),
                                boundaryRoot));
            }
        }

        int[] primaryKeyIndices = new int[groupBy.size()];
        int[] secondaryKeyIndices = new int[groupBy.size()];
        Set<String> keys = new HashSet<>();
        for (int i = 0; i < groupBy.size(); i++) {
            String key = groupBy.get(i);
            if (!keys.add(key)) {
                throw new IntervalSchemaException("Group column '" + key + "' is listed twice.");
            }
            primaryKeyIndices[i] = columnIndex(primaryType, key, "primary");
            secondaryKeyIndices[i] = columnIndex(secondaryType, key, "secondary");
            if (key.equals(primaryStart)
                    || key.equals(primaryEnd)
                    || key.equals(secondaryStart)
                    || key.equals(secondaryEnd)) {
                throw new IntervalSchemaException(
                        "Column '" + key + "' cannot be both a boundary and a group column.");
            }
            DataTypeRoot primaryRoot = primaryType.getTypeAt(primaryKeyIndices[i]).getTypeRoot();
            DataTypeRoot secondaryRoot =
                    secondaryType.getTypeAt(secondaryKeyIndices[i]).getTypeRoot();
            if (primaryRoot != secondaryRoot) {
                throw new IntervalSchemaException(
                        String.format(
                                "Group column '%s' is %s on the primary side but %s on the "
                                        + "secondary side.",
                                key, primaryRoot, secondaryRoot));
            }
        }

        Set<String> outputNames = new HashSet<>(primaryType.getFieldNames());
        List<Integer> payload = new ArrayList<>();
        List<String> renamed = new ArrayList<>();
        for (int i = 0; i < secondaryType.getFieldCount(); i++) {
            String name = secondaryType.getFields().get(i).name();
            if (keys.contains(name)) {
                continue;
            }
            String outputName = primaryType.containsField(name) ? name + suffix : name;
            if (!outputNames.add(outputName)) {
                throw new IntervalSchemaException(
                        String.format(
                                "Secondary column '%s' would be emitted as '%s', which "
                                        + "already exists in the result. Choose another suffix.",
                                name, outputName));
            }
            payload.add(i);
            renamed.add(outputName);
        }

        return new JoinSchema(
                primaryType,
                secondaryType,
                boundaries,
                primaryKeyIndices,
                secondaryKeyIndices,
                payload.stream().mapToInt(Integer::intValue).toArray(),
                ImmutableList.copyOf(renamed));
    }

    private static int columnIndex(RowType type, String name, String side) {
        int index = type.getFieldIndex(name);
        if (index < 0) {
            throw new IntervalSchemaException(
                    String.format(
                            "Column '%s' does not exist on the %s side, available columns are %s.",
                            name, side, type.getFieldNames()));
        }
        return index;
    }

    private static int boundaryIndex(RowType type, String name, String side) {
        int index = columnIndex(type, name, side);
        DataType fieldType = type.getTypeAt(index);
        if (!fieldType.getTypeRoot().isRangeBoundary()) {
            throw new IntervalSchemaException(
                    String.format(
                            "Column '%s' on the %s side has type %s, which cannot bound a range.",
                            name, side, fieldType));
        }
        return index;
    }

    public RowType typeOf(JoinSide side) {
        return side == JoinSide.PRIMARY ? primaryType : secondaryType;
    }

    public int index(FieldRole role) {
        return boundaries.get(role);
    }

    public GroupKey keyOf(JoinSide side, InternalRow row) {
        int[] indices = side == JoinSide.PRIMARY ? primaryKeyIndices : secondaryKeyIndices;
        if (indices.length == 0) {
            return GroupKey.EMPTY;
        }
        Object[] values = new Object[indices.length];
        for (int i = 0; i < indices.length; i++) {
            values[i] = row.getField(indices[i]);
        }
        return GroupKey.of(values);
    }

    int[] primaryKeyIndices() {
        return primaryKeyIndices;
    }

    int[] secondaryKeyIndices() {
        return secondaryKeyIndices;
    }

    int[] secondaryPayloadIndices() {
        return secondaryPayloadIndices;
    }

    public List<String> secondaryOutputNames() {
        return secondaryOutputNames;
    }

    /**
     * Row type of the joined result for the given mode. Columns that can be padded with nulls
     * under that mode become nullable. Group columns of padded secondary rows hold the secondary
     * key, so they are nullable when the secondary key is.
     */
    public RowType outputType(JoinType how) {
        List<DataField> fields = new ArrayList<>();
        Map<Integer, DataType> secondaryKeyTypes = new HashMap<>();
        for (int i = 0; i < primaryKeyIndices.length; i++) {
            secondaryKeyTypes.put(
                    primaryKeyIndices[i], secondaryType.getTypeAt(secondaryKeyIndices[i]));
        }
        for (int i = 0; i < primaryType.getFieldCount(); i++) {
            DataField field = primaryType.getFields().get(i);
            DataType type = field.type();
            if (how.keepsUnmatchedSecondary()) {
                DataType secondaryKeyType = secondaryKeyTypes.get(i);
                if (secondaryKeyType == null || secondaryKeyType.isNullable()) {
                    type = type.nullable();
                }
            }
            fields.add(new DataField(fields.size(), field.name(), type));
        }
        for (int i = 0; i < secondaryPayloadIndices.length; i++) {
            DataField field = secondaryType.getFields().get(secondaryPayloadIndices[i]);
            DataType type =
                    how.keepsUnmatchedPrimary() ? field.type().nullable() : field.type();
            fields.add(new DataField(fields.size(), secondaryOutputNames.get(i), type));
        }
        return new RowType(fields);
    }
}
