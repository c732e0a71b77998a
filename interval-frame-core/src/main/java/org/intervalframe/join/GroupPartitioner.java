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
import org.intervalframe.data.RangeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Splits both operands into groups by key and sorts each group by {@code (start, end)}.
 *
 * <p>Keys are visited in order of first appearance, primary keys first. A key found on both sides
 * becomes a {@link GroupPartition}; a key found on one side only yields a group that can never
 * overlap anything. Without grouping columns both operands form one group each.
 */
public class GroupPartitioner {

    private static final Logger LOG = LoggerFactory.getLogger(GroupPartitioner.class);

    private final JoinSchema schema;
    private final boolean deduplicate;
    private final boolean strict;
    private final JoinMetrics metrics;

    public GroupPartitioner(
            JoinSchema schema, boolean deduplicate, boolean strict, JoinMetrics metrics) {
        this.schema = schema;
        this.deduplicate = deduplicate;
        this.strict = strict;
        this.metrics = metrics;
    }

    public PartitionedRanges partition(RangeSet primary, RangeSet secondary) {
        List<InternalRow> unmatchablePrimary = new ArrayList<>();
        List<InternalRow> unmatchableSecondary = new ArrayList<>();
        Map<GroupKey, List<Integer>> primaryGroups =
                collect(JoinSide.PRIMARY, primary, unmatchablePrimary);
        Map<GroupKey, List<Integer>> secondaryGroups =
                collect(JoinSide.SECONDARY, secondary, unmatchableSecondary);

        List<GroupPartition> paired = new ArrayList<>();
        List<SortedGroup> onlyInPrimary = new ArrayList<>();
        List<SortedGroup> onlyInSecondary = new ArrayList<>();
        for (Map.Entry<GroupKey, List<Integer>> entry : primaryGroups.entrySet()) {
            SortedGroup primaryGroup =
                    sortedGroup(JoinSide.PRIMARY, entry.getKey(), primary, entry.getValue());
            List<Integer> secondaryPositions = secondaryGroups.get(entry.getKey());
            if (secondaryPositions == null) {
                onlyInPrimary.add(primaryGroup);
            } else {
                paired.add(
                        new GroupPartition(
                                entry.getKey(),
                                primaryGroup,
                                sortedGroup(
                                        JoinSide.SECONDARY,
                                        entry.getKey(),
                                        secondary,
                                        secondaryPositions)));
            }
        }
        for (Map.Entry<GroupKey, List<Integer>> entry : secondaryGroups.entrySet()) {
            if (!primaryGroups.containsKey(entry.getKey())) {
                onlyInSecondary.add(
                        sortedGroup(
                                JoinSide.SECONDARY,
                                entry.getKey(),
                                secondary,
                                entry.getValue()));
            }
        }

        metrics.recordGroups(paired.size(), onlyInPrimary.size(), onlyInSecondary.size());
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Partitioned {} primary and {} secondary rows into {} paired groups, {} "
                            + "primary-only groups, {} secondary-only groups; {} primary and {} "
                            + "secondary rows cannot be matched.",
                    primary.size(),
                    secondary.size(),
                    paired.size(),
                    onlyInPrimary.size(),
                    onlyInSecondary.size(),
                    unmatchablePrimary.size(),
                    unmatchableSecondary.size());
        }
        return new PartitionedRanges(
                paired, onlyInPrimary, onlyInSecondary, unmatchablePrimary, unmatchableSecondary);
    }

    /**
     * Checks every range of the operand.
     *
     * @throws IntervalSchemaException in strict mode, for a null boundary or a start after the end
     */
    public void checkRanges(JoinSide side, RangeSet ranges) {
        if (!strict) {
            return;
        }
        for (InternalRow row : ranges) {
            isMatchable(side, row);
        }
    }

    private Map<GroupKey, List<Integer>> collect(
            JoinSide side, RangeSet ranges, List<InternalRow> unmatchable) {
        Map<GroupKey, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < ranges.size(); i++) {
            InternalRow row = ranges.row(i);
            if (!isMatchable(side, row)) {
                unmatchable.add(row);
                continue;
            }
            GroupKey key = schema.keyOf(side, row);
            // a null key equals no key, not even another null
            if (key.hasNull()) {
                unmatchable.add(row);
                continue;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
        }
        return groups;
    }

    private boolean isMatchable(JoinSide side, InternalRow row) {
        int startIndex = schema.index(FieldRole.startOf(side));
        int endIndex = schema.index(FieldRole.endOf(side));
        if (row.isNullAt(startIndex) || row.isNullAt(endIndex)) {
            if (strict) {
                throw new IntervalSchemaException(
                        String.format(
                                "Range %s on the %s side has a null boundary.",
                                row, side.name().toLowerCase(Locale.ROOT)));
            }
            return false;
        }
        if (SortedGroup.BOUNDARY_ORDER.compare(row.getField(startIndex), row.getField(endIndex))
                > 0) {
            if (strict) {
                throw new IntervalSchemaException(
                        String.format(
                                "Range %s on the %s side starts after it ends.",
                                row, side.name().toLowerCase(Locale.ROOT)));
            }
            return false;
        }
        return true;
    }

    private SortedGroup sortedGroup(
            JoinSide side, GroupKey key, RangeSet ranges, List<Integer> positions) {
        List<InternalRow> rows = new ArrayList<>(positions.size());
        int[] indices = new int[positions.size()];
        for (int i = 0; i < positions.size(); i++) {
            indices[i] = positions.get(i);
            rows.add(ranges.row(indices[i]));
        }
        return SortedGroup.create(
                side,
                key,
                Collections.unmodifiableList(rows),
                indices,
                schema.index(FieldRole.startOf(side)),
                schema.index(FieldRole.endOf(side)),
                deduplicate);
    }
}
