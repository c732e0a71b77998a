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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Output of {@link GroupPartitioner}: groups present on both sides, groups present on only one
 * side, and rows that cannot take part in matching because a boundary or a group column is
 * null, or the range is inverted.
 */
public final class PartitionedRanges {

    private final List<GroupPartition> pairedGroups;
    private final List<SortedGroup> groupsOnlyInPrimary;
    private final List<SortedGroup> groupsOnlyInSecondary;
    private final List<InternalRow> unmatchablePrimary;
    private final List<InternalRow> unmatchableSecondary;

    PartitionedRanges(
            List<GroupPartition> pairedGroups,
            List<SortedGroup> groupsOnlyInPrimary,
            List<SortedGroup> groupsOnlyInSecondary,
            List<InternalRow> unmatchablePrimary,
            List<InternalRow> unmatchableSecondary) {
        this.pairedGroups = ImmutableList.copyOf(pairedGroups);
        this.groupsOnlyInPrimary = ImmutableList.copyOf(groupsOnlyInPrimary);
        this.groupsOnlyInSecondary = ImmutableList.copyOf(groupsOnlyInSecondary);
        this.unmatchablePrimary = ImmutableList.copyOf(unmatchablePrimary);
        this.unmatchableSecondary = ImmutableList.copyOf(unmatchableSecondary);
    }

    public List<GroupPartition> pairedGroups() {
        return pairedGroups;
    }

    public List<SortedGroup> groupsOnlyIn(JoinSide side) {
        return side == JoinSide.PRIMARY ? groupsOnlyInPrimary : groupsOnlyInSecondary;
    }

    public List<InternalRow> unmatchableRows(JoinSide side) {
        return side == JoinSide.PRIMARY ? unmatchablePrimary : unmatchableSecondary;
    }
}
