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

import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the ranges of one side that overlap nothing.
 *
 * <p>Within a paired group the unmatched positions are all positions minus the matched ones.
 * They fall in two parts: positions no candidate window reaches from either direction, and
 * positions whose every candidate was rejected by the overlap predicate. A group present on one
 * side only, and rows that cannot be matched at all, are unmatched as a whole without any search.
 *
 * <p>Rows are emitted once per duplicate. With {@code padOther} they are laid out like joined
 * rows, the other side's columns null.
 */
public class MissingOverlapComputer {

    private static final Logger LOG = LoggerFactory.getLogger(MissingOverlapComputer.class);

    private final RowAssembler assembler;
    private final JoinMetrics metrics;

    public MissingOverlapComputer(RowAssembler assembler, JoinMetrics metrics) {
        this.assembler = assembler;
        this.metrics = metrics;
    }

    /** Sorted positions of the given side of a paired group that take part in no pair. */
    public int[] unmatchedPositions(
            JoinSide side, GroupPartition group, MatchIndices indices, OverlapPairs pairs) {
        int size = group.side(side).size();
        RoaringBitmap all = new RoaringBitmap();
        all.add(0L, (long) size);

        RoaringBitmap candidates = new RoaringBitmap();
        for (int pos = 0; pos < size; pos++) {
            if (indices.mask(side, pos)) {
                candidates.add(pos);
            }
        }
        JoinSide other = side.other();
        for (int pos = 0; pos < indices.size(other); pos++) {
            if (indices.mask(other, pos)) {
                candidates.add((long) indices.low(other, pos), (long) indices.high(other, pos));
            }
        }

        RoaringBitmap withoutCandidate = RoaringBitmap.andNot(all, candidates);
        RoaringBitmap rejected = RoaringBitmap.andNot(candidates, pairs.matched(side));
        SortedGroup sorted = group.side(side);
        metrics.recordUnmatched(
                side, rowCount(sorted, withoutCandidate), rowCount(sorted, rejected));
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Group {}: {} {} ranges without candidates, {} with rejected candidates.",
                    group.key(),
                    withoutCandidate.getCardinality(),
                    side,
                    rejected.getCardinality());
        }
        return RoaringBitmap.or(withoutCandidate, rejected).toArray();
    }

    private static long rowCount(SortedGroup group, RoaringBitmap positions) {
        long total = 0;
        for (int pos : positions) {
            total += group.count(pos);
        }
        return total;
    }

    public List<InternalRow> unmatched(
            JoinSide side,
            GroupPartition group,
            MatchIndices indices,
            OverlapPairs pairs,
            boolean padOther) {
        SortedGroup sorted = group.side(side);
        List<InternalRow> rows = new ArrayList<>();
        for (int pos : unmatchedPositions(side, group, indices, pairs)) {
            emit(side, sorted.row(pos), sorted.count(pos), padOther, rows);
        }
        return rows;
    }

    /** All rows of a group whose key does not exist on the other side. */
    public List<InternalRow> wholeGroup(SortedGroup group, boolean padOther) {
        List<InternalRow> rows = new ArrayList<>();
        for (int pos = 0; pos < group.size(); pos++) {
            emit(group.side(), group.row(pos), group.count(pos), padOther, rows);
        }
        metrics.recordUnmatched(group.side(), rows.size(), 0);
        return rows;
    }

    /**
     * Rows known to be unmatched before any search, such as rows that cannot be matched or the
     * rows of an operand whose counterpart is empty. Input order is kept.
     */
    public List<InternalRow> allUnmatched(
            JoinSide side, List<InternalRow> input, boolean padOther) {
        List<InternalRow> rows = new ArrayList<>(input.size());
        for (InternalRow row : input) {
            emit(side, row, 1, padOther, rows);
        }
        metrics.recordUnmatched(side, rows.size(), 0);
        return rows;
    }

    private void emit(
            JoinSide side, InternalRow row, int count, boolean padOther, List<InternalRow> out) {
        InternalRow emitted = padOther ? assembler.pad(side, row) : row;
        for (int r = 0; r < count; r++) {
            out.add(emitted);
        }
    }
}
