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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.LongStream;

/**
 * Turns the candidate windows of a group into overlapping pairs and the pairs into result rows.
 *
 * <p>Each candidate is checked against the overlap predicate, which only rejects candidates
 * involving empty ranges in half-open mode. Result rows are repeated by the product of the
 * duplicate counts of both representatives, so every pair of input rows appears once.
 */
public class ExpansionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ExpansionEngine.class);

    private final boolean closed;
    private final JoinMetrics metrics;

    public ExpansionEngine(boolean closed, JoinMetrics metrics) {
        this.closed = closed;
        this.metrics = metrics;
    }

    public OverlapPairs expand(GroupPartition group, MatchIndices indices) {
        SortedGroup primary = group.primary();
        SortedGroup secondary = group.secondary();
        LongStream.Builder encoded = LongStream.builder();

        for (int i = 0; i < primary.size(); i++) {
            if (!indices.mask(JoinSide.PRIMARY, i)) {
                continue;
            }
            for (int j = indices.low(JoinSide.PRIMARY, i);
                    j < indices.high(JoinSide.PRIMARY, i);
                    j++) {
                if (overlaps(primary, i, secondary, j)) {
                    encoded.add(encode(i, j));
                }
            }
        }
        for (int j = 0; j < secondary.size(); j++) {
            if (!indices.mask(JoinSide.SECONDARY, j)) {
                continue;
            }
            for (int i = indices.low(JoinSide.SECONDARY, j);
                    i < indices.high(JoinSide.SECONDARY, j);
                    i++) {
                if (overlaps(primary, i, secondary, j)) {
                    encoded.add(encode(i, j));
                }
            }
        }

        long[] sorted = encoded.build().sorted().toArray();
        int[] primaryPositions = new int[sorted.length];
        int[] secondaryPositions = new int[sorted.length];
        for (int k = 0; k < sorted.length; k++) {
            primaryPositions[k] = (int) (sorted[k] >>> 32);
            secondaryPositions[k] = (int) sorted[k];
        }
        metrics.recordPairs(sorted.length);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Group {}: {} overlapping pairs.", group.key(), sorted.length);
        }
        return new OverlapPairs(primaryPositions, secondaryPositions);
    }

    /** Joined rows of all pairs, one per pair of input rows. */
    public List<InternalRow> materialize(
            GroupPartition group, OverlapPairs pairs, RowAssembler assembler) {
        SortedGroup primary = group.primary();
        SortedGroup secondary = group.secondary();
        List<InternalRow> rows = new ArrayList<>(pairs.size());
        for (int k = 0; k < pairs.size(); k++) {
            int i = pairs.primary(k);
            int j = pairs.secondary(k);
            InternalRow joined = assembler.join(primary.row(i), secondary.row(j));
            long repeat = (long) primary.count(i) * secondary.count(j);
            for (long r = 0; r < repeat; r++) {
                rows.add(joined);
            }
        }
        return rows;
    }

    /** Primary rows with at least one overlap, each repeated by its duplicate count. */
    public List<InternalRow> overlappingPrimary(GroupPartition group, OverlapPairs pairs) {
        SortedGroup primary = group.primary();
        List<InternalRow> rows = new ArrayList<>();
        int previous = -1;
        for (int k = 0; k < pairs.size(); k++) {
            int i = pairs.primary(k);
            if (i == previous) {
                continue;
            }
            previous = i;
            for (int r = 0; r < primary.count(i); r++) {
                rows.add(primary.row(i));
            }
        }
        return rows;
    }

    private boolean overlaps(SortedGroup primary, int i, SortedGroup secondary, int j) {
        Object start = max(primary.start(i), secondary.start(j));
        Object end = min(primary.end(i), secondary.end(j));
        int cmp = SortedGroup.BOUNDARY_ORDER.compare(start, end);
        return closed ? cmp <= 0 : cmp < 0;
    }

    private static Object max(Object left, Object right) {
        return SortedGroup.BOUNDARY_ORDER.compare(left, right) >= 0 ? left : right;
    }

    private static Object min(Object left, Object right) {
        return SortedGroup.BOUNDARY_ORDER.compare(left, right) <= 0 ? left : right;
    }

    private static long encode(int primary, int secondary) {
        return ((long) primary << 32) | (secondary & 0xFFFFFFFFL);
    }
}
