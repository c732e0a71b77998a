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

import org.intervalframe.utils.SearchSide;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.intervalframe.utils.SortedSearch.searchSorted;

/**
 * Locates candidate overlaps of one group without comparing ranges pairwise.
 *
 * <p>Both sides are sorted by start, so the ranges of one side whose start falls within a range of
 * the other side form a contiguous window of the sorted starts. Two searches bound that window:
 * the lower bound always searches leftmost, the upper bound searches rightmost for closed ranges
 * and leftmost for half-open ones.
 *
 * <p>From the primary side the window holds secondary ranges starting at or after the primary
 * start. From the secondary side it holds primary ranges starting strictly after the secondary
 * start. Every pair whose starts are ordered one way is found by exactly one of the two
 * directions, so no overlap is reported twice. Changing either tie-break breaks this.
 */
public class OverlapMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(OverlapMatcher.class);

    private final boolean closed;
    private final JoinMetrics metrics;

    public OverlapMatcher(boolean closed, JoinMetrics metrics) {
        this.closed = closed;
        this.metrics = metrics;
    }

    public MatchIndices match(GroupPartition group) {
        SortedGroup primary = group.primary();
        SortedGroup secondary = group.secondary();
        SearchSide upper = closed ? SearchSide.RIGHT : SearchSide.LEFT;

        int[] primaryLow =
                searchSorted(
                        secondary.starts(),
                        primary.starts(),
                        SearchSide.LEFT,
                        SortedGroup.BOUNDARY_ORDER);
        int[] primaryHigh =
                searchSorted(
                        secondary.starts(), primary.ends(), upper, SortedGroup.BOUNDARY_ORDER);
        int[] secondaryLow =
                searchSorted(
                        primary.starts(),
                        secondary.starts(),
                        SearchSide.RIGHT,
                        SortedGroup.BOUNDARY_ORDER);
        int[] secondaryHigh =
                searchSorted(
                        primary.starts(), secondary.ends(), upper, SortedGroup.BOUNDARY_ORDER);

        MatchIndices indices =
                new MatchIndices(primaryLow, primaryHigh, secondaryLow, secondaryHigh);
        metrics.recordCandidates(indices.candidateCount());
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Group {}: {} candidate pairs for {} primary and {} secondary ranges.",
                    group.key(),
                    indices.candidateCount(),
                    primary.size(),
                    secondary.size());
        }
        return indices;
    }
}
