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

import org.intervalframe.data.GenericRow;
import org.intervalframe.data.InternalRow;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.intervalframe.join.RangeTestUtils.AB_SCHEMA;
import static org.intervalframe.join.RangeTestUtils.group;
import static org.intervalframe.join.RangeTestUtils.r;
import static org.intervalframe.join.RangeTestUtils.ranges;

/** Tests for {@link MissingOverlapComputer}. */
public class MissingOverlapComputerTest {

    @Test
    public void testRangesWithoutCandidates() {
        GroupPartition group =
                group(
                        ranges(r(1, 2), r(10, 11), r(30, 40), r(0, 10)),
                        ranges(r(-5, 5), r(6, 7), r(0, 1), r(100, 200), r(100, 200), r(400, 600)),
                        false);
        JoinMetrics metrics = new JoinMetrics();
        MissingOverlapComputer computer = computer(metrics);
        MatchIndices indices = new OverlapMatcher(false, metrics).match(group);
        OverlapPairs pairs = new ExpansionEngine(false, metrics).expand(group, indices);

        assertThat(computer.unmatchedPositions(JoinSide.PRIMARY, group, indices, pairs))
                .containsExactly(2, 3);
        assertThat(computer.unmatchedPositions(JoinSide.SECONDARY, group, indices, pairs))
                .containsExactly(3, 4, 5);
        assertThat(metrics.unmatchedWithoutCandidate(JoinSide.PRIMARY)).isEqualTo(2);
        assertThat(metrics.unmatchedRejected(JoinSide.PRIMARY)).isEqualTo(0);
        assertThat(metrics.unmatched(JoinSide.SECONDARY)).isEqualTo(3);

        assertThat(computer.unmatched(JoinSide.PRIMARY, group, indices, pairs, true))
                .containsExactly(row(10L, 11L, null, null), row(30L, 40L, null, null));
        assertThat(computer.unmatched(JoinSide.SECONDARY, group, indices, pairs, false))
                .containsExactly(row(100L, 200L), row(100L, 200L), row(400L, 600L));
    }

    @Test
    public void testRejectedCandidates() {
        GroupPartition group = group(ranges(r(5, 5), r(0, 1)), ranges(r(3, 8)), false);
        JoinMetrics metrics = new JoinMetrics();
        MatchIndices indices = new OverlapMatcher(false, metrics).match(group);
        OverlapPairs pairs = new ExpansionEngine(false, metrics).expand(group, indices);

        MissingOverlapComputer computer = computer(metrics);

        assertThat(computer.unmatchedPositions(JoinSide.PRIMARY, group, indices, pairs))
                .containsExactly(0, 1);
        assertThat(computer.unmatchedPositions(JoinSide.SECONDARY, group, indices, pairs))
                .containsExactly(0);
        assertThat(metrics.candidatePairs()).isEqualTo(1);
        assertThat(metrics.unmatchedWithoutCandidate(JoinSide.PRIMARY)).isEqualTo(1);
        assertThat(metrics.unmatchedRejected(JoinSide.PRIMARY)).isEqualTo(1);
        assertThat(metrics.unmatchedRejected(JoinSide.SECONDARY)).isEqualTo(1);
    }

    @Test
    public void testDuplicatesAreEmittedPerCount() {
        GroupPartition group =
                group(ranges(r(0, 1), r(50, 60), r(50, 60)), ranges(r(0, 5)), true);
        JoinMetrics metrics = new JoinMetrics();
        MatchIndices indices = new OverlapMatcher(false, metrics).match(group);
        OverlapPairs pairs = new ExpansionEngine(false, metrics).expand(group, indices);

        assertThat(computer(metrics).unmatched(JoinSide.PRIMARY, group, indices, pairs, false))
                .containsExactly(row(50L, 60L), row(50L, 60L));
        assertThat(metrics.unmatched(JoinSide.PRIMARY)).isEqualTo(2);
    }

    @Test
    public void testWholeGroupAndUnmatchableRows() {
        JoinMetrics metrics = new JoinMetrics();
        MissingOverlapComputer computer = computer(metrics);
        SortedGroup secondary =
                group(ranges(r(0, 1)), ranges(r(7, 8), r(2, 3), r(7, 8)), true).secondary();

        assertThat(computer.wholeGroup(secondary, true))
                .containsExactly(
                        row(null, null, 2L, 3L), row(null, null, 7L, 8L), row(null, null, 7L, 8L));
        assertThat(
                        computer.allUnmatched(
                                JoinSide.PRIMARY,
                                Arrays.<InternalRow>asList(row(9L, 3L), row(null, 4L)),
                                true))
                .containsExactly(row(9L, 3L, null, null), row(null, 4L, null, null));
        assertThat(metrics.unmatched(JoinSide.SECONDARY)).isEqualTo(3);
        assertThat(metrics.unmatched(JoinSide.PRIMARY)).isEqualTo(2);
    }

    private static MissingOverlapComputer computer(JoinMetrics metrics) {
        return new MissingOverlapComputer(new RowAssembler(AB_SCHEMA), metrics);
    }

    private static GenericRow row(Object... values) {
        return GenericRow.of(values);
    }
}
