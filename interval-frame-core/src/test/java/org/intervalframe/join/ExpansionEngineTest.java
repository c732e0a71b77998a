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

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.intervalframe.join.RangeTestUtils.AB_SCHEMA;
import static org.intervalframe.join.RangeTestUtils.group;
import static org.intervalframe.join.RangeTestUtils.r;
import static org.intervalframe.join.RangeTestUtils.ranges;

/** Tests for {@link ExpansionEngine}. */
public class ExpansionEngineTest {

    private static final GroupPartition GROUP =
            group(
                    ranges(r(0, 6), r(5, 7), r(6, 10)),
                    ranges(r(1, 2), r(3, 8), r(6, 7)),
                    false);

    @Test
    public void testPairsOrderedByPrimaryThenSecondary() {
        JoinMetrics metrics = new JoinMetrics();
        OverlapPairs pairs = expand(GROUP, false, metrics);

        assertThat(positions(pairs)).containsExactly("0-0", "0-1", "1-1", "1-2", "2-1", "2-2");
        assertThat(metrics.overlapPairs()).isEqualTo(6);
        assertThat(pairs.matched(JoinSide.SECONDARY).getCardinality()).isEqualTo(3);
    }

    @Test
    public void testClosedRangesMatchWhenTouching() {
        OverlapPairs pairs = expand(GROUP, true, new JoinMetrics());

        assertThat(positions(pairs))
                .containsExactly("0-0", "0-1", "0-2", "1-1", "1-2", "2-1", "2-2");
    }

    @Test
    public void testEmptyRangeIsRejected() {
        GroupPartition group = group(ranges(r(5, 5)), ranges(r(3, 8)), false);

        assertThat(expand(group, false, new JoinMetrics()).size()).isEqualTo(0);
        assertThat(expand(group, true, new JoinMetrics()).size()).isEqualTo(1);
    }

    @Test
    public void testMaterializeRepeatsDuplicates() {
        GroupPartition group =
                group(
                        ranges(r(0, 10), r(0, 10), r(20, 30)),
                        ranges(r(5, 6), r(5, 6), r(5, 6)),
                        true);
        ExpansionEngine engine = new ExpansionEngine(false, new JoinMetrics());
        OverlapPairs pairs =
                engine.expand(group, new OverlapMatcher(false, new JoinMetrics()).match(group));

        List<InternalRow> rows = engine.materialize(group, pairs, new RowAssembler(AB_SCHEMA));

        assertThat(pairs.size()).isEqualTo(1);
        assertThat(rows).hasSize(6).containsOnly(GenericRow.of(0L, 10L, 5L, 6L));
        assertThat(engine.overlappingPrimary(group, pairs))
                .containsExactly(GenericRow.of(0L, 10L), GenericRow.of(0L, 10L));
    }

    @Test
    public void testOverlappingPrimaryOncePerRange() {
        ExpansionEngine engine = new ExpansionEngine(false, new JoinMetrics());

        List<InternalRow> rows =
                engine.overlappingPrimary(GROUP, expand(GROUP, false, new JoinMetrics()));

        assertThat(rows)
                .containsExactly(
                        GenericRow.of(0L, 6L), GenericRow.of(5L, 7L), GenericRow.of(6L, 10L));
    }

    private static OverlapPairs expand(GroupPartition group, boolean closed, JoinMetrics metrics) {
        MatchIndices indices = new OverlapMatcher(closed, metrics).match(group);
        return new ExpansionEngine(closed, metrics).expand(group, indices);
    }

    private static List<String> positions(OverlapPairs pairs) {
        List<String> positions = new ArrayList<>();
        for (int k = 0; k < pairs.size(); k++) {
            positions.add(pairs.primary(k) + "-" + pairs.secondary(k));
        }
        return positions;
    }
}
