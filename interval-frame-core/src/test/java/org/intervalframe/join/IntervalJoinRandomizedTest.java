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
import org.intervalframe.data.RangeSet;
import org.intervalframe.types.DataTypes;
import org.intervalframe.types.RowType;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/** Compares {@link IntervalJoin} with a pairwise scan on random ranges. */
public class IntervalJoinRandomizedTest {

    private static final RowType ROW_TYPE =
            RowType.builder()
                    .field("k", DataTypes.STRING())
                    .field("a", DataTypes.BIGINT())
                    .field("b", DataTypes.BIGINT())
                    .build();

    private static final String[] KEYS = {"A", "B", "C", "D"};

    @Test
    public void testMatchesPairwiseScan() {
        for (long seed = 0; seed < 30; seed++) {
            Random random = new Random(seed);
            RangeSet primary = randomRanges(random, 1 + random.nextInt(40));
            RangeSet secondary = randomRanges(random, 1 + random.nextInt(40));
            for (JoinType how : JoinType.values()) {
                for (boolean closed : new boolean[] {false, true}) {
                    for (boolean deduplicate : new boolean[] {false, true}) {
                        RangeSet result =
                                new IntervalJoin(primary, secondary)
                                        .on("a", "b")
                                        .withBy("k")
                                        .withJoinType(how)
                                        .withClosed(closed)
                                        .withDeduplicate(deduplicate)
                                        .join();

                        assertThat(result.rows())
                                .as("seed %s, %s, closed %s", seed, how, closed)
                                .containsExactlyInAnyOrderElementsOf(
                                        pairwiseJoin(primary, secondary, how, closed));
                    }
                }
            }
        }
    }

    @Test
    public void testJoinIsSymmetric() {
        for (long seed = 100; seed < 120; seed++) {
            Random random = new Random(seed);
            RangeSet primary = randomRanges(random, 30);
            RangeSet secondary = randomRanges(random, 30);

            List<InternalRow> forward =
                    new IntervalJoin(primary, secondary).on("a", "b").withBy("k").join().rows();
            List<InternalRow> backward =
                    new IntervalJoin(secondary, primary).on("a", "b").withBy("k").join().rows();

            List<InternalRow> swapped = new ArrayList<>();
            for (InternalRow row : backward) {
                swapped.add(
                        GenericRow.of(
                                row.getField(0),
                                row.getField(3),
                                row.getField(4),
                                row.getField(1),
                                row.getField(2)));
            }
            assertThat(swapped).as("seed %s", seed).containsExactlyInAnyOrderElementsOf(forward);
        }
    }

    @Test
    public void testOuterJoinPartitionsBothSides() {
        for (long seed = 200; seed < 220; seed++) {
            Random random = new Random(seed);
            RangeSet primary = randomRanges(random, 25);
            RangeSet secondary = randomRanges(random, 25);
            IntervalJoin join = new IntervalJoin(primary, secondary).on("a", "b").withBy("k");

            int inner = join.withJoinType(JoinType.INNER).join().size();
            int left = join.nonOverlapping(JoinType.LEFT).size();
            int right = join.nonOverlapping(JoinType.RIGHT).size();
            int outer = join.withJoinType(JoinType.OUTER).join().size();

            assertThat(outer).as("seed %s", seed).isEqualTo(inner + left + right);
            assertThat(join.overlaps().size() + left).isEqualTo(primary.size());
        }
    }

    private static RangeSet randomRanges(Random random, int count) {
        RangeSet.Builder builder = RangeSet.builder(ROW_TYPE);
        List<Object[]> generated = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            if (!generated.isEmpty() && random.nextInt(5) == 0) {
                // duplicate an earlier row
                Object[] values = generated.get(random.nextInt(generated.size()));
                builder.add(values);
                generated.add(values);
                continue;
            }
            long start = random.nextInt(50) - 10;
            Object[] values = {KEYS[random.nextInt(KEYS.length)], start, start + random.nextInt(8)};
            builder.add(values);
            generated.add(values);
        }
        return builder.build();
    }

    private static List<InternalRow> pairwiseJoin(
            RangeSet primary, RangeSet secondary, JoinType how, boolean closed) {
        List<InternalRow> rows = new ArrayList<>();
        boolean[] secondaryMatched = new boolean[secondary.size()];
        for (InternalRow p : primary) {
            boolean matched = false;
            for (int j = 0; j < secondary.size(); j++) {
                InternalRow s = secondary.row(j);
                if (overlaps(p, s, closed)) {
                    matched = true;
                    secondaryMatched[j] = true;
                    rows.add(
                            GenericRow.of(
                                    p.getField(0),
                                    p.getField(1),
                                    p.getField(2),
                                    s.getField(1),
                                    s.getField(2)));
                }
            }
            if (!matched && how.keepsUnmatchedPrimary()) {
                rows.add(GenericRow.of(p.getField(0), p.getField(1), p.getField(2), null, null));
            }
        }
        if (how.keepsUnmatchedSecondary()) {
            for (int j = 0; j < secondary.size(); j++) {
                if (!secondaryMatched[j]) {
                    InternalRow s = secondary.row(j);
                    rows.add(
                            GenericRow.of(s.getField(0), null, null, s.getField(1), s.getField(2)));
                }
            }
        }
        return rows;
    }

    private static boolean overlaps(InternalRow p, InternalRow s, boolean closed) {
        if (!p.getField(0).equals(s.getField(0))) {
            return false;
        }
        long start = Math.max((Long) p.getField(1), (Long) s.getField(1));
        long end = Math.min((Long) p.getField(2), (Long) s.getField(2));
        return closed ? start <= end : start < end;
    }
}
