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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters collected while an {@link IntervalJoin} runs. Safe to update from the threads that
 * process groups in parallel. One instance may be reused across runs, the counters then add up.
 */
public class JoinMetrics {

    private final AtomicLong pairedGroups = new AtomicLong();
    private final AtomicLong primaryOnlyGroups = new AtomicLong();
    private final AtomicLong secondaryOnlyGroups = new AtomicLong();
    private final AtomicLong candidatePairs = new AtomicLong();
    private final AtomicLong overlapPairs = new AtomicLong();
    private final AtomicLong primaryWithoutCandidate = new AtomicLong();
    private final AtomicLong primaryRejected = new AtomicLong();
    private final AtomicLong secondaryWithoutCandidate = new AtomicLong();
    private final AtomicLong secondaryRejected = new AtomicLong();
    private final AtomicLong outputRows = new AtomicLong();

    void recordGroups(long paired, long primaryOnly, long secondaryOnly) {
        pairedGroups.addAndGet(paired);
        primaryOnlyGroups.addAndGet(primaryOnly);
        secondaryOnlyGroups.addAndGet(secondaryOnly);
    }

    void recordCandidates(long count) {
        candidatePairs.addAndGet(count);
    }

    void recordPairs(long count) {
        overlapPairs.addAndGet(count);
    }

    void recordUnmatched(JoinSide side, long withoutCandidate, long rejected) {
        if (side == JoinSide.PRIMARY) {
            primaryWithoutCandidate.addAndGet(withoutCandidate);
            primaryRejected.addAndGet(rejected);
        } else {
            secondaryWithoutCandidate.addAndGet(withoutCandidate);
            secondaryRejected.addAndGet(rejected);
        }
    }

    void recordOutput(long rows) {
        outputRows.addAndGet(rows);
    }

    public long pairedGroups() {
        return pairedGroups.get();
    }

    public long groupsOnlyIn(JoinSide side) {
        return side == JoinSide.PRIMARY ? primaryOnlyGroups.get() : secondaryOnlyGroups.get();
    }

    /** Candidate pairs inside the search windows, before the overlap check. */
    public long candidatePairs() {
        return candidatePairs.get();
    }

    /** Overlapping pairs of distinct representatives. */
    public long overlapPairs() {
        return overlapPairs.get();
    }

    /** Unmatched rows of the side that no candidate window reached. */
    public long unmatchedWithoutCandidate(JoinSide side) {
        return side == JoinSide.PRIMARY
                ? primaryWithoutCandidate.get()
                : secondaryWithoutCandidate.get();
    }

    /** Unmatched rows of the side whose candidates all failed the overlap check. */
    public long unmatchedRejected(JoinSide side) {
        return side == JoinSide.PRIMARY ? primaryRejected.get() : secondaryRejected.get();
    }

    public long unmatched(JoinSide side) {
        return unmatchedWithoutCandidate(side) + unmatchedRejected(side);
    }

    public long outputRows() {
        return outputRows.get();
    }

    @Override
    public String toString() {
        return "JoinMetrics{"
                + "pairedGroups="
                + pairedGroups
                + ", primaryOnlyGroups="
                + primaryOnlyGroups
                + ", secondaryOnlyGroups="
                + secondaryOnlyGroups
                + ", candidatePairs="
                + candidatePairs
                + ", overlapPairs="
                + overlapPairs
                + ", unmatchedPrimary="
                + unmatched(JoinSide.PRIMARY)
                + ", unmatchedSecondary="
                + unmatched(JoinSide.SECONDARY)
                + ", outputRows="
                + outputRows
                + '}';
    }
}
