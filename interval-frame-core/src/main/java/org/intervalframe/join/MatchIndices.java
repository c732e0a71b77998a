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

/**
 * Candidate windows of one group, computed by {@link OverlapMatcher} in both directions.
 *
 * <p>For primary row {@code i}, {@code [primaryLow[i], primaryHigh[i])} indexes the secondary
 * rows whose start lies within the primary range. For secondary row {@code j}, {@code
 * [secondaryLow[j], secondaryHigh[j])} indexes the primary rows whose start lies strictly after
 * the secondary start and within the secondary range. A mask is set where the window is not empty
 * and a length is the window size, never negative.
 */
public final class MatchIndices {

    private final int[] primaryLow;
    private final int[] primaryHigh;
    private final int[] secondaryLow;
    private final int[] secondaryHigh;
    private final boolean[] primaryMask;
    private final boolean[] secondaryMask;
    private final int[] primaryLengths;
    private final int[] secondaryLengths;

    MatchIndices(int[] primaryLow, int[] primaryHigh, int[] secondaryLow, int[] secondaryHigh) {
        this.primaryLow = primaryLow;
        this.primaryHigh = primaryHigh;
        this.secondaryLow = secondaryLow;
        this.secondaryHigh = secondaryHigh;
        this.primaryLengths = lengths(primaryLow, primaryHigh);
        this.secondaryLengths = lengths(secondaryLow, secondaryHigh);
        this.primaryMask = mask(primaryLengths);
        this.secondaryMask = mask(secondaryLengths);
    }

    private static int[] lengths(int[] low, int[] high) {
        int[] lengths = new int[low.length];
        for (int i = 0; i < low.length; i++) {
            lengths[i] = Math.max(0, high[i] - low[i]);
        }
        return lengths;
    }

    private static boolean[] mask(int[] lengths) {
        boolean[] mask = new boolean[lengths.length];
        for (int i = 0; i < lengths.length; i++) {
            mask[i] = lengths[i] > 0;
        }
        return mask;
    }

    public int low(JoinSide side, int pos) {
        return side == JoinSide.PRIMARY ? primaryLow[pos] : secondaryLow[pos];
    }

    public int high(JoinSide side, int pos) {
        return side == JoinSide.PRIMARY ? primaryHigh[pos] : secondaryHigh[pos];
    }

    public int length(JoinSide side, int pos) {
        return side == JoinSide.PRIMARY ? primaryLengths[pos] : secondaryLengths[pos];
    }

    public boolean mask(JoinSide side, int pos) {
        return side == JoinSide.PRIMARY ? primaryMask[pos] : secondaryMask[pos];
    }

    /** Number of rows of the given side, i.e. the length of its window arrays. */
    public int size(JoinSide side) {
        return side == JoinSide.PRIMARY ? primaryLow.length : secondaryLow.length;
    }

    /** Total number of candidate pairs over both directions. */
    public long candidateCount() {
        long total = 0;
        for (int length : primaryLengths) {
            total += length;
        }
        for (int length : secondaryLengths) {
            total += length;
        }
        return total;
    }
}
