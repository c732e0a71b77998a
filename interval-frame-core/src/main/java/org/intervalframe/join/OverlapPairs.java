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

import org.roaringbitmap.RoaringBitmap;

/**
 * Overlapping pairs of one group, as positions into the sorted groups of both sides. Pairs are
 * ordered by primary position, then secondary position.
 */
public final class OverlapPairs {

    private final int[] primaryPositions;
    private final int[] secondaryPositions;

    OverlapPairs(int[] primaryPositions, int[] secondaryPositions) {
        this.primaryPositions = primaryPositions;
        this.secondaryPositions = secondaryPositions;
    }

    public int size() {
        return primaryPositions.length;
    }

    public int primary(int pair) {
        return primaryPositions[pair];
    }

    public int secondary(int pair) {
        return secondaryPositions[pair];
    }

    /** Positions of the given side that take part in at least one pair. */
    public RoaringBitmap matched(JoinSide side) {
        return RoaringBitmap.bitmapOf(
                side == JoinSide.PRIMARY ? primaryPositions : secondaryPositions);
    }
}
