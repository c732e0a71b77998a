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

package org.intervalframe.utils;

import java.util.Comparator;

import static org.intervalframe.utils.Preconditions.checkNotNull;

/**
 * Binary search of insertion points over an ascending array.
 *
 * <p>For every probe the result is the position at which the probe could be inserted while
 * keeping the array sorted. {@link SearchSide#LEFT} places it before equal elements and {@link
 * SearchSide#RIGHT} after them. Each probe is an independent {@code O(log n)} search over the
 * whole array, so probes need not be sorted.
 */
public final class SortedSearch {

    private SortedSearch() {}

    public static <T> int[] searchSorted(
            T[] sorted, T[] probes, SearchSide side, Comparator<? super T> comparator) {
        checkNotNull(sorted, "Sorted input cannot be null");
        checkNotNull(probes, "Probes cannot be null");
        int[] result = new int[probes.length];
        for (int i = 0; i < probes.length; i++) {
            result[i] = insertionPoint(sorted, probes[i], side, comparator);
        }
        return result;
    }

    public static <T> int insertionPoint(
            T[] sorted, T probe, SearchSide side, Comparator<? super T> comparator) {
        int left = 0;
        int right = sorted.length;
        while (left < right) {
            int mid = left + (right - left) / 2;
            int cmp = comparator.compare(sorted[mid], probe);
            if (cmp < 0 || (cmp == 0 && side == SearchSide.RIGHT)) {
                left = mid + 1;
            } else {
                right = mid;
            }
        }
        return left;
    }
}
