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

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The rows of one group on one side, sorted ascending by {@code (start, end)}.
 *
 * <p>Every position holds a distinct representative row together with the number of identical
 * input rows it stands for and the input position of its first occurrence. Without
 * deduplication every count is one. {@link #starts()} and {@link #ends()} are the sorted
 * boundary arrays that the binary searches of {@link OverlapMatcher} run against.
 */
public final class SortedGroup {

    /** Natural order of boundary values. Both sides hold values of the same type root. */
    @SuppressWarnings("unchecked")
    public static final Comparator<Object> BOUNDARY_ORDER =
            (left, right) -> ((Comparable<Object>) left).compareTo(right);

    private final JoinSide side;
    private final GroupKey key;
    private final List<InternalRow> rows;
    private final Object[] starts;
    private final Object[] ends;
    private final int[] originalIndex;
    private final int[] counts;

    private SortedGroup(
            JoinSide side,
            GroupKey key,
            List<InternalRow> rows,
            Object[] starts,
            Object[] ends,
            int[] originalIndex,
            int[] counts) {
        this.side = side;
        this.key = key;
        this.rows = rows;
        this.starts = starts;
        this.ends = ends;
        this.originalIndex = originalIndex;
        this.counts = counts;
    }

    /**
     * Sorts the given rows of one group.
     *
     * @param rows rows of the group, in input order
     * @param positions input position of each row
     * @param startIndex field position of the start boundary
     * @param endIndex field position of the end boundary
     * @param deduplicate whether rows equal in every field collapse into one representative
     */
    public static SortedGroup create(
            JoinSide side,
            GroupKey key,
            List<InternalRow> rows,
            int[] positions,
            int startIndex,
            int endIndex,
            boolean deduplicate) {
        List<InternalRow> distinct = new ArrayList<>(rows.size());
        List<Integer> firstPositions = new ArrayList<>(rows.size());
        List<Integer> multiplicities = new ArrayList<>(rows.size());
        if (deduplicate) {
            Map<List<Object>, Integer> seen = new LinkedHashMap<>();
            for (int i = 0; i < rows.size(); i++) {
                InternalRow row = rows.get(i);
                Integer slot = seen.putIfAbsent(valuesOf(row), distinct.size());
                if (slot == null) {
                    distinct.add(row);
                    firstPositions.add(positions[i]);
                    multiplicities.add(1);
                } else {
                    multiplicities.set(slot, multiplicities.get(slot) + 1);
                }
            }
        } else {
            for (int i = 0; i < rows.size(); i++) {
                distinct.add(rows.get(i));
                firstPositions.add(positions[i]);
                multiplicities.add(1);
            }
        }

        // stable, so rows with equal boundaries keep their input order
        Integer[] order = new Integer[distinct.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Comparator<Integer> byStart =
                Comparator.comparing(i -> distinct.get(i).getField(startIndex), BOUNDARY_ORDER);
        Arrays.sort(
                order,
                byStart.thenComparing(i -> distinct.get(i).getField(endIndex), BOUNDARY_ORDER));

        ImmutableList.Builder<InternalRow> sortedRows = ImmutableList.builder();
        Object[] starts = new Object[order.length];
        Object[] ends = new Object[order.length];
        int[] originalIndex = new int[order.length];
        int[] counts = new int[order.length];
        for (int i = 0; i < order.length; i++) {
            InternalRow row = distinct.get(order[i]);
            sortedRows.add(row);
            starts[i] = row.getField(startIndex);
            ends[i] = row.getField(endIndex);
            originalIndex[i] = firstPositions.get(order[i]);
            counts[i] = multiplicities.get(order[i]);
        }
        return new SortedGroup(side, key, sortedRows.build(), starts, ends, originalIndex, counts);
    }

    private static List<Object> valuesOf(InternalRow row) {
        List<Object> values = new ArrayList<>(row.getFieldCount());
        for (int i = 0; i < row.getFieldCount(); i++) {
            values.add(row.getField(i));
        }
        return values;
    }

    public JoinSide side() {
        return side;
    }

    public GroupKey key() {
        return key;
    }

    /** Number of distinct representatives. */
    public int size() {
        return rows.size();
    }

    /** Number of input rows, counting every duplicate. */
    public long totalCount() {
        long total = 0;
        for (int count : counts) {
            total += count;
        }
        return total;
    }

    public InternalRow row(int pos) {
        return rows.get(pos);
    }

    public Object start(int pos) {
        return starts[pos];
    }

    public Object end(int pos) {
        return ends[pos];
    }

    public int count(int pos) {
        return counts[pos];
    }

    public int originalIndex(int pos) {
        return originalIndex[pos];
    }

    /** Sorted start boundaries. The array is shared and must not be modified. */
    Object[] starts() {
        return starts;
    }

    /** End boundaries in the same order as {@link #starts()}. The array is shared. */
    Object[] ends() {
        return ends;
    }

    @Override
    public String toString() {
        return String.format("%s group %s with %d ranges", side, key, rows.size());
    }
}
