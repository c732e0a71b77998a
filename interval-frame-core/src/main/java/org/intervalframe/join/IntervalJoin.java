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

import org.intervalframe.CoreOptions;
import org.intervalframe.data.InternalRow;
import org.intervalframe.data.RangeSet;
import org.intervalframe.options.Options;
import org.intervalframe.types.RowType;
import org.intervalframe.utils.ThreadPoolUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

import static org.intervalframe.utils.Preconditions.checkArgument;
import static org.intervalframe.utils.Preconditions.checkNotNull;
import static org.intervalframe.utils.Preconditions.checkState;

/**
 * Interval join between a primary and a secondary {@link RangeSet}.
 *
 * <p>Two ranges overlap when {@code max(start) < min(end)}, or {@code <=} for closed ranges, and
 * both carry equal values in the group columns. Each run goes through the same stages: {@link
 * GroupPartitioner} groups and sorts both operands, {@link OverlapMatcher} finds candidate
 * windows per group, {@link ExpansionEngine} turns them into pairs and rows, and {@link
 * MissingOverlapComputer} collects the ranges without overlap. Groups are independent and may be
 * processed in parallel, see {@link CoreOptions#PARALLELISM}.
 *
 * <pre>{@code
 * RangeSet result =
 *         new IntervalJoin(genes, peaks)
 *                 .on("start", "end")
 *                 .withBy("chromosome")
 *                 .withJoinType(JoinType.LEFT)
 *                 .join();
 * }</pre>
 */
public class IntervalJoin {

    private static final Logger LOG = LoggerFactory.getLogger(IntervalJoin.class);

    private final RangeSet primary;
    private final RangeSet secondary;
    private final Options options = new Options();

    private String primaryStart;
    private String primaryEnd;
    private String secondaryStart;
    private String secondaryEnd;
    private List<String> by = Collections.emptyList();
    private JoinMetrics metrics = new JoinMetrics();

    public IntervalJoin(RangeSet primary, RangeSet secondary) {
        this.primary = checkNotNull(primary, "Primary ranges cannot be null");
        this.secondary = checkNotNull(secondary, "Secondary ranges cannot be null");
    }

    public static IntervalJoin create(
            RangeSet primary, RangeSet secondary, JoinDescriptor descriptor) {
        return new IntervalJoin(primary, secondary)
                .on(
                        descriptor.primaryStart(),
                        descriptor.primaryEnd(),
                        descriptor.secondaryStart(),
                        descriptor.secondaryEnd())
                .withBy(descriptor.by())
                .withOptions(descriptor.options());
    }

    /** Both sides store their boundaries in columns with the given names. */
    public IntervalJoin on(String start, String end) {
        return on(start, end, start, end);
    }

    public IntervalJoin on(
            String primaryStart, String primaryEnd, String secondaryStart, String secondaryEnd) {
        this.primaryStart = checkNotNull(primaryStart);
        this.primaryEnd = checkNotNull(primaryEnd);
        this.secondaryStart = checkNotNull(secondaryStart);
        this.secondaryEnd = checkNotNull(secondaryEnd);
        return this;
    }

    public IntervalJoin withBy(String... by) {
        return withBy(Arrays.asList(by));
    }

    /** Group columns, present under the same name on both sides. Empty means one group. */
    public IntervalJoin withBy(List<String> by) {
        this.by = new ArrayList<>(checkNotNull(by));
        return this;
    }

    public IntervalJoin withSuffix(String suffix) {
        options.set(CoreOptions.SUFFIX, checkNotNull(suffix));
        return this;
    }

    public IntervalJoin withJoinType(JoinType how) {
        options.set(CoreOptions.HOW, checkNotNull(how));
        return this;
    }

    public IntervalJoin withClosed(boolean closed) {
        options.set(CoreOptions.CLOSED, closed);
        return this;
    }

    public IntervalJoin withDeduplicate(boolean deduplicate) {
        options.set(CoreOptions.DEDUPLICATE, deduplicate);
        return this;
    }

    public IntervalJoin withStrict(boolean strict) {
        options.set(CoreOptions.STRICT, strict);
        return this;
    }

    public IntervalJoin withNullsLast(boolean nullsLast) {
        options.set(CoreOptions.NULLS_LAST, nullsLast);
        return this;
    }

    public IntervalJoin withParallelism(int parallelism) {
        checkArgument(parallelism > 0, "Parallelism must be positive, but is %s", parallelism);
        options.set(CoreOptions.PARALLELISM, parallelism);
        return this;
    }

    public IntervalJoin withOptions(Map<String, String> dynamicOptions) {
        dynamicOptions.forEach(options::setString);
        return this;
    }

    /** Counters of this join are added to the given instance. */
    public IntervalJoin withMetrics(JoinMetrics metrics) {
        this.metrics = checkNotNull(metrics);
        return this;
    }

    public JoinMetrics metrics() {
        return metrics;
    }

    public JoinDescriptor descriptor() {
        checkBoundaries();
        return new JoinDescriptor(
                primaryStart, primaryEnd, secondaryStart, secondaryEnd, by, options.toMap());
    }

    /**
     * Pairs every primary range with every overlapping secondary range. Depending on {@link
     * CoreOptions#HOW}, ranges without overlap are added with the other side's columns null.
     */
    public RangeSet join() {
        CoreOptions coreOptions = new CoreOptions(options);
        JoinType how = coreOptions.joinType();
        Stages stages = new Stages(coreOptions);
        RowType outputType = stages.schema.outputType(how);

        if (primary.isEmpty() || secondary.isEmpty()) {
            stages.partitioner.checkRanges(JoinSide.PRIMARY, primary);
            stages.partitioner.checkRanges(JoinSide.SECONDARY, secondary);
            List<InternalRow> rows = new ArrayList<>();
            if (how.keepsUnmatchedPrimary()) {
                rows.addAll(stages.missing.allUnmatched(JoinSide.PRIMARY, primary.rows(), true));
            }
            if (how.keepsUnmatchedSecondary()) {
                rows.addAll(
                        stages.missing.allUnmatched(JoinSide.SECONDARY, secondary.rows(), true));
            }
            LOG.debug("One operand is empty, skipping the search for {} join.", how);
            return finish(outputType, rows);
        }

        PartitionedRanges partitioned = stages.partitioner.partition(primary, secondary);
        List<GroupResult> results =
                processGroups(
                        partitioned.pairedGroups(),
                        coreOptions.parallelism(),
                        group -> {
                            MatchIndices indices = stages.matcher.match(group);
                            OverlapPairs pairs = stages.expansion.expand(group, indices);
                            return new GroupResult(
                                    stages.expansion.materialize(group, pairs, stages.assembler),
                                    how.keepsUnmatchedPrimary()
                                            ? stages.missing.unmatched(
                                                    JoinSide.PRIMARY, group, indices, pairs, true)
                                            : Collections.emptyList(),
                                    how.keepsUnmatchedSecondary()
                                            ? stages.missing.unmatched(
                                                    JoinSide.SECONDARY, group, indices, pairs, true)
                                            : Collections.emptyList());
                        });

        List<InternalRow> matched = new ArrayList<>();
        List<InternalRow> missing = new ArrayList<>();
        for (GroupResult result : results) {
            matched.addAll(result.matched);
        }
        if (how.keepsUnmatchedPrimary()) {
            for (GroupResult result : results) {
                missing.addAll(result.unmatchedPrimary);
            }
            missing.addAll(stages.unmatchedOutsidePairs(JoinSide.PRIMARY, partitioned, true));
        }
        if (how.keepsUnmatchedSecondary()) {
            for (GroupResult result : results) {
                missing.addAll(result.unmatchedSecondary);
            }
            missing.addAll(stages.unmatchedOutsidePairs(JoinSide.SECONDARY, partitioned, true));
        }

        List<InternalRow> rows = new ArrayList<>(matched.size() + missing.size());
        if (coreOptions.nullsLast()) {
            rows.addAll(matched);
            rows.addAll(missing);
        } else {
            rows.addAll(missing);
            rows.addAll(matched);
        }
        return finish(outputType, rows);
    }

    /**
     * Primary ranges that overlap at least one secondary range, without secondary columns. A
     * range is returned once per duplicate in the input, however many ranges it overlaps.
     */
    public RangeSet overlaps() {
        CoreOptions coreOptions = new CoreOptions(options);
        Stages stages = new Stages(coreOptions);
        if (primary.isEmpty() || secondary.isEmpty()) {
            stages.partitioner.checkRanges(JoinSide.PRIMARY, primary);
            stages.partitioner.checkRanges(JoinSide.SECONDARY, secondary);
            return finish(primary.rowType(), Collections.emptyList());
        }

        PartitionedRanges partitioned = stages.partitioner.partition(primary, secondary);
        List<List<InternalRow>> results =
                processGroups(
                        partitioned.pairedGroups(),
                        coreOptions.parallelism(),
                        group ->
                                stages.expansion.overlappingPrimary(
                                        group,
                                        stages.expansion.expand(
                                                group, stages.matcher.match(group))));
        List<InternalRow> rows = new ArrayList<>();
        results.forEach(rows::addAll);
        return finish(primary.rowType(), rows);
    }

    /** Ranges of one side without overlap, in that side's own columns. */
    public RangeSet nonOverlapping(JoinType how) {
        return nonOverlapping(how, false);
    }

    /**
     * Ranges of one side without overlap.
     *
     * @param how {@link JoinType#LEFT} for primary ranges, {@link JoinType#RIGHT} for secondary
     *     ranges
     * @param includeOtherColumns whether to lay rows out like the joined result, with the other
     *     side's columns null
     */
    public RangeSet nonOverlapping(JoinType how, boolean includeOtherColumns) {
        checkArgument(
                how == JoinType.LEFT || how == JoinType.RIGHT,
                "Non-overlapping ranges are computed for the left or right side, but got %s",
                how);
        JoinSide side = how == JoinType.LEFT ? JoinSide.PRIMARY : JoinSide.SECONDARY;
        CoreOptions coreOptions = new CoreOptions(options);
        Stages stages = new Stages(coreOptions);
        RowType outputType =
                includeOtherColumns ? stages.schema.outputType(how) : stages.schema.typeOf(side);
        RangeSet ranges = side == JoinSide.PRIMARY ? primary : secondary;

        if (primary.isEmpty() || secondary.isEmpty()) {
            stages.partitioner.checkRanges(JoinSide.PRIMARY, primary);
            stages.partitioner.checkRanges(JoinSide.SECONDARY, secondary);
            return finish(
                    outputType,
                    stages.missing.allUnmatched(side, ranges.rows(), includeOtherColumns));
        }

        PartitionedRanges partitioned = stages.partitioner.partition(primary, secondary);
        List<List<InternalRow>> results =
                processGroups(
                        partitioned.pairedGroups(),
                        coreOptions.parallelism(),
                        group -> {
                            MatchIndices indices = stages.matcher.match(group);
                            OverlapPairs pairs = stages.expansion.expand(group, indices);
                            return stages.missing.unmatched(
                                    side, group, indices, pairs, includeOtherColumns);
                        });
        List<InternalRow> rows = new ArrayList<>();
        results.forEach(rows::addAll);
        rows.addAll(stages.unmatchedOutsidePairs(side, partitioned, includeOtherColumns));
        return finish(outputType, rows);
    }

    private RangeSet finish(RowType rowType, List<InternalRow> rows) {
        metrics.recordOutput(rows.size());
        if (LOG.isDebugEnabled()) {
            LOG.debug("Interval join produced {} rows, {}", rows.size(), metrics);
        }
        return RangeSet.of(rowType, rows);
    }

    private <T> List<T> processGroups(
            List<GroupPartition> groups, int parallelism, Function<GroupPartition, T> processor) {
        if (parallelism == 1 || groups.size() <= 1) {
            List<T> results = new ArrayList<>(groups.size());
            for (GroupPartition group : groups) {
                results.add(processor.apply(group));
            }
            return results;
        }

        ExecutorService executor =
                ThreadPoolUtils.createCachedThreadPool(
                        Math.min(parallelism, groups.size()), "interval-join");
        try {
            return ThreadPoolUtils.randomlyExecuteSequentialReturn(
                    executor, group -> Collections.singletonList(processor.apply(group)), groups);
        } finally {
            executor.shutdownNow();
        }
    }

    private void checkBoundaries() {
        checkState(
                primaryStart != null,
                "Boundary columns are not set, call on(start, end) before running the join.");
    }

    /** The stages of one run, sharing one schema, one set of options and the metrics. */
    private final class Stages {

        private final JoinSchema schema;
        private final RowAssembler assembler;
        private final GroupPartitioner partitioner;
        private final OverlapMatcher matcher;
        private final ExpansionEngine expansion;
        private final MissingOverlapComputer missing;

        private Stages(CoreOptions coreOptions) {
            checkBoundaries();
            this.schema =
                    JoinSchema.create(
                            primary.rowType(),
                            secondary.rowType(),
                            primaryStart,
                            primaryEnd,
                            secondaryStart,
                            secondaryEnd,
                            by,
                            coreOptions.suffix());
            this.assembler = new RowAssembler(schema);
            this.partitioner =
                    new GroupPartitioner(
                            schema, coreOptions.deduplicate(), coreOptions.strict(), metrics);
            this.matcher = new OverlapMatcher(coreOptions.closed(), metrics);
            this.expansion = new ExpansionEngine(coreOptions.closed(), metrics);
            this.missing = new MissingOverlapComputer(assembler, metrics);
        }

        /** Unmatched rows of groups only on the given side, then rows that cannot be matched. */
        private List<InternalRow> unmatchedOutsidePairs(
                JoinSide side, PartitionedRanges partitioned, boolean padOther) {
            List<InternalRow> rows = new ArrayList<>();
            for (SortedGroup group : partitioned.groupsOnlyIn(side)) {
                rows.addAll(missing.wholeGroup(group, padOther));
            }
            rows.addAll(missing.allUnmatched(side, partitioned.unmatchableRows(side), padOther));
            return rows;
        }
    }

    private static final class GroupResult {

        private final List<InternalRow> matched;
        private final List<InternalRow> unmatchedPrimary;
        private final List<InternalRow> unmatchedSecondary;

        private GroupResult(
                List<InternalRow> matched,
                List<InternalRow> unmatchedPrimary,
                List<InternalRow> unmatchedSecondary) {
            this.matched = matched;
            this.unmatchedPrimary = unmatchedPrimary;
            this.unmatchedSecondary = unmatchedSecondary;
        }
    }
}
