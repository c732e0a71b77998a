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

package org.intervalframe;

import org.intervalframe.join.JoinType;
import org.intervalframe.options.ConfigOption;
import org.intervalframe.options.ConfigOptions;
import org.intervalframe.options.Options;

import java.io.Serializable;
import java.util.Map;

import static org.intervalframe.utils.Preconditions.checkArgument;

/** Core options for interval joins. */
public class CoreOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final ConfigOption<String> SUFFIX =
            ConfigOptions.key("join.suffix")
                    .stringType()
                    .defaultValue("_right")
                    .withDescription(
                            "Suffix appended to secondary column names that also exist on "
                                    + "the primary side.");

    public static final ConfigOption<JoinType> HOW =
            ConfigOptions.key("join.how")
                    .enumType(JoinType.class)
                    .defaultValue(JoinType.INNER)
                    .withDescription(
                            "Join mode: inner, left, right or outer. Unmatched ranges of the "
                                    + "requested sides are padded with nulls.");

    public static final ConfigOption<Boolean> CLOSED =
            ConfigOptions.key("join.closed")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether ranges are closed, so that ranges touching at a boundary "
                                    + "overlap. By default ranges are half-open.");

    public static final ConfigOption<Boolean> DEDUPLICATE =
            ConfigOptions.key("join.deduplicate")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether identical rows are collapsed into one representative before "
                                    + "matching. The result is re-expanded, so output is "
                                    + "unchanged.");

    public static final ConfigOption<Boolean> STRICT =
            ConfigOptions.key("join.strict")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether null boundaries and ranges with start > end are rejected. "
                                    + "Otherwise such ranges overlap nothing.");

    public static final ConfigOption<Boolean> NULLS_LAST =
            ConfigOptions.key("join.nulls-last")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether null padded rows of unmatched ranges follow the matched rows "
                                    + "instead of preceding them.");

    public static final ConfigOption<Integer> PARALLELISM =
            ConfigOptions.key("join.parallelism")
                    .intType()
                    .defaultValue(1)
                    .withDescription("Number of threads processing independent groups.");

    private final Options options;

    public CoreOptions(Map<String, String> options) {
        this(Options.fromMap(options));
    }

    public CoreOptions(Options options) {
        this.options = options;
    }

    public Map<String, String> toMap() {
        return options.toMap();
    }

    public String suffix() {
        return options.get(SUFFIX);
    }

    public JoinType joinType() {
        return options.get(HOW);
    }

    public boolean closed() {
        return options.get(CLOSED);
    }

    public boolean deduplicate() {
        return options.get(DEDUPLICATE);
    }

    public boolean strict() {
        return options.get(STRICT);
    }

    public boolean nullsLast() {
        return options.get(NULLS_LAST);
    }

    public int parallelism() {
        int parallelism = options.get(PARALLELISM);
        checkArgument(
                parallelism > 0,
                "Option %s must be positive, but is %s",
                PARALLELISM.key(),
                parallelism);
        return parallelism;
    }
}
