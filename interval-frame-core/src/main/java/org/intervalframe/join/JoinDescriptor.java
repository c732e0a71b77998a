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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.intervalframe.utils.Preconditions.checkNotNull;

/**
 * Serializable description of an interval join: the boundary columns of both sides, the group
 * columns and the options. Together with two operands it fully determines the result.
 */
public class JoinDescriptor {

    private static final String FIELD_PRIMARY_START = "primaryStart";
    private static final String FIELD_PRIMARY_END = "primaryEnd";
    private static final String FIELD_SECONDARY_START = "secondaryStart";
    private static final String FIELD_SECONDARY_END = "secondaryEnd";
    private static final String FIELD_BY = "by";
    private static final String FIELD_OPTIONS = "options";

    @JsonProperty(FIELD_PRIMARY_START)
    private final String primaryStart;

    @JsonProperty(FIELD_PRIMARY_END)
    private final String primaryEnd;

    @JsonProperty(FIELD_SECONDARY_START)
    private final String secondaryStart;

    @JsonProperty(FIELD_SECONDARY_END)
    private final String secondaryEnd;

    @JsonProperty(FIELD_BY)
    private final List<String> by;

    @JsonProperty(FIELD_OPTIONS)
    private final Map<String, String> options;

    @JsonCreator
    public JoinDescriptor(
            @JsonProperty(FIELD_PRIMARY_START) String primaryStart,
            @JsonProperty(FIELD_PRIMARY_END) String primaryEnd,
            @JsonProperty(FIELD_SECONDARY_START) @Nullable String secondaryStart,
            @JsonProperty(FIELD_SECONDARY_END) @Nullable String secondaryEnd,
            @JsonProperty(FIELD_BY) @Nullable List<String> by,
            @JsonProperty(FIELD_OPTIONS) @Nullable Map<String, String> options) {
        this.primaryStart = checkNotNull(primaryStart, "Primary start column must be set");
        this.primaryEnd = checkNotNull(primaryEnd, "Primary end column must be set");
        this.secondaryStart = secondaryStart == null ? primaryStart : secondaryStart;
        this.secondaryEnd = secondaryEnd == null ? primaryEnd : secondaryEnd;
        this.by = by == null ? Collections.emptyList() : ImmutableList.copyOf(by);
        this.options = options == null ? Collections.emptyMap() : ImmutableMap.copyOf(options);
    }

    public String primaryStart() {
        return primaryStart;
    }

    public String primaryEnd() {
        return primaryEnd;
    }

    public String secondaryStart() {
        return secondaryStart;
    }

    public String secondaryEnd() {
        return secondaryEnd;
    }

    public List<String> by() {
        return by;
    }

    public Map<String, String> options() {
        return options;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        JoinDescriptor that = (JoinDescriptor) o;
        return primaryStart.equals(that.primaryStart)
                && primaryEnd.equals(that.primaryEnd)
                && secondaryStart.equals(that.secondaryStart)
                && secondaryEnd.equals(that.secondaryEnd)
                && by.equals(that.by)
                && options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(primaryStart, primaryEnd, secondaryStart, secondaryEnd, by, options);
    }

    @Override
    public String toString() {
        return "JoinDescriptor{"
                + "on=("
                + primaryStart
                + ", "
                + primaryEnd
                + ")~("
                + secondaryStart
                + ", "
                + secondaryEnd
                + "), by="
                + by
                + ", options="
                + options
                + '}';
    }
}
