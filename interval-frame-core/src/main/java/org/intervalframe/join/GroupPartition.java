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

import static org.intervalframe.utils.Preconditions.checkArgument;

/** A group key present on both sides, with the sorted rows of each side. */
public final class GroupPartition {

    private final GroupKey key;
    private final SortedGroup primary;
    private final SortedGroup secondary;

    public GroupPartition(GroupKey key, SortedGroup primary, SortedGroup secondary) {
        checkArgument(
                primary.side() == JoinSide.PRIMARY && secondary.side() == JoinSide.SECONDARY,
                "Expected a primary and a secondary group, but got %s and %s",
                primary,
                secondary);
        this.key = key;
        this.primary = primary;
        this.secondary = secondary;
    }

    public GroupKey key() {
        return key;
    }

    public SortedGroup primary() {
        return primary;
    }

    public SortedGroup secondary() {
        return secondary;
    }

    public SortedGroup side(JoinSide side) {
        return side == JoinSide.PRIMARY ? primary : secondary;
    }

    @Override
    public String toString() {
        return "GroupPartition{key="
                + key
                + ", primary="
                + primary.size()
                + ", secondary="
                + secondary.size()
                + '}';
    }
}
