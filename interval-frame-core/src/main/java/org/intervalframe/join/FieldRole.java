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

/** Roles of the boundary columns resolved by a {@link JoinSchema}. */
public enum FieldRole {
    PRIMARY_START(JoinSide.PRIMARY),
    PRIMARY_END(JoinSide.PRIMARY),
    SECONDARY_START(JoinSide.SECONDARY),
    SECONDARY_END(JoinSide.SECONDARY);

    private final JoinSide side;

    FieldRole(JoinSide side) {
        this.side = side;
    }

    public JoinSide side() {
        return side;
    }

    public static FieldRole startOf(JoinSide side) {
        return side == JoinSide.PRIMARY ? PRIMARY_START : SECONDARY_START;
    }

    public static FieldRole endOf(JoinSide side) {
        return side == JoinSide.PRIMARY ? PRIMARY_END : SECONDARY_END;
    }
}
