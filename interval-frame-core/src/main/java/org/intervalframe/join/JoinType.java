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
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Which unmatched ranges an interval join keeps in addition to the overlapping pairs. */
public enum JoinType {
    INNER("inner"),
    LEFT("left"),
    RIGHT("right"),
    OUTER("outer");

    private final String value;

    JoinType(String value) {
        this.value = value;
    }

    @JsonCreator
    public static JoinType fromString(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "inner":
                return INNER;
            case "left":
                return LEFT;
            case "right":
                return RIGHT;
            case "outer":
            case "full":
                return OUTER;
            default:
                throw new IllegalArgumentException(
                        "Could not resolve join type '"
                                + name
                                + "', expected one of inner, left, right, outer");
        }
    }

    /** Whether primary ranges without overlap are part of the result. */
    public boolean keepsUnmatchedPrimary() {
        return this == LEFT || this == OUTER;
    }

    /** Whether secondary ranges without overlap are part of the result. */
    public boolean keepsUnmatchedSecondary() {
        return this == RIGHT || this == OUTER;
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
