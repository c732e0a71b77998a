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

import java.util.Arrays;

/**
 * Values of the grouping columns of a row. Ranges are only matched against ranges with an equal
 * key. Without grouping columns every row has the {@link #EMPTY} key.
 */
public final class GroupKey {

    public static final GroupKey EMPTY = new GroupKey(new Object[0]);

    private final Object[] values;

    private GroupKey(Object[] values) {
        this.values = values;
    }

    public static GroupKey of(Object... values) {
        return values.length == 0 ? EMPTY : new GroupKey(values.clone());
    }

    public int arity() {
        return values.length;
    }

    public Object get(int pos) {
        return values[pos];
    }

    public boolean hasNull() {
        for (Object value : values) {
            if (value == null) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(values, ((GroupKey) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
