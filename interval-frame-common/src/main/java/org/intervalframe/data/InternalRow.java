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

package org.intervalframe.data;

import javax.annotation.Nullable;

/**
 * Base interface for a row of a {@link RangeSet}. Fields are addressed by position; the {@link
 * org.intervalframe.types.RowType} of the owning set describes their logical types.
 */
public interface InternalRow {

    /** Returns the number of fields in this row. */
    int getFieldCount();

    /** Returns true if the element is null at the given position. */
    boolean isNullAt(int pos);

    /** Returns the value at the given position, or {@code null}. */
    @Nullable
    Object getField(int pos);
}
