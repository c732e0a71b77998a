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

import org.intervalframe.data.GenericRow;
import org.intervalframe.data.InternalRow;

/** Builds result rows from primary and secondary rows, following a {@link JoinSchema}. */
public class RowAssembler {

    private final JoinSchema schema;
    private final int primaryArity;
    private final int arity;

    public RowAssembler(JoinSchema schema) {
        this.schema = schema;
        this.primaryArity = schema.typeOf(JoinSide.PRIMARY).getFieldCount();
        this.arity = primaryArity + schema.secondaryOutputNames().size();
    }

    public InternalRow join(InternalRow primary, InternalRow secondary) {
        Object[] values = new Object[arity];
        copyPrimary(primary, values);
        copySecondary(secondary, values);
        return GenericRow.of(values);
    }

    /** A primary row without overlap: secondary columns are null. */
    public InternalRow padSecondary(InternalRow primary) {
        Object[] values = new Object[arity];
        copyPrimary(primary, values);
        return GenericRow.of(values);
    }

    /**
     * A secondary row without overlap: primary columns are null, except the group columns, which
     * take the values of the secondary row.
     */
    public InternalRow padPrimary(InternalRow secondary) {
        Object[] values = new Object[arity];
        int[] primaryKeys = schema.primaryKeyIndices();
        int[] secondaryKeys = schema.secondaryKeyIndices();
        for (int i = 0; i < primaryKeys.length; i++) {
            values[primaryKeys[i]] = secondary.getField(secondaryKeys[i]);
        }
        copySecondary(secondary, values);
        return GenericRow.of(values);
    }

    public InternalRow pad(JoinSide side, InternalRow row) {
        return side == JoinSide.PRIMARY ? padSecondary(row) : padPrimary(row);
    }

    private void copyPrimary(InternalRow primary, Object[] target) {
        for (int i = 0; i < primaryArity; i++) {
            target[i] = primary.getField(i);
        }
    }

    private void copySecondary(InternalRow secondary, Object[] target) {
        int[] payload = schema.secondaryPayloadIndices();
        for (int i = 0; i < payload.length; i++) {
            target[primaryArity + i] = secondary.getField(payload[i]);
        }
    }
}
