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

package org.intervalframe.types;

import java.util.ArrayList;
import java.util.List;

/** Utils for creating {@link DataType}s and {@link RowType}s. */
public class DataTypes {

    public static DataType BOOLEAN() {
        return new DataType(DataTypeRoot.BOOLEAN, true);
    }

    public static DataType INT() {
        return new DataType(DataTypeRoot.INTEGER, true);
    }

    public static DataType BIGINT() {
        return new DataType(DataTypeRoot.BIGINT, true);
    }

    public static DataType DOUBLE() {
        return new DataType(DataTypeRoot.DOUBLE, true);
    }

    public static DataType STRING() {
        return new DataType(DataTypeRoot.STRING, true);
    }

    public static DataType DATE() {
        return new DataType(DataTypeRoot.DATE, true);
    }

    public static DataType TIMESTAMP() {
        return new DataType(DataTypeRoot.TIMESTAMP, true);
    }

    /** Creates a row type whose field ids follow the order of the given names. */
    public static RowType ROW(String[] names, DataType[] types) {
        if (names.length != types.length) {
            throw new IllegalArgumentException(
                    "Field names and types must have the same length, but got "
                            + names.length
                            + " and "
                            + types.length);
        }
        List<DataField> fields = new ArrayList<>(names.length);
        for (int i = 0; i < names.length; i++) {
            fields.add(new DataField(i, names[i], types[i]));
        }
        return new RowType(fields);
    }
}
