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

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link RowType}. */
public class RowTypeTest {

    @Test
    public void testFieldLookup() {
        RowType rowType =
                DataTypes.ROW(
                        new String[] {"k", "a", "b"},
                        new DataType[] {DataTypes.STRING(), DataTypes.INT(), DataTypes.INT()});

        assertThat(rowType.getFieldNames()).containsExactly("k", "a", "b");
        assertThat(rowType.getFieldIndex("b")).isEqualTo(2);
        assertThat(rowType.getFieldIndex("c")).isEqualTo(-1);
        assertThat(rowType.getField("a").type().getTypeRoot()).isEqualTo(DataTypeRoot.INTEGER);
        assertThat(rowType.toString()).isEqualTo("ROW<k STRING, a INTEGER, b INTEGER>");
    }

    @Test
    public void testDuplicateNames() {
        assertThatThrownBy(
                        () ->
                                new RowType(
                                        Arrays.asList(
                                                new DataField(0, "a", DataTypes.INT()),
                                                new DataField(1, "a", DataTypes.BIGINT()))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicates: a");
    }

    @Test
    public void testNullability() {
        DataType type = DataTypes.DATE().notNull();

        assertThat(type.isNullable()).isFalse();
        assertThat(type.accepts(null)).isFalse();
        assertThat(type.nullable().accepts(null)).isTrue();
        assertThat(type.asSQLString()).isEqualTo("DATE NOT NULL");
        assertThat(DataTypeRoot.STRING.isRangeBoundary()).isFalse();
        assertThat(DataTypeRoot.TIMESTAMP.isRangeBoundary()).isTrue();
    }
}
