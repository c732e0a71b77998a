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
import org.intervalframe.types.DataTypes;
import org.intervalframe.types.RowType;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link JoinSchema}. */
public class JoinSchemaTest {

    private static final RowType PRIMARY =
            RowType.builder()
                    .field("k", DataTypes.STRING().notNull())
                    .field("a", DataTypes.BIGINT().notNull())
                    .field("b", DataTypes.BIGINT().notNull())
                    .build();

    private static final RowType SECONDARY =
            RowType.builder()
                    .field("k", DataTypes.STRING().notNull())
                    .field("a", DataTypes.BIGINT().notNull())
                    .field("b", DataTypes.BIGINT().notNull())
                    .field("genes", DataTypes.STRING().notNull())
                    .build();

    @Test
    public void testRenamesCollidingSecondaryColumns() {
        JoinSchema schema =
                JoinSchema.create(
                        PRIMARY, SECONDARY, "a", "b", "a", "b", Collections.emptyList(), "_2");

        assertThat(schema.secondaryOutputNames()).containsExactly("k_2", "a_2", "b_2", "genes");
        assertThat(schema.outputType(JoinType.INNER).getFieldNames())
                .containsExactly("k", "a", "b", "k_2", "a_2", "b_2", "genes");
        assertThat(schema.index(FieldRole.SECONDARY_END)).isEqualTo(2);
        assertThat(schema.keyOf(JoinSide.PRIMARY, GenericRow.of("chr1", 1L, 2L)))
                .isEqualTo(GroupKey.EMPTY);
    }

    @Test
    public void testGroupColumnsAreEmittedOnce() {
        JoinSchema schema =
                JoinSchema.create(
                        PRIMARY,
                        SECONDARY,
                        "a",
                        "b",
                        "a",
                        "b",
                        Collections.singletonList("k"),
                        "_right");

        assertThat(schema.outputType(JoinType.INNER).getFieldNames())
                .containsExactly("k", "a", "b", "a_right", "b_right", "genes");
        GroupKey key = schema.keyOf(JoinSide.SECONDARY, GenericRow.of("chr2", 1L, 2L, "x"));
        assertThat(key.arity()).isEqualTo(1);
        assertThat(key.get(0)).isEqualTo("chr2");
    }

    @Test
    public void testPaddedColumnsBecomeNullable() {
        JoinSchema schema =
                JoinSchema.create(
                        PRIMARY,
                        SECONDARY,
                        "a",
                        "b",
                        "a",
                        "b",
                        Collections.singletonList("k"),
                        "_right");

        RowType inner = schema.outputType(JoinType.INNER);
        assertThat(inner.getFields()).allMatch(field -> !field.type().isNullable());

        RowType left = schema.outputType(JoinType.LEFT);
        assertThat(left.getField("a").type().isNullable()).isFalse();
        assertThat(left.getField("a_right").type().isNullable()).isTrue();

        RowType right = schema.outputType(JoinType.RIGHT);
        assertThat(right.getField("k").type().isNullable()).isFalse();
        assertThat(right.getField("a").type().isNullable()).isTrue();
        assertThat(right.getField("genes").type().isNullable()).isFalse();

        RowType outer = schema.outputType(JoinType.OUTER);
        assertThat(outer.getField("k").type().isNullable()).isFalse();
        assertThat(outer.getField("b").type().isNullable()).isTrue();
        assertThat(outer.getField("b_right").type().isNullable()).isTrue();
    }

    @Test
    public void testGroupColumnFollowsNullableSecondaryKey() {
        RowType secondary =
                RowType.builder()
                        .field("k", DataTypes.STRING())
                        .field("a", DataTypes.BIGINT().notNull())
                        .field("b", DataTypes.BIGINT().notNull())
                        .build();

        JoinSchema schema =
                JoinSchema.create(
                        PRIMARY,
                        secondary,
                        "a",
                        "b",
                        "a",
                        "b",
                        Collections.singletonList("k"),
                        "_right");

        assertThat(schema.outputType(JoinType.INNER).getField("k").type().isNullable()).isFalse();
        assertThat(schema.outputType(JoinType.LEFT).getField("k").type().isNullable()).isFalse();
        assertThat(schema.outputType(JoinType.RIGHT).getField("k").type().isNullable()).isTrue();
        assertThat(schema.outputType(JoinType.OUTER).getField("k").type().isNullable()).isTrue();
    }

    @Test
    public void testSeparateBoundaryNames() {
        RowType secondary =
                RowType.builder()
                        .field("from", DataTypes.BIGINT())
                        .field("to", DataTypes.BIGINT())
                        .build();

        JoinSchema schema =
                JoinSchema.create(
                        PRIMARY, secondary, "a", "b", "from", "to", Collections.emptyList(), "_r");

        assertThat(schema.index(FieldRole.SECONDARY_START)).isEqualTo(0);
        assertThat(schema.secondaryOutputNames()).containsExactly("from", "to");
    }

    @Test
    public void testMissingColumn() {
        assertThatThrownBy(
                        () ->
                                JoinSchema.create(
                                        PRIMARY,
                                        SECONDARY,
                                        "start",
                                        "b",
                                        "a",
                                        "b",
                                        Collections.emptyList(),
                                        "_right"))
                .isInstanceOf(IntervalSchemaException.class)
                .hasMessageContaining("'start' does not exist on the primary side");
        assertThatThrownBy(
                        () ->
                                JoinSchema.create(
                                        PRIMARY,
                                        SECONDARY,
                                        "a",
                                        "b",
                                        "a",
                                        "b",
                                        Collections.singletonList("strand"),
                                        "_right"))
                .isInstanceOf(IntervalSchemaException.class)
                .hasMessageContaining("strand");
    }

    @Test
    public void testUnsuitableBoundaryTypes() {
        assertThatThrownBy(
                        () ->
                                JoinSchema.create(
                                        PRIMARY,
                                        SECONDARY,
                                        "k",
                                        "b",
                                        "a",
                                        "b",
                                        Collections.emptyList(),
                                        "_right"))
                .isInstanceOf(IntervalSchemaException.class)
                .hasMessageContaining("cannot bound a range");

        RowType dates =
                RowType.builder()
                        .field("a", DataTypes.DATE())
                        .field("b", DataTypes.DATE())
                        .build();
        assertThatThrownBy(
                        () ->
                                JoinSchema.create(
                                        PRIMARY,
                                        dates,
                                        "a",
                                        "b",
                                        "a",
                                        "b",
                                        Collections.emptyList(),
                                        "_right"))
                .isInstanceOf(IntervalSchemaException.class)
                .hasMessageContaining("share one type");
    }

    @Test
    public void testInvalidGroupColumns() {
        assertThatThrownBy(
                        () ->
                                JoinSchema.create(
                                        PRIMARY,
                                        SECONDARY,
                                        "a",
                                        "b",
                                        "a",
                                        "b",
                                        Arrays.asList("k", "k"),
                                        "_right"))
                .isInstanceOf(IntervalSchemaException.class)
                .hasMessageContaining("listed twice");
        assertThatThrownBy(
                        () ->
                                JoinSchema.create(
                                        PRIMARY,
                                        SECONDARY,
                                        "a",
                                        "b",
                                        "a",
                                        "b",
                                        Collections.singletonList("a"),
                                        "_right"))
                .isInstanceOf(IntervalSchemaException.class)
                .hasMessageContaining("both a boundary and a group column");
    }

    @Test
    public void testSuffixCollision() {
        RowType primary =
                RowType.builder()
                        .field("a", DataTypes.BIGINT())
                        .field("b", DataTypes.BIGINT())
                        .field("a_right", DataTypes.BIGINT())
                        .build();
        RowType secondary =
                RowType.builder()
                        .field("a", DataTypes.BIGINT())
                        .field("b", DataTypes.BIGINT())
                        .build();

        assertThatThrownBy(
                        () ->
                                JoinSchema.create(
                                        primary,
                                        secondary,
                                        "a",
                                        "b",
                                        "a",
                                        "b",
                                        Collections.emptyList(),
                                        "_right"))
                .isInstanceOf(IntervalSchemaException.class)
                .hasMessageContaining("'a_right'");
    }
}
