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

package org.intervalframe;

import org.intervalframe.join.JoinType;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link CoreOptions}. */
public class CoreOptionsTest {

    @Test
    public void testDefaults() {
        CoreOptions options = new CoreOptions(new HashMap<>());

        assertThat(options.suffix()).isEqualTo("_right");
        assertThat(options.joinType()).isEqualTo(JoinType.INNER);
        assertThat(options.closed()).isFalse();
        assertThat(options.deduplicate()).isFalse();
        assertThat(options.strict()).isFalse();
        assertThat(options.nullsLast()).isFalse();
        assertThat(options.parallelism()).isEqualTo(1);
    }

    @Test
    public void testDynamicOptions() {
        Map<String, String> map = new HashMap<>();
        map.put(CoreOptions.HOW.key(), "OUTER");
        map.put(CoreOptions.CLOSED.key(), "true");
        map.put(CoreOptions.SUFFIX.key(), "_2");
        map.put(CoreOptions.PARALLELISM.key(), "4");

        CoreOptions options = new CoreOptions(map);

        assertThat(options.joinType()).isEqualTo(JoinType.OUTER);
        assertThat(options.closed()).isTrue();
        assertThat(options.suffix()).isEqualTo("_2");
        assertThat(options.parallelism()).isEqualTo(4);
        assertThat(options.toMap()).isEqualTo(map);
    }

    @Test
    public void testInvalidParallelism() {
        Map<String, String> map = new HashMap<>();
        map.put(CoreOptions.PARALLELISM.key(), "0");

        assertThatThrownBy(() -> new CoreOptions(map).parallelism())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("join.parallelism");
    }

    @Test
    public void testInvalidJoinType() {
        Map<String, String> map = new HashMap<>();
        map.put(CoreOptions.HOW.key(), "cross");

        assertThatThrownBy(() -> new CoreOptions(map).joinType())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cross");
    }
}
