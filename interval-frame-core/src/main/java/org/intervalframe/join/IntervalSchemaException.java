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

/**
 * Thrown when the operands of an interval join do not fit the requested columns: a column is
 * missing or has an unsuitable type, output names collide, or (in strict mode) a range has a null
 * boundary or starts after it ends.
 */
public class IntervalSchemaException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public IntervalSchemaException(String message) {
        super(message);
    }
}
