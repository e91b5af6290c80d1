/*
 * LoggableKeysAndValues.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2024 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.kestrel.util;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Associates structured logging details with an object.
 * Kestrel log lines are made of a fixed title plus a set of keys and values describing the particular occurrence,
 * for example a "column not found" message with {@code column_name="c"} and {@code table_name="t"}. Keeping the
 * details out of the title keeps the logs searchable.
 *
 * @param <T> type of object the details are attached to
 */
interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    /**
     * Get the details attached so far.
     *
     * @return an unmodifiable view of the details
     */
    @Nonnull
    Map<String, Object> getLogInfo();

    /**
     * Attach a single key and value.
     *
     * @param description the key
     * @param object the value
     * @return this object
     */
    @Nonnull
    T addLogInfo(@Nonnull String description, Object object);

    /**
     * Attach keys and values given as a flat array {@code [k0, v0, k1, v1, ...]}, the same format returned by
     * {@link #exportLogInfo()}.
     *
     * @param keyValue flattened key/value pairs
     * @return this object
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    T addLogInfo(@Nonnull Object ... keyValue);

    /**
     * Flatten the attached details into {@code [k0, v0, k1, v1, ...]}.
     *
     * @return the flattened key/value pairs
     */
    @Nonnull
    Object[] exportLogInfo();
}
