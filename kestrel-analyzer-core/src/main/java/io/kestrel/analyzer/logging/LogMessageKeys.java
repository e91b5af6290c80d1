/*
 * LogMessageKeys.java
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

package io.kestrel.analyzer.logging;

import io.kestrel.annotation.API;

import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by the analyzer.
 * All keys live here so that collisions are easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // errors
    CODE,
    SQLSTATE,
    // name resolution
    TABLE_NAME,
    TABLE_ID,
    COLUMN_NAME,
    COLUMN_ID,
    ALIAS,
    RTE_INDEX,
    RANGE_TABLE_SIZE,
    // expressions and types
    EXPR,
    OPERATOR,
    TYPE,
    LEFT_TYPE,
    RIGHT_TYPE,
    TARGET_TYPE,
    VALUE,
    // target and order lists
    TARGET_LIST_SIZE,
    ORDER_POSITION,
    // statement level
    STATEMENT_TYPE,
    QUERY;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return logKey;
    }
}
