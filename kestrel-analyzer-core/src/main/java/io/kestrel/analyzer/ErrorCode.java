/*
 * ErrorCode.java
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

package io.kestrel.analyzer;

import io.kestrel.annotation.API;

import javax.annotation.Nonnull;

/**
 * Error codes reported by the analyzer, each carrying the SQLSTATE a SQL front end would report for it.
 */
@API(API.Status.UNSTABLE)
public enum ErrorCode {
    // type errors
    DATATYPE_MISMATCH("42804", Category.TYPE),
    CANNOT_COERCE("42846", Category.TYPE),
    INVALID_TEXT_REPRESENTATION("22P02", Category.TYPE),
    NUMERIC_VALUE_OUT_OF_RANGE("22003", Category.TYPE),
    STRING_DATA_RIGHT_TRUNCATION("22001", Category.TYPE),
    INVALID_DATETIME_FORMAT("22007", Category.TYPE),
    SUBQUERY_COLUMN_COUNT("42601", Category.TYPE),
    // name resolution
    UNDEFINED_TABLE("42P01", Category.RESOLUTION),
    UNDEFINED_COLUMN("42703", Category.RESOLUTION),
    AMBIGUOUS_COLUMN("42702", Category.RESOLUTION),
    DUPLICATE_ALIAS("42712", Category.RESOLUTION),
    INVALID_COLUMN_REFERENCE("42P10", Category.RESOLUTION),
    // grouping
    GROUPING_ERROR("42803", Category.GROUPING),
    // programming errors
    UNSUPPORTED_OPERATION("0A000", Category.INTERNAL),
    INTERNAL_ERROR("XX000", Category.INTERNAL);

    /**
     * The broad kind of failure an {@link ErrorCode} belongs to.
     */
    public enum Category {
        /** No common type, or a cast between incompatible values. */
        TYPE,
        /** A table, alias, or column could not be found or is out of scope. */
        RESOLUTION,
        /** A non-aggregated expression is neither a grouping key nor built from one. */
        GROUPING,
        /** A pass was invoked on a tree it does not support. */
        INTERNAL
    }

    @Nonnull
    private final String sqlState;
    @Nonnull
    private final Category category;

    ErrorCode(@Nonnull String sqlState, @Nonnull Category category) {
        this.sqlState = sqlState;
        this.category = category;
    }

    @Nonnull
    public String getSqlState() {
        return sqlState;
    }

    @Nonnull
    public Category getCategory() {
        return category;
    }
}
