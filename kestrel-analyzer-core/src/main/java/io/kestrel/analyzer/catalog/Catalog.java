/*
 * Catalog.java
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

package io.kestrel.analyzer.catalog;

import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only view of the schema that names are resolved against. Lookups are synchronous and never modify the
 * catalog.
 */
@API(API.Status.UNSTABLE)
public interface Catalog {
    /**
     * Find a table or view by name.
     * @param name the name as written in the statement
     * @return the table, or empty if there is none of that name
     */
    @Nonnull
    Optional<TableDescriptor> lookupTable(@Nonnull String name);

    @Nonnull
    Optional<TableDescriptor> lookupTable(int tableId);

    /**
     * Find a column of a table by name, including virtual columns.
     * @param tableId id of the table
     * @param name the name as written in the statement
     * @return the column, or empty if the table has no column of that name
     */
    @Nonnull
    Optional<ColumnDescriptor> lookupColumn(int tableId, @Nonnull String name);

    /**
     * Get every column of a table, virtual ones included, in the table's column order.
     * @param tableId id of the table
     * @return the columns, or an empty list for an unknown table
     */
    @Nonnull
    List<ColumnDescriptor> getAllColumns(int tableId);

    /**
     * Map an identifier to the form under which it is looked up, so that two identifiers name the same object
     * exactly when their normalized forms are equal. By default identifiers are case-insensitive.
     * @param identifier an identifier as written
     * @return the normalized identifier
     */
    @Nonnull
    default String normalizeIdentifier(@Nonnull String identifier) {
        return identifier.toLowerCase(Locale.ROOT);
    }
}
