/*
 * RangeTblEntry.java
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

package io.kestrel.analyzer.query;

import com.google.common.collect.ImmutableList;
import io.kestrel.analyzer.ErrorCode;
import io.kestrel.analyzer.ResolutionException;
import io.kestrel.analyzer.catalog.Catalog;
import io.kestrel.analyzer.catalog.ColumnDescriptor;
import io.kestrel.analyzer.catalog.TableDescriptor;
import io.kestrel.analyzer.expr.ColumnVar;
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A table or view in the {@code FROM} clause of a {@link Query}, under the alias it is referenced by.
 *
 * <p>
 * Column descriptors resolved through this entry are cached, keyed by the catalog's normalized column name. The cache
 * only grows: a hit is never invalidated and a miss leaves it unchanged. Because of this cache an entry must only be
 * used by the thread analyzing its query.
 * </p>
 */
@API(API.Status.UNSTABLE)
@NotThreadSafe
public class RangeTblEntry {
    @Nonnull
    private final String alias;
    @Nonnull
    private final TableDescriptor table;
    @Nullable
    private final Query viewQuery;
    @Nonnull
    private final Map<String, ColumnDescriptor> columnCache = new LinkedHashMap<>();

    public RangeTblEntry(@Nonnull String alias, @Nonnull TableDescriptor table, @Nullable Query viewQuery) {
        this.alias = alias;
        this.table = table;
        this.viewQuery = viewQuery;
    }

    public RangeTblEntry(@Nonnull String alias, @Nonnull TableDescriptor table) {
        this(alias, table, null);
    }

    @Nonnull
    public String getAlias() {
        return alias;
    }

    @Nonnull
    public TableDescriptor getTable() {
        return table;
    }

    public int getTableId() {
        return table.getTableId();
    }

    @Nonnull
    public String getTableName() {
        return table.getName();
    }

    /**
     * Get the analyzed query of the view this entry reads, if it reads a view.
     * @return the view's query, or empty for a base table
     */
    @Nonnull
    public Optional<Query> getViewQuery() {
        return Optional.ofNullable(viewQuery);
    }

    /**
     * Find a column of this entry's table, consulting the cache before the catalog. A column found in the catalog
     * is added to the cache.
     * @param catalog the catalog the table belongs to
     * @param name the column name as written
     * @return the column, or empty if the table has no such column
     */
    @Nonnull
    public Optional<ColumnDescriptor> lookupColumn(@Nonnull Catalog catalog, @Nonnull String name) {
        final String key = catalog.normalizeIdentifier(name);
        final ColumnDescriptor cached = columnCache.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        final Optional<ColumnDescriptor> found = catalog.lookupColumn(table.getTableId(), name);
        found.ifPresent(column -> columnCache.put(key, column));
        return found;
    }

    /**
     * Like {@link #lookupColumn(Catalog, String)} but fails if there is no such column.
     * @param catalog the catalog the table belongs to
     * @param name the column name as written
     * @return the column
     * @throws ResolutionException if the table has no such column
     */
    @Nonnull
    public ColumnDescriptor resolveColumn(@Nonnull Catalog catalog, @Nonnull String name) {
        return lookupColumn(catalog, name).orElseThrow(() -> new ResolutionException("column does not exist",
                ErrorCode.UNDEFINED_COLUMN,
                LogMessageKeys.COLUMN_NAME, name,
                LogMessageKeys.TABLE_NAME, table.getName(),
                LogMessageKeys.ALIAS, alias));
    }

    /**
     * Get the columns resolved through this entry so far, in the order they were first resolved.
     * @return the cached columns
     */
    @Nonnull
    public List<ColumnDescriptor> getColumnDescriptors() {
        return ImmutableList.copyOf(columnCache.values());
    }

    /**
     * Append one target entry per non-virtual column of this entry's table, in catalog order, each reading the
     * column from this entry. This is how {@code *} and {@code alias.*} are expanded.
     * @param catalog the catalog the table belongs to
     * @param targetList the target list to append to
     * @param rangeTableIndex index of this entry in its query's range table
     */
    public void expandStar(@Nonnull Catalog catalog, @Nonnull List<TargetEntry> targetList, int rangeTableIndex) {
        for (ColumnDescriptor column : catalog.getAllColumns(table.getTableId())) {
            if (column.isVirtual()) {
                continue;
            }
            columnCache.putIfAbsent(catalog.normalizeIdentifier(column.getName()), column);
            targetList.add(new TargetEntry(column.getName(),
                    new ColumnVar(column.getTypeInfo(), column.getTableId(), column.getColumnId(), rangeTableIndex)));
        }
    }

    /**
     * Resolve every column of this entry's table, virtual ones included, into the cache.
     * @param catalog the catalog the table belongs to
     */
    public void addAllColumnDescriptors(@Nonnull Catalog catalog) {
        for (ColumnDescriptor column : catalog.getAllColumns(table.getTableId())) {
            columnCache.putIfAbsent(catalog.normalizeIdentifier(column.getName()), column);
        }
    }

    @Override
    public String toString() {
        return table.getName() + (alias.equals(table.getName()) ? "" : " AS " + alias);
    }
}
