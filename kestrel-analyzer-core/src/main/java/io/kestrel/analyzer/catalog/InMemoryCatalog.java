/*
 * InMemoryCatalog.java
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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.kestrel.analyzer.types.TypeInfo;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable {@link Catalog} held in memory, assembled with a {@link Builder}.
 *
 * <pre>{@code
 * InMemoryCatalog catalog = InMemoryCatalog.newBuilder()
 *         .table(1, "emp")
 *             .column("id", TypeInfo.of(SqlTypeName.INT, true))
 *             .column("name", TypeInfo.string(SqlTypeName.VARCHAR, 40, false))
 *             .virtualColumn("rowid", TypeInfo.of(SqlTypeName.BIGINT, true))
 *             .add()
 *         .build();
 * }</pre>
 */
@API(API.Status.UNSTABLE)
public final class InMemoryCatalog implements Catalog {
    private final boolean caseSensitive;
    @Nonnull
    private final Map<String, TableDescriptor> tablesByName;
    @Nonnull
    private final Map<Integer, TableDescriptor> tablesById;
    @Nonnull
    private final Map<Integer, List<ColumnDescriptor>> columnsByTable;

    private InMemoryCatalog(@Nonnull Builder builder) {
        this.caseSensitive = builder.caseSensitive;
        this.tablesByName = ImmutableMap.copyOf(builder.tablesByName);
        this.tablesById = ImmutableMap.copyOf(builder.tablesById);
        final ImmutableMap.Builder<Integer, List<ColumnDescriptor>> columns = ImmutableMap.builder();
        for (Map.Entry<Integer, List<ColumnDescriptor>> entry : builder.columnsByTable.entrySet()) {
            columns.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
        }
        this.columnsByTable = columns.build();
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    @Override
    public Optional<TableDescriptor> lookupTable(@Nonnull String name) {
        return Optional.ofNullable(tablesByName.get(normalizeIdentifier(name)));
    }

    @Nonnull
    @Override
    public Optional<TableDescriptor> lookupTable(int tableId) {
        return Optional.ofNullable(tablesById.get(tableId));
    }

    @Nonnull
    @Override
    public Optional<ColumnDescriptor> lookupColumn(int tableId, @Nonnull String name) {
        final String normalized = normalizeIdentifier(name);
        for (ColumnDescriptor column : getAllColumns(tableId)) {
            if (normalizeIdentifier(column.getName()).equals(normalized)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    @Nonnull
    @Override
    public List<ColumnDescriptor> getAllColumns(int tableId) {
        final List<ColumnDescriptor> columns = columnsByTable.get(tableId);
        return columns == null ? ImmutableList.of() : columns;
    }

    @Nonnull
    @Override
    public String normalizeIdentifier(@Nonnull String identifier) {
        return caseSensitive ? identifier : identifier.toLowerCase(Locale.ROOT);
    }

    /**
     * Builder for {@link InMemoryCatalog}. Column ids are assigned from {@code 1} in the order columns are added.
     */
    public static final class Builder {
        private boolean caseSensitive;
        private final Map<String, TableDescriptor> tablesByName = new HashMap<>();
        private final Map<Integer, TableDescriptor> tablesById = new LinkedHashMap<>();
        private final Map<Integer, List<ColumnDescriptor>> columnsByTable = new HashMap<>();

        private Builder() {
        }

        /**
         * Set whether identifiers are case-sensitive. Must be called before tables are added.
         * @param caseSensitive {@code true} to match names exactly
         * @return this builder
         */
        @Nonnull
        public Builder setCaseSensitive(boolean caseSensitive) {
            Preconditions.checkState(tablesById.isEmpty(), "case sensitivity must be set before adding tables");
            this.caseSensitive = caseSensitive;
            return this;
        }

        @Nonnull
        public TableBuilder table(int tableId, @Nonnull String name) {
            return new TableBuilder(this, tableId, name, false);
        }

        @Nonnull
        public TableBuilder view(int tableId, @Nonnull String name) {
            return new TableBuilder(this, tableId, name, true);
        }

        private void addTable(@Nonnull TableDescriptor table, @Nonnull List<ColumnDescriptor> columns) {
            final String key = caseSensitive ? table.getName() : table.getName().toLowerCase(Locale.ROOT);
            Preconditions.checkArgument(!tablesByName.containsKey(key), "duplicate table name %s", table.getName());
            Preconditions.checkArgument(!tablesById.containsKey(table.getTableId()), "duplicate table id %s", table.getTableId());
            Preconditions.checkArgument(table.getTableId() > 0, "table ids must be positive");
            tablesByName.put(key, table);
            tablesById.put(table.getTableId(), table);
            columnsByTable.put(table.getTableId(), columns);
        }

        @Nonnull
        public InMemoryCatalog build() {
            return new InMemoryCatalog(this);
        }
    }

    /**
     * Collects the columns of one table.
     */
    public static final class TableBuilder {
        @Nonnull
        private final Builder parent;
        @Nonnull
        private final TableDescriptor table;
        private final List<ColumnDescriptor> columns = new ArrayList<>();

        private TableBuilder(@Nonnull Builder parent, int tableId, @Nonnull String name, boolean view) {
            this.parent = parent;
            this.table = new TableDescriptor(tableId, name, view);
        }

        @Nonnull
        public TableBuilder column(@Nonnull String name, @Nonnull TypeInfo typeInfo) {
            return addColumn(name, typeInfo, false);
        }

        @Nonnull
        public TableBuilder virtualColumn(@Nonnull String name, @Nonnull TypeInfo typeInfo) {
            return addColumn(name, typeInfo, true);
        }

        @Nonnull
        private TableBuilder addColumn(@Nonnull String name, @Nonnull TypeInfo typeInfo, boolean virtual) {
            for (ColumnDescriptor column : columns) {
                Preconditions.checkArgument(!column.getName().equalsIgnoreCase(name) || (parent.caseSensitive && !column.getName().equals(name)),
                        "duplicate column %s in table %s", name, table.getName());
            }
            columns.add(new ColumnDescriptor(table.getTableId(), columns.size() + 1, name, typeInfo, virtual));
            return this;
        }

        /**
         * Add the table to the catalog being built.
         * @return the catalog builder
         */
        @Nonnull
        public Builder add() {
            parent.addTable(table, columns);
            return parent;
        }
    }
}
