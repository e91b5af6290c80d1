/*
 * ColumnDescriptor.java
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

import io.kestrel.analyzer.types.TypeInfo;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A column of a table known to the {@link Catalog}. A virtual column, such as a row id, can be referenced by name
 * but is not part of {@code SELECT *}.
 */
@API(API.Status.UNSTABLE)
public final class ColumnDescriptor {
    private final int tableId;
    private final int columnId;
    @Nonnull
    private final String name;
    @Nonnull
    private final TypeInfo typeInfo;
    private final boolean virtual;

    public ColumnDescriptor(int tableId, int columnId, @Nonnull String name, @Nonnull TypeInfo typeInfo, boolean virtual) {
        this.tableId = tableId;
        this.columnId = columnId;
        this.name = name;
        this.typeInfo = typeInfo;
        this.virtual = virtual;
    }

    public int getTableId() {
        return tableId;
    }

    public int getColumnId() {
        return columnId;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public TypeInfo getTypeInfo() {
        return typeInfo;
    }

    public boolean isVirtual() {
        return virtual;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ColumnDescriptor that = (ColumnDescriptor)o;
        return tableId == that.tableId && columnId == that.columnId && virtual == that.virtual
               && name.equals(that.name) && typeInfo.equals(that.typeInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableId, columnId, name, typeInfo, virtual);
    }

    @Override
    public String toString() {
        return name + "#" + tableId + "." + columnId + " " + typeInfo;
    }
}
