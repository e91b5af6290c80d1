/*
 * TableDescriptor.java
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
import java.util.Objects;

/**
 * A table or view known to the {@link Catalog}.
 */
@API(API.Status.UNSTABLE)
public final class TableDescriptor {
    private final int tableId;
    @Nonnull
    private final String name;
    private final boolean view;

    public TableDescriptor(int tableId, @Nonnull String name, boolean view) {
        this.tableId = tableId;
        this.name = name;
        this.view = view;
    }

    public int getTableId() {
        return tableId;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    public boolean isView() {
        return view;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TableDescriptor that = (TableDescriptor)o;
        return tableId == that.tableId && view == that.view && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableId, name, view);
    }

    @Override
    public String toString() {
        return name + "#" + tableId;
    }
}
