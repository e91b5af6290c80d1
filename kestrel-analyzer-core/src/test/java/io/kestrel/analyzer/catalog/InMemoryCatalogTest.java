/*
 * InMemoryCatalogTest.java
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

import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeInfo;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link InMemoryCatalog}.
 */
public class InMemoryCatalogTest {
    private static final TypeInfo INT = TypeInfo.of(SqlTypeName.INT, true);
    private static final TypeInfo TEXT = TypeInfo.of(SqlTypeName.TEXT);

    @Test
    public void caseInsensitiveByDefault() {
        final InMemoryCatalog catalog = InMemoryCatalog.newBuilder()
                .table(1, "Emp").column("Id", INT).column("name", TEXT).add()
                .build();
        final TableDescriptor emp = catalog.lookupTable("EMP").orElseThrow(AssertionError::new);
        assertThat(emp.getTableId(), equalTo(1));
        assertThat(emp.getName(), equalTo("Emp"));
        assertThat(catalog.lookupTable(1).isPresent(), is(true));
        final ColumnDescriptor id = catalog.lookupColumn(1, "ID").orElseThrow(AssertionError::new);
        assertThat(id.getColumnId(), equalTo(1));
        assertThat(id.getTypeInfo(), equalTo(INT));
        assertThat(catalog.normalizeIdentifier("MiXeD"), equalTo("mixed"));
    }

    @Test
    public void caseSensitiveNames() {
        final InMemoryCatalog catalog = InMemoryCatalog.newBuilder()
                .setCaseSensitive(true)
                .table(1, "Emp").column("Id", INT).column("id", INT).add()
                .table(2, "emp").column("x", INT).add()
                .build();
        assertThat(catalog.lookupTable("Emp").map(TableDescriptor::getTableId).orElse(-1), equalTo(1));
        assertThat(catalog.lookupTable("emp").map(TableDescriptor::getTableId).orElse(-1), equalTo(2));
        assertThat(catalog.lookupTable("EMP").isPresent(), is(false));
        assertThat(catalog.lookupColumn(1, "id").map(ColumnDescriptor::getColumnId).orElse(-1), equalTo(2));
        assertThat(catalog.normalizeIdentifier("MiXeD"), equalTo("MiXeD"));
    }

    @Test
    public void columnsKeepTheirOrder() {
        final InMemoryCatalog catalog = InMemoryCatalog.newBuilder()
                .table(7, "t").column("c", INT).virtualColumn("rowid", INT).column("a", TEXT).add()
                .build();
        assertThat(catalog.getAllColumns(7).stream().map(ColumnDescriptor::getName).collect(Collectors.toList()),
                contains("c", "rowid", "a"));
        assertThat(catalog.getAllColumns(7).get(1).isVirtual(), is(true));
        assertThat(catalog.getAllColumns(7).get(2).getColumnId(), equalTo(3));
        assertThat(catalog.getAllColumns(8), empty());
        assertThat(catalog.lookupColumn(8, "c").isPresent(), is(false));
    }

    @Test
    public void views() {
        final InMemoryCatalog catalog = InMemoryCatalog.newBuilder()
                .view(3, "v").column("c", INT).add()
                .build();
        assertThat(catalog.lookupTable("v").map(TableDescriptor::isView).orElse(false), is(true));
    }

    @Test
    public void duplicatesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> InMemoryCatalog.newBuilder()
                .table(1, "t").add()
                .table(2, "T").add());
        assertThrows(IllegalArgumentException.class, () -> InMemoryCatalog.newBuilder()
                .table(1, "t").add()
                .table(1, "u").add());
        assertThrows(IllegalArgumentException.class, () -> InMemoryCatalog.newBuilder()
                .table(1, "t").column("a", INT).column("A", INT));
        assertThrows(IllegalArgumentException.class, () -> InMemoryCatalog.newBuilder()
                .table(0, "t").add());
    }

    @Test
    public void caseSensitivityComesFirst() {
        final InMemoryCatalog.Builder builder = InMemoryCatalog.newBuilder().table(1, "t").add();
        assertThrows(IllegalStateException.class, () -> builder.setCaseSensitive(true));
    }
}
