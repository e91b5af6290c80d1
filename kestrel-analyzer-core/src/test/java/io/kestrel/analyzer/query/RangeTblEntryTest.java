/*
 * RangeTblEntryTest.java
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

import io.kestrel.analyzer.ErrorCode;
import io.kestrel.analyzer.ResolutionException;
import io.kestrel.analyzer.catalog.ColumnDescriptor;
import io.kestrel.analyzer.catalog.InMemoryCatalog;
import io.kestrel.analyzer.catalog.TableDescriptor;
import io.kestrel.analyzer.expr.ColumnVar;
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link RangeTblEntry}.
 */
public class RangeTblEntryTest {
    private static final TypeInfo INT = TypeInfo.of(SqlTypeName.INT, true);
    private static final TypeInfo NAME = TypeInfo.string(SqlTypeName.VARCHAR, 40, false);

    private InMemoryCatalog catalog;
    private RangeTblEntry entry;

    @BeforeEach
    public void setUp() {
        catalog = InMemoryCatalog.newBuilder()
                .table(1, "emp")
                    .column("id", INT)
                    .virtualColumn("rowid", TypeInfo.of(SqlTypeName.BIGINT, true))
                    .column("name", NAME)
                    .add()
                .build();
        entry = new RangeTblEntry("e", catalog.lookupTable("emp").orElseThrow(AssertionError::new));
    }

    @Test
    public void lookupsFillTheCache() {
        assertThat(entry.getColumnDescriptors(), empty());
        final ColumnDescriptor name = entry.lookupColumn(catalog, "NAME").orElseThrow(AssertionError::new);
        assertThat(name.getColumnId(), equalTo(3));
        assertThat(entry.lookupColumn(catalog, "id").isPresent(), is(true));
        assertThat(entry.lookupColumn(catalog, "name").orElseThrow(AssertionError::new), equalTo(name));
        assertThat(names(entry.getColumnDescriptors()), contains("name", "id"));
    }

    @Test
    public void missesAreNotCached() {
        assertThat(entry.lookupColumn(catalog, "salary").isPresent(), is(false));
        assertThat(entry.getColumnDescriptors(), empty());
    }

    @Test
    public void resolveMissingColumn() {
        final ResolutionException e = assertThrows(ResolutionException.class, () -> entry.resolveColumn(catalog, "salary"));
        assertThat(e.getErrorCode(), equalTo(ErrorCode.UNDEFINED_COLUMN));
        assertThat(e.getLogInfo().get("column_name"), equalTo("salary"));
    }

    @Test
    public void starSkipsVirtualColumns() {
        final List<TargetEntry> targets = new ArrayList<>();
        entry.expandStar(catalog, targets, 2);
        assertThat(targets.stream().map(TargetEntry::getName).collect(Collectors.toList()), contains("id", "name"));
        assertThat(targets.get(1).getExpr(), equalTo(new ColumnVar(NAME, 1, 3, 2)));
        assertThat(names(entry.getColumnDescriptors()), contains("id", "name"));
    }

    @Test
    public void allColumnsIncludeVirtualOnes() {
        entry.lookupColumn(catalog, "name");
        entry.addAllColumnDescriptors(catalog);
        assertThat(names(entry.getColumnDescriptors()), contains("name", "id", "rowid"));
    }

    @Test
    public void viewQuery() {
        final Query viewQuery = new Query();
        final RangeTblEntry view = new RangeTblEntry("v", new TableDescriptor(9, "v", true), viewQuery);
        assertThat(view.getViewQuery().isPresent(), is(true));
        assertThat(entry.getViewQuery().isPresent(), is(false));
        assertThat(view.toString(), equalTo("v"));
        assertThat(entry.toString(), equalTo("emp AS e"));
        assertThat(entry.getTableId(), equalTo(1));
        assertThat(entry.getTableName(), equalTo("emp"));
    }

    private static List<String> names(List<ColumnDescriptor> columns) {
        return columns.stream().map(ColumnDescriptor::getName).collect(Collectors.toList());
    }
}
