/*
 * QueryTest.java
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
import io.kestrel.analyzer.AnalyzerException;
import io.kestrel.analyzer.ErrorCode;
import io.kestrel.analyzer.GroupingException;
import io.kestrel.analyzer.ResolutionException;
import io.kestrel.analyzer.catalog.TableDescriptor;
import io.kestrel.analyzer.expr.AggExpr;
import io.kestrel.analyzer.expr.AggKind;
import io.kestrel.analyzer.expr.BinOper;
import io.kestrel.analyzer.expr.ColumnVar;
import io.kestrel.analyzer.expr.Constant;
import io.kestrel.analyzer.expr.SqlOperator;
import io.kestrel.analyzer.expr.Subquery;
import io.kestrel.analyzer.expr.Var;
import io.kestrel.analyzer.expr.WhichRow;
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link Query}.
 */
public class QueryTest {
    private static final TypeInfo INT = TypeInfo.of(SqlTypeName.INT, true);
    private static final TableDescriptor EMP = new TableDescriptor(1, "emp", false);
    private static final TableDescriptor DEPT = new TableDescriptor(2, "dept", false);

    private Query query;

    @BeforeEach
    public void setUp() {
        query = new Query();
    }

    private static ColumnVar column(int tableId, int columnId, int rangeTableIndex) {
        return new ColumnVar(INT, tableId, columnId, rangeTableIndex);
    }

    @Test
    public void newestAliasWins() {
        assertThat(query.addRangeTableEntry(new RangeTblEntry("x", EMP)), equalTo(0));
        assertThat(query.addRangeTableEntry(new RangeTblEntry("d", DEPT)), equalTo(1));
        assertThat(query.addRangeTableEntry(new RangeTblEntry("x", DEPT)), equalTo(2));
        assertThat(query.resolveRangeIndex("x"), equalTo(2));
        assertThat(query.resolveRangeIndex("d"), equalTo(1));
        assertThat(query.findRangeIndex("nope"), equalTo(-1));
        final ResolutionException e = assertThrows(ResolutionException.class, () -> query.resolveRangeIndex("nope"));
        assertThat(e.getErrorCode(), equalTo(ErrorCode.UNDEFINED_TABLE));
        assertThrows(IndexOutOfBoundsException.class, () -> query.getRangeTableEntry(3));
    }

    @Test
    public void orderByMustNameATarget() {
        query.addTargetEntry(new TargetEntry("a", column(1, 1, 0)));
        query.setOrderBy(ImmutableList.of(new OrderEntry(1, true, false)));
        assertThat(query.getOrderBy(), contains(new OrderEntry(1, true, false)));
        final ResolutionException e = assertThrows(ResolutionException.class,
                () -> query.setOrderBy(ImmutableList.of(new OrderEntry(1, false, false), new OrderEntry(2, false, false))));
        assertThat(e.getErrorCode(), equalTo(ErrorCode.INVALID_COLUMN_REFERENCE));
        query.setOrderBy(null);
        assertThat(query.getOrderBy(), nullValue());
        assertThrows(IllegalArgumentException.class, () -> new OrderEntry(0, false, false));
    }

    @Test
    public void rangeTableReferences() {
        query.addRangeTableEntry(new RangeTblEntry("e", EMP));
        query.addTargetEntry(new TargetEntry("a", column(1, 1, 0)));
        query.addTargetEntry(new TargetEntry("v", new Var(INT, WhichRow.OUTPUT, 1)));
        query.setWhere(BinOper.create(SqlOperator.EQ, column(1, 2, 0), Constant.ofInt(1)));
        assertDoesNotThrow(() -> query.checkRangeTableReferences());

        query.setHaving(BinOper.create(SqlOperator.EQ, column(2, 1, 1), Constant.ofInt(1)));
        final AnalyzerException e = assertThrows(AnalyzerException.class, () -> query.checkRangeTableReferences());
        assertThat(e.getErrorCode(), equalTo(ErrorCode.INTERNAL_ERROR));
    }

    @Test
    public void columnWithoutRangeTableIndexIsInvalid() {
        query.addRangeTableEntry(new RangeTblEntry("e", EMP));
        query.setGroupBy(ImmutableList.of(column(1, 1, -1)));
        assertThrows(AnalyzerException.class, () -> query.checkRangeTableReferences());
    }

    @Test
    public void subqueriesAreNotDescendedInto() {
        final Query inner = new Query();
        inner.addTargetEntry(new TargetEntry("x", column(2, 1, 5)));
        query.addRangeTableEntry(new RangeTblEntry("e", EMP));
        query.setWhere(BinOper.create(SqlOperator.EQ, column(1, 1, 0), Subquery.of(inner)));
        assertDoesNotThrow(() -> query.checkRangeTableReferences());
    }

    @Test
    public void groupByIsCheckedOnlyWhenAggregating() {
        query.addTargetEntry(new TargetEntry("a", column(1, 1, 0)));
        query.addTargetEntry(new TargetEntry("b", column(1, 2, 0)));
        assertThat(query.isAggregating(), is(false));
        assertDoesNotThrow(() -> query.checkGroupBy());

        query.setGroupBy(ImmutableList.of(column(1, 1, 0)));
        assertThat(query.isAggregating(), is(true));
        assertThrows(GroupingException.class, () -> query.checkGroupBy());
    }

    @Test
    public void havingIsChecked() {
        query.addTargetEntry(new TargetEntry("n", AggExpr.create(AggKind.COUNT, null, false)));
        query.setNumAggregates(1);
        assertDoesNotThrow(() -> query.checkGroupBy());
        query.setHaving(BinOper.create(SqlOperator.GT, column(1, 1, 0), Constant.ofInt(3)));
        assertThrows(GroupingException.class, () -> query.checkGroupBy());
        query.setGroupBy(ImmutableList.of(column(1, 1, 0)));
        assertDoesNotThrow(() -> query.checkGroupBy());
    }

    @Test
    public void invalidValues() {
        assertThrows(IllegalArgumentException.class, () -> query.setLimit(-1));
        assertThrows(IllegalArgumentException.class, () -> query.setOffset(-1));
        assertThrows(IllegalArgumentException.class, () -> query.setNumAggregates(-1));
        assertThrows(IllegalArgumentException.class, () -> query.setNextQuery(query));
        assertThrows(UnsupportedOperationException.class,
                () -> query.getTargetList().add(new TargetEntry("a", Constant.ofInt(1))));
    }

    @Test
    public void unnestNeedsAnArray() {
        assertThrows(IllegalArgumentException.class, () -> new TargetEntry("a", column(1, 1, 0), true));
        final ColumnVar tags = new ColumnVar(TypeInfo.array(SqlTypeName.TEXT, false), 1, 3, 0);
        assertThat(new TargetEntry("t", tags, true).toString(), equalTo("UNNEST $0.1.3 AS t"));
    }

    @Test
    public void rendering() {
        query.addRangeTableEntry(new RangeTblEntry("e", EMP));
        query.setDistinct(true);
        query.addTargetEntry(new TargetEntry("a", column(1, 1, 0)));
        query.setWhere(BinOper.create(SqlOperator.GT, column(1, 2, 0), Constant.ofInt(5)));
        query.setOrderBy(ImmutableList.of(new OrderEntry(1, true, true)));
        query.setLimit(10);
        final Query next = new Query();
        next.addTargetEntry(new TargetEntry("b", Constant.ofInt(1)));
        query.setNextQuery(next);
        query.setUnionAll(true);
        assertThat(query.toString(), equalTo("SELECT DISTINCT $0.1.1 AS a FROM emp AS e WHERE ($0.1.2 > 5)"
                + " ORDER BY 1 DESC NULLS FIRST LIMIT 10 UNION ALL SELECT 1 AS b"));
    }

    @Test
    public void insertRendering() {
        query.setStatementType(StatementType.INSERT);
        query.setResultTableId(1);
        query.setResultColumns(ImmutableList.of(1, 2));
        query.addTargetEntry(new TargetEntry("id", Constant.ofInt(7)));
        query.addTargetEntry(new TargetEntry("dept", Constant.ofInt(8)));
        assertThat(query.toString(), equalTo("INSERT INTO #1[1, 2] SELECT 7 AS id, 8 AS dept"));
        assertThat(StatementType.INSERT.hasResultTable(), is(true));
        assertThat(StatementType.SELECT.hasResultTable(), is(false));
    }
}
