/*
 * CheckGroupByTest.java
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

package io.kestrel.analyzer.expr;

import com.google.common.collect.ImmutableList;
import io.kestrel.analyzer.GroupingException;
import io.kestrel.analyzer.query.Query;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.kestrel.analyzer.expr.TestColumns.INT_NOT_NULL;
import static io.kestrel.analyzer.expr.TestColumns.intColumn;
import static io.kestrel.analyzer.expr.TestColumns.target;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link Expr#checkGroupBy(List)}.
 */
public class CheckGroupByTest {
    private static final ColumnVar A = intColumn(1, 1, 0);
    private static final ColumnVar B = intColumn(1, 2, 0);
    private static final List<Expr> GROUP_BY_A = ImmutableList.of(A);

    @Test
    public void groupedColumn() {
        assertDoesNotThrow(() -> A.checkGroupBy(GROUP_BY_A));
        assertDoesNotThrow(() -> BinOper.create(SqlOperator.PLUS, A, Constant.ofInt(1)).checkGroupBy(GROUP_BY_A));
    }

    @Test
    public void ungroupedColumn() {
        assertThrows(GroupingException.class, () -> B.checkGroupBy(GROUP_BY_A));
        assertThrows(GroupingException.class, () -> BinOper.create(SqlOperator.PLUS, A, B).checkGroupBy(GROUP_BY_A));
    }

    @Test
    public void keyWithoutRangeTableIndexMatches() {
        assertDoesNotThrow(() -> A.checkGroupBy(ImmutableList.of(intColumn(1, 1, -1))));
        assertThrows(GroupingException.class, () -> A.checkGroupBy(ImmutableList.of(intColumn(1, 1, 2))));
    }

    @Test
    public void expressionEqualToAKey() {
        final Expr sum = BinOper.create(SqlOperator.PLUS, A, B);
        assertDoesNotThrow(() -> BinOper.create(SqlOperator.PLUS, A, B).checkGroupBy(ImmutableList.of(sum)));
        assertThrows(GroupingException.class, () -> B.checkGroupBy(ImmutableList.of(sum)));
    }

    @Test
    public void aggregatesNeedNoGrouping() {
        assertDoesNotThrow(() -> AggExpr.create(AggKind.SUM, B, false).checkGroupBy(GROUP_BY_A));
        assertDoesNotThrow(() -> BinOper.create(SqlOperator.GT, AggExpr.create(AggKind.MAX, B, false), A)
                .checkGroupBy(GROUP_BY_A));
    }

    @Test
    public void groupByVarsPass() {
        assertDoesNotThrow(() -> new Var(INT_NOT_NULL, WhichRow.GROUPBY, 1).checkGroupBy(ImmutableList.of()));
        final Var output = new Var(INT_NOT_NULL, 1, 1, 0, WhichRow.OUTPUT, 1);
        assertDoesNotThrow(() -> output.checkGroupBy(ImmutableList.of(output.deepCopy())));
        assertThrows(GroupingException.class, () -> output.checkGroupBy(GROUP_BY_A));
    }

    @Test
    public void varKeyDoesNotGroupAColumn() {
        final Var key = new Var(INT_NOT_NULL, 1, 1, 0, WhichRow.INPUT_OUTER, 1);
        assertThrows(GroupingException.class, () -> A.checkGroupBy(ImmutableList.of(key)));
    }

    @Test
    public void subqueriesAreNotChecked() {
        final Query query = new Query();
        query.addTargetEntry(target("x", B));
        assertDoesNotThrow(() -> Subquery.of(query).checkGroupBy(GROUP_BY_A));
    }
}
