/*
 * GroupPredicatesTest.java
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

import io.kestrel.analyzer.UnsupportedExprOperationException;
import io.kestrel.analyzer.query.Query;
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeInfo;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

import static io.kestrel.analyzer.expr.TestColumns.column;
import static io.kestrel.analyzer.expr.TestColumns.intColumn;
import static io.kestrel.analyzer.expr.TestColumns.target;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link Expr#groupPredicates(List, List, List)}.
 */
public class GroupPredicatesTest {
    private final List<Expr> scan = new ArrayList<>();
    private final List<Expr> join = new ArrayList<>();
    private final List<Expr> constant = new ArrayList<>();

    private void group(@Nonnull Expr predicate) {
        predicate.groupPredicates(scan, join, constant);
    }

    @Test
    public void twoTableConjunction() {
        final ColumnVar t1a = intColumn(1, 1, 0);
        final ColumnVar t2b = intColumn(2, 2, 1);
        final ColumnVar t2c = column(TypeInfo.of(SqlTypeName.VARCHAR, false), 2, 3, 1);
        final Expr joinCondition = BinOper.create(SqlOperator.EQ, t1a, t2b);
        final Expr t1Filter = BinOper.create(SqlOperator.EQ, t1a, Constant.ofInt(5));
        final Expr t2Filter = UOper.create(SqlOperator.NOT, UOper.create(SqlOperator.IS_NULL, t2c));

        group(BinOper.create(SqlOperator.AND, BinOper.create(SqlOperator.AND, joinCondition, t1Filter), t2Filter));

        assertThat(join, contains(joinCondition));
        assertThat(scan, contains(t1Filter, t2Filter));
        assertThat(constant, empty());
    }

    @Test
    public void onlyAndIsSplit() {
        final Expr left = BinOper.create(SqlOperator.EQ, intColumn(1, 1, 0), Constant.ofInt(1));
        final Expr right = BinOper.create(SqlOperator.EQ, intColumn(1, 2, 0), Constant.ofInt(2));
        final Expr disjunction = BinOper.create(SqlOperator.OR, left, right);
        group(disjunction);
        assertThat(scan, contains(disjunction));
        assertThat(join, empty());
    }

    @Test
    public void disjunctionAcrossTablesIsAJoinPredicate() {
        final Expr disjunction = BinOper.create(SqlOperator.OR,
                BinOper.create(SqlOperator.EQ, intColumn(1, 1, 0), Constant.ofInt(1)),
                BinOper.create(SqlOperator.EQ, intColumn(2, 1, 1), Constant.ofInt(2)));
        group(disjunction);
        assertThat(join, contains(disjunction));
    }

    @Test
    public void columnFreeConjunctsAreConstant() {
        final Expr alwaysTrue = BinOper.create(SqlOperator.EQ, Constant.ofInt(1), Constant.ofInt(1));
        final Expr filter = BinOper.create(SqlOperator.GT, intColumn(1, 1, 2), Constant.ofInt(0));
        group(BinOper.create(SqlOperator.AND, alwaysTrue, filter));
        assertThat(constant, contains(alwaysTrue));
        assertThat(scan, contains(filter));
    }

    @Test
    public void varsCountAsOneRangeTableEntry() {
        final Var outer = new Var(TestColumns.INT_NOT_NULL, 1, 1, 0, WhichRow.INPUT_OUTER, 1);
        final Var inner = new Var(TestColumns.INT_NOT_NULL, 2, 1, 1, WhichRow.INPUT_INNER, 1);
        final Expr varComparison = BinOper.create(SqlOperator.EQ, outer, inner);
        final Expr mixed = BinOper.create(SqlOperator.EQ, outer, intColumn(3, 1, 2));
        group(BinOper.create(SqlOperator.AND, varComparison, mixed));
        assertThat(scan, contains(varComparison));
        assertThat(join, contains(mixed));
    }

    @Test
    public void conjunctsKeepTheirOrderAcrossLists() {
        final List<Expr> filters = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            filters.add(BinOper.create(SqlOperator.LT, intColumn(1, i, 0), Constant.ofInt(i)));
        }
        Expr predicate = filters.get(0);
        for (int i = 1; i < filters.size(); i++) {
            predicate = BinOper.create(SqlOperator.AND, predicate, filters.get(i));
        }
        group(predicate);
        assertThat(scan, contains(filters.toArray()));
    }

    @Test
    public void subqueryIsRejected() {
        final Query query = new Query();
        query.addTargetEntry(target("x", intColumn(5, 1, 0)));
        final Expr predicate = BinOper.create(SqlOperator.AND,
                BinOper.create(SqlOperator.EQ, intColumn(1, 1, 0), Constant.ofInt(1)),
                BinOper.create(SqlOperator.EQ, intColumn(1, 2, 0), Subquery.of(query)));
        assertThrows(UnsupportedExprOperationException.class, () -> group(predicate));
    }
}
