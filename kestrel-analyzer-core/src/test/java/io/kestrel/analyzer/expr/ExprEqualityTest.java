/*
 * ExprEqualityTest.java
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
import io.kestrel.analyzer.query.Query;
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeInfo;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.kestrel.analyzer.expr.TestColumns.intColumn;
import static io.kestrel.analyzer.expr.TestColumns.target;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

/**
 * Tests for {@link Expr#structuralEquals(Expr)}, {@link Expr#deepCopy()} and the list helpers built on them.
 */
public class ExprEqualityTest {

    @Test
    public void deepCopyIsEqualButShared() {
        final BinOper predicate = BinOper.create(SqlOperator.AND,
                BinOper.create(SqlOperator.EQ, intColumn(1, 1, 0), Constant.ofInt(5)),
                BinOper.create(SqlOperator.LT, intColumn(1, 2, 0), intColumn(2, 1, 1)));
        final Expr copy = predicate.deepCopy();
        assertThat(copy, not(sameInstance(predicate)));
        assertThat(copy.structuralEquals(predicate), is(true));
        assertThat(copy, equalTo(predicate));
        assertThat(copy.hashCode(), equalTo(predicate.hashCode()));
        for (int i = 0; i < 2; i++) {
            assertThat(copy.getChildren().get(i), not(sameInstance(predicate.getChildren().get(i))));
            assertThat(copy.getChildren().get(i), equalTo(predicate.getChildren().get(i)));
        }
    }

    @Test
    public void columnVarNeverEqualsVar() {
        final ColumnVar column = intColumn(1, 2, 0);
        final Var var = new Var(column.getTypeInfo(), 1, 2, 0, WhichRow.INPUT_OUTER, 1);
        assertThat(column.structuralEquals(var), is(false));
        assertThat(var.structuralEquals(column), is(false));
        assertThat(column.refersToSameColumn(var), is(true));
    }

    @Test
    public void typesAreComparedExactly() {
        assertThat(Constant.ofInt(1).structuralEquals(Constant.ofLong(1L)), is(false));
        assertThat(intColumn(1, 1, 0).structuralEquals(
                new ColumnVar(TypeInfo.of(SqlTypeName.INT, false), 1, 1, 0)), is(false));
        assertThat(intColumn(1, 1, 0).structuralEquals(intColumn(1, 1, 1)), is(false));
        assertThat(BinOper.create(SqlOperator.LT, intColumn(1, 1, 0), Constant.ofInt(1)).structuralEquals(
                BinOper.create(SqlOperator.LE, intColumn(1, 1, 0), Constant.ofInt(1))), is(false));
    }

    @Test
    public void varEqualityIncludesRowAndSlot() {
        final Var outer = new Var(TestColumns.INT_NOT_NULL, WhichRow.INPUT_OUTER, 1);
        assertThat(outer, equalTo(new Var(TestColumns.INT_NOT_NULL, WhichRow.INPUT_OUTER, 1)));
        assertThat(outer, not(equalTo(new Var(TestColumns.INT_NOT_NULL, WhichRow.INPUT_INNER, 1))));
        assertThat(outer, not(equalTo(new Var(TestColumns.INT_NOT_NULL, WhichRow.INPUT_OUTER, 2))));
        assertThat(outer.isSynthetic(), is(true));
        assertThat(outer.getSlotIndex(), equalTo(0));
    }

    @Test
    public void subqueryEqualityIsIdentityOfItsQuery() {
        final Query query = new Query();
        query.addTargetEntry(target("x", intColumn(1, 1, 0)));
        final Query sameShape = new Query();
        sameShape.addTargetEntry(target("x", intColumn(1, 1, 0)));

        final Subquery subquery = Subquery.of(query);
        assertThat(subquery.getTypeInfo(), equalTo(TestColumns.INT_NOT_NULL));
        assertThat(subquery, equalTo(Subquery.of(query)));
        assertThat(subquery, not(equalTo(Subquery.of(sameShape))));
        final Expr copy = subquery.deepCopy();
        assertThat(copy, not(sameInstance(subquery)));
        assertThat(((Subquery)copy).getQuery(), sameInstance(query));
    }

    @Test
    public void addUniqueSkipsStructuralDuplicates() {
        final List<Expr> exprs = new ArrayList<>();
        intColumn(1, 1, 0).addUnique(exprs);
        Constant.ofInt(3).addUnique(exprs);
        intColumn(1, 1, 0).addUnique(exprs);
        Constant.ofInt(3).addUnique(exprs);
        Constant.ofLong(3L).addUnique(exprs);
        assertThat(exprs, contains(intColumn(1, 1, 0), Constant.ofInt(3), Constant.ofLong(3L)));
    }

    @Test
    public void findExprStopsAtMatches() {
        final Expr sum = BinOper.create(SqlOperator.PLUS, intColumn(1, 1, 0), intColumn(1, 2, 0));
        final Expr predicate = BinOper.create(SqlOperator.AND,
                BinOper.create(SqlOperator.GT, sum, Constant.ofInt(0)),
                BinOper.create(SqlOperator.LT, sum.deepCopy(), Constant.ofInt(10)));
        final List<Expr> sums = predicate.findExpr(e -> e instanceof BinOper && ((BinOper)e).getOperator() == SqlOperator.PLUS);
        assertThat(sums, contains(sum));
        assertThat(predicate.findExpr(e -> e instanceof ColumnVar), hasSize(2));
        assertThat(predicate.findExpr(e -> e instanceof AggExpr), hasSize(0));
    }

    @Test
    public void columnVarsAreCollectedOncePerColumn() {
        final Expr predicate = BinOper.create(SqlOperator.AND,
                BinOper.create(SqlOperator.EQ, intColumn(2, 1, 1), intColumn(1, 3, 0)),
                BinOper.create(SqlOperator.GT, intColumn(1, 3, 0),
                        AggExpr.create(AggKind.MAX, intColumn(1, 1, 0), false)));
        assertThat(ImmutableList.copyOf(predicate.getColumnVars(false)), contains(intColumn(1, 3, 0), intColumn(2, 1, 1)));
        assertThat(ImmutableList.copyOf(predicate.getColumnVars(true)),
                contains(intColumn(1, 1, 0), intColumn(1, 3, 0), intColumn(2, 1, 1)));
    }

    @Test
    public void explain() {
        final Expr predicate = BinOper.create(SqlOperator.AND,
                BinOper.create(SqlOperator.EQ, intColumn(1, 2, 0), Constant.ofInt(5)),
                UOper.create(SqlOperator.IS_NULL, new Var(TestColumns.NULLABLE_INT, WhichRow.OUTPUT, 1)));
        assertThat(predicate.toString(), equalTo("(($0.1.2 = 5) AND (OUTPUT#1 IS NULL))"));
        assertThat(Constant.ofString("it's").toString(), equalTo("'it''s'"));
        assertThat(AggExpr.create(AggKind.COUNT, null, false).toString(), equalTo("COUNT(*)"));
    }
}
