/*
 * CaseExprTest.java
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
import io.kestrel.analyzer.TypeException;
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeInfo;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import static io.kestrel.analyzer.expr.TestColumns.NULLABLE_INT;
import static io.kestrel.analyzer.expr.TestColumns.column;
import static io.kestrel.analyzer.expr.TestColumns.intColumn;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link CaseExpr}.
 */
public class CaseExprTest {
    private static final ColumnVar X = column(NULLABLE_INT, 1, 1, 0);

    @Nonnull
    private static CaseExpr sign(@Nullable Expr elseExpr) {
        return CaseExpr.create(ImmutableList.of(
                new CaseExpr.WhenClause(BinOper.create(SqlOperator.GT, X, Constant.ofInt(0)), Constant.ofInt(1)),
                new CaseExpr.WhenClause(BinOper.create(SqlOperator.LT, X, Constant.ofInt(0)), Constant.ofInt(-1))),
                elseExpr);
    }

    @Test
    public void resultsShareOneType() {
        final CaseExpr caseExpr = sign(Constant.ofInt(0));
        assertThat(caseExpr.getTypeInfo(), equalTo(TypeInfo.of(SqlTypeName.INT, true)));
        for (CaseExpr.WhenClause whenClause : caseExpr.getWhenClauses()) {
            assertThat(whenClause.getResult().getTypeInfo(), equalTo(caseExpr.getTypeInfo()));
        }
        assertThat(caseExpr.getElseExpr(), equalTo(Constant.ofInt(0)));
    }

    @Test
    public void missingElseMakesTheResultNullable() {
        final CaseExpr caseExpr = sign(null);
        assertThat(caseExpr.getTypeInfo(), equalTo(NULLABLE_INT));
        assertThat(caseExpr.getWhenClauses().get(0).getResult(), equalTo(Constant.ofInt(1)));
    }

    @Test
    public void resultsArePromoted() {
        final CaseExpr caseExpr = sign(Constant.ofDouble(0.5));
        final TypeInfo doubleType = TypeInfo.of(SqlTypeName.DOUBLE, true);
        assertThat(caseExpr.getTypeInfo(), equalTo(doubleType));
        final Expr first = caseExpr.getWhenClauses().get(0).getResult();
        assertThat(first, instanceOf(Constant.class));
        assertThat(first.getTypeInfo(), equalTo(doubleType));
    }

    @Test
    public void conditionsMustBeBoolean() {
        assertThrows(TypeException.class, () -> CaseExpr.create(
                ImmutableList.of(new CaseExpr.WhenClause(Constant.ofInt(1), Constant.ofInt(1))), null));
    }

    @Test
    public void resultsNeedACommonType() {
        assertThrows(TypeException.class, () -> sign(Constant.ofString("zero")));
    }

    @Test
    public void atLeastOneArm() {
        assertThrows(IllegalArgumentException.class, () -> CaseExpr.create(ImmutableList.of(), Constant.ofInt(0)));
    }

    @Test
    public void constantResultsFormTheDomain() {
        assertThat(sign(Constant.ofInt(0)).getDomain(), contains(Constant.ofInt(1), Constant.ofInt(-1), Constant.ofInt(0)));
        assertThat(sign(Constant.ofInt(1)).getDomain(), contains(Constant.ofInt(1), Constant.ofInt(-1)));
    }

    @Test
    public void columnResultHasNoDomain() {
        assertThat(sign(intColumn(1, 2, 0)).getDomain(), empty());
    }

    @Test
    public void castIsPushedIntoTheResults() {
        final TypeInfo bigint = TypeInfo.of(SqlTypeName.BIGINT, true);
        final Expr cast = sign(Constant.ofInt(0)).addCast(bigint);
        assertThat(cast, instanceOf(CaseExpr.class));
        assertThat(cast.getTypeInfo(), equalTo(bigint));
        assertThat(((CaseExpr)cast).getElseExpr(), equalTo(Constant.ofLong(0L)));
        assertThat(((CaseExpr)cast).getWhenClauses().get(1).getResult(), equalTo(Constant.ofLong(-1L)));
    }

    @Test
    public void aggregateInAnArmIsTracked() {
        final CaseExpr caseExpr = CaseExpr.create(ImmutableList.of(
                new CaseExpr.WhenClause(Constant.ofBoolean(true), AggExpr.create(AggKind.COUNT, null, false))),
                Constant.ofLong(0L));
        assertThat(caseExpr.containsAggregate(), is(true));
        assertThat(sign(null).containsAggregate(), is(false));
    }
}
