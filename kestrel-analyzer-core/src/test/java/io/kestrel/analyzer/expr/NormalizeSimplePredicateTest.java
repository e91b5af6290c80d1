/*
 * NormalizeSimplePredicateTest.java
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

import io.kestrel.analyzer.query.Query;
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import javax.annotation.Nonnull;
import java.util.Optional;
import java.util.stream.Stream;

import static io.kestrel.analyzer.expr.TestColumns.column;
import static io.kestrel.analyzer.expr.TestColumns.intColumn;
import static io.kestrel.analyzer.expr.TestColumns.target;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

/**
 * Tests for {@link Expr#normalizeSimplePredicate()}.
 */
public class NormalizeSimplePredicateTest {

    static Stream<Arguments> flipped() {
        return Stream.of(
                Arguments.of(SqlOperator.EQ, SqlOperator.EQ),
                Arguments.of(SqlOperator.NE, SqlOperator.NE),
                Arguments.of(SqlOperator.LT, SqlOperator.GT),
                Arguments.of(SqlOperator.GT, SqlOperator.LT),
                Arguments.of(SqlOperator.LE, SqlOperator.GE),
                Arguments.of(SqlOperator.GE, SqlOperator.LE)
        );
    }

    @ParameterizedTest
    @MethodSource("flipped")
    public void constantOnTheLeftIsMovedRight(@Nonnull SqlOperator written, @Nonnull SqlOperator normalized) {
        final ColumnVar column = intColumn(1, 4, 2);
        final Optional<SimplePredicate> simple = BinOper.create(written, Constant.ofInt(5), column).normalizeSimplePredicate();
        assertThat(simple.isPresent(), is(true));
        assertThat(simple.get().getPredicate().getOperator(), equalTo(normalized));
        assertThat(simple.get().getColumn(), equalTo(column));
        assertThat(simple.get().getValue(), equalTo(Constant.ofInt(5)));
        assertThat(simple.get().getRangeTableIndex(), equalTo(2));
    }

    @Test
    public void canonicalShapeIsCopied() {
        final BinOper predicate = BinOper.create(SqlOperator.GE, intColumn(1, 1, 0), Constant.ofInt(3));
        final SimplePredicate simple = predicate.normalizeSimplePredicate().orElseThrow(AssertionError::new);
        assertThat(simple.getPredicate(), equalTo(predicate));
        assertThat(simple.getPredicate(), not(sameInstance(predicate)));
        assertThat(simple.getRangeTableIndex(), equalTo(0));
    }

    @Test
    public void valueIsCastToTheColumnType() {
        final ColumnVar bigint = column(TypeInfo.of(SqlTypeName.BIGINT, true), 1, 1, 0);
        final SimplePredicate simple = BinOper.create(SqlOperator.LT, Constant.ofInt(10), bigint)
                .normalizeSimplePredicate().orElseThrow(AssertionError::new);
        assertThat(simple.getValue(), equalTo(Constant.ofLong(10L)));
        assertThat(simple.getPredicate().getOperator(), equalTo(SqlOperator.GT));
    }

    @Test
    public void columnFreeExpressionsCount() {
        final Expr value = BinOper.create(SqlOperator.PLUS, Constant.ofInt(1), Constant.ofInt(2));
        final Optional<SimplePredicate> simple = BinOper.create(SqlOperator.EQ, value, intColumn(1, 1, 0)).normalizeSimplePredicate();
        assertThat(simple.isPresent(), is(true));
        assertThat(simple.get().getValue(), equalTo(value));
    }

    @Test
    public void otherShapesAreNotSimple() {
        final ColumnVar a = intColumn(1, 1, 0);
        final ColumnVar b = intColumn(1, 2, 0);
        assertThat(BinOper.create(SqlOperator.EQ, a, b).normalizeSimplePredicate().isPresent(), is(false));
        assertThat(BinOper.create(SqlOperator.EQ, BinOper.create(SqlOperator.PLUS, a, Constant.ofInt(1)), Constant.ofInt(5))
                .normalizeSimplePredicate().isPresent(), is(false));
        assertThat(BinOper.create(SqlOperator.PLUS, a, Constant.ofInt(1)).normalizeSimplePredicate().isPresent(), is(false));
        assertThat(BinOper.create(SqlOperator.AND,
                        BinOper.create(SqlOperator.EQ, a, Constant.ofInt(1)),
                        BinOper.create(SqlOperator.EQ, b, Constant.ofInt(2)))
                .normalizeSimplePredicate().isPresent(), is(false));
        assertThat(Constant.ofBoolean(true).normalizeSimplePredicate().isPresent(), is(false));
        assertThat(UOper.create(SqlOperator.IS_NULL, a).normalizeSimplePredicate().isPresent(), is(false));
    }

    @Test
    public void varsAreNotBaseColumns() {
        final Var var = new Var(TestColumns.INT_NOT_NULL, 1, 1, 0, WhichRow.INPUT_OUTER, 1);
        assertThat(BinOper.create(SqlOperator.EQ, var, Constant.ofInt(1)).normalizeSimplePredicate().isPresent(), is(false));
    }

    @Test
    public void quantifiedComparisonsAreNotSimple() {
        final Query query = new Query();
        query.addTargetEntry(target("x", intColumn(2, 1, 0)));
        final BinOper any = BinOper.create(SqlOperator.EQ, Qualifier.ANY, intColumn(1, 1, 0), Subquery.of(query), true);
        assertThat(any.normalizeSimplePredicate().isPresent(), is(false));
        final BinOper subquery = BinOper.create(SqlOperator.EQ, intColumn(1, 1, 0), Subquery.of(query));
        assertThat(subquery.normalizeSimplePredicate().isPresent(), is(false));
    }
}
