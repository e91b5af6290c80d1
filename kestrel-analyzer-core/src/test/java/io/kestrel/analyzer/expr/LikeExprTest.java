/*
 * LikeExprTest.java
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

import io.kestrel.analyzer.TypeException;
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static io.kestrel.analyzer.expr.TestColumns.column;
import static io.kestrel.analyzer.expr.TestColumns.intColumn;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link LikeExpr}.
 */
public class LikeExprTest {
    private static final ColumnVar NAME = column(TypeInfo.string(SqlTypeName.VARCHAR, 40, true), 1, 1, 0);
    private static final ColumnVar NULLABLE_NAME = column(TypeInfo.of(SqlTypeName.TEXT, false), 1, 2, 0);

    @ParameterizedTest
    @CsvSource({
            "'%abc%', true",
            "'%a%', true",
            "'% %', true",
            "'%%', false",
            "'abc%', false",
            "'%abc', false",
            "'abc', false",
            "'%a_c%', false",
            "'%a%c%', false",
            "'%[ab]%', false",
            "'%a]%', false"
    })
    public void simplePatterns(String pattern, boolean simple) {
        assertThat(LikeExpr.isSimplePattern(pattern), is(simple));
    }

    @Test
    public void simpleFlagFollowsTheLiteralPattern() {
        assertThat(LikeExpr.create(NAME, Constant.ofString("%foo%"), null, false).isSimple(), is(true));
        assertThat(LikeExpr.create(NAME, Constant.ofString("foo%"), null, false).isSimple(), is(false));
        assertThat(LikeExpr.create(NAME, Constant.ofString("%foo%"), Constant.ofString("\\"), false).isSimple(), is(false));
        assertThat(LikeExpr.create(NAME, NULLABLE_NAME, null, false).isSimple(), is(false));
    }

    @Test
    public void nullability() {
        final TypeInfo notNullBoolean = TypeInfo.of(SqlTypeName.BOOLEAN, true);
        final TypeInfo nullableBoolean = TypeInfo.of(SqlTypeName.BOOLEAN, false);
        assertThat(LikeExpr.create(NAME, Constant.ofString("a%"), null, true).getTypeInfo(), equalTo(notNullBoolean));
        assertThat(LikeExpr.create(NULLABLE_NAME, Constant.ofString("a%"), null, false).getTypeInfo(), equalTo(nullableBoolean));
        assertThat(LikeExpr.create(NAME, NULLABLE_NAME, null, false).getTypeInfo(), equalTo(nullableBoolean));
        assertThat(LikeExpr.create(NAME, Constant.ofString("a%"), Constant.nullOf(TypeInfo.of(SqlTypeName.TEXT)), false)
                .getTypeInfo(), equalTo(nullableBoolean));
    }

    @Test
    public void operandsMustBeStrings() {
        assertThrows(TypeException.class, () -> LikeExpr.create(intColumn(1, 3, 0), Constant.ofString("1%"), null, false));
        assertThrows(TypeException.class, () -> LikeExpr.create(NAME, Constant.ofInt(1), null, false));
        assertThrows(TypeException.class, () -> LikeExpr.create(NAME, Constant.ofString("a%"), Constant.ofInt(0), false));
    }

    @Test
    public void ilikeIsKept() {
        final LikeExpr like = LikeExpr.create(NAME, Constant.ofString("A%"), null, true);
        assertThat(like.isIlike(), is(true));
        assertThat(like.deepCopy(), equalTo(like));
    }
}
