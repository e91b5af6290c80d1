/*
 * CharLengthExpr.java
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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.kestrel.analyzer.TypeException;
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeInfo;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * {@code CHAR_LENGTH(arg)} of a string, or its encoded length in bytes when {@link #isCalcEncodedLength()}.
 */
@API(API.Status.UNSTABLE)
public final class CharLengthExpr extends Expr {
    @Nonnull
    private final Expr arg;
    private final boolean calcEncodedLength;

    public CharLengthExpr(@Nonnull TypeInfo typeInfo, boolean containsAggregate, @Nonnull Expr arg, boolean calcEncodedLength) {
        super(typeInfo, containsAggregate);
        this.arg = arg;
        this.calcEncodedLength = calcEncodedLength;
    }

    @Nonnull
    public static CharLengthExpr create(@Nonnull Expr arg, boolean calcEncodedLength) {
        if (!arg.getTypeInfo().isString()) {
            throw new TypeException("CHAR_LENGTH needs a string argument", LogMessageKeys.TYPE, arg.getTypeInfo());
        }
        return new CharLengthExpr(TypeInfo.of(SqlTypeName.INT, arg.getTypeInfo().isNotNull()), arg.containsAggregate(),
                arg, calcEncodedLength);
    }

    @Nonnull
    public Expr getArg() {
        return arg;
    }

    public boolean isCalcEncodedLength() {
        return calcEncodedLength;
    }

    @Nonnull
    @Override
    public List<Expr> getChildren() {
        return ImmutableList.of(arg);
    }

    @Nonnull
    @Override
    protected Expr withChildren(@Nonnull List<Expr> newChildren) {
        Preconditions.checkArgument(newChildren.size() == 1);
        return new CharLengthExpr(getTypeInfo(), containsAggregate(), newChildren.get(0), calcEncodedLength);
    }

    @Override
    protected boolean equalsWithoutChildren(@Nonnull Expr other) {
        return calcEncodedLength == ((CharLengthExpr)other).calcEncodedLength;
    }

    @Override
    protected int hashCodeWithoutChildren() {
        return Boolean.hashCode(calcEncodedLength);
    }

    @Override
    public <T> T accept(@Nonnull ExprVisitor<T> visitor) {
        return visitor.visitCharLength(this);
    }
}
