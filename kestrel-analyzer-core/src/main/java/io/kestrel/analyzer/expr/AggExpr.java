/*
 * AggExpr.java
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
import io.kestrel.analyzer.GroupingException;
import io.kestrel.analyzer.TypeException;
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeInfo;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A call of a built-in aggregate function. The argument is absent only for {@code COUNT(*)}.
 */
@API(API.Status.UNSTABLE)
public final class AggExpr extends Expr {
    @Nonnull
    private final AggKind kind;
    @Nullable
    private final Expr arg;
    private final boolean distinct;

    public AggExpr(@Nonnull TypeInfo typeInfo, @Nonnull AggKind kind, @Nullable Expr arg, boolean distinct) {
        super(typeInfo, true);
        Preconditions.checkArgument(arg != null || kind == AggKind.COUNT, "only COUNT may omit its argument");
        this.kind = kind;
        this.arg = arg;
        this.distinct = distinct;
    }

    /**
     * Build a typed aggregate call.
     * <ul>
     *     <li>{@code COUNT} and {@code APPROX_COUNT_DISTINCT} return {@code BIGINT}.</li>
     *     <li>{@code AVG} returns {@code DOUBLE}.</li>
     *     <li>{@code SUM} returns {@code BIGINT} over integers, otherwise the argument's type.</li>
     *     <li>{@code MIN}, {@code MAX} and {@code SAMPLE} return the argument's type.</li>
     * </ul>
     * The result may be null whenever the argument may be; {@code COUNT(*)} is never null.
     * @param kind the aggregate function
     * @param arg the argument, or {@code null} for {@code COUNT(*)}
     * @param distinct whether duplicate argument values are ignored
     * @return a new node
     * @throws TypeException if the argument type is not valid for the function
     * @throws GroupingException if the argument itself contains an aggregate
     */
    @Nonnull
    public static AggExpr create(@Nonnull AggKind kind, @Nullable Expr arg, boolean distinct) {
        if (arg == null) {
            if (kind != AggKind.COUNT) {
                throw new TypeException("aggregate needs an argument", LogMessageKeys.OPERATOR, kind);
            }
            return new AggExpr(TypeInfo.of(SqlTypeName.BIGINT, true), kind, null, distinct);
        }
        if (arg.containsAggregate()) {
            throw new GroupingException("aggregate function calls cannot be nested", LogMessageKeys.EXPR, arg);
        }
        final TypeInfo argType = arg.getTypeInfo();
        final boolean notNull = argType.isNotNull();
        final TypeInfo resultType;
        switch (kind) {
            case COUNT:
            case APPROX_COUNT_DISTINCT:
                resultType = TypeInfo.of(SqlTypeName.BIGINT, notNull);
                break;
            case AVG:
                checkNumeric(kind, argType);
                resultType = TypeInfo.of(SqlTypeName.DOUBLE, notNull);
                break;
            case SUM:
                checkNumeric(kind, argType);
                resultType = argType.isInteger() ? TypeInfo.of(SqlTypeName.BIGINT, notNull) : argType.withoutEncoding();
                break;
            case MIN:
            case MAX:
                if (argType.isArray()) {
                    throw new TypeException("cannot order array values", LogMessageKeys.OPERATOR, kind, LogMessageKeys.TYPE, argType);
                }
                resultType = argType;
                break;
            case SAMPLE:
            default:
                resultType = argType;
                break;
        }
        return new AggExpr(resultType, kind, arg, distinct);
    }

    private static void checkNumeric(@Nonnull AggKind kind, @Nonnull TypeInfo argType) {
        if (!argType.isNumber()) {
            throw new TypeException("aggregate needs a numeric argument", LogMessageKeys.OPERATOR, kind, LogMessageKeys.TYPE, argType);
        }
    }

    @Nonnull
    public AggKind getKind() {
        return kind;
    }

    @Nullable
    public Expr getArg() {
        return arg;
    }

    public boolean isDistinct() {
        return distinct;
    }

    @Override
    public void collectColumnVars(@Nonnull Set<ColumnVar> columnVars, boolean includeAggregates) {
        if (includeAggregates && arg != null) {
            arg.collectColumnVars(columnVars, true);
        }
    }

    @Override
    public void checkGroupBy(@Nonnull List<Expr> groupBy) {
        // evaluated once per group by definition
    }

    @Nonnull
    @Override
    public List<Expr> getChildren() {
        return arg == null ? ImmutableList.of() : ImmutableList.of(arg);
    }

    @Nonnull
    @Override
    protected Expr withChildren(@Nonnull List<Expr> newChildren) {
        Preconditions.checkArgument(newChildren.size() == (arg == null ? 0 : 1));
        return new AggExpr(getTypeInfo(), kind, arg == null ? null : newChildren.get(0), distinct);
    }

    @Override
    protected boolean equalsWithoutChildren(@Nonnull Expr other) {
        final AggExpr otherAgg = (AggExpr)other;
        return kind == otherAgg.kind && distinct == otherAgg.distinct;
    }

    @Override
    protected int hashCodeWithoutChildren() {
        return Objects.hash(kind, distinct);
    }

    @Override
    public <T> T accept(@Nonnull ExprVisitor<T> visitor) {
        return visitor.visitAggregate(this);
    }
}
