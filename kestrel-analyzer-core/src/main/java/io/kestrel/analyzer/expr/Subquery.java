/*
 * Subquery.java
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
import io.kestrel.analyzer.ErrorCode;
import io.kestrel.analyzer.TypeException;
import io.kestrel.analyzer.UnsupportedExprOperationException;
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.analyzer.query.Query;
import io.kestrel.analyzer.types.TypeInfo;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * A nested query used as a value. Its type is the type of the sole column the subquery returns, not of the set.
 *
 * <p>
 * The nested {@link Query} is referenced, not owned: copies of this node share it, and two subquery nodes are equal
 * only if they reference the same query. Predicate classification and the target list rewrites do not apply to
 * subqueries, which an earlier stage must flatten first.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class Subquery extends Expr {
    @Nonnull
    private final Query query;

    public Subquery(@Nonnull TypeInfo typeInfo, @Nonnull Query query) {
        super(typeInfo, false);
        this.query = query;
    }

    /**
     * Wrap an analyzed query returning a single column.
     * @param query the nested query
     * @return a new node typed after the query's only target entry
     * @throws TypeException if the query does not return exactly one column
     */
    @Nonnull
    public static Subquery of(@Nonnull Query query) {
        if (query.getTargetList().size() != 1) {
            throw new TypeException("subquery must return exactly one column", ErrorCode.SUBQUERY_COLUMN_COUNT,
                    LogMessageKeys.TARGET_LIST_SIZE, query.getTargetList().size());
        }
        return new Subquery(query.getTargetList().get(0).getExpr().getTypeInfo(), query);
    }

    @Nonnull
    public Query getQuery() {
        return query;
    }

    @Override
    public void collectRangeTableIndices(@Nonnull Set<Integer> rangeTableIndices) {
        throw unsupported("range table collection");
    }

    @Override
    public void collectColumnVars(@Nonnull Set<ColumnVar> columnVars, boolean includeAggregates) {
        throw unsupported("column collection");
    }

    @Override
    public void checkGroupBy(@Nonnull List<Expr> groupBy) {
        // the nested query is grouped on its own
    }

    @Override
    public void findExpr(@Nonnull Predicate<Expr> matcher, @Nonnull List<Expr> found) {
        if (matcher.test(this)) {
            addUnique(found);
        }
    }

    @Nonnull
    UnsupportedExprOperationException unsupported(@Nonnull String operation) {
        return new UnsupportedExprOperationException("subquery must be flattened before " + operation,
                LogMessageKeys.QUERY, query);
    }

    @Nonnull
    @Override
    public List<Expr> getChildren() {
        return ImmutableList.of();
    }

    @Nonnull
    @Override
    protected Expr withChildren(@Nonnull List<Expr> newChildren) {
        Preconditions.checkArgument(newChildren.isEmpty());
        return new Subquery(getTypeInfo(), query);
    }

    @Override
    protected boolean equalsWithoutChildren(@Nonnull Expr other) {
        return query == ((Subquery)other).query;
    }

    @Override
    protected int hashCodeWithoutChildren() {
        return System.identityHashCode(query);
    }

    @Override
    public <T> T accept(@Nonnull ExprVisitor<T> visitor) {
        return visitor.visitSubquery(this);
    }
}
