/*
 * Expr.java
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
import io.kestrel.analyzer.TypeException;
import io.kestrel.analyzer.ErrorCode;
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.analyzer.query.TargetEntry;
import io.kestrel.analyzer.types.TypeInfo;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * A typed node of an analyzed expression tree.
 *
 * <p>
 * Nodes are immutable. Every operation that changes a tree, such as casting or rewriting against a target list,
 * builds new nodes and leaves its input untouched, so a published tree can be read from several threads at once.
 * Every node carries its {@link TypeInfo}, fixed at construction, and whether it contains an aggregate call.
 * </p>
 *
 * <p>
 * The set of variants is closed: {@link ColumnVar} (and its refinement {@link Var}), {@link Constant}, {@link UOper},
 * {@link BinOper}, {@link Subquery}, {@link InValues}, {@link CharLengthExpr}, {@link LikeExpr}, {@link AggExpr},
 * {@link CaseExpr}, {@link ExtractExpr} and {@link DatetruncExpr}. Consumers that need to handle each variant use
 * an {@link ExprVisitor}.
 * </p>
 */
@API(API.Status.UNSTABLE)
public abstract class Expr {
    @Nonnull
    private final TypeInfo typeInfo;
    private final boolean containsAggregate;

    protected Expr(@Nonnull TypeInfo typeInfo, boolean containsAggregate) {
        this.typeInfo = Objects.requireNonNull(typeInfo);
        this.containsAggregate = containsAggregate;
    }

    @Nonnull
    public TypeInfo getTypeInfo() {
        return typeInfo;
    }

    /**
     * Whether this node is, or has below it, an aggregate function call.
     * @return {@code true} if the tree contains an {@link AggExpr}
     */
    public boolean containsAggregate() {
        return containsAggregate;
    }

    /**
     * Get the direct children of this node, in a fixed variant-specific order. Absent optional children, such as
     * the escape of a {@code LIKE}, are left out.
     * @return the children
     */
    @Nonnull
    public abstract List<Expr> getChildren();

    /**
     * Build a node of the same variant with the same type and scalar fields but the given children.
     * @param newChildren replacement children, in the order of {@link #getChildren()}
     * @return a new node
     */
    @Nonnull
    protected abstract Expr withChildren(@Nonnull List<Expr> newChildren);

    /**
     * Compare the variant-specific scalar fields of two nodes of the same class. Children, type and aggregate flag
     * are compared by {@link #structuralEquals(Expr)}.
     * @param other a node of the same class as this one
     * @return whether the scalar fields are equal
     */
    protected abstract boolean equalsWithoutChildren(@Nonnull Expr other);

    protected abstract int hashCodeWithoutChildren();

    public abstract <T> T accept(@Nonnull ExprVisitor<T> visitor);

    /**
     * Make a fully independent copy of this tree.
     * @return a tree that is {@link #structuralEquals(Expr)} to this one and shares no node with it
     */
    @Nonnull
    public Expr deepCopy() {
        final List<Expr> children = getChildren();
        final List<Expr> copies = new ArrayList<>(children.size());
        for (Expr child : children) {
            copies.add(child.deepCopy());
        }
        return withChildren(copies);
    }

    /**
     * Value equality over variant, type, aggregate flag, scalar fields and all children. No coercion is applied, so
     * {@code 1} as {@code INT} and {@code 1} as {@code BIGINT} differ, and a {@link ColumnVar} never equals a
     * {@link Var}.
     * @param other the tree to compare with
     * @return {@code true} if the two trees are structurally identical
     */
    public boolean structuralEquals(@Nullable Expr other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        if (containsAggregate != other.containsAggregate || !typeInfo.equals(other.typeInfo)) {
            return false;
        }
        if (!equalsWithoutChildren(other)) {
            return false;
        }
        final Iterator<Expr> children = getChildren().iterator();
        final Iterator<Expr> otherChildren = other.getChildren().iterator();
        while (children.hasNext()) {
            if (!otherChildren.hasNext() || !children.next().structuralEquals(otherChildren.next())) {
                return false;
            }
        }
        return !otherChildren.hasNext();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Expr && structuralEquals((Expr)o);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), typeInfo, hashCodeWithoutChildren(), getChildren());
    }

    @Override
    public String toString() {
        return accept(new ExplainExprVisitor());
    }

    /**
     * Get an expression of the given type equivalent to this one. Unless overridden, the result wraps this node in
     * a {@link SqlOperator#CAST}. A type that differs only by allowing nulls needs no cast.
     * @param target the type to cast to
     * @return this node if no cast is needed, otherwise a new node of type {@code target}
     * @throws TypeException if no cast between the two types is defined
     */
    @Nonnull
    public Expr addCast(@Nonnull TypeInfo target) {
        if (needsNoCast(target)) {
            return this;
        }
        if (!typeInfo.isCastableTo(target)) {
            throw new TypeException("cannot cast", ErrorCode.CANNOT_COERCE,
                    LogMessageKeys.TYPE, typeInfo, LogMessageKeys.TARGET_TYPE, target);
        }
        return new UOper(target, containsAggregate, SqlOperator.CAST, this);
    }

    boolean needsNoCast(@Nonnull TypeInfo target) {
        return typeInfo.equals(target) || (!target.isNotNull() && typeInfo.withNotNull(false).equals(target));
    }

    /**
     * Cast an encoded result to the same type without encoding.
     * @return this node if it is not encoded, otherwise a cast of it
     */
    @Nonnull
    public Expr decompress() {
        if (!typeInfo.isEncoded()) {
            return this;
        }
        return new UOper(typeInfo.withoutEncoding(), containsAggregate, SqlOperator.CAST, this);
    }

    /**
     * Add the range table index of every base table column this tree references. A {@link Var} reports
     * {@link Var#RANGE_TABLE_SENTINEL} instead.
     * @param rangeTableIndices the set to add to
     * @throws io.kestrel.analyzer.UnsupportedExprOperationException if the tree contains a {@link Subquery}
     */
    public void collectRangeTableIndices(@Nonnull Set<Integer> rangeTableIndices) {
        for (Expr child : getChildren()) {
            child.collectRangeTableIndices(rangeTableIndices);
        }
    }

    @Nonnull
    public Set<Integer> getRangeTableIndices() {
        final Set<Integer> rangeTableIndices = new TreeSet<>();
        collectRangeTableIndices(rangeTableIndices);
        return rangeTableIndices;
    }

    /**
     * Add every distinct {@link ColumnVar} this tree references. Use a set ordered by
     * {@link ColumnVar#TABLE_COLUMN_ORDER} so that references to the same column count once.
     * @param columnVars the set to add to
     * @param includeAggregates whether to descend into the arguments of aggregate calls
     * @throws io.kestrel.analyzer.UnsupportedExprOperationException if the tree contains a {@link Subquery}
     */
    public void collectColumnVars(@Nonnull Set<ColumnVar> columnVars, boolean includeAggregates) {
        for (Expr child : getChildren()) {
            child.collectColumnVars(columnVars, includeAggregates);
        }
    }

    @Nonnull
    public Set<ColumnVar> getColumnVars(boolean includeAggregates) {
        final Set<ColumnVar> columnVars = new TreeSet<>(ColumnVar.TABLE_COLUMN_ORDER);
        collectColumnVars(columnVars, includeAggregates);
        return columnVars;
    }

    /**
     * Replace every {@link ColumnVar} by a {@link Var} reading slot {@code i} of the {@link WhichRow#OUTPUT} row,
     * where {@code i} is the position of the matching entry in {@code targetList}.
     * @param targetList the output columns of the plan node being wrapped
     * @return the rewritten tree
     * @throws io.kestrel.analyzer.AnalyzerException if a column is not in the target list, or the tree contains
     * a {@link Subquery}
     */
    @Nonnull
    public Expr rewriteWithTargetList(@Nonnull List<TargetEntry> targetList) {
        return accept(ExprRewriter.withTargetList(targetList));
    }

    /**
     * Replace every {@link ColumnVar} by a {@link Var} reading the outer input row of a plan node whose child
     * produces {@code targetList}.
     * @param targetList the output columns of the child plan node
     * @return the rewritten tree
     */
    @Nonnull
    public Expr rewriteWithChildTargetList(@Nonnull List<TargetEntry> targetList) {
        return rewriteWithChildTargetList(targetList, WhichRow.INPUT_OUTER);
    }

    /**
     * Replace every {@link ColumnVar} by a {@link Var} reading the given input row of a plan node whose child
     * produces {@code targetList}.
     * @param targetList the output columns of the child plan node
     * @param side {@link WhichRow#INPUT_OUTER} or {@link WhichRow#INPUT_INNER}
     * @return the rewritten tree
     */
    @Nonnull
    public Expr rewriteWithChildTargetList(@Nonnull List<TargetEntry> targetList, @Nonnull WhichRow side) {
        return accept(ExprRewriter.withChildTargetList(targetList, side));
    }

    /**
     * Replace columns as {@link #rewriteWithChildTargetList(List)} does, and every {@link AggExpr} by a
     * {@link WhichRow#OUTPUT} {@link Var} reading the slot where an aggregation node materializes its result.
     * @param targetList the output columns of the aggregation node
     * @return the rewritten tree
     */
    @Nonnull
    public Expr rewriteAggregatesToVars(@Nonnull List<TargetEntry> targetList) {
        return accept(ExprRewriter.aggregatesToVars(targetList));
    }

    /**
     * Check that this tree can be evaluated once per group: it either equals a grouping key, or every column it
     * references outside an aggregate call is itself a grouping key.
     * @param groupBy the grouping keys
     * @throws GroupingException if a column is neither grouped nor aggregated
     */
    public void checkGroupBy(@Nonnull List<Expr> groupBy) {
        if (isGroupingKey(groupBy)) {
            return;
        }
        for (Expr child : getChildren()) {
            child.checkGroupBy(groupBy);
        }
    }

    boolean isGroupingKey(@Nonnull List<Expr> groupBy) {
        for (Expr key : groupBy) {
            if (structuralEquals(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Split a predicate into conjuncts and sort each into the stage where it can first be evaluated: a conjunct
     * referencing no table is constant, one referencing a single table can be pushed to that table's scan, and one
     * referencing several tables belongs to a join.
     * @param scanPredicates receives the single-table conjuncts
     * @param joinPredicates receives the multi-table conjuncts
     * @param constPredicates receives the conjuncts that reference no table
     * @throws io.kestrel.analyzer.UnsupportedExprOperationException if a conjunct contains a {@link Subquery}
     */
    public void groupPredicates(@Nonnull List<Expr> scanPredicates,
                                @Nonnull List<Expr> joinPredicates,
                                @Nonnull List<Expr> constPredicates) {
        final Set<Integer> rangeTableIndices = getRangeTableIndices();
        if (rangeTableIndices.isEmpty()) {
            constPredicates.add(this);
        } else if (rangeTableIndices.size() == 1) {
            scanPredicates.add(this);
        } else {
            joinPredicates.add(this);
        }
    }

    /**
     * Bring a comparison between a single column and a column-free expression into the canonical
     * {@code column op value} shape.
     * @return the normalized predicate, or empty if this is not such a comparison
     */
    @Nonnull
    public Optional<SimplePredicate> normalizeSimplePredicate() {
        return Optional.empty();
    }

    /**
     * Add this node to {@code exprs} unless a structurally equal node is already there.
     * @param exprs list of distinct expressions
     */
    public void addUnique(@Nonnull List<Expr> exprs) {
        for (Expr expr : exprs) {
            if (structuralEquals(expr)) {
                return;
            }
        }
        exprs.add(this);
    }

    /**
     * Add every node of this tree that satisfies {@code matcher} to {@code found}, skipping duplicates. A matching
     * node is added whole and its own subtree is not searched further.
     * @param matcher the condition to search for
     * @param found list of distinct matches
     */
    public void findExpr(@Nonnull Predicate<Expr> matcher, @Nonnull List<Expr> found) {
        if (matcher.test(this)) {
            addUnique(found);
            return;
        }
        for (Expr child : getChildren()) {
            child.findExpr(matcher, found);
        }
    }

    @Nonnull
    public List<Expr> findExpr(@Nonnull Predicate<Expr> matcher) {
        final List<Expr> found = new ArrayList<>();
        findExpr(matcher, found);
        return found;
    }

    /**
     * Get the finite set of values this expression can take.
     * @return the distinct possible values, or an empty list if they are not known
     */
    @Nonnull
    public List<Expr> getDomain() {
        return ImmutableList.of();
    }

    /**
     * Whether this tree references no column, aggregate or subquery, so that it evaluates the same for every row.
     * @return {@code true} if the tree is free of column references
     */
    public boolean isColumnFree() {
        return findExpr(e -> e instanceof ColumnVar || e instanceof AggExpr || e instanceof Subquery).isEmpty();
    }

    static boolean anyContainsAggregate(@Nonnull Iterable<? extends Expr> exprs) {
        for (Expr expr : exprs) {
            if (expr != null && expr.containsAggregate()) {
                return true;
            }
        }
        return false;
    }
}
