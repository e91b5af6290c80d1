/*
 * Query.java
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

package io.kestrel.analyzer.query;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.kestrel.analyzer.AnalyzerException;
import io.kestrel.analyzer.ErrorCode;
import io.kestrel.analyzer.ResolutionException;
import io.kestrel.analyzer.expr.ColumnVar;
import io.kestrel.analyzer.expr.Expr;
import io.kestrel.analyzer.expr.Var;
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An analyzed statement.
 *
 * <p>
 * A query is assembled in one forward pass: range table entries and target entries are appended, and clauses are
 * set. Nothing is ever removed. Expressions refer to range table entries by their index, so the range table is never
 * reordered. For {@code INSERT}, {@code UPDATE} and {@code DELETE} the first range table entry is the table written to.
 * </p>
 *
 * <p>
 * Once analysis is finished a query is treated as read-only and may be shared between threads; later stages derive
 * new expression trees instead of modifying the ones held here.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class Query {
    private boolean distinct;
    private int numAggregates;
    @Nonnull
    private final List<TargetEntry> targetList = new ArrayList<>();
    @Nonnull
    private final List<RangeTblEntry> rangeTable = new ArrayList<>();
    @Nullable
    private Expr where;
    @Nonnull
    private List<Expr> groupBy = ImmutableList.of();
    @Nullable
    private Expr having;
    @Nullable
    private List<OrderEntry> orderBy;
    @Nullable
    private Query nextQuery;
    private boolean unionAll;
    @Nonnull
    private StatementType statementType = StatementType.SELECT;
    private int resultTableId;
    @Nonnull
    private List<Integer> resultColumns = ImmutableList.of();
    private long limit;
    private long offset;

    public boolean isDistinct() {
        return distinct;
    }

    public void setDistinct(boolean distinct) {
        this.distinct = distinct;
    }

    public int getNumAggregates() {
        return numAggregates;
    }

    public void setNumAggregates(int numAggregates) {
        Preconditions.checkArgument(numAggregates >= 0, "aggregate count cannot be negative");
        this.numAggregates = numAggregates;
    }

    @Nonnull
    public List<TargetEntry> getTargetList() {
        return Collections.unmodifiableList(targetList);
    }

    public void addTargetEntry(@Nonnull TargetEntry entry) {
        targetList.add(entry);
    }

    @Nonnull
    public List<RangeTblEntry> getRangeTable() {
        return Collections.unmodifiableList(rangeTable);
    }

    /**
     * Append an entry to the range table.
     * @param entry the new entry
     * @return the index expressions use to refer to the entry
     */
    public int addRangeTableEntry(@Nonnull RangeTblEntry entry) {
        rangeTable.add(entry);
        return rangeTable.size() - 1;
    }

    @Nonnull
    public RangeTblEntry getRangeTableEntry(int rangeTableIndex) {
        Preconditions.checkElementIndex(rangeTableIndex, rangeTable.size(), "range table index");
        return rangeTable.get(rangeTableIndex);
    }

    /**
     * Find the range table entry an alias refers to. When an alias occurs more than once, the most recently added
     * entry wins.
     * @param alias the alias, in the same normalized form it was added under
     * @return index of the entry
     * @throws ResolutionException if no entry has that alias
     */
    public int resolveRangeIndex(@Nonnull String alias) {
        final int index = findRangeIndex(alias);
        if (index < 0) {
            throw new ResolutionException("table or alias is not in scope", ErrorCode.UNDEFINED_TABLE,
                    LogMessageKeys.ALIAS, alias,
                    LogMessageKeys.RANGE_TABLE_SIZE, rangeTable.size());
        }
        return index;
    }

    /**
     * Like {@link #resolveRangeIndex(String)} but returns {@code -1} if the alias is not in scope.
     * @param alias the alias
     * @return index of the entry, or {@code -1}
     */
    public int findRangeIndex(@Nonnull String alias) {
        for (int i = rangeTable.size() - 1; i >= 0; i--) {
            if (rangeTable.get(i).getAlias().equals(alias)) {
                return i;
            }
        }
        return -1;
    }

    @Nullable
    public Expr getWhere() {
        return where;
    }

    public void setWhere(@Nullable Expr where) {
        this.where = where;
    }

    @Nonnull
    public List<Expr> getGroupBy() {
        return groupBy;
    }

    public void setGroupBy(@Nonnull List<Expr> groupBy) {
        this.groupBy = ImmutableList.copyOf(groupBy);
    }

    @Nullable
    public Expr getHaving() {
        return having;
    }

    public void setHaving(@Nullable Expr having) {
        this.having = having;
    }

    /**
     * Get the {@code ORDER BY} keys.
     * @return the keys, or {@code null} if the query is unordered
     */
    @Nullable
    public List<OrderEntry> getOrderBy() {
        return orderBy;
    }

    /**
     * Set the {@code ORDER BY} keys. Every key must name an existing entry of the target list, so the target list
     * must be complete first.
     * @param orderBy the keys, or {@code null} for no ordering
     * @throws ResolutionException if a key's position is past the end of the target list
     */
    public void setOrderBy(@Nullable List<OrderEntry> orderBy) {
        if (orderBy != null) {
            for (OrderEntry entry : orderBy) {
                if (entry.getPosition() > targetList.size()) {
                    throw new ResolutionException("order by position is not in select list", ErrorCode.INVALID_COLUMN_REFERENCE,
                            LogMessageKeys.ORDER_POSITION, entry.getPosition(),
                            LogMessageKeys.TARGET_LIST_SIZE, targetList.size());
                }
            }
            this.orderBy = ImmutableList.copyOf(orderBy);
        } else {
            this.orderBy = null;
        }
    }

    /**
     * Get the next query of a {@code UNION} chain.
     * @return the query whose rows are appended to this one's, or {@code null}
     */
    @Nullable
    public Query getNextQuery() {
        return nextQuery;
    }

    public void setNextQuery(@Nullable Query nextQuery) {
        Preconditions.checkArgument(nextQuery != this, "a query cannot be united with itself");
        this.nextQuery = nextQuery;
    }

    public boolean isUnionAll() {
        return unionAll;
    }

    public void setUnionAll(boolean unionAll) {
        this.unionAll = unionAll;
    }

    @Nonnull
    public StatementType getStatementType() {
        return statementType;
    }

    public void setStatementType(@Nonnull StatementType statementType) {
        this.statementType = statementType;
    }

    /**
     * Get the table an {@code INSERT} writes to.
     * @return the table id, or {@code 0} for other statements
     */
    public int getResultTableId() {
        return resultTableId;
    }

    public void setResultTableId(int resultTableId) {
        this.resultTableId = resultTableId;
    }

    /**
     * Get the ids of the columns an {@code INSERT} writes, in the order values are supplied.
     * @return the column ids
     */
    @Nonnull
    public List<Integer> getResultColumns() {
        return resultColumns;
    }

    public void setResultColumns(@Nonnull List<Integer> resultColumns) {
        this.resultColumns = ImmutableList.copyOf(resultColumns);
    }

    /**
     * Get the {@code LIMIT} row count.
     * @return the limit, {@code 0} meaning all rows
     */
    public long getLimit() {
        return limit;
    }

    public void setLimit(long limit) {
        Preconditions.checkArgument(limit >= 0, "limit cannot be negative");
        this.limit = limit;
    }

    /**
     * Get the number of rows skipped by {@code OFFSET}.
     * @return the offset, {@code 0} meaning none
     */
    public long getOffset() {
        return offset;
    }

    public void setOffset(long offset) {
        Preconditions.checkArgument(offset >= 0, "offset cannot be negative");
        this.offset = offset;
    }

    /**
     * Whether output rows are formed per group rather than per input row.
     * @return {@code true} if there is a {@code GROUP BY} clause or an aggregate call
     */
    public boolean isAggregating() {
        return !groupBy.isEmpty() || numAggregates > 0;
    }

    /**
     * Check that the target list and {@code HAVING} clause of an aggregating query only use grouped columns
     * outside of aggregate calls.
     * @throws io.kestrel.analyzer.GroupingException if some column is neither grouped nor aggregated
     */
    public void checkGroupBy() {
        if (!isAggregating()) {
            return;
        }
        for (TargetEntry entry : targetList) {
            entry.getExpr().checkGroupBy(groupBy);
        }
        if (having != null) {
            having.checkGroupBy(groupBy);
        }
    }

    /**
     * Check that every column reference in this query's clauses names an entry of its range table. A {@link Var}
     * may instead carry {@link Var#RANGE_TABLE_SENTINEL}. Subqueries are not descended into.
     * @throws AnalyzerException if some reference is out of range
     */
    public void checkRangeTableReferences() {
        final List<Expr> exprs = new ArrayList<>();
        for (TargetEntry entry : targetList) {
            exprs.add(entry.getExpr());
        }
        if (where != null) {
            exprs.add(where);
        }
        exprs.addAll(groupBy);
        if (having != null) {
            exprs.add(having);
        }
        for (Expr expr : exprs) {
            for (Expr found : expr.findExpr(e -> e instanceof ColumnVar)) {
                final ColumnVar column = (ColumnVar)found;
                final int index = column.getRangeTableIndex();
                final boolean sentinel = column instanceof Var && index == Var.RANGE_TABLE_SENTINEL;
                if (!sentinel && (index < 0 || index >= rangeTable.size())) {
                    throw new AnalyzerException("column refers to a missing range table entry", ErrorCode.INTERNAL_ERROR,
                            LogMessageKeys.RTE_INDEX, index,
                            LogMessageKeys.RANGE_TABLE_SIZE, rangeTable.size(),
                            LogMessageKeys.EXPR, column);
                }
            }
        }
    }

    @Override
    public String toString() {
        final StringBuilder str = new StringBuilder();
        if (statementType != StatementType.SELECT) {
            str.append(statementType).append(' ');
            if (resultTableId != 0) {
                str.append("INTO #").append(resultTableId).append(resultColumns).append(' ');
            }
        }
        str.append("SELECT ");
        if (distinct) {
            str.append("DISTINCT ");
        }
        str.append(targetList.stream().map(TargetEntry::toString).collect(Collectors.joining(", ")));
        if (!rangeTable.isEmpty()) {
            str.append(" FROM ").append(rangeTable.stream().map(RangeTblEntry::toString).collect(Collectors.joining(", ")));
        }
        if (where != null) {
            str.append(" WHERE ").append(where);
        }
        if (!groupBy.isEmpty()) {
            str.append(" GROUP BY ").append(groupBy.stream().map(Expr::toString).collect(Collectors.joining(", ")));
        }
        if (having != null) {
            str.append(" HAVING ").append(having);
        }
        if (orderBy != null) {
            str.append(" ORDER BY ").append(orderBy.stream().map(OrderEntry::toString).collect(Collectors.joining(", ")));
        }
        if (limit != 0) {
            str.append(" LIMIT ").append(limit);
        }
        if (offset != 0) {
            str.append(" OFFSET ").append(offset);
        }
        if (nextQuery != null) {
            str.append(unionAll ? " UNION ALL " : " UNION ").append(nextQuery);
        }
        return str.toString();
    }
}
