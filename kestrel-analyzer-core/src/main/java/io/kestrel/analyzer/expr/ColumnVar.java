/*
 * ColumnVar.java
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
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.analyzer.types.EncodingType;
import io.kestrel.analyzer.types.TypeInfo;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The value of a stored column of a base table, read by the scan of the range table entry at
 * {@link #getRangeTableIndex()}. Plan nodes above a scan use {@link Var} instead.
 */
@API(API.Status.UNSTABLE)
public class ColumnVar extends Expr {
    /**
     * Orders column references by table id, then column id. Two references to the same column compare equal.
     */
    public static final Comparator<ColumnVar> TABLE_COLUMN_ORDER =
            Comparator.comparingInt(ColumnVar::getTableId).thenComparingInt(ColumnVar::getColumnId);

    private final int tableId;
    private final int columnId;
    private final int rangeTableIndex;

    public ColumnVar(@Nonnull TypeInfo typeInfo, int tableId, int columnId, int rangeTableIndex) {
        super(typeInfo, false);
        this.tableId = tableId;
        this.columnId = columnId;
        this.rangeTableIndex = rangeTableIndex;
    }

    public int getTableId() {
        return tableId;
    }

    public int getColumnId() {
        return columnId;
    }

    /**
     * Get the 0-based index of the range table entry this column is read from.
     * @return the range table index
     */
    public int getRangeTableIndex() {
        return rangeTableIndex;
    }

    @Nonnull
    public EncodingType getEncoding() {
        return getTypeInfo().getEncoding();
    }

    /**
     * Whether this and another reference read the same column. The range table index must also agree, unless
     * either side does not know it.
     * @param other another column reference
     * @return {@code true} if both reference the same column
     */
    public boolean refersToSameColumn(@Nonnull ColumnVar other) {
        return tableId == other.tableId && columnId == other.columnId
               && (rangeTableIndex < 0 || other.rangeTableIndex < 0 || rangeTableIndex == other.rangeTableIndex);
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
        return new ColumnVar(getTypeInfo(), tableId, columnId, rangeTableIndex);
    }

    @Override
    protected boolean equalsWithoutChildren(@Nonnull Expr other) {
        final ColumnVar otherColumn = (ColumnVar)other;
        return tableId == otherColumn.tableId && columnId == otherColumn.columnId
               && rangeTableIndex == otherColumn.rangeTableIndex;
    }

    @Override
    protected int hashCodeWithoutChildren() {
        return Objects.hash(tableId, columnId, rangeTableIndex);
    }

    @Override
    public <T> T accept(@Nonnull ExprVisitor<T> visitor) {
        return visitor.visitColumnVar(this);
    }

    @Override
    public void collectRangeTableIndices(@Nonnull Set<Integer> rangeTableIndices) {
        rangeTableIndices.add(rangeTableIndex);
    }

    @Override
    public void collectColumnVars(@Nonnull Set<ColumnVar> columnVars, boolean includeAggregates) {
        columnVars.add(this);
    }

    @Override
    public void checkGroupBy(@Nonnull List<Expr> groupBy) {
        for (Expr key : groupBy) {
            if (key instanceof ColumnVar && !(key instanceof Var) && refersToSameColumn((ColumnVar)key)) {
                return;
            }
        }
        throw new GroupingException("column must appear in the GROUP BY clause or be used in an aggregate function",
                LogMessageKeys.TABLE_ID, tableId, LogMessageKeys.COLUMN_ID, columnId,
                LogMessageKeys.RTE_INDEX, rangeTableIndex);
    }
}
