/*
 * Var.java
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
import io.kestrel.analyzer.GroupingException;
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.analyzer.types.TypeInfo;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The value of a column of a row produced by a plan node rather than read from a base table. The row is chosen by
 * {@link WhichRow} and the column by the 1-based {@link #getVarNo()}.
 *
 * <p>
 * A {@code Var} keeps the table and column ids of the base column it came from, if any, to track lineage through
 * the plan. A synthetic value, such as the result of an aggregate, has table id {@code 0}. For predicate
 * classification a {@code Var} always reports {@link #RANGE_TABLE_SENTINEL}.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class Var extends ColumnVar {
    /**
     * Range table index reported for values that no longer come from a single table scan.
     */
    public static final int RANGE_TABLE_SENTINEL = -1;

    @Nonnull
    private final WhichRow whichRow;
    private final int varNo;

    public Var(@Nonnull TypeInfo typeInfo, int tableId, int columnId, int rangeTableIndex,
               @Nonnull WhichRow whichRow, int varNo) {
        super(typeInfo, tableId, columnId, rangeTableIndex);
        Preconditions.checkArgument(varNo >= 1, "varno is 1-based: %s", varNo);
        this.whichRow = whichRow;
        this.varNo = varNo;
    }

    /**
     * Create a synthetic {@code Var} with no base column lineage.
     * @param typeInfo type of the value
     * @param whichRow the row to read
     * @param varNo 1-based position in that row
     */
    public Var(@Nonnull TypeInfo typeInfo, @Nonnull WhichRow whichRow, int varNo) {
        this(typeInfo, 0, 0, RANGE_TABLE_SENTINEL, whichRow, varNo);
    }

    @Nonnull
    public WhichRow getWhichRow() {
        return whichRow;
    }

    /**
     * Get the 1-based position of the value in its row.
     * @return the varno
     */
    public int getVarNo() {
        return varNo;
    }

    /**
     * Get the 0-based position of the value in its row.
     * @return {@code getVarNo() - 1}
     */
    public int getSlotIndex() {
        return varNo - 1;
    }

    public boolean isSynthetic() {
        return getTableId() == 0;
    }

    @Nonnull
    @Override
    protected Expr withChildren(@Nonnull List<Expr> newChildren) {
        Preconditions.checkArgument(newChildren.isEmpty());
        return new Var(getTypeInfo(), getTableId(), getColumnId(), getRangeTableIndex(), whichRow, varNo);
    }

    @Override
    protected boolean equalsWithoutChildren(@Nonnull Expr other) {
        final Var otherVar = (Var)other;
        return super.equalsWithoutChildren(other) && whichRow == otherVar.whichRow && varNo == otherVar.varNo;
    }

    @Override
    protected int hashCodeWithoutChildren() {
        return Objects.hash(super.hashCodeWithoutChildren(), whichRow, varNo);
    }

    @Override
    public <T> T accept(@Nonnull ExprVisitor<T> visitor) {
        return visitor.visitVar(this);
    }

    @Override
    public void collectRangeTableIndices(@Nonnull Set<Integer> rangeTableIndices) {
        rangeTableIndices.add(RANGE_TABLE_SENTINEL);
    }

    @Override
    public void collectColumnVars(@Nonnull Set<ColumnVar> columnVars, boolean includeAggregates) {
        // a Var is not a base table column
    }

    @Override
    public void checkGroupBy(@Nonnull List<Expr> groupBy) {
        if (whichRow != WhichRow.GROUPBY && !isGroupingKey(groupBy)) {
            throw new GroupingException("value is not a grouping key", LogMessageKeys.EXPR, this);
        }
    }
}
