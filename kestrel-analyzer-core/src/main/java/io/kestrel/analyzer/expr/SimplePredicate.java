/*
 * SimplePredicate.java
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

import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A comparison between one column and a column-free expression, with the column on the left. This is the single
 * shape that index and partition pruning need to recognize.
 *
 * @see Expr#normalizeSimplePredicate()
 */
@API(API.Status.UNSTABLE)
public final class SimplePredicate {
    @Nonnull
    private final BinOper predicate;
    private final int rangeTableIndex;

    SimplePredicate(@Nonnull BinOper predicate, int rangeTableIndex) {
        this.predicate = predicate;
        this.rangeTableIndex = rangeTableIndex;
    }

    /**
     * Get the normalized comparison. Its left operand is always a {@link ColumnVar}.
     * @return the comparison
     */
    @Nonnull
    public BinOper getPredicate() {
        return predicate;
    }

    @Nonnull
    public ColumnVar getColumn() {
        return (ColumnVar)predicate.getLeftOperand();
    }

    @Nonnull
    public Expr getValue() {
        return predicate.getRightOperand();
    }

    /**
     * Get the range table index of the column.
     * @return the index of the range table entry the column belongs to
     */
    public int getRangeTableIndex() {
        return rangeTableIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final SimplePredicate that = (SimplePredicate)o;
        return rangeTableIndex == that.rangeTableIndex && predicate.structuralEquals(that.predicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(predicate, rangeTableIndex);
    }

    @Override
    public String toString() {
        return predicate + " @" + rangeTableIndex;
    }
}
