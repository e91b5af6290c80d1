/*
 * ExprRewriter.java
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
import io.kestrel.analyzer.AnalyzerException;
import io.kestrel.analyzer.ErrorCode;
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.analyzer.query.TargetEntry;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * The recursion shared by the three target list rewrites. Every node is rebuilt from its rewritten children;
 * subclasses decide what replaces column references and aggregate calls. Subqueries are rejected.
 */
abstract class ExprRewriter implements ExprVisitor<Expr> {
    @Nonnull
    protected final List<TargetEntry> targetList;

    ExprRewriter(@Nonnull List<TargetEntry> targetList) {
        this.targetList = ImmutableList.copyOf(targetList);
    }

    @Nonnull
    static ExprRewriter withTargetList(@Nonnull List<TargetEntry> targetList) {
        return new ExprRewriter(targetList) {
            @Override
            public Expr visitColumnVar(@Nonnull ColumnVar columnVar) {
                return replaceColumn(columnVar, WhichRow.OUTPUT);
            }
        };
    }

    @Nonnull
    static ExprRewriter withChildTargetList(@Nonnull List<TargetEntry> targetList, @Nonnull WhichRow side) {
        Preconditions.checkArgument(side == WhichRow.INPUT_OUTER || side == WhichRow.INPUT_INNER,
                "child rows are read from an input side, not %s", side);
        return new ExprRewriter(targetList) {
            @Override
            public Expr visitColumnVar(@Nonnull ColumnVar columnVar) {
                return replaceColumn(columnVar, side);
            }
        };
    }

    @Nonnull
    static ExprRewriter aggregatesToVars(@Nonnull List<TargetEntry> targetList) {
        return new ExprRewriter(targetList) {
            @Override
            public Expr visitColumnVar(@Nonnull ColumnVar columnVar) {
                return replaceColumn(columnVar, WhichRow.INPUT_OUTER);
            }

            @Override
            public Expr visitVar(@Nonnull Var var) {
                final int varNo = findSlot(var);
                final TargetEntry entry = targetList.get(varNo - 1);
                return new Var(entry.getExpr().getTypeInfo(), var.getTableId(), var.getColumnId(),
                        var.getRangeTableIndex(), WhichRow.INPUT_OUTER, varNo);
            }

            @Override
            public Expr visitAggregate(@Nonnull AggExpr aggregate) {
                int varNo = 1;
                for (TargetEntry entry : targetList) {
                    if (aggregate.structuralEquals(entry.getExpr())) {
                        return new Var(entry.getExpr().getTypeInfo(), WhichRow.OUTPUT, varNo);
                    }
                    varNo++;
                }
                throw notFound("aggregate not found in target list", aggregate);
            }
        };
    }

    /**
     * Replace a base column by a {@code Var} reading the matching target list slot. The {@code Var} keeps the
     * column's lineage and takes the type of the target entry.
     */
    @Nonnull
    protected Var replaceColumn(@Nonnull ColumnVar columnVar, @Nonnull WhichRow whichRow) {
        final int varNo = findSlot(columnVar);
        final ColumnVar match = (ColumnVar)targetList.get(varNo - 1).getExpr();
        return new Var(match.getTypeInfo(), match.getTableId(), match.getColumnId(), columnVar.getRangeTableIndex(),
                whichRow, varNo);
    }

    /**
     * Find the 1-based position of the target entry producing a column. Entries that are not column references
     * are skipped. A synthetic {@code Var} only matches an equal {@code Var}.
     */
    protected int findSlot(@Nonnull ColumnVar column) {
        final boolean synthetic = column instanceof Var && ((Var)column).isSynthetic();
        int varNo = 1;
        for (TargetEntry entry : targetList) {
            final Expr expr = entry.getExpr();
            if (expr instanceof ColumnVar) {
                if (synthetic ? column.structuralEquals(expr) : column.refersToSameColumn((ColumnVar)expr)) {
                    return varNo;
                }
            }
            varNo++;
        }
        throw notFound("column not found in target list", column);
    }

    @Nonnull
    protected AnalyzerException notFound(@Nonnull String message, @Nonnull Expr expr) {
        return new AnalyzerException(message, ErrorCode.INTERNAL_ERROR,
                LogMessageKeys.EXPR, expr, LogMessageKeys.TARGET_LIST_SIZE, targetList.size());
    }

    @Nonnull
    private Expr rewriteChildren(@Nonnull Expr expr) {
        final List<Expr> children = expr.getChildren();
        final List<Expr> rewritten = new ArrayList<>(children.size());
        for (Expr child : children) {
            rewritten.add(child.accept(this));
        }
        return expr.withChildren(rewritten);
    }

    @Override
    public Expr visitVar(@Nonnull Var var) {
        return var.deepCopy();
    }

    @Override
    public Expr visitConstant(@Nonnull Constant constant) {
        return constant.deepCopy();
    }

    @Override
    public Expr visitUOper(@Nonnull UOper uOper) {
        return rewriteChildren(uOper);
    }

    @Override
    public Expr visitBinOper(@Nonnull BinOper binOper) {
        return rewriteChildren(binOper);
    }

    @Override
    public Expr visitSubquery(@Nonnull Subquery subquery) {
        throw subquery.unsupported("target list rewrite");
    }

    @Override
    public Expr visitInValues(@Nonnull InValues inValues) {
        return rewriteChildren(inValues);
    }

    @Override
    public Expr visitCharLength(@Nonnull CharLengthExpr charLength) {
        return rewriteChildren(charLength);
    }

    @Override
    public Expr visitLike(@Nonnull LikeExpr like) {
        return rewriteChildren(like);
    }

    @Override
    public Expr visitAggregate(@Nonnull AggExpr aggregate) {
        return rewriteChildren(aggregate);
    }

    @Override
    public Expr visitCase(@Nonnull CaseExpr caseExpr) {
        return rewriteChildren(caseExpr);
    }

    @Override
    public Expr visitExtract(@Nonnull ExtractExpr extract) {
        return rewriteChildren(extract);
    }

    @Override
    public Expr visitDatetrunc(@Nonnull DatetruncExpr datetrunc) {
        return rewriteChildren(datetrunc);
    }
}
