/*
 * ExplainExprVisitor.java
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
import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an expression tree as compact SQL-like text, for logging and debugging. Columns print as
 * {@code $rte.table.column} and {@code Var}s as {@code row#varno}.
 */
@API(API.Status.UNSTABLE)
public class ExplainExprVisitor implements ExprVisitor<String> {

    @Nonnull
    private String explain(@Nonnull Expr expr) {
        return expr.accept(this);
    }

    @Nonnull
    private String explainAll(@Nonnull List<Expr> exprs) {
        return exprs.stream().map(this::explain).collect(Collectors.joining(", "));
    }

    @Override
    public String visitColumnVar(@Nonnull ColumnVar columnVar) {
        return "$" + columnVar.getRangeTableIndex() + "." + columnVar.getTableId() + "." + columnVar.getColumnId();
    }

    @Override
    public String visitVar(@Nonnull Var var) {
        return var.getWhichRow() + "#" + var.getVarNo();
    }

    @Override
    public String visitConstant(@Nonnull Constant constant) {
        final Object value = constant.getValue();
        if (value == null) {
            return "NULL";
        }
        if (constant.getTypeInfo().isString() || constant.getTypeInfo().isTime()) {
            return "'" + LiteralCasts.toText(value).replace("'", "''") + "'";
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal)value).toPlainString();
        }
        return value.toString();
    }

    @Override
    public String visitUOper(@Nonnull UOper uOper) {
        switch (uOper.getOperator()) {
            case CAST:
                return "CAST(" + explain(uOper.getOperand()) + " AS " + uOper.getTypeInfo() + ")";
            case IS_NULL:
                return "(" + explain(uOper.getOperand()) + " IS NULL)";
            case UMINUS:
                return "(-" + explain(uOper.getOperand()) + ")";
            default:
                return uOper.getOperator().getSymbol() + "(" + explain(uOper.getOperand()) + ")";
        }
    }

    @Override
    public String visitBinOper(@Nonnull BinOper binOper) {
        final String qualifier = binOper.getQualifier() == Qualifier.ONE ? "" : binOper.getQualifier() + " ";
        return "(" + explain(binOper.getLeftOperand()) + " " + binOper.getOperator().getSymbol() + " "
               + qualifier + explain(binOper.getRightOperand()) + ")";
    }

    @Override
    public String visitSubquery(@Nonnull Subquery subquery) {
        return "(subquery)";
    }

    @Override
    public String visitInValues(@Nonnull InValues inValues) {
        return "(" + explain(inValues.getArg()) + " IN (" + explainAll(inValues.getValues()) + "))";
    }

    @Override
    public String visitCharLength(@Nonnull CharLengthExpr charLength) {
        return (charLength.isCalcEncodedLength() ? "LENGTH(" : "CHAR_LENGTH(") + explain(charLength.getArg()) + ")";
    }

    @Override
    public String visitLike(@Nonnull LikeExpr like) {
        final StringBuilder sb = new StringBuilder("(")
                .append(explain(like.getArg()))
                .append(like.isIlike() ? " ILIKE " : " LIKE ")
                .append(explain(like.getPattern()));
        if (like.getEscape() != null) {
            sb.append(" ESCAPE ").append(explain(like.getEscape()));
        }
        return sb.append(")").toString();
    }

    @Override
    public String visitAggregate(@Nonnull AggExpr aggregate) {
        final Expr arg = aggregate.getArg();
        return aggregate.getKind() + "(" + (aggregate.isDistinct() ? "DISTINCT " : "")
               + (arg == null ? "*" : explain(arg)) + ")";
    }

    @Override
    public String visitCase(@Nonnull CaseExpr caseExpr) {
        final StringBuilder sb = new StringBuilder("CASE");
        for (CaseExpr.WhenClause whenClause : caseExpr.getWhenClauses()) {
            sb.append(" WHEN ").append(explain(whenClause.getCondition()))
                    .append(" THEN ").append(explain(whenClause.getResult()));
        }
        if (caseExpr.getElseExpr() != null) {
            sb.append(" ELSE ").append(explain(caseExpr.getElseExpr()));
        }
        return sb.append(" END").toString();
    }

    @Override
    public String visitExtract(@Nonnull ExtractExpr extract) {
        return "EXTRACT(" + extract.getField() + " FROM " + explain(extract.getFrom()) + ")";
    }

    @Override
    public String visitDatetrunc(@Nonnull DatetruncExpr datetrunc) {
        return "DATE_TRUNC(" + datetrunc.getField() + ", " + explain(datetrunc.getFrom()) + ")";
    }
}
