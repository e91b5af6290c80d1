/*
 * BinOper.java
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
import io.kestrel.analyzer.types.TypeCoercion;
import io.kestrel.analyzer.types.TypeInfo;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A binary operator: comparison, arithmetic or logical connective. The {@link Qualifier} is {@link Qualifier#ONE}
 * unless the right operand is a subquery compared with {@code ANY} or {@code ALL}.
 */
@API(API.Status.UNSTABLE)
public final class BinOper extends Expr {
    @Nonnull
    private final SqlOperator operator;
    @Nonnull
    private final Qualifier qualifier;
    @Nonnull
    private final Expr leftOperand;
    @Nonnull
    private final Expr rightOperand;

    public BinOper(@Nonnull TypeInfo typeInfo, boolean containsAggregate, @Nonnull SqlOperator operator,
                   @Nonnull Qualifier qualifier, @Nonnull Expr leftOperand, @Nonnull Expr rightOperand) {
        super(typeInfo, containsAggregate);
        Preconditions.checkArgument(!operator.isUnary(), "not a binary operator: %s", operator);
        this.operator = operator;
        this.qualifier = qualifier;
        this.leftOperand = leftOperand;
        this.rightOperand = rightOperand;
    }

    @Nonnull
    public static BinOper create(@Nonnull SqlOperator operator, @Nonnull Expr left, @Nonnull Expr right) {
        return create(operator, Qualifier.ONE, left, right, true);
    }

    /**
     * Build a typed binary operation. Operands whose type differs from the one the operation needs are cast. In a
     * comparison, a string literal facing a non-string operand is first converted to that operand's type, which
     * succeeds only if the string parses exactly.
     * @param operator a binary operator
     * @param qualifier {@code ANY} or {@code ALL} for a comparison with a subquery, otherwise {@code ONE}
     * @param left the left operand
     * @param right the right operand
     * @param coerceStringLiterals whether to convert string literals in comparisons
     * @return a new node whose nullability is the conjunction of the operands'
     * @throws io.kestrel.analyzer.TypeException if the operands have no valid common type
     */
    @Nonnull
    public static BinOper create(@Nonnull SqlOperator operator, @Nonnull Qualifier qualifier,
                                 @Nonnull Expr left, @Nonnull Expr right, boolean coerceStringLiterals) {
        Preconditions.checkArgument(!operator.isUnary(), "not a binary operator: %s", operator);
        Expr newLeft = left;
        Expr newRight = right;
        if (operator.isComparison() && coerceStringLiterals) {
            newLeft = coerceStringLiteral(newLeft, newRight);
            newRight = coerceStringLiteral(newRight, newLeft);
        }
        final TypeCoercion.BinaryOperationTypes types = TypeCoercion.analyzeBinaryOperation(operator.getOperationKind(),
                newLeft.getTypeInfo(), newRight.getTypeInfo());
        newLeft = newLeft.addCast(types.getLeftType());
        newRight = newRight.addCast(types.getRightType());
        return new BinOper(types.getResultType(), newLeft.containsAggregate() || newRight.containsAggregate(),
                operator, qualifier, newLeft, newRight);
    }

    @Nonnull
    static Expr coerceStringLiteral(@Nonnull Expr literal, @Nonnull Expr other) {
        final TypeInfo otherType = other.getTypeInfo();
        if (literal instanceof Constant && literal.getTypeInfo().isString()
                && !otherType.isString() && !otherType.isNullType() && !otherType.isArray()) {
            return literal.addCast(otherType.withoutEncoding().withNotNull(true));
        }
        return literal;
    }

    @Nonnull
    public SqlOperator getOperator() {
        return operator;
    }

    @Nonnull
    public Qualifier getQualifier() {
        return qualifier;
    }

    @Nonnull
    public Expr getLeftOperand() {
        return leftOperand;
    }

    @Nonnull
    public Expr getRightOperand() {
        return rightOperand;
    }

    @Override
    public void groupPredicates(@Nonnull List<Expr> scanPredicates,
                                @Nonnull List<Expr> joinPredicates,
                                @Nonnull List<Expr> constPredicates) {
        if (operator == SqlOperator.AND) {
            leftOperand.groupPredicates(scanPredicates, joinPredicates, constPredicates);
            rightOperand.groupPredicates(scanPredicates, joinPredicates, constPredicates);
        } else {
            super.groupPredicates(scanPredicates, joinPredicates, constPredicates);
        }
    }

    @Nonnull
    @Override
    public Optional<SimplePredicate> normalizeSimplePredicate() {
        if (!operator.isComparison() || qualifier != Qualifier.ONE) {
            return Optional.empty();
        }
        if (isBareColumn(leftOperand) && rightOperand.isColumnFree()) {
            return Optional.of(new SimplePredicate((BinOper)deepCopy(), ((ColumnVar)leftOperand).getRangeTableIndex()));
        }
        if (isBareColumn(rightOperand) && leftOperand.isColumnFree()) {
            final BinOper swapped = new BinOper(getTypeInfo(), containsAggregate(), operator.commute(), qualifier,
                    rightOperand.deepCopy(), leftOperand.deepCopy());
            return Optional.of(new SimplePredicate(swapped, ((ColumnVar)rightOperand).getRangeTableIndex()));
        }
        return Optional.empty();
    }

    private static boolean isBareColumn(@Nonnull Expr expr) {
        return expr.getClass() == ColumnVar.class;
    }

    @Nonnull
    @Override
    public List<Expr> getChildren() {
        return ImmutableList.of(leftOperand, rightOperand);
    }

    @Nonnull
    @Override
    protected Expr withChildren(@Nonnull List<Expr> newChildren) {
        Preconditions.checkArgument(newChildren.size() == 2);
        return new BinOper(getTypeInfo(), containsAggregate(), operator, qualifier, newChildren.get(0), newChildren.get(1));
    }

    @Override
    protected boolean equalsWithoutChildren(@Nonnull Expr other) {
        final BinOper otherOper = (BinOper)other;
        return operator == otherOper.operator && qualifier == otherOper.qualifier;
    }

    @Override
    protected int hashCodeWithoutChildren() {
        return Objects.hash(operator, qualifier);
    }

    @Override
    public <T> T accept(@Nonnull ExprVisitor<T> visitor) {
        return visitor.visitBinOper(this);
    }
}
