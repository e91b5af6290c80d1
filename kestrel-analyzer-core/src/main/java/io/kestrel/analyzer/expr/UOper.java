/*
 * UOper.java
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
import io.kestrel.analyzer.TypeException;
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeInfo;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A unary operator: {@code -x}, {@code NOT x}, {@code x IS NULL}, {@code EXISTS (subquery)}, {@code CAST(x AS t)}
 * or {@code UNNEST(array)}.
 */
@API(API.Status.UNSTABLE)
public final class UOper extends Expr {
    @Nonnull
    private final SqlOperator operator;
    @Nonnull
    private final Expr operand;

    public UOper(@Nonnull TypeInfo typeInfo, boolean containsAggregate, @Nonnull SqlOperator operator, @Nonnull Expr operand) {
        super(typeInfo, containsAggregate);
        Preconditions.checkArgument(operator.isUnary(), "not a unary operator: %s", operator);
        this.operator = operator;
        this.operand = operand;
    }

    /**
     * Build a typed unary operation. The result may be null whenever the operand may be, except for
     * {@code IS NULL} and {@code EXISTS}, which are never null. Use {@link Expr#addCast(TypeInfo)} for casts.
     * @param operator a unary operator other than {@link SqlOperator#CAST}
     * @param operand the operand
     * @return a new node
     * @throws TypeException if the operand type is not valid for the operator
     */
    @Nonnull
    public static UOper create(@Nonnull SqlOperator operator, @Nonnull Expr operand) {
        final TypeInfo operandType = operand.getTypeInfo();
        final TypeInfo resultType;
        switch (operator) {
            case UMINUS:
                check(operandType.isNumber() || operandType.isNullType(), operator, operandType);
                resultType = operandType.withoutEncoding();
                break;
            case NOT:
                check(operandType.isBoolean() || operandType.isNullType(), operator, operandType);
                resultType = TypeInfo.of(SqlTypeName.BOOLEAN, operandType.isNotNull());
                break;
            case IS_NULL:
                resultType = TypeInfo.of(SqlTypeName.BOOLEAN, true);
                break;
            case EXISTS:
                check(operand instanceof Subquery, operator, operandType);
                resultType = TypeInfo.of(SqlTypeName.BOOLEAN, true);
                break;
            case UNNEST:
                check(operandType.isArray(), operator, operandType);
                resultType = operandType.getElementTypeInfo();
                break;
            case CAST:
            default:
                throw new IllegalArgumentException("cannot create unary operation " + operator);
        }
        return new UOper(resultType, operand.containsAggregate(), operator, operand);
    }

    private static void check(boolean valid, @Nonnull SqlOperator operator, @Nonnull TypeInfo operandType) {
        if (!valid) {
            throw new TypeException("invalid operand type for operator",
                    LogMessageKeys.OPERATOR, operator, LogMessageKeys.TYPE, operandType);
        }
    }

    @Nonnull
    public SqlOperator getOperator() {
        return operator;
    }

    @Nonnull
    public Expr getOperand() {
        return operand;
    }

    public boolean isCast() {
        return operator == SqlOperator.CAST;
    }

    @Nonnull
    @Override
    public List<Expr> getChildren() {
        return ImmutableList.of(operand);
    }

    @Nonnull
    @Override
    protected Expr withChildren(@Nonnull List<Expr> newChildren) {
        Preconditions.checkArgument(newChildren.size() == 1);
        return new UOper(getTypeInfo(), containsAggregate(), operator, newChildren.get(0));
    }

    @Override
    protected boolean equalsWithoutChildren(@Nonnull Expr other) {
        return operator == ((UOper)other).operator;
    }

    @Override
    protected int hashCodeWithoutChildren() {
        return operator.hashCode();
    }

    @Override
    public <T> T accept(@Nonnull ExprVisitor<T> visitor) {
        return visitor.visitUOper(this);
    }
}
