/*
 * SqlOperator.java
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

import io.kestrel.analyzer.types.TypeCoercion;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Operators of {@link UOper} and {@link BinOper} nodes.
 */
@API(API.Status.UNSTABLE)
public enum SqlOperator {
    EQ("=", TypeCoercion.OperationKind.COMPARISON),
    NE("<>", TypeCoercion.OperationKind.COMPARISON),
    LT("<", TypeCoercion.OperationKind.COMPARISON),
    GT(">", TypeCoercion.OperationKind.COMPARISON),
    LE("<=", TypeCoercion.OperationKind.COMPARISON),
    GE(">=", TypeCoercion.OperationKind.COMPARISON),
    AND("AND", TypeCoercion.OperationKind.LOGIC),
    OR("OR", TypeCoercion.OperationKind.LOGIC),
    MINUS("-", TypeCoercion.OperationKind.ARITHMETIC),
    PLUS("+", TypeCoercion.OperationKind.ARITHMETIC),
    MULTIPLY("*", TypeCoercion.OperationKind.ARITHMETIC),
    DIVIDE("/", TypeCoercion.OperationKind.ARITHMETIC),
    MODULO("%", TypeCoercion.OperationKind.INTEGER_ARITHMETIC),
    // unary
    NOT("NOT", null),
    UMINUS("-", null),
    IS_NULL("IS NULL", null),
    EXISTS("EXISTS", null),
    CAST("CAST", null),
    UNNEST("UNNEST", null);

    @Nonnull
    private final String symbol;
    @Nullable
    private final TypeCoercion.OperationKind operationKind;

    SqlOperator(@Nonnull String symbol, @Nullable TypeCoercion.OperationKind operationKind) {
        this.symbol = symbol;
        this.operationKind = operationKind;
    }

    @Nonnull
    public String getSymbol() {
        return symbol;
    }

    public boolean isUnary() {
        return operationKind == null;
    }

    public boolean isComparison() {
        return operationKind == TypeCoercion.OperationKind.COMPARISON;
    }

    public boolean isLogic() {
        return operationKind == TypeCoercion.OperationKind.LOGIC;
    }

    public boolean isArithmetic() {
        return operationKind == TypeCoercion.OperationKind.ARITHMETIC
               || operationKind == TypeCoercion.OperationKind.INTEGER_ARITHMETIC;
    }

    /**
     * Get the typing rule of a binary operator.
     * @return the operation kind
     * @throws IllegalStateException for unary operators
     */
    @Nonnull
    public TypeCoercion.OperationKind getOperationKind() {
        if (operationKind == null) {
            throw new IllegalStateException("unary operator has no binary operation kind: " + this);
        }
        return operationKind;
    }

    /**
     * Get the comparison that gives the same result with its operands swapped, so that {@code a < b} is
     * {@code b > a}.
     * @return the commuted comparison
     * @throws IllegalStateException if this is not a comparison
     */
    @Nonnull
    public SqlOperator commute() {
        switch (this) {
            case EQ:
            case NE:
                return this;
            case LT:
                return GT;
            case GT:
                return LT;
            case LE:
                return GE;
            case GE:
                return LE;
            default:
                throw new IllegalStateException("cannot commute " + this);
        }
    }
}
