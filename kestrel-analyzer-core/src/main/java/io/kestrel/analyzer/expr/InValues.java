/*
 * InValues.java
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
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeCoercion;
import io.kestrel.analyzer.types.TypeInfo;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * The predicate {@code arg IN (v1, v2, ...)}.
 *
 * <p>
 * Under three-valued logic the predicate is {@code NULL} when no value matches and any value, or the probe, is
 * {@code NULL}. The result is therefore {@code NOT NULL} only if the probe and every value are.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class InValues extends Expr {
    @Nonnull
    private final Expr arg;
    @Nonnull
    private final List<Expr> values;

    public InValues(@Nonnull TypeInfo typeInfo, boolean containsAggregate, @Nonnull Expr arg, @Nonnull List<Expr> values) {
        super(typeInfo, containsAggregate);
        Preconditions.checkArgument(!values.isEmpty(), "IN list must not be empty");
        this.arg = arg;
        this.values = ImmutableList.copyOf(values);
    }

    /**
     * Build a typed {@code IN} predicate. The probe and the values are compared at one type: numbers are widened
     * to the common numeric type of the whole list, and dates and timestamps to the common time type. Strings,
     * booleans and arrays keep their own types.
     * @param arg the probe
     * @param values the list of values
     * @param coerceStringLiterals whether string literals are converted to the probe's type
     * @return a new node
     * @throws io.kestrel.analyzer.TypeException if a value cannot be compared with the probe
     */
    @Nonnull
    public static InValues create(@Nonnull Expr arg, @Nonnull List<? extends Expr> values, boolean coerceStringLiterals) {
        final List<Expr> coercedValues = new ArrayList<>(values.size());
        TypeInfo common = arg.getTypeInfo();
        for (Expr value : values) {
            final Expr coercedValue = coerceStringLiterals ? BinOper.coerceStringLiteral(value, arg) : value;
            common = TypeCoercion.analyzeBinaryOperation(TypeCoercion.OperationKind.COMPARISON,
                    common, coercedValue.getTypeInfo()).getLeftType();
            coercedValues.add(coercedValue);
        }
        final Expr typedArg = arg.addCast(comparedAs(arg.getTypeInfo(), common));
        final ImmutableList.Builder<Expr> typedValues = ImmutableList.builder();
        boolean notNull = typedArg.getTypeInfo().isNotNull();
        boolean containsAggregate = typedArg.containsAggregate();
        for (Expr value : coercedValues) {
            final Expr typedValue = value.addCast(comparedAs(value.getTypeInfo(), common));
            notNull &= typedValue.getTypeInfo().isNotNull();
            containsAggregate |= typedValue.containsAggregate();
            typedValues.add(typedValue);
        }
        return new InValues(TypeInfo.of(SqlTypeName.BOOLEAN, notNull), containsAggregate, typedArg, typedValues.build());
    }

    @Nonnull
    private static TypeInfo comparedAs(@Nonnull TypeInfo operand, @Nonnull TypeInfo common) {
        if (operand.isNullType()) {
            return common.isNullType() ? operand : common.withoutEncoding().withNotNull(false);
        }
        if ((common.isNumber() || common.isTime()) && !operand.isSameType(common)) {
            return common.withoutEncoding().withNotNull(operand.isNotNull());
        }
        return operand;
    }

    @Nonnull
    public Expr getArg() {
        return arg;
    }

    @Nonnull
    public List<Expr> getValues() {
        return values;
    }

    @Nonnull
    @Override
    public List<Expr> getChildren() {
        return ImmutableList.<Expr>builder().add(arg).addAll(values).build();
    }

    @Nonnull
    @Override
    protected Expr withChildren(@Nonnull List<Expr> newChildren) {
        Preconditions.checkArgument(newChildren.size() == values.size() + 1);
        return new InValues(getTypeInfo(), containsAggregate(), newChildren.get(0), newChildren.subList(1, newChildren.size()));
    }

    @Override
    protected boolean equalsWithoutChildren(@Nonnull Expr other) {
        return values.size() == ((InValues)other).values.size();
    }

    @Override
    protected int hashCodeWithoutChildren() {
        return values.size();
    }

    @Override
    public <T> T accept(@Nonnull ExprVisitor<T> visitor) {
        return visitor.visitInValues(this);
    }
}
