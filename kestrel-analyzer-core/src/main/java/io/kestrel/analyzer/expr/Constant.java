/*
 * Constant.java
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
import io.kestrel.analyzer.ErrorCode;
import io.kestrel.analyzer.TypeException;
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeInfo;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A literal value. The value is held as an instance of {@link SqlTypeName#getJavaClass()} of the constant's type:
 * a {@link BigDecimal} whose scale is the type's scale for fixed-point types, an unmodifiable {@link List} of
 * element values for arrays, and {@code null} for a SQL {@code NULL}. A non-null constant's type is always
 * {@code NOT NULL}.
 */
@API(API.Status.UNSTABLE)
public final class Constant extends Expr {
    private final boolean isNull;
    @Nullable
    private final Object value;

    private Constant(@Nonnull TypeInfo typeInfo, @Nullable Object value) {
        super(typeInfo.withNotNull(value != null), false);
        this.isNull = value == null;
        this.value = value;
    }

    /**
     * Create a non-null constant.
     * @param typeInfo the type of the constant
     * @param value the literal, an instance of the type's Java class
     * @return a new constant
     * @throws IllegalArgumentException if the value does not match the type
     */
    @Nonnull
    public static Constant of(@Nonnull TypeInfo typeInfo, @Nonnull Object value) {
        validate(typeInfo, value);
        return new Constant(typeInfo, value instanceof List ? Collections.unmodifiableList(new ArrayList<>((List<?>)value)) : value);
    }

    /**
     * Create a SQL {@code NULL} of the given type.
     * @param typeInfo the type, usually {@link TypeInfo#NULL} until the constant is cast
     * @return a new null constant
     */
    @Nonnull
    public static Constant nullOf(@Nonnull TypeInfo typeInfo) {
        return new Constant(typeInfo, null);
    }

    @Nonnull
    public static Constant ofBoolean(boolean value) {
        return new Constant(TypeInfo.of(SqlTypeName.BOOLEAN, true), value);
    }

    @Nonnull
    public static Constant ofInt(int value) {
        return new Constant(TypeInfo.of(SqlTypeName.INT, true), value);
    }

    @Nonnull
    public static Constant ofLong(long value) {
        return new Constant(TypeInfo.of(SqlTypeName.BIGINT, true), value);
    }

    @Nonnull
    public static Constant ofFloat(float value) {
        return of(TypeInfo.of(SqlTypeName.FLOAT, true), value);
    }

    @Nonnull
    public static Constant ofDouble(double value) {
        return of(TypeInfo.of(SqlTypeName.DOUBLE, true), value);
    }

    /**
     * Create a fixed-point constant whose precision and scale are those of the value.
     * @param value the literal
     * @return a new {@code DECIMAL} constant
     * @throws TypeException if the value has more digits than a fixed-point type can hold
     */
    @Nonnull
    public static Constant ofDecimal(@Nonnull BigDecimal value) {
        if (value.signum() != 0 && (long)value.precision() - value.scale() > SqlTypeName.MAX_DECIMAL_PRECISION) {
            throw tooManyDigits(value);
        }
        final BigDecimal normalized = value.scale() < 0 ? value.setScale(0) : value;
        final int precision = Math.max(normalized.precision(), normalized.scale());
        if (precision > SqlTypeName.MAX_DECIMAL_PRECISION) {
            throw tooManyDigits(value);
        }
        return new Constant(TypeInfo.decimal(Math.max(precision, 1), normalized.scale(), true), normalized);
    }

    @Nonnull
    private static TypeException tooManyDigits(@Nonnull BigDecimal value) {
        return new TypeException("numeric literal has too many digits", ErrorCode.NUMERIC_VALUE_OUT_OF_RANGE,
                LogMessageKeys.VALUE, value);
    }

    /**
     * Create a string constant typed {@code VARCHAR} of the literal's length.
     * @param value the literal
     * @return a new string constant
     */
    @Nonnull
    public static Constant ofString(@Nonnull String value) {
        return new Constant(TypeInfo.string(SqlTypeName.VARCHAR, value.length(), true), value);
    }

    @Nonnull
    public static Constant ofDate(@Nonnull LocalDate value) {
        return new Constant(TypeInfo.of(SqlTypeName.DATE, true), value);
    }

    @Nonnull
    public static Constant ofTime(@Nonnull LocalTime value) {
        return new Constant(TypeInfo.of(SqlTypeName.TIME, true), value);
    }

    @Nonnull
    public static Constant ofTimestamp(@Nonnull LocalDateTime value) {
        return new Constant(TypeInfo.of(SqlTypeName.TIMESTAMP, true), value);
    }

    private static void validate(@Nonnull TypeInfo typeInfo, @Nonnull Object value) {
        final SqlTypeName type = typeInfo.getType();
        Preconditions.checkArgument(type != SqlTypeName.NULLT, "the null type has no values");
        Preconditions.checkArgument(type.getJavaClass().isInstance(value),
                "%s literal must be a %s, not %s", type, type.getJavaClass().getSimpleName(), value.getClass().getSimpleName());
        if (typeInfo.isDecimal()) {
            final BigDecimal decimal = (BigDecimal)value;
            Preconditions.checkArgument(decimal.scale() == typeInfo.getScale(), "literal scale does not match %s", typeInfo);
            Preconditions.checkArgument(LiteralCasts.fitsPrecision(decimal, typeInfo.getDimension()),
                    "literal does not fit %s", typeInfo);
        } else if (value instanceof Float) {
            Preconditions.checkArgument(Float.isFinite((Float)value), "literal must be finite");
        } else if (value instanceof Double) {
            Preconditions.checkArgument(Double.isFinite((Double)value), "literal must be finite");
        } else if (typeInfo.isBoundedString()) {
            Preconditions.checkArgument(((String)value).length() <= typeInfo.getDimension(), "literal too long for %s", typeInfo);
        } else if (typeInfo.isArray()) {
            final Class<?> elementClass = Objects.requireNonNull(typeInfo.getElementType()).getJavaClass();
            for (Object element : (List<?>)value) {
                Preconditions.checkArgument(element == null || elementClass.isInstance(element),
                        "array element must be a %s", elementClass.getSimpleName());
            }
        }
    }

    public boolean isNull() {
        return isNull;
    }

    /**
     * Get the literal.
     * @return the value, or {@code null} for a SQL {@code NULL}
     */
    @Nullable
    public Object getValue() {
        return value;
    }

    /**
     * Convert this literal to another type.
     * @param target the type to convert to
     * @return a constant of type {@code target} holding the converted value
     * @throws TypeException if the value cannot be represented exactly in {@code target}
     */
    @Nonnull
    @Override
    public Expr addCast(@Nonnull TypeInfo target) {
        if (needsNoCast(target)) {
            return this;
        }
        if (isNull) {
            if (!getTypeInfo().isCastableTo(target)) {
                throw new TypeException("cannot cast", ErrorCode.CANNOT_COERCE,
                        LogMessageKeys.TYPE, getTypeInfo(), LogMessageKeys.TARGET_TYPE, target);
            }
            return new Constant(target, null);
        }
        return new Constant(target, LiteralCasts.convert(Objects.requireNonNull(value), getTypeInfo(), target));
    }

    @Nonnull
    @Override
    public List<Expr> getDomain() {
        return ImmutableList.of(this);
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
        return new Constant(getTypeInfo(), value);
    }

    @Override
    protected boolean equalsWithoutChildren(@Nonnull Expr other) {
        final Constant otherConstant = (Constant)other;
        return isNull == otherConstant.isNull && Objects.equals(value, otherConstant.value);
    }

    @Override
    protected int hashCodeWithoutChildren() {
        return Objects.hash(isNull, value);
    }

    @Override
    public <T> T accept(@Nonnull ExprVisitor<T> visitor) {
        return visitor.visitConstant(this);
    }
}
