/*
 * TypeCoercion.java
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

package io.kestrel.analyzer.types;

import io.kestrel.analyzer.ErrorCode;
import io.kestrel.analyzer.TypeException;
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;

/**
 * Type promotion rules: the common type of two operands and the operand types a binary operation requires.
 *
 * <p>
 * Numbers promote along integers (by width), then fixed-point, then {@code FLOAT}, then {@code DOUBLE}. Mixing an
 * integer with a fixed-point value keeps the fixed-point scale and widens the precision to fit the integer's digits;
 * two fixed-point values combine the larger integer part with the larger scale. Precision never exceeds
 * {@link SqlTypeName#MAX_DECIMAL_PRECISION}. The nullability of a common type is the conjunction of the operands'.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class TypeCoercion {

    /**
     * The typing rule a binary operator follows.
     */
    public enum OperationKind {
        /** {@code AND}, {@code OR}: boolean operands, boolean result. */
        LOGIC,
        /** Comparisons: operands of one family, boolean result. */
        COMPARISON,
        /** {@code + - * /}: numeric operands, result of the common numeric type. */
        ARITHMETIC,
        /** {@code %}: integer operands. */
        INTEGER_ARITHMETIC
    }

    /**
     * Result of {@link #analyzeBinaryOperation}: the type of the operation and the type each operand must be cast to.
     * An operand type equal to the operand's current type means no cast is needed.
     */
    public static final class BinaryOperationTypes {
        @Nonnull
        private final TypeInfo resultType;
        @Nonnull
        private final TypeInfo leftType;
        @Nonnull
        private final TypeInfo rightType;

        BinaryOperationTypes(@Nonnull TypeInfo resultType, @Nonnull TypeInfo leftType, @Nonnull TypeInfo rightType) {
            this.resultType = resultType;
            this.leftType = leftType;
            this.rightType = rightType;
        }

        @Nonnull
        public TypeInfo getResultType() {
            return resultType;
        }

        @Nonnull
        public TypeInfo getLeftType() {
            return leftType;
        }

        @Nonnull
        public TypeInfo getRightType() {
            return rightType;
        }
    }

    private TypeCoercion() {
    }

    /**
     * Compute the common type of two numeric types.
     * @param a first operand type
     * @param b second operand type
     * @return an unencoded numeric type both operands convert to without loss of integer digits
     * @throws TypeException if either type is not a number
     */
    @Nonnull
    public static TypeInfo commonNumericType(@Nonnull TypeInfo a, @Nonnull TypeInfo b) {
        if (!a.isNumber() || !b.isNumber()) {
            throw mismatch("no common numeric type", a, b);
        }
        final boolean notNull = a.isNotNull() && b.isNotNull();
        if (a.isFloatingPoint() || b.isFloatingPoint()) {
            final SqlTypeName approximate = a.getType() == SqlTypeName.DOUBLE || b.getType() == SqlTypeName.DOUBLE
                                            ? SqlTypeName.DOUBLE : SqlTypeName.FLOAT;
            return TypeInfo.of(approximate, notNull);
        }
        if (a.isInteger() && b.isInteger()) {
            final SqlTypeName wider = a.getType().getIntegerDigits() >= b.getType().getIntegerDigits() ? a.getType() : b.getType();
            return TypeInfo.of(wider, notNull);
        }
        if (a.isInteger() || b.isInteger()) {
            final TypeInfo integer = a.isInteger() ? a : b;
            final TypeInfo fixed = a.isInteger() ? b : a;
            final int precision = Math.min(SqlTypeName.MAX_DECIMAL_PRECISION,
                    Math.max(integer.getType().getIntegerDigits() + fixed.getScale(), fixed.getDimension()));
            return TypeInfo.fixedPoint(fixed.getType(), precision, fixed.getScale(), notNull);
        }
        final int integerDigits = Math.max(a.getDimension() - a.getScale(), b.getDimension() - b.getScale());
        final int scale = Math.max(a.getScale(), b.getScale());
        final int precision = Math.min(SqlTypeName.MAX_DECIMAL_PRECISION, integerDigits + scale);
        final SqlTypeName fixedType = a.getType() == b.getType() ? a.getType() : SqlTypeName.DECIMAL;
        return TypeInfo.fixedPoint(fixedType, precision, scale, notNull);
    }

    /**
     * Compute the common type of two string types. {@code TEXT} absorbs everything, {@code VARCHAR} absorbs
     * {@code CHAR}, and two {@code CHAR}s of different lengths become {@code VARCHAR}. An unbounded {@code VARCHAR}
     * (length {@code 0}) stays unbounded. The encoding survives only if both sides share it.
     * @param a first operand type
     * @param b second operand type
     * @return the more general string type
     * @throws TypeException if either type is not a string
     */
    @Nonnull
    public static TypeInfo commonStringType(@Nonnull TypeInfo a, @Nonnull TypeInfo b) {
        if (!a.isString() || !b.isString()) {
            throw mismatch("no common string type", a, b);
        }
        final boolean notNull = a.isNotNull() && b.isNotNull();
        final TypeInfo common;
        if (a.getType() == SqlTypeName.TEXT || b.getType() == SqlTypeName.TEXT) {
            common = TypeInfo.string(SqlTypeName.TEXT, 0, notNull);
        } else if (a.getType() == SqlTypeName.CHAR && b.getType() == SqlTypeName.CHAR && a.getDimension() == b.getDimension()) {
            common = TypeInfo.string(SqlTypeName.CHAR, a.getDimension(), notNull);
        } else {
            final int length = a.getDimension() == 0 || b.getDimension() == 0 ? 0 : Math.max(a.getDimension(), b.getDimension());
            common = TypeInfo.string(SqlTypeName.VARCHAR, length, notNull);
        }
        if (a.getEncoding() == b.getEncoding() && a.getEncodingParam() == b.getEncodingParam() && a.isEncoded()) {
            return common.withEncoding(a.getEncoding(), a.getEncodingParam());
        }
        return common;
    }

    /**
     * Compute the common type of two date/time types. {@code DATE} and {@code TIMESTAMP} promote to
     * {@code TIMESTAMP}; {@code TIME} only combines with {@code TIME}.
     * @param a first operand type
     * @param b second operand type
     * @return the common time type
     * @throws TypeException if the types cannot be combined
     */
    @Nonnull
    public static TypeInfo commonTimeType(@Nonnull TypeInfo a, @Nonnull TypeInfo b) {
        if (!a.isTime() || !b.isTime()) {
            throw mismatch("no common time type", a, b);
        }
        final boolean notNull = a.isNotNull() && b.isNotNull();
        if (a.getType() == b.getType()) {
            return TypeInfo.of(a.getType(), notNull);
        }
        if (a.getType() == SqlTypeName.TIME || b.getType() == SqlTypeName.TIME) {
            throw mismatch("no common time type", a, b);
        }
        return TypeInfo.of(SqlTypeName.TIMESTAMP, notNull);
    }

    /**
     * Compute the least upper bound of two types, as needed for the results of a {@code CASE} or the columns of a
     * {@code UNION}. The null type yields the other type, made nullable.
     * @param a first type
     * @param b second type
     * @return the common type
     * @throws TypeException if the types belong to incompatible families
     */
    @Nonnull
    public static TypeInfo commonType(@Nonnull TypeInfo a, @Nonnull TypeInfo b) {
        if (a.isNullType()) {
            return b.withNotNull(false);
        }
        if (b.isNullType()) {
            return a.withNotNull(false);
        }
        final boolean notNull = a.isNotNull() && b.isNotNull();
        if (a.withNotNull(notNull).equals(b.withNotNull(notNull))) {
            return a.withNotNull(notNull);
        }
        if (a.isNumber() && b.isNumber()) {
            return commonNumericType(a, b);
        }
        if (a.isString() && b.isString()) {
            return commonStringType(a, b);
        }
        if (a.isTime() && b.isTime()) {
            return commonTimeType(a, b);
        }
        if (a.isSameType(b)) {
            return a.withoutEncoding().withNotNull(notNull);
        }
        throw mismatch("no common type", a, b);
    }

    /**
     * Work out the types of a binary operation.
     * @param kind the typing rule of the operator
     * @param left type of the left operand
     * @param right type of the right operand
     * @return the result type and the types the operands must be cast to
     * @throws TypeException if the operands are not valid for the operation
     */
    @Nonnull
    public static BinaryOperationTypes analyzeBinaryOperation(@Nonnull OperationKind kind,
                                                              @Nonnull TypeInfo left, @Nonnull TypeInfo right) {
        final boolean notNull = left.isNotNull() && right.isNotNull();
        switch (kind) {
            case LOGIC:
                if (!isBooleanOrNull(left) || !isBooleanOrNull(right)) {
                    throw mismatch("logical operator needs boolean operands", left, right);
                }
                return new BinaryOperationTypes(TypeInfo.of(SqlTypeName.BOOLEAN, notNull),
                        retype(left, TypeInfo.of(SqlTypeName.BOOLEAN)), retype(right, TypeInfo.of(SqlTypeName.BOOLEAN)));
            case COMPARISON:
                return new BinaryOperationTypes(TypeInfo.of(SqlTypeName.BOOLEAN, notNull),
                        comparisonOperandType(left, right), comparisonOperandType(right, left));
            case INTEGER_ARITHMETIC:
                if (!isIntegerOrNull(left) || !isIntegerOrNull(right)) {
                    throw mismatch("operator needs integer operands", left, right);
                }
                return arithmetic(left, right, notNull);
            case ARITHMETIC:
                if (!isNumberOrNull(left) || !isNumberOrNull(right)) {
                    throw mismatch("arithmetic operator needs numeric operands", left, right);
                }
                return arithmetic(left, right, notNull);
            default:
                throw new TypeException("unknown operation kind", ErrorCode.INTERNAL_ERROR, LogMessageKeys.OPERATOR, kind);
        }
    }

    @Nonnull
    private static BinaryOperationTypes arithmetic(@Nonnull TypeInfo left, @Nonnull TypeInfo right, boolean notNull) {
        if (left.isNullType() && right.isNullType()) {
            return new BinaryOperationTypes(TypeInfo.NULL, left, right);
        }
        final TypeInfo common;
        if (left.isNullType()) {
            common = right.withoutEncoding();
        } else if (right.isNullType()) {
            common = left.withoutEncoding();
        } else {
            common = commonNumericType(left, right);
        }
        return new BinaryOperationTypes(common.withNotNull(notNull), retype(left, common), retype(right, common));
    }

    @Nonnull
    private static TypeInfo comparisonOperandType(@Nonnull TypeInfo operand, @Nonnull TypeInfo other) {
        if (operand.isNullType()) {
            return other.isNullType() ? operand : other.withoutEncoding().withNotNull(false);
        }
        if (other.isNullType()) {
            return operand;
        }
        if (operand.isNumber() && other.isNumber()) {
            return retype(operand, commonNumericType(operand, other));
        }
        if (operand.isString() && other.isString()) {
            return operand;
        }
        if (operand.isTime() && other.isTime()) {
            return retype(operand, commonTimeType(operand, other));
        }
        if (operand.isBoolean() && other.isBoolean()) {
            return operand;
        }
        if (operand.isArray() && operand.isSameType(other)) {
            return operand;
        }
        throw mismatch("cannot compare values of these types", operand, other);
    }

    /**
     * Keep an operand's own type if it is already the required logical type, so that encoded columns are not
     * decompressed for nothing.
     */
    @Nonnull
    private static TypeInfo retype(@Nonnull TypeInfo operand, @Nonnull TypeInfo required) {
        if (operand.isSameType(required)) {
            return operand;
        }
        return required.withoutEncoding().withNotNull(operand.isNotNull());
    }

    private static boolean isBooleanOrNull(@Nonnull TypeInfo type) {
        return type.isBoolean() || type.isNullType();
    }

    private static boolean isIntegerOrNull(@Nonnull TypeInfo type) {
        return type.isInteger() || type.isNullType();
    }

    private static boolean isNumberOrNull(@Nonnull TypeInfo type) {
        return type.isNumber() || type.isNullType();
    }

    @Nonnull
    private static TypeException mismatch(@Nonnull String message, @Nonnull TypeInfo left, @Nonnull TypeInfo right) {
        return new TypeException(message, LogMessageKeys.LEFT_TYPE, left, LogMessageKeys.RIGHT_TYPE, right);
    }
}
