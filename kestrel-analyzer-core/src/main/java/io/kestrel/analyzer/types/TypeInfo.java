/*
 * TypeInfo.java
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

import com.google.common.base.Preconditions;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Immutable descriptor of the type of an expression: base type, element type for arrays, dimension (precision of a
 * fixed-point number or length of a string), scale, nullability and physical encoding.
 *
 * <p>
 * Two descriptors are equal only if every one of those attributes is equal. Use {@link #isSameType(TypeInfo)} to
 * compare the logical type alone.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class TypeInfo {
    public static final TypeInfo NULL = new TypeInfo(SqlTypeName.NULLT, null, 0, 0, false, EncodingType.NONE, 0);

    @Nonnull
    private final SqlTypeName type;
    @Nullable
    private final SqlTypeName elementType;
    private final int dimension;
    private final int scale;
    private final boolean notNull;
    @Nonnull
    private final EncodingType encoding;
    private final int encodingParam;

    private TypeInfo(@Nonnull SqlTypeName type, @Nullable SqlTypeName elementType, int dimension, int scale,
                     boolean notNull, @Nonnull EncodingType encoding, int encodingParam) {
        this.type = type;
        this.elementType = elementType;
        this.dimension = dimension;
        this.scale = scale;
        this.notNull = notNull;
        this.encoding = encoding;
        this.encodingParam = encodingParam;
    }

    /**
     * Create a nullable, unencoded descriptor for a type that takes no dimension.
     * Fixed-point types get the maximum precision and scale {@code 0}; strings are unbounded.
     * @param type the base type
     * @return a new descriptor
     */
    @Nonnull
    public static TypeInfo of(@Nonnull SqlTypeName type) {
        return of(type, false);
    }

    @Nonnull
    public static TypeInfo of(@Nonnull SqlTypeName type, boolean notNull) {
        Preconditions.checkArgument(type != SqlTypeName.ARRAY, "array types need an element type");
        if (type == SqlTypeName.NULLT) {
            return NULL;
        }
        if (type.isDecimal()) {
            return new TypeInfo(type, null, SqlTypeName.MAX_DECIMAL_PRECISION, 0, notNull, EncodingType.NONE, 0);
        }
        if (type == SqlTypeName.CHAR) {
            return new TypeInfo(type, null, 1, 0, notNull, EncodingType.NONE, 0);
        }
        return new TypeInfo(type, null, 0, 0, notNull, EncodingType.NONE, 0);
    }

    /**
     * Create a fixed-point descriptor.
     * @param precision total number of digits, between 1 and {@link SqlTypeName#MAX_DECIMAL_PRECISION}
     * @param scale digits after the decimal point, at most {@code precision}
     * @param notNull whether the value can never be null
     * @return a new {@link SqlTypeName#DECIMAL} descriptor
     */
    @Nonnull
    public static TypeInfo decimal(int precision, int scale, boolean notNull) {
        return fixedPoint(SqlTypeName.DECIMAL, precision, scale, notNull);
    }

    @Nonnull
    public static TypeInfo fixedPoint(@Nonnull SqlTypeName type, int precision, int scale, boolean notNull) {
        Preconditions.checkArgument(type.isDecimal(), "not a fixed-point type: %s", type);
        Preconditions.checkArgument(precision >= 1 && precision <= SqlTypeName.MAX_DECIMAL_PRECISION,
                "precision out of range: %s", precision);
        Preconditions.checkArgument(scale >= 0 && scale <= precision, "scale out of range: %s", scale);
        return new TypeInfo(type, null, precision, scale, notNull, EncodingType.NONE, 0);
    }

    /**
     * Create a string descriptor.
     * @param type {@link SqlTypeName#CHAR}, {@link SqlTypeName#VARCHAR} or {@link SqlTypeName#TEXT}
     * @param length maximum length, where {@code 0} means unbounded (not allowed for {@code CHAR}); ignored for {@code TEXT}
     * @param notNull whether the value can never be null
     * @return a new descriptor
     */
    @Nonnull
    public static TypeInfo string(@Nonnull SqlTypeName type, int length, boolean notNull) {
        Preconditions.checkArgument(type.isString(), "not a string type: %s", type);
        Preconditions.checkArgument(length >= 0, "negative length: %s", length);
        Preconditions.checkArgument(type != SqlTypeName.CHAR || length > 0, "CHAR needs a length");
        return new TypeInfo(type, null, type == SqlTypeName.TEXT ? 0 : length, 0, notNull, EncodingType.NONE, 0);
    }

    @Nonnull
    public static TypeInfo array(@Nonnull SqlTypeName elementType, boolean notNull) {
        Preconditions.checkArgument(elementType != SqlTypeName.ARRAY && elementType != SqlTypeName.NULLT,
                "invalid array element type: %s", elementType);
        return new TypeInfo(SqlTypeName.ARRAY, elementType, 0, 0, notNull, EncodingType.NONE, 0);
    }

    @Nonnull
    public SqlTypeName getType() {
        return type;
    }

    @Nullable
    public SqlTypeName getElementType() {
        return elementType;
    }

    /**
     * Get the descriptor of one element of an array.
     * @return a nullable descriptor of the element type
     */
    @Nonnull
    public TypeInfo getElementTypeInfo() {
        Preconditions.checkState(elementType != null, "not an array type: %s", this);
        return of(elementType, false);
    }

    /**
     * Get the precision of a fixed-point type or the length of a string type.
     * @return the dimension, {@code 0} when not applicable or unbounded
     */
    public int getDimension() {
        return dimension;
    }

    public int getScale() {
        return scale;
    }

    public boolean isNotNull() {
        return notNull;
    }

    @Nonnull
    public EncodingType getEncoding() {
        return encoding;
    }

    public int getEncodingParam() {
        return encodingParam;
    }

    public boolean isEncoded() {
        return encoding != EncodingType.NONE;
    }

    public boolean isNumber() {
        return type.isNumber();
    }

    public boolean isInteger() {
        return type.isInteger();
    }

    public boolean isDecimal() {
        return type.isDecimal();
    }

    public boolean isFloatingPoint() {
        return type.isFloatingPoint();
    }

    public boolean isString() {
        return type.isString();
    }

    public boolean isTime() {
        return type.isTime();
    }

    public boolean isBoolean() {
        return type.isBoolean();
    }

    public boolean isArray() {
        return type.isArray();
    }

    public boolean isNullType() {
        return type == SqlTypeName.NULLT;
    }

    /**
     * Whether strings of this type have a maximum length.
     * @return {@code true} for {@code CHAR} and for {@code VARCHAR} with a non-zero length
     */
    public boolean isBoundedString() {
        return (type == SqlTypeName.CHAR || type == SqlTypeName.VARCHAR) && dimension > 0;
    }

    @Nonnull
    public TypeInfo withNotNull(boolean newNotNull) {
        if (newNotNull == notNull || type == SqlTypeName.NULLT) {
            return this;
        }
        return new TypeInfo(type, elementType, dimension, scale, newNotNull, encoding, encodingParam);
    }

    @Nonnull
    public TypeInfo withEncoding(@Nonnull EncodingType newEncoding, int newEncodingParam) {
        if (newEncoding == EncodingType.DICT) {
            Preconditions.checkArgument(isString() || (isArray() && Objects.requireNonNull(elementType).isString()),
                    "dictionary encoding needs a string type: %s", this);
        }
        if (newEncoding == EncodingType.FIXED) {
            Preconditions.checkArgument(isInteger() || isTime() || isDecimal(), "fixed encoding needs an integral type: %s", this);
            Preconditions.checkArgument(newEncodingParam > 0, "fixed encoding needs a bit width");
        }
        if (newEncoding == EncodingType.NONE) {
            newEncodingParam = 0;
        }
        return new TypeInfo(type, elementType, dimension, scale, notNull, newEncoding, newEncodingParam);
    }

    @Nonnull
    public TypeInfo withoutEncoding() {
        if (!isEncoded()) {
            return this;
        }
        return new TypeInfo(type, elementType, dimension, scale, notNull, EncodingType.NONE, 0);
    }

    /**
     * Whether this and another descriptor describe the same logical type, ignoring nullability and encoding.
     * @param other the other descriptor
     * @return {@code true} if base type, element type, dimension and scale agree
     */
    public boolean isSameType(@Nonnull TypeInfo other) {
        return type == other.type && elementType == other.elementType && dimension == other.dimension && scale == other.scale;
    }

    /**
     * Whether a value of this type can be cast to another type at all. Individual values may still fail to convert.
     * @param target the type to cast to
     * @return {@code true} if a cast between the two types is defined
     */
    public boolean isCastableTo(@Nonnull TypeInfo target) {
        final SqlTypeName targetType = target.getType();
        if (type == targetType || type == SqlTypeName.NULLT) {
            return true;
        }
        if (isArray() || target.isArray()) {
            return false;
        }
        if (isString() || target.isString()) {
            return true;
        }
        if (isNumber() && target.isNumber()) {
            return true;
        }
        if (isBoolean() && target.isNumber()) {
            return true;
        }
        if (isNumber() && target.isBoolean()) {
            return true;
        }
        if ((type == SqlTypeName.TIMESTAMP || type == SqlTypeName.DATE) && target.isNumber()) {
            return true;
        }
        if (type == SqlTypeName.DATE && targetType == SqlTypeName.TIMESTAMP) {
            return true;
        }
        return type == SqlTypeName.TIMESTAMP && (targetType == SqlTypeName.DATE || targetType == SqlTypeName.TIME);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TypeInfo other = (TypeInfo)o;
        return isSameType(other) && notNull == other.notNull && encoding == other.encoding && encodingParam == other.encodingParam;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, elementType, dimension, scale, notNull, encoding, encodingParam);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        if (isArray()) {
            sb.append(elementType).append("[]");
        } else {
            sb.append(type);
        }
        if (isDecimal()) {
            sb.append('(').append(dimension).append(',').append(scale).append(')');
        } else if (isBoundedString()) {
            sb.append('(').append(dimension).append(')');
        }
        if (notNull) {
            sb.append(" NOT NULL");
        }
        if (isEncoded()) {
            sb.append(" ENCODING ").append(encoding);
            if (encodingParam != 0) {
                sb.append('(').append(encodingParam).append(')');
            }
        }
        return sb.toString();
    }
}
