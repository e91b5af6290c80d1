/*
 * LiteralCasts.java
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

import io.kestrel.analyzer.ErrorCode;
import io.kestrel.analyzer.TypeException;
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeInfo;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Conversion of literal values between SQL types.
 *
 * <p>
 * Every conversion between numbers, strings and booleans preserves the decimal value exactly or fails, so that
 * casting a literal through an intermediate type gives the same result as casting it directly. Approximate numbers
 * stand for the decimal value of their shortest string representation. Casting a timestamp to a date or time
 * truncates, as in SQL.
 * </p>
 */
final class LiteralCasts {
    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral(' ').optionalEnd()
            .optionalStart().appendLiteral('T').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter(Locale.ROOT);

    // No numeric type holds a nonzero value whose decimal exponent is larger in magnitude.
    private static final int MAX_DECIMAL_EXPONENT = 400;

    private LiteralCasts() {
    }

    /**
     * Convert a non-null literal.
     * @param value the literal, an instance of {@code from}'s Java class
     * @param from the type of {@code value}
     * @param to the type to convert to
     * @return the converted literal, an instance of {@code to}'s Java class
     * @throws TypeException if the types cannot be cast or the value does not survive the conversion
     */
    @Nonnull
    static Object convert(@Nonnull Object value, @Nonnull TypeInfo from, @Nonnull TypeInfo to) {
        if (!from.isCastableTo(to)) {
            throw new TypeException("cannot cast literal", ErrorCode.CANNOT_COERCE,
                    LogMessageKeys.TYPE, from, LogMessageKeys.TARGET_TYPE, to);
        }
        switch (to.getType().getFamily()) {
            case BOOLEAN:
                return toBoolean(value, to);
            case INTEGER:
                return toInteger(toExactDecimal(value, to), to);
            case DECIMAL:
                return toFixedPoint(toExactDecimal(value, to), to);
            case APPROXIMATE:
                return toApproximate(toExactDecimal(value, to), to);
            case STRING:
                return toBoundedString(toText(value), to);
            case TIME:
                return toTime(value, to);
            case ARRAY:
                return toArray(value, from, to);
            case NULL:
            default:
                throw new TypeException("cannot cast literal", ErrorCode.CANNOT_COERCE,
                        LogMessageKeys.VALUE, value, LogMessageKeys.TARGET_TYPE, to);
        }
    }

    /**
     * Get the exact decimal value of a number, boolean, string or date/time literal.
     */
    @Nonnull
    static BigDecimal toExactDecimal(@Nonnull Object value, @Nonnull TypeInfo to) {
        if (value instanceof BigDecimal) {
            return (BigDecimal)value;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number)value).longValue());
        }
        if (value instanceof Float) {
            final float f = (Float)value;
            checkFinite(Float.isFinite(f), value, to);
            return new BigDecimal(Float.toString(f));
        }
        if (value instanceof Double) {
            final double d = (Double)value;
            checkFinite(Double.isFinite(d), value, to);
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Boolean) {
            return (Boolean)value ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        if (value instanceof String) {
            final BigDecimal parsed;
            try {
                parsed = new BigDecimal(((String)value).trim());
            } catch (NumberFormatException e) {
                throw new TypeException("invalid input syntax for a number", ErrorCode.INVALID_TEXT_REPRESENTATION, e)
                        .addLogInfo(LogMessageKeys.VALUE.toString(), value)
                        .addLogInfo(LogMessageKeys.TARGET_TYPE.toString(), to);
            }
            final long exponent = (long)parsed.precision() - parsed.scale();
            checkRange(parsed.signum() == 0 || Math.abs(exponent) <= MAX_DECIMAL_EXPONENT, value, to);
            return parsed;
        }
        if (value instanceof LocalDate) {
            return BigDecimal.valueOf(((LocalDate)value).atStartOfDay().toEpochSecond(ZoneOffset.UTC));
        }
        if (value instanceof LocalDateTime) {
            final LocalDateTime timestamp = (LocalDateTime)value;
            return BigDecimal.valueOf(timestamp.toEpochSecond(ZoneOffset.UTC))
                    .add(BigDecimal.valueOf(timestamp.getNano(), 9)).stripTrailingZeros();
        }
        throw new TypeException("not a numeric literal", ErrorCode.CANNOT_COERCE,
                LogMessageKeys.VALUE, value, LogMessageKeys.TARGET_TYPE, to);
    }

    @Nonnull
    private static Boolean toBoolean(@Nonnull Object value, @Nonnull TypeInfo to) {
        if (value instanceof Boolean) {
            return (Boolean)value;
        }
        if (value instanceof String) {
            switch (((String)value).trim().toLowerCase(Locale.ROOT)) {
                case "true":
                case "t":
                case "1":
                    return Boolean.TRUE;
                case "false":
                case "f":
                case "0":
                    return Boolean.FALSE;
                default:
                    throw new TypeException("invalid input syntax for a boolean", ErrorCode.INVALID_TEXT_REPRESENTATION,
                            LogMessageKeys.VALUE, value, LogMessageKeys.TARGET_TYPE, to);
            }
        }
        final BigDecimal number = toExactDecimal(value, to);
        if (number.compareTo(BigDecimal.ONE) == 0) {
            return Boolean.TRUE;
        }
        if (number.signum() == 0) {
            return Boolean.FALSE;
        }
        throw outOfRange(value, to);
    }

    @Nonnull
    private static Object toInteger(@Nonnull BigDecimal number, @Nonnull TypeInfo to) {
        final long longValue;
        try {
            longValue = number.longValueExact();
        } catch (ArithmeticException e) {
            throw new TypeException("value does not fit an integer", ErrorCode.NUMERIC_VALUE_OUT_OF_RANGE, e)
                    .addLogInfo(LogMessageKeys.VALUE.toString(), number)
                    .addLogInfo(LogMessageKeys.TARGET_TYPE.toString(), to);
        }
        switch (to.getType()) {
            case TINYINT:
                checkRange(longValue >= Byte.MIN_VALUE && longValue <= Byte.MAX_VALUE, number, to);
                return (byte)longValue;
            case SMALLINT:
                checkRange(longValue >= Short.MIN_VALUE && longValue <= Short.MAX_VALUE, number, to);
                return (short)longValue;
            case INT:
                checkRange(longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE, number, to);
                return (int)longValue;
            case BIGINT:
            default:
                return longValue;
        }
    }

    @Nonnull
    private static BigDecimal toFixedPoint(@Nonnull BigDecimal number, @Nonnull TypeInfo to) {
        // checked before setScale, which expands every digit of a large exponent
        if (number.signum() != 0) {
            checkRange((long)number.precision() - number.scale() <= to.getDimension() - to.getScale(), number, to);
            if (number.stripTrailingZeros().scale() > to.getScale()) {
                throw new TypeException("value needs rounding to fit the scale", ErrorCode.NUMERIC_VALUE_OUT_OF_RANGE,
                        LogMessageKeys.VALUE, number, LogMessageKeys.TARGET_TYPE, to);
            }
        }
        final BigDecimal scaled = number.setScale(to.getScale(), RoundingMode.UNNECESSARY);
        checkRange(fitsPrecision(scaled, to.getDimension()), number, to);
        return scaled;
    }

    /**
     * Whether a value, already at the target scale, has no more digits than the precision allows.
     */
    static boolean fitsPrecision(@Nonnull BigDecimal scaled, int precision) {
        return scaled.precision() <= precision;
    }

    @Nonnull
    private static Object toApproximate(@Nonnull BigDecimal number, @Nonnull TypeInfo to) {
        if (to.getType() == SqlTypeName.FLOAT) {
            final float f = number.floatValue();
            checkRange(Float.isFinite(f) && new BigDecimal(Float.toString(f)).compareTo(number) == 0, number, to);
            return f;
        }
        final double d = number.doubleValue();
        checkRange(Double.isFinite(d) && BigDecimal.valueOf(d).compareTo(number) == 0, number, to);
        return d;
    }

    /**
     * Render a literal the way a cast to a string type does.
     */
    @Nonnull
    static String toText(@Nonnull Object value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal)value).toPlainString();
        }
        if (value instanceof LocalDateTime) {
            final LocalDateTime timestamp = (LocalDateTime)value;
            return timestamp.toLocalDate() + " " + timestamp.toLocalTime().format(DateTimeFormatter.ISO_LOCAL_TIME);
        }
        if (value instanceof LocalTime) {
            return ((LocalTime)value).format(DateTimeFormatter.ISO_LOCAL_TIME);
        }
        return value.toString();
    }

    @Nonnull
    private static String toBoundedString(@Nonnull String text, @Nonnull TypeInfo to) {
        if (to.isBoundedString() && text.length() > to.getDimension()) {
            throw new TypeException("value too long for type", ErrorCode.STRING_DATA_RIGHT_TRUNCATION,
                    LogMessageKeys.VALUE, text, LogMessageKeys.TARGET_TYPE, to);
        }
        return text;
    }

    @Nonnull
    private static Object toTime(@Nonnull Object value, @Nonnull TypeInfo to) {
        try {
            switch (to.getType()) {
                case DATE:
                    if (value instanceof LocalDate) {
                        return value;
                    }
                    if (value instanceof LocalDateTime) {
                        return ((LocalDateTime)value).toLocalDate();
                    }
                    return parseDateOrTimestamp((String)value).toLocalDate();
                case TIMESTAMP:
                    if (value instanceof LocalDateTime) {
                        return value;
                    }
                    if (value instanceof LocalDate) {
                        return ((LocalDate)value).atStartOfDay();
                    }
                    return parseDateOrTimestamp((String)value);
                case TIME:
                default:
                    if (value instanceof LocalTime) {
                        return value;
                    }
                    if (value instanceof LocalDateTime) {
                        return ((LocalDateTime)value).toLocalTime();
                    }
                    return LocalTime.parse(((String)value).trim());
            }
        } catch (DateTimeParseException e) {
            throw new TypeException("invalid input syntax for a date/time", ErrorCode.INVALID_DATETIME_FORMAT, e)
                    .addLogInfo(LogMessageKeys.VALUE.toString(), value)
                    .addLogInfo(LogMessageKeys.TARGET_TYPE.toString(), to);
        }
    }

    @Nonnull
    private static LocalDateTime parseDateOrTimestamp(@Nonnull String text) {
        final String trimmed = text.trim();
        if (trimmed.length() == 10) {
            return LocalDate.parse(trimmed).atStartOfDay();
        }
        return LocalDateTime.parse(trimmed, TIMESTAMP_FORMAT);
    }

    @Nonnull
    private static List<Object> toArray(@Nonnull Object value, @Nonnull TypeInfo from, @Nonnull TypeInfo to) {
        final TypeInfo fromElement = from.getElementTypeInfo();
        final TypeInfo toElement = to.getElementTypeInfo();
        final List<?> elements = (List<?>)value;
        final List<Object> converted = new ArrayList<>(elements.size());
        for (Object element : elements) {
            converted.add(element == null ? null : convert(element, fromElement, toElement));
        }
        return Collections.unmodifiableList(converted);
    }

    private static void checkFinite(boolean finite, @Nonnull Object value, @Nonnull TypeInfo to) {
        if (!finite) {
            throw outOfRange(value, to);
        }
    }

    private static void checkRange(boolean inRange, @Nonnull Object value, @Nonnull TypeInfo to) {
        if (!inRange) {
            throw outOfRange(value, to);
        }
    }

    @Nonnull
    private static TypeException outOfRange(@Nullable Object value, @Nonnull TypeInfo to) {
        return new TypeException("value out of range for type", ErrorCode.NUMERIC_VALUE_OUT_OF_RANGE,
                LogMessageKeys.VALUE, value, LogMessageKeys.TARGET_TYPE, to);
    }
}
