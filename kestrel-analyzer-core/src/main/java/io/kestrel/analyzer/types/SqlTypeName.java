/*
 * SqlTypeName.java
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

import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * SQL base types. Each name belongs to a {@link Family} and knows the Java class used to hold literal values of the
 * type inside a {@code Constant}.
 */
@API(API.Status.UNSTABLE)
public enum SqlTypeName {
    NULLT(Family.NULL, Void.class, 0),
    BOOLEAN(Family.BOOLEAN, Boolean.class, 0),
    CHAR(Family.STRING, String.class, 0),
    VARCHAR(Family.STRING, String.class, 0),
    TEXT(Family.STRING, String.class, 0),
    NUMERIC(Family.DECIMAL, BigDecimal.class, 0),
    DECIMAL(Family.DECIMAL, BigDecimal.class, 0),
    TINYINT(Family.INTEGER, Byte.class, 3),
    SMALLINT(Family.INTEGER, Short.class, 5),
    INT(Family.INTEGER, Integer.class, 10),
    BIGINT(Family.INTEGER, Long.class, 19),
    FLOAT(Family.APPROXIMATE, Float.class, 0),
    DOUBLE(Family.APPROXIMATE, Double.class, 0),
    TIME(Family.TIME, LocalTime.class, 0),
    TIMESTAMP(Family.TIME, LocalDateTime.class, 0),
    DATE(Family.TIME, LocalDate.class, 0),
    ARRAY(Family.ARRAY, List.class, 0);

    /**
     * Maximum precision of a fixed-point type. Fixed-point values are backed by a 64 bit integer at execution time.
     */
    public static final int MAX_DECIMAL_PRECISION = 19;

    /**
     * Groups of types that may be compared or combined with each other.
     */
    public enum Family {
        NULL,
        BOOLEAN,
        INTEGER,
        DECIMAL,
        APPROXIMATE,
        STRING,
        TIME,
        ARRAY
    }

    @Nonnull
    private final Family family;
    @Nonnull
    private final Class<?> javaClass;
    private final int integerDigits;

    SqlTypeName(@Nonnull Family family, @Nonnull Class<?> javaClass, int integerDigits) {
        this.family = family;
        this.javaClass = javaClass;
        this.integerDigits = integerDigits;
    }

    @Nonnull
    public Family getFamily() {
        return family;
    }

    /**
     * Get the class of literal values of this type.
     * @return the Java class a constant of this type holds
     */
    @Nonnull
    public Class<?> getJavaClass() {
        return javaClass;
    }

    /**
     * Get the number of decimal digits needed to hold any value of an integer type.
     * @return the digit count, or {@code 0} for types that are not integers
     */
    public int getIntegerDigits() {
        return integerDigits;
    }

    public boolean isNumber() {
        return family == Family.INTEGER || family == Family.DECIMAL || family == Family.APPROXIMATE;
    }

    public boolean isInteger() {
        return family == Family.INTEGER;
    }

    public boolean isDecimal() {
        return family == Family.DECIMAL;
    }

    public boolean isFloatingPoint() {
        return family == Family.APPROXIMATE;
    }

    public boolean isString() {
        return family == Family.STRING;
    }

    public boolean isTime() {
        return family == Family.TIME;
    }

    public boolean isBoolean() {
        return family == Family.BOOLEAN;
    }

    public boolean isArray() {
        return family == Family.ARRAY;
    }
}
