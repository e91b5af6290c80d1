/*
 * ExtractField.java
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

/**
 * Fields that {@code EXTRACT(field FROM x)} can take out of a date/time value.
 */
@API(API.Status.UNSTABLE)
public enum ExtractField {
    YEAR,
    QUARTER,
    MONTH,
    DAY,
    HOUR,
    MINUTE,
    SECOND,
    DOW,
    ISODOW,
    DOY,
    WEEK,
    EPOCH;

    /**
     * Whether the field can be extracted from a {@code TIME} value, which has no date part.
     * @return {@code true} for the time-of-day fields
     */
    public boolean appliesToTimeOfDay() {
        return this == HOUR || this == MINUTE || this == SECOND || this == EPOCH;
    }
}
