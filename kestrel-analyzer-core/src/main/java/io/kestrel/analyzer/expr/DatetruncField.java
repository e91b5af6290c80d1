/*
 * DatetruncField.java
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
 * Units that {@code DATE_TRUNC(field, x)} can truncate a date/time value to.
 */
@API(API.Status.UNSTABLE)
public enum DatetruncField {
    MILLENNIUM,
    CENTURY,
    DECADE,
    YEAR,
    QUARTER,
    MONTH,
    WEEK,
    DAY,
    QUARTERDAY,
    HOUR,
    MINUTE,
    SECOND;

    public boolean appliesToTimeOfDay() {
        return this == HOUR || this == MINUTE || this == SECOND;
    }
}
