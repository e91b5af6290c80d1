/*
 * OrderEntry.java
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

package io.kestrel.analyzer.query;

import com.google.common.base.Preconditions;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One key of an {@code ORDER BY} clause, naming an entry of the target list by its 1-based position.
 */
@API(API.Status.UNSTABLE)
public final class OrderEntry {
    private final int position;
    private final boolean descending;
    private final boolean nullsFirst;

    public OrderEntry(int position, boolean descending, boolean nullsFirst) {
        Preconditions.checkArgument(position >= 1, "order by position is 1-based: %s", position);
        this.position = position;
        this.descending = descending;
        this.nullsFirst = nullsFirst;
    }

    /**
     * Get the 1-based position of the target list entry to order by.
     * @return the position
     */
    public int getPosition() {
        return position;
    }

    public boolean isDescending() {
        return descending;
    }

    public boolean isNullsFirst() {
        return nullsFirst;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final OrderEntry that = (OrderEntry)o;
        return position == that.position && descending == that.descending && nullsFirst == that.nullsFirst;
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, descending, nullsFirst);
    }

    @Nonnull
    @Override
    public String toString() {
        return position + (descending ? " DESC" : " ASC") + (nullsFirst ? " NULLS FIRST" : " NULLS LAST");
    }
}
