/*
 * TargetEntry.java
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
import io.kestrel.analyzer.expr.Expr;
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One output column of a {@link Query}: the expression computing it and the name it is output under. An unnest
 * entry flattens an array value into one output row per element.
 */
@API(API.Status.UNSTABLE)
public final class TargetEntry {
    @Nonnull
    private final String name;
    @Nonnull
    private final Expr expr;
    private final boolean unnest;

    public TargetEntry(@Nonnull String name, @Nonnull Expr expr, boolean unnest) {
        Preconditions.checkArgument(!unnest || expr.getTypeInfo().getType() == SqlTypeName.ARRAY,
                "only an array value can be unnested: %s", expr.getTypeInfo());
        this.name = name;
        this.expr = expr;
        this.unnest = unnest;
    }

    public TargetEntry(@Nonnull String name, @Nonnull Expr expr) {
        this(name, expr, false);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Expr getExpr() {
        return expr;
    }

    public boolean isUnnest() {
        return unnest;
    }

    /**
     * Derive an entry with the same name and unnest flag computing a different expression.
     * @param newExpr the replacement expression
     * @return the new entry
     */
    @Nonnull
    public TargetEntry withExpr(@Nonnull Expr newExpr) {
        return new TargetEntry(name, newExpr, unnest);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TargetEntry that = (TargetEntry)o;
        return unnest == that.unnest && name.equals(that.name) && expr.equals(that.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, expr, unnest);
    }

    @Override
    public String toString() {
        return (unnest ? "UNNEST " : "") + expr + " AS " + name;
    }
}
