/*
 * DatetruncExpr.java
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
import io.kestrel.analyzer.TypeException;
import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.analyzer.types.SqlTypeName;
import io.kestrel.analyzer.types.TypeInfo;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * {@code DATE_TRUNC(field, source)}: the date/time value truncated to a unit, of the same type as the source.
 */
@API(API.Status.UNSTABLE)
public final class DatetruncExpr extends Expr {
    @Nonnull
    private final DatetruncField field;
    @Nonnull
    private final Expr from;

    public DatetruncExpr(@Nonnull TypeInfo typeInfo, boolean containsAggregate, @Nonnull DatetruncField field, @Nonnull Expr from) {
        super(typeInfo, containsAggregate);
        this.field = field;
        this.from = from;
    }

    @Nonnull
    public static DatetruncExpr create(@Nonnull DatetruncField field, @Nonnull Expr from) {
        final TypeInfo fromType = from.getTypeInfo();
        if (!fromType.isTime() || (fromType.getType() == SqlTypeName.TIME && !field.appliesToTimeOfDay())) {
            throw new TypeException("cannot truncate value to unit", LogMessageKeys.VALUE, field, LogMessageKeys.TYPE, fromType);
        }
        return new DatetruncExpr(fromType.withoutEncoding(), from.containsAggregate(), field, from);
    }

    @Nonnull
    public DatetruncField getField() {
        return field;
    }

    @Nonnull
    public Expr getFrom() {
        return from;
    }

    @Nonnull
    @Override
    public List<Expr> getChildren() {
        return ImmutableList.of(from);
    }

    @Nonnull
    @Override
    protected Expr withChildren(@Nonnull List<Expr> newChildren) {
        Preconditions.checkArgument(newChildren.size() == 1);
        return new DatetruncExpr(getTypeInfo(), containsAggregate(), field, newChildren.get(0));
    }

    @Override
    protected boolean equalsWithoutChildren(@Nonnull Expr other) {
        return field == ((DatetruncExpr)other).field;
    }

    @Override
    protected int hashCodeWithoutChildren() {
        return field.hashCode();
    }

    @Override
    public <T> T accept(@Nonnull ExprVisitor<T> visitor) {
        return visitor.visitDatetrunc(this);
    }
}
