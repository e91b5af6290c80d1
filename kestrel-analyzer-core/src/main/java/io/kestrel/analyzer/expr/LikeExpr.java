/*
 * LikeExpr.java
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
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * The predicate {@code arg [I]LIKE pattern [ESCAPE escape]}.
 *
 * <p>
 * A pattern is simple when it has the form {@code %literal%} and the literal contains none of {@code % _ [ ]}.
 * Such a match is a plain substring search.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class LikeExpr extends Expr {
    @Nonnull
    private final Expr arg;
    @Nonnull
    private final Expr pattern;
    @Nullable
    private final Expr escape;
    private final boolean ilike;
    private final boolean simple;

    public LikeExpr(@Nonnull TypeInfo typeInfo, boolean containsAggregate, @Nonnull Expr arg, @Nonnull Expr pattern,
                    @Nullable Expr escape, boolean ilike, boolean simple) {
        super(typeInfo, containsAggregate);
        this.arg = arg;
        this.pattern = pattern;
        this.escape = escape;
        this.ilike = ilike;
        this.simple = simple;
    }

    /**
     * Build a typed {@code LIKE} predicate and work out whether its pattern is simple.
     * @param arg the string to match
     * @param pattern the pattern
     * @param escape the escape character, or {@code null}
     * @param ilike whether matching ignores case
     * @return a new node, nullable whenever any operand may be null
     * @throws TypeException if an operand is not a string
     */
    @Nonnull
    public static LikeExpr create(@Nonnull Expr arg, @Nonnull Expr pattern, @Nullable Expr escape, boolean ilike) {
        checkString(arg);
        checkString(pattern);
        boolean notNull = arg.getTypeInfo().isNotNull() && pattern.getTypeInfo().isNotNull();
        if (escape != null) {
            checkString(escape);
            notNull &= escape.getTypeInfo().isNotNull();
        }
        boolean simple = false;
        if (escape == null && pattern instanceof Constant && !((Constant)pattern).isNull()) {
            simple = isSimplePattern((String)Objects.requireNonNull(((Constant)pattern).getValue()));
        }
        final boolean containsAggregate = arg.containsAggregate() || pattern.containsAggregate()
                                          || (escape != null && escape.containsAggregate());
        return new LikeExpr(TypeInfo.of(SqlTypeName.BOOLEAN, notNull), containsAggregate, arg, pattern, escape, ilike, simple);
    }

    private static void checkString(@Nonnull Expr operand) {
        final TypeInfo type = operand.getTypeInfo();
        if (!type.isString() && !type.isNullType()) {
            throw new TypeException("LIKE needs string operands", LogMessageKeys.TYPE, type);
        }
    }

    /**
     * Whether a pattern is {@code %literal%} with no wildcard or bracket in the literal.
     * @param pattern the pattern text
     * @return {@code true} if a substring search implements the match
     */
    public static boolean isSimplePattern(@Nonnull String pattern) {
        if (pattern.length() < 3 || pattern.charAt(0) != '%' || pattern.charAt(pattern.length() - 1) != '%') {
            return false;
        }
        for (int i = 1; i < pattern.length() - 1; i++) {
            final char c = pattern.charAt(i);
            if (c == '%' || c == '_' || c == '[' || c == ']') {
                return false;
            }
        }
        return true;
    }

    @Nonnull
    public Expr getArg() {
        return arg;
    }

    @Nonnull
    public Expr getPattern() {
        return pattern;
    }

    @Nullable
    public Expr getEscape() {
        return escape;
    }

    public boolean isIlike() {
        return ilike;
    }

    public boolean isSimple() {
        return simple;
    }

    @Nonnull
    @Override
    public List<Expr> getChildren() {
        return escape == null ? ImmutableList.of(arg, pattern) : ImmutableList.of(arg, pattern, escape);
    }

    @Nonnull
    @Override
    protected Expr withChildren(@Nonnull List<Expr> newChildren) {
        Preconditions.checkArgument(newChildren.size() == (escape == null ? 2 : 3));
        return new LikeExpr(getTypeInfo(), containsAggregate(), newChildren.get(0), newChildren.get(1),
                escape == null ? null : newChildren.get(2), ilike, simple);
    }

    @Override
    protected boolean equalsWithoutChildren(@Nonnull Expr other) {
        final LikeExpr otherLike = (LikeExpr)other;
        return ilike == otherLike.ilike && simple == otherLike.simple && (escape == null) == (otherLike.escape == null);
    }

    @Override
    protected int hashCodeWithoutChildren() {
        return Objects.hash(ilike, simple, escape == null);
    }

    @Override
    public <T> T accept(@Nonnull ExprVisitor<T> visitor) {
        return visitor.visitLike(this);
    }
}
