/*
 * CaseExpr.java
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
import io.kestrel.analyzer.types.TypeCoercion;
import io.kestrel.analyzer.types.TypeInfo;
import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code CASE WHEN c1 THEN r1 ... [ELSE e] END}. All results share the type of the expression, which is the common
 * type of the results as written.
 */
@API(API.Status.UNSTABLE)
public final class CaseExpr extends Expr {
    /**
     * One {@code WHEN condition THEN result} arm.
     */
    public static final class WhenClause {
        @Nonnull
        private final Expr condition;
        @Nonnull
        private final Expr result;

        public WhenClause(@Nonnull Expr condition, @Nonnull Expr result) {
            this.condition = condition;
            this.result = result;
        }

        @Nonnull
        public Expr getCondition() {
            return condition;
        }

        @Nonnull
        public Expr getResult() {
            return result;
        }
    }

    @Nonnull
    private final List<WhenClause> whenClauses;
    @Nullable
    private final Expr elseExpr;

    public CaseExpr(@Nonnull TypeInfo typeInfo, boolean containsAggregate, @Nonnull List<WhenClause> whenClauses,
                    @Nullable Expr elseExpr) {
        super(typeInfo, containsAggregate);
        Preconditions.checkArgument(!whenClauses.isEmpty(), "CASE needs at least one WHEN");
        this.whenClauses = ImmutableList.copyOf(whenClauses);
        this.elseExpr = elseExpr;
    }

    /**
     * Build a typed {@code CASE}. Every result is cast to the common type of all results.
     * @param whenClauses the arms, in order
     * @param elseExpr the {@code ELSE} result, or {@code null}, in which case the expression may be null
     * @return a new node
     * @throws TypeException if a condition is not boolean or the results have no common type
     */
    @Nonnull
    public static CaseExpr create(@Nonnull List<WhenClause> whenClauses, @Nullable Expr elseExpr) {
        Preconditions.checkArgument(!whenClauses.isEmpty(), "CASE needs at least one WHEN");
        TypeInfo common = null;
        for (WhenClause whenClause : whenClauses) {
            final TypeInfo conditionType = whenClause.getCondition().getTypeInfo();
            if (!conditionType.isBoolean() && !conditionType.isNullType()) {
                throw new TypeException("CASE condition must be boolean", LogMessageKeys.TYPE, conditionType);
            }
            final TypeInfo resultType = whenClause.getResult().getTypeInfo();
            common = common == null ? resultType : TypeCoercion.commonType(common, resultType);
        }
        if (elseExpr != null) {
            common = TypeCoercion.commonType(Objects.requireNonNull(common), elseExpr.getTypeInfo());
        } else {
            common = Objects.requireNonNull(common).withNotNull(false);
        }
        return castResults(whenClauses, elseExpr, common);
    }

    @Nonnull
    private static CaseExpr castResults(@Nonnull List<WhenClause> whenClauses, @Nullable Expr elseExpr,
                                        @Nonnull TypeInfo target) {
        final List<WhenClause> castClauses = new ArrayList<>(whenClauses.size());
        boolean containsAggregate = false;
        for (WhenClause whenClause : whenClauses) {
            final Expr result = whenClause.getResult().addCast(target);
            castClauses.add(new WhenClause(whenClause.getCondition(), result));
            containsAggregate |= whenClause.getCondition().containsAggregate() || result.containsAggregate();
        }
        final Expr castElse = elseExpr == null ? null : elseExpr.addCast(target);
        containsAggregate |= castElse != null && castElse.containsAggregate();
        return new CaseExpr(castElse == null ? target.withNotNull(false) : target, containsAggregate, castClauses, castElse);
    }

    @Nonnull
    public List<WhenClause> getWhenClauses() {
        return whenClauses;
    }

    @Nullable
    public Expr getElseExpr() {
        return elseExpr;
    }

    /**
     * Cast every result instead of wrapping the whole expression.
     * @param target the type to cast to
     * @return a {@code CASE} whose results all have type {@code target}
     */
    @Nonnull
    @Override
    public Expr addCast(@Nonnull TypeInfo target) {
        if (needsNoCast(target)) {
            return this;
        }
        return castResults(whenClauses, elseExpr, target);
    }

    /**
     * The domain of a {@code CASE} is known when every result is a constant or a cast of one.
     */
    @Nonnull
    @Override
    public List<Expr> getDomain() {
        final List<Expr> domain = new ArrayList<>();
        for (WhenClause whenClause : whenClauses) {
            if (!addToDomain(whenClause.getResult(), domain)) {
                return ImmutableList.of();
            }
        }
        if (elseExpr != null && !addToDomain(elseExpr, domain)) {
            return ImmutableList.of();
        }
        return ImmutableList.copyOf(domain);
    }

    private static boolean addToDomain(@Nonnull Expr result, @Nonnull List<Expr> domain) {
        if (result instanceof Constant
                || (result instanceof UOper && ((UOper)result).isCast() && ((UOper)result).getOperand() instanceof Constant)) {
            result.addUnique(domain);
            return true;
        }
        return false;
    }

    @Nonnull
    @Override
    public List<Expr> getChildren() {
        final ImmutableList.Builder<Expr> children = ImmutableList.builder();
        for (WhenClause whenClause : whenClauses) {
            children.add(whenClause.getCondition(), whenClause.getResult());
        }
        if (elseExpr != null) {
            children.add(elseExpr);
        }
        return children.build();
    }

    @Nonnull
    @Override
    protected Expr withChildren(@Nonnull List<Expr> newChildren) {
        Preconditions.checkArgument(newChildren.size() == 2 * whenClauses.size() + (elseExpr == null ? 0 : 1));
        final List<WhenClause> newClauses = new ArrayList<>(whenClauses.size());
        for (int i = 0; i < whenClauses.size(); i++) {
            newClauses.add(new WhenClause(newChildren.get(2 * i), newChildren.get(2 * i + 1)));
        }
        final Expr newElse = elseExpr == null ? null : newChildren.get(newChildren.size() - 1);
        return new CaseExpr(getTypeInfo(), containsAggregate(), newClauses, newElse);
    }

    @Override
    protected boolean equalsWithoutChildren(@Nonnull Expr other) {
        final CaseExpr otherCase = (CaseExpr)other;
        return whenClauses.size() == otherCase.whenClauses.size() && (elseExpr == null) == (otherCase.elseExpr == null);
    }

    @Override
    protected int hashCodeWithoutChildren() {
        return Objects.hash(whenClauses.size(), elseExpr == null);
    }

    @Override
    public <T> T accept(@Nonnull ExprVisitor<T> visitor) {
        return visitor.visitCase(this);
    }
}
