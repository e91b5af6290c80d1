/*
 * ExprVisitor.java
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

import javax.annotation.Nonnull;

/**
 * Visitor over the closed set of expression variants. Adding a variant adds a method here, so every visitor
 * has to handle it.
 *
 * @param <T> the result of visiting a node
 */
@API(API.Status.UNSTABLE)
public interface ExprVisitor<T> {
    T visitColumnVar(@Nonnull ColumnVar columnVar);

    T visitVar(@Nonnull Var var);

    T visitConstant(@Nonnull Constant constant);

    T visitUOper(@Nonnull UOper uOper);

    T visitBinOper(@Nonnull BinOper binOper);

    T visitSubquery(@Nonnull Subquery subquery);

    T visitInValues(@Nonnull InValues inValues);

    T visitCharLength(@Nonnull CharLengthExpr charLength);

    T visitLike(@Nonnull LikeExpr like);

    T visitAggregate(@Nonnull AggExpr aggregate);

    T visitCase(@Nonnull CaseExpr caseExpr);

    T visitExtract(@Nonnull ExtractExpr extract);

    T visitDatetrunc(@Nonnull DatetruncExpr datetrunc);
}
