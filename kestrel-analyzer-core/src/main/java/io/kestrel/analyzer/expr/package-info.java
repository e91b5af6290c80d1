/*
 * package-info.java
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

/**
 * Typed expression trees.
 *
 * <p>
 * Every node is an immutable {@link io.kestrel.analyzer.expr.Expr} carrying its
 * {@link io.kestrel.analyzer.types.TypeInfo}. Transformations such as cast insertion, predicate splitting and the
 * target list rewrites return new trees and leave their input untouched, so a finished tree can be read from several
 * threads. Nodes are built through the {@code create} factories of each class, which compute result types and insert
 * the casts operands need.
 * </p>
 *
 * <p>
 * {@link io.kestrel.analyzer.expr.ColumnVar} refers to a base table column through an index into the owning query's
 * range table, while {@link io.kestrel.analyzer.expr.Var} refers to a slot of an intermediate row.
 * </p>
 */
package io.kestrel.analyzer.expr;
