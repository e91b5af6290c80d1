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
 * The analyzed-query model of the Kestrel SQL engine: the tree semantic analysis produces from a parsed statement and
 * that the planner and code generator consume.
 *
 * <p>
 * {@link io.kestrel.analyzer.AnalyzerContext} builds a {@link io.kestrel.analyzer.query.Query} against a
 * {@link io.kestrel.analyzer.catalog.Catalog}. Failures are reported as subclasses of
 * {@link io.kestrel.analyzer.AnalyzerException}, each carrying an {@link io.kestrel.analyzer.ErrorCode}.
 * </p>
 */
package io.kestrel.analyzer;
