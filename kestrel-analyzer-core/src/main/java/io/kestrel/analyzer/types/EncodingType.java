/*
 * EncodingType.java
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

package io.kestrel.analyzer.types;

import io.kestrel.annotation.API;

/**
 * Physical compression applied to the values of a column. Expressions over encoded columns produce encoded values
 * until a cast decompresses them.
 */
@API(API.Status.UNSTABLE)
public enum EncodingType {
    /** Plain values. */
    NONE,
    /** Fixed-width integer truncation; the parameter is the number of bits. */
    FIXED,
    /** Run-length encoding. */
    RL,
    /** Differential encoding. */
    DIFF,
    /** Dictionary encoding of strings; the parameter identifies the dictionary. */
    DICT,
    /** Sparse encoding; the parameter is the size of the null sentinel. */
    SPARSE
}
