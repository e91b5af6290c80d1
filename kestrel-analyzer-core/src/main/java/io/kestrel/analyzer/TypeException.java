/*
 * TypeException.java
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

package io.kestrel.analyzer;

import io.kestrel.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when operands have no common type or a value cannot be converted to a requested type.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class TypeException extends AnalyzerException {
    public TypeException(@Nonnull String msg, @Nullable Object... keyValues) {
        this(msg, ErrorCode.DATATYPE_MISMATCH, keyValues);
    }

    public TypeException(@Nonnull String msg, @Nonnull ErrorCode errorCode, @Nullable Object... keyValues) {
        super(msg, errorCode, keyValues);
    }

    public TypeException(@Nonnull String msg, @Nonnull ErrorCode errorCode, @Nullable Throwable cause) {
        super(msg, errorCode, cause);
    }
}
