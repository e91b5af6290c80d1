/*
 * AnalyzerException.java
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

import io.kestrel.analyzer.logging.LogMessageKeys;
import io.kestrel.annotation.API;
import io.kestrel.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base class of every failure reported while building or transforming an analyzed query.
 * The {@link ErrorCode} is also attached to the log info so it shows up in structured logs.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class AnalyzerException extends LoggableException {
    @Nonnull
    private final ErrorCode errorCode;

    public AnalyzerException(@Nonnull String msg, @Nonnull ErrorCode errorCode, @Nullable Object... keyValues) {
        super(msg, keyValues);
        this.errorCode = errorCode;
        addLogInfo(LogMessageKeys.CODE.toString(), errorCode.name());
        addLogInfo(LogMessageKeys.SQLSTATE.toString(), errorCode.getSqlState());
    }

    public AnalyzerException(@Nonnull String msg, @Nonnull ErrorCode errorCode, @Nullable Throwable cause) {
        super(msg, cause);
        this.errorCode = errorCode;
        addLogInfo(LogMessageKeys.CODE.toString(), errorCode.name());
        addLogInfo(LogMessageKeys.SQLSTATE.toString(), errorCode.getSqlState());
    }

    @Nonnull
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    @Nonnull
    public String getSqlState() {
        return errorCode.getSqlState();
    }
}
