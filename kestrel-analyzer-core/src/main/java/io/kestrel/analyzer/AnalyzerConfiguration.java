/*
 * AnalyzerConfiguration.java
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

/**
 * A set of options that control how an {@link AnalyzerContext} builds a query.
 */
@API(API.Status.UNSTABLE)
public class AnalyzerConfiguration {
    @Nonnull
    private static final AnalyzerConfiguration DEFAULT_ANALYZER_CONFIGURATION = builder().build();

    private final boolean identifiersCaseSensitive;
    private final boolean coerceStringLiterals;
    private final boolean checkRangeTableReferences;

    private AnalyzerConfiguration(@Nonnull AnalyzerConfiguration.Builder builder) {
        this.identifiersCaseSensitive = builder.identifiersCaseSensitive;
        this.coerceStringLiterals = builder.coerceStringLiterals;
        this.checkRangeTableReferences = builder.checkRangeTableReferences;
    }

    /**
     * Whether table aliases are matched exactly. Column names follow the rules of the catalog.
     * @return {@code true} if aliases differing only in case are different aliases
     */
    public boolean isIdentifiersCaseSensitive() {
        return identifiersCaseSensitive;
    }

    /**
     * Whether a string literal compared with a non-string value is converted to that value's type.
     * @return {@code true} if string literals are converted
     */
    public boolean shouldCoerceStringLiterals() {
        return coerceStringLiterals;
    }

    /**
     * Whether a finished query is checked for column references to missing range table entries.
     * @return {@code true} if the check is run
     */
    public boolean shouldCheckRangeTableReferences() {
        return checkRangeTableReferences;
    }

    @Nonnull
    public Builder asBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Nonnull
    public static AnalyzerConfiguration defaultAnalyzerConfiguration() {
        return DEFAULT_ANALYZER_CONFIGURATION;
    }

    @Override
    public String toString() {
        return "AnalyzerConfiguration{identifiersCaseSensitive=" + identifiersCaseSensitive
               + ", coerceStringLiterals=" + coerceStringLiterals
               + ", checkRangeTableReferences=" + checkRangeTableReferences + "}";
    }

    /**
     * A builder for {@link AnalyzerConfiguration}.
     */
    public static class Builder {
        private boolean identifiersCaseSensitive = false;
        private boolean coerceStringLiterals = true;
        private boolean checkRangeTableReferences = true;

        public Builder(@Nonnull AnalyzerConfiguration configuration) {
            this.identifiersCaseSensitive = configuration.identifiersCaseSensitive;
            this.coerceStringLiterals = configuration.coerceStringLiterals;
            this.checkRangeTableReferences = configuration.checkRangeTableReferences;
        }

        public Builder() {
        }

        @Nonnull
        public Builder setIdentifiersCaseSensitive(boolean identifiersCaseSensitive) {
            this.identifiersCaseSensitive = identifiersCaseSensitive;
            return this;
        }

        @Nonnull
        public Builder setCoerceStringLiterals(boolean coerceStringLiterals) {
            this.coerceStringLiterals = coerceStringLiterals;
            return this;
        }

        @Nonnull
        public Builder setCheckRangeTableReferences(boolean checkRangeTableReferences) {
            this.checkRangeTableReferences = checkRangeTableReferences;
            return this;
        }

        @Nonnull
        public AnalyzerConfiguration build() {
            return new AnalyzerConfiguration(this);
        }
    }
}
