/*
 * AnalyzerConfigurationTest.java
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

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

/**
 * Tests for {@link AnalyzerConfiguration}.
 */
public class AnalyzerConfigurationTest {
    @Test
    public void defaults() {
        final AnalyzerConfiguration configuration = AnalyzerConfiguration.defaultAnalyzerConfiguration();
        assertThat(configuration.isIdentifiersCaseSensitive(), is(false));
        assertThat(configuration.shouldCoerceStringLiterals(), is(true));
        assertThat(configuration.shouldCheckRangeTableReferences(), is(true));
        assertThat(AnalyzerConfiguration.defaultAnalyzerConfiguration(), sameInstance(configuration));
    }

    @Test
    public void asBuilderKeepsOtherSettings() {
        final AnalyzerConfiguration strict = AnalyzerConfiguration.builder()
                .setCoerceStringLiterals(false)
                .setIdentifiersCaseSensitive(true)
                .build();
        final AnalyzerConfiguration unchecked = strict.asBuilder().setCheckRangeTableReferences(false).build();
        assertThat(unchecked.shouldCoerceStringLiterals(), is(false));
        assertThat(unchecked.isIdentifiersCaseSensitive(), is(true));
        assertThat(unchecked.shouldCheckRangeTableReferences(), is(false));
        assertThat(strict.shouldCheckRangeTableReferences(), is(true));
    }
}
