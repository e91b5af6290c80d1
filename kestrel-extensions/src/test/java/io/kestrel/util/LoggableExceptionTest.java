/*
 * LoggableExceptionTest.java
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

package io.kestrel.util;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link LoggableException}.
 */
public class LoggableExceptionTest {
    @Test
    public void emptyLogInfo() {
        LoggableException e = new LoggableException("no details");
        assertEquals(Collections.emptyMap(), e.getLogInfo());
        assertEquals(0, e.exportLogInfo().length);
    }

    @Test
    public void detailsKeepInsertionOrder() {
        LoggableException e = new LoggableException("three details", "table_name", "emp", "column_name", "sal")
                .addLogInfo("rte_index", 2);
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("table_name", "emp");
        expected.put("column_name", "sal");
        expected.put("rte_index", 2);
        assertEquals(expected, e.getLogInfo());
        assertArrayEquals(new Object[]{"table_name", "emp", "column_name", "sal", "rte_index", 2}, e.exportLogInfo());
    }

    @Test
    public void addLogInfoReturnsSameException() {
        LoggableException e = new LoggableException("chained");
        assertSame(e, e.addLogInfo("k", "v"));
        assertNotNull(e.getLogInfo().get("k"));
    }

    @Test
    public void oddLogInfoValues() {
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("odd", "k1", "v1", "k2"));
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("odd in call").addLogInfo("k1", "v1", "k2"));
    }

    @Test
    public void causeIsKept() {
        IllegalStateException cause = new IllegalStateException("inner");
        LoggableException e = new LoggableException("outer", cause);
        assertSame(cause, e.getCause());
    }
}
