/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.format;

import com.intuitivedesigns.tracekernel.config.PipelineConfig;
import com.intuitivedesigns.tracekernel.core.EventFormatter;
import com.intuitivedesigns.tracekernel.core.TestEvents;
import com.intuitivedesigns.tracekernel.core.TraceEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TextEventFormatterTest {

    @Test
    void testSingleLineLayout() {
        TraceEvent event = TestEvents.info(3);

        String line = new TextEventFormatter().format(event);

        assertEquals("2025-03-01T10:15:30.003Z INFORMATIONAL Shop-Orders/1 OrderPlaced pid=100 tid=1 kw=0x1"
                + " msg=\"Order 3 placed\" seq=3 orderId=o-3", line);
    }

    @Test
    void testQuotesAndNewlinesAreEscaped() {
        TraceEvent event = TraceEvent.of(TestEvents.PAYMENT_FAILED, Instant.parse("2025-03-01T10:15:30Z"), 1L, 2L,
                null, null, "line1\n\"quoted\"", Arrays.asList(1, null));

        String line = new TextEventFormatter().format(event);

        assertTrue(line.contains("msg=\"line1\\n\\\"quoted\\\"\""), line);
        assertTrue(line.endsWith("reason=null"), line);
        assertFalse(line.contains("\n"));
    }

    @Test
    void testPluginHonoursDatePattern() {
        EventFormatter formatter = new TextFormatterPlugin()
                .create(PipelineConfig.fromMap(Map.of("formatter.datetime", "yyyy-MM-dd HH:mm")));

        assertTrue(formatter.format(TestEvents.info(0)).startsWith("2025-03-01 10:15 INFORMATIONAL"));
    }
}
