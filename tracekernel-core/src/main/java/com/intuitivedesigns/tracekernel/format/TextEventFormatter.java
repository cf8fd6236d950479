/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.format;

import com.intuitivedesigns.tracekernel.core.EventFormatter;
import com.intuitivedesigns.tracekernel.core.EventKeywords;
import com.intuitivedesigns.tracekernel.core.TraceEvent;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Single-line {@code key=value} rendering, e.g.
 * {@code 2025-03-01T10:15:30Z WARNING Shop-Orders/7 OrderStart pid=42 tid=7 kw=0x4 msg="placed" orderId=o-1}.
 */
public final class TextEventFormatter implements EventFormatter {

    private final DateTimeFormatter timestampFormat;

    public TextEventFormatter() {
        this(DateTimeFormatter.ISO_INSTANT);
    }

    public TextEventFormatter(DateTimeFormatter timestampFormat) {
        this.timestampFormat = (timestampFormat == null) ? DateTimeFormatter.ISO_INSTANT : timestampFormat;
    }

    @Override
    public String format(TraceEvent event) {
        final StringBuilder sb = new StringBuilder(160);
        sb.append(timestampFormat.format(event.timestamp()))
                .append(' ').append(event.level().name())
                .append(' ').append(event.providerName()).append('/').append(event.eventId());

        final String name = event.schema().eventName();
        if (!name.isEmpty()) {
            sb.append(' ').append(name);
        }

        sb.append(" pid=").append(event.processId())
                .append(" tid=").append(event.threadId())
                .append(" kw=").append(EventKeywords.toHex(event.keywords()));

        if (!TraceEvent.EMPTY_ID.equals(event.activityId())) {
            sb.append(" activity=").append(event.activityId());
        }
        if (event.formattedMessage() != null) {
            sb.append(" msg=\"").append(escape(event.formattedMessage())).append('"');
        }

        final List<String> names = event.schema().payloadNames();
        for (int i = 0; i < names.size(); i++) {
            sb.append(' ').append(names.get(i)).append('=').append(escape(String.valueOf(event.payload().get(i))));
        }
        return sb.toString();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
    }
}
