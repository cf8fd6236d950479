/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.diagnostics;

import com.intuitivedesigns.tracekernel.core.EventLevel;

import java.util.List;

/**
 * Fixed catalogue of events the pipeline reports about itself.
 */
public enum DiagnosticEvent {

    CUSTOM_SINK_FAULT(1, EventLevel.ERROR, DiagnosticKeywords.SINK, "Sink", "Fault",
            List.of("sinkId", "message", "exception"),
            "Sink [{0}] reported a fault: {1}"),

    TRANSIENT_PUBLISH_ERROR(100, EventLevel.WARNING, DiagnosticKeywords.SINK, "Publish", "Retry",
            List.of("sinkId", "attempt", "exception"),
            "Transient error publishing to sink [{0}] (failure {1,number,#}), retrying: {2}"),

    PUBLISH_FAILED(101, EventLevel.ERROR, DiagnosticKeywords.SINK, "Publish", "Fail",
            List.of("sinkId", "exception"),
            "Publishing to sink [{0}] failed: {1}"),

    ENTRIES_DISCARDED(102, EventLevel.WARNING, DiagnosticKeywords.SINK, "Publish", "Discard",
            List.of("sinkId", "count", "reason"),
            "Sink [{0}] discarded {1,number,#} entries: {2}"),

    SINGLE_ENTRY_DISCARDED(103, EventLevel.WARNING, DiagnosticKeywords.SINK, "Publish", "DiscardSingle",
            List.of("sinkId", "index", "message"),
            "Sink [{0}] rejected the entry at index {1,number,#} and it was discarded: {2}"),

    ENTRIES_PERSISTED(104, EventLevel.VERBOSE, DiagnosticKeywords.SINK, "Publish", "Persisted",
            List.of("sinkId", "count"),
            "Sink [{0}] persisted {1,number,#} entries"),

    BUFFER_OVERLOADED(900, EventLevel.WARNING, DiagnosticKeywords.SINK, "Buffer", "Overloaded",
            List.of("sinkId", "capacity"),
            "Buffer of sink [{0}] reached its capacity of {1,number,#}, new entries are dropped"),

    BUFFER_RESTORED(901, EventLevel.INFORMATIONAL, DiagnosticKeywords.SINK, "Buffer", "Restored",
            List.of("sinkId"),
            "Buffer of sink [{0}] is accepting entries again"),

    EVENTS_LOST_WHILE_DISPOSING(902, EventLevel.WARNING, DiagnosticKeywords.SINK, "Buffer", "Lost",
            List.of("sinkId", "count"),
            "Sink [{0}] lost {1,number,#} buffered entries while disposing"),

    UNOBSERVED_FAULT(903, EventLevel.CRITICAL, DiagnosticKeywords.SINK, "Publisher", "Fault",
            List.of("sinkId", "exception"),
            "Unhandled fault in the publishing task of sink [{0}]: {1}"),

    FORMATTING_FAILED(1100, EventLevel.CRITICAL, DiagnosticKeywords.FORMATTING, "Format", "Fail",
            List.of("sinkId", "eventId", "exception"),
            "Sink [{0}] could not format event {1,number,#}: {2}");

    private final int id;
    private final EventLevel level;
    private final long keywords;
    private final String taskName;
    private final String opcodeName;
    private final List<String> payloadNames;
    private final String messageTemplate;

    DiagnosticEvent(int id, EventLevel level, long keywords, String taskName, String opcodeName,
                    List<String> payloadNames, String messageTemplate) {
        this.id = id;
        this.level = level;
        this.keywords = keywords;
        this.taskName = taskName;
        this.opcodeName = opcodeName;
        this.payloadNames = payloadNames;
        this.messageTemplate = messageTemplate;
    }

    public int id() { return id; }
    public EventLevel level() { return level; }
    public long keywords() { return keywords; }
    public String taskName() { return taskName; }
    public String opcodeName() { return opcodeName; }
    public List<String> payloadNames() { return payloadNames; }
    public String messageTemplate() { return messageTemplate; }

    public static DiagnosticEvent byId(int id) {
        for (DiagnosticEvent e : values()) {
            if (e.id == id) return e;
        }
        throw new IllegalArgumentException("Unknown diagnostic event id: " + id);
    }
}
