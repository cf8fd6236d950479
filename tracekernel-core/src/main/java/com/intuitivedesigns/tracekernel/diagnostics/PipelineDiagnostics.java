/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.diagnostics;

import com.intuitivedesigns.tracekernel.core.EventObserver;
import com.intuitivedesigns.tracekernel.core.EventObservable;
import com.intuitivedesigns.tracekernel.core.EventSchema;
import com.intuitivedesigns.tracekernel.core.EventSubject;
import com.intuitivedesigns.tracekernel.core.SchemaLookup;
import com.intuitivedesigns.tracekernel.core.SinkDiagnostics;
import com.intuitivedesigns.tracekernel.core.Subscription;
import com.intuitivedesigns.tracekernel.core.TraceEvent;
import com.intuitivedesigns.tracekernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.LongAdder;

/**
 * The pipeline's own event channel.
 * <p>
 * Each report is logged through SLF4J, counted, and pushed as a {@link TraceEvent} of provider
 * {@value #PROVIDER_NAME} to whoever subscribed. User sinks are never attached automatically, so a failing
 * sink cannot feed its own failures back into itself.
 */
public final class PipelineDiagnostics implements SinkDiagnostics, EventObservable<TraceEvent>, SchemaLookup, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineDiagnostics.class);

    public static final String PROVIDER_NAME = "TraceKernel-Diagnostics";
    public static final UUID PROVIDER_ID = UUID.nameUUIDFromBytes(PROVIDER_NAME.getBytes(StandardCharsets.UTF_8));

    public static final String METRIC_DIAGNOSTICS = "tracekernel.diagnostics";

    private static final long PROCESS_ID = ProcessHandle.current().pid();

    private final EventSubject<TraceEvent> subject = new EventSubject<>("tk-diagnostics");
    private final Map<DiagnosticEvent, EventSchema> schemas = new EnumMap<>(DiagnosticEvent.class);
    private final Map<DiagnosticEvent, LongAdder> counts = new EnumMap<>(DiagnosticEvent.class);
    private final MetricsRuntime metrics;

    public PipelineDiagnostics() {
        this(MetricsRuntime.NOOP);
    }

    public PipelineDiagnostics(MetricsRuntime metrics) {
        this.metrics = (metrics == null) ? MetricsRuntime.NOOP : metrics;
        for (DiagnosticEvent e : DiagnosticEvent.values()) {
            schemas.put(e, new EventSchema(e.id(), PROVIDER_ID, PROVIDER_NAME, e.level(),
                    e.id(), e.taskName(), 0, e.opcodeName(), e.keywords(),
                    (e.keywords() == DiagnosticKeywords.FORMATTING) ? "Formatting" : "Sink",
                    1, e.payloadNames()));
            counts.put(e, new LongAdder());
        }
    }

    // --- Reports ---

    @Override
    public void sinkFault(String sinkId, String message, Throwable error) {
        emit(DiagnosticEvent.CUSTOM_SINK_FAULT, error, sinkId, message, describe(error));
    }

    @Override
    public void formattingFailed(String sinkId, TraceEvent event, Throwable error) {
        emit(DiagnosticEvent.FORMATTING_FAILED, error, sinkId, event == null ? -1 : event.eventId(), describe(error));
    }

    public void transientPublishError(String sinkId, int failures, Throwable error) {
        emit(DiagnosticEvent.TRANSIENT_PUBLISH_ERROR, null, sinkId, failures, describe(error));
    }

    public void publishFailed(String sinkId, Throwable error) {
        emit(DiagnosticEvent.PUBLISH_FAILED, error, sinkId, describe(error));
    }

    public void entriesDiscarded(String sinkId, int count, String reason) {
        emit(DiagnosticEvent.ENTRIES_DISCARDED, null, sinkId, count, reason);
    }

    public void singleEntryDiscarded(String sinkId, int index, Throwable error) {
        emit(DiagnosticEvent.SINGLE_ENTRY_DISCARDED, null, sinkId, index, describe(error));
    }

    public void entriesPersisted(String sinkId, int count) {
        emit(DiagnosticEvent.ENTRIES_PERSISTED, null, sinkId, count);
    }

    public void bufferOverloaded(String sinkId, int capacity) {
        emit(DiagnosticEvent.BUFFER_OVERLOADED, null, sinkId, capacity);
    }

    public void bufferRestored(String sinkId) {
        emit(DiagnosticEvent.BUFFER_RESTORED, null, sinkId);
    }

    public void eventsLostWhileDisposing(String sinkId, int count) {
        emit(DiagnosticEvent.EVENTS_LOST_WHILE_DISPOSING, null, sinkId, count);
    }

    public void unobservedFault(String sinkId, Throwable error) {
        emit(DiagnosticEvent.UNOBSERVED_FAULT, error, sinkId, describe(error));
    }

    // --- Channel ---

    @Override
    public Subscription subscribe(EventObserver<? super TraceEvent> observer) {
        return subject.subscribe(observer);
    }

    @Override
    public EventSchema schemaFor(UUID providerId, int eventId) {
        if (!PROVIDER_ID.equals(providerId)) {
            throw new IllegalArgumentException("Unknown provider: " + providerId);
        }
        return schemas.get(DiagnosticEvent.byId(eventId));
    }

    public long count(DiagnosticEvent event) {
        return counts.get(event).sum();
    }

    /**
     * Completes the channel; subscribers receive onCompleted.
     */
    @Override
    public void close() {
        subject.onCompleted();
    }

    // --- Helpers ---

    private void emit(DiagnosticEvent kind, Throwable error, Object... payload) {
        counts.get(kind).increment();
        final String message = render(kind, payload);

        switch (kind.level()) {
            case LOG_ALWAYS, CRITICAL, ERROR -> {
                if (error != null) log.error(message, error); else log.error(message);
            }
            case WARNING -> log.warn(message);
            case INFORMATIONAL -> log.info(message);
            default -> log.debug(message);
        }

        metrics.counter(METRIC_DIAGNOSTICS, 1.0, "event", kind.name());

        if (subject.observerCount() == 0) {
            return;
        }
        try {
            subject.onNext(TraceEvent.of(schemas.get(kind), Instant.now(), PROCESS_ID,
                    Thread.currentThread().getId(), null, null, message, Arrays.asList(payload)));
        } catch (RuntimeException e) {
            log.warn("Diagnostics observer failed for {}", kind, e);
        }
    }

    private static String render(DiagnosticEvent kind, Object[] payload) {
        try {
            return new MessageFormat(kind.messageTemplate(), Locale.ROOT).format(payload);
        } catch (IllegalArgumentException e) {
            return kind.name() + " " + Arrays.toString(payload);
        }
    }

    private static String describe(Throwable error) {
        return (error == null) ? "" : error.toString();
    }
}
