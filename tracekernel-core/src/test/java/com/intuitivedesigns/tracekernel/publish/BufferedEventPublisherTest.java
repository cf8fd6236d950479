/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.publish;

import com.intuitivedesigns.tracekernel.core.RecordingSink;
import com.intuitivedesigns.tracekernel.core.TestEvents;
import com.intuitivedesigns.tracekernel.core.TraceEvent;
import com.intuitivedesigns.tracekernel.diagnostics.DiagnosticEvent;
import com.intuitivedesigns.tracekernel.diagnostics.PipelineDiagnostics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class BufferedEventPublisherTest {

    private static final RetryPolicy FAST_RETRY =
            new RetryPolicy(5, Duration.ofMillis(1), Duration.ofMillis(10), Duration.ofMillis(1));

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final PipelineDiagnostics diagnostics = new PipelineDiagnostics();
    private BufferedEventPublisher publisher;

    @AfterEach
    void tearDown() {
        if (publisher != null) {
            publisher.dispose(Duration.ZERO);
        }
    }

    private BufferedEventPublisher start(RecordingSink sink, int count, int maxBuffer) {
        BufferingSettings settings = new BufferingSettings(Duration.ofSeconds(60), count, maxBuffer, WAIT, FAST_RETRY);
        publisher = BufferedEventPublisher.create("orders", sink, settings, diagnostics, null);
        return publisher;
    }

    private static List<Integer> seqs(List<TraceEvent> events) {
        return events.stream().map(TestEvents::seq).collect(Collectors.toList());
    }

    private static List<Integer> range(int n) {
        return IntStream.range(0, n).boxed().collect(Collectors.toList());
    }

    @Test
    void testCountThresholdTriggersPublishBeforeTimer() {
        RecordingSink sink = new RecordingSink();
        start(sink, 3, 100);

        for (TraceEvent e : TestEvents.infos(3)) {
            assertTrue(publisher.tryPost(e));
        }

        assertTrue(TestEvents.await(() -> sink.persisted().size() == 3, WAIT));
        assertEquals(1, sink.callCount());
        assertEquals(range(3), seqs(sink.persisted()));
    }

    @Test
    void testTimerPublishesLoneEvent() {
        RecordingSink sink = new RecordingSink();
        BufferingSettings settings = new BufferingSettings(Duration.ofMillis(100), 1000, 5000, WAIT, FAST_RETRY);
        publisher = BufferedEventPublisher.create("orders", sink, settings, diagnostics, null);

        publisher.tryPost(TestEvents.info(0));

        assertEquals(BufferingSettings.MINIMUM_INTERVAL, settings.effectiveInterval());
        assertTrue(TestEvents.await(() -> sink.persisted().size() == 1, WAIT));
    }

    @Test
    void testBatchesNeverExceedBufferingCountAndKeepOrder() throws Exception {
        RecordingSink sink = new RecordingSink();
        start(sink, 3, 100);

        TestEvents.infos(10).forEach(publisher::tryPost);
        publisher.flushAsync().get(5, TimeUnit.SECONDS);

        assertEquals(range(10), seqs(sink.persisted()));
        assertTrue(sink.calls().stream().allMatch(batch -> batch.size() <= 3));
    }

    @Test
    void testOverflowDropsNewestAndReportsOnce() throws Exception {
        // Setup
        RecordingSink sink = new RecordingSink();
        start(sink, 0, 5);

        // Act
        List<Boolean> accepted = TestEvents.infos(8).stream()
                .map(publisher::tryPost)
                .collect(Collectors.toList());

        // Assert
        assertEquals(List.of(true, true, true, true, true, false, false, false), accepted);
        assertEquals(3, publisher.droppedCount());
        assertEquals(1, diagnostics.count(DiagnosticEvent.BUFFER_OVERLOADED));

        publisher.flushAsync().get(5, TimeUnit.SECONDS);
        assertEquals(range(5), seqs(sink.persisted()));
        assertEquals(1, diagnostics.count(DiagnosticEvent.BUFFER_RESTORED));
    }

    @Test
    void testFlushOnEmptyBufferCompletesImmediately() {
        start(new RecordingSink(), 3, 100);

        CompletableFuture<Void> flush = publisher.flushAsync();

        assertTrue(flush.isDone());
        assertFalse(flush.isCompletedExceptionally());
    }

    @Test
    void testFlushFailsWhenBatchIsDiscarded() {
        RecordingSink sink = new RecordingSink().then(RecordingSink.fatalFailure());
        start(sink, 0, 100);
        publisher.tryPost(TestEvents.info(0));
        publisher.tryPost(TestEvents.info(1));

        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> publisher.flushAsync().get(5, TimeUnit.SECONDS));

        assertInstanceOf(FlushFailedException.class, thrown.getCause());
        assertEquals(2, publisher.discardedCount());
    }

    @Test
    void testCountTriggerPausedAfterFailureUntilSuccess() throws Exception {
        RecordingSink sink = new RecordingSink().then(RecordingSink.fatalFailure());
        start(sink, 3, 100);

        TestEvents.infos(3).forEach(publisher::tryPost);
        assertTrue(TestEvents.await(() -> publisher.discardedCount() == 3, WAIT));
        Thread.sleep(100);

        for (int i = 3; i < 6; i++) {
            publisher.tryPost(TestEvents.info(i));
        }
        Thread.sleep(300);
        assertEquals(1, sink.callCount());

        publisher.flushAsync().get(5, TimeUnit.SECONDS);
        assertEquals(2, sink.callCount());

        for (int i = 6; i < 9; i++) {
            publisher.tryPost(TestEvents.info(i));
        }
        assertTrue(TestEvents.await(() -> sink.callCount() == 3, WAIT));
        assertEquals(List.of(3, 4, 5, 6, 7, 8), seqs(sink.persisted()));
    }

    @Test
    void testTransientFailuresAreRetriedInBackground() {
        RecordingSink sink = new RecordingSink().thenTimes(2, RecordingSink.transientFailure());
        start(sink, 3, 100);

        TestEvents.infos(3).forEach(publisher::tryPost);

        assertTrue(TestEvents.await(() -> sink.persisted().size() == 3, WAIT));
        assertEquals(3, publisher.publishAttempts());
        assertEquals(2, diagnostics.count(DiagnosticEvent.TRANSIENT_PUBLISH_ERROR));
    }

    @Test
    void testDisposeFlushesAndClosesSinkOnce() {
        // Setup
        RecordingSink sink = new RecordingSink();
        start(sink, 0, 100);
        TestEvents.infos(5).forEach(publisher::tryPost);

        // Act
        publisher.close();
        publisher.close();

        // Assert
        assertEquals(range(5), seqs(sink.persisted()));
        assertEquals(1, sink.closeCount());
        assertEquals(PublisherState.DISPOSED, publisher.state());
        assertFalse(publisher.tryPost(TestEvents.info(99)));
        assertEquals(0, publisher.droppedCount());
        assertEquals(0, diagnostics.count(DiagnosticEvent.EVENTS_LOST_WHILE_DISPOSING));
    }

    @Test
    void testZeroTimeoutDisposeReportsLostEvents() {
        RecordingSink sink = new RecordingSink();
        start(sink, 0, 100);
        TestEvents.infos(5).forEach(publisher::tryPost);

        publisher.dispose(Duration.ZERO);

        assertEquals(0, sink.callCount());
        assertEquals(0, publisher.persistedCount());
        assertEquals(5, publisher.discardedCount());
        assertEquals(5, publisher.lostWhileDisposingCount());
        assertEquals(1, sink.closeCount());
        assertEquals(1, diagnostics.count(DiagnosticEvent.EVENTS_LOST_WHILE_DISPOSING));
        assertTrue(publisher.isDisposed());
    }

    @Test
    void testDisposeIsBoundedWhenSinkHangs() throws Exception {
        CountDownLatch never = new CountDownLatch(1);
        RecordingSink sink = new RecordingSink().then(batch -> {
            never.await();
            return batch.size();
        });
        start(sink, 1, 100);
        publisher.tryPost(TestEvents.info(0));
        assertTrue(TestEvents.await(() -> sink.callCount() == 1, WAIT));

        long startNs = System.nanoTime();
        publisher.dispose(Duration.ofMillis(200));
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);

        assertTrue(tookMs < 1500, "dispose took " + tookMs + " ms");
        assertTrue(TestEvents.await(() -> sink.closeCount() == 1, WAIT));
        assertEquals(0, sink.persisted().size());
    }

    @Test
    void testDisposeDoesNotWaitForSinkIgnoringInterrupts() throws Exception {
        // Setup
        AtomicBoolean publishing = new AtomicBoolean();
        AtomicBoolean closedWhilePublishing = new AtomicBoolean();
        RecordingSink sink = new RecordingSink() {
            @Override
            public void close() {
                if (publishing.get()) {
                    closedWhilePublishing.set(true);
                }
                super.close();
            }
        }.then(batch -> {
            publishing.set(true);
            long end = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (System.nanoTime() < end) {
                try {
                    Thread.sleep(10);
                } catch (InterruptedException ignored) {
                    // keep going, this store does not honour interrupts
                }
            }
            publishing.set(false);
            return batch.size();
        });
        start(sink, 1, 100);
        publisher.tryPost(TestEvents.info(0));
        assertTrue(TestEvents.await(publishing::get, WAIT));

        // Act
        long startNs = System.nanoTime();
        publisher.dispose(Duration.ofMillis(200));
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);

        // Assert
        assertTrue(tookMs < 1500, "dispose took " + tookMs + " ms");
        assertEquals(0, sink.closeCount());
        assertFalse(publisher.isSinkClosed());
        assertTrue(TestEvents.await(() -> sink.closeCount() == 1, WAIT));
        assertFalse(closedWhilePublishing.get());
        assertTrue(publisher.isSinkClosed());
    }

    @Test
    void testFlushAfterDisposeCompletes() {
        start(new RecordingSink(), 3, 100);
        publisher.close();

        assertTrue(publisher.flushAsync().isDone());
    }
}
