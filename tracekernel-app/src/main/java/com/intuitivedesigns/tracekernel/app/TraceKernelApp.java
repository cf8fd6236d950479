/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.app;

import com.intuitivedesigns.tracekernel.config.PipelineConfig;
import com.intuitivedesigns.tracekernel.config.PipelineFactory;
import com.intuitivedesigns.tracekernel.core.EventPipeline;
import com.intuitivedesigns.tracekernel.diagnostics.DiagnosticEvent;
import com.intuitivedesigns.tracekernel.diagnostics.PipelineDiagnostics;
import com.intuitivedesigns.tracekernel.metrics.MetricsFactory;
import com.intuitivedesigns.tracekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tracekernel.metrics.MetricsSettings;
import com.intuitivedesigns.tracekernel.util.Closeables;
import com.intuitivedesigns.tracekernel.util.NamedDaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public final class TraceKernelApp {

    private static final Logger log = LoggerFactory.getLogger(TraceKernelApp.class);

    // --- Config Keys ---
    private static final String CFG_SYNTHETIC_RATE = "app.synthetic.rate";
    private static final String CFG_SYNTHETIC_DURATION_SECONDS = "app.synthetic.duration.seconds";
    private static final String CFG_SPEEDOMETER_ENABLED = "tracekernel.speedometer.enabled";
    private static final String CFG_SPEEDOMETER_WINDOW_SECONDS = "tracekernel.speedometer.window.seconds";

    // --- Defaults ---
    private static final int DEFAULT_RATE = 1_000;
    private static final int DEFAULT_WINDOW_SECONDS = 10;
    private static final int MIN_WINDOW_SECONDS = 5;
    private static final int MAX_WINDOW_SECONDS = 60;

    private TraceKernelApp() {}

    public static void main(String[] args) {
        log.info("=== Booting TraceKernel ===");

        final PipelineConfig config = PipelineConfig.get();
        final PipelineFactory factory = PipelineFactory.discover();
        factory.logAvailablePlugins();

        MetricsRuntime metrics = null;
        EventPipeline pipeline = null;
        ScheduledExecutorService speedometerScheduler = null;

        final CountDownLatch shutdownLatch = new CountDownLatch(1);
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        try {
            // 1. Metrics
            metrics = MetricsFactory.init(MetricsSettings.from(config));

            // 2. Tuning
            final int rate = Math.max(1, config.getInt(CFG_SYNTHETIC_RATE, DEFAULT_RATE));
            final long durationSeconds = config.getLong(CFG_SYNTHETIC_DURATION_SECONDS, 0L);
            final Duration duration = (durationSeconds > 0) ? Duration.ofSeconds(durationSeconds) : null;
            final boolean speedometerEnabled = config.getBoolean(CFG_SPEEDOMETER_ENABLED, true);
            final int windowSeconds = clampInt(
                    config.getInt(CFG_SPEEDOMETER_WINDOW_SECONDS, DEFAULT_WINDOW_SECONDS),
                    MIN_WINDOW_SECONDS,
                    MAX_WINDOW_SECONDS
            );

            log.info("CONFIG: Rate={}/s | Duration={} | Speedometer={} | Metrics={}",
                    rate, duration == null ? "until signal" : duration, speedometerEnabled ? "ON" : "OFF", metrics.type());

            // 3. Pipeline
            pipeline = factory.build(config, metrics);

            // 4. Speedometer
            if (speedometerEnabled) {
                speedometerScheduler = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("tk-speedometer"));
                startSpeedometer(speedometerScheduler, pipeline, windowSeconds);
            }

            // 5. Shutdown
            final MetricsRuntime finalMetrics = metrics;
            final EventPipeline finalPipeline = pipeline;
            final ScheduledExecutorService finalSpeedometer = speedometerScheduler;
            final Runnable shutdown = () -> {
                if (!shutdownStarted.compareAndSet(false, true)) {
                    return;
                }
                try {
                    stop(finalSpeedometer, finalPipeline, finalMetrics);
                } finally {
                    shutdownLatch.countDown();
                }
            };

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutdown signal received.");
                shutdown.run();
            }, "tk-shutdown"));

            // 6. Launch
            final SyntheticEventSource source = new SyntheticEventSource();
            final Thread producer = new NamedDaemonThreadFactory("tk-synthetic").newThread(() -> {
                try {
                    source.run(finalPipeline, rate, duration, () -> !shutdownStarted.get());
                } catch (Throwable t) {
                    log.error("Synthetic source failed", t);
                } finally {
                    shutdown.run();
                }
            });
            producer.start();

            shutdownLatch.await();
            log.info("TraceKernel stopped.");
        } catch (Throwable t) {
            log.error("Fatal application error", t);

            if (shutdownStarted.compareAndSet(false, true)) {
                stop(speedometerScheduler, pipeline, metrics);
                shutdownLatch.countDown();
            }

            System.exit(1);
        }
    }

    /**
     * Closing the pipeline drains every sink within its configured timeout.
     */
    private static void stop(ScheduledExecutorService speedometer, EventPipeline pipeline, MetricsRuntime metrics) {
        if (speedometer != null) {
            speedometer.shutdownNow();
        }
        Closeables.closeQuietly(pipeline, "pipeline");
        Closeables.closeQuietly(metrics, "metrics");
    }

    private static void startSpeedometer(ScheduledExecutorService scheduler, EventPipeline pipeline, int windowSeconds) {
        log.info("Speedometer active ({}s window): Emitted + Discarded", windowSeconds);

        final PipelineDiagnostics diagnostics = pipeline.diagnostics();
        final long periodNs = TimeUnit.SECONDS.toNanos(windowSeconds);

        scheduler.scheduleAtFixedRate(new Runnable() {
            private long lastTimeNs = System.nanoTime();
            private long lastEmitted = 0;

            @Override
            public void run() {
                try {
                    final long nowNs = System.nanoTime();
                    final long elapsedNs = nowNs - lastTimeNs;
                    if (elapsedNs <= 0) {
                        return;
                    }
                    final double seconds = elapsedNs / 1_000_000_000.0;

                    final long emittedNow = pipeline.emittedCount();
                    final double emittedEps = (emittedNow - lastEmitted) / seconds;

                    log.info(String.format(
                            Locale.US,
                            "AVG %ds | EMITTED: %,.0f eps | DISCARD REPORTS: %,d | OVERLOADS: %,d",
                            windowSeconds,
                            emittedEps,
                            diagnostics.count(DiagnosticEvent.ENTRIES_DISCARDED) + diagnostics.count(DiagnosticEvent.SINGLE_ENTRY_DISCARDED),
                            diagnostics.count(DiagnosticEvent.BUFFER_OVERLOADED)
                    ));

                    lastEmitted = emittedNow;
                    lastTimeNs = nowNs;
                } catch (Throwable t) {
                    log.warn("Speedometer error", t);
                }
            }
        }, periodNs, periodNs, TimeUnit.NANOSECONDS);
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
