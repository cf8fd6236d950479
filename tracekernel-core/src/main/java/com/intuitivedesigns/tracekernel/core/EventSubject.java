/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

import com.intuitivedesigns.tracekernel.util.NamedDaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Fan-out subject: every event pushed in is delivered to every subscribed observer.
 *
 * <p><b>Threading:</b></p>
 * <ul>
 * <li>The observer list is copy-on-write. Subscribe and unsubscribe take a short lock;
 * {@link #onNext(Object)} iterates a volatile snapshot without locking.</li>
 * <li>{@link #onNext(Object)} calls observers on the caller's thread, in subscription order. An observer
 * that throws aborts delivery of that event to later observers and the exception reaches the caller.
 * Sink observers never throw.</li>
 * <li>Completion freezes the subject. Observers subscribed at that point are completed concurrently,
 * one daemon thread each, and the completing call returns once all of them are done.</li>
 * <li>Subscribing to a frozen subject completes the observer immediately.</li>
 * </ul>
 *
 * @param <T> event type
 */
public final class EventSubject<T> implements EventObservable<T>, EventObserver<T>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventSubject.class);

    private final Object lock = new Object();
    private final Executor completionExecutor;

    private volatile List<Registration> observers = List.of();
    private boolean frozen; // guarded by lock

    public EventSubject() {
        this("tk-subject");
    }

    public EventSubject(String threadPrefix) {
        final ThreadFactory threads = new NamedDaemonThreadFactory(threadPrefix + "-complete");
        this.completionExecutor = task -> threads.newThread(task).start();
    }

    @Override
    public Subscription subscribe(EventObserver<? super T> observer) {
        if (observer == null) {
            throw new IllegalArgumentException("observer must not be null");
        }

        synchronized (lock) {
            if (!frozen) {
                final Registration registration = new Registration(observer);
                final List<Registration> next = new ArrayList<>(observers.size() + 1);
                next.addAll(observers);
                next.add(registration);
                observers = List.copyOf(next);
                return registration;
            }
        }

        observer.onCompleted();
        return Subscription.EMPTY;
    }

    @Override
    public void onNext(T event) {
        for (Registration r : observers) {
            r.observer.onNext(event);
        }
    }

    @Override
    public void onCompleted() {
        complete(EventObserver::onCompleted);
    }

    @Override
    public void onError(Throwable error) {
        complete(o -> o.onError(error));
    }

    /**
     * Same as {@link #onCompleted()}.
     */
    @Override
    public void close() {
        onCompleted();
    }

    public int observerCount() {
        return observers.size();
    }

    public boolean isCompleted() {
        synchronized (lock) {
            return frozen;
        }
    }

    private void complete(Consumer<EventObserver<? super T>> signal) {
        final List<Registration> toNotify;
        synchronized (lock) {
            if (frozen) {
                return;
            }
            frozen = true;
            toNotify = observers;
            observers = List.of();
        }

        if (toNotify.isEmpty()) {
            return;
        }

        final CompletableFuture<?>[] tasks = new CompletableFuture<?>[toNotify.size()];
        for (int i = 0; i < tasks.length; i++) {
            final EventObserver<? super T> observer = toNotify.get(i).observer;
            tasks[i] = CompletableFuture.runAsync(() -> {
                try {
                    signal.accept(observer);
                } catch (Throwable t) {
                    log.error("Observer {} failed during completion", observer, t);
                }
            }, completionExecutor);
        }
        CompletableFuture.allOf(tasks).join();
    }

    private void remove(Registration registration) {
        synchronized (lock) {
            if (frozen || !observers.contains(registration)) {
                return;
            }
            final List<Registration> next = new ArrayList<>(observers);
            next.remove(registration);
            observers = List.copyOf(next);
        }
    }

    // Identity-based entry, so the same observer subscribed twice yields two independent registrations
    private final class Registration implements Subscription {
        private final EventObserver<? super T> observer;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Registration(EventObserver<? super T> observer) {
            this.observer = observer;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                remove(this);
            }
        }
    }
}
