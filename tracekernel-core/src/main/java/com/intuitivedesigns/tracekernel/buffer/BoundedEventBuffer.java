/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.buffer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.IntConsumer;

/**
 * Fixed-capacity FIFO between producers and the publishing thread of one sink.
 *
 * <p><b>Overflow policy:</b> drop newest. When full, {@link #tryPost(Object)} rejects the incoming
 * element and counts it; elements already buffered are never evicted.</p>
 *
 * <p>The lock covers only the deque operations. Nothing in here performs I/O.</p>
 *
 * @param <T> element type
 */
public final class BoundedEventBuffer<T> {

    private final int capacity;
    private final ArrayDeque<T> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final LongAdder dropped = new LongAdder();
    private final IntConsumer overloadListener;

    // guarded by lock
    private boolean overloaded;
    private boolean closed;

    public BoundedEventBuffer(int capacity) {
        this(capacity, c -> { });
    }

    /**
     * @param overloadListener called with the capacity on the first rejection after a normal state
     */
    public BoundedEventBuffer(int capacity, IntConsumer overloadListener) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(Math.min(capacity, 1024));
        this.overloadListener = overloadListener;
    }

    /**
     * @return true if appended; false when full (element dropped) or closed
     */
    public boolean tryPost(T element) {
        boolean firstOverflow = false;
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (queue.size() < capacity) {
                queue.addLast(element);
                return true;
            }
            dropped.increment();
            if (!overloaded) {
                overloaded = true;
                firstOverflow = true;
            }
        } finally {
            lock.unlock();
        }

        if (firstOverflow) {
            overloadListener.accept(capacity);
        }
        return false;
    }

    /**
     * Removes up to {@code maxItems} elements from the head, in order.
     */
    public List<T> drain(int maxItems) {
        if (maxItems <= 0) {
            return List.of();
        }
        lock.lock();
        try {
            final int n = Math.min(maxItems, queue.size());
            if (n == 0) {
                return List.of();
            }
            final List<T> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                out.add(queue.pollFirst());
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public List<T> drainAll() {
        return drain(Integer.MAX_VALUE);
    }

    /**
     * Leaves the overloaded state.
     *
     * @return true if the buffer had been overloaded
     */
    public boolean clearOverload() {
        lock.lock();
        try {
            final boolean was = overloaded;
            overloaded = false;
            return was;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops admitting elements. Draining still works.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public boolean isFull() {
        return size() >= capacity;
    }

    public int capacity() {
        return capacity;
    }

    public long droppedCount() {
        return dropped.sum();
    }
}
