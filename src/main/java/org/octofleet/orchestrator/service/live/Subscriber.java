package org.octofleet.orchestrator.service.live;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One viewer of a live session. Frames are queued up to {@code capacity} and written to the
 * sink by a single drain task at a time, so a slow viewer never blocks the upstream reader
 * or the other viewers.
 */
@Slf4j
final class Subscriber {

    private final FrameSink sink;
    private final int capacity;
    private final Executor executor;
    private final Runnable onProgress;
    private final Consumer<Subscriber> onFailure;

    private final ArrayDeque<LiveFrame> queue = new ArrayDeque<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong dropped = new AtomicLong();
    private boolean finishing;

    Subscriber(FrameSink sink, int capacity, Executor executor, Runnable onProgress, Consumer<Subscriber> onFailure) {
        this.sink = sink;
        this.capacity = Math.max(1, capacity);
        this.executor = executor;
        this.onProgress = onProgress;
        this.onFailure = onFailure;
    }

    String id() { return sink.id(); }

    long dropped() { return dropped.get(); }

    /** Drop-oldest enqueue; always accepts. */
    synchronized void offerDroppingOldest(LiveFrame frame) {
        if (finishing) return;
        while (queue.size() >= capacity) {
            queue.pollFirst();
            dropped.incrementAndGet();
        }
        queue.addLast(frame);
    }

    /**
     * Enqueues a frame the caller already found room for under the session lock. Control
     * frames may have landed in between, so capacity is not checked again.
     */
    synchronized void offerReserved(LiveFrame frame) {
        if (!finishing) queue.addLast(frame);
    }

    synchronized boolean hasRoom() {
        return !finishing && queue.size() < capacity;
    }

    synchronized int queued() {
        return queue.size();
    }

    /** Control frames (pong, info) go out regardless of capacity. */
    synchronized void offerControl(LiveFrame frame) {
        if (!finishing) queue.addLast(frame);
    }

    /** Queues the final frame; the sink is closed once everything before it is written. */
    void finish(LiveFrame last) {
        synchronized (this) {
            if (finishing) return;
            if (last != null) queue.addLast(last);
            finishing = true;
        }
        schedule();
    }

    void schedule() {
        if (closed.get() || !draining.compareAndSet(false, true)) return;
        try {
            executor.execute(this::drain);
        } catch (RuntimeException e) {
            draining.set(false);
            log.warn("[Live] relay executor rejected drain for {}: {}", id(), e.getMessage());
            onFailure.accept(this);
        }
    }

    private void drain() {
        while (true) {
            LiveFrame next;
            synchronized (this) {
                next = queue.pollFirst();
                if (next == null) {
                    draining.set(false);
                    if (finishing) {
                        closeSink();
                    }
                    return;
                }
            }
            try {
                sink.send(next);
            } catch (IOException | RuntimeException e) {
                log.debug("[Live] viewer {} write failed: {}", id(), e.getMessage());
                synchronized (this) {
                    queue.clear();
                    finishing = true;
                }
                draining.set(false);
                closeSink();
                onFailure.accept(this);
                return;
            }
            onProgress.run();
        }
    }

    private void closeSink() {
        if (closed.compareAndSet(false, true)) {
            try {
                sink.close();
            } catch (RuntimeException e) {
                log.debug("[Live] viewer {} close failed: {}", id(), e.getMessage());
            }
        }
    }
}
