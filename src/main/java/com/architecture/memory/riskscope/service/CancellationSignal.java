package com.architecture.memory.riskscope.service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Top-down cancellation for one risk check. Cancelling aborts registered in-flight tasks;
 * the investigation loop polls {@link #isCancelled()} between hops.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Future<?>> inFlight = new CopyOnWriteArrayList<>();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            inFlight.forEach(f -> f.cancel(true));
            inFlight.clear();
        }
    }

    /**
     * Tracks a task so {@link #cancel()} can abort it. A task registered after cancellation
     * is cancelled immediately.
     */
    public void register(Future<?> future) {
        inFlight.add(future);
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    public void release(Future<?> future) {
        inFlight.remove(future);
    }
}
