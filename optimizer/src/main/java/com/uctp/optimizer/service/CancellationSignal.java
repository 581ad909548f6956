package com.uctp.optimizer.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag for a running optimization, checked between
 * generations. A cancelled run still returns its best candidates so far.
 */
public class CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }
}
