package com.newsintel.alcalor.service;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop request for the backfill loop. The loop polls {@link #isRequested()}
 * between days and calls {@link #markDrained()} once its checkpoint is written; a
 * shutdown hook requests the stop and waits in {@link #awaitDrained(Duration)}.
 */
public class ShutdownSignal {

    private final AtomicBoolean requested = new AtomicBoolean();
    private final CountDownLatch drained = new CountDownLatch(1);

    public void request() {
        requested.set(true);
    }

    public boolean isRequested() {
        return requested.get();
    }

    public void markDrained() {
        drained.countDown();
    }

    /**
     * @return true when the loop drained within the timeout
     */
    public boolean awaitDrained(Duration timeout) {
        try {
            return drained.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
