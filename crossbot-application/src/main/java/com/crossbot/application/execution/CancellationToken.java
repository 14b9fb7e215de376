package com.crossbot.application.execution;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal passed into a worker loop.
 * The loop checks it once per iteration and waits on it instead of sleeping,
 * so a cancel wakes an idle worker immediately.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits up to {@code millis} for cancellation.
     *
     * @return true if cancelled (or the waiting thread was interrupted)
     */
    public boolean awaitCancellation(long millis) {
        try {
            return cancelled.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
