package com.crossbot.application.execution;

/**
 * Handle of a running worker.
 */
public interface RunHandle {

    /** Signals the worker to exit at its next iteration boundary. Does not wait. */
    void cancel();

    /**
     * Blocks until the worker finished or the timeout elapsed.
     *
     * @return true if the worker has finished
     */
    boolean awaitTermination(long timeoutMs);

    /** Interrupts a worker that did not honor {@link #cancel()} in time. */
    void forceStop();

    boolean isRunning();
}
