package com.crossbot.application.execution;

/** Long-running task that exits when its token is cancelled. */
@FunctionalInterface
public interface CancellableTask {
    void run(CancellationToken token);
}
