package com.crossbot.application.execution;

/**
 * Launches background workers. The app code does not care which threads run them.
 */
public interface JobScheduler {
    RunHandle submit(String key, CancellableTask task);
}
