package com.crossbot.application.execution;

/**
 * Optional observer for live-loop telemetry (health/status).
 */
public interface ExecutionObserver {
    ExecutionObserver NONE = new ExecutionObserver() {};

    default void onTickSuccess(double price) {}
    default void onTickError(Exception error) {}
}
