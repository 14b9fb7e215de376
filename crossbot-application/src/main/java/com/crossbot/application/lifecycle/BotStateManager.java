package com.crossbot.application.lifecycle;

/**
 * IDLE <-> RUNNING state holder. Reads are lock-free.
 */
public class BotStateManager {

    private volatile BotState state = BotState.IDLE;

    /** @return true if the state moved IDLE -> RUNNING */
    public synchronized boolean tryStart() {
        if (state == BotState.RUNNING) return false;
        state = BotState.RUNNING;
        return true;
    }

    /** @return true if the state moved RUNNING -> IDLE */
    public synchronized boolean tryStop() {
        if (state == BotState.IDLE) return false;
        state = BotState.IDLE;
        return true;
    }

    public BotState getState() { return state; }

    public boolean isRunning() { return state == BotState.RUNNING; }
}
