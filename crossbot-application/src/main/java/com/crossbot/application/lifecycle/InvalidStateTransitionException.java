package com.crossbot.application.lifecycle;

import com.crossbot.domain.DomainException;

/**
 * A lifecycle request that does not apply in the current state
 * (start while running, stop while idle). Rejected, not fatal.
 */
public final class InvalidStateTransitionException extends DomainException {

    private final BotState state;

    public InvalidStateTransitionException(String message, BotState state) {
        super(message);
        this.state = state;
    }

    public BotState state() {
        return state;
    }
}
