package com.crossbot.domain.risk;

/** Why a position was closed. */
public enum ExitReason {
    SIGNAL,
    STOP_LOSS,
    TAKE_PROFIT
}
