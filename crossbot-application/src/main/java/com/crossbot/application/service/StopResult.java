package com.crossbot.application.service;

public enum StopResult {
    /** Worker finished within the timeout. */
    STOPPED,
    /** Worker did not finish in time and was interrupted. */
    FORCED,
    ALREADY_IDLE
}
