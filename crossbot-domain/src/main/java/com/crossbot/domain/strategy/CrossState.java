package com.crossbot.domain.strategy;

/** Position of the short moving average relative to the long one. */
public enum CrossState {
    ABOVE,
    BELOW,
    UNSET
}
