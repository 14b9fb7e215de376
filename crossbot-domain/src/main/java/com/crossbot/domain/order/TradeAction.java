package com.crossbot.domain.order;

/** Signal produced by a strategy for the latest tick. */
public enum TradeAction {
    BUY,
    SELL,
    HOLD
}
