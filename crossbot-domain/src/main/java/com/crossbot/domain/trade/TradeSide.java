package com.crossbot.domain.trade;

public enum TradeSide {
    BUY,
    SELL
}
