package com.crossbot.domain.trade;

import java.util.Objects;

/**
 * Executed (simulated) trade, one ledger entry.
 *
 * timestamp is wall-clock seconds in live mode and the series index in a backtest.
 */
public record Trade(double timestamp, TradeSide action, double price, double quantity) {

    public Trade {
        Objects.requireNonNull(action, "action");
        if (!(price > 0)) throw new IllegalArgumentException("price must be positive: " + price);
        if (!(quantity > 0)) throw new IllegalArgumentException("quantity must be positive: " + quantity);
    }

    public static Trade buy(double timestamp, double price, double quantity) {
        return new Trade(timestamp, TradeSide.BUY, price, quantity);
    }

    public static Trade sell(double timestamp, double price, double quantity) {
        return new Trade(timestamp, TradeSide.SELL, price, quantity);
    }
}
