package com.crossbot.domain.strategy;

import com.crossbot.domain.order.TradeAction;

import java.util.List;

/**
 * Signal capability: turns a price history (oldest first, most recent last) into a trade action.
 *
 * Implementations may keep state between calls; one instance serves exactly one run
 * (a live session or a single backtest).
 */
public interface Strategy {

    TradeAction decide(List<Double> prices);

    /** Drops any state accumulated by previous calls. */
    default void reset() {}

    /** Minimum history length before the strategy can emit anything other than HOLD. */
    default int requiredHistory() {
        return 1;
    }

    default String getParamsSummary() {
        return "No params summary";
    }
}
