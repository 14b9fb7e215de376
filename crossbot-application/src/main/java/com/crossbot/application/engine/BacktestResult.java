package com.crossbot.application.engine;

import com.crossbot.domain.trade.Trade;

import java.util.List;

/**
 * Backtest summary.
 *
 * @param profit       sum of realized P&L; a position still open at the end counts 0
 * @param tradeCount   number of ledger entries (BUY and SELL)
 * @param trades       the ledger, in execution order
 * @param closedTrades number of round trips
 * @param wins         round trips with positive P&L
 * @param openAtEnd    whether a position was still open after the last price
 */
public record BacktestResult(double profit,
                             int tradeCount,
                             List<Trade> trades,
                             int closedTrades,
                             int wins,
                             boolean openAtEnd) {

    public BacktestResult {
        trades = List.copyOf(trades);
    }

    /** Share of winning round trips, in percent. */
    public double winRate() {
        return closedTrades > 0 ? wins * 100.0 / closedTrades : 0.0;
    }
}
