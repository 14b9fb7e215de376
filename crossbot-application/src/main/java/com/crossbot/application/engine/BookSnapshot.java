package com.crossbot.application.engine;

import com.crossbot.domain.trade.Position;
import com.crossbot.domain.trade.Trade;

import java.util.List;

/**
 * Consistent point-in-time copy of a {@link TradingBook}.
 *
 * @param position open position or null
 */
public record BookSnapshot(Position position, List<Trade> trades, double realizedProfit, int closedTrades, int wins) {

    public BookSnapshot {
        trades = List.copyOf(trades);
    }

    public Double openPositionPrice() {
        return position == null ? null : position.entryPrice();
    }

    public int tradeCount() {
        return trades.size();
    }
}
