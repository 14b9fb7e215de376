package com.crossbot.domain.risk;

import com.crossbot.domain.trade.Position;
import com.crossbot.domain.trade.Trade;

/**
 * Outcome of one risk evaluation.
 *
 * @param trade       the trade to record, or null when nothing happens on this tick
 * @param position    the open position after this tick, or null when flat
 * @param exitReason  set only when {@code trade} closes a position
 * @param realizedPnl P&L realized by {@code trade} (0 for opens and no-ops)
 */
public record RiskDecision(Trade trade, Position position, ExitReason exitReason, double realizedPnl) {

    public static RiskDecision none(Position position) {
        return new RiskDecision(null, position, null, 0.0);
    }

    public static RiskDecision open(Trade buy) {
        return new RiskDecision(buy, Position.openedBy(buy), null, 0.0);
    }

    public static RiskDecision close(Trade sell, ExitReason reason, double realizedPnl) {
        return new RiskDecision(sell, null, reason, realizedPnl);
    }

    public boolean hasTrade() {
        return trade != null;
    }

    public boolean isExit() {
        return exitReason != null;
    }
}
