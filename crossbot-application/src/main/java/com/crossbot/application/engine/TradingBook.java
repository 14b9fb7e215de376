package com.crossbot.application.engine;

import com.crossbot.domain.risk.RiskDecision;
import com.crossbot.domain.trade.Position;
import com.crossbot.domain.trade.Trade;

import java.util.ArrayList;
import java.util.List;

/**
 * Open position, append-only trade ledger and realized P&L of one run.
 *
 * All access goes through the instance lock, so a status reader never sees a
 * ledger entry without the matching position change.
 */
public final class TradingBook {

    private final List<Trade> ledger = new ArrayList<>();
    private Position position;
    private double realizedProfit;
    private int closedTrades;
    private int wins;

    public synchronized Position position() {
        return position;
    }

    /** Records the outcome of one risk evaluation. */
    public synchronized void apply(RiskDecision decision) {
        if (decision.hasTrade()) {
            ledger.add(decision.trade());
        }
        if (decision.isExit()) {
            realizedProfit += decision.realizedPnl();
            closedTrades++;
            if (decision.realizedPnl() > 0) wins++;
        }
        position = decision.position();
    }

    public synchronized int tradeCount() {
        return ledger.size();
    }

    public synchronized BookSnapshot snapshot() {
        return new BookSnapshot(position, ledger, realizedProfit, closedTrades, wins);
    }
}
