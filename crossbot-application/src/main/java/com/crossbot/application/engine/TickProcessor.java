package com.crossbot.application.engine;

import com.crossbot.domain.order.TradeAction;
import com.crossbot.domain.risk.RiskDecision;
import com.crossbot.domain.risk.RiskManager;
import com.crossbot.domain.strategy.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * One tick: Strategy -> RiskManager -> TradingBook.
 * Shared by the live loop and the backtest.
 */
public final class TickProcessor {

    private static final Logger log = LoggerFactory.getLogger(TickProcessor.class);

    private final RiskManager riskManager;
    private final String label;

    public TickProcessor(RiskManager riskManager, String label) {
        this.riskManager = riskManager;
        this.label = label;
    }

    /**
     * @param strategy  the run's strategy instance (stateful)
     * @param history   prices up to and including {@code price}, oldest first
     * @param price     latest price
     * @param timestamp stamped on resulting trades
     * @param book      run state to update
     */
    public RiskDecision process(Strategy strategy, List<Double> history, double price, double timestamp, TradingBook book) {
        TradeAction signal = strategy.decide(history);
        RiskDecision decision = riskManager.evaluate(book.position(), signal, price, timestamp);
        book.apply(decision);

        if (decision.hasTrade()) {
            if (decision.isExit()) {
                log.info("[{}] {} price={} qty={} reason={} pnl={}",
                        label, decision.trade().action(), price, decision.trade().quantity(),
                        decision.exitReason(), String.format("%.6f", decision.realizedPnl()));
            } else {
                log.info("[{}] {} price={} qty={}", label, decision.trade().action(), price, decision.trade().quantity());
            }
        } else if (log.isDebugEnabled()) {
            log.debug("[{}] signal={} price={} open={}", label, signal, price, decision.position() != null);
        }
        return decision;
    }
}
