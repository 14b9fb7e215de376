package com.crossbot.application.engine;

import com.crossbot.domain.risk.RiskManager;
import com.crossbot.domain.strategy.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Offline replay of a fixed price series.
 *
 * For each index i the prefix prices[0..i] is the strategy's history and i is the trade
 * timestamp. Each run uses a fresh strategy and its own book, so runs are deterministic
 * and never touch live state.
 */
public class BacktestEngine {

    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    private final Supplier<Strategy> strategyFactory;
    private final TickProcessor ticks;
    private final String symbol;
    private final String interval;

    public BacktestEngine(Supplier<Strategy> strategyFactory, RiskManager riskManager, String symbol, String interval) {
        this.strategyFactory = Objects.requireNonNull(strategyFactory, "strategyFactory");
        this.ticks = new TickProcessor(Objects.requireNonNull(riskManager, "riskManager"), "BACKTEST");
        this.symbol = symbol;
        this.interval = interval;
    }

    public BacktestResult run(List<Double> prices) {
        Objects.requireNonNull(prices, "prices");

        Strategy strategy = strategyFactory.get();
        strategy.reset();
        TradingBook book = new TradingBook();

        for (int i = 0; i < prices.size(); i++) {
            double price = prices.get(i);
            ticks.process(strategy, prices.subList(0, i + 1), price, i, book);
        }

        BookSnapshot end = book.snapshot();
        BacktestResult result = new BacktestResult(
                end.realizedProfit(),
                end.tradeCount(),
                end.trades(),
                end.closedTrades(),
                end.wins(),
                end.position() != null
        );

        log.info("[BACKTEST] symbol={} interval={} candles={} trades={} roundTrips={} winrate={}% profit={} openAtEnd={}",
                symbol, interval, prices.size(), result.tradeCount(), result.closedTrades(),
                String.format("%.2f", result.winRate()), String.format("%.6f", result.profit()), result.openAtEnd());
        return result;
    }
}
