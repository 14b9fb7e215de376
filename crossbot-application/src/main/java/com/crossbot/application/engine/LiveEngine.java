package com.crossbot.application.engine;

import com.crossbot.application.execution.CancellableTask;
import com.crossbot.application.execution.CancellationToken;
import com.crossbot.application.execution.ExecutionObserver;
import com.crossbot.application.ports.DataUnavailableException;
import com.crossbot.application.ports.PriceSourcePort;
import com.crossbot.domain.risk.RiskManager;
import com.crossbot.domain.strategy.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Live loop: fetch price, run one tick, wait, repeat until cancelled.
 *
 * A failed fetch skips the tick; any tick error is logged and the loop keeps going.
 * Cancellation is checked after every fetch and before every wait, never mid-tick.
 */
public class LiveEngine implements CancellableTask {

    private static final Logger log = LoggerFactory.getLogger(LiveEngine.class);

    private final Supplier<Strategy> strategyFactory;
    private final TickProcessor ticks;
    private final PriceSourcePort prices;
    private final TradingBook book;
    private final String symbol;
    private final long tickIntervalMs;
    private final Clock clock;
    private final ExecutionObserver observer;

    public LiveEngine(Supplier<Strategy> strategyFactory,
                      RiskManager riskManager,
                      PriceSourcePort prices,
                      TradingBook book,
                      String symbol,
                      long tickIntervalMs,
                      Clock clock,
                      ExecutionObserver observer) {
        this.strategyFactory = Objects.requireNonNull(strategyFactory, "strategyFactory");
        this.ticks = new TickProcessor(Objects.requireNonNull(riskManager, "riskManager"), "ENGINE");
        this.prices = Objects.requireNonNull(prices, "prices");
        this.book = Objects.requireNonNull(book, "book");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.tickIntervalMs = tickIntervalMs;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.observer = observer == null ? ExecutionObserver.NONE : observer;
    }

    @Override
    public void run(CancellationToken token) {
        Strategy strategy = strategyFactory.get();
        strategy.reset();
        PriceHistory history = PriceHistory.forRequiredHistory(strategy.requiredHistory());

        log.info("[ENGINE] session started symbol={} strategy={} tickMs={}",
                symbol, strategy.getParamsSummary(), tickIntervalMs);

        long ticksDone = 0;
        while (!token.isCancelled()) {
            try {
                double price = prices.currentPrice(symbol);
                if (token.isCancelled()) break;

                history.add(price);
                ticks.process(strategy, history.snapshot(), price, clock.millis() / 1000.0, book);
                ticksDone++;
                observer.onTickSuccess(price);

            } catch (DataUnavailableException e) {
                log.warn("[ENGINE] price unavailable for {}, tick skipped: {}", symbol, e.getMessage());
                observer.onTickError(e);
            } catch (RuntimeException e) {
                log.error("[ENGINE] tick failed for {}, continuing", symbol, e);
                observer.onTickError(e);
            }

            if (token.awaitCancellation(tickIntervalMs)) break;
        }

        log.info("[ENGINE] session ended symbol={} ticks={} trades={}", symbol, ticksDone, book.tradeCount());
    }
}
