package com.crossbot.application.service;

import com.crossbot.application.config.BotSettings;
import com.crossbot.application.engine.BacktestEngine;
import com.crossbot.application.engine.BacktestResult;
import com.crossbot.application.engine.BookSnapshot;
import com.crossbot.application.engine.LiveEngine;
import com.crossbot.application.engine.TradingBook;
import com.crossbot.application.execution.ExecutionObserver;
import com.crossbot.application.execution.JobScheduler;
import com.crossbot.application.execution.RunHandle;
import com.crossbot.application.lifecycle.BotStateManager;
import com.crossbot.application.ports.DataUnavailableException;
import com.crossbot.application.ports.PriceSourcePort;
import com.crossbot.domain.risk.RiskManager;
import com.crossbot.domain.strategy.Strategy;
import com.crossbot.domain.strategy.StrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Owns one trading bot: its live worker, live position and ledger, and backtests.
 * Entry point for the REST layer.
 *
 * - start()/stop() are idempotent and serialized; at most one live worker exists,
 *   so start() refuses while a force-stopped worker is still exiting.
 * - stop() waits up to stopTimeoutMs for the worker, then interrupts it (FORCED).
 * - status() never blocks on start()/stop().
 * - backtest() runs on the caller thread with its own state.
 *
 * The live ledger and position survive stop/start; the strategy state does not.
 */
public class BotController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BotController.class);

    /** Largest series a backtest fetches; Binance klines return at most 1000. */
    public static final int MAX_BACKTEST_CANDLES = 1000;

    private final BotSettings settings;
    private final Supplier<Strategy> strategyFactory;
    private final RiskManager riskManager;
    private final PriceSourcePort prices;
    private final JobScheduler scheduler;
    private final Clock clock;

    private final BotStateManager state = new BotStateManager();
    private final TradingBook liveBook = new TradingBook();
    private final Object lifecycleLock = new Object();

    private RunHandle worker;
    // force-stopped worker whose thread may not have exited yet
    private RunHandle draining;

    private volatile Instant lastTickAt;
    private volatile String lastError;

    public BotController(BotSettings settings,
                         StrategyRegistry strategies,
                         PriceSourcePort prices,
                         JobScheduler scheduler,
                         Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(strategies, "strategies");
        this.prices = Objects.requireNonNull(prices, "prices");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = clock == null ? Clock.systemUTC() : clock;

        // fail fast on bad strategy or risk parameters
        strategies.create(settings.strategy());
        this.riskManager = settings.riskManager();
        this.strategyFactory = () -> strategies.create(settings.strategy());
    }

    public BotSettings settings() {
        return settings;
    }

    public StartResult start() {
        synchronized (lifecycleLock) {
            if (state.isRunning()) {
                log.info("[BOT] start ignored: already running");
                return StartResult.ALREADY_RUNNING;
            }
            if (draining != null) {
                if (draining.isRunning() && !draining.awaitTermination(settings.stopTimeoutMs())) {
                    log.warn("[BOT] start rejected: previous worker still exiting");
                    return StartResult.STILL_STOPPING;
                }
                draining = null;
            }
            if (!state.tryStart()) {
                return StartResult.ALREADY_RUNNING;
            }

            LiveEngine engine = new LiveEngine(
                    strategyFactory,
                    riskManager,
                    prices,
                    liveBook,
                    settings.symbol(),
                    settings.tickIntervalMs(),
                    clock,
                    new TelemetryObserver()
            );
            worker = scheduler.submit("live-" + settings.symbol(), engine);
            log.info("[BOT] started symbol={}", settings.symbol());
            return StartResult.STARTED;
        }
    }

    public StopResult stop() {
        synchronized (lifecycleLock) {
            if (!state.isRunning()) {
                return StopResult.ALREADY_IDLE;
            }

            RunHandle handle = worker;
            worker = null;
            handle.cancel();
            boolean finished = handle.awaitTermination(settings.stopTimeoutMs());
            if (!finished) {
                handle.forceStop();
                draining = handle;
                log.warn("[BOT] worker did not stop within {} ms, interrupted", settings.stopTimeoutMs());
            }
            state.tryStop();
            log.info("[BOT] stopped symbol={} clean={}", settings.symbol(), finished);
            return finished ? StopResult.STOPPED : StopResult.FORCED;
        }
    }

    public BotStatus status() {
        BookSnapshot snap = liveBook.snapshot();
        return new BotStatus(
                state.isRunning(),
                state.getState(),
                snap.openPositionPrice(),
                snap.tradeCount(),
                snap.realizedProfit(),
                lastTickAt,
                lastError
        );
    }

    /** Live ledger copy, in execution order. */
    public BookSnapshot ledger() {
        return liveBook.snapshot();
    }

    /**
     * Backtests over the last {@code numCandles} prices from the price source.
     *
     * @throws DataUnavailableException if the series cannot be fetched
     */
    public BacktestResult backtest(int numCandles) throws DataUnavailableException {
        if (numCandles < 1 || numCandles > MAX_BACKTEST_CANDLES) {
            throw new IllegalArgumentException(
                    "num_candles must be in [1, " + MAX_BACKTEST_CANDLES + "], got: " + numCandles);
        }
        List<Double> series = prices.recentPrices(settings.symbol(), settings.interval(), numCandles);
        return backtest(series);
    }

    /** Backtests over a caller-supplied series, oldest first. */
    public BacktestResult backtest(List<Double> series) {
        return new BacktestEngine(strategyFactory, riskManager, settings.symbol(), settings.interval()).run(series);
    }

    @Override
    public void close() {
        stop();
    }

    private final class TelemetryObserver implements ExecutionObserver {
        @Override
        public void onTickSuccess(double price) {
            lastTickAt = clock.instant();
            lastError = null;
        }

        @Override
        public void onTickError(Exception error) {
            lastTickAt = clock.instant();
            lastError = error == null ? "unknown" : String.valueOf(error.getMessage());
        }
    }
}
