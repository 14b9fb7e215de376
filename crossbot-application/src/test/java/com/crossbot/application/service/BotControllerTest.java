package com.crossbot.application.service;

import com.crossbot.application.config.BotSettings;
import com.crossbot.application.engine.BacktestResult;
import com.crossbot.application.execution.CancellableTask;
import com.crossbot.application.execution.JobScheduler;
import com.crossbot.application.execution.RunHandle;
import com.crossbot.application.execution.impl.DefaultJobScheduler;
import com.crossbot.application.lifecycle.BotState;
import com.crossbot.application.ports.DataUnavailableException;
import com.crossbot.application.ports.PriceSourcePort;
import com.crossbot.application.support.Await;
import com.crossbot.application.support.ScriptedPriceSource;
import com.crossbot.domain.ConfigurationException;
import com.crossbot.domain.strategy.StrategyConfig;
import com.crossbot.domain.strategy.StrategyRegistry;
import com.crossbot.domain.trade.Trade;
import com.crossbot.domain.trade.TradeSide;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BotControllerTest {

    private static final List<Double> CROSSING =
            List.of(10.0, 10.0, 10.0, 10.0, 11.0, 12.0, 13.0, 9.0, 8.0, 7.0, 7.0);

    private final DefaultJobScheduler pool = new DefaultJobScheduler();
    private final CountingScheduler scheduler = new CountingScheduler(pool);
    private final StrategyRegistry registry = StrategyRegistry.withDefaults();

    private BotController controller;

    private static BotSettings fastSettings() {
        return BotSettings.defaults()
                .withStrategy(StrategyConfig.sma(2, 4))
                .withRisk(1.0, 0.5, 0.5)
                .withTiming(1, 2_000);
    }

    private BotController controller(PriceSourcePort prices, BotSettings settings) {
        controller = new BotController(settings, registry, prices, scheduler, Clock.systemUTC());
        return controller;
    }

    @AfterEach
    void tearDown() {
        if (controller != null) controller.stop();
        pool.shutdown();
    }

    @Test
    void newControllerIsIdleAndEmpty() {
        BotStatus s = controller(ScriptedPriceSource.constant(100.0, 1), fastSettings()).status();

        assertThat(s.running()).isFalse();
        assertThat(s.state()).isEqualTo(BotState.IDLE);
        assertThat(s.openPositionPrice()).isNull();
        assertThat(s.tradeCount()).isZero();
        assertThat(s.lastTickAt()).isNull();
    }

    @Test
    void stopWhileIdleIsANoOp() {
        BotController bot = controller(ScriptedPriceSource.constant(100.0, 1), fastSettings());

        assertThat(bot.stop()).isEqualTo(StopResult.ALREADY_IDLE);
        assertThat(bot.status().running()).isFalse();
    }

    @Test
    void startWhileRunningDoesNotSpawnASecondWorker() {
        BotController bot = controller(ScriptedPriceSource.constant(100.0, 100_000), fastSettings());

        assertThat(bot.start()).isEqualTo(StartResult.STARTED);
        assertThat(bot.start()).isEqualTo(StartResult.ALREADY_RUNNING);

        assertThat(scheduler.submitted.get()).isEqualTo(1);
        assertThat(bot.status().running()).isTrue();
    }

    @Test
    void liveRunRecordsTradesAndStopsCleanly() {
        ScriptedPriceSource source = new ScriptedPriceSource(CROSSING.subList(0, 5));
        BotController bot = controller(source, fastSettings());

        bot.start();
        Await.until(() -> bot.status().tradeCount() == 1, 2_000);

        BotStatus running = bot.status();
        assertThat(running.running()).isTrue();
        assertThat(running.openPositionPrice()).isEqualTo(11.0);
        assertThat(running.lastTickAt()).isNotNull();

        assertThat(bot.stop()).isEqualTo(StopResult.STOPPED);
        BotStatus stopped = bot.status();
        assertThat(stopped.running()).isFalse();
        assertThat(stopped.state()).isEqualTo(BotState.IDLE);
        // position and ledger outlive the session
        assertThat(stopped.openPositionPrice()).isEqualTo(11.0);
        assertThat(stopped.tradeCount()).isEqualTo(1);
        assertThat(bot.ledger().trades().get(0).action()).isEqualTo(TradeSide.BUY);
    }

    @Test
    void restartSpawnsAFreshWorker() {
        BotController bot = controller(ScriptedPriceSource.constant(100.0, 100_000), fastSettings());

        bot.start();
        bot.stop();
        bot.start();

        assertThat(scheduler.submitted.get()).isEqualTo(2);
        assertThat(bot.status().running()).isTrue();
    }

    @Test
    void failingSourceIsReportedInStatusWithoutStoppingTheLoop() {
        BotController bot = controller(new ScriptedPriceSource(Arrays.asList(null, null, null)), fastSettings());

        bot.start();
        Await.until(() -> bot.status().lastError() != null, 2_000);

        assertThat(bot.status().running()).isTrue();
        assertThat(scheduler.lastHandle.isRunning()).isTrue();
    }

    @Test
    void stuckWorkerIsForcedAfterTimeout() {
        CountDownLatch never = new CountDownLatch(1);
        AtomicInteger fetches = new AtomicInteger();
        PriceSourcePort stuck = new PriceSourcePort() {
            @Override
            public double currentPrice(String symbol) throws DataUnavailableException {
                fetches.incrementAndGet();
                try {
                    never.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new DataUnavailableException("interrupted");
                }
                return 1.0;
            }

            @Override
            public List<Double> recentPrices(String symbol, String interval, int limit) {
                return List.of();
            }
        };
        BotController bot = controller(stuck, fastSettings().withTiming(1, 50));

        bot.start();
        Await.until(() -> fetches.get() == 1, 2_000);

        assertThat(bot.stop()).isEqualTo(StopResult.FORCED);
        assertThat(bot.status().running()).isFalse();
        Await.until(() -> !scheduler.lastHandle.isRunning(), 2_000);
    }

    @Test
    void backtestOverSuppliedSeriesIsDeterministic() {
        BotController bot = controller(ScriptedPriceSource.constant(100.0, 1), fastSettings());

        BacktestResult first = bot.backtest(CROSSING);
        BacktestResult second = bot.backtest(CROSSING);

        assertThat(first.tradeCount()).isEqualTo(2);
        assertThat(first.profit()).isEqualTo(-2.0);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void backtestFetchesTheRequestedNumberOfCandles() throws Exception {
        ScriptedPriceSource source = new ScriptedPriceSource(List.of(), CROSSING);
        BotController bot = controller(source, fastSettings());

        BacktestResult r = bot.backtest(CROSSING.size());

        assertThat(r.trades()).extracting(Trade::timestamp).containsExactly(4.0, 7.0);
    }

    @Test
    void backtestDoesNotTouchLiveState() {
        BotController bot = controller(ScriptedPriceSource.constant(100.0, 100_000), fastSettings());
        bot.start();

        BacktestResult r = bot.backtest(CROSSING);

        assertThat(r.tradeCount()).isEqualTo(2);
        assertThat(bot.status().tradeCount()).isZero();
        assertThat(bot.status().running()).isTrue();
    }

    @Test
    void backtestPropagatesDataErrors() {
        BotController bot = controller(new ScriptedPriceSource(List.of()), fastSettings());

        assertThatThrownBy(() -> bot.backtest(50)).isInstanceOf(DataUnavailableException.class);
    }

    @Test
    void backtestRejectsNonPositiveCandleCount() {
        BotController bot = controller(ScriptedPriceSource.constant(100.0, 1), fastSettings());

        assertThatThrownBy(() -> bot.backtest(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void backtestRejectsOversizedCandleCount() {
        ScriptedPriceSource source = new ScriptedPriceSource(List.of(), CROSSING);
        BotController bot = controller(source, fastSettings());

        assertThatThrownBy(() -> bot.backtest(BotController.MAX_BACKTEST_CANDLES + 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bot.backtest(Integer.MAX_VALUE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void startWaitsForAForceStoppedWorkerToExit() {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger fetches = new AtomicInteger();
        PriceSourcePort deaf = new PriceSourcePort() {
            @Override
            public double currentPrice(String symbol) {
                if (fetches.incrementAndGet() == 1) {
                    awaitIgnoringInterrupts(release);
                }
                return 100.0;
            }

            @Override
            public List<Double> recentPrices(String symbol, String interval, int limit) {
                return List.of();
            }
        };
        BotController bot = controller(deaf, fastSettings().withTiming(1, 50));

        bot.start();
        Await.until(() -> fetches.get() == 1, 2_000);
        assertThat(bot.stop()).isEqualTo(StopResult.FORCED);
        RunHandle stuck = scheduler.lastHandle;

        assertThat(stuck.isRunning()).isTrue();
        assertThat(bot.start()).isEqualTo(StartResult.STILL_STOPPING);
        assertThat(scheduler.submitted.get()).isEqualTo(1);
        assertThat(bot.status().running()).isFalse();

        release.countDown();
        Await.until(() -> !stuck.isRunning(), 2_000);

        assertThat(bot.start()).isEqualTo(StartResult.STARTED);
        assertThat(scheduler.submitted.get()).isEqualTo(2);
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }

    @Test
    void invalidStrategyFailsConstruction() {
        BotSettings bad = fastSettings().withStrategy(new StrategyConfig("sma", 10, 5));

        assertThatThrownBy(() -> new BotController(bad, registry, ScriptedPriceSource.constant(1.0, 1), scheduler, null))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new BotController(fastSettings().withStrategy(new StrategyConfig("rsi", 2, 4)),
                registry, ScriptedPriceSource.constant(1.0, 1), scheduler, null))
                .isInstanceOf(ConfigurationException.class);
    }

    private static final class CountingScheduler implements JobScheduler {
        private final JobScheduler delegate;
        private final AtomicInteger submitted = new AtomicInteger();
        private volatile RunHandle lastHandle;

        private CountingScheduler(JobScheduler delegate) {
            this.delegate = delegate;
        }

        @Override
        public RunHandle submit(String key, CancellableTask task) {
            submitted.incrementAndGet();
            lastHandle = delegate.submit(key, task);
            return lastHandle;
        }
    }
}
