package com.crossbot.application.config;

import com.crossbot.domain.risk.RiskManager;
import com.crossbot.domain.strategy.StrategyConfig;

/**
 * Immutable engine configuration, built once by {@link BotSettingsLoader}.
 */
public record BotSettings(
        String symbol,
        String interval,
        double baseAssetAmount,
        double stopLossPct,
        double takeProfitPct,
        double maxPositionSize,
        StrategyConfig strategy,
        long tickIntervalMs,
        long stopTimeoutMs
) {

    public static BotSettings defaults() {
        return new BotSettings("BTCUSDT", "1m", 0.001, 0.02, 0.03, 0.1,
                StrategyConfig.sma(7, 25), 5000L, 5000L);
    }

    public RiskManager riskManager() {
        return new RiskManager(baseAssetAmount, stopLossPct, takeProfitPct);
    }

    public BotSettings withTiming(long tickIntervalMs, long stopTimeoutMs) {
        return new BotSettings(symbol, interval, baseAssetAmount, stopLossPct, takeProfitPct,
                maxPositionSize, strategy, tickIntervalMs, stopTimeoutMs);
    }

    public BotSettings withRisk(double baseAssetAmount, double stopLossPct, double takeProfitPct) {
        return new BotSettings(symbol, interval, baseAssetAmount, stopLossPct, takeProfitPct,
                maxPositionSize, strategy, tickIntervalMs, stopTimeoutMs);
    }

    public BotSettings withStrategy(StrategyConfig strategy) {
        return new BotSettings(symbol, interval, baseAssetAmount, stopLossPct, takeProfitPct,
                maxPositionSize, strategy, tickIntervalMs, stopTimeoutMs);
    }
}
