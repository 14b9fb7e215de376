package com.crossbot.application.config;

import com.crossbot.domain.strategy.StrategyRegistry;

public final class ConfigValidator {

    private final StrategyRegistry strategies;

    public ConfigValidator(StrategyRegistry strategies) {
        this.strategies = strategies;
    }

    public ConfigValidationResult validate(BotSettings s) {
        ConfigValidationResult res = new ConfigValidationResult();

        if (s.symbol() == null || s.symbol().isBlank()) {
            res.addError(ConfigKey.SYMBOL.key() + " must not be blank");
        }
        if (s.interval() == null || s.interval().isBlank()) {
            res.addError(ConfigKey.INTERVAL.key() + " must not be blank");
        }
        if (!(s.baseAssetAmount() > 0)) {
            res.addError(ConfigKey.BASE_ASSET_AMOUNT.key() + " must be positive");
        }
        if (!(s.stopLossPct() > 0 && s.stopLossPct() < 1)) {
            res.addError(ConfigKey.STOP_LOSS_PCT.key() + " must be in (0, 1)");
        }
        if (!(s.takeProfitPct() > 0)) {
            res.addError(ConfigKey.TAKE_PROFIT_PCT.key() + " must be positive");
        }
        if (s.tickIntervalMs() <= 0) {
            res.addError(ConfigKey.TICK_INTERVAL_MS.key() + " must be positive");
        }
        if (s.stopTimeoutMs() <= 0) {
            res.addError(ConfigKey.STOP_TIMEOUT_MS.key() + " must be positive");
        }

        if (!strategies.supports(s.strategy().type())) {
            res.addError("Unknown strategy type: " + s.strategy().type());
        }
        if (s.strategy().shortWindow() <= 0) {
            res.addError(ConfigKey.SHORT_WINDOW.key() + " must be positive");
        }
        if (s.strategy().longWindow() <= s.strategy().shortWindow()) {
            res.addError(ConfigKey.LONG_WINDOW.key() + " must be greater than " + ConfigKey.SHORT_WINDOW.key());
        }

        // max_position_size is not enforced by the engine
        if (s.maxPositionSize() > 0 && s.baseAssetAmount() > s.maxPositionSize()) {
            res.addWarning(ConfigKey.BASE_ASSET_AMOUNT.key() + " exceeds " + ConfigKey.MAX_POSITION_SIZE.key()
                    + " (not enforced)");
        }

        return res;
    }
}
