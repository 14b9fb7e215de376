package com.crossbot.application.config;

import com.crossbot.application.ports.ConfigPort;
import com.crossbot.domain.ConfigurationException;
import com.crossbot.domain.strategy.StrategyConfig;
import com.crossbot.domain.strategy.StrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link BotSettings} from a {@link ConfigPort}, applying defaults and validating.
 */
public final class BotSettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(BotSettingsLoader.class);

    private final StrategyRegistry strategies;

    public BotSettingsLoader(StrategyRegistry strategies) {
        this.strategies = strategies;
    }

    /**
     * @throws ConfigurationException listing every problem found
     */
    public BotSettings load(ConfigPort config) {
        BotSettings settings = new BotSettings(
                str(config, ConfigKey.SYMBOL),
                str(config, ConfigKey.INTERVAL),
                dbl(config, ConfigKey.BASE_ASSET_AMOUNT),
                dbl(config, ConfigKey.STOP_LOSS_PCT),
                dbl(config, ConfigKey.TAKE_PROFIT_PCT),
                dbl(config, ConfigKey.MAX_POSITION_SIZE),
                new StrategyConfig(
                        str(config, ConfigKey.STRATEGY_TYPE),
                        config.getInt(ConfigKey.SHORT_WINDOW.key(), Integer.parseInt(ConfigKey.SHORT_WINDOW.defaultValue())),
                        config.getInt(ConfigKey.LONG_WINDOW.key(), Integer.parseInt(ConfigKey.LONG_WINDOW.defaultValue()))
                ),
                config.getLong(ConfigKey.TICK_INTERVAL_MS.key(), Long.parseLong(ConfigKey.TICK_INTERVAL_MS.defaultValue())),
                config.getLong(ConfigKey.STOP_TIMEOUT_MS.key(), Long.parseLong(ConfigKey.STOP_TIMEOUT_MS.defaultValue()))
        );

        ConfigValidationResult res = new ConfigValidator(strategies).validate(settings);
        for (String w : res.warnings()) {
            log.warn("[CONFIG] {}", w);
        }
        if (!res.isValid()) {
            throw new ConfigurationException(res.errors());
        }

        log.info("[CONFIG] symbol={} interval={} amount={} sl={} tp={} strategy={} short={} long={}",
                settings.symbol(), settings.interval(), settings.baseAssetAmount(),
                settings.stopLossPct(), settings.takeProfitPct(),
                settings.strategy().type(), settings.strategy().shortWindow(), settings.strategy().longWindow());
        return settings;
    }

    private static String str(ConfigPort config, ConfigKey key) {
        String v = config.get(key.key(), key.defaultValue());
        return v == null ? null : v.trim();
    }

    private static double dbl(ConfigPort config, ConfigKey key) {
        return config.getDouble(key.key(), Double.parseDouble(key.defaultValue()));
    }
}
