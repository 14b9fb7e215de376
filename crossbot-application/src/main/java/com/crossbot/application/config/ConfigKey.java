package com.crossbot.application.config;

/**
 * Known configuration keys with their defaults.
 * Secrets (API credentials) have no default and are optional: without them the
 * synthetic price source is used.
 */
public enum ConfigKey {
    SYMBOL("symbol", "BTCUSDT"),
    INTERVAL("interval", "1m"),
    BASE_ASSET_AMOUNT("base_asset_amount", "0.001"),

    STOP_LOSS_PCT("risk.stop_loss_pct", "0.02"),
    TAKE_PROFIT_PCT("risk.take_profit_pct", "0.03"),
    MAX_POSITION_SIZE("risk.max_position_size", "0.1"),

    STRATEGY_TYPE("strategy.type", "sma"),
    SHORT_WINDOW("strategy.short_window", "7"),
    LONG_WINDOW("strategy.long_window", "25"),

    TICK_INTERVAL_MS("engine.tick_interval_ms", "5000"),
    STOP_TIMEOUT_MS("engine.stop_timeout_ms", "5000"),

    MARKETDATA_BASE_URL("marketdata.base_url", "https://api.binance.com"),
    MARKETDATA_SYNTHETIC_FALLBACK("marketdata.synthetic_fallback", "true"),

    API_KEY("api_key", null),
    API_SECRET("api_secret", null);

    private final String key;
    private final String defaultValue;

    ConfigKey(String key, String defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public String key() { return key; }
    public String defaultValue() { return defaultValue; }
}
