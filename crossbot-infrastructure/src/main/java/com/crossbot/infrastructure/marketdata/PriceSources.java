package com.crossbot.infrastructure.marketdata;

import com.crossbot.application.config.ConfigKey;
import com.crossbot.application.ports.ConfigPort;
import com.crossbot.application.ports.PriceSourcePort;
import com.crossbot.infrastructure.exchange.BinanceMarketClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the price source from configuration.
 * With exchange credentials: Binance, backed by synthetic data unless
 * marketdata.synthetic_fallback=false. Without: synthetic only.
 */
public final class PriceSources {

    private static final Logger log = LoggerFactory.getLogger(PriceSources.class);

    private PriceSources() {}

    public static PriceSourcePort fromConfig(ConfigPort config) {
        String apiKey = config.getSecret(ConfigKey.API_KEY.key());
        String apiSecret = config.getSecret(ConfigKey.API_SECRET.key());

        if (apiKey == null || apiSecret == null) {
            log.info("[MARKET] no exchange credentials, using synthetic prices");
            return new SyntheticPriceSource();
        }

        String baseUrl = config.get(ConfigKey.MARKETDATA_BASE_URL.key(), ConfigKey.MARKETDATA_BASE_URL.defaultValue());
        PriceSourcePort binance = new BinancePriceSource(new BinanceMarketClient(baseUrl));

        boolean fallback = config.getBoolean(ConfigKey.MARKETDATA_SYNTHETIC_FALLBACK.key(),
                Boolean.parseBoolean(ConfigKey.MARKETDATA_SYNTHETIC_FALLBACK.defaultValue()));
        log.info("[MARKET] using Binance at {} (synthetic fallback: {})", baseUrl, fallback);
        return fallback ? new FallbackPriceSource(binance, new SyntheticPriceSource()) : binance;
    }
}
