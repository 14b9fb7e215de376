package com.crossbot.infrastructure.marketdata;

import com.crossbot.application.ports.ConfigPort;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PriceSourcesTest {

    @Test
    void withoutCredentialsUsesSyntheticPrices() {
        assertThat(PriceSources.fromConfig(config(Map.of()))).isInstanceOf(SyntheticPriceSource.class);
        assertThat(PriceSources.fromConfig(config(Map.of("api_key", "k")))).isInstanceOf(SyntheticPriceSource.class);
    }

    @Test
    void withCredentialsUsesBinanceBackedBySynthetic() {
        Map<String, String> creds = Map.of("api_key", "k", "api_secret", "s");

        assertThat(PriceSources.fromConfig(config(creds))).isInstanceOf(FallbackPriceSource.class);
    }

    @Test
    void fallbackCanBeDisabled() {
        Map<String, String> creds = Map.of("api_key", "k", "api_secret", "s",
                "marketdata.synthetic_fallback", "false");

        assertThat(PriceSources.fromConfig(config(creds))).isInstanceOf(BinancePriceSource.class);
    }

    private static ConfigPort config(Map<String, String> values) {
        return new ConfigPort() {
            @Override
            public String get(String key) {
                return values.get(key);
            }

            @Override
            public String get(String key, String defaultValue) {
                return values.getOrDefault(key, defaultValue);
            }

            @Override
            public String getSecret(String key) {
                return values.get(key);
            }
        };
    }
}
