package com.crossbot.infrastructure.marketdata;

import com.crossbot.application.ports.DataUnavailableException;
import com.crossbot.infrastructure.exchange.BinanceMarketClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BinancePriceSourceTest {

    private MockWebServer server;
    private BinancePriceSource source;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        source = new BinancePriceSource(new BinanceMarketClient(server.url("/").toString()));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void currentPriceIsLatestOneMinuteClose() throws Exception {
        server.enqueue(new MockResponse().setBody("[[0,\"1\",\"1\",\"1\",\"42000.5\",\"1\",0]]"));

        assertThat(source.currentPrice("BTCUSDT")).isEqualTo(42000.5);
        assertThat(server.takeRequest().getRequestUrl().queryParameter("interval")).isEqualTo("1m");
    }

    @Test
    void emptyResponseIsUnavailable() {
        server.enqueue(new MockResponse().setBody("[]"));

        assertThatThrownBy(() -> source.currentPrice("BTCUSDT"))
                .isInstanceOf(DataUnavailableException.class);
    }

    @Test
    void serverErrorIsUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> source.recentPrices("BTCUSDT", "1h", 10))
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("BTCUSDT");
    }
}
