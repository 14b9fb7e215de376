package com.crossbot.infrastructure.marketdata;

import com.crossbot.application.ports.DataUnavailableException;
import com.crossbot.application.ports.PriceSourcePort;
import com.crossbot.infrastructure.exchange.BinanceMarketClient;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Prices from Binance klines. The current price is the close of the latest 1m candle.
 */
public class BinancePriceSource implements PriceSourcePort {

    private final BinanceMarketClient client;

    public BinancePriceSource(BinanceMarketClient client) {
        this.client = Objects.requireNonNull(client);
    }

    @Override
    public double currentPrice(String symbol) throws DataUnavailableException {
        List<Double> last = fetch(symbol, "1m", 1);
        if (last.isEmpty()) {
            throw new DataUnavailableException("No price returned for " + symbol);
        }
        return last.get(last.size() - 1);
    }

    @Override
    public List<Double> recentPrices(String symbol, String interval, int limit) throws DataUnavailableException {
        return fetch(symbol, interval, limit);
    }

    private List<Double> fetch(String symbol, String interval, int limit) throws DataUnavailableException {
        try {
            return client.closes(symbol, interval, limit);
        } catch (IOException | RuntimeException e) {
            throw new DataUnavailableException("Binance klines failed for " + symbol + ": " + e.getMessage(), e);
        }
    }
}
