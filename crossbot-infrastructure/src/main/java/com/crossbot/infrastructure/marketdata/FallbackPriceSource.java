package com.crossbot.infrastructure.marketdata;

import com.crossbot.application.ports.DataUnavailableException;
import com.crossbot.application.ports.PriceSourcePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Asks the primary source first; on failure logs and answers from the fallback.
 */
public class FallbackPriceSource implements PriceSourcePort {

    private static final Logger log = LoggerFactory.getLogger(FallbackPriceSource.class);

    private final PriceSourcePort primary;
    private final PriceSourcePort fallback;

    public FallbackPriceSource(PriceSourcePort primary, PriceSourcePort fallback) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public double currentPrice(String symbol) throws DataUnavailableException {
        try {
            return primary.currentPrice(symbol);
        } catch (DataUnavailableException e) {
            log.warn("[MARKET] current price unavailable, using fallback: {}", e.getMessage());
            return fallback.currentPrice(symbol);
        }
    }

    @Override
    public List<Double> recentPrices(String symbol, String interval, int limit) throws DataUnavailableException {
        try {
            return primary.recentPrices(symbol, interval, limit);
        } catch (DataUnavailableException e) {
            log.warn("[MARKET] price history unavailable, using fallback: {}", e.getMessage());
            return fallback.recentPrices(symbol, interval, limit);
        }
    }
}
