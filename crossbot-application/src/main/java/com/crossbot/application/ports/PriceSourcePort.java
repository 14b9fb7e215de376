package com.crossbot.application.ports;

import java.util.List;

/**
 * Market data capability consumed by the engines.
 * Implementations may block on network I/O.
 */
public interface PriceSourcePort {

    /** Latest price for the symbol. */
    double currentPrice(String symbol) throws DataUnavailableException;

    /** Last {@code limit} close prices, oldest first. */
    List<Double> recentPrices(String symbol, String interval, int limit) throws DataUnavailableException;
}
