package com.crossbot.domain.strategy.impl;

import com.crossbot.domain.ConfigurationException;
import com.crossbot.domain.order.TradeAction;
import com.crossbot.domain.strategy.CrossState;
import com.crossbot.domain.strategy.Strategy;

import java.util.List;

/**
 * Simple moving average crossover (short / long).
 *
 * BUY  - short SMA moves from below to above the long SMA.
 * SELL - short SMA moves from above to below the long SMA.
 * HOLD - otherwise, including the first observation and any call with fewer than
 *        longWindow prices (those calls leave the cross state untouched).
 *
 * Equal averages count as BELOW.
 */
public class SmaCrossStrategy implements Strategy {

    private final int shortWindow;
    private final int longWindow;

    private CrossState lastCrossState = CrossState.UNSET;

    public SmaCrossStrategy(int shortWindow, int longWindow) {
        if (shortWindow <= 0 || longWindow <= 0) {
            throw new ConfigurationException(
                    "SMA windows must be positive: short=" + shortWindow + " long=" + longWindow);
        }
        if (longWindow <= shortWindow) {
            throw new ConfigurationException(
                    "long_window must be greater than short_window: short=" + shortWindow + " long=" + longWindow);
        }
        this.shortWindow = shortWindow;
        this.longWindow = longWindow;
    }

    public CrossState getLastCrossState() {
        return lastCrossState;
    }

    @Override
    public TradeAction decide(List<Double> prices) {
        if (prices == null || prices.size() < longWindow) {
            return TradeAction.HOLD;
        }

        double shortMa = movingAverage(prices, shortWindow);
        double longMa = movingAverage(prices, longWindow);
        CrossState current = shortMa > longMa ? CrossState.ABOVE : CrossState.BELOW;

        TradeAction action = TradeAction.HOLD;
        if (lastCrossState == CrossState.BELOW && current == CrossState.ABOVE) {
            action = TradeAction.BUY;
        } else if (lastCrossState == CrossState.ABOVE && current == CrossState.BELOW) {
            action = TradeAction.SELL;
        }

        lastCrossState = current;
        return action;
    }

    @Override
    public void reset() {
        lastCrossState = CrossState.UNSET;
    }

    @Override
    public int requiredHistory() {
        return longWindow;
    }

    @Override
    public String getParamsSummary() {
        return "SMA Cross short=" + shortWindow + " long=" + longWindow;
    }

    /** Mean of the last {@code window} values. */
    private static double movingAverage(List<Double> prices, int window) {
        int size = prices.size();
        double sum = 0.0;
        for (int i = size - window; i < size; i++) {
            sum += prices.get(i);
        }
        return sum / window;
    }
}
