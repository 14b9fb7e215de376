package com.crossbot.infrastructure.marketdata;

import com.crossbot.application.ports.PriceSourcePort;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Offline price source.
 * recentPrices: noise of 1% around a base drawn from [10000, 40000) on every call,
 * at most 1000 values.
 * currentPrice: random walk (0.1% steps) from a base drawn once per instance.
 */
public class SyntheticPriceSource implements PriceSourcePort {

    static final double MIN_BASE = 10_000.0;
    static final double MAX_BASE = 40_000.0;

    /** Same cap as Binance klines. */
    static final int MAX_LIMIT = 1000;

    private static final double SERIES_NOISE = 0.01;
    private static final double WALK_STEP = 0.001;

    private final Random random;
    private double last;

    public SyntheticPriceSource() {
        this(new Random());
    }

    public SyntheticPriceSource(long seed) {
        this(new Random(seed));
    }

    private SyntheticPriceSource(Random random) {
        this.random = random;
        this.last = randomBase();
    }

    @Override
    public synchronized double currentPrice(String symbol) {
        double next = last + random.nextGaussian() * last * WALK_STEP;
        if (next > 0) {
            last = next;
        }
        return last;
    }

    @Override
    public synchronized List<Double> recentPrices(String symbol, String interval, int limit) {
        double base = randomBase();
        int n = Math.min(limit, MAX_LIMIT);
        List<Double> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double p = base + random.nextGaussian() * base * SERIES_NOISE;
            out.add(p > 0 ? p : base);
        }
        return out;
    }

    private double randomBase() {
        return MIN_BASE + random.nextDouble() * (MAX_BASE - MIN_BASE);
    }
}
