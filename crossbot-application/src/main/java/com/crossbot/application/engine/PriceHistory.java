package com.crossbot.application.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory price history for the live loop; the oldest price is dropped on overflow.
 * Not thread-safe: owned by the worker.
 */
public final class PriceHistory {

    static final int MIN_CAPACITY = 1000;

    private final int capacity;
    private final Deque<Double> prices;

    public PriceHistory(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.capacity = capacity;
        this.prices = new ArrayDeque<>(Math.min(capacity, MIN_CAPACITY));
    }

    /** Capacity keeping at least twice what the strategy needs, never under 1000. */
    public static PriceHistory forRequiredHistory(int required) {
        return new PriceHistory(Math.max(MIN_CAPACITY, 2 * required));
    }

    public void add(double price) {
        prices.addLast(price);
        while (prices.size() > capacity) {
            prices.removeFirst();
        }
    }

    public int size() {
        return prices.size();
    }

    public int capacity() {
        return capacity;
    }

    /** Copy of the retained prices, oldest first. */
    public List<Double> snapshot() {
        return new ArrayList<>(prices);
    }
}
