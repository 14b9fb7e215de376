package com.crossbot.application.support;

import com.crossbot.application.ports.DataUnavailableException;
import com.crossbot.application.ports.PriceSourcePort;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves a fixed list of prices, one per call; a null entry or running past the end
 * fails with {@link DataUnavailableException}.
 */
public final class ScriptedPriceSource implements PriceSourcePort {

    private final List<Double> script;
    private final List<Double> history;
    private final AtomicInteger calls = new AtomicInteger();

    public ScriptedPriceSource(List<Double> script) {
        this(script, List.of());
    }

    public ScriptedPriceSource(List<Double> script, List<Double> history) {
        this.script = new ArrayList<>(script);
        this.history = List.copyOf(history);
    }

    public static ScriptedPriceSource constant(double price, int times) {
        List<Double> s = new ArrayList<>();
        for (int i = 0; i < times; i++) s.add(price);
        return new ScriptedPriceSource(s);
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public double currentPrice(String symbol) throws DataUnavailableException {
        int i = calls.getAndIncrement();
        if (i >= script.size() || script.get(i) == null) {
            throw new DataUnavailableException("no price at call " + i);
        }
        return script.get(i);
    }

    @Override
    public List<Double> recentPrices(String symbol, String interval, int limit) throws DataUnavailableException {
        if (history.isEmpty()) {
            throw new DataUnavailableException("no history");
        }
        int from = Math.max(0, history.size() - limit);
        return history.subList(from, history.size());
    }
}
