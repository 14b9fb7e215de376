package com.crossbot.domain.strategy;

import java.util.Locale;
import java.util.Objects;

/**
 * Strategy selection and parameters as read from configuration.
 */
public record StrategyConfig(String type, int shortWindow, int longWindow) {

    public static final String DEFAULT_TYPE = "sma";

    public StrategyConfig {
        type = normalizeType(type);
    }

    static String normalizeType(String type) {
        Objects.requireNonNull(type, "type");
        return type.trim().toLowerCase(Locale.ROOT);
    }

    public static StrategyConfig sma(int shortWindow, int longWindow) {
        return new StrategyConfig(DEFAULT_TYPE, shortWindow, longWindow);
    }
}
