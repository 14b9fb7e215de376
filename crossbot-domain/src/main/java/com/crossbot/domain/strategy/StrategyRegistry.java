package com.crossbot.domain.strategy;

import com.crossbot.domain.ConfigurationException;
import com.crossbot.domain.strategy.impl.SmaCrossStrategy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Strategy constructors keyed by configuration name ("sma", ...).
 *
 * Every call to {@link #create(StrategyConfig)} returns a new instance with fresh state.
 */
public final class StrategyRegistry {

    private final Map<String, Function<StrategyConfig, Strategy>> factories = new LinkedHashMap<>();

    public static StrategyRegistry withDefaults() {
        StrategyRegistry registry = new StrategyRegistry();
        registry.register(StrategyConfig.DEFAULT_TYPE,
                cfg -> new SmaCrossStrategy(cfg.shortWindow(), cfg.longWindow()));
        return registry;
    }

    public StrategyRegistry register(String type, Function<StrategyConfig, Strategy> factory) {
        Objects.requireNonNull(factory, "factory");
        factories.put(StrategyConfig.normalizeType(type), factory);
        return this;
    }

    public boolean supports(String type) {
        return type != null && factories.containsKey(StrategyConfig.normalizeType(type));
    }

    public Set<String> types() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    /**
     * @throws ConfigurationException for an unknown type or invalid parameters
     */
    public Strategy create(StrategyConfig config) {
        Objects.requireNonNull(config, "config");
        Function<StrategyConfig, Strategy> factory = factories.get(config.type());
        if (factory == null) {
            throw new ConfigurationException("Unknown strategy type: " + config.type() + " (known: " + factories.keySet() + ")");
        }
        return factory.apply(config);
    }
}
