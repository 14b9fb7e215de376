package com.crossbot.domain;

import java.util.List;

/**
 * Invalid or unknown configuration detected while building the engine.
 * Fatal: nothing is started when this is thrown.
 */
public class ConfigurationException extends DomainException {

    private final List<String> problems;

    public ConfigurationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public ConfigurationException(List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
