package com.feedwatch.engine.domain.exceptions;

import java.util.List;

/** Invalid configuration. Always fatal at start-up. */
public class ConfigurationException extends RuntimeException {

    private final List<String> problems;

    private ConfigurationException(String message, List<String> problems) {
        super(message);
        this.problems = problems;
    }

    public static ConfigurationException of(List<String> problems) {
        return new ConfigurationException(
                "Invalid configuration:\n  - " + String.join("\n  - ", problems), List.copyOf(problems));
    }

    public List<String> problems() {
        return problems;
    }
}
