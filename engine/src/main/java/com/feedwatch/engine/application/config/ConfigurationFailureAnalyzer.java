package com.feedwatch.engine.application.config;

import com.feedwatch.engine.domain.exceptions.ConfigurationException;
import org.springframework.boot.diagnostics.AbstractFailureAnalyzer;
import org.springframework.boot.diagnostics.FailureAnalysis;

/** Prints configuration problems as a list instead of a stack trace when start-up fails. */
public class ConfigurationFailureAnalyzer extends AbstractFailureAnalyzer<ConfigurationException> {

    @Override
    protected FailureAnalysis analyze(Throwable rootFailure, ConfigurationException cause) {
        return new FailureAnalysis(
                "The feedwatch configuration is invalid:\n  - " + String.join("\n  - ", cause.problems()),
                "Fix the listed entries in the file passed with --config and restart.",
                cause);
    }
}
