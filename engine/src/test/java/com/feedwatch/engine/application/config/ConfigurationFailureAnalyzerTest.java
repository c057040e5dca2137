package com.feedwatch.engine.application.config;

import com.feedwatch.engine.domain.exceptions.ConfigurationException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationFailureAnalyzerTest {

    @Test
    void shouldListEveryProblem() {
        var cause = ConfigurationException.of(List.of(
                "subscription 'meow'[0]: unknown platform 'youtube'",
                "notify 'ops': unknown channel 'irc'"));

        var analysis = new ConfigurationFailureAnalyzer()
                .analyze(new BeanCreationException("catalog", "failed", cause));

        assertThat(analysis).isNotNull();
        assertThat(analysis.getDescription())
                .contains("- subscription 'meow'[0]: unknown platform 'youtube'")
                .contains("- notify 'ops': unknown channel 'irc'");
        assertThat(analysis.getCause()).isSameAs(cause);
    }
}
