package com.feedwatch.engine.application.config;

import com.feedwatch.engine.application.scheduling.CycleMetrics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public CycleMetrics cycleMetrics(MeterRegistry registry) {
        return new CycleMetrics(registry);
    }

    @Bean
    public Gauge subscriptionsGauge(MeterRegistry registry, Catalog catalog) {
        return Gauge.builder("feedwatch.subscriptions", catalog, c -> c.subscriptions().subscriptions().size())
                .description("Number of scheduled subscriptions")
                .register(registry);
    }
}
