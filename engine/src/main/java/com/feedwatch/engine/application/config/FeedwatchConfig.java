package com.feedwatch.engine.application.config;

import com.feedwatch.common.json.JacksonConfig;
import com.feedwatch.engine.domain.detection.ChangeDetectionEngine;
import com.feedwatch.engine.domain.routing.NotifyTargetCatalog;
import com.feedwatch.engine.domain.state.InMemorySnapshotStore;
import com.feedwatch.engine.domain.state.SnapshotStore;
import com.feedwatch.engine.domain.subscription.SubscriptionCatalog;
import com.feedwatch.engine.infrastructure.state.FileSnapshotStore;
import java.nio.file.Path;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.env.Environment;
import tools.jackson.databind.json.JsonMapper;

@Slf4j
@Configuration
@EnableConfigurationProperties(FeedwatchProperties.class)
public class FeedwatchConfig {

    @Bean
    @Primary
    public JsonMapper feedwatchJsonMapper() {
        return JacksonConfig.createObjectMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Catalog catalog(FeedwatchProperties properties, Environment environment) {
        return new CatalogFactory(properties, environment::getProperty).create();
    }

    @Bean
    public SubscriptionCatalog subscriptionCatalog(Catalog catalog) {
        return catalog.subscriptions();
    }

    @Bean
    public NotifyTargetCatalog notifyTargetCatalog(Catalog catalog) {
        return catalog.targets();
    }

    @Bean
    public ChangeDetectionEngine changeDetectionEngine(FeedwatchProperties properties, Clock clock) {
        return new ChangeDetectionEngine(properties.state().seenCapacity(), clock);
    }

    @Bean
    public SnapshotStore snapshotStore(FeedwatchProperties properties, JsonMapper mapper) {
        var directory = properties.state().directory();
        if (directory == null || directory.isBlank()) {
            log.warn("No feedwatch.state.directory set, snapshots are kept in memory only");
            return new InMemorySnapshotStore();
        }
        return new FileSnapshotStore(Path.of(directory), mapper);
    }
}
