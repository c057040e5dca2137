package com.feedwatch.engine.application.job;

import com.feedwatch.engine.application.config.FeedwatchProperties;
import com.feedwatch.engine.application.scheduling.SubscriptionScheduler;
import com.feedwatch.engine.domain.cycle.SubscriptionCycle;
import com.feedwatch.engine.domain.subscription.SubscriptionCatalog;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Starts polling once the context is ready and the configuration has been validated. */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubscriptionJob {

    private final SubscriptionCatalog catalog;
    private final SubscriptionScheduler scheduler;
    private final SubscriptionCycle cycle;
    private final FeedwatchProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (catalog.subscriptions().isEmpty()) {
            log.warn("No subscriptions configured, nothing to poll");
            return;
        }
        scheduler.start(catalog.subscriptions(), catalog.interval(), cycle::run);
        log.info("Polling {} subscriptions", catalog.subscriptions().size());
    }

    @PreDestroy
    public void stop() {
        log.info("Stopping subscription timers");
        scheduler.stop(properties.scheduler().shutdownGrace());
    }
}
