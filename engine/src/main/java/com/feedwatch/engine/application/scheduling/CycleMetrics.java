package com.feedwatch.engine.application.scheduling;

import com.feedwatch.engine.domain.cycle.CycleResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public class CycleMetrics {

    private final Counter completed;
    private final Counter failed;
    private final Counter skipped;
    private final Counter events;
    private final Counter delivered;
    private final Counter deliveryFailures;

    public CycleMetrics(MeterRegistry registry) {
        completed = Counter.builder("feedwatch.cycles.completed")
                .description("Subscription cycles that committed a snapshot")
                .register(registry);
        failed = Counter.builder("feedwatch.cycles.failed")
                .description("Subscription cycles aborted by an error")
                .register(registry);
        skipped = Counter.builder("feedwatch.cycles.skipped")
                .description("Ticks dropped because the previous cycle was still running")
                .register(registry);
        events = Counter.builder("feedwatch.events.detected")
                .description("Change events detected")
                .register(registry);
        delivered = Counter.builder("feedwatch.notifications.delivered")
                .description("Notifications accepted by a channel")
                .register(registry);
        deliveryFailures = Counter.builder("feedwatch.notifications.failed")
                .description("Notifications a channel failed to deliver")
                .register(registry);
    }

    void completed(CycleResult result) {
        completed.increment();
        events.increment(result.events());
        delivered.increment(result.delivery().delivered());
        deliveryFailures.increment(result.delivery().failed());
    }

    void failed() {
        failed.increment();
    }

    void skipped() {
        skipped.increment();
    }
}
