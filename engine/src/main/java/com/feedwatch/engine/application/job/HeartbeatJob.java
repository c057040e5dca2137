package com.feedwatch.engine.application.job;

import com.feedwatch.engine.application.config.FeedwatchProperties;
import com.feedwatch.engine.infrastructure.heartbeat.HeartbeatClient;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.ScheduledFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class HeartbeatJob {

    private final FeedwatchProperties properties;
    private final ObjectProvider<HeartbeatClient> heartbeatClient;
    private final TaskScheduler subscriptionTimers;

    private ScheduledFuture<?> scheduled;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        var client = heartbeatClient.getIfAvailable();
        if (client == null) {
            return;
        }
        var interval = properties.reporter().heartbeat().interval();
        scheduled = subscriptionTimers.scheduleAtFixedRate(client::beat, interval);
        log.info("Heartbeat every {}", interval);
    }

    @PreDestroy
    public void stop() {
        if (scheduled != null) {
            scheduled.cancel(false);
        }
    }
}
