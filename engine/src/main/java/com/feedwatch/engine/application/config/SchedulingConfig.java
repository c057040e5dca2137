package com.feedwatch.engine.application.config;

import com.feedwatch.engine.application.scheduling.CycleMetrics;
import com.feedwatch.engine.application.scheduling.SubscriptionScheduler;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Timers and cycles run on separate pools. Timer threads only enqueue work, so a handful serve any
 * number of subscriptions; the cycle pool hands work straight to a thread and grows with the
 * number of cycles running at once.
 */
@Configuration
public class SchedulingConfig {

    static final int LOG_FORWARD_QUEUE = 256;

    @Bean
    public ThreadPoolTaskScheduler subscriptionTimers(FeedwatchProperties properties) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.scheduler().timerThreads());
        scheduler.setThreadNamePrefix("feedwatch-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor cycleExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("feedwatch-cycle-");
        return executor;
    }

    /** Single thread for forwarded log records; when the queue is full the oldest record is dropped. */
    @Bean
    public ThreadPoolTaskExecutor logForwardExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(LOG_FORWARD_QUEUE);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
        executor.setThreadNamePrefix("feedwatch-log-forward-");
        return executor;
    }

    @Bean
    public SubscriptionScheduler subscriptionScheduler(
            ThreadPoolTaskScheduler subscriptionTimers,
            @Qualifier("cycleExecutor") ThreadPoolTaskExecutor cycleExecutor,
            CycleMetrics metrics) {
        return new SubscriptionScheduler(subscriptionTimers, cycleExecutor, metrics);
    }
}
