package com.feedwatch.engine.application.scheduling;

import com.feedwatch.engine.domain.cycle.CycleResult;
import com.feedwatch.engine.domain.exceptions.FetchException;
import com.feedwatch.engine.domain.routing.DeliveryReport;
import com.feedwatch.engine.domain.subscription.Subscription;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import static com.feedwatch.engine.fixtures.FeedwatchFixtures.liveSubscription;
import static com.feedwatch.engine.fixtures.FeedwatchFixtures.postSubscription;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class SubscriptionSchedulerTest {

    private static final Duration FAST = Duration.ofMillis(50);
    private static final CycleResult QUIET = new CycleResult(0, false, DeliveryReport.EMPTY);

    private SimpleMeterRegistry registry;
    private ThreadPoolTaskScheduler timers;
    private ThreadPoolTaskExecutor cycles;
    private SubscriptionScheduler scheduler;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        timers = new ThreadPoolTaskScheduler();
        timers.setPoolSize(2);
        timers.initialize();
        cycles = new ThreadPoolTaskExecutor();
        cycles.setCorePoolSize(2);
        cycles.setMaxPoolSize(Integer.MAX_VALUE);
        cycles.setQueueCapacity(0);
        cycles.initialize();
        scheduler = new SubscriptionScheduler(timers, cycles, new CycleMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        scheduler.stop(Duration.ofMillis(100));
        timers.shutdown();
    }

    @Test
    void shouldKeepTickingOtherSubscriptionsWhenOneAlwaysFails() {
        var failing = liveSubscription().toBuilder().name("broken").build();
        var healthy = postSubscription().toBuilder().name("healthy").build();
        Map<String, AtomicInteger> ticks = new ConcurrentHashMap<>();

        scheduler.start(List.of(failing, healthy), FAST, subscription -> {
            ticks.computeIfAbsent(subscription.name(), name -> new AtomicInteger()).incrementAndGet();
            if (subscription.name().equals("broken")) {
                throw FetchException.of("bilibili.live", "unreachable");
            }
            return QUIET;
        });

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            assertThat(ticks.get("healthy")).hasValueGreaterThanOrEqualTo(3);
            assertThat(ticks.get("broken")).hasValueGreaterThanOrEqualTo(3);
        });
        assertThat(registry.counter("feedwatch.cycles.failed").count()).isGreaterThanOrEqualTo(3);
        assertThat(registry.counter("feedwatch.cycles.completed").count()).isGreaterThanOrEqualTo(3);
    }

    @Test
    void shouldSkipTicksWhileCycleIsStillRunning() {
        var release = new CountDownLatch(1);
        var started = new AtomicInteger();

        scheduler.start(List.of(liveSubscription()), FAST, subscription -> {
            started.incrementAndGet();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return QUIET;
        });

        await().atMost(Duration.ofSeconds(5))
                .until(() -> registry.counter("feedwatch.cycles.skipped").count() >= 3);
        assertThat(started).hasValue(1);

        release.countDown();
        await().atMost(Duration.ofSeconds(5)).until(() -> started.get() >= 2);
    }

    @Test
    void shouldUseSubscriptionIntervalOverGlobalOne() {
        var fast = liveSubscription().toBuilder().name("fast").interval(FAST).build();
        var slow = postSubscription().toBuilder().name("slow").build();
        Map<String, AtomicInteger> ticks = new ConcurrentHashMap<>();

        scheduler.start(List.of(fast, slow), Duration.ofHours(1), subscription -> {
            ticks.computeIfAbsent(subscription.name(), name -> new AtomicInteger()).incrementAndGet();
            return QUIET;
        });

        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(ticks.get("fast")).hasValueGreaterThanOrEqualTo(4));
        assertThat(ticks.get("slow")).hasValue(1);
    }

    @Test
    void shouldCountDetectedEventsAndDeliveries() {
        var result = new CycleResult(2, false, new DeliveryReport(3, 1, 0));

        scheduler.start(List.of(liveSubscription()), Duration.ofHours(1), subscription -> result);

        await().atMost(Duration.ofSeconds(5))
                .until(() -> registry.counter("feedwatch.cycles.completed").count() == 1);
        assertThat(registry.counter("feedwatch.events.detected").count()).isEqualTo(2);
        assertThat(registry.counter("feedwatch.notifications.delivered").count()).isEqualTo(3);
        assertThat(registry.counter("feedwatch.notifications.failed").count()).isEqualTo(1);
    }

    @Test
    void shouldInterruptCyclesThatOutliveGracePeriod() {
        var interrupted = new CountDownLatch(1);
        var running = new CountDownLatch(1);
        scheduler.start(List.of(liveSubscription()), Duration.ofHours(1), subscription -> {
            running.countDown();
            try {
                Thread.sleep(Duration.ofMinutes(1).toMillis());
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return QUIET;
        });
        await().atMost(Duration.ofSeconds(5)).until(() -> running.getCount() == 0);

        scheduler.stop(Duration.ofMillis(50));

        await().atMost(Duration.ofSeconds(5)).until(() -> interrupted.getCount() == 0);
    }
}
