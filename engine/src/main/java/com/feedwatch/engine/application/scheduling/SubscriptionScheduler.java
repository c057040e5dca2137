package com.feedwatch.engine.application.scheduling;

import com.feedwatch.engine.domain.cycle.CycleResult;
import com.feedwatch.engine.domain.exceptions.FetchException;
import com.feedwatch.engine.domain.exceptions.SnapshotMismatchException;
import com.feedwatch.engine.domain.exceptions.StateStoreException;
import com.feedwatch.engine.domain.subscription.Subscription;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs one fixed-rate timer per subscription.
 *
 * <p>A timer only hands the cycle over to the cycle executor, so a slow or hung cycle never holds
 * a timer thread. While a subscription's cycle is in flight its further ticks are dropped, not
 * queued. Errors are caught per cycle; a failing subscription keeps its timer and never affects
 * another subscription.
 */
@Slf4j
@RequiredArgsConstructor
public class SubscriptionScheduler {

    private final TaskScheduler timers;
    private final ThreadPoolTaskExecutor cycles;
    private final CycleMetrics metrics;

    private final List<ScheduledFuture<?>> scheduled = new CopyOnWriteArrayList<>();

    public void start(
            List<Subscription> subscriptions, Duration globalInterval, Function<Subscription, CycleResult> onTick) {
        for (Subscription subscription : subscriptions) {
            var interval = subscription.effectiveInterval(globalInterval);
            var inFlight = new AtomicBoolean(false);
            scheduled.add(timers.scheduleAtFixedRate(() -> tick(subscription, inFlight, onTick), interval));
            log.info("Scheduled {} every {}", subscription.key(), interval);
        }
    }

    /**
     * Cancels every timer, then gives running cycles {@code grace} to finish before interrupting
     * them. An interrupted cycle does not commit.
     */
    public void stop(Duration grace) {
        scheduled.forEach(future -> future.cancel(false));
        scheduled.clear();
        var executor = cycles.getThreadPoolExecutor();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Cycles still running after {}, interrupting", grace);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void tick(Subscription subscription, AtomicBoolean inFlight, Function<Subscription, CycleResult> onTick) {
        if (!inFlight.compareAndSet(false, true)) {
            log.warn("Skipping tick for {}: previous cycle still running", subscription.key());
            metrics.skipped();
            return;
        }
        try {
            cycles.execute(() -> runCycle(subscription, inFlight, onTick));
        } catch (RejectedExecutionException e) {
            inFlight.set(false);
            log.warn("Cycle for {} rejected: {}", subscription.key(), e.getMessage());
        }
    }

    private void runCycle(Subscription subscription, AtomicBoolean inFlight, Function<Subscription, CycleResult> onTick) {
        var key = subscription.key();
        try {
            metrics.completed(onTick.apply(subscription));
        } catch (FetchException e) {
            metrics.failed();
            log.warn("Fetch failed for {}: {}", key, e.getMessage());
        } catch (SnapshotMismatchException e) {
            metrics.failed();
            log.error("Diff failed for {}: {}", key, e.getMessage());
        } catch (StateStoreException e) {
            metrics.failed();
            log.error("State commit failed for {}", key, e);
        } catch (CancellationException e) {
            metrics.failed();
            log.info("Cycle for {} cancelled: {}", key, e.getMessage());
        } catch (RuntimeException e) {
            metrics.failed();
            log.error("Cycle failed for {}", key, e);
        } finally {
            inFlight.set(false);
        }
    }
}
