package com.feedwatch.engine.domain.cycle;

import com.feedwatch.common.snapshot.Snapshot;
import com.feedwatch.engine.domain.detection.ChangeDetectionEngine;
import com.feedwatch.engine.domain.platform.AccountPermits;
import com.feedwatch.engine.domain.platform.PlatformAdapterRegistry;
import com.feedwatch.engine.domain.routing.DeliveryReport;
import com.feedwatch.engine.domain.routing.NotificationRouter;
import com.feedwatch.engine.domain.state.SnapshotStore;
import com.feedwatch.engine.domain.subscription.Subscription;
import java.util.concurrent.CancellationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * One poll of one subscription: fetch, diff against the committed snapshot, commit, route.
 *
 * <p>Nothing is committed when fetching or diffing fails, or when the running thread was
 * interrupted before the commit, so the next cycle starts again from the last committed snapshot.
 * Events are routed only after their snapshot is committed; a crash between the two loses those
 * notifications rather than repeating them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubscriptionCycle {

    private final PlatformAdapterRegistry adapters;
    private final AccountPermits accountPermits;
    private final SnapshotStore snapshotStore;
    private final ChangeDetectionEngine detectionEngine;
    private final NotificationRouter router;

    public CycleResult run(Subscription subscription) {
        var key = subscription.key();
        var fetched = fetch(subscription);
        var previous = snapshotStore.get(key).orElse(null);
        var detection = detectionEngine.detect(subscription, previous, fetched);

        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Cycle for " + key + " interrupted before commit");
        }
        snapshotStore.commit(key, detection.next());

        if (detection.events().isEmpty()) {
            log.debug("No changes for {}", key);
            return new CycleResult(0, detection.baseline(), DeliveryReport.EMPTY);
        }
        log.info("Detected {} change(s) for {}", detection.events().size(), key);
        var report = router.route(subscription, detection.events());
        return new CycleResult(detection.events().size(), detection.baseline(), report);
    }

    private Snapshot fetch(Subscription subscription) {
        var adapter = adapters.require(subscription.platform().kind());
        return subscription.sharedAccount()
                .map(account -> accountPermits.withPermit(
                        account.name(), () -> adapter.fetch(subscription.platform(), subscription.sharedAccount())))
                .orElseGet(() -> adapter.fetch(subscription.platform(), subscription.sharedAccount()));
    }
}
