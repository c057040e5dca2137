package com.feedwatch.engine.domain.detection;

import com.feedwatch.common.event.ChangeEvent;
import com.feedwatch.common.event.ChangeKind;
import com.feedwatch.common.event.ChangePayload;
import com.feedwatch.common.event.ChangePayload.LiveChange;
import com.feedwatch.common.event.ChangePayload.NewItem;
import com.feedwatch.common.id.EventIdGenerator;
import com.feedwatch.common.snapshot.FeedItem;
import com.feedwatch.common.snapshot.FeedState;
import com.feedwatch.common.snapshot.LiveStatus;
import com.feedwatch.common.snapshot.SeenMarkers;
import com.feedwatch.common.snapshot.Snapshot;
import com.feedwatch.engine.domain.exceptions.SnapshotMismatchException;
import com.feedwatch.engine.domain.subscription.PlatformSpec.LiveStatusSpec;
import com.feedwatch.engine.domain.subscription.Subscription;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives change events from the committed and the freshly fetched snapshot of a subscription.
 *
 * <p>Live status reports transitions only: going live always, going offline and title changes when
 * the subscription asks for them. Feeds report every item whose id has not been seen before, in
 * the order the adapter returned them (oldest-first). Without a committed snapshot the fetched one
 * becomes the baseline and nothing is reported.
 *
 * <p>The engine is stateless; calling it twice with the same inputs yields the same events apart
 * from their ids and timestamps.
 */
@Slf4j
@RequiredArgsConstructor
public class ChangeDetectionEngine {

    private final int seenCapacity;
    private final Clock clock;

    public Detection detect(Subscription subscription, Snapshot previous, Snapshot fetched) {
        if (subscription.platform() instanceof LiveStatusSpec spec) {
            var current = expect(subscription, fetched, LiveStatus.class);
            return detectLive(subscription, spec, previous, current);
        }
        var current = expect(subscription, fetched, FeedState.class);
        return detectFeed(subscription, previous, current);
    }

    private Detection detectLive(Subscription subscription, LiveStatusSpec spec, Snapshot previous, LiveStatus current) {
        if (previous == null) {
            log.info("Baseline for {}: online={}", subscription.key(), current.online());
            return Detection.baseline(current);
        }
        var before = expect(subscription, previous, LiveStatus.class);
        List<ChangeEvent> events = new ArrayList<>();
        if (!before.online() && current.online()) {
            events.add(event(subscription, ChangeKind.LIVE_STARTED, new LiveChange(current, null)));
        } else if (before.online() && !current.online()) {
            if (spec.reportOffline()) {
                events.add(event(subscription, ChangeKind.LIVE_ENDED, new LiveChange(current, null)));
            }
        } else if (spec.reportTitle() && !Objects.equals(before.title(), current.title())) {
            events.add(event(subscription, ChangeKind.LIVE_TITLE_CHANGED, new LiveChange(current, before.title())));
        }
        return new Detection(events, current, false);
    }

    private Detection detectFeed(Subscription subscription, Snapshot previous, FeedState current) {
        var visible = new LinkedHashSet<String>();
        var items = current.items();
        for (int i = 0; i < items.size(); i++) {
            var id = items.get(i).id();
            if (id == null || id.isBlank()) {
                throw SnapshotMismatchException.malformedItem(subscription.key(), i);
            }
            visible.add(id);
        }

        if (previous == null) {
            log.info("Baseline for {}: {} items", subscription.key(), visible.size());
            return Detection.baseline(current.withSeen(SeenMarkers.empty().remember(visible, seenCapacity)));
        }

        var seen = expect(subscription, previous, FeedState.class).seen();
        var reported = new LinkedHashSet<String>();
        List<ChangeEvent> events = new ArrayList<>();
        for (FeedItem item : items) {
            if (!seen.contains(item.id()) && reported.add(item.id())) {
                events.add(event(subscription, ChangeKind.NEW_ITEM, new NewItem(item)));
            }
        }
        return new Detection(events, current.withSeen(seen.remember(visible, seenCapacity)), false);
    }

    private ChangeEvent event(Subscription subscription, ChangeKind kind, ChangePayload payload) {
        return ChangeEvent.builder()
                .eventId(EventIdGenerator.next())
                .subscriptionName(subscription.name())
                .platform(subscription.platform().kind().id())
                .kind(kind)
                .payload(payload)
                .detectedAt(clock.instant())
                .build();
    }

    private static <T extends Snapshot> T expect(Subscription subscription, Snapshot snapshot, Class<T> type) {
        if (!type.isInstance(snapshot)) {
            throw SnapshotMismatchException.of(subscription.key(), type, snapshot.getClass());
        }
        return type.cast(snapshot);
    }
}
