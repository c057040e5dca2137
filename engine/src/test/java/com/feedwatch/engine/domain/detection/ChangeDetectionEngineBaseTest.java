package com.feedwatch.engine.domain.detection;

import com.feedwatch.common.event.ChangeEvent;
import com.feedwatch.common.event.ChangeKind;
import com.feedwatch.common.snapshot.Snapshot;
import com.feedwatch.engine.domain.subscription.Subscription;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.feedwatch.engine.fixtures.FeedwatchFixtures.SOME_INSTANT;

public abstract class ChangeDetectionEngineBaseTest {

    static final int SEEN_CAPACITY = 300;

    final ChangeDetectionEngine engine =
            new ChangeDetectionEngine(SEEN_CAPACITY, Clock.fixed(SOME_INSTANT, ZoneOffset.UTC));

    /** Feeds the snapshots through the engine the way consecutive cycles would, returning every event. */
    List<ChangeEvent> replay(Subscription subscription, Snapshot... fetched) {
        List<ChangeEvent> events = new ArrayList<>();
        Snapshot committed = null;
        for (Snapshot snapshot : fetched) {
            var detection = engine.detect(subscription, committed, snapshot);
            events.addAll(detection.events());
            committed = detection.next();
        }
        return events;
    }

    static List<ChangeKind> kinds(List<ChangeEvent> events) {
        return events.stream().map(ChangeEvent::kind).toList();
    }
}
