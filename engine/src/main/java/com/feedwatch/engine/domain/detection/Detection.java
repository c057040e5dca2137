package com.feedwatch.engine.domain.detection;

import com.feedwatch.common.event.ChangeEvent;
import com.feedwatch.common.snapshot.Snapshot;
import java.util.List;

/**
 * Result of comparing a fetched snapshot with the committed one.
 *
 * @param next snapshot to commit once the diff is accepted
 * @param baseline whether this was the first snapshot for the subscription
 */
public record Detection(List<ChangeEvent> events, Snapshot next, boolean baseline) {

    public Detection {
        events = List.copyOf(events);
    }

    static Detection baseline(Snapshot next) {
        return new Detection(List.of(), next, true);
    }
}
