package com.feedwatch.common.snapshot;

import java.util.List;

/**
 * Items visible in the latest fetch, ordered oldest-first, plus the identifiers already reported.
 *
 * <p>Adapters return a {@code FeedState} with empty {@link SeenMarkers}; the markers are filled in
 * by change detection before the state is committed.
 */
public record FeedState(List<FeedItem> items, SeenMarkers seen) implements Snapshot {

    public FeedState {
        items = items == null ? List.of() : List.copyOf(items);
        seen = seen == null ? SeenMarkers.empty() : seen;
    }

    public static FeedState of(List<FeedItem> items) {
        return new FeedState(items, SeenMarkers.empty());
    }

    public FeedState withSeen(SeenMarkers markers) {
        return new FeedState(items, markers);
    }
}
