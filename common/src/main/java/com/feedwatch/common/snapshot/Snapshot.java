package com.feedwatch.common.snapshot;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Point-in-time observation of one source, as returned by a platform adapter. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = LiveStatus.class, name = "live_status"),
    @JsonSubTypes.Type(value = FeedState.class, name = "feed_state")
})
public sealed interface Snapshot permits LiveStatus, FeedState {}
