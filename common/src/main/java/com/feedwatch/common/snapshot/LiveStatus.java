package com.feedwatch.common.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record LiveStatus(
        boolean online,
        String title,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("streamer_name") String streamerName,
        @JsonProperty("live_url") String liveUrl,
        @JsonProperty("cover_url") String coverUrl)
        implements Snapshot {}
