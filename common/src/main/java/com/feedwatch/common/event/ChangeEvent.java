package com.feedwatch.common.event;

import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record ChangeEvent(
        String eventId,
        String subscriptionName,
        String platform,
        ChangeKind kind,
        ChangePayload payload,
        Instant detectedAt) {}
