package com.feedwatch.engine.domain.subscription;

import com.feedwatch.engine.domain.routing.NotifyRef;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.Builder;

/**
 * One watched source of one person together with where its changes go.
 *
 * @param interval poll interval, {@code null} to use the global one
 * @param account shared account used for fetching, {@code null} when the platform needs none
 * @param notifyRefs targets told about every change, in order
 */
@Builder(toBuilder = true)
public record Subscription(
        String name, PlatformSpec platform, Duration interval, PlatformAccount account, List<NotifyRef> notifyRefs) {

    public Subscription {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(platform, "platform");
        notifyRefs = notifyRefs == null ? List.of() : List.copyOf(notifyRefs);
    }

    /** Addresses this subscription's state; unique across the configuration. */
    public String key() {
        return name + "/" + platform.describe();
    }

    public Duration effectiveInterval(Duration globalInterval) {
        return interval != null ? interval : globalInterval;
    }

    public Optional<PlatformAccount> sharedAccount() {
        return Optional.ofNullable(account);
    }
}
