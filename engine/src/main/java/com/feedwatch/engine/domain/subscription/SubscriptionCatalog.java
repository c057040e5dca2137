package com.feedwatch.engine.domain.subscription;

import java.time.Duration;
import java.util.List;

public record SubscriptionCatalog(List<Subscription> subscriptions, Duration interval) {

    public SubscriptionCatalog {
        subscriptions = List.copyOf(subscriptions);
    }
}
