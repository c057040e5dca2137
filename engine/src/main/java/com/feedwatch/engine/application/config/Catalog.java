package com.feedwatch.engine.application.config;

import com.feedwatch.engine.domain.routing.NotifyRef;
import com.feedwatch.engine.domain.routing.NotifyTargetCatalog;
import com.feedwatch.engine.domain.subscription.SubscriptionCatalog;
import java.util.List;

/** Validated, fully resolved configuration. */
public record Catalog(SubscriptionCatalog subscriptions, NotifyTargetCatalog targets, List<NotifyRef> logRefs) {

    public Catalog {
        logRefs = logRefs == null ? List.of() : List.copyOf(logRefs);
    }
}
