package com.feedwatch.engine.domain.routing;

import java.util.Map;
import java.util.Optional;

public record NotifyTargetCatalog(Map<String, NotifyTarget> targets) {

    public NotifyTargetCatalog {
        targets = Map.copyOf(targets);
    }

    public Optional<NotifyTarget> find(String name) {
        return Optional.ofNullable(targets.get(name));
    }

    /** References are validated when the configuration is loaded, so a miss here is a bug. */
    public NotifyTarget require(String name) {
        return find(name).orElseThrow(() -> new IllegalStateException("Unknown notify target: " + name));
    }
}
