package com.feedwatch.engine.domain.subscription;

import java.util.Map;
import java.util.Optional;

/**
 * Credential bundle shared by subscriptions of one platform. Fetches that use the same account are
 * serialised.
 */
public record PlatformAccount(String name, PlatformKind platform, Map<String, String> credentials) {

    public PlatformAccount {
        credentials = credentials == null ? Map.of() : Map.copyOf(credentials);
    }

    public Optional<String> credential(String key) {
        return Optional.ofNullable(credentials.get(key));
    }

    @Override
    public String toString() {
        return "PlatformAccount[name=" + name + ", platform=" + platform.id() + ", credentials=" + credentials.keySet() + "]";
    }
}
