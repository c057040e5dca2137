package com.feedwatch.engine.domain.routing;

import java.util.Map;

/** Reference to a {@link NotifyTarget} by name, with overrides applied on top of it. */
public record NotifyRef(String target, Map<String, String> overrides, ToggleOverrides notifications) {

    public NotifyRef {
        overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
        notifications = notifications == null ? ToggleOverrides.NONE : notifications;
    }

    public static NotifyRef to(String target) {
        return new NotifyRef(target, Map.of(), ToggleOverrides.NONE);
    }

    public static NotifyRef to(String target, Map<String, String> overrides) {
        return new NotifyRef(target, overrides, ToggleOverrides.NONE);
    }
}
