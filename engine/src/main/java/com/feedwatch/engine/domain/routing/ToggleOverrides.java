package com.feedwatch.engine.domain.routing;

/** Per-reference toggle overrides; {@code null} keeps the target's value. */
public record ToggleOverrides(Boolean liveOnline, Boolean liveTitle, Boolean post, Boolean log) {

    public static final ToggleOverrides NONE = new ToggleOverrides(null, null, null, null);
}
