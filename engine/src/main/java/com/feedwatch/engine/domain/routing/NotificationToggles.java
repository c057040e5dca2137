package com.feedwatch.engine.domain.routing;

import com.feedwatch.common.event.ChangeKind;

/**
 * Which kinds of change a target wants to hear about. {@code liveOnline} covers both going live
 * and going offline.
 */
public record NotificationToggles(boolean liveOnline, boolean liveTitle, boolean post, boolean log) {

    public static final NotificationToggles DEFAULTS = new NotificationToggles(true, false, true, true);

    public boolean allows(ChangeKind kind) {
        return switch (kind) {
            case LIVE_STARTED, LIVE_ENDED -> liveOnline;
            case LIVE_TITLE_CHANGED -> liveTitle;
            case NEW_ITEM -> post;
            case LOG -> log;
        };
    }

    public NotificationToggles apply(ToggleOverrides overrides) {
        if (overrides == null) {
            return this;
        }
        return new NotificationToggles(
                pick(overrides.liveOnline(), liveOnline),
                pick(overrides.liveTitle(), liveTitle),
                pick(overrides.post(), post),
                pick(overrides.log(), log));
    }

    private static boolean pick(Boolean override, boolean current) {
        return override != null ? override : current;
    }
}
