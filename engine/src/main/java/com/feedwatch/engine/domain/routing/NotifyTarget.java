package com.feedwatch.engine.domain.routing;

public record NotifyTarget(
        String name, ChannelKind channel, ChannelParameters parameters, NotificationToggles notifications) {

    public NotifyTarget {
        parameters = parameters == null ? ChannelParameters.empty() : parameters;
        notifications = notifications == null ? NotificationToggles.DEFAULTS : notifications;
    }

    /** Applies a reference's overrides; the target itself is left untouched. */
    public NotifyTarget resolve(NotifyRef ref) {
        return new NotifyTarget(
                name, channel, parameters.merge(ref.overrides()), notifications.apply(ref.notifications()));
    }
}
