package com.feedwatch.engine.domain.routing;

import com.feedwatch.common.event.ChangeEvent;
import com.feedwatch.common.snapshot.Attachment;
import java.util.List;

/** Port to a chat platform. Implementations must be safe to call from several cycles at once. */
public interface NotificationChannel {

    ChannelKind kind();

    default String render(ChangeEvent event) {
        return MessageRenderer.plainText(event);
    }

    /**
     * Sends one message.
     *
     * @param body text produced by {@link #render(ChangeEvent)}
     * @param media images and videos to show with the text, possibly empty; channels that cannot
     *     show them may drop them
     */
    void deliver(ChannelParameters parameters, String body, List<Attachment> media);
}
