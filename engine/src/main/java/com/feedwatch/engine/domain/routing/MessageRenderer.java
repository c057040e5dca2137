package com.feedwatch.engine.domain.routing;

import com.feedwatch.common.event.ChangeEvent;
import com.feedwatch.common.event.ChangeKind;
import com.feedwatch.common.event.ChangePayload.LiveChange;
import com.feedwatch.common.event.ChangePayload.LogRecord;
import com.feedwatch.common.event.ChangePayload.NewItem;
import com.feedwatch.common.snapshot.Attachment;
import com.feedwatch.common.snapshot.FeedItem;
import java.util.List;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class MessageRenderer {

    public static String plainText(ChangeEvent event) {
        var payload = event.payload();
        if (payload instanceof LogRecord record) {
            return "#log #" + record.level().toLowerCase() + " " + record.message();
        }
        var header = "[" + event.platform() + "] ";
        if (payload instanceof LiveChange change) {
            var status = change.status();
            return switch (event.kind()) {
                case LIVE_STARTED -> header + status.streamerName() + " is live: " + status.title()
                        + suffix(status.liveUrl());
                case LIVE_ENDED -> header + status.streamerName() + " went offline";
                case LIVE_TITLE_CHANGED -> header + status.streamerName() + " changed the title: "
                        + change.previousTitle() + " -> " + status.title() + suffix(status.liveUrl());
                default -> header + status.streamerName() + ": " + status.title();
            };
        }
        if (payload instanceof NewItem newItem) {
            return header + item(newItem.item());
        }
        return header + event.kind();
    }

    /** Images and videos worth showing with the message: the cover of a started stream, or the item's media. */
    public static List<Attachment> media(ChangeEvent event) {
        var payload = event.payload();
        if (payload instanceof LiveChange change && event.kind() == ChangeKind.LIVE_STARTED) {
            var cover = change.status().coverUrl();
            return isBlank(cover) ? List.of() : List.of(Attachment.image(cover));
        }
        if (payload instanceof NewItem newItem) {
            return newItem.item().allAttachments();
        }
        return List.of();
    }

    private static String item(FeedItem item) {
        var repost = item.repostFrom();
        var text = new StringBuilder();
        if (isBlank(item.author())) {
            text.append(repost == null ? "new upload:" : "new repost:");
        } else {
            text.append(item.author()).append(repost == null ? " posted:" : " reposted:");
        }
        if (!isBlank(item.content())) {
            text.append('\n').append(item.content());
        }
        if (repost != null) {
            text.append("\n> ");
            if (!isBlank(repost.author())) {
                text.append(repost.author()).append(": ");
            }
            text.append(repost.content() == null ? "" : repost.content());
        }
        return text + suffix(item.url());
    }

    private static String suffix(String url) {
        return isBlank(url) ? "" : "\n" + url;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
