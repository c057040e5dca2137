package com.feedwatch.common.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;

/**
 * One post, tweet or video of a feed.
 *
 * @param attachments media attached to the item, in display order; never null
 * @param repostFrom the item this one reposts, or null for an original item
 */
@Builder(toBuilder = true)
public record FeedItem(
        String id,
        String author,
        String content,
        String url,
        @JsonProperty("published_at") Instant publishedAt,
        List<Attachment> attachments,
        @JsonProperty("repost_from") FeedItem repostFrom) {

    public FeedItem {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    /** Attachments of this item followed by those of the reposted item. */
    public List<Attachment> allAttachments() {
        if (repostFrom == null) {
            return attachments;
        }
        var all = new ArrayList<>(attachments);
        all.addAll(repostFrom.allAttachments());
        return List.copyOf(all);
    }
}
