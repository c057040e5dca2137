package com.feedwatch.common.snapshot;

import com.feedwatch.common.json.JacksonConfig;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotSerializationTest {

    private final ObjectMapper mapper = JacksonConfig.createObjectMapper();

    @Test
    void liveStatusCarriesTypeDiscriminator() {
        Snapshot status = LiveStatus.builder()
                .online(true)
                .title("late night stream")
                .startedAt(Instant.parse("2026-02-21T14:30:00Z"))
                .streamerName("meow")
                .liveUrl("https://live.bilibili.com/42")
                .build();

        String json = mapper.writeValueAsString(status);
        assertThat(json).contains("\"type\":\"live_status\"");
        assertThat(json).contains("\"streamer_name\":\"meow\"");

        var restored = mapper.readValue(json, Snapshot.class);
        assertThat(restored).isEqualTo(status);
    }

    @Test
    void feedStateKeepsSeenMarkerOrder() {
        Snapshot state = new FeedState(
                List.of(FeedItem.builder().id("3").author("meow").content("hello").url("https://x.com/meow/status/3").build()),
                SeenMarkers.of(List.of("1", "2", "3")));

        String json = mapper.writeValueAsString(state);
        assertThat(json).contains("\"seen\":[\"1\",\"2\",\"3\"]");

        var restored = (FeedState) mapper.readValue(json, Snapshot.class);
        assertThat(restored.seen().ids()).containsExactly("1", "2", "3");
        assertThat(restored.items()).extracting(FeedItem::id).containsExactly("3");
    }

    @Test
    void feedItemKeepsAttachmentsAndRepost() {
        var original = FeedItem.builder()
                .id("1")
                .author("purr")
                .content("look")
                .attachments(List.of(Attachment.video("https://video.twimg.com/1.mp4")))
                .build();
        Snapshot state = FeedState.of(List.of(FeedItem.builder()
                .id("2")
                .author("meow")
                .content("RT")
                .attachments(List.of(Attachment.image("https://pbs.twimg.com/2.jpg")))
                .repostFrom(original)
                .build()));

        String json = mapper.writeValueAsString(state);
        assertThat(json).contains("\"repost_from\":{").contains("\"kind\":\"video\"");

        var item = ((FeedState) mapper.readValue(json, Snapshot.class)).items().get(0);
        assertThat(item.repostFrom()).isEqualTo(original);
        assertThat(item.allAttachments()).extracting(Attachment::url)
                .containsExactly("https://pbs.twimg.com/2.jpg", "https://video.twimg.com/1.mp4");
    }

    @Test
    void feedItemWithoutMediaFieldsLoadsWithNoAttachments() {
        String json = """
                {"type":"feed_state","items":[{"id":"9","author":"meow","content":"old","url":null}],"seen":["9"]}
                """;

        var item = ((FeedState) mapper.readValue(json, Snapshot.class)).items().get(0);

        assertThat(item.attachments()).isEmpty();
        assertThat(item.repostFrom()).isNull();
    }
}
