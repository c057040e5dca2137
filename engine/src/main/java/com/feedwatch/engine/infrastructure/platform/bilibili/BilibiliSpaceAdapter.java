package com.feedwatch.engine.infrastructure.platform.bilibili;

import com.feedwatch.common.snapshot.Attachment;
import com.feedwatch.common.snapshot.FeedItem;
import com.feedwatch.common.snapshot.FeedState;
import com.feedwatch.common.snapshot.Snapshot;
import com.feedwatch.engine.domain.exceptions.FetchException;
import com.feedwatch.engine.domain.platform.PlatformAdapter;
import com.feedwatch.engine.domain.subscription.PlatformAccount;
import com.feedwatch.engine.domain.subscription.PlatformKind;
import com.feedwatch.engine.domain.subscription.PlatformSpec;
import com.feedwatch.engine.domain.subscription.PlatformSpec.PostFeedSpec;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Dynamics ("posts") of a user from {@code space.bilibili.com}. The endpoint returns the newest
 * dynamics first; the snapshot lists them oldest-first.
 */
@Slf4j
@RequiredArgsConstructor
public class BilibiliSpaceAdapter implements PlatformAdapter {

    static final String FEED_PATH = "/x/polymer/web-dynamic/v1/feed/space";
    static final String COOKIES = "cookies";

    private final RestClient restClient;
    private final ObjectMapper mapper;

    @Override
    public PlatformKind kind() {
        return PlatformKind.BILIBILI_SPACE;
    }

    @Override
    public Snapshot fetch(PlatformSpec spec, Optional<PlatformAccount> account) {
        var uid = ((PostFeedSpec) spec).userId();
        String body;
        try {
            body = restClient.get()
                    .uri(uriBuilder -> uriBuilder.path(FEED_PATH).queryParam("host_mid", uid).build())
                    .headers(headers -> account.flatMap(a -> a.credential(COOKIES))
                            .ifPresent(cookies -> headers.set(HttpHeaders.COOKIE, cookies)))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw FetchException.of(kind().id(), e.getMessage(), e);
        }

        List<FeedItem> items = new ArrayList<>();
        for (JsonNode node : BilibiliResponses.data(mapper, kind().id(), body).path("items")) {
            items.add(toItem(node));
        }
        Collections.reverse(items);
        log.debug("Fetched {} dynamics of {}", items.size(), uid);
        return FeedState.of(items);
    }

    /** Maps one dynamic; a forwarded dynamic carries the original under {@code orig}. */
    private static FeedItem toItem(JsonNode node) {
        var id = node.path("id_str").asText("");
        var modules = node.path("modules");
        var author = modules.path("module_author");
        var major = modules.path("module_dynamic").path("major");
        long published = author.path("pub_ts").asLong(0);
        var original = node.path("orig");
        return FeedItem.builder()
                .id(id)
                .author(author.path("name").asText(""))
                .content(content(modules.path("module_dynamic")))
                .url(url(id, major))
                .publishedAt(published > 0 ? Instant.ofEpochSecond(published) : null)
                .attachments(attachments(major))
                .repostFrom(original.isObject() ? toItem(original) : null)
                .build();
    }

    private static String content(JsonNode dynamic) {
        var text = dynamic.path("desc").path("text").asText("");
        if (!text.isBlank()) {
            return text;
        }
        var major = dynamic.path("major");
        var summary = major.path("opus").path("summary").path("text").asText("");
        if (!summary.isBlank()) {
            return summary;
        }
        for (String kind : List.of("archive", "article", "pgc")) {
            var title = major.path(kind).path("title").asText("");
            if (!title.isBlank()) {
                return title;
            }
        }
        return "";
    }

    private static String url(String id, JsonNode major) {
        var bvid = major.path("archive").path("bvid").asText("");
        if (!bvid.isEmpty()) {
            return "https://www.bilibili.com/video/" + bvid;
        }
        long article = major.path("article").path("id").asLong(0);
        if (article > 0) {
            return "https://www.bilibili.com/read/cv" + article;
        }
        long episode = major.path("pgc").path("epid").asLong(0);
        if (episode > 0) {
            return "https://www.bilibili.com/bangumi/play/ep" + episode;
        }
        return "https://www.bilibili.com/opus/" + id;
    }

    private static List<Attachment> attachments(JsonNode major) {
        List<Attachment> attachments = new ArrayList<>();
        major.path("opus").path("pics").forEach(pic -> image(pic.path("url"), attachments));
        major.path("draw").path("items").forEach(item -> image(item.path("src"), attachments));
        major.path("article").path("covers").forEach(cover -> image(cover, attachments));
        image(major.path("archive").path("cover"), attachments);
        image(major.path("pgc").path("cover"), attachments);
        return attachments;
    }

    private static void image(JsonNode url, List<Attachment> attachments) {
        var value = url.asText("");
        if (!value.isBlank()) {
            attachments.add(Attachment.image(value));
        }
    }
}
