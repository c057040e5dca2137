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
import com.feedwatch.engine.domain.subscription.PlatformSpec.VideoSeriesSpec;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Videos of a series on {@code space.bilibili.com}. The archive list does not name the uploader,
 * so items carry no author. The endpoint returns the newest videos first.
 */
@Slf4j
@RequiredArgsConstructor
public class BilibiliVideoSeriesAdapter implements PlatformAdapter {

    static final String ARCHIVES_PATH = "/x/series/archives";

    private final RestClient restClient;
    private final ObjectMapper mapper;

    @Override
    public PlatformKind kind() {
        return PlatformKind.BILIBILI_VIDEO;
    }

    @Override
    public Snapshot fetch(PlatformSpec spec, Optional<PlatformAccount> account) {
        var series = (VideoSeriesSpec) spec;
        String body;
        try {
            body = restClient.get()
                    .uri(uriBuilder -> uriBuilder.path(ARCHIVES_PATH)
                            .queryParam("mid", series.userId())
                            .queryParam("series_id", series.seriesId())
                            .build())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw FetchException.of(kind().id(), e.getMessage(), e);
        }

        List<FeedItem> items = new ArrayList<>();
        for (JsonNode archive : BilibiliResponses.data(mapper, kind().id(), body).path("archives")) {
            var bvid = archive.path("bvid").asText("");
            if (bvid.isEmpty()) {
                continue;
            }
            long published = archive.path("pubdate").asLong(0);
            var cover = BilibiliResponses.nullIfBlank(archive.path("pic").asText(""));
            items.add(FeedItem.builder()
                    .id(bvid)
                    .content(archive.path("title").asText(""))
                    .url("https://www.bilibili.com/video/" + bvid)
                    .publishedAt(published > 0 ? Instant.ofEpochSecond(published) : null)
                    .attachments(cover == null ? List.of() : List.of(Attachment.image(cover)))
                    .build());
        }
        Collections.reverse(items);
        log.debug("Fetched {} videos of {}", items.size(), series.describe());
        return FeedState.of(items);
    }
}
