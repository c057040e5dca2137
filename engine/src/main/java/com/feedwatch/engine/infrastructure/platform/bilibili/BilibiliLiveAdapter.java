package com.feedwatch.engine.infrastructure.platform.bilibili;

import com.feedwatch.common.snapshot.LiveStatus;
import com.feedwatch.common.snapshot.Snapshot;
import com.feedwatch.engine.domain.exceptions.FetchException;
import com.feedwatch.engine.domain.platform.PlatformAdapter;
import com.feedwatch.engine.domain.subscription.PlatformAccount;
import com.feedwatch.engine.domain.subscription.PlatformKind;
import com.feedwatch.engine.domain.subscription.PlatformSpec;
import com.feedwatch.engine.domain.subscription.PlatformSpec.LiveStatusSpec;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.databind.ObjectMapper;

/** Live room status from {@code live.bilibili.com}, looked up by the streamer's user id. */
@Slf4j
@RequiredArgsConstructor
public class BilibiliLiveAdapter implements PlatformAdapter {

    static final String STATUS_PATH = "/room/v1/Room/get_status_info_by_uids";
    private static final int LIVE_STATUS_ONLINE = 1;

    private final RestClient restClient;
    private final ObjectMapper mapper;

    @Override
    public PlatformKind kind() {
        return PlatformKind.BILIBILI_LIVE;
    }

    @Override
    public Snapshot fetch(PlatformSpec spec, Optional<PlatformAccount> account) {
        var uid = ((LiveStatusSpec) spec).userId();
        String body;
        try {
            body = restClient.post()
                    .uri(STATUS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(mapper.writeValueAsString(Map.of("uids", List.of(uid))))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw FetchException.of(kind().id(), e.getMessage(), e);
        }

        var room = BilibiliResponses.data(mapper, kind().id(), body).path(String.valueOf(uid));
        if (room.isMissingNode() || room.isNull()) {
            throw FetchException.of(kind().id(), "user " + uid + " has no live room");
        }
        long liveTime = room.path("live_time").asLong(0);
        var status = LiveStatus.builder()
                .online(room.path("live_status").asInt(0) == LIVE_STATUS_ONLINE)
                .title(room.path("title").asText(""))
                .startedAt(liveTime > 0 ? Instant.ofEpochSecond(liveTime) : null)
                .streamerName(room.path("uname").asText(""))
                .liveUrl("https://live.bilibili.com/" + room.path("room_id").asLong(0))
                .coverUrl(BilibiliResponses.nullIfBlank(room.path("cover_from_user").asText("")))
                .build();
        log.debug("Live status of {}: online={}", uid, status.online());
        return status;
    }
}
