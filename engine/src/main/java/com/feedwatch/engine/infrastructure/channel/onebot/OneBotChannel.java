package com.feedwatch.engine.infrastructure.channel.onebot;

import com.feedwatch.common.snapshot.Attachment;
import com.feedwatch.engine.domain.exceptions.DeliveryException;
import com.feedwatch.engine.domain.routing.ChannelKind;
import com.feedwatch.engine.domain.routing.ChannelParameters;
import com.feedwatch.engine.domain.routing.NotificationChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * QQ messages through a OneBot v11 HTTP endpoint (for example Lagrange). Parameters: exactly one
 * of {@code group-id} and {@code user-id}.
 *
 * <p>Plain text goes out as a string message. Images are appended as {@code image} segments;
 * videos are not sent.
 */
@Slf4j
public class OneBotChannel implements NotificationChannel {

    private final RestClient restClient;
    private final ObjectMapper mapper;
    private final String accessToken;

    public OneBotChannel(RestClient restClient, ObjectMapper mapper, String accessToken) {
        this.restClient = restClient;
        this.mapper = mapper;
        this.accessToken = accessToken;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.ONEBOT;
    }

    @Override
    public void deliver(ChannelParameters parameters, String body, List<Attachment> media) {
        var group = parameters.get("group-id");
        var message = message(body, media);
        String action;
        Map<String, Object> request;
        if (group.isPresent()) {
            action = "/send_group_msg";
            request = Map.of("group_id", number("group-id", group.get()), "message", message);
        } else {
            action = "/send_private_msg";
            request = Map.of("user_id", number("user-id", parameters.require("user-id", kind())), "message", message);
        }

        try {
            var response = restClient.post()
                    .uri(action)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        if (accessToken != null && !accessToken.isBlank()) {
                            headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
                        }
                    })
                    .body(mapper.writeValueAsString(request))
                    .retrieve()
                    .body(String.class);
            var root = response == null ? null : mapper.readTree(response);
            if (root == null || root.path("retcode").asInt(-1) != 0) {
                throw DeliveryException.of(kind().id(), "rejected: " + response);
            }
        } catch (RestClientException | JacksonException e) {
            throw DeliveryException.of(kind().id(), e.getMessage(), e);
        }
        log.debug("OneBot accepted message via {}", action);
    }

    private static Object message(String body, List<Attachment> media) {
        var images = media.stream().filter(attachment -> attachment.kind() == Attachment.Kind.IMAGE).toList();
        if (images.isEmpty()) {
            return body;
        }
        List<Map<String, Object>> segments = new ArrayList<>();
        segments.add(Map.of("type", "text", "data", Map.of("text", body)));
        images.forEach(image -> segments.add(Map.of("type", "image", "data", Map.of("file", image.url()))));
        return segments;
    }

    private long number(String parameter, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw DeliveryException.of(kind().id(), parameter + " is not a number: " + value);
        }
    }
}
