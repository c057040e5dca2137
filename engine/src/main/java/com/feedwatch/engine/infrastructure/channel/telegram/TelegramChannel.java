package com.feedwatch.engine.infrastructure.channel.telegram;

import com.feedwatch.common.event.ChangeEvent;
import com.feedwatch.common.snapshot.Attachment;
import com.feedwatch.engine.domain.exceptions.DeliveryException;
import com.feedwatch.engine.domain.routing.ChannelKind;
import com.feedwatch.engine.domain.routing.ChannelParameters;
import com.feedwatch.engine.domain.routing.MessageRenderer;
import com.feedwatch.engine.domain.routing.NotificationChannel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.HtmlUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Sends messages through the Telegram Bot API.
 *
 * <p>Parameters: {@code chat-id} (numeric id or {@code @username}), optional {@code thread-id}
 * for forum topics, optional {@code token} overriding the bot token configured globally.
 *
 * <p>One attachment is sent with {@code sendPhoto} or {@code sendVideo}, several as an album with
 * {@code sendMediaGroup}, the text becoming the caption. Text longer than a caption allows, or
 * media Telegram refuses to fetch, falls back to a plain {@code sendMessage}.
 */
@Slf4j
public class TelegramChannel implements NotificationChannel {

    static final int CAPTION_LIMIT = 1024;
    static final int MEDIA_GROUP_LIMIT = 10;

    private final RestClient restClient;
    private final ObjectMapper mapper;
    private final String defaultToken;

    public TelegramChannel(RestClient restClient, ObjectMapper mapper, String defaultToken) {
        this.restClient = restClient;
        this.mapper = mapper;
        this.defaultToken = defaultToken;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.TELEGRAM;
    }

    /** Escapes the plain text for HTML parse mode and puts the headline in bold. */
    @Override
    public String render(ChangeEvent event) {
        var text = HtmlUtils.htmlEscape(MessageRenderer.plainText(event));
        int lineBreak = text.indexOf('\n');
        return lineBreak < 0
                ? "<b>" + text + "</b>"
                : "<b>" + text.substring(0, lineBreak) + "</b>" + text.substring(lineBreak);
    }

    @Override
    public void deliver(ChannelParameters parameters, String body, List<Attachment> media) {
        var token = parameters.get("token")
                .or(() -> Optional.ofNullable(defaultToken).filter(value -> !value.isBlank()))
                .orElseThrow(() -> DeliveryException.missingParameter(kind().id(), "token"));

        var chat = new LinkedHashMap<String, Object>();
        chat.put("chat_id", parameters.require("chat-id", kind()));
        parameters.get("thread-id").ifPresent(threadId -> chat.put("message_thread_id", threadId(threadId)));

        if (!media.isEmpty() && body.length() <= CAPTION_LIMIT) {
            try {
                sendMedia(token, chat, body, media);
                return;
            } catch (DeliveryException e) {
                log.warn("Telegram rejected media for chat {}, sending text only: {}", chat.get("chat_id"), e.getMessage());
            }
        }
        var request = new LinkedHashMap<>(chat);
        request.put("text", body);
        request.put("parse_mode", "HTML");
        call(token, "sendMessage", request);
        log.debug("Telegram accepted message for chat {}", chat.get("chat_id"));
    }

    private void sendMedia(String token, Map<String, Object> chat, String caption, List<Attachment> media) {
        var request = new LinkedHashMap<>(chat);
        if (media.size() == 1) {
            var attachment = media.get(0);
            request.put(mediaType(attachment), attachment.url());
            request.put("caption", caption);
            request.put("parse_mode", "HTML");
            call(token, attachment.kind() == Attachment.Kind.VIDEO ? "sendVideo" : "sendPhoto", request);
            return;
        }
        List<Map<String, Object>> group = new ArrayList<>();
        for (Attachment attachment : media.subList(0, Math.min(media.size(), MEDIA_GROUP_LIMIT))) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("type", mediaType(attachment));
            entry.put("media", attachment.url());
            // the album caption is the caption of its first item
            if (group.isEmpty()) {
                entry.put("caption", caption);
                entry.put("parse_mode", "HTML");
            }
            group.add(entry);
        }
        request.put("media", group);
        call(token, "sendMediaGroup", request);
    }

    private void call(String token, String method, Map<String, Object> request) {
        String response;
        try {
            response = restClient.post()
                    .uri(builder -> builder.path("/bot" + token + "/" + method).build())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(mapper.writeValueAsString(request))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw DeliveryException.of(kind().id(), e.getStatusCode().value() + " " + description(e.getResponseBodyAsString()), e);
        } catch (RestClientException e) {
            throw DeliveryException.of(kind().id(), e.getMessage(), e);
        }
        if (!accepted(response)) {
            throw DeliveryException.of(kind().id(), description(response));
        }
    }

    private static String mediaType(Attachment attachment) {
        return attachment.kind() == Attachment.Kind.VIDEO ? "video" : "photo";
    }

    private long threadId(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw DeliveryException.of(kind().id(), "thread-id is not a number: " + value);
        }
    }

    private boolean accepted(String response) {
        if (response == null || response.isBlank()) {
            return false;
        }
        try {
            return mapper.readTree(response).path("ok").asBoolean(false);
        } catch (JacksonException e) {
            return false;
        }
    }

    private String description(String response) {
        if (response == null || response.isBlank()) {
            return "empty response";
        }
        try {
            return mapper.readTree(response).path("description").asText(response);
        } catch (JacksonException e) {
            return response;
        }
    }
}
