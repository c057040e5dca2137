package com.feedwatch.engine.infrastructure.platform.bilibili;

import com.feedwatch.engine.domain.exceptions.FetchException;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/** Bilibili wraps every payload as {@code {"code": 0, "message": "...", "data": ...}}. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class BilibiliResponses {

    static JsonNode data(ObjectMapper mapper, String platform, String body) {
        if (body == null || body.isBlank()) {
            throw FetchException.of(platform, "empty response");
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JacksonException e) {
            throw FetchException.of(platform, "unreadable response", e);
        }
        if (root == null || !root.has("code")) {
            throw FetchException.of(platform, "response has no code");
        }
        int code = root.path("code").asInt(0);
        if (code != 0) {
            throw FetchException.of(platform, "code " + code + ": " + root.path("message").asText(""));
        }
        return root.path("data");
    }

    static String nullIfBlank(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
