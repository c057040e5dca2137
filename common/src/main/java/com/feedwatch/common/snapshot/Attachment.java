package com.feedwatch.common.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Attachment(Kind kind, String url) {

    public enum Kind {
        @JsonProperty("image")
        IMAGE,
        @JsonProperty("video")
        VIDEO
    }

    public static Attachment image(String url) {
        return new Attachment(Kind.IMAGE, url);
    }

    public static Attachment video(String url) {
        return new Attachment(Kind.VIDEO, url);
    }
}
