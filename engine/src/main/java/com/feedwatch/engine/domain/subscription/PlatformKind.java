package com.feedwatch.engine.domain.subscription;

import java.util.Arrays;
import java.util.Optional;

public enum PlatformKind {
    BILIBILI_LIVE("bilibili.live"),
    BILIBILI_SPACE("bilibili.space"),
    BILIBILI_VIDEO("bilibili.video"),
    TWITTER("twitter");

    private final String id;

    PlatformKind(String id) {
        this.id = id;
    }

    /** Identifier used in configuration files and log lines. */
    public String id() {
        return id;
    }

    public static Optional<PlatformKind> fromId(String id) {
        return Arrays.stream(values()).filter(kind -> kind.id.equalsIgnoreCase(id)).findFirst();
    }
}
