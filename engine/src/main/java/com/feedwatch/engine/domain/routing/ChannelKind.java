package com.feedwatch.engine.domain.routing;

import java.util.Arrays;
import java.util.Optional;

public enum ChannelKind {
    TELEGRAM("telegram"),
    ONEBOT("qq");

    private final String id;

    ChannelKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<ChannelKind> fromId(String id) {
        return Arrays.stream(values()).filter(kind -> kind.id.equalsIgnoreCase(id)).findFirst();
    }
}
