package com.feedwatch.common.event;

import com.feedwatch.common.snapshot.FeedItem;
import com.feedwatch.common.snapshot.LiveStatus;

public sealed interface ChangePayload {

    /** Live status after the transition; {@code previousTitle} is set for title changes only. */
    record LiveChange(LiveStatus status, String previousTitle) implements ChangePayload {}

    record NewItem(FeedItem item) implements ChangePayload {}

    record LogRecord(String level, String logger, String message) implements ChangePayload {}
}
