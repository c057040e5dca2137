package com.feedwatch.common.event;

public enum ChangeKind {
    LIVE_STARTED,
    LIVE_ENDED,
    LIVE_TITLE_CHANGED,
    NEW_ITEM,
    LOG
}
