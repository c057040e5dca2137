package com.feedwatch.engine.fixtures;

import com.feedwatch.common.event.ChangeEvent;
import com.feedwatch.common.event.ChangeKind;
import com.feedwatch.common.event.ChangePayload.LiveChange;
import com.feedwatch.common.event.ChangePayload.NewItem;
import com.feedwatch.common.snapshot.FeedItem;
import com.feedwatch.common.snapshot.FeedState;
import com.feedwatch.common.snapshot.LiveStatus;
import com.feedwatch.engine.domain.routing.NotifyRef;
import com.feedwatch.engine.domain.subscription.PlatformAccount;
import com.feedwatch.engine.domain.subscription.PlatformKind;
import com.feedwatch.engine.domain.subscription.PlatformSpec.LiveStatusSpec;
import com.feedwatch.engine.domain.subscription.PlatformSpec.PostFeedSpec;
import com.feedwatch.engine.domain.subscription.PlatformSpec.SocialFeedSpec;
import com.feedwatch.engine.domain.subscription.Subscription;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public final class FeedwatchFixtures {

    public static final String SOME_NAME = "meow";
    public static final long SOME_USER_ID = 123456L;
    public static final String SOME_HANDLE = "meowmeow";
    public static final String SOME_TARGET = "meow-group";
    public static final Instant SOME_INSTANT = Instant.parse("2026-02-21T14:30:00Z");

    private FeedwatchFixtures() {}

    public static Subscription liveSubscription() {
        return liveSubscription(false, false);
    }

    public static Subscription liveSubscription(boolean reportOffline, boolean reportTitle) {
        return Subscription.builder()
                .name(SOME_NAME)
                .platform(new LiveStatusSpec(SOME_USER_ID, reportOffline, reportTitle))
                .notifyRefs(List.of(NotifyRef.to(SOME_TARGET)))
                .build();
    }

    public static Subscription postSubscription() {
        return Subscription.builder()
                .name(SOME_NAME)
                .platform(new PostFeedSpec(SOME_USER_ID))
                .notifyRefs(List.of(NotifyRef.to(SOME_TARGET)))
                .build();
    }

    public static Subscription socialSubscription(String name, PlatformAccount account) {
        return Subscription.builder()
                .name(name)
                .platform(new SocialFeedSpec(name))
                .account(account)
                .notifyRefs(List.of(NotifyRef.to(SOME_TARGET)))
                .build();
    }

    public static PlatformAccount twitterAccount(String name) {
        return new PlatformAccount(name, PlatformKind.TWITTER, Map.of("cookies", "auth_token=a; ct0=csrf"));
    }

    public static LiveStatus online(String title) {
        return LiveStatus.builder()
                .online(true)
                .title(title)
                .streamerName(SOME_NAME)
                .liveUrl("https://live.bilibili.com/42")
                .build();
    }

    public static LiveStatus offline(String title) {
        return online(title).toBuilder().online(false).build();
    }

    public static FeedItem item(String id) {
        return FeedItem.builder()
                .id(id)
                .author(SOME_NAME)
                .content("post " + id)
                .url("https://www.bilibili.com/opus/" + id)
                .publishedAt(SOME_INSTANT)
                .build();
    }

    public static FeedState feed(String... ids) {
        return FeedState.of(Arrays.stream(ids).map(FeedwatchFixtures::item).toList());
    }

    public static ChangeEvent liveStartedEvent() {
        return ChangeEvent.builder()
                .eventId("01HZ3X0000000000000000000A")
                .subscriptionName(SOME_NAME)
                .platform(PlatformKind.BILIBILI_LIVE.id())
                .kind(ChangeKind.LIVE_STARTED)
                .payload(new LiveChange(online("late night stream"), null))
                .detectedAt(SOME_INSTANT)
                .build();
    }

    public static ChangeEvent newItemEvent(String id) {
        return ChangeEvent.builder()
                .eventId("01HZ3X0000000000000000000" + id)
                .subscriptionName(SOME_NAME)
                .platform(PlatformKind.BILIBILI_SPACE.id())
                .kind(ChangeKind.NEW_ITEM)
                .payload(new NewItem(item(id)))
                .detectedAt(SOME_INSTANT)
                .build();
    }
}
