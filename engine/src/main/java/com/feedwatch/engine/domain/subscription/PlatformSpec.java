package com.feedwatch.engine.domain.subscription;

/** What to watch on a platform. The platform kind is implied by the variant. */
public sealed interface PlatformSpec {

    PlatformKind kind();

    /** Stable description used in subscription keys, for example {@code bilibili.live:12345}. */
    String describe();

    record LiveStatusSpec(long userId, boolean reportOffline, boolean reportTitle) implements PlatformSpec {

        @Override
        public PlatformKind kind() {
            return PlatformKind.BILIBILI_LIVE;
        }

        @Override
        public String describe() {
            return kind().id() + ":" + userId;
        }
    }

    record PostFeedSpec(long userId) implements PlatformSpec {

        @Override
        public PlatformKind kind() {
            return PlatformKind.BILIBILI_SPACE;
        }

        @Override
        public String describe() {
            return kind().id() + ":" + userId;
        }
    }

    /** Videos of one series (a collection curated by the uploader). */
    record VideoSeriesSpec(long userId, long seriesId) implements PlatformSpec {

        @Override
        public PlatformKind kind() {
            return PlatformKind.BILIBILI_VIDEO;
        }

        @Override
        public String describe() {
            return kind().id() + ":" + userId + ",series" + seriesId;
        }
    }

    record SocialFeedSpec(String handle) implements PlatformSpec {

        @Override
        public PlatformKind kind() {
            return PlatformKind.TWITTER;
        }

        @Override
        public String describe() {
            return kind().id() + ":" + handle;
        }
    }
}
