package com.feedwatch.engine.domain.detection;

import com.feedwatch.common.snapshot.FeedItem;
import com.feedwatch.common.snapshot.FeedState;
import com.feedwatch.engine.domain.exceptions.SnapshotMismatchException;
import java.util.List;
import org.junit.jupiter.api.Test;

import static com.feedwatch.engine.fixtures.FeedwatchFixtures.feed;
import static com.feedwatch.engine.fixtures.FeedwatchFixtures.item;
import static com.feedwatch.engine.fixtures.FeedwatchFixtures.liveSubscription;
import static com.feedwatch.engine.fixtures.FeedwatchFixtures.online;
import static com.feedwatch.engine.fixtures.FeedwatchFixtures.postSubscription;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotMismatchTest extends ChangeDetectionEngineBaseTest {

    @Test
    void shouldRejectFeedForLiveSubscription() {
        assertThatThrownBy(() -> engine.detect(liveSubscription(), null, feed("1")))
                .isInstanceOf(SnapshotMismatchException.class)
                .hasMessageContaining("LiveStatus");
    }

    @Test
    void shouldRejectStoredSnapshotOfOtherType() {
        assertThatThrownBy(() -> engine.detect(postSubscription(), online("t"), feed("1")))
                .isInstanceOf(SnapshotMismatchException.class)
                .hasMessageContaining("FeedState");
    }

    @Test
    void shouldRejectItemWithoutIdentifier() {
        var fetched = FeedState.of(List.of(item("1"), FeedItem.builder().id(" ").content("x").build()));

        assertThatThrownBy(() -> engine.detect(postSubscription(), feed("1"), fetched))
                .isInstanceOf(SnapshotMismatchException.class)
                .hasMessageContaining("item 1");
    }
}
