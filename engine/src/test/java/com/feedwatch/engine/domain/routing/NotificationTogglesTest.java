package com.feedwatch.engine.domain.routing;

import com.feedwatch.common.event.ChangeKind;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationTogglesTest {

    @Test
    void defaultsSkipTitleChangesOnly() {
        var toggles = NotificationToggles.DEFAULTS;

        assertThat(toggles.allows(ChangeKind.LIVE_STARTED)).isTrue();
        assertThat(toggles.allows(ChangeKind.LIVE_ENDED)).isTrue();
        assertThat(toggles.allows(ChangeKind.LIVE_TITLE_CHANGED)).isFalse();
        assertThat(toggles.allows(ChangeKind.NEW_ITEM)).isTrue();
        assertThat(toggles.allows(ChangeKind.LOG)).isTrue();
    }

    @Test
    void overridesReplaceOnlyGivenToggles() {
        var toggles = NotificationToggles.DEFAULTS.apply(new ToggleOverrides(null, true, false, null));

        assertThat(toggles).isEqualTo(new NotificationToggles(true, true, false, true));
    }

    @Test
    void targetResolutionLeavesTargetUntouched() {
        var target = new NotifyTarget("meow", ChannelKind.TELEGRAM,
                ChannelParameters.of(Map.of("chat-id", "1")), NotificationToggles.DEFAULTS);
        var ref = new NotifyRef("meow", Map.of("chat-id", "2"), new ToggleOverrides(false, null, null, null));

        var resolved = target.resolve(ref);

        assertThat(resolved.parameters().get("chat-id")).contains("2");
        assertThat(resolved.notifications().liveOnline()).isFalse();
        assertThat(target.parameters().get("chat-id")).contains("1");
        assertThat(target.notifications().liveOnline()).isTrue();
    }
}
