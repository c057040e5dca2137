package com.feedwatch.engine.application.config;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import static org.assertj.core.api.Assertions.assertThat;

class FeedwatchPropertiesBindingTest {

    @Test
    void shouldBindNotifyKeysAtEveryLevel() {
        var source = new MapConfigurationPropertySource(Map.of(
                "feedwatch.notify.meow.channel", "telegram",
                "feedwatch.notify.meow.params.chat-id", "-100",
                "feedwatch.subscriptions.meow[0].platform.kind", "bilibili.live",
                "feedwatch.subscriptions.meow[0].platform.user-id", "42",
                "feedwatch.subscriptions.meow[0].notify[0].ref", "meow",
                "feedwatch.subscriptions.meow[0].notify[1].ref", "meow",
                "feedwatch.subscriptions.meow[0].notify[1].params.thread-id", "514",
                "feedwatch.reporter.log.notify[0].ref", "meow"));

        var properties = new Binder(source).bind("feedwatch", FeedwatchProperties.class).get();

        assertThat(properties.targets()).containsOnlyKeys("meow");
        assertThat(properties.targets().get("meow").channel()).isEqualTo("telegram");
        var entry = properties.subscriptions().get("meow").get(0);
        assertThat(entry.platform().userId()).isEqualTo(42L);
        assertThat(entry.refs()).extracting(FeedwatchProperties.Ref::ref).containsExactly("meow", "meow");
        assertThat(entry.refs().get(1).params()).containsEntry("thread-id", "514");
        assertThat(properties.reporter().log().refs()).extracting(FeedwatchProperties.Ref::ref).containsExactly("meow");
    }
}
