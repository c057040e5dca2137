package com.feedwatch.engine;

import com.feedwatch.engine.application.config.Catalog;
import com.feedwatch.engine.domain.platform.PlatformAdapterRegistry;
import com.feedwatch.engine.domain.routing.ChannelKind;
import com.feedwatch.engine.domain.state.InMemorySnapshotStore;
import com.feedwatch.engine.domain.state.SnapshotStore;
import com.feedwatch.engine.domain.subscription.PlatformKind;
import com.feedwatch.engine.infrastructure.channel.onebot.OneBotChannel;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
            "feedwatch.channels.telegram.token=111:global",
            "feedwatch.notify.ops.channel=telegram",
            "feedwatch.notify.ops.params.chat-id=-100"
        })
class FeedwatchApplicationTest {

    @Autowired
    ApplicationContext context;

    @Autowired
    Catalog catalog;

    @Autowired
    PlatformAdapterRegistry adapters;

    @Autowired
    MeterRegistry meterRegistry;

    @Test
    void shouldWireEngineFromConfiguration() {
        assertThat(adapters.supported()).containsExactlyInAnyOrder(PlatformKind.values());
        assertThat(catalog.targets().require("ops").channel()).isEqualTo(ChannelKind.TELEGRAM);
        assertThat(catalog.logRefs()).isEmpty();
        assertThat(catalog.subscriptions().subscriptions()).isEmpty();
        assertThat(context.getBean(SnapshotStore.class)).isInstanceOf(InMemorySnapshotStore.class);
        assertThat(context.getBeansOfType(OneBotChannel.class)).isEmpty();
        assertThat(meterRegistry.get("feedwatch.subscriptions").gauge().value()).isZero();
    }

    @TestConfiguration
    static class MetricsTestConfig {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }
}
