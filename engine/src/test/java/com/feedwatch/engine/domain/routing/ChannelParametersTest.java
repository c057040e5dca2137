package com.feedwatch.engine.domain.routing;

import com.feedwatch.engine.domain.exceptions.DeliveryException;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelParametersTest {

    @Test
    void shouldOverrideOnlyGivenKeys() {
        var base = ChannelParameters.of(Map.of("id", "X", "thread_id", "114"));

        var merged = base.merge(Map.of("thread_id", "514"));

        assertThat(merged.asMap()).containsExactlyInAnyOrderEntriesOf(Map.of("id", "X", "thread_id", "514"));
        assertThat(base.asMap()).containsEntry("thread_id", "114");
    }

    @Test
    void shouldAddKeysMissingFromBase() {
        var merged = ChannelParameters.of(Map.of("id", "X")).merge(Map.of("thread_id", "7"));

        assertThat(merged.asMap()).containsEntry("id", "X").containsEntry("thread_id", "7");
    }

    @Test
    void shouldTreatBlankValueAsAbsent() {
        var parameters = ChannelParameters.of(Map.of("chat-id", " "));

        assertThat(parameters.get("chat-id")).isEmpty();
        assertThatThrownBy(() -> parameters.require("chat-id", ChannelKind.TELEGRAM))
                .isInstanceOf(DeliveryException.class)
                .hasMessageContaining("chat-id");
    }

    @Test
    void shouldMaskSecretsInToString() {
        var parameters = ChannelParameters.of(Map.of("chat-id", "42", "token", "123:abc"));

        assertThat(parameters.toString()).contains("chat-id=42").contains("token=****").doesNotContain("123:abc");
    }
}
