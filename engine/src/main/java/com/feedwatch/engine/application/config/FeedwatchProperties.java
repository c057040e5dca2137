package com.feedwatch.engine.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.Name;
import org.springframework.validation.annotation.Validated;

/**
 * Raw configuration as written by the operator. Cross references (notify refs, account refs) and
 * secrets are resolved by {@link CatalogFactory}.
 */
@Validated
@ConfigurationProperties(prefix = "feedwatch")
public record FeedwatchProperties(
        @NotNull Duration interval,
        @NotNull @Valid State state,
        Map<String, @Valid Account> accounts,
        @Name("notify") Map<String, @Valid Target> targets,
        Map<String, List<@Valid SubscriptionEntry>> subscriptions,
        @Valid Reporter reporter,
        @NotNull @Valid Platforms platforms,
        @NotNull @Valid Channels channels,
        @NotNull @Valid Scheduler scheduler,
        @NotNull @Valid Http http) {

    public FeedwatchProperties {
        accounts = accounts == null ? Map.of() : accounts;
        targets = targets == null ? Map.of() : targets;
        subscriptions = subscriptions == null ? Map.of() : subscriptions;
        reporter = reporter == null ? new Reporter(null, null) : reporter;
    }

    /** @param directory where snapshots are persisted; state is kept in memory when blank */
    public record State(String directory, @Positive int seenCapacity) {}

    public record Account(@NotBlank String platform, Map<String, String> credentials) {}

    public record Target(@NotBlank String channel, Map<String, String> params, Toggles notifications) {}

    public record Toggles(Boolean liveOnline, Boolean liveTitle, Boolean post, Boolean log) {}

    public record Ref(@NotBlank String ref, Map<String, String> params, Toggles notifications) {}

    public record SubscriptionEntry(@NotNull @Valid PlatformEntry platform, Duration interval, @Name("notify") List<@Valid Ref> refs) {}

    public record PlatformEntry(
            @NotBlank String kind,
            Long userId,
            Long seriesId,
            String handle,
            String account,
            boolean reportOffline,
            boolean reportTitle) {}

    public record Reporter(@Valid LogReporter log, @Valid Heartbeat heartbeat) {}

    public record LogReporter(@Name("notify") List<@Valid Ref> refs) {}

    public record Heartbeat(@NotBlank String url, @NotNull Duration interval) {}

    public record Platforms(@NotNull @Valid Bilibili bilibili, @NotNull @Valid Twitter twitter) {}

    public record Bilibili(@NotBlank String liveApiUrl, @NotBlank String apiUrl) {}

    public record Twitter(
            @NotBlank String apiUrl,
            @NotBlank String bearerToken,
            @NotBlank String userByScreenNameQueryId,
            @NotBlank String userTweetsQueryId) {}

    public record Channels(@NotNull @Valid Telegram telegram, @Valid OneBot qq) {

        public Channels {
            qq = qq == null ? new OneBot(null, null) : qq;
        }
    }

    /** @param token bot token used when a target does not carry its own */
    public record Telegram(@NotBlank String apiUrl, String token) {}

    public record OneBot(String apiUrl, String accessToken) {}

    public record Scheduler(@Positive int timerThreads, @NotNull Duration shutdownGrace) {}

    public record Http(@NotNull Duration connectTimeout, @NotNull Duration readTimeout, @NotBlank String userAgent) {}
}
