package com.feedwatch.engine.infrastructure.platform.twitter;

import com.feedwatch.common.snapshot.Attachment;
import com.feedwatch.common.snapshot.FeedItem;
import com.feedwatch.common.snapshot.FeedState;
import com.feedwatch.common.snapshot.Snapshot;
import com.feedwatch.engine.domain.exceptions.FetchException;
import com.feedwatch.engine.domain.platform.PlatformAdapter;
import com.feedwatch.engine.domain.subscription.PlatformAccount;
import com.feedwatch.engine.domain.subscription.PlatformKind;
import com.feedwatch.engine.domain.subscription.PlatformSpec;
import com.feedwatch.engine.domain.subscription.PlatformSpec.SocialFeedSpec;
import java.math.BigInteger;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Tweets of a user through the web client's GraphQL API. Requires an account whose session
 * cookies are sent with every request. Screen names are resolved to user ids once and cached.
 */
@Slf4j
public class TwitterAdapter implements PlatformAdapter {

    private static final DateTimeFormatter CREATED_AT =
            DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss Z yyyy", Locale.ROOT);

    private static final Map<String, Object> USER_FEATURES = Map.of(
            "hidden_profile_subscriptions_enabled", true,
            "responsive_web_graphql_exclude_directive_enabled", true,
            "verified_phone_label_enabled", false,
            "responsive_web_graphql_skip_user_profile_image_extensions_enabled", false,
            "responsive_web_graphql_timeline_navigation_enabled", true);

    private static final Map<String, Object> TWEET_FEATURES = Map.of(
            "responsive_web_graphql_exclude_directive_enabled", true,
            "verified_phone_label_enabled", false,
            "responsive_web_graphql_timeline_navigation_enabled", true,
            "responsive_web_graphql_skip_user_profile_image_extensions_enabled", false,
            "longform_notetweets_consumption_enabled", true,
            "longform_notetweets_rich_text_read_enabled", true,
            "view_counts_everywhere_api_enabled", true,
            "freedom_of_speech_not_reach_fetch_enabled", true);

    private final RestClient restClient;
    private final ObjectMapper mapper;
    private final String bearerToken;
    private final String userByScreenNameQueryId;
    private final String userTweetsQueryId;
    private final ConcurrentMap<String, String> userIds = new ConcurrentHashMap<>();

    public TwitterAdapter(
            RestClient restClient,
            ObjectMapper mapper,
            String bearerToken,
            String userByScreenNameQueryId,
            String userTweetsQueryId) {
        this.restClient = restClient;
        this.mapper = mapper;
        this.bearerToken = bearerToken;
        this.userByScreenNameQueryId = userByScreenNameQueryId;
        this.userTweetsQueryId = userTweetsQueryId;
    }

    @Override
    public PlatformKind kind() {
        return PlatformKind.TWITTER;
    }

    @Override
    public Snapshot fetch(PlatformSpec spec, Optional<PlatformAccount> account) {
        var handle = ((SocialFeedSpec) spec).handle();
        var cookies = cookies(account.orElseThrow(() -> FetchException.of(kind().id(), "an account is required")));

        var userId = userIds.get(handle);
        if (userId == null) {
            userId = resolveUserId(handle, cookies);
            userIds.put(handle, userId);
        }

        var variables = new LinkedHashMap<String, Object>();
        variables.put("userId", userId);
        variables.put("count", 20);
        variables.put("includePromotedContent", false);
        variables.put("withVoice", true);
        variables.put("withV2Timeline", true);
        var root = query(userTweetsQueryId, "UserTweets", variables, TWEET_FEATURES, cookies);

        var result = root.path("data").path("user").path("result");
        var timeline = result.has("timeline_v2") ? result.path("timeline_v2") : result.path("timeline");
        List<FeedItem> items = new ArrayList<>();
        for (JsonNode instruction : timeline.path("timeline").path("instructions")) {
            switch (instruction.path("type").asText("")) {
                case "TimelinePinEntry" -> collect(instruction.path("entry"), items);
                case "TimelineAddEntries" -> instruction.path("entries").forEach(entry -> collect(entry, items));
                default -> {
                    // cache clears and cursors carry no tweets
                }
            }
        }
        // snowflake ids grow with time; the timeline itself puts the pinned tweet first
        items.sort(Comparator.comparing(item -> new BigInteger(item.id())));
        log.debug("Fetched {} tweets of {}", items.size(), handle);
        return FeedState.of(items);
    }

    private String resolveUserId(String handle, TwitterCookies cookies) {
        var variables = Map.<String, Object>of("screen_name", handle, "withSafetyModeUserFields", true);
        var root = query(userByScreenNameQueryId, "UserByScreenName", variables, USER_FEATURES, cookies);
        var restId = root.path("data").path("user").path("result").path("rest_id").asText("");
        if (restId.isEmpty()) {
            throw FetchException.of(kind().id(), "user '" + handle + "' not found");
        }
        log.info("Resolved twitter handle {} to user id {}", handle, restId);
        return restId;
    }

    private JsonNode query(
            String queryId,
            String operation,
            Map<String, Object> variables,
            Map<String, Object> features,
            TwitterCookies cookies) {
        try {
            var body = restClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/i/api/graphql/{queryId}/{operation}")
                            .queryParam("variables", "{variables}")
                            .queryParam("features", "{features}")
                            .build(Map.of(
                                    "queryId", queryId,
                                    "operation", operation,
                                    "variables", mapper.writeValueAsString(variables),
                                    "features", mapper.writeValueAsString(features))))
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken)
                    .header(HttpHeaders.COOKIE, cookies.raw())
                    .header("x-csrf-token", cookies.ct0())
                    .retrieve()
                    .body(String.class);
            if (body == null || body.isBlank()) {
                throw FetchException.of(kind().id(), operation + " returned an empty response");
            }
            return mapper.readTree(body);
        } catch (RestClientException | JacksonException e) {
            throw FetchException.of(kind().id(), operation + ": " + e.getMessage(), e);
        }
    }

    private void collect(JsonNode entry, List<FeedItem> items) {
        var content = entry.path("content");
        switch (content.path("entryType").asText("")) {
            case "TimelineTimelineItem" -> tweet(content.path("itemContent")).ifPresent(items::add);
            case "TimelineTimelineModule" -> content.path("items")
                    .forEach(item -> tweet(item.path("item").path("itemContent")).ifPresent(items::add));
            default -> {
                // cursors
            }
        }
    }

    private Optional<FeedItem> tweet(JsonNode itemContent) {
        if (!"TimelineTweet".equals(itemContent.path("itemType").asText(""))) {
            return Optional.empty();
        }
        return parse(itemContent.path("tweet_results").path("result"));
    }

    /** Maps a tweet result; retweets and quotes carry the original tweet as the repost. */
    private Optional<FeedItem> parse(JsonNode tweet) {
        if ("TweetWithVisibilityResults".equals(tweet.path("__typename").asText(""))) {
            tweet = tweet.path("tweet");
        }
        var id = tweet.path("rest_id").asText("");
        if (!isSnowflake(id)) {
            if (!id.isEmpty()) {
                log.debug("Skipping tweet with non-numeric id '{}'", id);
            }
            return Optional.empty();
        }
        var user = tweet.path("core").path("user_results").path("result");
        var screenName = user.path("legacy").path("screen_name").asText(user.path("core").path("screen_name").asText(""));
        var name = user.path("legacy").path("name").asText(user.path("core").path("name").asText(screenName));
        var legacy = tweet.path("legacy");
        var retweeted = legacy.path("retweeted_status_result").path("result");
        var reposted = legacy.path("is_quote_status").asBoolean(false)
                ? tweet.path("quoted_status_result").path("result")
                : retweeted;
        return Optional.of(FeedItem.builder()
                .id(id)
                .author(name)
                // a retweet's own text is a truncated "RT @user:" copy of the original
                .content(retweeted.isObject() ? "" : legacy.path("full_text").asText(""))
                .url("https://x.com/" + screenName + "/status/" + id)
                .publishedAt(createdAt(legacy.path("created_at").asText("")))
                .attachments(media(legacy))
                .repostFrom(reposted.isObject() ? parse(reposted).orElse(null) : null)
                .build());
    }

    private static List<Attachment> media(JsonNode legacy) {
        var media = legacy.path("extended_entities").path("media");
        if (media.isEmpty()) {
            media = legacy.path("entities").path("media");
        }
        List<Attachment> attachments = new ArrayList<>();
        for (JsonNode entry : media) {
            var preview = entry.path("media_url_https").asText("");
            switch (entry.path("type").asText("")) {
                case "video", "animated_gif" -> bestVariant(entry.path("video_info").path("variants"))
                        .map(Attachment::video)
                        .or(() -> Optional.of(preview).filter(url -> !url.isEmpty()).map(Attachment::image))
                        .ifPresent(attachments::add);
                default -> {
                    if (!preview.isEmpty()) {
                        attachments.add(Attachment.image(preview));
                    }
                }
            }
        }
        return attachments;
    }

    private static Optional<String> bestVariant(JsonNode variants) {
        JsonNode best = null;
        for (JsonNode variant : variants) {
            if (!"video/mp4".equals(variant.path("content_type").asText(""))) {
                continue;
            }
            if (best == null || variant.path("bitrate").asLong(0) > best.path("bitrate").asLong(0)) {
                best = variant;
            }
        }
        return Optional.ofNullable(best).map(variant -> variant.path("url").asText("")).filter(url -> !url.isEmpty());
    }

    private TwitterCookies cookies(PlatformAccount account) {
        var raw = account.credential(TwitterCookies.CREDENTIAL)
                .orElseThrow(() -> FetchException.missingCredential(account.name(), TwitterCookies.CREDENTIAL));
        try {
            return TwitterCookies.parse(raw);
        } catch (IllegalArgumentException e) {
            throw FetchException.of(kind().id(), "account " + account.name() + ": " + e.getMessage());
        }
    }

    private static boolean isSnowflake(String id) {
        return !id.isEmpty() && id.chars().allMatch(ch -> ch >= '0' && ch <= '9');
    }

    private static Instant createdAt(String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value, CREATED_AT).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable tweet timestamp '{}'", value);
            return null;
        }
    }
}
