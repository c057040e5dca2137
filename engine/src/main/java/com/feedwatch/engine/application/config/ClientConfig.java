package com.feedwatch.engine.application.config;

import com.feedwatch.engine.infrastructure.channel.onebot.OneBotChannel;
import com.feedwatch.engine.infrastructure.channel.telegram.TelegramChannel;
import com.feedwatch.engine.infrastructure.heartbeat.HeartbeatClient;
import com.feedwatch.engine.infrastructure.platform.bilibili.BilibiliLiveAdapter;
import com.feedwatch.engine.infrastructure.platform.bilibili.BilibiliSpaceAdapter;
import com.feedwatch.engine.infrastructure.platform.bilibili.BilibiliVideoSeriesAdapter;
import com.feedwatch.engine.infrastructure.platform.twitter.TwitterAdapter;
import java.net.URI;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.json.JsonMapper;

/** One {@link RestClient} per remote API, all sharing the timeouts and user agent from {@code feedwatch.http}. */
@Configuration
public class ClientConfig {

    @Bean
    public BilibiliLiveAdapter bilibiliLiveAdapter(FeedwatchProperties properties, JsonMapper mapper) {
        return new BilibiliLiveAdapter(
                restClient(properties, properties.platforms().bilibili().liveApiUrl()), mapper);
    }

    @Bean
    public BilibiliSpaceAdapter bilibiliSpaceAdapter(FeedwatchProperties properties, JsonMapper mapper) {
        return new BilibiliSpaceAdapter(restClient(properties, properties.platforms().bilibili().apiUrl()), mapper);
    }

    @Bean
    public BilibiliVideoSeriesAdapter bilibiliVideoSeriesAdapter(FeedwatchProperties properties, JsonMapper mapper) {
        return new BilibiliVideoSeriesAdapter(
                restClient(properties, properties.platforms().bilibili().apiUrl()), mapper);
    }

    @Bean
    public TwitterAdapter twitterAdapter(FeedwatchProperties properties, JsonMapper mapper) {
        var twitter = properties.platforms().twitter();
        return new TwitterAdapter(
                restClient(properties, twitter.apiUrl()),
                mapper,
                twitter.bearerToken(),
                twitter.userByScreenNameQueryId(),
                twitter.userTweetsQueryId());
    }

    @Bean
    public TelegramChannel telegramChannel(FeedwatchProperties properties, JsonMapper mapper) {
        var telegram = properties.channels().telegram();
        return new TelegramChannel(restClient(properties, telegram.apiUrl()), mapper, telegram.token());
    }

    @Bean
    @ConditionalOnProperty(prefix = "feedwatch.channels.qq", name = "api-url")
    public OneBotChannel oneBotChannel(FeedwatchProperties properties, JsonMapper mapper) {
        var qq = properties.channels().qq();
        return new OneBotChannel(restClient(properties, qq.apiUrl()), mapper, qq.accessToken());
    }

    @Bean
    @ConditionalOnProperty(prefix = "feedwatch.reporter.heartbeat", name = "url")
    public HeartbeatClient heartbeatClient(FeedwatchProperties properties) {
        var url = URI.create(properties.reporter().heartbeat().url());
        return new HeartbeatClient(restClient(properties, null), url);
    }

    private static RestClient restClient(FeedwatchProperties properties, String baseUrl) {
        var http = properties.http();
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(http.connectTimeout());
        requestFactory.setReadTimeout(http.readTimeout());
        var builder = RestClient.builder()
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, http.userAgent());
        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }
}
