package com.feedwatch.engine.application.config;

import com.feedwatch.engine.application.config.FeedwatchProperties.PlatformEntry;
import com.feedwatch.engine.application.config.FeedwatchProperties.Ref;
import com.feedwatch.engine.application.config.FeedwatchProperties.SubscriptionEntry;
import com.feedwatch.engine.application.config.FeedwatchProperties.Target;
import com.feedwatch.engine.application.config.FeedwatchProperties.Toggles;
import com.feedwatch.engine.domain.exceptions.ConfigurationException;
import com.feedwatch.engine.domain.routing.ChannelKind;
import com.feedwatch.engine.domain.routing.ChannelParameters;
import com.feedwatch.engine.domain.routing.NotificationToggles;
import com.feedwatch.engine.domain.routing.NotifyRef;
import com.feedwatch.engine.domain.routing.NotifyTarget;
import com.feedwatch.engine.domain.routing.NotifyTargetCatalog;
import com.feedwatch.engine.domain.routing.ToggleOverrides;
import com.feedwatch.engine.domain.subscription.PlatformAccount;
import com.feedwatch.engine.domain.subscription.PlatformKind;
import com.feedwatch.engine.domain.subscription.PlatformSpec;
import com.feedwatch.engine.domain.subscription.PlatformSpec.LiveStatusSpec;
import com.feedwatch.engine.domain.subscription.PlatformSpec.PostFeedSpec;
import com.feedwatch.engine.domain.subscription.PlatformSpec.SocialFeedSpec;
import com.feedwatch.engine.domain.subscription.PlatformSpec.VideoSeriesSpec;
import com.feedwatch.engine.domain.subscription.Subscription;
import com.feedwatch.engine.domain.subscription.SubscriptionCatalog;
import com.feedwatch.engine.infrastructure.platform.twitter.TwitterCookies;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns {@link FeedwatchProperties} into a {@link Catalog}. Every problem found is collected and
 * reported at once through a single {@link ConfigurationException}.
 */
@Slf4j
public class CatalogFactory {

    private final FeedwatchProperties properties;
    private final SecretResolver secrets;

    public CatalogFactory(FeedwatchProperties properties, UnaryOperator<String> environment) {
        this.properties = properties;
        this.secrets = new SecretResolver(environment);
    }

    public Catalog create() {
        List<String> problems = new ArrayList<>();
        checkPositive(properties.interval(), "feedwatch.interval", problems);

        var accounts = accounts(problems);
        var targets = new NotifyTargetCatalog(targets(problems));
        var subscriptions = subscriptions(accounts, targets, problems);
        var logRefs = logRefs(targets, problems);
        checkHeartbeat(problems);

        if (!problems.isEmpty()) {
            throw ConfigurationException.of(problems);
        }
        log.info("Loaded {} subscriptions, {} notify targets, {} accounts",
                subscriptions.size(), targets.targets().size(), accounts.size());
        return new Catalog(new SubscriptionCatalog(subscriptions, properties.interval()), targets, logRefs);
    }

    private Map<String, PlatformAccount> accounts(List<String> problems) {
        var accounts = new LinkedHashMap<String, PlatformAccount>();
        properties.accounts().forEach((name, account) -> {
            var where = "account '" + name + "'";
            platformKind(account.platform(), where, problems).ifPresent(kind -> {
                var credentials = secrets.resolve(account.credentials(), where, problems);
                if (kind == PlatformKind.TWITTER) {
                    checkTwitterCookies(credentials, where, problems);
                }
                accounts.put(name, new PlatformAccount(name, kind, credentials));
            });
        });
        return accounts;
    }

    private void checkTwitterCookies(Map<String, String> credentials, String where, List<String> problems) {
        var cookies = credentials.get(TwitterCookies.CREDENTIAL);
        if (cookies == null) {
            problems.add(where + ": credential '" + TwitterCookies.CREDENTIAL + "' is missing");
            return;
        }
        try {
            TwitterCookies.parse(cookies);
        } catch (IllegalArgumentException e) {
            problems.add(where + ": " + e.getMessage());
        }
    }

    private Map<String, NotifyTarget> targets(List<String> problems) {
        var targets = new LinkedHashMap<String, NotifyTarget>();
        properties.targets().forEach((name, target) -> {
            var where = "notify '" + name + "'";
            channelKind(target, where, problems).ifPresent(channel -> targets.put(name, new NotifyTarget(
                    name,
                    channel,
                    ChannelParameters.of(secrets.resolve(target.params(), where, problems)),
                    NotificationToggles.DEFAULTS.apply(toggles(target.notifications())))));
        });
        return targets;
    }

    private List<Subscription> subscriptions(
            Map<String, PlatformAccount> accounts, NotifyTargetCatalog targets, List<String> problems) {
        List<Subscription> subscriptions = new ArrayList<>();
        var keys = new HashSet<String>();
        properties.subscriptions().forEach((name, entries) -> {
            for (int i = 0; i < entries.size(); i++) {
                var entry = entries.get(i);
                var where = "subscription '" + name + "'[" + i + "]";
                subscription(name, entry, accounts, targets, where, problems).ifPresent(subscription -> {
                    if (!keys.add(subscription.key())) {
                        problems.add(where + ": duplicate subscription " + subscription.key());
                    }
                    if (subscription.notifyRefs().isEmpty()) {
                        log.warn("Subscription {} notifies nobody", subscription.key());
                    }
                    subscriptions.add(subscription);
                });
            }
        });
        return subscriptions;
    }

    private Optional<Subscription> subscription(
            String name,
            SubscriptionEntry entry,
            Map<String, PlatformAccount> accounts,
            NotifyTargetCatalog targets,
            String where,
            List<String> problems) {
        if (entry.interval() != null) {
            checkPositive(entry.interval(), where + ".interval", problems);
        }
        var refs = refs(entry.refs(), targets, where, problems);
        var platform = entry.platform();
        return platformKind(platform.kind(), where, problems)
                .flatMap(kind -> platformSpec(kind, platform, where, problems))
                .map(spec -> Subscription.builder()
                        .name(name)
                        .platform(spec)
                        .interval(entry.interval())
                        .account(account(spec.kind(), platform.account(), accounts, where, problems))
                        .notifyRefs(refs)
                        .build());
    }

    private Optional<PlatformSpec> platformSpec(
            PlatformKind kind, PlatformEntry entry, String where, List<String> problems) {
        switch (kind) {
            case BILIBILI_LIVE:
            case BILIBILI_SPACE:
                if (entry.userId() == null || entry.userId() <= 0) {
                    problems.add(where + ": " + kind.id() + " requires a positive 'user-id'");
                    return Optional.empty();
                }
                return Optional.of(kind == PlatformKind.BILIBILI_LIVE
                        ? new LiveStatusSpec(entry.userId(), entry.reportOffline(), entry.reportTitle())
                        : new PostFeedSpec(entry.userId()));
            case BILIBILI_VIDEO:
                return videoSeries(entry, where, problems);
            case TWITTER:
                if (entry.handle() == null || entry.handle().isBlank()) {
                    problems.add(where + ": twitter requires a 'handle'");
                    return Optional.empty();
                }
                if (entry.account() == null) {
                    problems.add(where + ": twitter requires an 'account'");
                }
                return Optional.of(new SocialFeedSpec(entry.handle()));
            default:
                throw new IllegalStateException("Unhandled platform " + kind);
        }
    }

    private static Optional<PlatformSpec> videoSeries(PlatformEntry entry, String where, List<String> problems) {
        boolean valid = true;
        if (entry.userId() == null || entry.userId() <= 0) {
            problems.add(where + ": bilibili.video requires a positive 'user-id'");
            valid = false;
        }
        if (entry.seriesId() == null || entry.seriesId() <= 0) {
            problems.add(where + ": bilibili.video requires a positive 'series-id'");
            valid = false;
        }
        return valid ? Optional.of(new VideoSeriesSpec(entry.userId(), entry.seriesId())) : Optional.empty();
    }

    private PlatformAccount account(
            PlatformKind kind, String name, Map<String, PlatformAccount> accounts, String where, List<String> problems) {
        if (name == null) {
            return null;
        }
        var account = accounts.get(name);
        if (account == null) {
            if (!properties.accounts().containsKey(name)) {
                problems.add(where + ": account '" + name + "' is not defined");
            }
            return null;
        }
        if (account.platform() != kind) {
            problems.add(where + ": account '" + name + "' belongs to " + account.platform().id()
                    + ", not " + kind.id());
            return null;
        }
        return account;
    }

    private List<NotifyRef> logRefs(NotifyTargetCatalog targets, List<String> problems) {
        var log = properties.reporter().log();
        if (log == null) {
            return List.of();
        }
        return refs(log.refs(), targets, "reporter.log", problems);
    }

    private List<NotifyRef> refs(List<Ref> raw, NotifyTargetCatalog targets, String where, List<String> problems) {
        if (raw == null) {
            return List.of();
        }
        List<NotifyRef> refs = new ArrayList<>();
        for (Ref ref : raw) {
            var refWhere = where + " -> notify '" + ref.ref() + "'";
            var target = targets.find(ref.ref());
            if (target.isEmpty()) {
                if (!properties.targets().containsKey(ref.ref())) {
                    problems.add(where + ": notify target '" + ref.ref() + "' is not defined");
                }
                continue;
            }
            var notifyRef = new NotifyRef(
                    ref.ref(), secrets.resolve(ref.params(), refWhere, problems), toggles(ref.notifications()));
            checkChannelParameters(target.get().resolve(notifyRef), refWhere, problems);
            refs.add(notifyRef);
        }
        return refs;
    }

    private void checkChannelParameters(NotifyTarget target, String where, List<String> problems) {
        var parameters = target.parameters();
        switch (target.channel()) {
            case TELEGRAM:
                if (parameters.get("chat-id").isEmpty()) {
                    problems.add(where + ": telegram requires 'chat-id'");
                }
                if (parameters.get("token").isEmpty() && isBlank(properties.channels().telegram().token())) {
                    problems.add(where + ": both the global telegram token and the target token are missing");
                }
                break;
            case ONEBOT:
                if (parameters.get("group-id").isEmpty() == parameters.get("user-id").isEmpty()) {
                    problems.add(where + ": qq requires exactly one of 'group-id' and 'user-id'");
                }
                if (isBlank(properties.channels().qq().apiUrl())) {
                    problems.add(where + ": qq requires feedwatch.channels.qq.api-url");
                }
                break;
            default:
                throw new IllegalStateException("Unhandled channel " + target.channel());
        }
    }

    private void checkHeartbeat(List<String> problems) {
        var heartbeat = properties.reporter().heartbeat();
        if (heartbeat == null) {
            return;
        }
        checkPositive(heartbeat.interval(), "reporter.heartbeat.interval", problems);
        try {
            var uri = new URI(heartbeat.url());
            if (!"http".equals(uri.getScheme()) && !"https".equals(uri.getScheme())) {
                problems.add("reporter.heartbeat.url: expected an http(s) url but got '" + heartbeat.url() + "'");
            }
        } catch (URISyntaxException e) {
            problems.add("reporter.heartbeat.url: " + e.getMessage());
        }
    }

    private static Optional<PlatformKind> platformKind(String id, String where, List<String> problems) {
        var kind = PlatformKind.fromId(id);
        if (kind.isEmpty()) {
            problems.add(where + ": unknown platform '" + id + "'");
        }
        return kind;
    }

    private static Optional<ChannelKind> channelKind(Target target, String where, List<String> problems) {
        var kind = ChannelKind.fromId(target.channel());
        if (kind.isEmpty()) {
            problems.add(where + ": unknown channel '" + target.channel() + "'");
        }
        return kind;
    }

    private static ToggleOverrides toggles(Toggles toggles) {
        return toggles == null
                ? ToggleOverrides.NONE
                : new ToggleOverrides(toggles.liveOnline(), toggles.liveTitle(), toggles.post(), toggles.log());
    }

    private static void checkPositive(Duration duration, String where, List<String> problems) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            problems.add(where + ": interval must be positive but was " + duration);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
