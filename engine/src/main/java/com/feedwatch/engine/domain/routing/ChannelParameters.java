package com.feedwatch.engine.domain.routing;

import com.feedwatch.engine.domain.exceptions.DeliveryException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;

/** Flat key/value configuration of a notification target. Values of secret keys never appear in {@link #toString()}. */
@EqualsAndHashCode
public final class ChannelParameters {

    private static final ChannelParameters EMPTY = new ChannelParameters(Map.of());

    private final Map<String, String> values;

    private ChannelParameters(Map<String, String> values) {
        this.values = values;
    }

    public static ChannelParameters empty() {
        return EMPTY;
    }

    public static ChannelParameters of(Map<String, String> values) {
        return values == null || values.isEmpty() ? EMPTY : new ChannelParameters(Map.copyOf(values));
    }

    /**
     * Shallow merge: every key present in {@code overrides} replaces the base value, every other
     * base key is kept as is.
     */
    public ChannelParameters merge(Map<String, String> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        var merged = new LinkedHashMap<>(values);
        merged.putAll(overrides);
        return new ChannelParameters(Map.copyOf(merged));
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key)).filter(value -> !value.isBlank());
    }

    public String require(String key, ChannelKind channel) {
        return get(key).orElseThrow(() -> DeliveryException.missingParameter(channel.id(), key));
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(entry -> entry.getKey() + "=" + (isSecret(entry.getKey()) ? "****" : entry.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private static boolean isSecret(String key) {
        return key.contains("token") || key.contains("secret");
    }
}
