package com.feedwatch.engine.application.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;

/**
 * Replaces {@code <name>-env: VARIABLE} entries by {@code <name>: <value of VARIABLE>} so secrets
 * can stay out of the configuration file.
 */
@RequiredArgsConstructor
class SecretResolver {

    static final String ENV_SUFFIX = "-env";

    private final UnaryOperator<String> lookup;

    Map<String, String> resolve(Map<String, String> raw, String where, List<String> problems) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        var resolved = new LinkedHashMap<String, String>();
        raw.forEach((key, value) -> {
            if (!key.endsWith(ENV_SUFFIX)) {
                resolved.putIfAbsent(key, value);
                return;
            }
            var name = key.substring(0, key.length() - ENV_SUFFIX.length());
            if (raw.containsKey(name)) {
                problems.add(where + ": both '" + name + "' and '" + key + "' are set");
                return;
            }
            var secret = lookup.apply(value);
            if (secret == null || secret.isBlank()) {
                problems.add(where + ": environment variable '" + value + "' for '" + name + "' is not set");
                return;
            }
            resolved.put(name, secret);
        });
        return resolved;
    }
}
