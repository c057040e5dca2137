package com.feedwatch.engine.infrastructure.platform.twitter;

import java.util.Arrays;

/**
 * Browser session cookies of a logged-in account. The {@code ct0} cookie doubles as the CSRF
 * token every GraphQL request must echo in {@code x-csrf-token}.
 */
public record TwitterCookies(String raw, String ct0) {

    public static final String CREDENTIAL = "cookies";

    public static TwitterCookies parse(String raw) {
        var ct0 = Arrays.stream(raw.split(";"))
                .map(String::trim)
                .filter(cookie -> cookie.startsWith("ct0="))
                .map(cookie -> cookie.substring("ct0=".length()))
                .filter(value -> !value.isEmpty())
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("cookie 'ct0' not found"));
        return new TwitterCookies(raw, ct0);
    }

    @Override
    public String toString() {
        return "TwitterCookies[****]";
    }
}
