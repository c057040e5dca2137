package com.feedwatch.engine.domain.exceptions;

/** A platform could not produce a snapshot. The cycle is skipped and prior state kept. */
public class FetchException extends RuntimeException {

    private FetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public static FetchException of(String platform, String reason) {
        return new FetchException("Fetch from " + platform + " failed: " + reason, null);
    }

    public static FetchException of(String platform, String reason, Throwable cause) {
        return new FetchException("Fetch from " + platform + " failed: " + reason, cause);
    }

    public static FetchException missingCredential(String account, String credential) {
        return new FetchException("Account " + account + " has no credential '" + credential + "'", null);
    }
}
