package com.feedwatch.engine.domain.exceptions;

public class StateStoreException extends RuntimeException {

    private StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public static StateStoreException commitFailed(String key, Throwable cause) {
        return new StateStoreException("Failed to commit snapshot for " + key, cause);
    }

    public static StateStoreException loadFailed(String location, Throwable cause) {
        return new StateStoreException("Failed to load snapshots from " + location, cause);
    }
}
