package com.feedwatch.engine.domain.exceptions;

public class SnapshotMismatchException extends RuntimeException {

    private SnapshotMismatchException(String message) {
        super(message);
    }

    public static SnapshotMismatchException of(String key, Class<?> expected, Class<?> actual) {
        return new SnapshotMismatchException("Snapshot for " + key + " expected " + expected.getSimpleName()
                + " but got " + actual.getSimpleName());
    }

    public static SnapshotMismatchException malformedItem(String key, int position) {
        return new SnapshotMismatchException("Feed item " + position + " for " + key + " has no identifier");
    }
}
