package com.feedwatch.engine.domain.state;

import com.feedwatch.common.snapshot.Snapshot;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemorySnapshotStore implements SnapshotStore {

    private final ConcurrentMap<String, Snapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<Snapshot> get(String key) {
        return Optional.ofNullable(snapshots.get(key));
    }

    @Override
    public void commit(String key, Snapshot snapshot) {
        snapshots.put(key, snapshot);
    }
}
