package com.feedwatch.engine.domain.state;

import com.feedwatch.common.snapshot.Snapshot;
import java.util.Optional;

/**
 * Last committed snapshot per subscription key. A commit either fully replaces the stored snapshot
 * or leaves it untouched.
 */
public interface SnapshotStore {

    Optional<Snapshot> get(String key);

    /** @throws com.feedwatch.engine.domain.exceptions.StateStoreException when the commit was not applied */
    void commit(String key, Snapshot snapshot);
}
