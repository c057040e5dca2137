package com.feedwatch.engine.domain.platform;

import com.feedwatch.common.snapshot.Snapshot;
import com.feedwatch.engine.domain.subscription.PlatformAccount;
import com.feedwatch.engine.domain.subscription.PlatformKind;
import com.feedwatch.engine.domain.subscription.PlatformSpec;
import java.util.Optional;

/**
 * Port to an update source. Adapters keep no per-subscription state and may be called
 * concurrently; calls sharing an account are serialised by {@link AccountPermits}.
 */
public interface PlatformAdapter {

    PlatformKind kind();

    /**
     * Fetches the current state. Feed snapshots list items oldest-first.
     *
     * @throws com.feedwatch.engine.domain.exceptions.FetchException when no snapshot can be produced
     */
    Snapshot fetch(PlatformSpec spec, Optional<PlatformAccount> account);
}
