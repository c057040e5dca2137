package com.feedwatch.engine.domain.platform;

import com.feedwatch.engine.domain.subscription.PlatformKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class PlatformAdapterRegistry {

    private final Map<PlatformKind, PlatformAdapter> adapters = new EnumMap<>(PlatformKind.class);

    public PlatformAdapterRegistry(List<PlatformAdapter> adapters) {
        for (PlatformAdapter adapter : adapters) {
            var previous = this.adapters.put(adapter.kind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for " + adapter.kind().id());
            }
        }
    }

    public PlatformAdapter require(PlatformKind kind) {
        var adapter = adapters.get(kind);
        if (adapter == null) {
            throw new IllegalStateException("No adapter registered for " + kind.id());
        }
        return adapter;
    }

    public Set<PlatformKind> supported() {
        return adapters.keySet();
    }
}
