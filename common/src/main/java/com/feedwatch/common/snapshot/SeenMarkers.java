package com.feedwatch.common.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Insertion-ordered, size-capped set of feed item identifiers that have already been reported.
 * Instances are immutable; {@link #remember(Collection, int)} returns a new set.
 */
@ToString
@EqualsAndHashCode
public final class SeenMarkers {

    private static final SeenMarkers EMPTY = new SeenMarkers(new LinkedHashSet<>());

    private final Set<String> ids;

    private SeenMarkers(LinkedHashSet<String> ids) {
        this.ids = Collections.unmodifiableSet(ids);
    }

    public static SeenMarkers empty() {
        return EMPTY;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SeenMarkers of(Collection<String> ids) {
        return ids == null || ids.isEmpty() ? EMPTY : new SeenMarkers(new LinkedHashSet<>(ids));
    }

    @JsonValue
    public List<String> ids() {
        return List.copyOf(ids);
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    public int size() {
        return ids.size();
    }

    /**
     * Returns markers holding these ids plus {@code visible}, where every visible id counts as the
     * most recently seen. The oldest ids are evicted until at most {@code capacity} remain, but a
     * visible id is never evicted: when more ids are visible than {@code capacity}, all of them
     * are kept.
     */
    public SeenMarkers remember(Collection<String> visible, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        var refreshed = new LinkedHashSet<>(visible);
        var next = new LinkedHashSet<>(ids);
        next.removeAll(refreshed);
        next.addAll(refreshed);
        Iterator<String> oldest = next.iterator();
        int excess = next.size() - Math.max(capacity, refreshed.size());
        while (excess-- > 0) {
            oldest.next();
            oldest.remove();
        }
        return new SeenMarkers(next);
    }
}
