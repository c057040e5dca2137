package com.feedwatch.common.snapshot;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeenMarkersTest {

    @Test
    void shouldRememberIdsInInsertionOrder() {
        var markers = SeenMarkers.empty().remember(List.of("1", "2", "3"), 10);

        assertThat(markers.ids()).containsExactly("1", "2", "3");
        assertThat(markers.contains("2")).isTrue();
        assertThat(markers.contains("4")).isFalse();
    }

    @Test
    void shouldEvictOldestFirstWhenOverCapacity() {
        var markers = SeenMarkers.of(List.of("1", "2", "3")).remember(List.of("4", "5"), 4);

        assertThat(markers.ids()).containsExactly("2", "3", "4", "5");
    }

    @Test
    void shouldRefreshVisibleIdsSoTheyAreNotEvicted() {
        var markers = SeenMarkers.of(List.of("1", "2", "3")).remember(List.of("1", "4"), 3);

        assertThat(markers.ids()).containsExactly("3", "1", "4");
    }

    @Test
    void shouldKeepEveryVisibleIdWhenMoreAreVisibleThanCapacity() {
        var markers = SeenMarkers.of(List.of("0", "1")).remember(List.of("1", "2", "3"), 2);

        assertThat(markers.ids()).containsExactly("1", "2", "3");
    }

    @Test
    void shouldNotMutateOriginal() {
        var original = SeenMarkers.of(List.of("a"));

        original.remember(List.of("b"), 5);

        assertThat(original.ids()).containsExactly("a");
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> SeenMarkers.empty().remember(List.of("1"), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
