package com.feedwatch.common.id;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EventIdGeneratorTest {

    private static final Instant SOME_INSTANT = Instant.ofEpochMilli(1_700_000_000_007L);

    @Test
    void shouldGenerateCrockfordBase32Ulid() {
        String id = EventIdGenerator.next();

        assertThat(id).hasSize(26).matches("^[0-9A-HJKMNP-TV-Z]{26}$");
    }

    @Test
    void shouldEncodeTimestampInFirstTenCharacters() {
        var clock = new SteppingClock(SOME_INSTANT);
        var generator = new EventIdGenerator(clock);

        String first = generator.generate();
        clock.advance(Duration.ofMillis(1));
        String second = generator.generate();

        assertThat(first.substring(0, 10)).isEqualTo("01HF7YAT07");
        assertThat(first.substring(0, 10)).isLessThan(second.substring(0, 10));
    }

    @Test
    void shouldStayMonotonicWithinSameMillisecond() {
        var generator = new EventIdGenerator(Clock.fixed(SOME_INSTANT, ZoneOffset.UTC));
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            ids.add(generator.generate());
        }

        assertThat(new HashSet<>(ids)).hasSize(500);
        assertThat(ids).isSorted();
        assertThat(ids).allSatisfy(id -> assertThat(id).startsWith("01HF7YAT07"));
    }

    @Test
    void shouldNotGoBackwardsWhenClockDoes() {
        var clock = new SteppingClock(SOME_INSTANT);
        var generator = new EventIdGenerator(clock);

        String first = generator.generate();
        clock.advance(Duration.ofMinutes(-1));
        String second = generator.generate();

        assertThat(second).isGreaterThan(first);
        assertThat(second.substring(0, 10)).isEqualTo(first.substring(0, 10));
    }

    @Test
    void shouldKeepSeparateGeneratorsIndependent() {
        var late = new EventIdGenerator(Clock.fixed(SOME_INSTANT.plusSeconds(3600), ZoneOffset.UTC));
        var early = new EventIdGenerator(Clock.fixed(SOME_INSTANT, ZoneOffset.UTC));

        String fromLate = late.generate();
        String fromEarly = early.generate();

        assertThat(fromEarly.substring(0, 10)).isLessThan(fromLate.substring(0, 10));
    }

    private static final class SteppingClock extends Clock {

        private Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
