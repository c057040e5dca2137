package com.feedwatch.common.id;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Generates monotonic ULIDs for change events.
 *
 * <p>A ULID is a 26-char Crockford Base32 string: 48 bits of epoch milliseconds followed by 80
 * bits of randomness. Ids generated within the same millisecond reuse the previous randomness
 * incremented by one, so ids from one process always sort in generation order.
 */
public final class EventIdGenerator {

    private static final char[] ENCODING = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int RANDOM_BYTES = 10;
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final EventIdGenerator SHARED = new EventIdGenerator(Clock.systemUTC());

    private final Clock clock;
    private final byte[] lastRandomness = new byte[RANDOM_BYTES];
    private long lastTimestamp = -1L;

    EventIdGenerator(Clock clock) {
        this.clock = clock;
    }

    /** Next id from the process-wide generator. */
    public static String next() {
        return SHARED.generate();
    }

    synchronized String generate() {
        long timestamp = clock.millis();
        if (timestamp <= lastTimestamp) {
            timestamp = lastTimestamp;
            increment(lastRandomness);
        } else {
            RANDOM.nextBytes(lastRandomness);
            lastTimestamp = timestamp;
        }
        return encode(timestamp, lastRandomness);
    }

    private static void increment(byte[] randomness) {
        for (int i = randomness.length - 1; i >= 0; i--) {
            randomness[i]++;
            if (randomness[i] != 0) {
                return;
            }
        }
    }

    private static String encode(long timestamp, byte[] randomness) {
        var chars = new char[26];
        for (int i = 9; i >= 0; i--) {
            chars[i] = ENCODING[(int) (timestamp & 0x1F)];
            timestamp >>>= 5;
        }

        // 80 random bits, consumed five at a time from the most significant end
        int buffer = 0;
        int bits = 0;
        int position = 10;
        for (byte b : randomness) {
            buffer = (buffer << 8) | (b & 0xFF);
            bits += 8;
            while (bits >= 5) {
                bits -= 5;
                chars[position++] = ENCODING[(buffer >>> bits) & 0x1F];
            }
        }
        return new String(chars);
    }
}
