package dev.lexiglow.util;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ULID generator producing 26-character, lexicographically sortable identifiers.
 *
 * <p>Layout (128 bits, Crockford base32):</p>
 * <pre>
 * | 48 bits (epoch millis) | 80 bits (randomness) |
 * </pre>
 *
 * <p>Within one millisecond the random part is incremented instead of re-drawn, so
 * IDs generated by one instance are strictly increasing. Generation is lock-free
 * (CAS on the last emitted state).</p>
 */
public final class UlidGenerator {

    public static final int LENGTH = 26;

    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final long MAX_TIMESTAMP = (1L << 48) - 1;
    private static final long RANDOM_HIGH_MASK = (1L << 16) - 1;

    private final Clock clock;
    private final Random random;
    private final AtomicReference<State> lastState = new AtomicReference<>(new State(-1L, 0L, 0L));

    public UlidGenerator() {
        this(Clock.systemUTC(), new SecureRandom());
    }

    public UlidGenerator(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    /**
     * Generates the next ULID.
     *
     * @throws IllegalStateException if the random component overflows within a millisecond
     */
    public String nextId() {
        while (true) {
            long now = clock.millis();
            State old = lastState.get();
            State next;
            if (now > old.timestamp) {
                next = new State(now, random.nextLong() & RANDOM_HIGH_MASK, random.nextLong());
            } else {
                // same millisecond or clock drift backwards: keep last timestamp, increment randomness
                long low = old.randomLow + 1;
                long high = old.randomHigh;
                if (low == 0) {
                    high = (high + 1) & RANDOM_HIGH_MASK;
                    if (high == 0) {
                        throw new IllegalStateException("ULID random component overflow within one millisecond");
                    }
                }
                next = new State(old.timestamp, high, low);
            }
            if (lastState.compareAndSet(old, next)) {
                return encode(next.timestamp, next.randomHigh, next.randomLow);
            }
        }
    }

    /**
     * Builds a ULID string from its components.
     */
    public static String encode(long timestamp, long randomHigh16, long randomLow64) {
        if (timestamp < 0 || timestamp > MAX_TIMESTAMP) {
            throw new IllegalArgumentException("Timestamp out of ULID range: " + timestamp);
        }
        // 128-bit value split in two longs: msb = 48 bits time + 16 random bits, lsb = 64 random bits
        long msb = (timestamp << 16) | (randomHigh16 & RANDOM_HIGH_MASK);
        long lsb = randomLow64;
        char[] out = new char[LENGTH];
        for (int i = LENGTH - 1; i >= 0; i--) {
            out[i] = ALPHABET[(int) (lsb & 0x1F)];
            lsb = (lsb >>> 5) | (msb << 59);
            msb = msb >>> 5;
        }
        return new String(out);
    }

    /**
     * Returns true if the value is a well-formed ULID string.
     */
    public static boolean isValid(String value) {
        if (value == null || value.length() != LENGTH) {
            return false;
        }
        // first char carries only 3 bits
        if (indexOf(value.charAt(0)) > 7) {
            return false;
        }
        for (int i = 0; i < LENGTH; i++) {
            if (indexOf(value.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Extracts the creation instant from a ULID.
     */
    public static Instant extractInstant(String ulid) {
        if (!isValid(ulid)) {
            throw new IllegalArgumentException("Not a ULID: " + ulid);
        }
        long timestamp = 0;
        for (int i = 0; i < 10; i++) {
            timestamp = (timestamp << 5) | indexOf(ulid.charAt(i));
        }
        return Instant.ofEpochMilli(timestamp);
    }

    private static int indexOf(char c) {
        char upper = Character.toUpperCase(c);
        for (int i = 0; i < ALPHABET.length; i++) {
            if (ALPHABET[i] == upper) {
                return i;
            }
        }
        return -1;
    }

    private record State(long timestamp, long randomHigh, long randomLow) {
    }
}
