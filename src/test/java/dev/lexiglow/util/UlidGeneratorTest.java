package dev.lexiglow.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UlidGenerator")
class UlidGeneratorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30.123Z");

    @Nested
    @DisplayName("nextId")
    class NextId {

        @Test
        @DisplayName("Should produce 26 character Crockford base32 ids")
        void shouldProduceWellFormedIds() {
            UlidGenerator generator = new UlidGenerator();

            String id = generator.nextId();

            assertThat(id).hasSize(UlidGenerator.LENGTH).matches("[0-9A-HJKMNP-TV-Z]{26}");
            assertThat(UlidGenerator.isValid(id)).isTrue();
        }

        @Test
        @DisplayName("Should be strictly increasing within one millisecond")
        void shouldBeMonotonicWithinSameMillisecond() {
            UlidGenerator generator = new UlidGenerator(Clock.fixed(NOW, ZoneOffset.UTC), new Random(42));

            String previous = generator.nextId();
            for (int i = 0; i < 1000; i++) {
                String next = generator.nextId();
                assertThat(next).isGreaterThan(previous);
                previous = next;
            }
        }

        @Test
        @DisplayName("Should stay increasing when the clock moves backwards")
        void shouldSurviveClockDrift() {
            MutableClock clock = new MutableClock(NOW.toEpochMilli());
            UlidGenerator generator = new UlidGenerator(clock, new Random(7));

            String first = generator.nextId();
            clock.set(NOW.toEpochMilli() - 5_000);
            String second = generator.nextId();

            assertThat(second).isGreaterThan(first);
            assertThat(UlidGenerator.extractInstant(second)).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should embed the generation time")
        void shouldEmbedTimestamp() {
            UlidGenerator generator = new UlidGenerator(Clock.fixed(NOW, ZoneOffset.UTC), new Random(1));

            assertThat(UlidGenerator.extractInstant(generator.nextId())).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should fail when the random part overflows within one millisecond")
        void shouldFailOnOverflow() {
            Random saturated = new Random() {
                @Override
                public long nextLong() {
                    return -1L;
                }
            };
            UlidGenerator generator = new UlidGenerator(Clock.fixed(NOW, ZoneOffset.UTC), saturated);
            generator.nextId();

            assertThatThrownBy(generator::nextId).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Should generate unique ids from concurrent threads")
        void shouldBeUniqueUnderConcurrency() throws Exception {
            UlidGenerator generator = new UlidGenerator();
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Callable<List<String>>> tasks = new ArrayList<>();
                for (int t = 0; t < 8; t++) {
                    tasks.add(() -> {
                        List<String> ids = new ArrayList<>();
                        for (int i = 0; i < 2_000; i++) {
                            ids.add(generator.nextId());
                        }
                        return ids;
                    });
                }
                Set<String> all = new HashSet<>();
                for (Future<List<String>> future : executor.invokeAll(tasks)) {
                    all.addAll(future.get());
                }
                assertThat(all).hasSize(16_000);
            } finally {
                executor.shutdown();
                executor.awaitTermination(5, TimeUnit.SECONDS);
            }
        }
    }

    @Nested
    @DisplayName("encode / isValid / extractInstant")
    class Codec {

        @Test
        @DisplayName("Should encode zero as all zeros")
        void shouldEncodeZero() {
            assertThat(UlidGenerator.encode(0, 0, 0)).isEqualTo("00000000000000000000000000");
        }

        @Test
        @DisplayName("Should keep the timestamp in the first ten characters")
        void shouldPlaceTimestampFirst() {
            String id = UlidGenerator.encode(1, 0, 0);

            assertThat(id).isEqualTo("0000000001" + "0000000000000000");
            assertThat(UlidGenerator.extractInstant(id)).isEqualTo(Instant.ofEpochMilli(1));
        }

        @Test
        @DisplayName("Should reject timestamps outside 48 bits")
        void shouldRejectOutOfRangeTimestamp() {
            assertThatThrownBy(() -> UlidGenerator.encode(-1, 0, 0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> UlidGenerator.encode(1L << 48, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject malformed values")
        void shouldRejectMalformed() {
            assertThat(UlidGenerator.isValid(null)).isFalse();
            assertThat(UlidGenerator.isValid("")).isFalse();
            assertThat(UlidGenerator.isValid("0000000000000000000000000")).isFalse();
            assertThat(UlidGenerator.isValid("0000000000000000000000000U")).isFalse();
            assertThat(UlidGenerator.isValid("80000000000000000000000000")).isFalse();
            assertThatThrownBy(() -> UlidGenerator.extractInstant("not-a-ulid"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should accept lower case input")
        void shouldAcceptLowerCase() {
            String id = new UlidGenerator().nextId();

            assertThat(UlidGenerator.isValid(id.toLowerCase())).isTrue();
        }
    }

    private static final class MutableClock extends Clock {

        private final AtomicLong millis;

        MutableClock(long millis) {
            this.millis = new AtomicLong(millis);
        }

        void set(long value) {
            millis.set(value);
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
        public long millis() {
            return millis.get();
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis.get());
        }
    }
}
