package dev.lexiglow.service;

import dev.lexiglow.util.UlidGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IdService")
class IdServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30.250Z");

    private IdService idService;

    @BeforeEach
    void setUp() {
        idService = new IdService(new UlidGenerator(Clock.fixed(NOW, ZoneOffset.UTC), new SecureRandom()));
    }

    @Test
    @DisplayName("should hand out distinct valid identifiers")
    void shouldGenerateValidIds() {
        String first = idService.nextId();
        String second = idService.nextId();

        assertThat(idService.isValid(first)).isTrue();
        assertThat(second).isNotEqualTo(first);
        assertThat(second.compareTo(first)).isPositive();
    }

    @Test
    @DisplayName("should recover the creation time from an identifier")
    void shouldExtractCreationTime() {
        String id = idService.nextId();

        assertThat(idService.getCreatedInstant(id)).isEqualTo(NOW);
        assertThat(idService.getCreatedAt(id)).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 15, 30, 250_000_000));
    }

    @Test
    @DisplayName("should reject malformed identifiers")
    void shouldRejectMalformed() {
        assertThat(idService.isValid("not-a-ulid")).isFalse();
        assertThat(idService.isValid(null)).isFalse();
    }
}
