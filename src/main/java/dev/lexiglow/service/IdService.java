package dev.lexiglow.service;

import dev.lexiglow.util.UlidGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Generates and inspects entity identifiers.
 *
 * <pre>
 * Language language = Language.builder()
 *     .id(idService.nextId())
 *     .code("es")
 *     .build();
 * </pre>
 */
@Service
@RequiredArgsConstructor
public class IdService {

    private final UlidGenerator ulidGenerator;

    public String nextId() {
        return ulidGenerator.nextId();
    }

    public boolean isValid(String id) {
        return UlidGenerator.isValid(id);
    }

    /**
     * Creation instant encoded in the identifier.
     */
    public Instant getCreatedInstant(String id) {
        return UlidGenerator.extractInstant(id);
    }

    public LocalDateTime getCreatedAt(String id) {
        return LocalDateTime.ofInstant(getCreatedInstant(id), ZoneOffset.UTC);
    }
}
