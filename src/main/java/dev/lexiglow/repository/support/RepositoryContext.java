package dev.lexiglow.repository.support;

import dev.lexiglow.metrics.RepositoryMetrics;
import dev.lexiglow.repository.BackendType;
import dev.lexiglow.util.UlidGenerator;

import java.time.Clock;
import java.time.Duration;

/**
 * Collaborators shared by all repositories of one backend.
 */
public record RepositoryContext(
        BackendType backend,
        UlidGenerator idGenerator,
        Clock clock,
        Duration queryTimeout,
        RepositoryMetrics metrics
) {
}
