package dev.lexiglow.repository;

import dev.lexiglow.config.PersistenceProperties;
import dev.lexiglow.metrics.RepositoryMetrics;
import dev.lexiglow.repository.support.RepositoryContext;
import dev.lexiglow.util.UlidGenerator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Document repositories (MongoDB)")
class DocumentRepositoryContractTest extends AbstractRepositoryContractTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7");

    @Override
    protected RepositoryFactory openFactory() {
        PersistenceProperties properties = new PersistenceProperties();
        properties.setBackend("document");
        properties.setUrl(MONGO.getConnectionString());
        properties.setDatabase("lexiglow_" + new UlidGenerator().nextId().toLowerCase());
        RepositoryContext context = new RepositoryContext(BackendType.DOCUMENT, new UlidGenerator(), Clock.systemUTC(),
                Duration.ofSeconds(10), new RepositoryMetrics(new SimpleMeterRegistry()));
        return new CachingRepositoryFactory(RepositoryBackends.open(properties, context));
    }

    @Override
    protected boolean enforcesReferences() {
        return false;
    }

    @Test
    @DisplayName("Should report the document backend")
    void shouldReportBackend() {
        assertThat(factory.backendType()).isEqualTo(BackendType.DOCUMENT);
    }
}
