package dev.lexiglow.config;

import dev.lexiglow.metrics.RepositoryMetrics;
import dev.lexiglow.repository.CachingRepositoryFactory;
import dev.lexiglow.repository.LanguageRepository;
import dev.lexiglow.repository.RepositoryBackends;
import dev.lexiglow.repository.RepositoryFactory;
import dev.lexiglow.repository.TextRepository;
import dev.lexiglow.repository.TextTagRepository;
import dev.lexiglow.repository.UserLanguageRepository;
import dev.lexiglow.repository.UserRepository;
import dev.lexiglow.repository.VocabularyItemRepository;
import dev.lexiglow.repository.VocabularyRepository;
import dev.lexiglow.repository.support.RepositoryContext;
import dev.lexiglow.util.UlidGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the persistence layer: one {@link RepositoryFactory} for the configured backend,
 * and every repository contract exposed as a bean resolved through it.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(PersistenceProperties.class)
public class PersistenceConfig {

    @Bean
    public UlidGenerator ulidGenerator() {
        return new UlidGenerator();
    }

    @Bean
    public RepositoryMetrics repositoryMetrics(MeterRegistry meterRegistry) {
        return new RepositoryMetrics(meterRegistry);
    }

    @Bean(destroyMethod = "dispose")
    public RepositoryFactory repositoryFactory(PersistenceProperties properties, UlidGenerator ulidGenerator,
                                               RepositoryMetrics repositoryMetrics) {
        RepositoryContext context = new RepositoryContext(
                properties.validate(), ulidGenerator, Clock.systemUTC(), properties.getQueryTimeout(), repositoryMetrics);
        RepositoryFactory factory = new CachingRepositoryFactory(RepositoryBackends.open(properties, context));
        log.info("Persistence ready: backend={}, queryTimeout={}", factory.backendType().label(), properties.getQueryTimeout());
        return factory;
    }

    @Bean
    public LanguageRepository languageRepository(RepositoryFactory factory) {
        return factory.getRepository(LanguageRepository.class);
    }

    @Bean
    public UserRepository userRepository(RepositoryFactory factory) {
        return factory.getRepository(UserRepository.class);
    }

    @Bean
    public UserLanguageRepository userLanguageRepository(RepositoryFactory factory) {
        return factory.getRepository(UserLanguageRepository.class);
    }

    @Bean
    public TextRepository textRepository(RepositoryFactory factory) {
        return factory.getRepository(TextRepository.class);
    }

    @Bean
    public TextTagRepository textTagRepository(RepositoryFactory factory) {
        return factory.getRepository(TextTagRepository.class);
    }

    @Bean
    public VocabularyRepository vocabularyRepository(RepositoryFactory factory) {
        return factory.getRepository(VocabularyRepository.class);
    }

    @Bean
    public VocabularyItemRepository vocabularyItemRepository(RepositoryFactory factory) {
        return factory.getRepository(VocabularyItemRepository.class);
    }
}
