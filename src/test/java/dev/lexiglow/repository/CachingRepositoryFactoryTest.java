package dev.lexiglow.repository;

import dev.lexiglow.exception.OperationNotSupportedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CachingRepositoryFactory")
class CachingRepositoryFactoryTest {

    @Mock
    private RepositoryBackend backend;

    @Mock
    private LanguageRepository languageRepository;

    @InjectMocks
    private CachingRepositoryFactory factory;

    @BeforeEach
    void setUp() {
        lenient().when(backend.type()).thenReturn(BackendType.RELATIONAL);
    }

    @Nested
    @DisplayName("getRepository")
    class GetRepository {

        @Test
        @DisplayName("Should construct a repository once and cache it")
        void shouldCacheInstance() {
            when(backend.createRepository(LanguageRepository.class)).thenReturn(languageRepository);

            LanguageRepository first = factory.getRepository(LanguageRepository.class);
            LanguageRepository second = factory.languages();

            assertThat(first).isSameAs(languageRepository).isSameAs(second);
            verify(backend, times(1)).createRepository(LanguageRepository.class);
        }

        @Test
        @DisplayName("Should construct once under concurrent first access")
        void shouldConstructOnceConcurrently() throws Exception {
            when(backend.createRepository(LanguageRepository.class)).thenAnswer(invocation -> {
                Thread.sleep(20);
                return languageRepository;
            });
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Callable<LanguageRepository>> tasks = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    tasks.add(() -> {
                        start.await();
                        return factory.getRepository(LanguageRepository.class);
                    });
                }
                List<Future<LanguageRepository>> futures = new ArrayList<>();
                for (Callable<LanguageRepository> task : tasks) {
                    futures.add(executor.submit(task));
                }
                start.countDown();
                for (Future<LanguageRepository> future : futures) {
                    assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(languageRepository);
                }
            } finally {
                executor.shutdownNow();
            }
            verify(backend, times(1)).createRepository(LanguageRepository.class);
        }

        @Test
        @DisplayName("Should propagate the backend's not-supported signal")
        void shouldPropagateUnsupported() {
            when(backend.createRepository(TextRepository.class))
                    .thenThrow(new OperationNotSupportedException("no texts"));

            assertThatThrownBy(() -> factory.getRepository(TextRepository.class))
                    .isInstanceOf(OperationNotSupportedException.class);
        }
    }

    @Nested
    @DisplayName("overrides")
    class Overrides {

        @Test
        @DisplayName("Should prefer a registered override without touching the backend")
        void shouldPreferOverride() {
            factory.registerOverride(LanguageRepository.class, languageRepository);

            assertThat(factory.getRepository(LanguageRepository.class)).isSameAs(languageRepository);
            verify(backend, never()).createRepository(any());
        }

        @Test
        @DisplayName("Should fall back to the backend after clearing overrides")
        void shouldFallBackAfterClear() {
            LanguageRepository fromBackend = mock(LanguageRepository.class);
            when(backend.createRepository(LanguageRepository.class)).thenReturn(fromBackend);
            factory.registerOverride(LanguageRepository.class, languageRepository);

            factory.clearOverrides();

            assertThat(factory.getRepository(LanguageRepository.class)).isSameAs(fromBackend);
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should close the backend only once")
        void shouldDisposeOnce() {
            factory.dispose();
            factory.dispose();

            verify(backend, times(1)).close();
            assertThat(factory.isDisposed()).isTrue();
        }

        @Test
        @DisplayName("Should refuse lookups after dispose")
        void shouldRejectAfterDispose() {
            factory.dispose();

            assertThatThrownBy(() -> factory.getRepository(LanguageRepository.class))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Should delegate backend type and ping")
        void shouldDelegate() {
            when(backend.type()).thenReturn(BackendType.DOCUMENT);
            when(backend.ping()).thenReturn(Mono.empty());

            assertThat(factory.backendType()).isEqualTo(BackendType.DOCUMENT);
            StepVerifier.create(factory.ping()).verifyComplete();
        }
    }
}
