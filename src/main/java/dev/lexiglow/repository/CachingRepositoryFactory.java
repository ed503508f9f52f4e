package dev.lexiglow.repository;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
public class CachingRepositoryFactory implements RepositoryFactory {

    private final RepositoryBackend backend;
    private final Map<Class<?>, Object> repositories = new ConcurrentHashMap<>();
    private final Map<Class<?>, Object> overrides = new ConcurrentHashMap<>();
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    public CachingRepositoryFactory(RepositoryBackend backend) {
        this.backend = backend;
    }

    @Override
    public BackendType backendType() {
        return backend.type();
    }

    @Override
    public <R> R getRepository(Class<R> repositoryType) {
        if (disposed.get()) {
            throw new IllegalStateException("Repository factory has been disposed");
        }
        Object override = overrides.get(repositoryType);
        if (override != null) {
            return repositoryType.cast(override);
        }
        return repositoryType.cast(repositories.computeIfAbsent(repositoryType, type -> {
            log.debug("Creating {} for {} backend", type.getSimpleName(), backend.type().label());
            return backend.createRepository(type);
        }));
    }

    @Override
    public <R> void registerOverride(Class<R> repositoryType, R implementation) {
        log.info("Registering override for {}", repositoryType.getSimpleName());
        overrides.put(repositoryType, implementation);
    }

    @Override
    public void clearOverrides() {
        overrides.clear();
    }

    @Override
    public Mono<Void> ping() {
        return backend.ping();
    }

    @Override
    public void dispose() {
        if (disposed.compareAndSet(false, true)) {
            log.info("Closing {} persistence backend", backend.type().label());
            repositories.clear();
            overrides.clear();
            backend.close();
        }
    }

    public boolean isDisposed() {
        return disposed.get();
    }
}
