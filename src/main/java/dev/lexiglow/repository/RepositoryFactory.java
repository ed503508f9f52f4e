package dev.lexiglow.repository;

import reactor.core.publisher.Mono;

/**
 * Hands out the repositories of the active backend. Each repository type is built at most
 * once and shared afterwards; overrides registered for a type win over the built instance.
 */
public interface RepositoryFactory {

    BackendType backendType();

    <R> R getRepository(Class<R> repositoryType);

    /**
     * Replaces the instance returned for {@code repositoryType}, typically with a test double.
     */
    <R> void registerOverride(Class<R> repositoryType, R implementation);

    void clearOverrides();

    Mono<Void> ping();

    /**
     * Releases the backend's resources. Safe to call more than once.
     */
    void dispose();

    default LanguageRepository languages() {
        return getRepository(LanguageRepository.class);
    }

    default UserRepository users() {
        return getRepository(UserRepository.class);
    }

    default TextRepository texts() {
        return getRepository(TextRepository.class);
    }
}
