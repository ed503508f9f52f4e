package dev.lexiglow.repository;

import dev.lexiglow.entity.User;
import reactor.core.publisher.Mono;

public interface UserRepository extends EntityRepository<User> {

    Mono<User> findByEmail(String email);

    Mono<User> findByUsername(String username);

    Mono<Boolean> existsByEmail(String email);

    Mono<Boolean> existsByUsername(String username);

    /**
     * Sets {@code lastActiveAt} to now without touching any other field.
     *
     * @return {@code false} if the user does not exist
     */
    Mono<Boolean> updateLastActive(String id);
}
