package dev.lexiglow.repository;

import dev.lexiglow.entity.TextTag;
import reactor.core.publisher.Mono;

public interface TextTagRepository extends EntityRepository<TextTag> {

    Mono<TextTag> findByName(String name);

    Mono<Boolean> existsByName(String name);
}
