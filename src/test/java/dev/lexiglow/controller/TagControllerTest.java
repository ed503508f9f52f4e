package dev.lexiglow.controller;

import dev.lexiglow.dto.TagRequest;
import dev.lexiglow.dto.TagResponse;
import dev.lexiglow.exception.DuplicateResourceException;
import dev.lexiglow.service.TextTagService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TagControllerTest {

    @Mock
    private TextTagService tagService;

    @InjectMocks
    private TagController controller;

    @Test
    @DisplayName("Should return tags as a list")
    void shouldListTags() {
        when(tagService.getAllTags(0, 100)).thenReturn(Flux.just(
                TagResponse.builder().id("01HX00000000000000000TAG01").name("travel").build(),
                TagResponse.builder().id("01HX00000000000000000TAG02").name("food").build()));

        StepVerifier.create(controller.getAllTags(0, 100))
                .assertNext(tags -> assertThat(tags).extracting(TagResponse::getName).containsExactly("travel", "food"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should propagate a duplicate name")
    void shouldPropagateDuplicate() {
        TagRequest request = new TagRequest("travel", null);
        when(tagService.createTag(request)).thenReturn(Mono.error(new DuplicateResourceException("Tag", "name", "travel")));

        StepVerifier.create(controller.createTag(request))
                .expectError(DuplicateResourceException.class)
                .verify();
    }
}
