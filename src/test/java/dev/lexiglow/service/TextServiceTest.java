package dev.lexiglow.service;

import dev.lexiglow.dto.TextRequest;
import dev.lexiglow.dto.TextUpdateRequest;
import dev.lexiglow.entity.ProficiencyLevel;
import dev.lexiglow.entity.Text;
import dev.lexiglow.entity.TextTag;
import dev.lexiglow.exception.ResourceNotFoundException;
import dev.lexiglow.repository.LanguageRepository;
import dev.lexiglow.repository.TextRepository;
import dev.lexiglow.repository.TextTagRepository;
import dev.lexiglow.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TextServiceTest {

    private static final String SPANISH = "01HX00000000000000000000ES";
    private static final String TAG = "01HX00000000000000000TAG01";

    @Mock private TextRepository textRepository;
    @Mock private TextTagRepository tagRepository;
    @Mock private LanguageRepository languageRepository;
    @Mock private UserRepository userRepository;
    @Mock private IdService idService;

    @InjectMocks
    private TextService textService;

    private Text story;

    @BeforeEach
    void setUp() {
        story = Text.builder()
                .id("01HX0000000000000000TEXT01")
                .title("El viaje")
                .content("Fuimos a la playa")
                .languageId(SPANISH)
                .proficiencyLevel(ProficiencyLevel.A2)
                .wordCount(4)
                .isPublic(true)
                .createdAt(LocalDateTime.now().minusDays(1))
                .updatedAt(LocalDateTime.now().minusDays(1))
                .build();
    }

    @ParameterizedTest(name = "\"{0}\" has {1} words")
    @CsvSource(delimiter = '|', value = {
            "Fuimos a la playa|4",
            "  leading and trailing  |3",
            "one|1",
            "''|0"
    })
    @DisplayName("Should count whitespace-separated words")
    void shouldCountWords(String content, int expected) {
        assertThat(TextService.countWords(content)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should treat tabs and line breaks as separators")
    void shouldCountAcrossLineBreaks() {
        assertThat(TextService.countWords("tabs\tand\nnew lines")).isEqualTo(4);
        assertThat(TextService.countWords(null)).isZero();
    }

    @Nested
    @DisplayName("createText")
    class CreateText {

        @Test
        @DisplayName("Should derive the word count and default to public")
        void shouldApplyDefaults() {
            TextRequest request = TextRequest.builder()
                    .title("Cuento")
                    .content("Había una vez un gato")
                    .languageId(SPANISH)
                    .proficiencyLevel(ProficiencyLevel.A1)
                    .isPublic(null)
                    .build();
            when(idService.nextId()).thenReturn("01HX0000000000000000TEXT02");
            when(languageRepository.exists(SPANISH)).thenReturn(Mono.just(true));
            when(textRepository.create(any(Text.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0, Text.class)));

            StepVerifier.create(textService.createText(request))
                    .assertNext(response -> {
                        assertThat(response.getWordCount()).isEqualTo(5);
                        assertThat(response.getIsPublic()).isTrue();
                        assertThat(response.getUserId()).isNull();
                    })
                    .verifyComplete();
            verify(userRepository, never()).exists(any());
        }

        @Test
        @DisplayName("Should fail with not found for an unknown owner")
        void shouldRejectUnknownOwner() {
            TextRequest request = TextRequest.builder()
                    .title("Diario")
                    .content("Hoy")
                    .languageId(SPANISH)
                    .userId("missing")
                    .proficiencyLevel(ProficiencyLevel.A1)
                    .build();
            when(idService.nextId()).thenReturn("01HX0000000000000000TEXT03");
            when(languageRepository.exists(SPANISH)).thenReturn(Mono.just(true));
            when(userRepository.exists("missing")).thenReturn(Mono.just(false));

            StepVerifier.create(textService.createText(request))
                    .expectErrorMatches(error -> error instanceof ResourceNotFoundException
                            && error.getMessage().contains("User"))
                    .verify();
            verify(textRepository, never()).create(any());
        }
    }

    @Nested
    @DisplayName("updateText")
    class UpdateText {

        @Test
        @DisplayName("Should recount words when the content changes")
        void shouldRecountWords() {
            when(textRepository.findById(story.getId())).thenReturn(Mono.just(story));
            when(textRepository.update(eq(story.getId()), any(Text.class)))
                    .thenAnswer(inv -> Mono.just(inv.getArgument(1, Text.class)));

            StepVerifier.create(textService.updateText(story.getId(),
                            TextUpdateRequest.builder().content("Fuimos a la playa con mi hermana").build()))
                    .assertNext(response -> {
                        assertThat(response.getWordCount()).isEqualTo(7);
                        assertThat(response.getTitle()).isEqualTo("El viaje");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should prefer an explicit word count")
        void shouldKeepExplicitWordCount() {
            when(textRepository.findById(story.getId())).thenReturn(Mono.just(story));
            when(textRepository.update(eq(story.getId()), any(Text.class)))
                    .thenAnswer(inv -> Mono.just(inv.getArgument(1, Text.class)));

            StepVerifier.create(textService.updateText(story.getId(),
                            TextUpdateRequest.builder().content("uno dos").wordCount(10).build()))
                    .assertNext(response -> assertThat(response.getWordCount()).isEqualTo(10))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should check a new language before writing")
        void shouldCheckNewLanguage() {
            when(textRepository.findById(story.getId())).thenReturn(Mono.just(story));
            when(languageRepository.exists("missing")).thenReturn(Mono.just(false));

            StepVerifier.create(textService.updateText(story.getId(),
                            TextUpdateRequest.builder().languageId("missing").build()))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
            verify(textRepository, never()).update(any(), any());
        }
    }

    @Nested
    @DisplayName("tags")
    class Tags {

        @Test
        @DisplayName("Should include tag ids when reading a single text")
        void shouldIncludeTagIds() {
            when(textRepository.findById(story.getId())).thenReturn(Mono.just(story));
            when(textRepository.findTagIds(story.getId())).thenReturn(Flux.just(TAG));

            StepVerifier.create(textService.getTextById(story.getId()))
                    .assertNext(response -> assertThat(response.getTagIds()).containsExactly(TAG))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should link an existing tag and return the text")
        void shouldAddTag() {
            when(tagRepository.exists(TAG)).thenReturn(Mono.just(true));
            when(textRepository.addTag(story.getId(), TAG)).thenReturn(Mono.just(true));
            when(textRepository.findById(story.getId())).thenReturn(Mono.just(story));
            when(textRepository.findTagIds(story.getId())).thenReturn(Flux.just(TAG));

            StepVerifier.create(textService.addTag(story.getId(), TAG))
                    .assertNext(response -> assertThat(response.getTagIds()).containsExactly(TAG))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fail with not found for an unknown tag")
        void shouldRejectUnknownTag() {
            when(tagRepository.exists(TAG)).thenReturn(Mono.just(false));

            StepVerifier.create(textService.addTag(story.getId(), TAG))
                    .expectErrorMatches(error -> error instanceof ResourceNotFoundException
                            && error.getMessage().startsWith("Tag"))
                    .verify();
            verify(textRepository, never()).addTag(any(), any());
        }

        @Test
        @DisplayName("Should fail with not found for an unknown text")
        void shouldRejectUnknownText() {
            when(tagRepository.exists(TAG)).thenReturn(Mono.just(true));
            when(textRepository.addTag("missing", TAG)).thenReturn(Mono.just(false));

            StepVerifier.create(textService.addTag("missing", TAG))
                    .expectErrorMatches(error -> error instanceof ResourceNotFoundException
                            && error.getMessage().startsWith("Text"))
                    .verify();
        }

        @Test
        @DisplayName("Should resolve a text's tags in tag id order")
        void shouldListTags() {
            TextTag travel = TextTag.builder().id(TAG).name("travel").build();
            when(textRepository.findById(story.getId())).thenReturn(Mono.just(story));
            when(textRepository.findTagIds(story.getId())).thenReturn(Flux.just(TAG));
            when(tagRepository.findById(TAG)).thenReturn(Mono.just(travel));

            StepVerifier.create(textService.getTextTags(story.getId()))
                    .assertNext(tag -> assertThat(tag.getName()).isEqualTo("travel"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fail with not found when the link does not exist")
        void shouldFailRemovingMissingLink() {
            when(textRepository.removeTag(story.getId(), TAG)).thenReturn(Mono.just(false));

            StepVerifier.create(textService.removeTag(story.getId(), TAG))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("Should pass tag filters through to the repository")
    void shouldFindByTags() {
        when(textRepository.findByTags(List.of(TAG), 0, 10)).thenReturn(Flux.just(story));

        StepVerifier.create(textService.getTextsByTags(List.of(TAG), 0, 10))
                .assertNext(response -> assertThat(response.getTagIds()).isNull())
                .verifyComplete();
    }

    @Test
    @DisplayName("Should fail with not found when deleting an unknown text")
    void shouldFailDeletingUnknown() {
        when(textRepository.delete("missing")).thenReturn(Mono.just(false));

        StepVerifier.create(textService.deleteText("missing"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }
}
