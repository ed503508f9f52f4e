package dev.lexiglow.service;

import dev.lexiglow.dto.UserLanguageRequest;
import dev.lexiglow.dto.UserRequest;
import dev.lexiglow.dto.UserUpdateRequest;
import dev.lexiglow.entity.ProficiencyLevel;
import dev.lexiglow.entity.User;
import dev.lexiglow.entity.UserLanguage;
import dev.lexiglow.exception.DuplicateResourceException;
import dev.lexiglow.exception.ResourceNotFoundException;
import dev.lexiglow.repository.LanguageRepository;
import dev.lexiglow.repository.UserLanguageRepository;
import dev.lexiglow.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    private static final String SPANISH = "01HX00000000000000000000ES";
    private static final String ENGLISH = "01HX00000000000000000000EN";

    @Mock private UserRepository userRepository;
    @Mock private UserLanguageRepository userLanguageRepository;
    @Mock private LanguageRepository languageRepository;
    @Mock private PasswordEncoder passwordEncoder;
    @Mock private IdService idService;

    @InjectMocks
    private UserService userService;

    private User maria;

    @BeforeEach
    void setUp() {
        maria = User.builder()
                .id("01HX000000000000000000USR1")
                .email("maria@example.com")
                .username("maria")
                .passwordHash("$2a$12$stored")
                .firstName("María")
                .lastName("García")
                .nativeLanguageId(SPANISH)
                .currentLanguageId(ENGLISH)
                .createdAt(LocalDateTime.now().minusDays(3))
                .updatedAt(LocalDateTime.now().minusDays(3))
                .build();
    }

    private UserRequest newUserRequest() {
        return UserRequest.builder()
                .email("pedro@example.com")
                .username("pedro")
                .password("s3cret-pass")
                .firstName("Pedro")
                .lastName("López")
                .nativeLanguageId(SPANISH)
                .currentLanguageId(ENGLISH)
                .build();
    }

    @Nested
    @DisplayName("createUser")
    class CreateUser {

        @Test
        @DisplayName("Should store a hash of the password, never the password itself")
        void shouldHashPassword() {
            when(userRepository.existsByEmail("pedro@example.com")).thenReturn(Mono.just(false));
            when(userRepository.existsByUsername("pedro")).thenReturn(Mono.just(false));
            when(languageRepository.exists(SPANISH)).thenReturn(Mono.just(true));
            when(languageRepository.exists(ENGLISH)).thenReturn(Mono.just(true));
            when(idService.nextId()).thenReturn("01HX000000000000000000USR2");
            when(passwordEncoder.encode("s3cret-pass")).thenReturn("$2a$12$hashed");
            when(userRepository.create(any(User.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0, User.class)));

            StepVerifier.create(userService.createUser(newUserRequest()))
                    .assertNext(response -> {
                        assertThat(response.getId()).isEqualTo("01HX000000000000000000USR2");
                        assertThat(response.getUsername()).isEqualTo("pedro");
                    })
                    .verifyComplete();

            ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
            verify(userRepository).create(captor.capture());
            assertThat(captor.getValue().getPasswordHash()).isEqualTo("$2a$12$hashed");
        }

        @Test
        @DisplayName("Should reject an email in use without checking further")
        void shouldRejectDuplicateEmail() {
            when(userRepository.existsByEmail("pedro@example.com")).thenReturn(Mono.just(true));

            StepVerifier.create(userService.createUser(newUserRequest()))
                    .expectErrorMatches(error -> error instanceof DuplicateResourceException
                            && error.getMessage().contains("email"))
                    .verify();
            verify(userRepository, never()).existsByUsername(anyString());
            verify(userRepository, never()).create(any());
        }

        @Test
        @DisplayName("Should reject a username in use")
        void shouldRejectDuplicateUsername() {
            when(userRepository.existsByEmail("pedro@example.com")).thenReturn(Mono.just(false));
            when(userRepository.existsByUsername("pedro")).thenReturn(Mono.just(true));

            StepVerifier.create(userService.createUser(newUserRequest()))
                    .expectError(DuplicateResourceException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should fail with not found for an unknown language")
        void shouldRejectUnknownLanguage() {
            when(userRepository.existsByEmail("pedro@example.com")).thenReturn(Mono.just(false));
            when(userRepository.existsByUsername("pedro")).thenReturn(Mono.just(false));
            when(languageRepository.exists(SPANISH)).thenReturn(Mono.just(false));

            StepVerifier.create(userService.createUser(newUserRequest()))
                    .expectErrorMatches(error -> error instanceof ResourceNotFoundException
                            && error.getMessage().contains("Language"))
                    .verify();
            verify(userRepository, never()).create(any());
        }
    }

    @Nested
    @DisplayName("updateUser")
    class UpdateUser {

        @Test
        @DisplayName("Should only check uniqueness of values that change")
        void shouldSkipChecksForUnchangedValues() {
            when(userRepository.findById(maria.getId())).thenReturn(Mono.just(maria));
            when(userRepository.update(eq(maria.getId()), any(User.class)))
                    .thenAnswer(inv -> Mono.just(inv.getArgument(1, User.class)));

            UserUpdateRequest request = UserUpdateRequest.builder()
                    .email("maria@example.com")
                    .firstName("Mari")
                    .build();

            StepVerifier.create(userService.updateUser(maria.getId(), request))
                    .assertNext(response -> {
                        assertThat(response.getFirstName()).isEqualTo("Mari");
                        assertThat(response.getLastName()).isEqualTo("García");
                    })
                    .verifyComplete();
            verify(userRepository, never()).existsByEmail(anyString());
        }

        @Test
        @DisplayName("Should reject a new username owned by someone else")
        void shouldRejectTakenUsername() {
            when(userRepository.findById(maria.getId())).thenReturn(Mono.just(maria));
            when(userRepository.existsByUsername("pedro")).thenReturn(Mono.just(true));

            StepVerifier.create(userService.updateUser(maria.getId(),
                            UserUpdateRequest.builder().username("pedro").build()))
                    .expectError(DuplicateResourceException.class)
                    .verify();
            verify(userRepository, never()).update(anyString(), any());
        }

        @Test
        @DisplayName("Should fail with not found for an unknown id")
        void shouldFailWhenMissing() {
            when(userRepository.findById("missing")).thenReturn(Mono.empty());

            StepVerifier.create(userService.updateUser("missing", new UserUpdateRequest()))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("recordActivity")
    class RecordActivity {

        @Test
        @DisplayName("Should return the user with the new activity time")
        void shouldStampActivity() {
            LocalDateTime stamped = LocalDateTime.now();
            when(userRepository.updateLastActive(maria.getId())).thenReturn(Mono.just(true));
            when(userRepository.findById(maria.getId()))
                    .thenReturn(Mono.just(maria.toBuilder().lastActiveAt(stamped).build()));

            StepVerifier.create(userService.recordActivity(maria.getId()))
                    .assertNext(response -> assertThat(response.getLastActiveAt()).isEqualTo(stamped))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fail with not found when no user was stamped")
        void shouldFailWhenMissing() {
            when(userRepository.updateLastActive("missing")).thenReturn(Mono.just(false));

            StepVerifier.create(userService.recordActivity("missing"))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("user languages")
    class UserLanguages {

        @Test
        @DisplayName("Should save the proficiency for an existing user and language")
        void shouldSaveUserLanguage() {
            when(userRepository.findById(maria.getId())).thenReturn(Mono.just(maria));
            when(languageRepository.exists(ENGLISH)).thenReturn(Mono.just(true));
            when(userLanguageRepository.save(any(UserLanguage.class)))
                    .thenAnswer(inv -> Mono.just(inv.getArgument(0, UserLanguage.class)));

            StepVerifier.create(userService.saveUserLanguage(maria.getId(), ENGLISH,
                            UserLanguageRequest.builder().proficiencyLevel(ProficiencyLevel.B2).build()))
                    .assertNext(response -> {
                        assertThat(response.getLanguageId()).isEqualTo(ENGLISH);
                        assertThat(response.getProficiencyLevel()).isEqualTo(ProficiencyLevel.B2);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should not save when the user does not exist")
        void shouldRejectUnknownUser() {
            when(userRepository.findById("missing")).thenReturn(Mono.empty());

            StepVerifier.create(userService.saveUserLanguage("missing", ENGLISH,
                            UserLanguageRequest.builder().proficiencyLevel(ProficiencyLevel.A2).build()))
                    .expectErrorMatches(error -> error instanceof ResourceNotFoundException
                            && error.getMessage().contains("User"))
                    .verify();
            verify(userLanguageRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should list the languages of an existing user")
        void shouldListLanguages() {
            when(userRepository.findById(maria.getId())).thenReturn(Mono.just(maria));
            when(userLanguageRepository.findByUser(maria.getId())).thenReturn(Flux.just(
                    UserLanguage.builder().userId(maria.getId()).languageId(ENGLISH).build()));

            StepVerifier.create(userService.getUserLanguages(maria.getId()))
                    .assertNext(response -> assertThat(response.getProficiencyLevel()).isEqualTo(ProficiencyLevel.A1))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fail with not found when the pair does not exist")
        void shouldFailRemovingUnknownPair() {
            when(userLanguageRepository.delete(maria.getId(), SPANISH)).thenReturn(Mono.just(false));

            StepVerifier.create(userService.removeUserLanguage(maria.getId(), SPANISH))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("Should never expose the password hash")
    void shouldNotExposeHash() {
        when(userRepository.findByUsername("maria")).thenReturn(Mono.just(maria));

        StepVerifier.create(userService.getUserByUsername("maria"))
                .assertNext(response -> assertThat(response.toString()).doesNotContain("$2a$12$stored"))
                .verifyComplete();
    }
}
