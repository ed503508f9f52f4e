package dev.lexiglow.service;

import dev.lexiglow.dto.UserLanguageRequest;
import dev.lexiglow.dto.UserLanguageResponse;
import dev.lexiglow.dto.UserRequest;
import dev.lexiglow.dto.UserResponse;
import dev.lexiglow.dto.UserUpdateRequest;
import dev.lexiglow.entity.User;
import dev.lexiglow.entity.UserLanguage;
import dev.lexiglow.exception.DuplicateResourceException;
import dev.lexiglow.exception.ResourceNotFoundException;
import dev.lexiglow.repository.LanguageRepository;
import dev.lexiglow.repository.UserLanguageRepository;
import dev.lexiglow.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * User accounts and the languages each user studies.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final UserLanguageRepository userLanguageRepository;
    private final LanguageRepository languageRepository;
    private final PasswordEncoder passwordEncoder;
    private final IdService idService;

    public Flux<UserResponse> getAllUsers(long skip, int limit) {
        return userRepository.findAll(skip, limit)
                .map(UserService::toResponse);
    }

    public Mono<UserResponse> getUserById(String id) {
        return findUser(id).map(UserService::toResponse);
    }

    public Mono<UserResponse> getUserByUsername(String username) {
        return userRepository.findByUsername(username)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", "username", username)))
                .map(UserService::toResponse);
    }

    public Mono<UserResponse> createUser(UserRequest request) {
        return checkEmailAvailable(request.getEmail())
                .then(Mono.defer(() -> checkUsernameAvailable(request.getUsername())))
                .then(Mono.defer(() -> requireLanguage(request.getNativeLanguageId())))
                .then(Mono.defer(() -> request.getCurrentLanguageId().equals(request.getNativeLanguageId())
                        ? Mono.<Void>empty()
                        : requireLanguage(request.getCurrentLanguageId())))
                .then(Mono.defer(() -> {
                    User user = User.builder()
                            .id(idService.nextId())
                            .email(request.getEmail())
                            .username(request.getUsername())
                            .passwordHash(passwordEncoder.encode(request.getPassword()))
                            .firstName(request.getFirstName())
                            .lastName(request.getLastName())
                            .nativeLanguageId(request.getNativeLanguageId())
                            .currentLanguageId(request.getCurrentLanguageId())
                            .build();
                    return userRepository.create(user);
                }))
                .doOnSuccess(u -> log.info("User created: {} ({})", u.getId(), u.getUsername()))
                .map(UserService::toResponse);
    }

    public Mono<UserResponse> updateUser(String id, UserUpdateRequest request) {
        return findUser(id)
                .flatMap(existing -> {
                    Mono<Void> checks = Mono.empty();
                    if (request.getEmail() != null && !request.getEmail().equals(existing.getEmail())) {
                        checks = checks.then(checkEmailAvailable(request.getEmail()));
                    }
                    if (request.getUsername() != null && !request.getUsername().equals(existing.getUsername())) {
                        checks = checks.then(Mono.defer(() -> checkUsernameAvailable(request.getUsername())));
                    }
                    if (request.getNativeLanguageId() != null
                            && !request.getNativeLanguageId().equals(existing.getNativeLanguageId())) {
                        checks = checks.then(Mono.defer(() -> requireLanguage(request.getNativeLanguageId())));
                    }
                    if (request.getCurrentLanguageId() != null
                            && !request.getCurrentLanguageId().equals(existing.getCurrentLanguageId())) {
                        checks = checks.then(Mono.defer(() -> requireLanguage(request.getCurrentLanguageId())));
                    }
                    User merged = existing.toBuilder()
                            .email(valueOr(request.getEmail(), existing.getEmail()))
                            .username(valueOr(request.getUsername(), existing.getUsername()))
                            .firstName(valueOr(request.getFirstName(), existing.getFirstName()))
                            .lastName(valueOr(request.getLastName(), existing.getLastName()))
                            .nativeLanguageId(valueOr(request.getNativeLanguageId(), existing.getNativeLanguageId()))
                            .currentLanguageId(valueOr(request.getCurrentLanguageId(), existing.getCurrentLanguageId()))
                            .build();
                    return checks.then(Mono.defer(() -> userRepository.update(id, merged)));
                })
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", "id", id)))
                .doOnSuccess(u -> log.info("User updated: {}", id))
                .map(UserService::toResponse);
    }

    public Mono<Void> deleteUser(String id) {
        return userRepository.delete(id)
                .flatMap(deleted -> {
                    if (!deleted) {
                        return Mono.error(new ResourceNotFoundException("User", "id", id));
                    }
                    log.info("User deleted: {}", id);
                    return Mono.empty();
                });
    }

    /**
     * Stamps the user's last activity with the current time.
     */
    public Mono<UserResponse> recordActivity(String id) {
        return userRepository.updateLastActive(id)
                .flatMap(updated -> updated
                        ? findUser(id)
                        : Mono.error(new ResourceNotFoundException("User", "id", id)))
                .map(UserService::toResponse);
    }

    public Flux<UserLanguageResponse> getUserLanguages(String userId) {
        return findUser(userId)
                .flatMapMany(user -> userLanguageRepository.findByUser(userId))
                .map(UserService::toResponse);
    }

    public Mono<UserLanguageResponse> saveUserLanguage(String userId, String languageId, UserLanguageRequest request) {
        return findUser(userId)
                .then(Mono.defer(() -> requireLanguage(languageId)))
                .then(Mono.defer(() -> {
                    UserLanguage userLanguage = UserLanguage.builder()
                            .userId(userId)
                            .languageId(languageId)
                            .proficiencyLevel(request.getProficiencyLevel())
                            .startedAt(request.getStartedAt())
                            .build();
                    return userLanguageRepository.save(userLanguage);
                }))
                .doOnSuccess(ul -> log.info("User {} studies language {} at {}",
                        userId, languageId, ul.getProficiencyLevel()))
                .map(UserService::toResponse);
    }

    public Mono<Void> removeUserLanguage(String userId, String languageId) {
        return userLanguageRepository.delete(userId, languageId)
                .flatMap(deleted -> {
                    if (!deleted) {
                        return Mono.error(new ResourceNotFoundException(
                                "UserLanguage", "userId/languageId", userId + "/" + languageId));
                    }
                    log.info("User {} no longer studies language {}", userId, languageId);
                    return Mono.empty();
                });
    }

    private Mono<User> findUser(String id) {
        return userRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", "id", id)));
    }

    private Mono<Void> requireLanguage(String languageId) {
        return languageRepository.exists(languageId)
                .flatMap(exists -> exists
                        ? Mono.<Void>empty()
                        : Mono.error(new ResourceNotFoundException("Language", "id", languageId)));
    }

    private Mono<Void> checkEmailAvailable(String email) {
        return userRepository.existsByEmail(email)
                .flatMap(exists -> exists
                        ? Mono.error(new DuplicateResourceException("User", "email", email))
                        : Mono.empty());
    }

    private Mono<Void> checkUsernameAvailable(String username) {
        return userRepository.existsByUsername(username)
                .flatMap(exists -> exists
                        ? Mono.error(new DuplicateResourceException("User", "username", username))
                        : Mono.empty());
    }

    private static <T> T valueOr(T value, T fallback) {
        return value != null ? value : fallback;
    }

    static UserResponse toResponse(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .nativeLanguageId(user.getNativeLanguageId())
                .currentLanguageId(user.getCurrentLanguageId())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .lastActiveAt(user.getLastActiveAt())
                .build();
    }

    static UserLanguageResponse toResponse(UserLanguage userLanguage) {
        return UserLanguageResponse.builder()
                .userId(userLanguage.getUserId())
                .languageId(userLanguage.getLanguageId())
                .proficiencyLevel(userLanguage.getProficiencyLevel())
                .startedAt(userLanguage.getStartedAt())
                .createdAt(userLanguage.getCreatedAt())
                .updatedAt(userLanguage.getUpdatedAt())
                .build();
    }
}
