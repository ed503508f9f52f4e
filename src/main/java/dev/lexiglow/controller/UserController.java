package dev.lexiglow.controller;

import dev.lexiglow.dto.UserLanguageRequest;
import dev.lexiglow.dto.UserLanguageResponse;
import dev.lexiglow.dto.UserRequest;
import dev.lexiglow.dto.UserResponse;
import dev.lexiglow.dto.UserUpdateRequest;
import dev.lexiglow.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * User accounts and their studied languages. Password hashes never leave the service layer.
 */
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
@Validated
@Tag(name = "Users", description = "User accounts and studied languages")
@Slf4j
public class UserController {

    private final UserService userService;

    @GetMapping
    @Operation(summary = "List users")
    public Mono<List<UserResponse>> getAllUsers(
            @RequestParam(defaultValue = "0") @Min(0) long skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        log.debug("Fetching users skip={} limit={}", skip, limit);
        return userService.getAllUsers(skip, limit).collectList();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get user by id")
    public Mono<UserResponse> getUserById(@PathVariable String id) {
        log.debug("Fetching user by id={}", id);
        return userService.getUserById(id);
    }

    @GetMapping("/username/{username}")
    @Operation(summary = "Get user by username")
    public Mono<UserResponse> getUserByUsername(@PathVariable String username) {
        log.debug("Fetching user by username={}", username);
        return userService.getUserByUsername(username);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Register user")
    public Mono<UserResponse> createUser(@Valid @RequestBody UserRequest request) {
        log.info("Creating user: username={}", request.getUsername());
        return userService.createUser(request);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update user profile", description = "Password is not changed through this endpoint")
    public Mono<UserResponse> updateUser(@PathVariable String id, @Valid @RequestBody UserUpdateRequest request) {
        log.info("Updating user: id={}", id);
        return userService.updateUser(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete user", description = "Removes studied languages and vocabularies; texts are kept without owner")
    public Mono<Void> deleteUser(@PathVariable String id) {
        log.info("Deleting user: id={}", id);
        return userService.deleteUser(id);
    }

    @PostMapping("/{id}/activity")
    @Operation(summary = "Record user activity", description = "Sets lastActiveAt to the current time")
    public Mono<UserResponse> recordActivity(@PathVariable String id) {
        log.debug("Recording activity for user={}", id);
        return userService.recordActivity(id);
    }

    @GetMapping("/{id}/languages")
    @Operation(summary = "List languages studied by the user")
    public Mono<List<UserLanguageResponse>> getUserLanguages(@PathVariable String id) {
        log.debug("Fetching languages of user={}", id);
        return userService.getUserLanguages(id).collectList();
    }

    @PutMapping("/{id}/languages/{languageId}")
    @Operation(summary = "Start or update studying a language")
    public Mono<UserLanguageResponse> saveUserLanguage(@PathVariable String id,
                                                       @PathVariable String languageId,
                                                       @Valid @RequestBody UserLanguageRequest request) {
        log.info("Saving language {} for user {}", languageId, id);
        return userService.saveUserLanguage(id, languageId, request);
    }

    @DeleteMapping("/{id}/languages/{languageId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Stop studying a language")
    public Mono<Void> removeUserLanguage(@PathVariable String id, @PathVariable String languageId) {
        log.info("Removing language {} from user {}", languageId, id);
        return userService.removeUserLanguage(id, languageId);
    }
}
