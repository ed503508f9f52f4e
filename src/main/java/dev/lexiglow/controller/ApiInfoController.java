package dev.lexiglow.controller;

import dev.lexiglow.repository.RepositoryFactory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringBootVersion;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service information and a lightweight health check.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "API Info", description = "Service information and version")
@Slf4j
public class ApiInfoController {

    private static final Duration PING_TIMEOUT = Duration.ofSeconds(3);

    private final RepositoryFactory repositoryFactory;
    private final String appName;
    private final String appVersion;

    public ApiInfoController(RepositoryFactory repositoryFactory,
                             @Value("${app.name:LexiGlow Backend}") String appName,
                             @Value("${app.version:1.0.0}") String appVersion) {
        this.repositoryFactory = repositoryFactory;
        this.appName = appName;
        this.appVersion = appVersion;
    }

    @GetMapping
    @Operation(summary = "API root", description = "Available versions and entry points")
    public Mono<Map<String, Object>> getApiInfo() {
        return Mono.just(Map.of(
                "name", appName,
                "versions", Map.of("v1", "/api/v1", "latest", "/api/v1"),
                "documentation", "/swagger-ui.html",
                "health", "/api/health"));
    }

    @GetMapping("/about")
    @Operation(summary = "About the service")
    public Mono<Map<String, Object>> getAbout() {
        log.debug("About endpoint accessed");
        Map<String, Object> about = new LinkedHashMap<>();
        about.put("service", appName);
        about.put("version", appVersion);
        about.put("description", "REST API backend for LexiGlow application");
        about.put("database", repositoryFactory.backendType().label());
        about.put("apiDocumentation", "/swagger-ui.html");
        about.put("healthCheck", "/api/health");
        about.put("status", "operational");
        return Mono.just(about);
    }

    @GetMapping("/about/version")
    @Operation(summary = "Version details")
    public Mono<Map<String, Object>> getVersion() {
        return Mono.just(Map.of(
                "version", appVersion,
                "javaVersion", System.getProperty("java.version"),
                "springBootVersion", String.valueOf(SpringBootVersion.getVersion())));
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Reports DOWN with 503 when the store does not answer")
    public Mono<ResponseEntity<Map<String, Object>>> healthCheck() {
        return repositoryFactory.ping()
                .timeout(PING_TIMEOUT)
                .then(Mono.fromCallable(() -> ResponseEntity.ok(health("UP"))))
                .onErrorResume(e -> {
                    log.warn("Health check failed: {}", e.toString());
                    return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health("DOWN")));
                });
    }

    private Map<String, Object> health(String status) {
        return Map.of(
                "status", status,
                "database", repositoryFactory.backendType().label(),
                "timestamp", LocalDateTime.now().toString(),
                "version", appVersion);
    }
}
