package dev.lexiglow.exception;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.context.support.StaticMessageSource;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;
    private MockServerWebExchange exchange;

    @BeforeEach
    void setUp() {
        StaticMessageSource messageSource = new StaticMessageSource();
        messageSource.addMessage("error.not_found", Locale.ENGLISH, "Not Found");
        messageSource.addMessage("error.conflict", Locale.ENGLISH, "Conflict");
        messageSource.addMessage("error.duplicate_value", Locale.ENGLISH, "Duplicate value");
        messageSource.addMessage("error.integrity_violation", Locale.ENGLISH, "Integrity violation");
        messageSource.addMessage("error.storage_failure", Locale.ENGLISH, "Storage failure");
        handler = new GlobalExceptionHandler(messageSource);
        exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/languages/01HX").build());
    }

    @Nested
    @DisplayName("not found")
    class NotFound {

        @Test
        @DisplayName("should return 404 with message and path")
        void shouldReturn404() {
            ResourceNotFoundException ex = new ResourceNotFoundException("Language", "id", "01HX");

            StepVerifier.create(handler.handleResourceNotFound(ex, exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo(404);
                        assertThat(response.getError()).isEqualTo("Not Found");
                        assertThat(response.getMessage()).isEqualTo("Language not found with id: '01HX'");
                        assertThat(response.getPath()).isEqualTo("/api/v1/languages/01HX");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("conflicts")
    class Conflicts {

        @Test
        @DisplayName("should keep the message of a duplicate found before writing")
        void shouldReportDuplicateResource() {
            DuplicateResourceException ex = new DuplicateResourceException("Language", "code", "es");

            StepVerifier.create(handler.handleConflict(ex, exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo(409);
                        assertThat(response.getMessage()).isEqualTo("Language already exists with code: 'es'");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should hide storage detail for constraint violations")
        void shouldReportConstraintViolation() {
            ConflictException duplicate = new ConflictException(ConflictException.Reason.DUPLICATE,
                    "create", "User", "01HX", new IllegalStateException("uq_users_email"));
            ConflictException integrity = new ConflictException(ConflictException.Reason.INTEGRITY,
                    "delete", "Language", "01HX", null);

            StepVerifier.create(handler.handleConflict(duplicate, exchange))
                    .assertNext(response -> assertThat(response.getMessage()).isEqualTo("Duplicate value"))
                    .verifyComplete();
            StepVerifier.create(handler.handleConflict(integrity, exchange))
                    .assertNext(response -> assertThat(response.getMessage()).isEqualTo("Integrity violation"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("storage failures")
    class StorageFailures {

        @Test
        @DisplayName("should return 500 without the driver message")
        void shouldHideDriverMessage() {
            PersistenceException ex = new PersistenceException("findAll", "Text", null,
                    new IllegalStateException("connection refused to db-host:5432"));

            StepVerifier.create(handler.handlePersistence(ex, exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo(500);
                        assertThat(response.getMessage()).isEqualTo("Storage failure");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return 503 for timeouts")
        void shouldReturn503ForTimeout() {
            RepositoryTimeoutException ex = new RepositoryTimeoutException("findById", "Text", "01HX", null);

            StepVerifier.create(handler.handleTimeout(ex, exchange))
                    .assertNext(response -> assertThat(response.getStatus()).isEqualTo(503))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return 501 for operations a backend lacks")
        void shouldReturn501() {
            OperationNotSupportedException ex = new OperationNotSupportedException("Document backend has no Foo");

            StepVerifier.create(handler.handleNotSupported(ex, exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo(501);
                        assertThat(response.getMessage()).isEqualTo("Document backend has no Foo");
                    })
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("should map response status exceptions to their status")
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND, "No route");

        StepVerifier.create(handler.handleResponseStatusException(ex, exchange))
                .assertNext(entity -> {
                    assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(entity.getBody().getMessage()).isEqualTo("No route");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should fall back to the message key when no text is configured")
    void shouldFallBackToKey() {
        StepVerifier.create(handler.handleGenericException(new RuntimeException("boom"), exchange))
                .assertNext(response -> {
                    assertThat(response.getStatus()).isEqualTo(500);
                    assertThat(response.getMessage()).isEqualTo("error.unexpected_error");
                })
                .verifyComplete();
    }
}
