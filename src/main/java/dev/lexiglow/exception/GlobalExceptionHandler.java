package dev.lexiglow.exception;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final MessageSource messageSource;

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Mono<ErrorResponse> handleResourceNotFound(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Resource not found: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.NOT_FOUND, msg(exchange, "error.not_found"), ex.getMessage(), exchange));
    }

    @ExceptionHandler(ConflictException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleConflict(ConflictException ex, ServerWebExchange exchange) {
        log.warn("Conflict on {} {}: {}", ex.getOperation(), ex.getEntityType(), ex.getMessage());
        String message = ex instanceof DuplicateResourceException
                ? ex.getMessage()
                : msg(exchange, ex.getReason() == ConflictException.Reason.DUPLICATE
                        ? "error.duplicate_value" : "error.integrity_violation");
        return Mono.just(build(HttpStatus.CONFLICT, msg(exchange, "error.conflict"), message, exchange));
    }

    @ExceptionHandler(RepositoryTimeoutException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Mono<ErrorResponse> handleTimeout(RepositoryTimeoutException ex, ServerWebExchange exchange) {
        log.error("Storage timeout: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.SERVICE_UNAVAILABLE,
                msg(exchange, "error.service_unavailable"), msg(exchange, "error.storage_timeout"), exchange));
    }

    @ExceptionHandler(PersistenceException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handlePersistence(PersistenceException ex, ServerWebExchange exchange) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        // storage details stay in the log
        return Mono.just(build(HttpStatus.INTERNAL_SERVER_ERROR,
                msg(exchange, "error.internal_server_error"), msg(exchange, "error.storage_failure"), exchange));
    }

    @ExceptionHandler(OperationNotSupportedException.class)
    @ResponseStatus(HttpStatus.NOT_IMPLEMENTED)
    public Mono<ErrorResponse> handleNotSupported(OperationNotSupportedException ex, ServerWebExchange exchange) {
        log.warn("Operation not supported: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.NOT_IMPLEMENTED, msg(exchange, "error.not_implemented"), ex.getMessage(), exchange));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toUnmodifiableMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null
                                ? fieldError.getDefaultMessage() : msg(exchange, "error.invalid_value"),
                        (existing, ignored) -> existing
                ));
        log.warn("Validation failed: {}", errors);
        ErrorResponse response = build(HttpStatus.BAD_REQUEST,
                msg(exchange, "error.validation_failed"), msg(exchange, "error.invalid_request_data"), exchange);
        response.setValidationErrors(errors);
        return Mono.just(response);
    }

    @ExceptionHandler(jakarta.validation.ConstraintViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleConstraintViolation(
            jakarta.validation.ConstraintViolationException ex, ServerWebExchange exchange) {
        Map<String, String> errors = new HashMap<>();
        ex.getConstraintViolations().forEach(violation -> {
            String path = violation.getPropertyPath().toString();
            String field = path.contains(".") ? path.substring(path.lastIndexOf('.') + 1) : path;
            errors.put(field, violation.getMessage());
        });
        log.warn("Constraint violations: {}", errors);
        ErrorResponse response = build(HttpStatus.BAD_REQUEST,
                msg(exchange, "error.validation_failed"), msg(exchange, "error.invalid_request_params"), exchange);
        response.setValidationErrors(errors);
        return Mono.just(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, ServerWebExchange exchange) {
        log.warn("Invalid argument: {}", ex.getMessage());
        String message = ex.getMessage() != null ? ex.getMessage() : msg(exchange, "error.invalid_request");
        return Mono.just(build(HttpStatus.BAD_REQUEST, msg(exchange, "error.bad_request"), message, exchange));
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleServerWebInputException(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Bad request input: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.BAD_REQUEST, msg(exchange, "error.bad_request"),
                ex.getReason() != null ? ex.getReason() : msg(exchange, "error.invalid_request"), exchange));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatusException(
            ResponseStatusException ex, ServerWebExchange exchange) {
        log.warn("Response status exception: {} - {}", ex.getStatusCode(), ex.getReason());
        HttpStatusCode statusCode = ex.getStatusCode();
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        if (status == null) status = HttpStatus.INTERNAL_SERVER_ERROR;
        String errorKey = statusToKey(status);
        String message = ex.getReason() != null ? ex.getReason() : msg(exchange, errorKey);
        return Mono.just(ResponseEntity.status(status)
                .body(build(status, msg(exchange, errorKey), message, exchange)));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error: ", ex);
        return Mono.just(build(HttpStatus.INTERNAL_SERVER_ERROR,
                msg(exchange, "error.internal_server_error"), msg(exchange, "error.unexpected_error"), exchange));
    }

    private ErrorResponse build(HttpStatus status, String error, String message, ServerWebExchange exchange) {
        return ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().value())
                .build();
    }

    private String msg(ServerWebExchange exchange, String code) {
        Locale locale = exchange.getLocaleContext().getLocale();
        return messageSource.getMessage(code, null, code, locale != null ? locale : Locale.ENGLISH);
    }

    private String statusToKey(HttpStatus status) {
        return switch (status) {
            case NOT_FOUND -> "error.not_found";
            case CONFLICT -> "error.conflict";
            case BAD_REQUEST -> "error.bad_request";
            case NOT_IMPLEMENTED -> "error.not_implemented";
            case SERVICE_UNAVAILABLE -> "error.service_unavailable";
            default -> "error.internal_server_error";
        };
    }
}
