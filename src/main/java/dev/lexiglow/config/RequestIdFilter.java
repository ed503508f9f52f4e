package dev.lexiglow.config;

import dev.lexiglow.util.UlidGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.regex.Pattern;

/**
 * Tags every request with an id, echoed in the response headers and put in the Reactor
 * context. An upstream {@code X-Request-ID} is reused when it is well formed.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
@Slf4j
public class RequestIdFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String REQUEST_ID_CONTEXT_KEY = "requestId";

    private static final int MAX_ID_LENGTH = 64;
    private static final Pattern VALID_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    private final UlidGenerator ulidGenerator;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String externalRequestId = exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER);
        String requestId = sanitizeId(externalRequestId);
        if (requestId == null) {
            if (externalRequestId != null && !externalRequestId.isBlank()) {
                log.warn("Rejected external request ID");
            }
            requestId = ulidGenerator.nextId();
        }
        String correlationId = sanitizeId(exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER));
        if (correlationId == null) {
            correlationId = requestId;
        }

        ServerHttpRequest mutatedRequest = exchange.getRequest().mutate()
                .header(REQUEST_ID_HEADER, requestId)
                .header(CORRELATION_ID_HEADER, correlationId)
                .build();
        ServerWebExchange mutatedExchange = exchange.mutate()
                .request(mutatedRequest)
                .build();
        mutatedExchange.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);
        mutatedExchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        return chain.filter(mutatedExchange)
                .contextWrite(Context.of(
                        REQUEST_ID_CONTEXT_KEY, requestId,
                        "correlationId", correlationId));
    }

    private String sanitizeId(String value) {
        if (value == null || value.isBlank()) return null;
        if (value.length() > MAX_ID_LENGTH) return null;
        if (!VALID_ID_PATTERN.matcher(value).matches()) return null;
        return value;
    }
}
