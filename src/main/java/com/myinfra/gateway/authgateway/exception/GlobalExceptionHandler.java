package com.myinfra.gateway.authgateway.exception;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Answers errors raised while routing a request to the backend with a JSON {@link ErrorResponse}.
 * Authentication failures never get here; the gateway filter answers those itself.
 */
@Slf4j
@Component
@Order(-2) // ahead of Spring Boot's DefaultErrorWebExceptionHandler (-1)
@RequiredArgsConstructor
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

    private static final int MAX_CAUSE_DEPTH = 10;

    private final ErrorResponseWriter errorResponseWriter;

    @Override
    @NonNull
    public Mono<Void> handle(@NonNull ServerWebExchange exchange, @NonNull Throwable ex) {
        String path = exchange.getRequest().getURI().getPath();

        if (exchange.getResponse().isCommitted()) {
            log.warn("Response for {} already committed, cannot report: {}", path, ex.getMessage());
            return Mono.error(ex);
        }

        RouteError error = RouteError.classify(ex);
        HttpStatus status = error.status();

        if (status == HttpStatus.INTERNAL_SERVER_ERROR) {
            log.error("Routing {} failed: {}", path, ex.getMessage(), ex);
        } else {
            log.warn("Routing {} failed with {}: {}", path, status.value(), ex.getMessage());
        }

        return errorResponseWriter.write(exchange.getResponse(),
                ErrorResponse.of(status.value(), status.getReasonPhrase(), error.message(), path));
    }

    /**
     * Client-facing status and message for a routing error. Backend details never reach the caller.
     */
    record RouteError(HttpStatus status, String message) {

        static final String TIMEOUT = "The backend did not respond in time. Please retry.";
        static final String UNREACHABLE = "The backend is currently unavailable.";
        static final String UNEXPECTED = "An unexpected error occurred.";

        static RouteError classify(Throwable ex) {
            Throwable cause = ex;
            for (int depth = 0; cause != null && depth < MAX_CAUSE_DEPTH; depth++) {
                if (cause instanceof ResponseStatusException rse) {
                    return fromStatus(rse);
                }
                if (cause instanceof TimeoutException) {
                    return new RouteError(HttpStatus.GATEWAY_TIMEOUT, TIMEOUT);
                }
                if (cause instanceof ConnectException || cause instanceof UnknownHostException) {
                    return new RouteError(HttpStatus.BAD_GATEWAY, UNREACHABLE);
                }
                cause = cause.getCause();
            }
            return new RouteError(HttpStatus.INTERNAL_SERVER_ERROR, UNEXPECTED);
        }

        private static RouteError fromStatus(ResponseStatusException rse) {
            HttpStatus status = HttpStatus.resolve(rse.getStatusCode().value());
            if (status == null) status = HttpStatus.INTERNAL_SERVER_ERROR;

            if (status.is4xxClientError()) {
                String reason = rse.getReason();
                return new RouteError(status, reason != null && !reason.isBlank() ? reason : status.getReasonPhrase());
            }
            if (status == HttpStatus.GATEWAY_TIMEOUT) return new RouteError(status, TIMEOUT);
            if (status == HttpStatus.BAD_GATEWAY || status == HttpStatus.SERVICE_UNAVAILABLE) {
                return new RouteError(status, UNREACHABLE);
            }
            return new RouteError(status, UNEXPECTED);
        }
    }
}
