package com.myinfra.gateway.authgateway.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Writes an {@link ErrorResponse} as the JSON body of a gateway-generated response.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ErrorResponseWriter {

    private final ObjectMapper objectMapper;

    /**
     * Sets the status and content type from the body and writes it.
     *
     * @param response The response to complete
     * @param body     Error payload; its status becomes the response status
     * @return Mono completing when the body has been written
     */
    public Mono<Void> write(ServerHttpResponse response, ErrorResponse body) {
        HttpStatus status = HttpStatus.valueOf(body.getStatus());
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize ErrorResponse to JSON", e);
            bytes = String.format("{\"status\":%d,\"error\":\"%s\"}", status.value(), status.getReasonPhrase())
                    .getBytes(StandardCharsets.UTF_8);
        }

        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }
}
