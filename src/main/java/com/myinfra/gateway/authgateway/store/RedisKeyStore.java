package com.myinfra.gateway.authgateway.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myinfra.gateway.authgateway.model.ApiKeyRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * {@link KeyStore} backed by Redis. Each key is stored as a JSON {@link ApiKeyRecord}
 * under {@code api-key:<raw key>}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisKeyStore implements KeyStore {

    static final String KEY_PREFIX = "api-key:";

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<ApiKeyRecord> lookup(String rawKey) {
        return redisTemplate.opsForValue().get(KEY_PREFIX + rawKey)
                .flatMap(json -> Mono.fromCallable(() -> objectMapper.readValue(json, ApiKeyRecord.class)))
                .doOnError(e -> log.error("API key lookup failed: {}", e.getMessage()));
    }
}
