package com.myinfra.gateway.authgateway.store;

import com.myinfra.gateway.authgateway.model.ApiKeyRecord;
import reactor.core.publisher.Mono;

/**
 * Source of API key records.
 */
public interface KeyStore {

    /**
     * Looks up an API key by its raw value.
     *
     * @param rawKey The key as presented by the caller
     * @return The record, an empty Mono if no such key exists, or an error if the store failed
     */
    Mono<ApiKeyRecord> lookup(String rawKey);
}
