package com.myinfra.gateway.authgateway.search;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Narrow boundary to the search engine.
 */
public interface IndexBackend {

    /**
     * Indexes a single document.
     *
     * @param index  Target index
     * @param record Document body
     * @return Mono completing when the backend acknowledged the write
     */
    Mono<Void> index(String index, Map<String, Object> record);

    /**
     * Runs a search request.
     *
     * @param index Index to search
     * @param query Search request body
     * @return The raw backend response
     */
    Mono<JsonNode> search(String index, Map<String, Object> query);

    /**
     * Deletes every document matching a query.
     *
     * @param index Index to delete from
     * @param query Delete-by-query request body
     * @return Number of deleted documents
     */
    Mono<Long> deleteByQuery(String index, Map<String, Object> query);
}
