package com.myinfra.gateway.authgateway.model;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of an inbound request as seen by the credential resolver.
 *
 * @param queryParams Query parameters, all values in request order
 * @param headers     Headers keyed by lower-cased name, first value only
 * @param clientIp    Resolved client IP address, or null if it could not be resolved
 */
public record RequestContext(
        Map<String, List<String>> queryParams,
        Map<String, String> headers,
        String clientIp) {

    public RequestContext {
        queryParams = queryParams == null ? Map.of() : Map.copyOf(queryParams);
        headers = headers == null ? Map.of() : lowerCaseKeys(headers);
    }

    /**
     * Returns the first value of a query parameter.
     *
     * @param name Parameter name (case-sensitive)
     * @return The first value, or empty if absent
     */
    public Optional<String> queryParam(String name) {
        List<String> values = queryParams.get(name);
        if (values == null || values.isEmpty()) return Optional.empty();
        return Optional.ofNullable(values.get(0));
    }

    /**
     * Returns a header value.
     *
     * @param name Header name (case-insensitive)
     * @return The header value, or empty if absent
     */
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name.toLowerCase(Locale.ROOT)));
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> source) {
        Map<String, String> copy = new HashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.putIfAbsent(key.toLowerCase(Locale.ROOT), value);
            }
        });
        return Map.copyOf(copy);
    }
}
